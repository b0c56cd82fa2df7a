package io.github.hotbrkm.mailqueue.agent.transport;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;

/**
 * Final hand-off of a composed MIME message to the mail system.
 */
@FunctionalInterface
public interface MessageSubmitter {

    void submit(MimeMessage message) throws MessagingException;
}
