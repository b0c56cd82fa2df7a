package io.github.hotbrkm.mailqueue.agent.message;

import io.github.hotbrkm.mailqueue.core.address.AddressValidator;
import io.github.hotbrkm.mailqueue.core.message.MailMessage;
import io.github.hotbrkm.mailqueue.core.message.Mailer;
import io.github.hotbrkm.mailqueue.core.message.Transport;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Creates messages bound to the configured transport, validator and mailer identity.
 * Each call returns a new, independently owned message.
 */
@Getter
@RequiredArgsConstructor
public class MailMessageFactory {

    private final Transport transport;
    private final AddressValidator addressValidator;
    private final Mailer mailer;

    public MailMessage create() {
        return new MailMessage(transport, addressValidator, mailer);
    }

    public MailMessage create(String subject, String body) {
        MailMessage message = create();
        message.setSubject(subject);
        message.setBody(body);
        return message;
    }
}
