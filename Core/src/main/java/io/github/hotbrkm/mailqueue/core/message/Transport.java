package io.github.hotbrkm.mailqueue.core.message;

/**
 * Hands a rendered message to the mail system for delivery.
 */
@FunctionalInterface
public interface Transport {

    /**
     * @param recipientLine one rendered recipient, or several joined with {@code ", "} in batch mode
     * @param subject       subject line
     * @param body          message body
     * @param headerBlock   CRLF-joined header lines without a trailing CRLF
     * @return true if the mail system accepted the message
     */
    boolean send(String recipientLine, String subject, String body, String headerBlock);
}
