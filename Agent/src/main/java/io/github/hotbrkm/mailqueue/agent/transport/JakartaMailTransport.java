package io.github.hotbrkm.mailqueue.agent.transport;

import io.github.hotbrkm.mailqueue.core.message.Transport;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;

/**
 * {@link Transport} that composes a Jakarta Mail {@link MimeMessage} and submits it.
 * <p>
 * The recipient line becomes the To field. Each line of the header block is mapped onto the
 * message: From, Reply-To, Cc and Bcc as addresses, anything else as a raw header.
 * Addresses that do not parse into {@code local@domain} mailboxes, and submission failures,
 * are logged and reported as {@code false}.
 * </p>
 */
@Slf4j
public class JakartaMailTransport implements Transport {

    private static final String CRLF = "\r\n";

    private final Session session;
    private final MessageSubmitter submitter;

    public JakartaMailTransport(Session session) {
        this(session, jakarta.mail.Transport::send);
    }

    public JakartaMailTransport(Session session, MessageSubmitter submitter) {
        if (session == null) {
            throw new IllegalArgumentException("session must not be null");
        }
        if (submitter == null) {
            throw new IllegalArgumentException("submitter must not be null");
        }
        this.session = session;
        this.submitter = submitter;
    }

    @Override
    public boolean send(String recipientLine, String subject, String body, String headerBlock) {
        try {
            MimeMessage message = compose(recipientLine, subject, body, headerBlock);
            submitter.submit(message);
            log.debug("Message submitted. to={}, subject={}", recipientLine, subject);
            return true;
        } catch (MessagingException e) {
            log.warn("Message submission failed. to={}, subject={}, message={}", recipientLine, subject, e.getMessage());
            return false;
        }
    }

    MimeMessage compose(String recipientLine, String subject, String body, String headerBlock) throws MessagingException {
        MimeMessage message = new MimeMessage(session);
        message.setRecipients(Message.RecipientType.TO, parseAddresses(recipientLine == null ? "" : recipientLine));
        if (subject != null) {
            message.setSubject(subject);
        }
        message.setText(body == null ? "" : body);
        applyHeaderBlock(message, headerBlock);
        return message;
    }

    private void applyHeaderBlock(MimeMessage message, String headerBlock) throws MessagingException {
        if (headerBlock == null || headerBlock.isEmpty()) {
            return;
        }

        for (String line : headerBlock.split(CRLF)) {
            int colon = line.indexOf(':');
            if (colon <= 0) {
                log.debug("Skipping malformed header line. line={}", line);
                continue;
            }
            String name = line.substring(0, colon).trim();
            String value = line.substring(colon + 1).trim();
            applyHeader(message, name, value);
        }
    }

    private void applyHeader(MimeMessage message, String name, String value) throws MessagingException {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "from" -> message.setFrom(new InternetAddress(value));
            case "reply-to" -> message.setReplyTo(parseAddresses(value));
            case "cc" -> {
                if (!value.isEmpty()) {
                    message.setRecipients(Message.RecipientType.CC, parseAddresses(value));
                }
            }
            case "bcc" -> {
                if (!value.isEmpty()) {
                    message.setRecipients(Message.RecipientType.BCC, parseAddresses(value));
                }
            }
            default -> message.setHeader(name, value);
        }
    }

    /**
     * Parses a comma separated address list and rejects entries without a domain. An unquoted
     * display name containing a comma splits into such an entry.
     */
    static InternetAddress[] parseAddresses(String value) throws AddressException {
        InternetAddress[] addresses = InternetAddress.parse(value);
        for (InternetAddress address : addresses) {
            address.validate();
            String mailbox = address.getAddress();
            if (mailbox == null || mailbox.indexOf('@') <= 0) {
                throw new AddressException("Missing final '@domain'", mailbox);
            }
        }
        return addresses;
    }
}
