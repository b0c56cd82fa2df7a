package io.github.hotbrkm.mailqueue.core.message;

import io.github.hotbrkm.mailqueue.core.address.AddressValidator;
import io.github.hotbrkm.mailqueue.core.address.InvalidAddressException;
import io.github.hotbrkm.mailqueue.core.header.Header;
import io.github.hotbrkm.mailqueue.core.header.HeaderKind;
import io.github.hotbrkm.mailqueue.core.header.HeaderList;
import io.github.hotbrkm.mailqueue.core.recipient.Recipient;
import io.github.hotbrkm.mailqueue.core.recipient.RecipientList;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An email message with To, Cc and Bcc recipients, a sender, custom headers and
 * batch or serial dispatch through a {@link Transport}.
 * <p>
 * Every new or reset message carries an {@code X-Mailer} header. Instances are not thread-safe;
 * each message owns its recipient list, header list and error list.
 * </p>
 */
@Slf4j
public class MailMessage {

    private static final String UNABLE_TO_SEND = "Unable to send to ";

    private final Transport transport;
    private final AddressValidator validator;
    @Getter
    private final Mailer mailer;

    @Getter
    private String subject;
    @Getter
    private String body;

    @Getter
    private RecipientList to;
    @Getter
    private HeaderList headers;
    private final List<String> errors = new ArrayList<>();

    public MailMessage(Transport transport) {
        this(transport, AddressValidator.syntaxOnly(), Mailer.DEFAULT);
    }

    public MailMessage(Transport transport, AddressValidator validator, Mailer mailer) {
        this.transport = Objects.requireNonNull(transport, "transport must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.mailer = Objects.requireNonNull(mailer, "mailer must not be null");
        reset();
    }

    /**
     * Restores an empty message: no subject, body or recipients, only the {@code X-Mailer} header.
     */
    public void reset() {
        subject = "";
        body = "";
        to = RecipientList.create();
        headers = HeaderList.withMailer(mailer.product(), mailer.version());
        errors.clear();
    }

    /**
     * Sets the subject; null is stored as an empty string.
     */
    public void setSubject(String subject) {
        this.subject = subject == null ? "" : subject;
    }

    /**
     * Sets the body; null is stored as an empty string.
     */
    public void setBody(String body) {
        this.body = body == null ? "" : body;
    }

    /**
     * @return false if a From header is already set
     * @throws InvalidAddressException if {@code address} is not a valid email address
     */
    public boolean setFrom(String address) {
        return headers.add(Header.from(address, validator));
    }

    public Optional<Header> getFrom() {
        return headers.lookup(HeaderKind.FROM.getTypeName());
    }

    /**
     * @return false if a Reply-To header is already set
     */
    public boolean setReplyTo(String address) {
        return headers.add(Header.replyTo(address));
    }

    public Optional<Header> getReplyTo() {
        return headers.lookup(HeaderKind.REPLY_TO.getTypeName());
    }

    /**
     * Replaces the To list. The message takes ownership of {@code recipients}.
     */
    public void setTo(RecipientList recipients) {
        if (recipients == null) {
            throw new IllegalArgumentException("setTo requires a RecipientList, got null");
        }
        this.to = recipients;
    }

    /**
     * Recipients are copied and checked with this message's validator, which the header keeps
     * for recipients added to it later.
     *
     * @return false if a Cc header is already set
     * @throws InvalidAddressException if any recipient is rejected by the validator
     */
    public boolean setCc(RecipientList recipients) {
        if (recipients == null) {
            throw new IllegalArgumentException("setCc requires a RecipientList, got null");
        }
        if (headers.contains(HeaderKind.CC.getTypeName())) {
            return false;
        }
        return headers.add(Header.cc(recipients, validator));
    }

    public Optional<Header> getCc() {
        return headers.lookup(HeaderKind.CC.getTypeName());
    }

    /**
     * Recipients are copied and checked with this message's validator, which the header keeps
     * for recipients added to it later.
     *
     * @return false if a Bcc header is already set
     * @throws InvalidAddressException if any recipient is rejected by the validator
     */
    public boolean setBcc(RecipientList recipients) {
        if (recipients == null) {
            throw new IllegalArgumentException("setBcc requires a RecipientList, got null");
        }
        if (headers.contains(HeaderKind.BCC.getTypeName())) {
            return false;
        }
        return headers.add(Header.bcc(recipients, validator));
    }

    public Optional<Header> getBcc() {
        return headers.lookup(HeaderKind.BCC.getTypeName());
    }

    /**
     * @return false if a header of the same type is already set
     */
    public boolean addHeader(Header header) {
        return headers.add(header);
    }

    public boolean addRecipient(String address) {
        return tryAddRecipient(null, address).isAdded();
    }

    /**
     * @return true if added, false if the address is invalid or already a To recipient
     */
    public boolean addRecipient(String name, String address) {
        return tryAddRecipient(name, address).isAdded();
    }

    public boolean addRecipient(Recipient recipient) {
        return to.add(recipient);
    }

    public AddOutcome tryAddRecipient(String name, String address) {
        Recipient recipient;
        try {
            recipient = Recipient.of(name, address, validator);
        } catch (InvalidAddressException e) {
            log.warn("Rejected To recipient. {}", e.getMessage());
            return AddOutcome.INVALID_ADDRESS;
        }
        return to.add(recipient) ? AddOutcome.ADDED : AddOutcome.DUPLICATE;
    }

    /**
     * Errors recorded by the last {@link #send(boolean)} call.
     */
    public List<String> getErrors() {
        return List.copyOf(errors);
    }

    public int send() {
        return send(false);
    }

    public int batchSend() {
        return send(true);
    }

    /**
     * Sends the message to its To recipients.
     * <p>
     * In batch mode all recipients go out in a single transport call and the result is 0 or 1.
     * In serial mode each recipient gets its own call, in list order; a failed call is recorded
     * and the remaining recipients are still attempted.
     * </p>
     *
     * @param batch true for one combined transport call, false for one call per recipient
     * @return number of failed transport calls
     */
    public int send(boolean batch) {
        errors.clear();
        String headerBlock = headers.render();

        if (batch) {
            return sendBatch(headerBlock);
        }

        for (Recipient recipient : to) {
            if (!deliver(recipient.toString(), headerBlock)) {
                errors.add(UNABLE_TO_SEND + recipient);
            }
        }

        if (!errors.isEmpty()) {
            log.warn("Serial send finished with failures. subject={}, recipients={}, failures={}",
                    subject, to.size(), errors.size());
        }
        return errors.size();
    }

    private int sendBatch(String headerBlock) {
        if (to.isEmpty()) {
            log.warn("Batch send skipped, no To recipients. subject={}", subject);
            return 0;
        }

        String recipientLine = to.render();
        if (deliver(recipientLine, headerBlock)) {
            return 0;
        }
        errors.add(UNABLE_TO_SEND + recipientLine);
        return 1;
    }

    private boolean deliver(String recipientLine, String headerBlock) {
        try {
            boolean accepted = transport.send(recipientLine, subject, body, headerBlock);
            if (accepted) {
                log.debug("Transport accepted message. to={}, subject={}", recipientLine, subject);
            } else {
                log.warn("Transport rejected message. to={}, subject={}", recipientLine, subject);
            }
            return accepted;
        } catch (RuntimeException e) {
            log.warn("Transport failed. to={}, subject={}", recipientLine, subject, e);
            return false;
        }
    }

    /**
     * Renders From, To, Cc and Bcc lines followed by the body and a blank line.
     * Other headers, including {@code X-Mailer}, are not part of this rendering.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        getFrom().ifPresent(from -> sb.append(from.render()).append('\n'));
        sb.append("To: ").append(to.render()).append('\n');
        getCc().ifPresent(cc -> sb.append(cc.render()).append('\n'));
        getBcc().ifPresent(bcc -> sb.append(bcc.render()).append('\n'));
        sb.append(body);
        sb.append("\n\n");
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
