package io.github.hotbrkm.mailqueue.core.header;

import io.github.hotbrkm.mailqueue.core.address.AddressValidator;
import io.github.hotbrkm.mailqueue.core.address.InvalidAddressException;
import io.github.hotbrkm.mailqueue.core.recipient.Recipient;
import io.github.hotbrkm.mailqueue.core.recipient.RecipientList;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.Objects;

/**
 * A single message header.
 * <p>
 * One class covers every header kind. {@link HeaderKind#CC} and {@link HeaderKind#BCC} hold a
 * private {@link RecipientList} and check every recipient against their {@link AddressValidator};
 * all other kinds hold text content. Behavior is selected by {@link #getKind()}.
 * </p>
 */
@Getter
public final class Header {

    private final HeaderKind kind;
    private final String typeName;
    private final String content;
    private final RecipientList recipients;
    @Getter(AccessLevel.NONE)
    private final AddressValidator validator;

    private Header(HeaderKind kind, String typeName, String content, RecipientList recipients, AddressValidator validator) {
        this.kind = kind;
        this.typeName = typeName;
        this.content = content;
        this.recipients = recipients;
        this.validator = validator;
    }

    /**
     * Generic header with a caller supplied name.
     */
    public static Header of(String typeName, String content) {
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("typeName must not be null or blank");
        }
        return new Header(HeaderKind.GENERIC, typeName, content == null ? "" : content, null, null);
    }

    public static Header from(String sender) {
        return from(sender, AddressValidator.syntaxOnly());
    }

    /**
     * @throws InvalidAddressException if {@code validator} rejects {@code sender}
     */
    public static Header from(String sender, AddressValidator validator) {
        if (!validator.validate(sender)) {
            throw new InvalidAddressException(sender);
        }
        return new Header(HeaderKind.FROM, HeaderKind.FROM.getTypeName(), sender, null, null);
    }

    /**
     * Reply-To content is stored as given, without address validation.
     */
    public static Header replyTo(String address) {
        return new Header(HeaderKind.REPLY_TO, HeaderKind.REPLY_TO.getTypeName(), address == null ? "" : address, null, null);
    }

    public static Header cc() {
        return recipientHeader(HeaderKind.CC, null, AddressValidator.syntaxOnly());
    }

    public static Header cc(RecipientList recipients) {
        return cc(recipients, AddressValidator.syntaxOnly());
    }

    /**
     * Cc header holding a copy of {@code recipients}; later changes to the argument are not seen.
     * The header keeps {@code validator} for recipients added later.
     *
     * @throws InvalidAddressException if {@code validator} rejects any of {@code recipients}
     */
    public static Header cc(RecipientList recipients, AddressValidator validator) {
        return recipientHeader(HeaderKind.CC, requireList(recipients), validator);
    }

    public static Header bcc() {
        return recipientHeader(HeaderKind.BCC, null, AddressValidator.syntaxOnly());
    }

    public static Header bcc(RecipientList recipients) {
        return bcc(recipients, AddressValidator.syntaxOnly());
    }

    public static Header bcc(RecipientList recipients, AddressValidator validator) {
        return recipientHeader(HeaderKind.BCC, requireList(recipients), validator);
    }

    private static Header recipientHeader(HeaderKind kind, RecipientList source, AddressValidator validator) {
        Objects.requireNonNull(validator, "validator must not be null");
        Header header = new Header(kind, kind.getTypeName(), null, RecipientList.create(), validator);
        if (source != null) {
            for (Recipient recipient : source) {
                header.addRecipient(recipient);
            }
        }
        return header;
    }

    private static RecipientList requireList(RecipientList recipients) {
        if (recipients == null) {
            throw new IllegalArgumentException("recipients must be a RecipientList, got null");
        }
        return recipients;
    }

    public boolean isRecipientHeader() {
        return kind.isRecipientKind();
    }

    /**
     * @return true if appended, false if the address is already in this header
     * @throws UnsupportedOperationException if this header does not hold recipients
     * @throws InvalidAddressException if this header's validator rejects the address
     */
    public boolean addRecipient(Recipient recipient) {
        return switch (kind) {
            case CC, BCC -> {
                if (recipient == null) {
                    throw new IllegalArgumentException("recipient must not be null");
                }
                if (!validator.validate(recipient.getAddress())) {
                    throw new InvalidAddressException(recipient.getAddress());
                }
                yield recipients.add(recipient);
            }
            default -> throw notRecipientHeader();
        };
    }

    public boolean addRecipient(String address) {
        return addRecipient(null, address);
    }

    public boolean addRecipient(String name, String address) {
        if (!isRecipientHeader()) {
            throw notRecipientHeader();
        }
        return recipients.add(Recipient.of(name, address, validator));
    }

    private UnsupportedOperationException notRecipientHeader() {
        return new UnsupportedOperationException(typeName + " header does not hold recipients");
    }

    /**
     * Renders {@code "Type: value"}, where value is the text content or the joined recipient list.
     */
    public String render() {
        return switch (kind) {
            case CC, BCC -> typeName + ": " + recipients.render();
            case GENERIC, FROM, REPLY_TO -> typeName + ": " + content;
        };
    }

    @Override
    public String toString() {
        return render();
    }
}
