package io.github.hotbrkm.mailqueue.core.header;

import lombok.Getter;

/**
 * Discriminant of {@link Header}. Recipient kinds carry a recipient list instead of text content.
 */
@Getter
public enum HeaderKind {
    GENERIC(null, false),
    FROM("From", false),
    REPLY_TO("Reply-To", false),
    CC("Cc", true),
    BCC("Bcc", true);

    /**
     * Fixed header name, null for {@link #GENERIC}.
     */
    private final String typeName;
    private final boolean recipientKind;

    HeaderKind(String typeName, boolean recipientKind) {
        this.typeName = typeName;
        this.recipientKind = recipientKind;
    }
}
