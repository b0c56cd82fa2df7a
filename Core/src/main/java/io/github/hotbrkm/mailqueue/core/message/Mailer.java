package io.github.hotbrkm.mailqueue.core.message;

/**
 * Product identity written to the {@code X-Mailer} header of every new message.
 */
public record Mailer(String product, String version) {

    public static final Mailer DEFAULT = new Mailer("MailQueue", "0.1");

    public Mailer {
        if (product == null || product.isBlank()) {
            throw new IllegalArgumentException("product must not be null or blank");
        }
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version must not be null or blank");
        }
    }
}
