package io.github.hotbrkm.mailqueue.agent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties loaded from the {@code mailqueue} prefix.
 *
 * <pre>
 * mailqueue:
 *   enabled: true
 *   mailer:
 *     product: MailQueue
 *     version: 0.1
 *   validation:
 *     dns-check-enabled: false
 *     dns-servers: [8.8.8.8]
 *   smtp:
 *     host: smtp.example.com
 *     port: 587
 *     starttls: true
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "mailqueue")
public class MailQueueProperties {

    private boolean enabled = true;
    private boolean metricsEnabled = true;

    private Mailer mailer = new Mailer();
    private Validation validation = new Validation();
    private Smtp smtp = new Smtp();

    @Data
    public static class Mailer {
        public static final String DEFAULT_PRODUCT = "MailQueue";
        public static final String DEFAULT_VERSION = "0.1";

        private String product = DEFAULT_PRODUCT;
        private String version = DEFAULT_VERSION;
    }

    @Data
    public static class Validation {
        public static final int DEFAULT_DNS_RETRY_COUNT = 3;

        /**
         * Require an MX or A record for every validated domain.
         */
        private boolean dnsCheckEnabled;

        /**
         * DNS servers to query; empty means the system resolver.
         */
        private List<String> dnsServers = new ArrayList<>();
        private int dnsRetryCount = DEFAULT_DNS_RETRY_COUNT;
    }

    @Data
    public static class Smtp {
        public static final int DEFAULT_PORT = 25;
        public static final long DEFAULT_CONNECTION_TIMEOUT_MS = 10_000L;
        public static final long DEFAULT_TIMEOUT_MS = 30_000L;

        private String host = "localhost";
        private int port = DEFAULT_PORT;
        private String username;
        private String password;
        private boolean starttls;
        private long connectionTimeoutMs = DEFAULT_CONNECTION_TIMEOUT_MS;
        private long timeoutMs = DEFAULT_TIMEOUT_MS;

        public boolean isAuthEnabled() {
            return username != null && !username.isBlank();
        }
    }
}
