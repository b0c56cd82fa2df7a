package io.github.hotbrkm.mailqueue.agent.config;

import io.github.hotbrkm.mailqueue.agent.message.MailMessageFactory;
import io.github.hotbrkm.mailqueue.agent.transport.JakartaMailTransport;
import io.github.hotbrkm.mailqueue.agent.transport.MeteredTransport;
import io.github.hotbrkm.mailqueue.core.address.AddressValidator;
import io.github.hotbrkm.mailqueue.core.address.DomainResolver;
import io.github.hotbrkm.mailqueue.core.dns.DnsDomainResolver;
import io.github.hotbrkm.mailqueue.core.message.Mailer;
import io.github.hotbrkm.mailqueue.core.message.Transport;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.mail.Authenticator;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.StringUtils;

import java.util.Optional;
import java.util.Properties;

/**
 * Wires a {@link MailMessageFactory} from {@code mailqueue.*} properties.
 * Each bean backs off when the application defines its own.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(MailQueueProperties.class)
@ConditionalOnProperty(prefix = MailQueueConfig.PROPERTY_PREFIX, name = "enabled", havingValue = "true", matchIfMissing = true)
public class MailQueueConfig {

    static final String PROPERTY_PREFIX = "mailqueue";

    @Bean
    @ConditionalOnMissingBean(DomainResolver.class)
    @ConditionalOnProperty(prefix = PROPERTY_PREFIX, name = "validation.dns-check-enabled", havingValue = "true")
    public DomainResolver domainResolver(MailQueueProperties properties) {
        MailQueueProperties.Validation validation = properties.getValidation();
        log.info("DNS domain check enabled. dnsServers={}", validation.getDnsServers());
        return new DnsDomainResolver(validation.getDnsServers(), validation.getDnsRetryCount());
    }

    @Bean
    @ConditionalOnMissingBean(AddressValidator.class)
    public AddressValidator addressValidator(Optional<DomainResolver> domainResolver) {
        return domainResolver.map(AddressValidator::new).orElseGet(AddressValidator::syntaxOnly);
    }

    @Bean
    @ConditionalOnMissingBean(Session.class)
    public Session mailSession(MailQueueProperties properties) {
        MailQueueProperties.Smtp smtp = properties.getSmtp();

        Properties props = new Properties();
        props.put("mail.transport.protocol", "smtp");
        props.put("mail.smtp.host", smtp.getHost());
        props.put("mail.smtp.port", String.valueOf(smtp.getPort()));
        props.put("mail.smtp.connectiontimeout", String.valueOf(smtp.getConnectionTimeoutMs()));
        props.put("mail.smtp.timeout", String.valueOf(smtp.getTimeoutMs()));
        props.put("mail.smtp.starttls.enable", String.valueOf(smtp.isStarttls()));

        if (!smtp.isAuthEnabled()) {
            log.info("Mail session configured. host={}, port={}, auth=false", smtp.getHost(), smtp.getPort());
            return Session.getInstance(props);
        }

        props.put("mail.smtp.auth", "true");
        String username = smtp.getUsername();
        String password = smtp.getPassword() == null ? "" : smtp.getPassword();
        log.info("Mail session configured. host={}, port={}, auth=true, username={}", smtp.getHost(), smtp.getPort(), username);
        return Session.getInstance(props, new Authenticator() {
            @Override
            protected PasswordAuthentication getPasswordAuthentication() {
                return new PasswordAuthentication(username, password);
            }
        });
    }

    /**
     * Jakarta Mail transport, counted in the application's {@link MeterRegistry} when one exists
     * and {@code mailqueue.metrics-enabled} is not false.
     */
    @Bean
    @ConditionalOnMissingBean(Transport.class)
    public Transport mailTransport(MailQueueProperties properties, Session mailSession,
                                   ObjectProvider<MeterRegistry> meterRegistry) {
        Transport transport = new JakartaMailTransport(mailSession);
        if (!properties.isMetricsEnabled()) {
            return transport;
        }
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            log.info("No MeterRegistry available, transport metrics disabled.");
            return transport;
        }
        return new MeteredTransport(transport, registry);
    }

    @Bean
    @ConditionalOnMissingBean(MailMessageFactory.class)
    public MailMessageFactory mailMessageFactory(MailQueueProperties properties, Transport mailTransport,
                                                 AddressValidator addressValidator) {
        return new MailMessageFactory(mailTransport, addressValidator, mailer(properties.getMailer()));
    }

    private Mailer mailer(MailQueueProperties.Mailer mailer) {
        String product = StringUtils.hasText(mailer.getProduct()) ? mailer.getProduct() : MailQueueProperties.Mailer.DEFAULT_PRODUCT;
        String version = StringUtils.hasText(mailer.getVersion()) ? mailer.getVersion() : MailQueueProperties.Mailer.DEFAULT_VERSION;
        return new Mailer(product, version);
    }
}
