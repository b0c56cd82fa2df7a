package io.github.hotbrkm.mailqueue.core.dns;

import io.github.hotbrkm.mailqueue.core.address.DomainResolver;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.xbill.DNS.Lookup;
import org.xbill.DNS.SimpleResolver;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

import java.net.UnknownHostException;
import java.util.List;
import java.util.Objects;

/**
 * {@link DomainResolver} backed by dnsjava.
 * <p>
 * Queries MX first and falls back to A. With no DNS servers configured the system resolver
 * is used; otherwise each server is tried in order, retrying a server only while it answers
 * {@code TRY_AGAIN}.
 * </p>
 */
@Slf4j
@Getter
public class DnsDomainResolver implements DomainResolver {

    public static final int DEFAULT_RETRY_COUNT = 3;

    private final List<String> dnsServers;
    private final int retryCount;

    public DnsDomainResolver() {
        this(List.of(), DEFAULT_RETRY_COUNT);
    }

    public DnsDomainResolver(List<String> dnsServers, int retryCount) {
        this.dnsServers = dnsServers == null ? List.of() : dnsServers.stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isBlank())
                .toList();
        this.retryCount = retryCount > 0 ? retryCount : DEFAULT_RETRY_COUNT;
    }

    @Override
    public boolean hasMxOrA(String domain) {
        if (domain == null || domain.isBlank()) {
            return false;
        }
        return query(domain, Type.MX) == DnsQueryStatus.SUCCESS
                || query(domain, Type.A) == DnsQueryStatus.SUCCESS;
    }

    DnsQueryStatus query(String domain, int type) {
        if (dnsServers.isEmpty()) {
            return queryWithRetry(domain, type, null);
        }

        DnsQueryStatus last = DnsQueryStatus.UNKNOWN;
        for (String dnsServer : dnsServers) {
            last = queryWithRetry(domain, type, dnsServer);
            if (last == DnsQueryStatus.SUCCESS) {
                return last;
            }
        }
        return last;
    }

    private DnsQueryStatus queryWithRetry(String domain, int type, String dnsServer) {
        DnsQueryStatus status = DnsQueryStatus.UNKNOWN;
        for (int i = 0; i < retryCount; i++) {
            status = lookup(domain, type, dnsServer);
            if (!status.isRetryable()) {
                return status;
            }
        }
        return status;
    }

    private DnsQueryStatus lookup(String domain, int type, String dnsServer) {
        try {
            Lookup lookup = new Lookup(domain, type);
            if (dnsServer != null) {
                lookup.setResolver(new SimpleResolver(dnsServer));
            }
            lookup.run();
            DnsQueryStatus status = DnsQueryStatus.of(lookup.getResult());
            log.debug("DNS lookup finished. domain={}, type={}, server={}, status={}",
                    domain, Type.string(type), dnsServer, status);
            return status;
        } catch (TextParseException e) {
            log.debug("DNS lookup parse error: domain={}, type={}, message={}", domain, Type.string(type), e.getMessage());
            return DnsQueryStatus.UNRECOVERABLE;
        } catch (UnknownHostException e) {
            log.warn("Invalid DNS server host. dnsServer={}, domain={}", dnsServer, domain, e);
            return DnsQueryStatus.UNRECOVERABLE;
        } catch (RuntimeException e) {
            log.debug("DNS lookup runtime error: domain={}, type={}, message={}", domain, Type.string(type), e.getMessage());
            return DnsQueryStatus.TRY_AGAIN;
        }
    }
}
