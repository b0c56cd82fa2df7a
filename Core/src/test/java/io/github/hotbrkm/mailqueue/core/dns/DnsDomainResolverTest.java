package io.github.hotbrkm.mailqueue.core.dns;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.xbill.DNS.Lookup;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DnsDomainResolverTest {

    @DisplayName("Drops null and blank DNS server entries")
    @Test
    void sanitizesDnsServers() {
        DnsDomainResolver resolver = new DnsDomainResolver(Arrays.asList(" 8.8.8.8 ", null, "", "  "), 2);

        assertThat(resolver.getDnsServers()).containsExactly("8.8.8.8");
        assertThat(resolver.getRetryCount()).isEqualTo(2);
    }

    @DisplayName("Falls back to the default retry count for non-positive values")
    @Test
    void defaultRetryCount() {
        DnsDomainResolver resolver = new DnsDomainResolver(null, 0);

        assertThat(resolver.getDnsServers()).isEmpty();
        assertThat(resolver.getRetryCount()).isEqualTo(DnsDomainResolver.DEFAULT_RETRY_COUNT);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  "})
    @DisplayName("Blank domains never resolve")
    void blankDomain(String domain) {
        assertThat(new DnsDomainResolver().hasMxOrA(domain)).isFalse();
    }

    @DisplayName("Maps dnsjava lookup results to query status")
    @Test
    void mapsLookupResult() {
        assertThat(DnsQueryStatus.of(Lookup.SUCCESSFUL)).isEqualTo(DnsQueryStatus.SUCCESS);
        assertThat(DnsQueryStatus.of(Lookup.TRY_AGAIN)).isEqualTo(DnsQueryStatus.TRY_AGAIN);
        assertThat(DnsQueryStatus.of(Lookup.HOST_NOT_FOUND)).isEqualTo(DnsQueryStatus.HOST_NOT_FOUND);
        assertThat(DnsQueryStatus.of(Lookup.TYPE_NOT_FOUND)).isEqualTo(DnsQueryStatus.TYPE_NOT_FOUND);
        assertThat(DnsQueryStatus.of(Lookup.UNRECOVERABLE)).isEqualTo(DnsQueryStatus.UNRECOVERABLE);
        assertThat(DnsQueryStatus.of(99)).isEqualTo(DnsQueryStatus.UNKNOWN);
        assertThat(DnsQueryStatus.TRY_AGAIN.isRetryable()).isTrue();
        assertThat(DnsQueryStatus.HOST_NOT_FOUND.isRetryable()).isFalse();
    }

    @Tag("integration")
    @DisplayName("Resolves a domain with public DNS records")
    @Test
    void resolvesExistingDomain() {
        DnsDomainResolver resolver = new DnsDomainResolver(List.of("8.8.8.8"), 1);

        assertThat(resolver.hasMxOrA("example.com")).isTrue();
    }

    @Tag("integration")
    @DisplayName("Does not resolve a reserved non-existent domain")
    @Test
    void rejectsNonExistentDomain() {
        DnsDomainResolver resolver = new DnsDomainResolver(List.of("8.8.8.8"), 1);

        assertThat(resolver.hasMxOrA("nonexistent.invalid")).isFalse();
    }
}
