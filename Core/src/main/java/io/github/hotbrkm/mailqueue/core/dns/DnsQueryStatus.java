package io.github.hotbrkm.mailqueue.core.dns;

import org.xbill.DNS.Lookup;

public enum DnsQueryStatus {
    SUCCESS, UNRECOVERABLE, TRY_AGAIN, HOST_NOT_FOUND, TYPE_NOT_FOUND, UNKNOWN;

    public static DnsQueryStatus of(int lookupResult) {
        return switch (lookupResult) {
            case Lookup.SUCCESSFUL -> SUCCESS;
            case Lookup.UNRECOVERABLE -> UNRECOVERABLE;
            case Lookup.TRY_AGAIN -> TRY_AGAIN;
            case Lookup.HOST_NOT_FOUND -> HOST_NOT_FOUND;
            case Lookup.TYPE_NOT_FOUND -> TYPE_NOT_FOUND;
            default -> UNKNOWN;
        };
    }

    public boolean isRetryable() {
        return this == TRY_AGAIN;
    }
}
