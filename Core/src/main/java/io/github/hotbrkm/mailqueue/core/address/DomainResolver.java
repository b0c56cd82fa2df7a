package io.github.hotbrkm.mailqueue.core.address;

/**
 * Answers whether a mail domain exists in DNS.
 */
@FunctionalInterface
public interface DomainResolver {

    /**
     * @param domain domain part of an address, already syntax-checked
     * @return true if the domain has at least one MX or A record
     */
    boolean hasMxOrA(String domain);
}
