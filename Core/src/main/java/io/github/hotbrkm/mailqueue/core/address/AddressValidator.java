package io.github.hotbrkm.mailqueue.core.address;

import lombok.extern.slf4j.Slf4j;

import java.util.regex.Pattern;

/**
 * Validates email addresses by their local-part and domain syntax.
 * <p>
 * Checks run in a fixed order and stop at the first failure. When a {@link DomainResolver}
 * is supplied, the domain must additionally resolve to an MX or A record; without one the
 * validator is a pure function of its input.
 * </p>
 */
@Slf4j
public class AddressValidator {

    public static final int MAX_LOCAL_LENGTH = 64;
    public static final int MAX_DOMAIN_LENGTH = 255;

    private static final String ESCAPED_BACKSLASH = "\\\\";
    private static final Pattern DOMAIN_CHARS = Pattern.compile("^[A-Za-z0-9.-]+$");
    private static final Pattern UNQUOTED_LOCAL = Pattern.compile("^(\\\\.|[A-Za-z0-9!#%&`_=/$'*+?^{}|~.-])+$");
    private static final Pattern QUOTED_LOCAL = Pattern.compile("^\"(\\\\\"|[^\"])+\"$");

    private static final AddressValidator SYNTAX_ONLY = new AddressValidator(null);

    private final DomainResolver domainResolver;

    /**
     * @param domainResolver resolver consulted after the syntax checks pass, or null to skip the DNS step
     */
    public AddressValidator(DomainResolver domainResolver) {
        this.domainResolver = domainResolver;
    }

    /**
     * Shared validator that performs the syntax checks only.
     */
    public static AddressValidator syntaxOnly() {
        return SYNTAX_ONLY;
    }

    public boolean isDomainCheckEnabled() {
        return domainResolver != null;
    }

    public boolean validate(String address) {
        if (!isSyntaxValid(address)) {
            return false;
        }
        if (domainResolver == null) {
            return true;
        }

        String domain = address.substring(address.lastIndexOf('@') + 1);
        boolean resolved = domainResolver.hasMxOrA(domain);
        if (!resolved) {
            log.debug("Domain has no MX or A record. address={}, domain={}", address, domain);
        }
        return resolved;
    }

    public static boolean isSyntaxValid(String address) {
        if (address == null) {
            return false;
        }

        int at = address.lastIndexOf('@');
        if (at < 0) {
            return false;
        }

        String local = address.substring(0, at);
        String domain = address.substring(at + 1);

        if (local.isEmpty() || local.length() > MAX_LOCAL_LENGTH) {
            return false;
        }
        if (domain.isEmpty() || domain.length() > MAX_DOMAIN_LENGTH) {
            return false;
        }
        if (local.startsWith(".") || local.endsWith(".")) {
            return false;
        }
        if (local.contains("..")) {
            return false;
        }
        if (!DOMAIN_CHARS.matcher(domain).matches()) {
            return false;
        }
        if (domain.contains("..")) {
            return false;
        }

        String unescaped = local.replace(ESCAPED_BACKSLASH, "");
        return UNQUOTED_LOCAL.matcher(unescaped).matches() || QUOTED_LOCAL.matcher(unescaped).matches();
    }
}
