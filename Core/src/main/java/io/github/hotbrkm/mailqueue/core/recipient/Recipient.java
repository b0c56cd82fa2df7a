package io.github.hotbrkm.mailqueue.core.recipient;

import io.github.hotbrkm.mailqueue.core.address.AddressValidator;
import io.github.hotbrkm.mailqueue.core.address.InvalidAddressException;
import lombok.Getter;

import java.util.Objects;

/**
 * A validated email address with an optional display name.
 * <p>
 * The address is checked once, when the recipient is created; instances are immutable.
 * </p>
 */
@Getter
public final class Recipient {

    /**
     * Display name, or null for an anonymous recipient.
     */
    private final String name;
    private final String address;

    private Recipient(String name, String address) {
        this.name = name;
        this.address = address;
    }

    public static Recipient of(String address) {
        return of(null, address, AddressValidator.syntaxOnly());
    }

    public static Recipient of(String name, String address) {
        return of(name, address, AddressValidator.syntaxOnly());
    }

    /**
     * @throws InvalidAddressException if {@code validator} rejects {@code address}
     */
    public static Recipient of(String name, String address, AddressValidator validator) {
        Objects.requireNonNull(validator, "validator must not be null");
        if (!validator.validate(address)) {
            throw new InvalidAddressException(address);
        }
        return new Recipient(name, address);
    }

    public boolean hasName() {
        return name != null;
    }

    /**
     * Renders {@code name <address>} when a name is present, otherwise the bare address.
     */
    @Override
    public String toString() {
        if (name != null) {
            return name + " <" + address + ">";
        }
        return address;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != this.getClass()) {
            return false;
        }
        var that = (Recipient) obj;
        return Objects.equals(this.name, that.name) && Objects.equals(this.address, that.address);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, address);
    }
}
