package io.github.hotbrkm.mailqueue.core.address;

import lombok.Getter;

/**
 * Thrown when a recipient or sender is built from an address that fails validation.
 */
@Getter
public class InvalidAddressException extends RuntimeException {
    private final String address;

    public InvalidAddressException(String address) {
        super(address + " is not a valid email address");
        this.address = address;
    }
}
