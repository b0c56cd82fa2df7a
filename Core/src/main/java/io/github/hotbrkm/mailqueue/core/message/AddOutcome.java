package io.github.hotbrkm.mailqueue.core.message;

/**
 * Result of adding a recipient by address.
 */
public enum AddOutcome {
    ADDED,
    DUPLICATE,
    INVALID_ADDRESS;

    public boolean isAdded() {
        return this == ADDED;
    }
}
