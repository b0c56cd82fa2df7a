package io.github.hotbrkm.mailqueue.core.recipient;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered collection of recipients, unique by address.
 * <p>
 * {@link #add(Recipient)} is the only mutator that enforces uniqueness. {@link #set(int, Recipient)}
 * writes a slot directly and does not check for duplicates.
 * Not thread-safe.
 * </p>
 */
public class RecipientList implements Iterable<Recipient> {

    private static final String SEPARATOR = ", ";

    private final List<Recipient> recipients = new ArrayList<>();

    public static RecipientList create() {
        return new RecipientList();
    }

    /**
     * Builds a list from the given recipients, silently dropping repeated addresses.
     */
    public static RecipientList of(Recipient... recipients) {
        RecipientList list = new RecipientList();
        for (Recipient recipient : recipients) {
            list.add(recipient);
        }
        return list;
    }

    /**
     * Appends the recipient unless its address is already present.
     *
     * @return true if appended, false if the address was a duplicate
     */
    public boolean add(Recipient recipient) {
        if (recipient == null) {
            throw new IllegalArgumentException("recipient must not be null");
        }
        if (contains(recipient.getAddress())) {
            return false;
        }
        recipients.add(recipient);
        return true;
    }

    /**
     * Adds every recipient of {@code other} in order.
     *
     * @return number of recipients actually appended
     */
    public int addAll(RecipientList other) {
        if (other == null) {
            throw new IllegalArgumentException("other must not be null");
        }
        int added = 0;
        for (Recipient recipient : other) {
            if (add(recipient)) {
                added++;
            }
        }
        return added;
    }

    public boolean contains(String address) {
        for (Recipient recipient : recipients) {
            if (recipient.getAddress().equals(address)) {
                return true;
            }
        }
        return false;
    }

    public Recipient get(int index) {
        return recipients.get(index);
    }

    /**
     * Replaces the recipient at {@code index} without the duplicate check.
     */
    public Recipient set(int index, Recipient recipient) {
        if (recipient == null) {
            throw new IllegalArgumentException("recipient must not be null");
        }
        return recipients.set(index, recipient);
    }

    public Recipient remove(int index) {
        return recipients.remove(index);
    }

    public int size() {
        return recipients.size();
    }

    public boolean isEmpty() {
        return recipients.isEmpty();
    }

    public void reset() {
        recipients.clear();
    }

    public List<String> addresses() {
        return recipients.stream().map(Recipient::getAddress).toList();
    }

    @Override
    public Iterator<Recipient> iterator() {
        return Collections.unmodifiableList(recipients).iterator();
    }

    /**
     * Joins the recipients with {@code ", "}; an empty list renders as an empty string.
     */
    public String render() {
        return recipients.stream()
                .map(Recipient::toString)
                .collect(Collectors.joining(SEPARATOR));
    }

    @Override
    public String toString() {
        return render();
    }
}
