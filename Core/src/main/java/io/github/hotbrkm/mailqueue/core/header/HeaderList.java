package io.github.hotbrkm.mailqueue.core.header;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered collection of headers, unique by type name.
 * <p>
 * {@link #set(int, Header)} writes a slot directly and bypasses the uniqueness check.
 * </p>
 */
public class HeaderList implements Iterable<Header> {

    public static final String MAILER_HEADER = "X-Mailer";

    private static final String CRLF = "\r\n";

    private final List<Header> headers = new ArrayList<>();

    public static HeaderList create() {
        return new HeaderList();
    }

    /**
     * List pre-populated with {@code X-Mailer: product version}.
     */
    public static HeaderList withMailer(String product, String version) {
        HeaderList list = new HeaderList();
        list.add(Header.of(MAILER_HEADER, product + " " + version));
        return list;
    }

    /**
     * @return true if appended, false if a header with the same type name exists
     */
    public boolean add(Header header) {
        if (header == null) {
            throw new IllegalArgumentException("header must not be null");
        }
        if (contains(header.getTypeName())) {
            return false;
        }
        headers.add(header);
        return true;
    }

    /**
     * Removes any header of the same type and appends {@code header}.
     */
    public void replace(Header header) {
        if (header == null) {
            throw new IllegalArgumentException("header must not be null");
        }
        remove(header.getTypeName());
        headers.add(header);
    }

    public Optional<Header> lookup(String typeName) {
        for (Header header : headers) {
            if (header.getTypeName().equals(typeName)) {
                return Optional.of(header);
            }
        }
        return Optional.empty();
    }

    public boolean contains(String typeName) {
        return lookup(typeName).isPresent();
    }

    public boolean remove(String typeName) {
        return headers.removeIf(header -> header.getTypeName().equals(typeName));
    }

    public Header get(int index) {
        return headers.get(index);
    }

    /**
     * Replaces the header at {@code index} without the uniqueness check.
     */
    public Header set(int index, Header header) {
        if (header == null) {
            throw new IllegalArgumentException("header must not be null");
        }
        return headers.set(index, header);
    }

    public int size() {
        return headers.size();
    }

    public boolean isEmpty() {
        return headers.isEmpty();
    }

    public void reset() {
        headers.clear();
    }

    @Override
    public Iterator<Header> iterator() {
        return Collections.unmodifiableList(headers).iterator();
    }

    /**
     * Header block: one line per header joined by CRLF, without a trailing CRLF.
     */
    public String render() {
        return headers.stream()
                .map(Header::render)
                .collect(Collectors.joining(CRLF));
    }

    @Override
    public String toString() {
        return render();
    }
}
