package io.github.hotbrkm.mailqueue.core.recipient;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RecipientList test")
class RecipientListTest {

    @Test
    @DisplayName("Empty list renders as an empty string")
    void emptyList() {
        RecipientList list = RecipientList.create();

        assertThat(list.isEmpty()).isTrue();
        assertThat(list.size()).isZero();
        assertThat(list.render()).isEmpty();
    }

    @Test
    @DisplayName("Keeps insertion order and joins with comma-space")
    void rendersInOrder() {
        // given
        RecipientList list = RecipientList.create();

        // when
        list.add(Recipient.of("a@x.com"));
        list.add(Recipient.of("B", "b@x.com"));

        // then
        assertThat(list.render()).isEqualTo("a@x.com, B <b@x.com>");
        assertThat(list.toString()).isEqualTo(list.render());
        assertThat(list.addresses()).containsExactly("a@x.com", "b@x.com");
    }

    @Test
    @DisplayName("Rejects a second recipient with the same address")
    void duplicateAddress() {
        RecipientList list = RecipientList.create();

        boolean first = list.add(Recipient.of("a@x.com"));
        boolean second = list.add(Recipient.of("Another Name", "a@x.com"));

        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(list.size()).isEqualTo(1);
        assertThat(list.get(0).hasName()).isFalse();
    }

    @Test
    @DisplayName("Address comparison is case-sensitive")
    void caseSensitiveAddresses() {
        RecipientList list = RecipientList.of(Recipient.of("a@x.com"), Recipient.of("A@x.com"));

        assertThat(list.size()).isEqualTo(2);
        assertThat(list.contains("a@x.com")).isTrue();
        assertThat(list.contains("a@X.com")).isFalse();
    }

    @Test
    @DisplayName("addAll appends only new addresses and reports the count")
    void addAll() {
        RecipientList list = RecipientList.of(Recipient.of("a@x.com"));
        RecipientList other = RecipientList.of(Recipient.of("a@x.com"), Recipient.of("b@x.com"));

        int added = list.addAll(other);

        assertThat(added).isEqualTo(1);
        assertThat(list.render()).isEqualTo("a@x.com, b@x.com");
    }

    @Test
    @DisplayName("Direct slot assignment bypasses the duplicate check")
    void setBypassesUniqueness() {
        RecipientList list = RecipientList.of(Recipient.of("a@x.com"), Recipient.of("b@x.com"));

        list.set(1, Recipient.of("a@x.com"));

        assertThat(list.render()).isEqualTo("a@x.com, a@x.com");
    }

    @Test
    @DisplayName("Iteration is restartable and read-only")
    void iteration() {
        RecipientList list = RecipientList.of(Recipient.of("a@x.com"), Recipient.of("b@x.com"));

        List<String> firstPass = new ArrayList<>();
        list.forEach(r -> firstPass.add(r.getAddress()));
        List<String> secondPass = new ArrayList<>();
        list.forEach(r -> secondPass.add(r.getAddress()));

        assertThat(firstPass).containsExactly("a@x.com", "b@x.com");
        assertThat(secondPass).isEqualTo(firstPass);

        Iterator<Recipient> iterator = list.iterator();
        iterator.next();
        assertThatThrownBy(iterator::remove).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("remove and reset shrink the list")
    void removeAndReset() {
        RecipientList list = RecipientList.of(Recipient.of("a@x.com"), Recipient.of("b@x.com"));

        Recipient removed = list.remove(0);
        assertThat(removed.getAddress()).isEqualTo("a@x.com");
        assertThat(list.render()).isEqualTo("b@x.com");

        list.reset();
        assertThat(list.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Null recipients are rejected")
    void nullRecipient() {
        RecipientList list = RecipientList.create();

        assertThatThrownBy(() -> list.add(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> list.addAll(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
