package io.github.hotbrkm.mailqueue.core.header;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("HeaderList test")
class HeaderListTest {

    @Test
    @DisplayName("Allows one header per type and keeps the first")
    void uniqueByType() {
        // given
        HeaderList list = HeaderList.create();
        Header first = Header.from("a@x.com");
        Header second = Header.from("b@x.com");

        // when
        boolean addedFirst = list.add(first);
        boolean addedSecond = list.add(second);

        // then
        assertThat(addedFirst).isTrue();
        assertThat(addedSecond).isFalse();
        assertThat(list.size()).isEqualTo(1);
        assertThat(list.lookup("From")).containsSame(first);
    }

    @Test
    @DisplayName("Generic header with a reserved name collides with the typed header")
    void genericCollidesWithTyped() {
        HeaderList list = HeaderList.create();
        list.add(Header.of("Cc", "a@x.com"));

        assertThat(list.add(Header.cc())).isFalse();
    }

    @Test
    @DisplayName("Lookup of a missing type is empty")
    void lookupMissing() {
        assertThat(HeaderList.create().lookup("Bcc")).isEmpty();
    }

    @Test
    @DisplayName("Renders CRLF-joined lines without a trailing CRLF")
    void renderHeaderBlock() {
        HeaderList list = HeaderList.withMailer("MailQueue", "0.1");
        list.add(Header.from("a@x.com"));
        list.add(Header.of("X-Priority", "1"));

        assertThat(list.render()).isEqualTo("X-Mailer: MailQueue 0.1\r\nFrom: a@x.com\r\nX-Priority: 1");
        assertThat(list.toString()).isEqualTo(list.render());
    }

    @Test
    @DisplayName("Starts with the X-Mailer header when created for a mailer")
    void mailerHeader() {
        HeaderList list = HeaderList.withMailer("MailQueue", "0.1");

        assertThat(list.render()).isEqualTo("X-Mailer: MailQueue 0.1");
        assertThat(list.add(Header.of(HeaderList.MAILER_HEADER, "Other 2.0"))).isFalse();
    }

    @Test
    @DisplayName("replace swaps out an existing header of the same type")
    void replace() {
        HeaderList list = HeaderList.withMailer("MailQueue", "0.1");
        list.add(Header.of("X-Priority", "1"));

        list.replace(Header.of(HeaderList.MAILER_HEADER, "Custom 2.0"));

        assertThat(list.render()).isEqualTo("X-Priority: 1\r\nX-Mailer: Custom 2.0");
    }

    @Test
    @DisplayName("remove drops a header by type")
    void remove() {
        HeaderList list = HeaderList.withMailer("MailQueue", "0.1");

        assertThat(list.remove(HeaderList.MAILER_HEADER)).isTrue();
        assertThat(list.remove(HeaderList.MAILER_HEADER)).isFalse();
        assertThat(list.isEmpty()).isTrue();
        assertThat(list.render()).isEmpty();
    }

    @Test
    @DisplayName("Index access and direct assignment")
    void indexAccess() {
        HeaderList list = HeaderList.create();
        list.add(Header.of("X-A", "1"));
        list.add(Header.of("X-B", "2"));

        list.set(1, Header.of("X-A", "3"));

        assertThat(list.get(0).getContent()).isEqualTo("1");
        assertThat(list.get(1).getContent()).isEqualTo("3");
        assertThat(list.lookup("X-A").map(Header::getContent)).contains("1");
    }

    @Test
    @DisplayName("Iterates in insertion order")
    void iteration() {
        HeaderList list = HeaderList.create();
        list.add(Header.of("X-A", "1"));
        list.add(Header.replyTo("r@x.com"));

        List<String> names = new ArrayList<>();
        for (Header header : list) {
            names.add(header.getTypeName());
        }

        assertThat(names).containsExactly("X-A", "Reply-To");
    }

    @Test
    @DisplayName("reset empties the list and null headers are rejected")
    void resetAndNull() {
        HeaderList list = HeaderList.withMailer("MailQueue", "0.1");

        list.reset();

        assertThat(list.size()).isZero();
        assertThatThrownBy(() -> list.add(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
