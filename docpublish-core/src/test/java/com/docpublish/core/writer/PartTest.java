package com.docpublish.core.writer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Part}.
 */
class PartTest {

    @Test
    void prepend_placesFragmentBeforeEarlierAppends() {
        Part part = new Part("body");

        part.append("a");
        part.append("b");
        part.prepend("c");

        assertThat(part.content()).isEqualTo("cab");
        assertThat(part.fragments()).containsExactly("c", "a", "b");
    }

    @Test
    void freeze_rejectsFurtherWrites() {
        Part part = new Part("body");
        part.append("text");

        part.freeze();

        assertThat(part.isFrozen()).isTrue();
        assertThatThrownBy(() -> part.append("more"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("'body' is finalised");
        assertThat(part.content()).isEqualTo("text");
    }

    @Test
    void reset_clearsAndUnfreezes() {
        Part part = new Part("body");
        part.append("old");
        part.freeze();

        part.reset();
        part.append("new");

        assertThat(part.content()).isEqualTo("new");
        assertThat(part.isEmpty()).isFalse();
    }
}
