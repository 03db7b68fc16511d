package com.docpublish.core.settings;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link OptionType}.
 */
class OptionTypeTest {

    @Test
    void bool_acceptsCommonSpellings() {
        OptionType type = OptionType.bool();

        assertThat(type.parse("yes")).isEqualTo(true);
        assertThat(type.parse("On")).isEqualTo(true);
        assertThat(type.parse("0")).isEqualTo(false);
        assertThatThrownBy(() -> type.parse("maybe"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maybe");
    }

    @Test
    void integerRange_outsideBounds_throwsException() {
        OptionType type = OptionType.integerRange(0, 10);

        assertThat(type.parse("4")).isEqualTo(4);
        assertThatThrownBy(() -> type.parse("12")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> type.parse("four")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nullablePath_none_returnsNull() {
        assertThat(OptionType.nullablePath().parse("none")).isNull();
        assertThat(OptionType.nullablePath().parse("")).isNull();
        assertThat(OptionType.nullablePath().parse("style.css")).isEqualTo(Path.of("style.css"));
        assertThatThrownBy(() -> OptionType.path().parse("none"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void symbol_matchesCaseInsensitively() {
        OptionType type = OptionType.symbol("strict", "lenient");

        assertThat(type.parse("STRICT")).isEqualTo("strict");
        assertThatThrownBy(() -> type.parse("loose"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("[lenient, strict]");
    }

    @Test
    void listOf_parsesEachItem() {
        OptionType type = OptionType.listOf(OptionType.integerRange(1, 5));

        assertThat(type.parse("1, 3,5")).isEqualTo(List.of(1, 3, 5));
        assertThat(type.parse(" ")).isEqualTo(List.of());
        assertThatThrownBy(() -> type.parse("1,9")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void level_acceptsLabelsAndNumbers() {
        assertThat(OptionType.level().parse("error")).isEqualTo(6);
        assertThat(OptionType.level().parse("3")).isEqualTo(3);
    }
}
