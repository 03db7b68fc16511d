package com.docpublish.core.error;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Severity}.
 */
class SeverityTest {

    @ParameterizedTest
    @CsvSource({
        "0, DEBUG",
        "1, DEBUG",
        "3, INFO",
        "5, WARNING",
        "6, ERROR",
        "8, SEVERE",
        "10, SEVERE"
    })
    void labelOf_usesHighestNamedLevelNotAbove(int severity, String label) {
        assertThat(Severity.labelOf(severity)).isEqualTo(label);
    }

    @Test
    void parse_acceptsNumbersAndLabels() {
        assertThat(Severity.parse("7")).isEqualTo(7);
        assertThat(Severity.parse("warning")).isEqualTo(4);
        assertThat(Severity.parse(" Severe ")).isEqualTo(8);
    }

    @Test
    void parse_outOfRange_throwsException() {
        assertThatThrownBy(() -> Severity.parse("11"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Severity.parse("loud"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("loud");
    }
}
