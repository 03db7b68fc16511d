package com.docpublish.core.settings;

import com.docpublish.core.error.Severity;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Type descriptor of a configuration option: parses raw configuration text into a typed value.
 *
 * <p>Implementations throw {@link IllegalArgumentException} with a short reason when a raw value
 * is not acceptable; the resolver attaches file and line information.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * OptionType type = OptionType.integerRange(0, 10);
 * Object value = type.parse("4");   // Integer 4
 * type.parse("12");                 // IllegalArgumentException
 * }</pre>
 */
public interface OptionType {

    /**
     * Parses a raw value.
     *
     * @param raw raw text, already trimmed
     * @return typed value, possibly {@code null} for nullable types
     * @throws IllegalArgumentException if the text is not a valid value of this type
     */
    Object parse(String raw);

    /**
     * Short human-readable description used in listings (e.g. {@code "integer 0..10"}).
     *
     * @return description
     */
    String describe();

    static OptionType bool() {
        return new BooleanType();
    }

    static OptionType integerRange(int min, int max) {
        return new IntegerRangeType(min, max);
    }

    static OptionType string() {
        return new StringType(false);
    }

    static OptionType nullableString() {
        return new StringType(true);
    }

    static OptionType path() {
        return new PathType(false);
    }

    static OptionType nullablePath() {
        return new PathType(true);
    }

    static OptionType symbol(String... choices) {
        return new SymbolType(Set.of(choices));
    }

    static OptionType listOf(OptionType element) {
        return new ListType(element);
    }

    static OptionType level() {
        return new LevelType();
    }

    /**
     * Boolean option. Accepts {@code true/false}, {@code yes/no}, {@code on/off} and {@code 1/0}.
     */
    record BooleanType() implements OptionType {
        private static final Set<String> TRUE_VALUES = Set.of("true", "yes", "on", "1");
        private static final Set<String> FALSE_VALUES = Set.of("false", "no", "off", "0");

        @Override
        public Object parse(String raw) {
            String value = raw.trim().toLowerCase(Locale.ROOT);
            if (TRUE_VALUES.contains(value)) {
                return Boolean.TRUE;
            }
            if (FALSE_VALUES.contains(value)) {
                return Boolean.FALSE;
            }
            throw new IllegalArgumentException("Not a boolean: '" + raw + "'");
        }

        @Override
        public String describe() {
            return "boolean";
        }
    }

    /**
     * Integer option bounded to {@code min..max} inclusive.
     *
     * @param min lowest accepted value
     * @param max highest accepted value
     */
    record IntegerRangeType(int min, int max) implements OptionType {
        /**
         * Compact constructor with validation.
         */
        public IntegerRangeType {
            if (min > max) {
                throw new IllegalArgumentException("min must not exceed max: " + min + " > " + max);
            }
        }

        @Override
        public Object parse(String raw) {
            int value;
            try {
                value = Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Not an integer: '" + raw + "'", e);
            }
            if (value < min || value > max) {
                throw new IllegalArgumentException("Out of range " + min + ".." + max + ": " + value);
            }
            return value;
        }

        @Override
        public String describe() {
            return "integer " + min + ".." + max;
        }
    }

    /**
     * String option. A nullable string maps an empty value or {@code none} to {@code null}.
     *
     * @param nullable whether {@code null} is allowed
     */
    record StringType(boolean nullable) implements OptionType {
        @Override
        public Object parse(String raw) {
            if (nullable && isNone(raw)) {
                return null;
            }
            return raw;
        }

        @Override
        public String describe() {
            return nullable ? "string or none" : "string";
        }
    }

    /**
     * Filesystem path option. A nullable path maps an empty value or {@code none} to {@code null}.
     *
     * @param nullable whether {@code null} is allowed
     */
    record PathType(boolean nullable) implements OptionType {
        @Override
        public Object parse(String raw) {
            if (isNone(raw)) {
                if (nullable) {
                    return null;
                }
                throw new IllegalArgumentException("A path is required");
            }
            try {
                return Path.of(raw.trim());
            } catch (RuntimeException e) {
                throw new IllegalArgumentException("Not a path: '" + raw + "'", e);
            }
        }

        @Override
        public String describe() {
            return nullable ? "path or none" : "path";
        }
    }

    /**
     * Enumerated symbol option; values are matched case-insensitively and stored lower-case.
     *
     * @param choices accepted symbols, lower-case
     */
    record SymbolType(Set<String> choices) implements OptionType {
        /**
         * Compact constructor with validation.
         */
        public SymbolType {
            Objects.requireNonNull(choices, "choices must not be null");
            if (choices.isEmpty()) {
                throw new IllegalArgumentException("choices must not be empty");
            }
            choices = Set.copyOf(choices);
        }

        @Override
        public Object parse(String raw) {
            String value = raw.trim().toLowerCase(Locale.ROOT);
            if (!choices.contains(value)) {
                throw new IllegalArgumentException("Expected one of " + new TreeSet<>(choices) + ": '" + raw + "'");
            }
            return value;
        }

        @Override
        public String describe() {
            return "one of " + String.join("|", new TreeSet<>(choices));
        }
    }

    /**
     * Comma-separated list whose items are parsed with an element type.
     *
     * @param element item type
     */
    record ListType(OptionType element) implements OptionType {
        /**
         * Compact constructor with validation.
         */
        public ListType {
            Objects.requireNonNull(element, "element must not be null");
        }

        @Override
        public Object parse(String raw) {
            List<Object> items = new ArrayList<>();
            if (raw.isBlank()) {
                return List.of();
            }
            for (String item : raw.split(",")) {
                items.add(element.parse(item.trim()));
            }
            return Collections.unmodifiableList(items);
        }

        @Override
        public String describe() {
            return "list of " + element.describe();
        }
    }

    /**
     * Severity threshold: a number {@code 0..10} or a label such as {@code warning}.
     */
    record LevelType() implements OptionType {
        @Override
        public Object parse(String raw) {
            return Severity.parse(raw);
        }

        @Override
        public String describe() {
            return "level 0..10 or debug|info|warning|error|severe";
        }
    }

    private static boolean isNone(String raw) {
        String value = raw.trim();
        return value.isEmpty() || "none".equalsIgnoreCase(value);
    }
}
