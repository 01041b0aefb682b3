package io.github.reugn.directive4j.lang;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A typed directive parameter value.
 * <p>
 * Values are one of:
 * <ul>
 *   <li>{@link StringValue} - quoted literals and plain barewords</li>
 *   <li>{@link BooleanValue} - the barewords {@code true} and {@code false}</li>
 *   <li>{@link NumberValue} - numeric barewords such as {@code 42} or {@code -1.5}, kept as written</li>
 *   <li>{@link ListValue} - a parenthesized group, one level deep at most</li>
 * </ul>
 * Scalars share a text form used by validation comparisons, so {@code 'true'} and
 * {@code true} both read as {@code "true"}.
 */
public interface Value {

    static Value of(String text) {
        return new StringValue(text);
    }

    static Value of(boolean flag) {
        return flag ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static Value of(long number) {
        return new NumberValue(Long.toString(number));
    }

    static Value of(BigDecimal number) {
        return new NumberValue(number.toPlainString());
    }

    /**
     * Text form of a scalar value.
     *
     * @return the value as written, without quotes
     * @throws IllegalArgumentException for a {@link ListValue}
     */
    String asText();

    /**
     * Reads the value as a boolean. Strings {@code "true"} and {@code "false"} are accepted
     * in any case.
     *
     * @return the boolean
     * @throws IllegalArgumentException if the value is not boolean-like
     */
    default boolean asBoolean() {
        String text = asText();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        throw new IllegalArgumentException("expected a boolean but got " + render());
    }

    /**
     * Reads the value as an {@code int}.
     *
     * @return the integer
     * @throws IllegalArgumentException if the value is not an integral number
     */
    default int asInt() {
        try {
            return new BigDecimal(asText()).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("expected an integer but got " + render(), e);
        }
    }

    /**
     * Renders the value back into micro-syntax that evaluates to an equal value.
     *
     * @return canonical source text
     */
    String render();

    record StringValue(String text) implements Value {

        public StringValue {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String asText() {
            return text;
        }

        @Override
        public String render() {
            return "'" + text.replace("'", "\\'") + "'";
        }

        @Override
        public String toString() {
            return text;
        }
    }

    record BooleanValue(boolean flag) implements Value {

        static final BooleanValue TRUE = new BooleanValue(true);
        static final BooleanValue FALSE = new BooleanValue(false);

        @Override
        public String asText() {
            return Boolean.toString(flag);
        }

        @Override
        public boolean asBoolean() {
            return flag;
        }

        @Override
        public String render() {
            return asText();
        }

        @Override
        public String toString() {
            return asText();
        }
    }

    /**
     * A numeric bareword. The text is kept as written, so {@code 007} reads as {@code "007"}
     * like its quoted form.
     *
     * @param text the numeral
     */
    record NumberValue(String text) implements Value {

        public NumberValue {
            Objects.requireNonNull(text, "text");
            try {
                new BigDecimal(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not a number: " + text, e);
            }
        }

        public BigDecimal number() {
            return new BigDecimal(text);
        }

        @Override
        public String asText() {
            return text;
        }

        @Override
        public int asInt() {
            try {
                return number().intValueExact();
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("expected an integer but got " + render(), e);
            }
        }

        @Override
        public String render() {
            return asText();
        }

        @Override
        public String toString() {
            return asText();
        }
    }

    /**
     * A parenthesized group. Keys follow the same lower-casing rule as top-level keys.
     *
     * @param positional unkeyed entries in source order
     * @param keyed      keyed entries in source order
     */
    record ListValue(List<Value> positional, Map<String, Value> keyed) implements Value {

        public ListValue {
            positional = List.copyOf(positional);
            keyed = Collections.unmodifiableMap(new LinkedHashMap<>(keyed));
        }

        public static ListValue of(Value... values) {
            return new ListValue(List.of(values), Map.of());
        }

        @Override
        public String asText() {
            throw new IllegalArgumentException("expected a single value but got the list " + render());
        }

        @Override
        public String render() {
            List<String> parts = new ArrayList<>();
            positional.forEach(v -> parts.add(v.render()));
            keyed.forEach((k, v) -> parts.add(new StringValue(k).render() + ": " + v.render()));
            return "(" + String.join(", ", parts) + ")";
        }

        @Override
        public String toString() {
            return render();
        }
    }
}
