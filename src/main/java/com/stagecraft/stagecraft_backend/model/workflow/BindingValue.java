package com.stagecraft.stagecraft_backend.model.workflow;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Value bound to a component parameter, rendered as a Python keyword argument.
 *
 * JSON shapes:
 *   "auto"          -> TextValue
 *   100, 0.25       -> NumberValue
 *   true            -> BoolValue
 *   ["a", 1, null]  -> SequenceValue
 *   null            -> NullValue
 *
 * JSON objects are rejected by {@link BindingValueDeserializer}.
 */
@JsonDeserialize(using = BindingValueDeserializer.class)
public sealed interface BindingValue
        permits BindingValue.TextValue, BindingValue.NumberValue, BindingValue.BoolValue,
                BindingValue.SequenceValue, BindingValue.NullValue {

    /** Literal used as the right-hand side of {@code name=value}. */
    String toLiteral();

    /** Literal used when the value sits inside a list. */
    default String toElementLiteral() {
        return toLiteral();
    }

    /** Omitted bindings are left out of the argument list entirely. */
    default boolean isOmitted() {
        return false;
    }

    static BindingValue of(String value)  { return new TextValue(value); }
    static BindingValue of(double value)  { return new NumberValue(value); }
    static BindingValue of(boolean value) { return new BoolValue(value); }
    static BindingValue of(List<BindingValue> items) { return new SequenceValue(items); }
    static BindingValue none()            { return NullValue.INSTANCE; }

    // ── Variants ──────────────────────────────────────────────────────────────

    record TextValue(String value) implements BindingValue {

        private static final Set<String> KEYWORDS = Set.of("None", "True", "False");

        // Plain decimal numbers only; "inf", "nan" and hex forms stay quoted
        private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

        public TextValue {
            value = value != null ? value : "";
        }

        @Override
        public String toLiteral() {
            if (KEYWORDS.contains(value) || DECIMAL.matcher(value).matches() || isPreformatted(value)) {
                return value;
            }
            return quote(value);
        }

        @Override
        public String toElementLiteral() {
            return quote(value);
        }

        @Override
        public boolean isOmitted() {
            return value.isEmpty();
        }

        private static boolean isPreformatted(String v) {
            return (v.startsWith("(") && v.endsWith(")"))
                    || (v.startsWith("[") && v.endsWith("]"))
                    || (v.startsWith("{") && v.endsWith("}"));
        }

        static String quote(String v) {
            String escaped = v.replace("\\", "\\\\")
                    .replace("'", "\\'")
                    .replace("\n", "\\n")
                    .replace("\r", "\\r");
            return "'" + escaped + "'";
        }
    }

    record NumberValue(double value) implements BindingValue {

        @Override
        public String toLiteral() {
            if (Double.isNaN(value)) {
                return "float('nan')";
            }
            if (Double.isInfinite(value)) {
                return value > 0 ? "float('inf')" : "float('-inf')";
            }
            if (isIntegral()) {
                return Long.toString((long) value);
            }
            String fixed = String.format(Locale.ROOT, "%f", value);
            // Six decimals lose small or very precise values
            if (Double.parseDouble(fixed) == value) {
                return fixed;
            }
            return BigDecimal.valueOf(value).toPlainString();
        }

        private boolean isIntegral() {
            return !Double.isInfinite(value)
                    && value == Math.rint(value)
                    && Math.abs(value) < 1e18;
        }
    }

    record BoolValue(boolean value) implements BindingValue {

        @Override
        public String toLiteral() {
            return value ? "True" : "False";
        }
    }

    record SequenceValue(List<BindingValue> items) implements BindingValue {

        public SequenceValue {
            items = items != null ? List.copyOf(items) : List.of();
        }

        @Override
        public String toLiteral() {
            return items.stream()
                    .map(BindingValue::toElementLiteral)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
    }

    final class NullValue implements BindingValue {

        static final NullValue INSTANCE = new NullValue();

        private NullValue() {}

        @Override
        public String toLiteral() {
            return "None";
        }

        @Override
        public String toString() {
            return "NullValue";
        }
    }
}
