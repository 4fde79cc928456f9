package io.lighting.weave.fragment;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Set;
import java.util.UUID;

/**
 * Renders Java values as inline PostgreSQL literals. The result goes straight into SQL text and
 * is not a bind parameter.
 */
public final class SqlLiterals {

    private SqlLiterals() {
    }

    /**
     * Formats a value as a SQL literal.
     *
     * @throws UnsupportedValueTypeException if the value's type has no literal form
     * @throws IllegalArgumentException      if a floating point value is NaN or infinite
     */
    public static String escape(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof CharSequence || value instanceof Character) {
            return quote(value.toString());
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number)) {
                throw new IllegalArgumentException("Can't escape NaN float");
            }
            if (Double.isInfinite(number)) {
                throw new IllegalArgumentException("Can't escape infinite float");
            }
            return value.toString();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
            || value instanceof Byte || value instanceof BigInteger) {
            return value.toString();
        }
        if (value instanceof Boolean bool) {
            return bool ? "TRUE" : "FALSE";
        }
        if (value instanceof UUID uuid) {
            return quote(uuid.toString()) + "::UUID";
        }
        if (value instanceof Iterable<?> iterable && !(value instanceof Set<?>)) {
            return escapeIterable(iterable);
        }
        if (value.getClass().isArray()) {
            return escapeArray(value);
        }
        throw new UnsupportedValueTypeException(value.getClass());
    }

    static String quote(String text) {
        return "'" + text.replace("'", "''") + "'";
    }

    private static String escapeIterable(Iterable<?> iterable) {
        StringBuilder out = new StringBuilder("ARRAY[");
        boolean first = true;
        for (Object item : iterable) {
            if (!first) {
                out.append(", ");
            }
            out.append(escape(item));
            first = false;
        }
        return out.append(']').toString();
    }

    private static String escapeArray(Object array) {
        StringBuilder out = new StringBuilder("ARRAY[");
        int length = Array.getLength(array);
        for (int i = 0; i < length; i++) {
            if (i > 0) {
                out.append(", ");
            }
            out.append(escape(Array.get(array, i)));
        }
        return out.append(']').toString();
    }
}
