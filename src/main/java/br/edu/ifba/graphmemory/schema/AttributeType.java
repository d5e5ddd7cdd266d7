package br.edu.ifba.graphmemory.schema;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Declared type of an entity attribute.
 *
 * <p>{@link #coerce(Object)} converts a raw extracted value to the canonical Java
 * representation of the type, or returns null when the value cannot be represented.</p>
 */
public enum AttributeType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    STRING_LIST,
    DATE_TIME;

    /**
     * Converts a raw value to this type.
     *
     * <ul>
     *   <li>STRING: {@link String}</li>
     *   <li>INTEGER: {@link Long}</li>
     *   <li>NUMBER: {@link Double}</li>
     *   <li>BOOLEAN: {@link Boolean}</li>
     *   <li>STRING_LIST: unmodifiable {@code List<String>}</li>
     *   <li>DATE_TIME: ISO-8601 instant string</li>
     * </ul>
     *
     * @param raw the extracted value
     * @return the coerced value, or null when it does not fit
     */
    @Nullable
    public Object coerce(@Nullable Object raw) {
        if (raw == null) {
            return null;
        }
        return switch (this) {
            case STRING -> raw instanceof String s ? blankToNull(s) : (raw instanceof Collection<?> ? null : raw.toString());
            case INTEGER -> toLong(raw);
            case NUMBER -> toDouble(raw);
            case BOOLEAN -> toBoolean(raw);
            case STRING_LIST -> toStringList(raw);
            case DATE_TIME -> toInstantString(raw);
        };
    }

    @Nullable
    private static String blankToNull(@NotNull String s) {
        String trimmed = s.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Nullable
    private static Long toLong(Object raw) {
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            return d == Math.rint(d) && !Double.isInfinite(d) ? (long) d : null;
        }
        if (raw instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @Nullable
    private static Double toDouble(Object raw) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    @Nullable
    private static Boolean toBoolean(Object raw) {
        if (raw instanceof Boolean b) {
            return b;
        }
        if (raw instanceof String s) {
            String v = s.trim().toLowerCase();
            if (v.equals("true") || v.equals("yes")) {
                return Boolean.TRUE;
            }
            if (v.equals("false") || v.equals("no")) {
                return Boolean.FALSE;
            }
        }
        return null;
    }

    @Nullable
    private static List<String> toStringList(Object raw) {
        List<String> values = new ArrayList<>();
        if (raw instanceof Collection<?> items) {
            for (Object item : items) {
                if (item != null && !item.toString().isBlank()) {
                    values.add(item.toString().trim());
                }
            }
        } else if (raw instanceof String s) {
            for (String part : s.split(",")) {
                if (!part.isBlank()) {
                    values.add(part.trim());
                }
            }
        } else {
            return null;
        }
        return values.isEmpty() ? null : List.copyOf(values);
    }

    @Nullable
    private static String toInstantString(Object raw) {
        if (raw instanceof Instant instant) {
            return instant.toString();
        }
        if (raw instanceof String s) {
            try {
                return Instant.parse(s.trim()).toString();
            } catch (DateTimeParseException e) {
                return null;
            }
        }
        return null;
    }
}
