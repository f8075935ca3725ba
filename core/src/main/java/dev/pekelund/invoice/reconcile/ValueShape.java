package dev.pekelund.invoice.reconcile;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Structural shape of a value in a decoded JSON tree.
 */
public enum ValueShape {
    OBJECT,
    ARRAY,
    STRING,
    NUMBER,
    BOOLEAN,
    NULL;

    public static ValueShape of(Object value) {
        if (value == null) {
            return NULL;
        }
        if (value instanceof Map<?, ?>) {
            return OBJECT;
        }
        if (value instanceof List<?>) {
            return ARRAY;
        }
        if (value instanceof Number) {
            return NUMBER;
        }
        if (value instanceof Boolean) {
            return BOOLEAN;
        }
        return STRING;
    }

    public boolean isScalar() {
        return this == STRING || this == NUMBER || this == BOOLEAN;
    }

    public String describe() {
        return name().toLowerCase(Locale.ROOT);
    }
}
