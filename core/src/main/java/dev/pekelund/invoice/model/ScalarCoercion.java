package dev.pekelund.invoice.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import org.springframework.util.StringUtils;

/**
 * Final coercion of reconciled leaf values into the scalar types the records declare.
 */
final class ScalarCoercion {

    private ScalarCoercion() {
    }

    static String toText(String path, Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof String text) {
            return text;
        }
        if (raw instanceof BigDecimal decimal) {
            return decimal.toPlainString();
        }
        if (raw instanceof Number || raw instanceof Boolean) {
            return String.valueOf(raw);
        }
        throw new FieldValidationException(path, raw, "text");
    }

    static BigDecimal toDecimal(String path, Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof BigDecimal decimal) {
            return decimal;
        }
        if (raw instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (raw instanceof Integer || raw instanceof Long || raw instanceof Short || raw instanceof Byte) {
            return BigDecimal.valueOf(((Number) raw).longValue());
        }
        if (raw instanceof Double || raw instanceof Float) {
            double value = ((Number) raw).doubleValue();
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new FieldValidationException(path, raw, "number");
            }
            return new BigDecimal(raw.toString());
        }
        if (raw instanceof String text) {
            if (!StringUtils.hasText(text)) {
                throw new FieldValidationException(path, raw, "number");
            }
            try {
                return new BigDecimal(text.trim());
            } catch (NumberFormatException ex) {
                throw new FieldValidationException(path, raw, "number");
            }
        }
        throw new FieldValidationException(path, raw, "number");
    }

    static FlexibleContent toFlexible(String path, Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof Map<?, ?> map) {
            return FlexibleContent.structured(map);
        }
        if (raw instanceof List<?>) {
            throw new FieldValidationException(path, raw, "text or object");
        }
        return FlexibleContent.text(toText(path, raw));
    }
}
