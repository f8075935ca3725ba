package dev.pekelund.invoice.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A field that the model may fill either with free text or with a free-form object.
 * Callers switch on the variant instead of assuming one shape.
 */
public sealed interface FlexibleContent permits FlexibleContent.Text, FlexibleContent.Structured {

    static Text text(String value) {
        return new Text(value);
    }

    static Structured structured(Map<?, ?> entries) {
        Map<String, Object> copy = new LinkedHashMap<>();
        entries.forEach((key, value) -> copy.put(String.valueOf(key), value));
        return new Structured(copy);
    }

    record Text(String value) implements FlexibleContent {

        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        @JsonValue
        public String value() {
            return value;
        }
    }

    record Structured(Map<String, Object> entries) implements FlexibleContent {

        public Structured {
            entries = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(entries, "entries")));
        }

        @Override
        @JsonValue
        public Map<String, Object> entries() {
            return entries;
        }
    }
}
