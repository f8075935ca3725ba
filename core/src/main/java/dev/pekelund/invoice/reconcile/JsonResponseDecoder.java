package dev.pekelund.invoice.reconcile;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses repaired reply text into a generic value tree of {@code LinkedHashMap},
 * {@code ArrayList} and scalar values. Floating point literals are read as
 * {@link java.math.BigDecimal} so amounts keep their exact digits.
 */
public class JsonResponseDecoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonResponseDecoder.class);

    private static final int PREVIEW_LENGTH = 256;

    private final ObjectMapper objectMapper;

    public JsonResponseDecoder() {
        this(JsonMapper.builder().build());
    }

    public JsonResponseDecoder(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper").copy()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * @param rawText      the reply as received, kept for diagnostics
     * @param repairedText the text to parse
     * @return the decoded tree; {@code null} when the text is the JSON literal {@code null}
     * @throws MalformedResponseException when the text is not a single valid JSON value
     */
    public Object decode(String rawText, String repairedText) {
        String text = repairedText != null ? repairedText : "";
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException ex) {
            JsonLocation location = ex.getLocation();
            int line = location != null ? location.getLineNr() : -1;
            int column = location != null ? location.getColumnNr() : -1;
            LOGGER.error("Failed to parse reply as JSON at line {} column {}. Payload begins with: {}", line, column,
                preview(text));
            throw new MalformedResponseException(rawText, text, ex.getOriginalMessage(), line, column, ex);
        }
    }

    private String preview(String text) {
        int max = Math.min(text.length(), PREVIEW_LENGTH);
        return text.substring(0, max);
    }
}
