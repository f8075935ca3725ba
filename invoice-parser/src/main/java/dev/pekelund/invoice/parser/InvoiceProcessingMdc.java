package dev.pekelund.invoice.parser;

import java.util.Map;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;

/**
 * Utility for populating mapped diagnostic context (MDC) entries so every log line written
 * while one extraction request is handled carries the same request id and current stage.
 */
final class InvoiceProcessingMdc {

    static final String KEY_REQUEST_ID = "invoice.requestId";
    static final String KEY_STAGE = "invoice.stage";

    private InvoiceProcessingMdc() {
        // Utility class
    }

    static Context open(String requestId) {
        return new Context(requestId);
    }

    static void setStage(String stage) {
        if (!StringUtils.hasText(stage)) {
            MDC.remove(KEY_STAGE);
        } else {
            MDC.put(KEY_STAGE, stage);
        }
    }

    static final class Context implements AutoCloseable {

        private final Map<String, String> previous;

        private Context(String requestId) {
            this.previous = MDC.getCopyOfContextMap();
            if (StringUtils.hasText(requestId)) {
                MDC.put(KEY_REQUEST_ID, requestId);
            } else {
                MDC.remove(KEY_REQUEST_ID);
            }
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
