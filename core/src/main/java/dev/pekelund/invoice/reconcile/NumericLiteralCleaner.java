package dev.pekelund.invoice.reconcile;

import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes thousands separators from numeric literals by deleting every comma that sits
 * between two digits. The rule is purely lexical, so a digit-comma-digit run inside a
 * quoted string (for example {@code "12,34 Main St"}) loses its comma as well.
 */
public class NumericLiteralCleaner implements ResponseRepairStep {

    private static final Logger LOGGER = LoggerFactory.getLogger(NumericLiteralCleaner.class);

    private static final Pattern DIGIT_GROUP_SEPARATOR = Pattern.compile("(?<=\\d),(?=\\d)");

    @Override
    public String apply(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String cleaned = DIGIT_GROUP_SEPARATOR.matcher(text).replaceAll("");
        if (LOGGER.isDebugEnabled() && cleaned.length() != text.length()) {
            LOGGER.debug("Removed {} digit group separators from reply", text.length() - cleaned.length());
        }
        return cleaned;
    }
}
