package dev.pekelund.invoice.reconcile;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a chat reply into plausible JSON text: trims it, removes Markdown code fences and
 * replaces typographic double quotes with ASCII ones.
 */
public class ResponseSanitizer implements ResponseRepairStep {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResponseSanitizer.class);

    private static final String FENCE = "```";
    private static final Pattern OPENING_FENCE = Pattern.compile("^```([\\w-]*)");
    private static final char LEFT_DOUBLE_QUOTE = '“';
    private static final char RIGHT_DOUBLE_QUOTE = '”';

    @Override
    public String apply(String response) {
        if (response == null) {
            return "";
        }
        String trimmed = response.trim();
        Matcher opening = OPENING_FENCE.matcher(trimmed);
        if (opening.find()) {
            LOGGER.debug("Removing Markdown code fence (declared language '{}') from reply", opening.group(1));
            trimmed = trimmed.substring(opening.end());
            if (trimmed.endsWith(FENCE)) {
                trimmed = trimmed.substring(0, trimmed.length() - FENCE.length());
            }
            trimmed = trimmed.trim();
        } else if (trimmed.endsWith(FENCE)) {
            trimmed = trimmed.substring(0, trimmed.length() - FENCE.length()).trim();
        }
        if (trimmed.length() > 1 && trimmed.startsWith("`") && trimmed.endsWith("`")) {
            LOGGER.debug("Removing single backtick fences from reply");
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        String sanitised = trimmed.replace(LEFT_DOUBLE_QUOTE, '"').replace(RIGHT_DOUBLE_QUOTE, '"');
        if (sanitised.length() != response.length()) {
            LOGGER.debug("Reply sanitised from {} to {} characters", response.length(), sanitised.length());
        }
        return sanitised;
    }
}
