package dev.pekelund.invoice.model;

import org.springframework.util.StringUtils;

/**
 * Builds the dotted field paths used in error messages, e.g. {@code line_items[2].quantity}.
 * The document root is the empty path.
 */
public final class FieldPaths {

    public static final String ROOT = "";

    private FieldPaths() {
    }

    public static String child(String parent, String field) {
        if (!StringUtils.hasLength(parent)) {
            return field;
        }
        return parent + "." + field;
    }

    public static String element(String parent, int index) {
        return (parent == null ? "" : parent) + "[" + index + "]";
    }
}
