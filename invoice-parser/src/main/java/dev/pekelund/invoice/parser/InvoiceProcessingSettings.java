package dev.pekelund.invoice.parser;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Configuration values resolved for the invoice extraction service: where uploaded
 * documents are staged and how the first page is rasterised before it is sent to the model.
 */
public record InvoiceProcessingSettings(
    Path uploadDirectory,
    int renderDpi,
    int renderWidth,
    int renderHeight,
    float jpegQuality
) {

    static final String DEFAULT_UPLOAD_DIRECTORY = "./uploads";
    static final int DEFAULT_RENDER_DPI = 200;
    static final int DEFAULT_RENDER_WIDTH = 800;
    static final int DEFAULT_RENDER_HEIGHT = 800;
    static final float DEFAULT_JPEG_QUALITY = 0.7f;

    public InvoiceProcessingSettings {
        Objects.requireNonNull(uploadDirectory, "uploadDirectory");
        if (renderDpi <= 0 || renderWidth <= 0 || renderHeight <= 0) {
            throw new IllegalStateException(String.format(
                "Render settings must be positive (dpi=%d, width=%d, height=%d)", renderDpi, renderWidth, renderHeight));
        }
        if (jpegQuality <= 0f || jpegQuality > 1f) {
            throw new IllegalStateException("JPEG quality must be in (0, 1] but was " + jpegQuality);
        }
    }

    public static InvoiceProcessingSettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    static InvoiceProcessingSettings fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");

        String uploadDirectory = firstNonEmpty(env.get("INVOICE_UPLOAD_DIR"), DEFAULT_UPLOAD_DIRECTORY);
        int dpi = parseInt(env, "INVOICE_RENDER_DPI", DEFAULT_RENDER_DPI);
        int width = parseInt(env, "INVOICE_RENDER_WIDTH", DEFAULT_RENDER_WIDTH);
        int height = parseInt(env, "INVOICE_RENDER_HEIGHT", DEFAULT_RENDER_HEIGHT);
        float quality = parseFloat(env, "INVOICE_JPEG_QUALITY", DEFAULT_JPEG_QUALITY);

        return new InvoiceProcessingSettings(Path.of(uploadDirectory), dpi, width, height, quality);
    }

    private static int parseInt(Map<String, String> env, String key, int defaultValue) {
        String value = env.get(key);
        if (!StringUtils.hasText(value)) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(String.format("%s must be an integer but was '%s'", key, value), ex);
        }
    }

    private static float parseFloat(Map<String, String> env, String key, float defaultValue) {
        String value = env.get(key);
        if (!StringUtils.hasText(value)) {
            return defaultValue;
        }
        try {
            return Float.parseFloat(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalStateException(String.format("%s must be a number but was '%s'", key, value), ex);
        }
    }

    private static String firstNonEmpty(String... values) {
        for (String value : values) {
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }
}
