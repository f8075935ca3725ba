package dev.pekelund.invoice.parser;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;

/**
 * The system instruction and the extraction instructions sent with every page image.
 */
public record InvoicePromptTemplate(String systemText, String instructions) {

    public static final String DEFAULT_LOCATION = "prompts/invoice-extraction.txt";
    public static final String DEFAULT_SYSTEM_TEXT = "You are an AI specialized in invoice data extraction.";

    public InvoicePromptTemplate {
        if (!StringUtils.hasText(systemText) || !StringUtils.hasText(instructions)) {
            throw new IllegalArgumentException("Prompt system text and instructions must not be empty");
        }
    }

    public static InvoicePromptTemplate fromClasspath() {
        return load(new ClassPathResource(DEFAULT_LOCATION));
    }

    static InvoicePromptTemplate load(Resource resource) {
        try (InputStream input = resource.getInputStream()) {
            return new InvoicePromptTemplate(DEFAULT_SYSTEM_TEXT,
                StreamUtils.copyToString(input, StandardCharsets.UTF_8).strip());
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to read prompt template " + resource.getDescription(), ex);
        }
    }
}
