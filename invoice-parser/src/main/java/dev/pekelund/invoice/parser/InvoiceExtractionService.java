package dev.pekelund.invoice.parser;

import dev.pekelund.invoice.model.InvoiceData;
import dev.pekelund.invoice.parser.pdf.PdfPageRenderer;
import dev.pekelund.invoice.reconcile.InvoiceResponseReconciler;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Runs one extraction request: stages the uploaded document in the upload directory,
 * renders its first page, asks the vision model for JSON and reconciles the reply into an
 * {@link InvoiceData}. The staged file is removed whether or not extraction succeeds.
 */
public class InvoiceExtractionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceExtractionService.class);

    static final Set<String> ALLOWED_EXTENSIONS = Set.of("pdf");

    private final InvoiceProcessingSettings settings;
    private final PdfPageRenderer pageRenderer;
    private final AIInvoiceExtractor extractor;
    private final InvoiceResponseReconciler reconciler;

    public InvoiceExtractionService(InvoiceProcessingSettings settings, PdfPageRenderer pageRenderer,
        AIInvoiceExtractor extractor, InvoiceResponseReconciler reconciler) {
        this.settings = settings;
        this.pageRenderer = pageRenderer;
        this.extractor = extractor;
        this.reconciler = reconciler;
    }

    public InvoiceData extract(String base64Data, String extension) {
        String normalisedExtension = normaliseExtension(extension);
        if (!ALLOWED_EXTENSIONS.contains(normalisedExtension)) {
            throw new InvalidInvoiceRequestException(String.format(
                "Unsupported file extension '%s'. Allowed extensions: %s", extension, String.join(", ",
                    ALLOWED_EXTENSIONS)));
        }
        byte[] document = decode(base64Data);
        if (document.length == 0) {
            throw new InvalidInvoiceRequestException("File data must not be empty.");
        }
        return extractDocument(document, normalisedExtension);
    }

    InvoiceData extractDocument(byte[] document, String extension) {
        Path file = settings.uploadDirectory().resolve(UUID.randomUUID() + "." + extension);
        try {
            InvoiceProcessingMdc.setStage("stage");
            stage(file, document);

            InvoiceProcessingMdc.setStage("render");
            byte[] pageImage = pageRenderer.renderFirstPage(file);

            InvoiceProcessingMdc.setStage("model");
            String reply = extractor.extract(pageImage);

            InvoiceProcessingMdc.setStage("reconcile");
            InvoiceData invoice = reconciler.reconcile(reply);
            LOGGER.info("Extracted invoice '{}' with {} line items",
                invoice.invoiceMetadata() != null ? invoice.invoiceMetadata().invoiceNumber() : null,
                invoice.lineItems().size());
            return invoice;
        } finally {
            InvoiceProcessingMdc.setStage("cleanup");
            delete(file);
        }
    }

    private void stage(Path file, byte[] document) {
        try {
            Files.createDirectories(file.getParent());
            writeDocument(file, document);
        } catch (IOException ex) {
            throw new UncheckedIOException("Unable to stage uploaded document in " + file.getParent(), ex);
        }
        LOGGER.info("Staged uploaded document as '{}' ({} bytes)", file, document.length);
    }

    void writeDocument(Path file, byte[] document) throws IOException {
        Files.write(file, document);
    }

    private void delete(Path file) {
        try {
            if (Files.deleteIfExists(file)) {
                LOGGER.info("Temporary file '{}' deleted", file);
            }
        } catch (IOException ex) {
            LOGGER.error("Failed to delete temporary file '{}'", file, ex);
        }
    }

    private static byte[] decode(String base64Data) {
        try {
            return Base64.getMimeDecoder().decode(base64Data);
        } catch (IllegalArgumentException ex) {
            throw new InvalidInvoiceRequestException("Invalid base64-encoded file data.", ex);
        }
    }

    static String normaliseExtension(String extension) {
        if (!StringUtils.hasText(extension)) {
            return "";
        }
        return extension.trim().replace(".", "").toLowerCase(Locale.ROOT);
    }
}
