package dev.pekelund.invoice.parser.tools;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line helper that writes a PDF as base64 text, ready to be sent as the
 * {@code data} field of an extraction request.
 *
 * <pre>
 * java -cp invoice-parser.jar dev.pekelund.invoice.parser.tools.PdfBase64Encoder invoice.pdf invoice.b64
 * </pre>
 */
public final class PdfBase64Encoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfBase64Encoder.class);

    private PdfBase64Encoder() {
    }

    public static void main(String[] args) throws IOException {
        if (args.length != 2) {
            System.err.println("Usage: PdfBase64Encoder <pdf-file> <output-file>");
            System.exit(1);
        }
        encode(Path.of(args[0]), Path.of(args[1]));
    }

    public static Path encode(Path pdfFile, Path outputFile) throws IOException {
        if (!Files.isRegularFile(pdfFile)) {
            throw new IOException("PDF file not found: " + pdfFile);
        }
        byte[] content = Files.readAllBytes(pdfFile);
        String encoded = Base64.getEncoder().encodeToString(content);
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputFile, encoded, StandardCharsets.US_ASCII);
        LOGGER.info("Encoded '{}' ({} bytes) to '{}' ({} characters)", pdfFile, content.length, outputFile,
            encoded.length());
        return outputFile;
    }
}
