package dev.pekelund.invoice.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.pekelund.invoice.model.InvoiceData;
import dev.pekelund.invoice.parser.pdf.PdfPageRenderer;
import dev.pekelund.invoice.parser.pdf.PdfRenderingException;
import dev.pekelund.invoice.reconcile.InvoiceResponseReconciler;
import dev.pekelund.invoice.reconcile.MalformedResponseException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class InvoiceExtractionServiceTest {

    private static final byte[] PDF_BYTES = "%PDF-1.4 test document".getBytes(StandardCharsets.US_ASCII);
    private static final String PDF_BASE64 = Base64.getEncoder().encodeToString(PDF_BYTES);
    private static final byte[] PAGE_IMAGE = {(byte) 0xFF, (byte) 0xD8, 0x01};

    @TempDir
    Path tempDir;

    @Mock
    private PdfPageRenderer pageRenderer;

    @Mock
    private AIInvoiceExtractor extractor;

    private Path uploadDirectory;
    private InvoiceExtractionService service;

    @BeforeEach
    void setUp() {
        uploadDirectory = tempDir.resolve("uploads");
        InvoiceProcessingSettings settings = new InvoiceProcessingSettings(uploadDirectory, 200, 800, 800, 0.7f);
        service = new InvoiceExtractionService(settings, pageRenderer, extractor, new InvoiceResponseReconciler());
    }

    @Test
    void extractsInvoiceAndRemovesStagedFile() throws IOException {
        List<Path> stagedFiles = new ArrayList<>();
        when(pageRenderer.renderFirstPage(any(Path.class))).thenAnswer(invocation -> {
            Path staged = invocation.getArgument(0);
            stagedFiles.add(staged);
            assertThat(staged.getParent()).isEqualTo(uploadDirectory);
            assertThat(staged.getFileName().toString()).endsWith(".pdf");
            assertThat(Files.readAllBytes(staged)).isEqualTo(PDF_BYTES);
            return PAGE_IMAGE;
        });
        when(extractor.extract(PAGE_IMAGE)).thenReturn("""
            ```json
            {"invoice_metadata": {"invoice_number": "INV-9"}, "line_items": [{"description": "Hosting"}]}
            ```""");

        InvoiceData invoice = service.extract(PDF_BASE64, "pdf");

        assertThat(invoice.invoiceMetadata().invoiceNumber()).isEqualTo("INV-9");
        assertThat(invoice.lineItems()).hasSize(1);
        assertThat(stagedFiles).hasSize(1);
        assertThat(stagedFiles.get(0)).doesNotExist();
        assertUploadDirectoryIsEmpty();
    }

    @Test
    void normalisesExtension() {
        when(pageRenderer.renderFirstPage(any(Path.class))).thenReturn(PAGE_IMAGE);
        when(extractor.extract(PAGE_IMAGE)).thenReturn("{}");

        InvoiceData invoice = service.extract(PDF_BASE64, ".PDF");

        assertThat(invoice.lineItems()).isEmpty();
    }

    @Test
    void removesStagedFileWhenRenderingFails() throws IOException {
        when(pageRenderer.renderFirstPage(any(Path.class))).thenThrow(new PdfRenderingException("PDF document has no pages"));

        assertThatThrownBy(() -> service.extract(PDF_BASE64, "pdf")).isInstanceOf(PdfRenderingException.class);

        verifyNoInteractions(extractor);
        assertUploadDirectoryIsEmpty();
    }

    @Test
    void removesPartiallyWrittenFileWhenStagingFails() throws IOException {
        InvoiceProcessingSettings settings = new InvoiceProcessingSettings(uploadDirectory, 200, 800, 800, 0.7f);
        InvoiceExtractionService failingService = new InvoiceExtractionService(settings, pageRenderer, extractor,
            new InvoiceResponseReconciler()) {
            @Override
            void writeDocument(Path file, byte[] document) throws IOException {
                Files.write(file, new byte[] {0x25, 0x50});
                throw new IOException("No space left on device");
            }
        };

        assertThatThrownBy(() -> failingService.extract(PDF_BASE64, "pdf"))
            .isInstanceOf(UncheckedIOException.class)
            .hasMessageContaining("Unable to stage uploaded document");

        verifyNoInteractions(pageRenderer, extractor);
        assertUploadDirectoryIsEmpty();
    }

    @Test
    void removesStagedFileWhenReplyIsMalformed() throws IOException {
        when(pageRenderer.renderFirstPage(any(Path.class))).thenReturn(PAGE_IMAGE);
        when(extractor.extract(PAGE_IMAGE)).thenReturn("{invalid json");

        assertThatThrownBy(() -> service.extract(PDF_BASE64, "pdf")).isInstanceOf(MalformedResponseException.class);

        assertUploadDirectoryIsEmpty();
    }

    @Test
    void rejectsUnsupportedExtension() {
        assertThatThrownBy(() -> service.extract(PDF_BASE64, "docx"))
            .isInstanceOf(InvalidInvoiceRequestException.class)
            .hasMessageContaining("'docx'")
            .hasMessageContaining("pdf");

        verifyNoInteractions(pageRenderer, extractor);
        assertThat(uploadDirectory).doesNotExist();
    }

    @Test
    void rejectsInvalidBase64() {
        assertThatThrownBy(() -> service.extract("QQ=Q", "pdf"))
            .isInstanceOf(InvalidInvoiceRequestException.class)
            .hasMessage("Invalid base64-encoded file data.");

        verifyNoInteractions(pageRenderer, extractor);
    }

    @Test
    void rejectsDataWithoutContent() {
        assertThatThrownBy(() -> service.extract("###", "pdf"))
            .isInstanceOf(InvalidInvoiceRequestException.class)
            .hasMessageContaining("must not be empty");
    }

    @Test
    void acceptsLineWrappedBase64() {
        String wrapped = Base64.getMimeEncoder(8, "\r\n".getBytes(StandardCharsets.US_ASCII)).encodeToString(PDF_BYTES);
        when(pageRenderer.renderFirstPage(any(Path.class))).thenAnswer(invocation -> {
            assertThat(Files.readAllBytes(invocation.<Path>getArgument(0))).isEqualTo(PDF_BYTES);
            return PAGE_IMAGE;
        });
        when(extractor.extract(PAGE_IMAGE)).thenReturn("{}");

        service.extract(wrapped, "pdf");
    }

    private void assertUploadDirectoryIsEmpty() throws IOException {
        try (Stream<Path> files = Files.list(uploadDirectory)) {
            assertThat(files).isEmpty();
        }
    }
}
