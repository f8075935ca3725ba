package dev.pekelund.invoice.parser;

import dev.pekelund.invoice.InvoiceReconciliationException;
import dev.pekelund.invoice.model.FieldValidationException;
import dev.pekelund.invoice.model.InvoiceData;
import dev.pekelund.invoice.parser.pdf.PdfRenderingException;
import dev.pekelund.invoice.reconcile.MalformedResponseException;
import dev.pekelund.invoice.reconcile.SchemaMismatchException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoint that accepts a base64-encoded invoice document and answers with the
 * reconciled invoice record.
 */
@RestController
public class InvoiceExtractionController {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceExtractionController.class);

    static final String REQUEST_ID_HEADER = "X-Request-Id";

    private final InvoiceExtractionService extractionService;

    public InvoiceExtractionController(InvoiceExtractionService extractionService) {
        this.extractionService = extractionService;
    }

    @PostMapping(path = "/extract", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public InvoiceData extract(@Valid @RequestBody InvoiceRequest request,
        @RequestHeader(name = REQUEST_ID_HEADER, required = false) String requestId) {

        String resolvedRequestId = StringUtils.hasText(requestId) ? requestId : UUID.randomUUID().toString();
        try (InvoiceProcessingMdc.Context ignored = InvoiceProcessingMdc.open(resolvedRequestId)) {
            InvoiceProcessingMdc.setStage("request");
            LOGGER.info("Received extraction request for a '{}' document ({} base64 characters)", request.ext(),
                request.data().length());
            return extractionService.extract(request.data(), request.ext());
        }
    }

    @ExceptionHandler(InvalidInvoiceRequestException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidRequest(InvalidInvoiceRequestException exception) {
        LOGGER.warn("Rejected extraction request: {}", exception.getMessage());
        return errorBody(exception.getMessage(), "invalid_request", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(MethodArgumentNotValidException exception) {
        String message = exception.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining("; "));
        LOGGER.warn("Rejected extraction request: {}", message);
        return errorBody(message, "invalid_request", null);
    }

    @ExceptionHandler({SchemaMismatchException.class, FieldValidationException.class})
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleUnprocessableReply(InvoiceReconciliationException exception) {
        LOGGER.warn("Model reply could not be reconciled at '{}': {}", exception.getPath(), exception.getMessage());
        String kind = exception instanceof SchemaMismatchException ? "schema_mismatch" : "validation_error";
        return errorBody(exception.getMessage(), kind, exception.getPath());
    }

    @ExceptionHandler(MalformedResponseException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleMalformedReply(MalformedResponseException exception) {
        LOGGER.error("Model reply was not valid JSON (line {}, column {}): {}", exception.getLine(),
            exception.getColumn(), exception.getReason());
        return errorBody(exception.getMessage(), "malformed_response", exception.getPath());
    }

    @ExceptionHandler(PdfRenderingException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleRenderingFailure(PdfRenderingException exception) {
        LOGGER.error("Invoice document could not be rendered", exception);
        return errorBody(exception.getMessage(), "rendering_failed", null);
    }

    @ExceptionHandler(InvoiceExtractionException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleExtractionFailure(InvoiceExtractionException exception) {
        LOGGER.error("Invoice extraction failed: {}", exception.getMessage());
        return errorBody(exception.getMessage(), "model_failed", null);
    }

    @ExceptionHandler(UncheckedIOException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleStorageFailure(UncheckedIOException exception) {
        LOGGER.error("Uploaded document could not be staged", exception);
        return errorBody(exception.getMessage(), "storage_failed", null);
    }

    private static Map<String, Object> errorBody(String message, String kind, String path) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("kind", kind);
        if (path != null) {
            body.put("path", path);
        }
        return body;
    }

    public record InvoiceRequest(@NotBlank String data, @NotBlank String ext) { }
}
