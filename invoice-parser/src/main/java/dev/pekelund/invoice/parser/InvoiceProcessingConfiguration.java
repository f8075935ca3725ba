package dev.pekelund.invoice.parser;

import dev.pekelund.invoice.parser.openai.OpenAiVisionChatModel;
import dev.pekelund.invoice.parser.pdf.PdfPageRenderer;
import dev.pekelund.invoice.reconcile.InvoiceResponseReconciler;
import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Service configuration for the invoice extraction workload.
 */
@Configuration
public class InvoiceProcessingConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceProcessingConfiguration.class);

    static final String DEFAULT_MODEL = "gpt-4o";
    static final int DEFAULT_MAX_TOKENS = 4095;

    @Bean
    public InvoiceProcessingSettings invoiceProcessingSettings() {
        return InvoiceProcessingSettings.fromEnvironment();
    }

    @Bean
    public ChatOptions invoiceChatOptions(Environment environment) {
        String modelName = environment.getProperty("openai.model", DEFAULT_MODEL);
        Integer maxTokens = environment.getProperty("openai.max-tokens", Integer.class, DEFAULT_MAX_TOKENS);
        Double temperature = environment.getProperty("openai.temperature", Double.class);
        LOGGER.info("Configured OpenAI chat settings - model: {}, maxTokens: {}, temperature: {}", modelName,
            maxTokens, temperature);
        return ChatOptions.builder()
            .model(modelName)
            .maxTokens(maxTokens)
            .temperature(temperature)
            .build();
    }

    @Bean
    public OpenAiVisionChatModel openAiVisionChatModel(Environment environment,
        ChatOptions invoiceChatOptions, ObjectProvider<ObservationRegistry> observationRegistry) {

        String apiKey = environment.getProperty("OPENAI_API_KEY");
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalStateException("OpenAI API key must be configured (OPENAI_API_KEY)");
        }

        ObservationRegistry resolvedObservationRegistry = observationRegistry
            .getIfAvailable(() -> ObservationRegistry.NOOP);

        String baseUrl = environment.getProperty("openai.base-url", OpenAiVisionChatModel.DEFAULT_BASE_URL);
        RestClient restClient = RestClient.builder().baseUrl(baseUrl).build();

        OpenAiVisionChatModel chatModel = new OpenAiVisionChatModel(restClient, apiKey, invoiceChatOptions,
            resolvedObservationRegistry);
        LOGGER.info("OpenAI ChatModel created for model '{}' at {}", chatModel.getDefaultOptions().getModel(),
            baseUrl);
        return chatModel;
    }

    @Bean
    public InvoicePromptTemplate invoicePromptTemplate() {
        return InvoicePromptTemplate.fromClasspath();
    }

    @Bean
    public AIInvoiceExtractor aiInvoiceExtractor(ChatModel chatModel, ChatOptions invoiceChatOptions,
        InvoicePromptTemplate invoicePromptTemplate) {
        return new AIInvoiceExtractor(chatModel, invoiceChatOptions, invoicePromptTemplate);
    }

    @Bean
    public PdfPageRenderer pdfPageRenderer(InvoiceProcessingSettings invoiceProcessingSettings) {
        return new PdfPageRenderer(invoiceProcessingSettings.renderDpi(), invoiceProcessingSettings.renderWidth(),
            invoiceProcessingSettings.renderHeight(), invoiceProcessingSettings.jpegQuality());
    }

    @Bean
    public InvoiceResponseReconciler invoiceResponseReconciler() {
        return new InvoiceResponseReconciler();
    }

    @Bean
    public InvoiceExtractionService invoiceExtractionService(InvoiceProcessingSettings invoiceProcessingSettings,
        PdfPageRenderer pdfPageRenderer, AIInvoiceExtractor aiInvoiceExtractor,
        InvoiceResponseReconciler invoiceResponseReconciler) {
        return new InvoiceExtractionService(invoiceProcessingSettings, pdfPageRenderer, aiInvoiceExtractor,
            invoiceResponseReconciler);
    }
}
