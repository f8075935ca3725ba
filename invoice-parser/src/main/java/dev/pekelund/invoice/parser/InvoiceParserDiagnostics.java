package dev.pekelund.invoice.parser;

import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Emits diagnostic logging when the service boots so the deployed configuration can be
 * verified from the logs.
 */
@Component
public class InvoiceParserDiagnostics implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceParserDiagnostics.class);

    private final Environment environment;
    private final ObjectProvider<ChatOptions> chatOptionsProvider;
    private final ObjectProvider<InvoiceProcessingSettings> settingsProvider;

    public InvoiceParserDiagnostics(Environment environment,
        ObjectProvider<ChatOptions> chatOptionsProvider,
        ObjectProvider<InvoiceProcessingSettings> settingsProvider) {
        this.environment = environment;
        this.chatOptionsProvider = chatOptionsProvider;
        this.settingsProvider = settingsProvider;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Invoice parser diagnostics starting");
        LOGGER.info("Active Spring profiles: {}", Arrays.toString(environment.getActiveProfiles()));
        LOGGER.info("Resolved OpenAI base URL: {}", environment.getProperty("openai.base-url", "(default)"));

        ChatOptions chatOptions = chatOptionsProvider.getIfAvailable();
        if (chatOptions != null) {
            LOGGER.info("Resolved chat options - model: {}, maxTokens: {}, temperature: {}", chatOptions.getModel(),
                chatOptions.getMaxTokens(), chatOptions.getTemperature());
        } else {
            LOGGER.info("ChatOptions bean not available; skipping chat options diagnostics");
        }

        InvoiceProcessingSettings settings = settingsProvider.getIfAvailable();
        if (settings != null) {
            LOGGER.info("Upload directory: {} - render {} DPI to {}x{} at JPEG quality {}",
                settings.uploadDirectory().toAbsolutePath(), settings.renderDpi(), settings.renderWidth(),
                settings.renderHeight(), settings.jpegQuality());
        }
    }
}
