package dev.pekelund.invoice.parser;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;

/**
 * Sends a rendered invoice page to the vision model and returns its raw reply. The reply is
 * not interpreted here; reconciling it into an invoice record is left to the caller.
 */
public class AIInvoiceExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(AIInvoiceExtractor.class);

    private final ChatModel chatModel;
    private final ChatOptions chatOptions;
    private final InvoicePromptTemplate promptTemplate;

    public AIInvoiceExtractor(ChatModel chatModel, ChatOptions chatOptions,
        InvoicePromptTemplate promptTemplate) {
        this.chatModel = chatModel;
        this.chatOptions = chatOptions;
        this.promptTemplate = promptTemplate;
    }

    public String extract(byte[] pageImage) {
        if (pageImage == null || pageImage.length == 0) {
            throw new InvoiceExtractionException("Cannot extract invoice data from an empty page image");
        }

        Media page = Media.builder()
            .mimeType(MimeTypeUtils.IMAGE_JPEG)
            .data(pageImage)
            .build();
        UserMessage userMessage = UserMessage.builder()
            .text(promptTemplate.instructions())
            .media(List.of(page))
            .build();
        Prompt prompt = new Prompt(List.of(new SystemMessage(promptTemplate.systemText()), userMessage), chatOptions);

        LOGGER.info("AIInvoiceExtractor invoking model '{}' with a {} byte page image", chatOptions.getModel(),
            pageImage.length);

        ChatResponse response;
        try {
            response = chatModel.call(prompt);
        } catch (RuntimeException ex) {
            LOGGER.error("Vision model call failed", ex);
            throw new InvoiceExtractionException("Vision model call failed: " + ex.getMessage(), ex);
        }

        String reply = response != null && response.getResult() != null && response.getResult().getOutput() != null
            ? response.getResult().getOutput().getText()
            : null;
        if (!StringUtils.hasText(reply)) {
            throw new InvoiceExtractionException("Vision model returned an empty reply");
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Vision model raw reply: {}", reply);
        }
        return reply;
    }
}
