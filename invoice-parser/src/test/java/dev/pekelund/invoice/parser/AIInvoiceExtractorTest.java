package dev.pekelund.invoice.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.util.MimeTypeUtils;

@ExtendWith(MockitoExtension.class)
class AIInvoiceExtractorTest {

    private static final byte[] PAGE_IMAGE = {(byte) 0xFF, (byte) 0xD8, 0x10, 0x20};

    @Mock
    private ChatModel chatModel;

    private ChatOptions chatOptions;
    private AIInvoiceExtractor extractor;

    @BeforeEach
    void setUp() {
        chatOptions = ChatOptions.builder().model("gpt-4o").maxTokens(4095).build();
        InvoicePromptTemplate template = new InvoicePromptTemplate("You extract invoices.", "Return JSON.");
        extractor = new AIInvoiceExtractor(chatModel, chatOptions, template);
    }

    @Test
    void sendsPageImageWithInstructions() {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("{\"document_type\": \"invoice\"}"));

        String reply = extractor.extract(PAGE_IMAGE);

        assertThat(reply).isEqualTo("{\"document_type\": \"invoice\"}");
        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(chatModel).call(captor.capture());
        Prompt prompt = captor.getValue();
        assertThat(prompt.getOptions()).isSameAs(chatOptions);
        List<Message> messages = prompt.getInstructions();
        assertThat(messages).hasSize(2);
        assertThat(messages.get(0)).isInstanceOf(SystemMessage.class);
        assertThat(messages.get(0).getText()).isEqualTo("You extract invoices.");
        assertThat(messages.get(1)).isInstanceOfSatisfying(UserMessage.class, user -> {
            assertThat(user.getText()).isEqualTo("Return JSON.");
            assertThat(user.getMedia()).hasSize(1);
            Media media = user.getMedia().get(0);
            assertThat(media.getMimeType()).isEqualTo(MimeTypeUtils.IMAGE_JPEG);
            assertThat(media.getData()).isEqualTo(PAGE_IMAGE);
        });
    }

    @Test
    void rejectsEmptyReply() {
        when(chatModel.call(any(Prompt.class))).thenReturn(reply("  "));

        assertThatThrownBy(() -> extractor.extract(PAGE_IMAGE))
            .isInstanceOf(InvoiceExtractionException.class)
            .hasMessageContaining("empty reply");
    }

    @Test
    void wrapsModelFailures() {
        IllegalStateException failure = new IllegalStateException("OpenAI chat completion request failed");
        when(chatModel.call(any(Prompt.class))).thenThrow(failure);

        assertThatThrownBy(() -> extractor.extract(PAGE_IMAGE))
            .isInstanceOf(InvoiceExtractionException.class)
            .hasCause(failure);
    }

    @Test
    void rejectsEmptyImage() {
        assertThatThrownBy(() -> extractor.extract(new byte[0])).isInstanceOf(InvoiceExtractionException.class);

        verifyNoInteractions(chatModel);
    }

    private static ChatResponse reply(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }
}
