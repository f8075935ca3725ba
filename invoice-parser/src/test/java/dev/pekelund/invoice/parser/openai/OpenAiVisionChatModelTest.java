package dev.pekelund.invoice.parser.openai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationHandler;
import io.micrometer.observation.ObservationRegistry;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.util.MimeTypeUtils;
import org.springframework.web.client.RestClient;

class OpenAiVisionChatModelTest {

    private static final String BASE_URL = "https://openai.test/v1";
    private static final byte[] PAGE_IMAGE = {(byte) 0xFF, (byte) 0xD8, 0x42};

    private static final String COMPLETION = """
        {
          "id": "chatcmpl-1",
          "object": "chat.completion",
          "choices": [
            {"index": 0, "message": {"role": "assistant", "content": "{\\"document_type\\": \\"invoice\\"}"},
             "finish_reason": "stop"}
          ],
          "usage": {"prompt_tokens": 10, "completion_tokens": 5, "total_tokens": 15}
        }
        """;

    private MockRestServiceServer server;
    private OpenAiVisionChatModel chatModel;
    private final List<String> observations = new ArrayList<>();

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        ObservationRegistry registry = ObservationRegistry.create();
        registry.observationConfig().observationHandler(new RecordingHandler());
        ChatOptions defaults = ChatOptions.builder().model("gpt-4o").maxTokens(4095).build();
        chatModel = new OpenAiVisionChatModel(builder.build(), "test-key", defaults, registry);
    }

    @Test
    void postsVisionRequestAndReturnsFirstChoice() {
        String dataUri = "data:image/jpeg;base64," + Base64.getEncoder().encodeToString(PAGE_IMAGE);
        server.expect(requestTo(BASE_URL + "/chat/completions"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer test-key"))
            .andExpect(jsonPath("$.model").value("gpt-4o"))
            .andExpect(jsonPath("$.max_tokens").value(4095))
            .andExpect(jsonPath("$.temperature").doesNotExist())
            .andExpect(jsonPath("$.messages[0].role").value("system"))
            .andExpect(jsonPath("$.messages[0].content").value("You extract invoices."))
            .andExpect(jsonPath("$.messages[1].role").value("user"))
            .andExpect(jsonPath("$.messages[1].content[0].type").value("text"))
            .andExpect(jsonPath("$.messages[1].content[0].text").value("Return JSON."))
            .andExpect(jsonPath("$.messages[1].content[1].type").value("image_url"))
            .andExpect(jsonPath("$.messages[1].content[1].image_url.url").value(dataUri))
            .andRespond(withSuccess(COMPLETION, MediaType.APPLICATION_JSON));

        ChatResponse response = chatModel.call(visionPrompt(null));

        assertThat(response.getResult().getOutput().getText()).isEqualTo("{\"document_type\": \"invoice\"}");
        assertThat(observations).containsExactly("openai.chat.call");
        server.verify();
    }

    @Test
    void promptOptionsOverrideDefaults() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
            .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
            .andExpect(jsonPath("$.max_tokens").value(4095))
            .andExpect(jsonPath("$.temperature").value(0.0))
            .andRespond(withSuccess(COMPLETION, MediaType.APPLICATION_JSON));

        chatModel.call(visionPrompt(ChatOptions.builder().model("gpt-4o-mini").temperature(0.0).build()));

        server.verify();
    }

    @Test
    void resolvedOptionsKeepDefaultsForUnsetValues() {
        ChatOptions resolved = chatModel.resolveOptions(ChatOptions.builder()
            .stopSequences(List.of("###"))
            .topP(0.9)
            .build());

        assertThat(resolved.getModel()).isEqualTo("gpt-4o");
        assertThat(resolved.getMaxTokens()).isEqualTo(4095);
        assertThat(resolved.getTopP()).isEqualTo(0.9);
        assertThat(resolved.getStopSequences()).containsExactly("###");
    }

    @Test
    void withoutPromptOptionsTheDefaultsApply() {
        assertThat(chatModel.resolveOptions(null)).isSameAs(chatModel.getDefaultOptions());
    }

    @Test
    void sendsStopSequencesFromPrompt() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
            .andExpect(jsonPath("$.model").value("gpt-4o"))
            .andExpect(jsonPath("$.stop[0]").value("###"))
            .andRespond(withSuccess(COMPLETION, MediaType.APPLICATION_JSON));

        chatModel.call(visionPrompt(ChatOptions.builder().stopSequences(List.of("###")).build()));

        server.verify();
    }

    @Test
    void sendsTextOnlyMessagesAsPlainContent() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
            .andExpect(jsonPath("$.messages[0].content").value("Hello"))
            .andRespond(withSuccess(COMPLETION, MediaType.APPLICATION_JSON));

        chatModel.call(new Prompt(List.of(new UserMessage("Hello"))));

        server.verify();
    }

    @Test
    void failsWhenServerReturnsError() {
        server.expect(requestTo(BASE_URL + "/chat/completions")).andRespond(withServerError());

        assertThatThrownBy(() -> chatModel.call(visionPrompt(null)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("request failed");
    }

    @Test
    void failsWhenResponseHasNoChoices() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
            .andRespond(withSuccess("{\"choices\": []}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> chatModel.call(visionPrompt(null)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("choices");
    }

    @Test
    void rejectsPromptWithoutMessages() {
        assertThatThrownBy(() -> chatModel.call(new Prompt(List.of())))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static Prompt visionPrompt(ChatOptions options) {
        Media page = Media.builder().mimeType(MimeTypeUtils.IMAGE_JPEG).data(PAGE_IMAGE).build();
        UserMessage user = UserMessage.builder().text("Return JSON.").media(List.of(page)).build();
        return new Prompt(List.of(new SystemMessage("You extract invoices."), user), options);
    }

    private final class RecordingHandler implements ObservationHandler<Observation.Context> {

        @Override
        public void onStart(Observation.Context context) {
            observations.add(context.getName());
        }

        @Override
        public boolean supportsContext(Observation.Context context) {
            return true;
        }
    }
}
