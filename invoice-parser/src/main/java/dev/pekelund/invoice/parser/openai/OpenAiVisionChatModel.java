package dev.pekelund.invoice.parser.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.Assert;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link ChatModel} that calls the OpenAI chat completions endpoint with bearer
 * authentication. Media attached to user messages are sent as {@code image_url} parts
 * carrying a base64 data URI, which is how the endpoint accepts page images.
 */
public class OpenAiVisionChatModel implements ChatModel {

    public static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";

    private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiVisionChatModel.class);

    private final RestClient restClient;
    private final String apiKey;
    private final ChatOptions defaultOptions;
    private final ObservationRegistry observationRegistry;

    public OpenAiVisionChatModel(RestClient restClient, String apiKey, ChatOptions defaultOptions,
        ObservationRegistry observationRegistry) {
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.defaultOptions = defaultOptions != null ? defaultOptions : ChatOptions.builder().build();
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    @Override
    public ChatResponse call(Prompt prompt) {
        Assert.notNull(prompt, "Prompt must not be null");
        ChatOptions resolvedOptions = resolveOptions(prompt.getOptions());
        if (!StringUtils.hasText(resolvedOptions.getModel())) {
            throw new IllegalStateException("OpenAI model name must be configured");
        }
        List<ChatMessage> messages = toChatMessages(prompt.getInstructions());
        Observation observation = Observation.start("openai.chat.call", observationRegistry)
            .highCardinalityKeyValue("model", Optional.ofNullable(resolvedOptions.getModel()).orElse("(unset)"));
        try (Observation.Scope scope = observation.openScope()) {
            LOGGER.info("Calling OpenAI model '{}' with {} messages", resolvedOptions.getModel(), messages.size());
            ChatCompletionRequest request = new ChatCompletionRequest(resolvedOptions.getModel(), messages,
                resolvedOptions.getMaxTokens(), resolvedOptions.getTemperature(), resolvedOptions.getTopP(),
                resolvedOptions.getFrequencyPenalty(), resolvedOptions.getPresencePenalty(),
                CollectionUtils.isEmpty(resolvedOptions.getStopSequences()) ? null : resolvedOptions.getStopSequences());
            ChatCompletionResponse response = executeRequest(request);
            String content = extractContent(response);
            return new ChatResponse(List.of(new Generation(new AssistantMessage(content))));
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    @Override
    public ChatOptions getDefaultOptions() {
        return defaultOptions;
    }

    /**
     * Values set on the prompt win over the model defaults. {@code top_k} has no counterpart on
     * the chat completions endpoint and is never sent.
     */
    ChatOptions resolveOptions(ChatOptions promptOptions) {
        if (promptOptions == null) {
            return defaultOptions;
        }
        String model = StringUtils.hasText(promptOptions.getModel()) ? promptOptions.getModel()
            : defaultOptions.getModel();
        List<String> stopSequences = !CollectionUtils.isEmpty(promptOptions.getStopSequences())
            ? promptOptions.getStopSequences() : defaultOptions.getStopSequences();
        return ChatOptions.builder()
            .model(model)
            .maxTokens(preferred(promptOptions.getMaxTokens(), defaultOptions.getMaxTokens()))
            .temperature(preferred(promptOptions.getTemperature(), defaultOptions.getTemperature()))
            .topP(preferred(promptOptions.getTopP(), defaultOptions.getTopP()))
            .frequencyPenalty(preferred(promptOptions.getFrequencyPenalty(), defaultOptions.getFrequencyPenalty()))
            .presencePenalty(preferred(promptOptions.getPresencePenalty(), defaultOptions.getPresencePenalty()))
            .stopSequences(stopSequences)
            .build();
    }

    private static <T> T preferred(T override, T fallback) {
        return override != null ? override : fallback;
    }

    private List<ChatMessage> toChatMessages(List<Message> instructions) {
        if (CollectionUtils.isEmpty(instructions)) {
            throw new IllegalArgumentException("Prompt must contain at least one message");
        }
        List<ChatMessage> messages = new ArrayList<>(instructions.size());
        for (Message message : instructions) {
            MessageType type = message.getMessageType();
            if (type == MessageType.USER && message instanceof UserMessage userMessage
                && !CollectionUtils.isEmpty(userMessage.getMedia())) {
                messages.add(new ChatMessage("user", toContentParts(userMessage)));
            } else {
                messages.add(new ChatMessage(roleOf(type), message.getText()));
            }
        }
        return messages;
    }

    private List<ContentPart> toContentParts(UserMessage message) {
        List<ContentPart> parts = new ArrayList<>();
        if (StringUtils.hasText(message.getText())) {
            parts.add(ContentPart.text(message.getText()));
        }
        for (Media media : message.getMedia()) {
            parts.add(ContentPart.image(toImageUrl(media)));
        }
        return parts;
    }

    private String toImageUrl(Media media) {
        Object data = media.getData();
        if (data instanceof byte[] bytes) {
            return "data:" + media.getMimeType() + ";base64," + Base64.getEncoder().encodeToString(bytes);
        }
        return String.valueOf(data);
    }

    private String roleOf(MessageType type) {
        return switch (type) {
            case SYSTEM -> "system";
            case ASSISTANT -> "assistant";
            case TOOL -> "tool";
            default -> "user";
        };
    }

    private ChatCompletionResponse executeRequest(ChatCompletionRequest request) {
        try {
            return restClient.post()
                .uri("/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(request)
                .retrieve()
                .body(ChatCompletionResponse.class);
        } catch (RestClientException ex) {
            throw new IllegalStateException("OpenAI chat completion request failed", ex);
        }
    }

    private String extractContent(ChatCompletionResponse response) {
        if (response == null || CollectionUtils.isEmpty(response.choices())) {
            throw new IllegalStateException("OpenAI response did not contain any choices");
        }
        ChatCompletionResponse.Choice first = response.choices().get(0);
        if (first == null || first.message() == null || !StringUtils.hasText(first.message().content())) {
            throw new IllegalStateException("OpenAI response did not contain any message content");
        }
        return first.message().content();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record ChatCompletionRequest(
        String model,
        List<ChatMessage> messages,
        @JsonProperty("max_tokens") Integer maxTokens,
        Double temperature,
        @JsonProperty("top_p") Double topP,
        @JsonProperty("frequency_penalty") Double frequencyPenalty,
        @JsonProperty("presence_penalty") Double presencePenalty,
        List<String> stop) {
    }

    /**
     * {@code content} is either plain text or a list of {@link ContentPart}s.
     */
    private record ChatMessage(String role, Object content) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record ContentPart(String type, String text, @JsonProperty("image_url") ImageUrl imageUrl) {

        static ContentPart text(String text) {
            return new ContentPart("text", text, null);
        }

        static ContentPart image(String url) {
            return new ContentPart("image_url", null, new ImageUrl(url));
        }
    }

    private record ImageUrl(String url) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ChatCompletionResponse(List<Choice> choices) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        private record Choice(ResponseMessage message) {
        }

        @JsonIgnoreProperties(ignoreUnknown = true)
        private record ResponseMessage(String role, String content) {
        }
    }
}
