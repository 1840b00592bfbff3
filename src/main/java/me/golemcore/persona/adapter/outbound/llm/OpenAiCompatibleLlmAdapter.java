package me.golemcore.persona.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.persona.domain.model.LlmFailureKind;
import me.golemcore.persona.domain.model.LlmResult;
import me.golemcore.persona.domain.model.Message;
import me.golemcore.persona.domain.model.QueryPayload;
import me.golemcore.persona.domain.model.ResponderConfig;
import me.golemcore.persona.infrastructure.http.FeignClientFactory;
import me.golemcore.persona.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * LLM adapter for OpenAI-compatible chat-completion APIs using Feign + OkHttp.
 *
 * <p>
 * The request carries the system and character prompts as leading
 * {@code system} messages, then one message per history turn. User turns are
 * prefixed with a sender header {@code name(id) | yyyy-MM-dd HH:mm:ss}; image
 * and sticker turns whose content is an http(s) URL are sent as multi-part
 * content. Hyperparameters are copied into the request body unchanged.
 *
 * <p>
 * One Feign client is kept per endpoint URL and timeout. Every failure is
 * returned as a classified {@link LlmResult}; nothing is thrown to the caller.
 *
 * @see LlmErrorClassifier
 * @see me.golemcore.persona.infrastructure.http.FeignClientFactory
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAiCompatibleLlmAdapter implements LlmPort {

    private static final String ROLE_SYSTEM = "system";
    private static final String FINISH_REASON_LENGTH = "length";
    private static final DateTimeFormatter HEADER_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final FeignClientFactory feignClientFactory;
    private final Clock clock;

    private final Map<String, ChatCompletionsApi> clients = new ConcurrentHashMap<>();

    @Override
    public LlmResult complete(QueryPayload payload, ResponderConfig.LlmApiSettings api, Duration timeout) {
        ChatCompletionRequest request = buildRequest(payload, api.model());
        log.debug("[LLM] Sending {} messages to {} (model {})", request.getMessages().size(), api.url(),
                api.model());

        ChatCompletionResponse response;
        try {
            response = clientFor(api.url(), timeout).chatCompletion(
                    api.apiKey() != null ? api.apiKey() : "", request);
        } catch (RuntimeException e) { // NOSONAR - every failure becomes a classified result
            LlmFailureKind kind = LlmErrorClassifier.classifyThrowable(e);
            log.warn("[LLM] Request failed: {} ({})", kind, e.getMessage());
            return LlmResult.failure(kind, e.getMessage());
        }
        return extractReply(response);
    }

    private ChatCompletionsApi clientFor(String url, Duration timeout) {
        String cacheKey = url + "|" + timeout.toMillis();
        return clients.computeIfAbsent(cacheKey,
                k -> feignClientFactory.create(ChatCompletionsApi.class, url, timeout));
    }

    ChatCompletionRequest buildRequest(QueryPayload payload, String model) {
        ChatCompletionRequest request = new ChatCompletionRequest();
        request.setModel(model);
        request.setStream(false);

        List<ApiMessage> messages = new ArrayList<>();
        addSystemMessage(messages, payload.getSystemPrompt());
        addSystemMessage(messages, payload.getCharacterPrompt());
        for (Message message : payload.getHistory()) {
            messages.add(toApiMessage(message));
        }
        request.setMessages(messages);

        if (payload.getModelParams() != null) {
            request.getParameters().putAll(payload.getModelParams());
        }
        return request;
    }

    private void addSystemMessage(List<ApiMessage> messages, String prompt) {
        if (prompt != null && !prompt.isBlank()) {
            messages.add(new ApiMessage(ROLE_SYSTEM, prompt));
        }
    }

    private ApiMessage toApiMessage(Message message) {
        if (!message.isUserMessage()) {
            return new ApiMessage(message.getRole(), message.getContent());
        }

        String header = senderHeader(message);
        String content = message.getContent() != null ? message.getContent() : "";
        if (message.resolveKind().isVisual() && isHttpUrl(content)) {
            List<ContentPart> parts = List.of(ContentPart.text(header), ContentPart.image(content.trim()));
            return new ApiMessage(message.getRole(), parts);
        }
        return new ApiMessage(message.getRole(), header + "\n" + content);
    }

    private String senderHeader(Message message) {
        String name = message.getSenderName() != null ? message.getSenderName() : "unknown";
        String id = message.getSenderId() != null ? String.valueOf(message.getSenderId()) : "?";
        String time = message.getTimestamp() != null
                ? HEADER_TIME_FORMAT.format(message.getTimestamp().atZone(clock.getZone()))
                : "";
        return name + "(" + id + ") | " + time;
    }

    private static boolean isHttpUrl(String content) {
        String trimmed = content.trim();
        return trimmed.startsWith("http://") || trimmed.startsWith("https://");
    }

    private LlmResult extractReply(ChatCompletionResponse response) {
        if (response == null || response.getChoices() == null || response.getChoices().isEmpty()) {
            log.error("[LLM] Response has no choices");
            return LlmResult.failure(LlmFailureKind.MALFORMED_RESPONSE, "response has no choices");
        }
        ChatChoice choice = response.getChoices().get(0);
        if (choice.getMessage() == null || choice.getMessage().getContent() == null
                || choice.getMessage().getContent().isBlank()) {
            log.error("[LLM] Response choice has no message content");
            return LlmResult.failure(LlmFailureKind.MALFORMED_RESPONSE, "choice has no message content");
        }
        if (FINISH_REASON_LENGTH.equals(choice.getFinishReason())) {
            log.warn("[LLM] Response truncated by max_tokens (model {})", response.getModel());
        }
        if (response.getUsage() != null) {
            log.debug("[LLM] Usage: prompt={}, completion={}, total={}", response.getUsage().getPromptTokens(),
                    response.getUsage().getCompletionTokens(), response.getUsage().getTotalTokens());
        }
        return LlmResult.success(choice.getMessage().getContent());
    }

    // Feign API interface
    public interface ChatCompletionsApi {
        @RequestLine("POST /chat/completions")
        @Headers({
                "Content-Type: application/json",
                "Accept: application/json",
                "Authorization: Bearer {apiKey}"
        })
        ChatCompletionResponse chatCompletion(@Param("apiKey") String apiKey, ChatCompletionRequest request);
    }

    // API DTOs
    @Data
    @JsonPropertyOrder({ "model", "messages", "stream" })
    public static class ChatCompletionRequest {
        private String model;
        private List<ApiMessage> messages;
        private boolean stream;
        private Map<String, Object> parameters = new LinkedHashMap<>();

        @JsonAnyGetter
        public Map<String, Object> getParameters() {
            return parameters;
        }
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ApiMessage {
        private String role;
        private Object content; // String or List<ContentPart>

        public ApiMessage() {
        }

        public ApiMessage(String role, Object content) {
            this.role = role;
            this.content = content;
        }
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ContentPart {
        private String type;
        private String text;
        @JsonProperty("image_url")
        private ImageUrl imageUrl;

        static ContentPart text(String text) {
            ContentPart part = new ContentPart();
            part.setType("text");
            part.setText(text);
            return part;
        }

        static ContentPart image(String url) {
            ContentPart part = new ContentPart();
            part.setType("image_url");
            ImageUrl imageUrl = new ImageUrl();
            imageUrl.setUrl(url);
            imageUrl.setDetail("auto");
            part.setImageUrl(imageUrl);
            return part;
        }
    }

    @Data
    public static class ImageUrl {
        private String url;
        private String detail;
    }

    @Data
    public static class ChatCompletionResponse {
        private String id;
        private String model;
        private List<ChatChoice> choices;
        private ApiUsage usage;
    }

    @Data
    public static class ChatChoice {
        private int index;
        private ResponseMessage message;
        @JsonProperty("finish_reason")
        private String finishReason;
    }

    @Data
    public static class ResponseMessage {
        private String role;
        private String content;
    }

    @Data
    public static class ApiUsage {
        @JsonProperty("prompt_tokens")
        private int promptTokens;
        @JsonProperty("completion_tokens")
        private int completionTokens;
        @JsonProperty("total_tokens")
        private int totalTokens;
    }
}
