package com.eainde.expedition.inference;

import com.eainde.expedition.error.BackendRejectedException;
import com.eainde.expedition.error.InferenceTimeoutException;
import com.eainde.expedition.error.MalformedResponseException;
import com.eainde.expedition.error.TransientBackendException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.request.ResponseFormatType;
import dev.langchain4j.model.chat.response.ChatResponse;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link InferenceClient} over langchain4j chat models, one model per tier. Requests use a JSON response format
 * bound to the request's schema.
 */
@Log4j2
public class ChatModelInferenceClient implements InferenceClient {

    private final Map<InferenceTier, ChatModel> models;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public ChatModelInferenceClient(Map<InferenceTier, ChatModel> models, ObjectMapper objectMapper, Duration timeout) {
        this.models = new EnumMap<>(models);
        this.objectMapper = objectMapper;
        this.timeout = timeout;
        for (InferenceTier tier : InferenceTier.values()) {
            if (!this.models.containsKey(tier)) {
                throw new IllegalArgumentException("No chat model configured for " + tier);
            }
        }
    }

    @Override
    public <T> T invoke(InferenceRequest request, Class<T> responseType) {
        String text = chat(request);
        JsonNode json = parse(request, text);
        try {
            return objectMapper.treeToValue(json, responseType);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedResponseException(request.malformedCode(),
                    request.promptName() + " response does not match " + responseType.getSimpleName()
                            + ": " + e.getMessage(), e);
        }
    }

    private String chat(InferenceRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.systemPrompt()));
        }
        messages.add(UserMessage.from(request.userPrompt()));

        ChatRequest chatRequest = ChatRequest.builder()
                .messages(messages)
                .responseFormat(ResponseFormat.builder()
                        .type(ResponseFormatType.JSON)
                        .jsonSchema(request.schema())
                        .build())
                .build();

        ChatResponse response;
        try {
            response = models.get(request.tier()).chat(chatRequest);
        } catch (RuntimeException e) {
            if (isTimeout(e)) {
                throw new InferenceTimeoutException(request.promptName(), timeout, e);
            }
            if (isTransient(e)) {
                throw new TransientBackendException(request.promptName() + " call failed: " + e.getMessage(), e);
            }
            throw new BackendRejectedException(request.promptName() + " call rejected: " + e.getMessage(), e);
        }

        if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
            throw new MalformedResponseException(request.malformedCode(), request.promptName() + " returned no text");
        }
        return response.aiMessage().text();
    }

    private JsonNode parse(InferenceRequest request, String text) {
        String body = stripFences(text);
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || !node.isObject()) {
                throw new MalformedResponseException(request.malformedCode(),
                        request.promptName() + " returned a non-object JSON value");
            }
            return node;
        } catch (JsonProcessingException e) {
            log.debug("Unparseable {} response: {}", request.promptName(), body);
            throw new MalformedResponseException(request.malformedCode(),
                    request.promptName() + " returned invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static String stripFences(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closing = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) {
                return trimmed.substring(firstNewline + 1, closing).trim();
            }
        }
        return trimmed;
    }

    /** Rate limits, 5xx responses and I/O failures; anything else, e.g. a 401 or a 400, is not worth retrying. */
    static boolean isTransient(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof AuthenticationException
                    || t instanceof InvalidRequestException
                    || t instanceof ModelNotFoundException) {
                return false;
            }
            if (t instanceof HttpException http) {
                int status = http.statusCode();
                return status == 429 || status >= 500;
            }
            if (t instanceof RateLimitException
                    || t instanceof InternalServerException
                    || t instanceof IOException
                    || t instanceof UncheckedIOException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TimeoutException
                    || t instanceof SocketTimeoutException
                    || t instanceof HttpTimeoutException
                    || t.getClass().getSimpleName().contains("Timeout")) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
