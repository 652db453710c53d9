package com.eainde.nsgx.client;

import com.eainde.nsgx.exception.ExtractionConfigurationException;
import com.eainde.nsgx.model.ExtractionOutcome;
import com.eainde.nsgx.model.FailureKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.log4j.Log4j2;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ExtractionClient} for OpenAI-compatible chat-completion endpoints
 * (DeepSeek chat / reasoner) in JSON-object mode.
 *
 * <h3>Retry policy:</h3>
 * <ul>
 *   <li><b>429</b>: wait for {@code Retry-After} seconds (default when absent), then
 *       re-issue the same request. Unbounded; the server dictates timing.</li>
 *   <li><b>Other non-2xx</b>: permanent failure for this call.</li>
 *   <li><b>Empty body or empty message content</b>: up to {@code emptyContentRetries}
 *       extra attempts with a fixed delay.</li>
 *   <li><b>Unparseable content</b>: permanent failure carrying the raw content.</li>
 *   <li><b>Timeout / transport error</b>: failure, no retry at this level.</li>
 * </ul>
 */
@Log4j2
public class ChatCompletionExtractionClient implements ExtractionClient {

    private static final MediaType JSON = MediaType.get("application/json");

    /** Structured-output mode is only honoured when the conversation mentions this token. */
    private static final String JSON_MARKER = "json";

    private static final String JSON_WRAPPER =
            "Extract information from the following text and return valid JSON: ";

    private static final int LOG_SNIPPET_CHARS = 500;

    private final String endpoint;
    private final String apiKey;
    private final OkHttpClient baseHttpClient;
    private final ObjectMapper objectMapper;
    private final ExtractionResponseParser responseParser;
    private final Sleeper sleeper;
    private final int emptyContentRetries;
    private final Duration emptyContentDelay;
    private final Duration defaultRetryAfter;

    /** One client per timeout; they share the base client's connection pool. */
    private final Map<Duration, OkHttpClient> clientsByTimeout = new ConcurrentHashMap<>();

    private ChatCompletionExtractionClient(Builder builder) {
        if (builder.endpoint == null || builder.endpoint.isBlank()) {
            throw new ExtractionConfigurationException("Extraction endpoint is not configured (DEEPSEEK_ENDPOINT)");
        }
        String lower = builder.endpoint.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            throw new ExtractionConfigurationException(
                    "Extraction endpoint must be an http(s) URL: " + builder.endpoint);
        }
        if (builder.apiKey == null || builder.apiKey.isBlank()) {
            throw new ExtractionConfigurationException("Extraction API key is not configured (DEEPSEEK_API_KEY)");
        }
        if (!builder.apiKey.startsWith("sk-")) {
            log.warn("API key does not start with 'sk-'; the service may reject it");
        }
        if (builder.objectMapper == null) {
            throw new IllegalArgumentException("objectMapper is required");
        }

        this.endpoint = builder.endpoint;
        this.apiKey = builder.apiKey;
        this.objectMapper = builder.objectMapper;
        this.baseHttpClient = builder.httpClient != null ? builder.httpClient : new OkHttpClient();
        this.responseParser = new ExtractionResponseParser(objectMapper);
        this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
        this.emptyContentRetries = builder.emptyContentRetries;
        this.emptyContentDelay = builder.emptyContentDelay;
        this.defaultRetryAfter = builder.defaultRetryAfter;
    }

    // =========================================================================
    //  ExtractionClient
    // =========================================================================

    @Override
    public ExtractionOutcome extract(String unitText, String instructions, ModelProfile model) {
        List<ChatMessage> messages = List.of(
                SystemMessage.from(instructions),
                UserMessage.from(ensureJsonMarker(instructions, unitText)));

        String payload;
        try {
            payload = objectMapper.writeValueAsString(createRequest(messages, model));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize completion request", e);
        }
        log.debug("Calling {} ({} chars of unit text)", model.modelId(), unitText.length());

        OkHttpClient httpClient = clientFor(model.timeout());
        int attempt = 0;
        int emptyAttempts = 0;

        while (true) {
            attempt++;
            Request request = new Request.Builder()
                    .url(endpoint)
                    .header("Authorization", "Bearer " + apiKey)
                    .post(RequestBody.create(payload, JSON))
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody body = response.body();
                String responseBody = body != null ? body.string() : "";

                if (response.code() == 429) {
                    Duration wait = retryAfter(response);
                    log.warn("Rate limited by {} (attempt {}); waiting {}s", model.modelId(), attempt, wait.toSeconds());
                    sleeper.sleep(wait);
                    continue;
                }
                if (!response.isSuccessful()) {
                    log.error("{} returned HTTP {}: {}", model.modelId(), response.code(), snippet(responseBody));
                    return ExtractionOutcome.failure(FailureKind.HTTP_STATUS,
                            "HTTP " + response.code() + " from " + model.modelId(), responseBody);
                }

                String content = messageContent(responseBody);
                if (content == null) {
                    log.error("Completion envelope from {} is not parseable: {}", model.modelId(), snippet(responseBody));
                    return ExtractionOutcome.failure(FailureKind.MALFORMED_RESPONSE,
                            "Completion envelope is not parseable", responseBody);
                }
                if (content.isBlank()) {
                    if (emptyAttempts < emptyContentRetries) {
                        emptyAttempts++;
                        log.warn("Empty content from {}; retry {}/{}", model.modelId(), emptyAttempts, emptyContentRetries);
                        sleeper.sleep(emptyContentDelay);
                        continue;
                    }
                    return ExtractionOutcome.failure(FailureKind.EMPTY_CONTENT,
                            "Empty content after " + (emptyAttempts + 1) + " attempts", responseBody);
                }

                logUsage(model, responseBody);
                return responseParser.parse(content);

            } catch (InterruptedIOException e) {
                log.error("Call to {} timed out after {}s", model.modelId(), model.timeout().toSeconds());
                return ExtractionOutcome.failure(FailureKind.TIMEOUT,
                        "Timed out after " + model.timeout().toSeconds() + "s", null);
            } catch (IOException e) {
                log.error("Call to {} failed: {}", model.modelId(), e.getMessage());
                return ExtractionOutcome.failure(FailureKind.CONNECTION, e.getMessage(), null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return ExtractionOutcome.failure(FailureKind.INTERRUPTED,
                        "Interrupted while waiting to retry " + model.modelId(), null);
            }
        }
    }

    @Override
    public boolean checkConnectivity(ModelProfile model) {
        ExtractionOutcome outcome = extract(
                "Reply with a JSON object {\"rules\": [], \"new_candidates\": {}}.",
                "You are a connectivity probe. Answer in JSON.",
                model);
        if (outcome instanceof ExtractionOutcome.Failure failure) {
            log.error("Connectivity check against {} failed: {} {}", model.modelId(), failure.kind(), failure.message());
            return false;
        }
        log.info("Connectivity check against {} succeeded", model.modelId());
        return true;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    /**
     * Wraps the unit text with an explicit JSON request when neither the
     * instructions nor the text mention JSON.
     */
    static String ensureJsonMarker(String instructions, String unitText) {
        boolean marked = (instructions != null && instructions.toLowerCase(Locale.ROOT).contains(JSON_MARKER))
                || unitText.toLowerCase(Locale.ROOT).contains(JSON_MARKER);
        return marked ? unitText : JSON_WRAPPER + unitText;
    }

    private ObjectNode createRequest(List<ChatMessage> messages, ModelProfile model) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("model", model.modelId());
        ArrayNode wireMessages = request.putArray("messages");
        for (ChatMessage message : messages) {
            ObjectNode wire = wireMessages.addObject();
            if (message instanceof SystemMessage system) {
                wire.put("role", "system");
                wire.put("content", system.text());
            } else if (message instanceof UserMessage user) {
                wire.put("role", "user");
                wire.put("content", user.singleText());
            }
        }
        request.put("temperature", model.temperature());
        request.put("max_tokens", model.maxTokens());
        request.putObject("response_format").put("type", "json_object");
        return request;
    }

    /**
     * @return {@code choices[0].message.content}, "" when the body or content is
     *         empty, or null when the body is not a completion envelope
     */
    private String messageContent(String responseBody) {
        if (responseBody.isBlank()) {
            return "";
        }
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            JsonNode choices = root.path("choices");
            if (!choices.isArray()) {
                return null;
            }
            if (choices.isEmpty()) {
                return "";
            }
            JsonNode content = choices.get(0).path("message").path("content");
            return content.isMissingNode() || content.isNull() ? "" : content.asText();
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private void logUsage(ModelProfile model, String responseBody) {
        if (!log.isDebugEnabled()) {
            return;
        }
        try {
            JsonNode usage = objectMapper.readTree(responseBody).path("usage");
            if (usage.isObject()) {
                TokenUsage tokenUsage = new TokenUsage(
                        usage.path("prompt_tokens").asInt(),
                        usage.path("completion_tokens").asInt());
                log.debug("{} usage: {} in / {} out / {} total", model.modelId(),
                        tokenUsage.inputTokenCount(), tokenUsage.outputTokenCount(), tokenUsage.totalTokenCount());
            }
        } catch (JsonProcessingException e) {
            log.debug("Usage block not readable: {}", e.getOriginalMessage());
        }
    }

    private Duration retryAfter(Response response) {
        String header = response.header("Retry-After");
        if (header != null) {
            try {
                return Duration.ofSeconds(Math.max(0, Long.parseLong(header.trim())));
            } catch (NumberFormatException e) {
                log.debug("Unparseable Retry-After '{}'; using default", header);
            }
        }
        return defaultRetryAfter;
    }

    private OkHttpClient clientFor(Duration timeout) {
        return clientsByTimeout.computeIfAbsent(timeout, t -> baseHttpClient.newBuilder()
                .callTimeout(t)
                .readTimeout(t)
                .build());
    }

    private static String snippet(String text) {
        return text.length() <= LOG_SNIPPET_CHARS ? text : text.substring(0, LOG_SNIPPET_CHARS) + "...";
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String endpoint;
        private String apiKey;
        private OkHttpClient httpClient;
        private ObjectMapper objectMapper;
        private Sleeper sleeper;
        private int emptyContentRetries = 2;
        private Duration emptyContentDelay = Duration.ofSeconds(1);
        private Duration defaultRetryAfter = Duration.ofSeconds(60);

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder httpClient(OkHttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder sleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public Builder emptyContentRetries(int emptyContentRetries) {
            this.emptyContentRetries = emptyContentRetries;
            return this;
        }

        public Builder emptyContentDelay(Duration emptyContentDelay) {
            this.emptyContentDelay = emptyContentDelay;
            return this;
        }

        public Builder defaultRetryAfter(Duration defaultRetryAfter) {
            this.defaultRetryAfter = defaultRetryAfter;
            return this;
        }

        public ChatCompletionExtractionClient build() {
            return new ChatCompletionExtractionClient(this);
        }
    }
}
