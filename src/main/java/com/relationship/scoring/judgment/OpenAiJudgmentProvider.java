package com.relationship.scoring.judgment;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

/**
 * Judgment provider backed by an OpenAI-compatible chat-completions endpoint.
 *
 * Usage:
 * <pre>
 * OpenAiJudgmentProvider provider = OpenAiJudgmentProvider.builder()
 *     .apiKey(System.getenv("OPENAI_API_KEY"))
 *     .model("gpt-4o")
 *     .build();
 *
 * RelationshipScoringEngine engine = RelationshipScoringEngine.builder()
 *     .recordSource(source)
 *     .judgmentProvider(provider)
 *     .build();
 * </pre>
 *
 * <p>Requests are sent at temperature 0 with the system prompt and the payload as
 * the two chat messages.</p>
 */
public class OpenAiJudgmentProvider implements JudgmentProvider {
    private static final Logger log = LoggerFactory.getLogger(OpenAiJudgmentProvider.class);

    private static final String DEFAULT_BASE_URL = "https://api.openai.com/v1";
    private static final String DEFAULT_MODEL = "gpt-4o";
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final String baseUrl;
    private final String model;
    private final String apiKey;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private OpenAiJudgmentProvider(Builder builder) {
        String url = builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL;
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.model = builder.model != null ? builder.model : DEFAULT_MODEL;
        this.apiKey = builder.apiKey;
        this.timeout = builder.timeout != null ? builder.timeout : DEFAULT_TIMEOUT;
        this.httpClient = builder.httpClient != null ? builder.httpClient : HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public String requestJudgment(JudgmentRequest request) {
        ChatRequest chatRequest = new ChatRequest(model, 0, List.of(
                new ChatMessage("system", request.systemPrompt()),
                new ChatMessage("user", request.payload())));

        try {
            String requestBody = objectMapper.writeValueAsString(chatRequest);
            log.debug("Calling {} for record {}", getProviderName(), request.recordId());

            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/chat/completions"))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + apiKey)
                    .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                    .build();

            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new JudgmentException("Judgment service returned status " + response.statusCode()
                        + ": " + response.body());
            }

            ChatResponse chatResponse = objectMapper.readValue(response.body(), ChatResponse.class);
            if (chatResponse.choices() == null || chatResponse.choices().isEmpty()
                    || chatResponse.choices().get(0).message() == null) {
                throw new JudgmentException("Judgment service returned no choices");
            }
            String content = chatResponse.choices().get(0).message().content();
            log.debug("Judgment response received for record {}, length: {}",
                    request.recordId(), content != null ? content.length() : 0);
            return content;
        } catch (IOException e) {
            throw new JudgmentException("Error calling judgment service: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JudgmentException("Interrupted while calling judgment service", e);
        }
    }

    @Override
    public String getProviderName() {
        return "OpenAI/" + model;
    }

    /**
     * Available when an API key is configured. No network call is made.
     */
    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }

    public String getModel() {
        return model;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String baseUrl;
        private String model;
        private String apiKey;
        private Duration timeout;
        private HttpClient httpClient;

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public OpenAiJudgmentProvider build() {
            return new OpenAiJudgmentProvider(this);
        }
    }

    // Request/Response DTOs for the chat-completions API
    private record ChatRequest(String model, int temperature, List<ChatMessage> messages) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ChatMessage(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ChatChoice(int index, ChatMessage message) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record ChatResponse(String id, List<ChatChoice> choices) {}
}
