package org.example.storyprep.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Messages API. It has no JSON response mode, so JSON requests get an instruction appended.
 */
public class AnthropicLlmProvider extends HttpLlmProvider {

    private static final String BASE_URL = "https://api.anthropic.com/v1";
    private static final String API_VERSION = "2023-06-01";
    private static final int DEFAULT_MAX_TOKENS = 4096;
    static final String JSON_INSTRUCTION = "\n\nRespond with a single JSON object and nothing else.";

    private final String apiKey;

    public AnthropicLlmProvider(String apiKey, String model, int timeoutSeconds) {
        super("anthropic", WebClient.builder()
                        .baseUrl(BASE_URL)
                        .defaultHeader("x-api-key", apiKey == null ? "" : apiKey)
                        .defaultHeader("anthropic-version", API_VERSION),
                "/messages", model, timeoutSeconds);
        this.apiKey = apiKey;
    }

    @Override
    Map<String, Object> requestBody(String prompt, LlmOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("max_tokens", options.maxTokens() != null ? options.maxTokens() : DEFAULT_MAX_TOKENS);
        body.put("temperature", options.temperature());
        String content = options.jsonOutput() ? prompt + JSON_INSTRUCTION : prompt;
        body.put("messages", List.of(Map.of("role", "user", "content", content)));
        return body;
    }

    @Override
    String extractText(JsonNode response) {
        StringBuilder text = new StringBuilder();
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }
        return text.isEmpty() ? null : text.toString();
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }
}
