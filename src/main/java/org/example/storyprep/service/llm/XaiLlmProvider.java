package org.example.storyprep.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * xAI (Grok) over the OpenAI-compatible chat completions endpoint.
 */
public class XaiLlmProvider extends HttpLlmProvider {

    private static final String BASE_URL = "https://api.x.ai/v1";

    private final String apiKey;

    public XaiLlmProvider(String apiKey, String model, int timeoutSeconds) {
        super("xai", WebClient.builder()
                        .baseUrl(BASE_URL)
                        .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + (apiKey == null ? "" : apiKey)),
                "/chat/completions", model, timeoutSeconds);
        this.apiKey = apiKey;
    }

    @Override
    Map<String, Object> requestBody(String prompt, LlmOptions options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        body.put("temperature", options.temperature());
        if (options.maxTokens() != null) {
            body.put("max_tokens", options.maxTokens());
        }
        if (options.jsonOutput()) {
            body.put("response_format", Map.of("type", "json_object"));
        }
        return body;
    }

    @Override
    String extractText(JsonNode response) {
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : null;
    }

    @Override
    public boolean isAvailable() {
        return apiKey != null && !apiKey.isBlank();
    }
}
