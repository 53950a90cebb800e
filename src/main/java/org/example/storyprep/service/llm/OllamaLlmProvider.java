package org.example.storyprep.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Local Ollama server via /api/generate. Also the fallback whenever a hosted provider has no key.
 */
public class OllamaLlmProvider extends HttpLlmProvider {

    private static final Logger log = LoggerFactory.getLogger(OllamaLlmProvider.class);

    // Agent chunking sends whole stories; the default 2k context would truncate them.
    static final int CONTEXT_WINDOW = 32768;
    private static final Duration AVAILABILITY_TIMEOUT = Duration.ofSeconds(2);

    public OllamaLlmProvider(String baseUrl, String model, int timeoutSeconds) {
        super("ollama", WebClient.builder().baseUrl(baseUrl), "/api/generate", model, timeoutSeconds);
    }

    @Override
    Map<String, Object> requestBody(String prompt, LlmOptions options) {
        Map<String, Object> modelOptions = new LinkedHashMap<>();
        modelOptions.put("temperature", options.temperature());
        modelOptions.put("num_ctx", CONTEXT_WINDOW);
        if (options.maxTokens() != null) {
            modelOptions.put("num_predict", options.maxTokens());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("prompt", prompt);
        body.put("stream", false);
        body.put("options", modelOptions);
        if (options.jsonOutput()) {
            body.put("format", "json");
        }
        return body;
    }

    @Override
    String extractText(JsonNode response) {
        JsonNode text = response.get("response");
        return text == null || text.isNull() ? null : text.asText();
    }

    /**
     * Pings /api/tags; any failure means the server is down or unreachable.
     */
    @Override
    public boolean isAvailable() {
        try {
            webClient.get()
                    .uri("/api/tags")
                    .retrieve()
                    .toBodilessEntity()
                    .block(AVAILABILITY_TIMEOUT);
            return true;
        } catch (RuntimeException e) {
            log.debug("Ollama not reachable: {}", e.getMessage());
            return false;
        }
    }
}
