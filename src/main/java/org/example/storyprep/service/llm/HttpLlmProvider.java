package org.example.storyprep.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Map;

/**
 * Blocking JSON-over-HTTP call shared by the providers. Subclasses supply the request body for their
 * API and pull the generated text out of the response tree.
 */
abstract class HttpLlmProvider implements LlmProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpLlmProvider.class);

    static final int MAX_RESPONSE_BYTES = 4 * 1024 * 1024;

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    protected final WebClient webClient;
    protected final String model;
    private final String vendor;
    private final String path;
    private final Duration timeout;

    protected HttpLlmProvider(String vendor, WebClient.Builder builder, String path, String model, int timeoutSeconds) {
        this.vendor = vendor;
        this.path = path;
        this.model = model;
        this.timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
        this.webClient = builder
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_RESPONSE_BYTES))
                .build();
    }

    abstract Map<String, Object> requestBody(String prompt, LlmOptions options);

    /**
     * @return the generated text, or null when the response has none
     */
    abstract String extractText(JsonNode response);

    @Override
    public final String generate(String prompt, LlmOptions options) {
        String raw;
        try {
            raw = webClient.post()
                    .uri(path)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(requestBody(prompt, options))
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            log.error("{} returned {}: {}", vendor, e.getStatusCode(), e.getResponseBodyAsString());
            throw new LlmProviderException(vendor + " returned " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            log.error("{} call failed after {}s budget", vendor, timeout.toSeconds(), e);
            throw new LlmProviderException(vendor + " call failed: " + e.getMessage(), e);
        }
        return parse(raw);
    }

    String parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new LlmProviderException(vendor + " returned an empty body");
        }
        JsonNode tree;
        try {
            tree = OBJECT_MAPPER.readTree(raw);
        } catch (Exception e) {
            throw new LlmProviderException(vendor + " returned unreadable JSON", e);
        }
        String text = extractText(tree);
        if (text == null) {
            throw new LlmProviderException(vendor + " response had no generated text");
        }
        return text;
    }

    @Override
    public String getProviderName() {
        return vendor + ":" + model;
    }
}
