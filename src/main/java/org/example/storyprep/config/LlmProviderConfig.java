package org.example.storyprep.config;

import org.example.storyprep.service.llm.AnthropicLlmProvider;
import org.example.storyprep.service.llm.LlmProvider;
import org.example.storyprep.service.llm.OllamaLlmProvider;
import org.example.storyprep.service.llm.XaiLlmProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for LLM providers.
 * Extraction, chunking and recap each get their own bean so they can point at
 * different providers; all of them default to the global {@code ai.reasoning.*} settings.
 */
@Configuration
public class LlmProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmProviderConfig.class);

    // Extraction provider config
    @Value("${extraction.llm.provider:${ai.reasoning.provider:anthropic}}")
    private String extractionProvider;

    @Value("${extraction.llm.timeout-seconds:${ai.reasoning.timeout-seconds:120}}")
    private int extractionTimeoutSeconds;

    @Value("${extraction.llm.model:}")
    private String extractionModel;

    // Chunking provider config (agent and single-pass chunkers share it)
    @Value("${chunking.llm.provider:${ai.reasoning.provider:anthropic}}")
    private String chunkingProvider;

    @Value("${chunking.llm.timeout-seconds:${ai.reasoning.timeout-seconds:120}}")
    private int chunkingTimeoutSeconds;

    @Value("${chunking.llm.model:}")
    private String chunkingModel;

    // Recap provider config
    @Value("${recap.llm.provider:${ai.reasoning.provider:anthropic}}")
    private String recapProvider;

    @Value("${recap.llm.timeout-seconds:60}")
    private int recapTimeoutSeconds;

    @Value("${recap.llm.model:}")
    private String recapModel;

    // Shared provider endpoints and credentials
    @Value("${ai.ollama.base-url:http://localhost:11434}")
    private String ollamaBaseUrl;

    @Value("${ai.ollama.model:llama3.1:latest}")
    private String ollamaModel;

    @Value("${ai.xai.api-key:}")
    private String xaiApiKey;

    @Value("${ai.xai.model:grok-4-1-fast-reasoning}")
    private String xaiModel;

    @Value("${ai.anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${ai.anthropic.model:claude-sonnet-4-5}")
    private String anthropicModel;

    @Bean
    @Qualifier("extractionLlmProvider")
    public LlmProvider extractionLlmProvider() {
        log.info("Configuring extraction LLM provider: {}", extractionProvider);
        return createProvider(extractionProvider, extractionModel, extractionTimeoutSeconds, "extraction");
    }

    @Bean
    @Qualifier("chunkingLlmProvider")
    public LlmProvider chunkingLlmProvider() {
        log.info("Configuring chunking LLM provider: {}", chunkingProvider);
        return createProvider(chunkingProvider, chunkingModel, chunkingTimeoutSeconds, "chunking");
    }

    @Bean
    @Qualifier("recapLlmProvider")
    public LlmProvider recapLlmProvider() {
        log.info("Configuring recap LLM provider: {}", recapProvider);
        return createProvider(recapProvider, recapModel, recapTimeoutSeconds, "recap");
    }

    private LlmProvider createProvider(String providerType, String modelOverride, int timeoutSeconds, String purpose) {
        boolean hasOverride = modelOverride != null && !modelOverride.isBlank();

        return switch (providerType.toLowerCase()) {
            case "ollama" -> {
                String model = hasOverride ? modelOverride : ollamaModel;
                log.info("Creating Ollama provider for {}: baseUrl={}, model={}", purpose, ollamaBaseUrl, model);
                yield new OllamaLlmProvider(ollamaBaseUrl, model, timeoutSeconds);
            }
            case "xai" -> {
                if (xaiApiKey == null || xaiApiKey.isBlank()) {
                    log.warn("xAI API key not configured for {} provider, falling back to Ollama", purpose);
                    yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
                }
                String model = hasOverride ? modelOverride : xaiModel;
                log.info("Creating xAI provider for {}: model={}", purpose, model);
                yield new XaiLlmProvider(xaiApiKey, model, timeoutSeconds);
            }
            case "anthropic" -> {
                if (anthropicApiKey == null || anthropicApiKey.isBlank()) {
                    log.warn("Anthropic API key not configured for {} provider, falling back to Ollama", purpose);
                    yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
                }
                String model = hasOverride ? modelOverride : anthropicModel;
                log.info("Creating Anthropic provider for {}: model={}", purpose, model);
                yield new AnthropicLlmProvider(anthropicApiKey, model, timeoutSeconds);
            }
            default -> {
                log.warn("Unknown provider type '{}' for {}, falling back to Ollama", providerType, purpose);
                yield new OllamaLlmProvider(ollamaBaseUrl, ollamaModel, timeoutSeconds);
            }
        };
    }
}
