package org.example.storyprep.service.llm;

/**
 * Abstraction for LLM providers (Ollama, xAI, Anthropic).
 * Calls are synchronous and bounded by the provider's configured timeout.
 */
public interface LlmProvider {

    /**
     * Generate a response from the LLM.
     *
     * @param prompt the prompt to send
     * @param options generation options
     * @return the generated text response
     * @throws LlmProviderException on transport errors, timeouts or malformed responses
     */
    String generate(String prompt, LlmOptions options);

    /**
     * Check if this provider is available and properly configured.
     */
    boolean isAvailable();

    /**
     * Provider name for logging and the recorded model name, e.g. "ollama".
     */
    String getProviderName();
}
