package org.example.storyprep.service.llm;

/**
 * Options for LLM generation requests.
 */
public record LlmOptions(
    double temperature,
    Integer maxTokens,  // nullable
    boolean jsonOutput
) {
    /**
     * Deterministic-ish plain text output, used for extraction and break finding.
     */
    public static LlmOptions precise(int maxTokens) {
        return new LlmOptions(0.0, maxTokens, false);
    }

    /**
     * Ask the provider to constrain output to a JSON document where it supports that.
     */
    public static LlmOptions json(int maxTokens) {
        return new LlmOptions(0.0, maxTokens, true);
    }

    /**
     * Slightly creative output for recaps.
     */
    public static LlmOptions withTemperature(double temp, int maxTokens) {
        return new LlmOptions(temp, maxTokens, false);
    }
}
