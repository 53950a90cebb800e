package org.example.storyprep.service.llm;

/**
 * A provider call failed: transport error, non-2xx status, timeout, or a body with no generated text.
 */
public class LlmProviderException extends RuntimeException {

    public LlmProviderException(String message) {
        super(message);
    }

    public LlmProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
