package org.example.storyprep.service.extraction;

/**
 * A single strategy could not produce content. The orchestrator moves on to the next strategy.
 */
public class ExtractionException extends Exception {

    private final ExtractionFailureReason reason;

    public ExtractionException(ExtractionFailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ExtractionException(ExtractionFailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public ExtractionFailureReason getReason() {
        return reason;
    }
}
