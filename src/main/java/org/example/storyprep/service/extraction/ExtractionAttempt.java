package org.example.storyprep.service.extraction;

public record ExtractionAttempt(
        String strategy,
        boolean succeeded,
        ExtractionFailureReason reason,
        String detail
) {

    public static ExtractionAttempt success(String strategy) {
        return new ExtractionAttempt(strategy, true, null, null);
    }

    public static ExtractionAttempt failure(String strategy, ExtractionFailureReason reason, String detail) {
        return new ExtractionAttempt(strategy, false, reason, detail);
    }

    public String describe() {
        if (succeeded) {
            return strategy + ": succeeded";
        }
        return strategy + ": " + reason + " - " + (detail == null || detail.isBlank() ? "no detail" : detail);
    }
}
