package org.example.storyprep.service.extraction;

public enum ExtractionFailureReason {
    NETWORK,
    PARSE,
    BELOW_MINIMUM_LENGTH,
    MISSING_PASSWORD,
    LOW_CONFIDENCE,
    NOT_APPLICABLE,
    DISABLED
}
