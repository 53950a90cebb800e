package org.example.storyprep.service.extraction;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every extraction strategy failed or was skipped.
 */
public class ExtractionFailedException extends RuntimeException {

    private final List<ExtractionAttempt> attempts;

    public ExtractionFailedException(List<ExtractionAttempt> attempts) {
        super(buildMessage(attempts));
        this.attempts = List.copyOf(attempts);
    }

    public List<ExtractionAttempt> getAttempts() {
        return attempts;
    }

    private static String buildMessage(List<ExtractionAttempt> attempts) {
        if (attempts == null || attempts.isEmpty()) {
            return "All extraction strategies failed: no strategies configured";
        }
        return "All extraction strategies failed: " + attempts.stream()
                .map(ExtractionAttempt::describe)
                .collect(Collectors.joining("; "));
    }
}
