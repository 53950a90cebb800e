package org.example.storyprep.service.extraction;

import java.util.Locale;

public enum ExtractionConfidence {
    LOW,
    MEDIUM,
    HIGH;

    public boolean atLeast(ExtractionConfidence minimum) {
        return minimum == null || compareTo(minimum) >= 0;
    }

    public static ExtractionConfidence parse(String value) {
        if (value == null || value.isBlank()) {
            return LOW;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return LOW;
        }
    }
}
