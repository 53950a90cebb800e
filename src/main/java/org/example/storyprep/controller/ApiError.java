package org.example.storyprep.controller;

import java.time.LocalDateTime;

public record ApiError(
        String error,
        String message,
        String requestId,
        LocalDateTime timestamp
) {
}
