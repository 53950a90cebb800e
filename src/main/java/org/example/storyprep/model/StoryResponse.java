package org.example.storyprep.model;

import java.time.LocalDateTime;

public record StoryResponse(
        String id,
        String sourceRef,
        String title,
        String author,
        String status,
        int wordCount,
        String extractionMethod,
        String chunkingStrategy,
        int retryCount,
        boolean retryEligible,
        String errorMessage,
        LocalDateTime receivedAt,
        LocalDateTime processedAt,
        long totalChunks,
        long deliveredChunks,
        boolean fullyDelivered
) {
}
