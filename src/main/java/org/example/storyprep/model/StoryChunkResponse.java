package org.example.storyprep.model;

import java.time.LocalDateTime;

public record StoryChunkResponse(
        String id,
        String storyId,
        int chunkNumber,
        int totalChunks,
        int wordCount,
        int narrativeWordCount,
        String storagePath,
        LocalDateTime createdAt,
        LocalDateTime sentAt
) {
}
