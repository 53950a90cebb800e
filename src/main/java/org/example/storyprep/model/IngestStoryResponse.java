package org.example.storyprep.model;

public record IngestStoryResponse(
        String storyId,
        String status
) {
}
