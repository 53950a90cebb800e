package org.example.storyprep.model;

public record IngestStoryRequest(
        String sourceRef,
        String subject,
        String from,
        String text,
        String html,
        String url,
        String password
) {
}
