package org.example.storyprep.service.event;

public enum PipelineEventType {
    STORY_RECEIVED,
    STORY_CHUNKED,
    STORY_FAILED,
    CHUNK_DELIVERED,
    DELIVERY_FAILED,
    QUEUE_EMPTY
}
