package org.example.storyprep.model;

/**
 * Result of one delivery run. QUEUE_EMPTY is a normal outcome, not an error.
 */
public record DeliveryOutcome(
        Status status,
        String chunkId,
        String storyId,
        String storyTitle,
        Integer chunkNumber,
        Integer totalChunks,
        String recipient,
        String message
) {

    public enum Status {
        QUEUE_EMPTY,
        DELIVERED,
        FAILED
    }

    public static DeliveryOutcome queueEmpty() {
        return new DeliveryOutcome(Status.QUEUE_EMPTY, null, null, null, null, null, null, "No unsent chunks available");
    }

    public boolean delivered() {
        return status == Status.DELIVERED;
    }

    public boolean queueIsEmpty() {
        return status == Status.QUEUE_EMPTY;
    }
}
