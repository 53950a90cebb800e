package org.example.storyprep.service;

public class DuplicateStoryException extends RuntimeException {

    private final String existingStoryId;

    public DuplicateStoryException(String sourceRef, String existingStoryId) {
        super("Story already received for source " + sourceRef);
        this.existingStoryId = existingStoryId;
    }

    public String getExistingStoryId() {
        return existingStoryId;
    }
}
