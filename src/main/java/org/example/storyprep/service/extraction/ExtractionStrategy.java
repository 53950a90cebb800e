package org.example.storyprep.service.extraction;

import org.example.storyprep.model.RawStoryContent;

public interface ExtractionStrategy {

    /**
     * Name recorded as the story's extraction method.
     */
    String name();

    default boolean isEnabled() {
        return true;
    }

    ExtractedContent attempt(RawStoryContent content) throws ExtractionException;
}
