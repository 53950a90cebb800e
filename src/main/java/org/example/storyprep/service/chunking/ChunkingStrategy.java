package org.example.storyprep.service.chunking;

import org.example.storyprep.text.StoryText;

import java.util.List;

/**
 * Proposes where a story should be split. A break value {@code b} means a new chunk starts at
 * paragraph index {@code b}; values are in {@code (0, story.size())}.
 */
public interface ChunkingStrategy {

    String name();

    default boolean isEnabled() {
        return true;
    }

    List<Integer> proposeBreaks(StoryText story, int targetWords) throws ChunkingException;
}
