package org.example.storyprep.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Story processing state. CHUNKED is terminal; FAILED can go back to PROCESSING through a retry.
 * Delivery progress lives on the chunks, never on the story.
 */
public enum StoryStatus {
    PENDING,
    PROCESSING,
    CHUNKED,
    FAILED;

    public Set<StoryStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(PROCESSING);
            case PROCESSING -> EnumSet.of(CHUNKED, FAILED);
            case FAILED -> EnumSet.of(PROCESSING);
            case CHUNKED -> EnumSet.noneOf(StoryStatus.class);
        };
    }

    public boolean canTransitionTo(StoryStatus target) {
        return target != null && allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return this == CHUNKED;
    }
}
