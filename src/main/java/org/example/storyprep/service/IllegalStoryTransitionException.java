package org.example.storyprep.service;

import org.example.storyprep.entity.StoryStatus;

public class IllegalStoryTransitionException extends RuntimeException {

    private final String storyId;
    private final StoryStatus from;
    private final StoryStatus to;

    public IllegalStoryTransitionException(String storyId, StoryStatus from, StoryStatus to) {
        super("Story " + storyId + " cannot move from " + from + " to " + to);
        this.storyId = storyId;
        this.from = from;
        this.to = to;
    }

    public String getStoryId() {
        return storyId;
    }

    public StoryStatus getFrom() {
        return from;
    }

    public StoryStatus getTo() {
        return to;
    }
}
