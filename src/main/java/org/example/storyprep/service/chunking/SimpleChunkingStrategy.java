package org.example.storyprep.service.chunking;

import org.example.storyprep.config.ChunkingProperties;
import org.example.storyprep.text.StoryText;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Greedy paragraph packing. A chunk closes once it reaches the target, or earlier when the next
 * paragraph would push it past {@code target * (1 + tolerance)}. Restarts at every scene break and
 * never splits a paragraph. Deterministic and cannot fail.
 */
@Component
public class SimpleChunkingStrategy implements ChunkingStrategy {

    public static final String NAME = "simple";

    private final ChunkingProperties properties;

    public SimpleChunkingStrategy(ChunkingProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Integer> proposeBreaks(StoryText story, int targetWords) {
        int maxWords = maxWords(targetWords);
        List<Integer> breaks = new ArrayList<>();
        int lastMarkerBreak = -1;
        int current = 0;

        for (StoryText.Paragraph paragraph : story.paragraphs()) {
            if (paragraph.sceneBreak()) {
                if (current > 0) {
                    breaks.add(paragraph.index());
                    lastMarkerBreak = paragraph.index();
                    current = 0;
                }
                continue;
            }
            if (current > 0 && current + paragraph.wordCount() > maxWords) {
                breaks.add(paragraph.index());
                current = 0;
            }
            current += paragraph.wordCount();

            int next = paragraph.index() + 1;
            if (current >= targetWords && next < story.size() && !story.get(next).sceneBreak()) {
                breaks.add(next);
                current = 0;
            }
        }

        // Fold a short tail into the previous chunk unless a scene break forces the boundary.
        if (!breaks.isEmpty()) {
            int lastBreak = breaks.get(breaks.size() - 1);
            if (lastBreak != lastMarkerBreak
                    && story.wordsBetween(lastBreak, story.size()) < properties.getMinTrailingWords()) {
                breaks.remove(breaks.size() - 1);
            }
        }
        return breaks;
    }

    int maxWords(int targetWords) {
        return (int) Math.floor(targetWords * (1 + Math.max(0.0, properties.getTolerance())));
    }
}
