package org.example.storyprep.service.chunking;

import org.example.storyprep.text.StoryText;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Makes every scene-break marker a chunk boundary. A proposed break that lands within
 * {@code snapWords} narrative words of a marker is moved onto that marker.
 */
@Component
public class SceneBreakAligner {

    public List<Integer> align(StoryText story, List<Integer> proposed, int snapWords) {
        List<Integer> markers = story.sceneBreakIndices();
        TreeSet<Integer> aligned = new TreeSet<>();

        for (Integer candidate : proposed) {
            if (candidate == null || candidate <= 0 || candidate >= story.size()) {
                continue;
            }
            aligned.add(snap(story, candidate, markers, snapWords));
        }
        for (Integer marker : markers) {
            if (marker > 0) {
                aligned.add(marker);
            }
        }
        return new ArrayList<>(aligned);
    }

    private int snap(StoryText story, int candidate, List<Integer> markers, int snapWords) {
        int best = candidate;
        int bestDistance = Integer.MAX_VALUE;
        for (int marker : markers) {
            if (marker <= 0) {
                continue;
            }
            int distance = marker < candidate
                    ? story.wordsBetween(marker, candidate)
                    : story.wordsBetween(candidate, marker);
            if (distance <= snapWords && distance < bestDistance) {
                best = marker;
                bestDistance = distance;
            }
        }
        return best;
    }

    /**
     * Turns sorted break indices into [from, to) paragraph ranges that contain narrative text.
     */
    public List<int[]> segments(StoryText story, List<Integer> breaks) {
        List<int[]> segments = new ArrayList<>();
        int from = 0;
        for (int boundary : breaks) {
            addIfNarrative(story, segments, from, boundary);
            from = boundary;
        }
        addIfNarrative(story, segments, from, story.size());
        return segments;
    }

    private void addIfNarrative(StoryText story, List<int[]> segments, int from, int to) {
        if (to > from && !story.join(from, to).isBlank()) {
            segments.add(new int[]{from, to});
        }
    }
}
