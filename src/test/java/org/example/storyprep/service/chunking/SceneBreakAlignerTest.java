package org.example.storyprep.service.chunking;

import org.example.storyprep.text.StoryText;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.example.storyprep.service.chunking.SimpleChunkingStrategyTest.storyOf;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SceneBreakAlignerTest {

    private final SceneBreakAligner aligner = new SceneBreakAligner();

    // Paragraphs 0-9 (1000 words), marker at 10, paragraphs 11-20 (1000 words).
    private final StoryText story = StoryText.parse(storyOf(1000, 100) + "\n\n* * *\n\n" + storyOf(1000, 100));

    @Test
    void align_nearbyBreak_snapsOntoMarker() {
        assertEquals(List.of(10), aligner.align(story, List.of(12), 250));
        assertEquals(List.of(10), aligner.align(story, List.of(8), 250));
    }

    @Test
    void align_distantBreak_isKeptAlongsideMarker() {
        assertEquals(List.of(10, 15), aligner.align(story, List.of(15), 250));
    }

    @Test
    void align_markerIsAlwaysABoundary() {
        assertEquals(List.of(10), aligner.align(story, List.of(), 0));
    }

    @Test
    void align_dropsOutOfRangeBreaks() {
        assertEquals(List.of(10), aligner.align(story, List.of(0, -3, 21, 99), 0));
    }

    @Test
    void segments_excludeMarkerOnlyRanges() {
        StoryText trailingMarker = StoryText.parse(storyOf(500, 100) + "\n\n***");

        List<Integer> breaks = aligner.align(trailingMarker, List.of(), 0);
        List<int[]> segments = aligner.segments(trailingMarker, breaks);

        assertEquals(List.of(5), breaks);
        assertEquals(1, segments.size());
        assertArrayEquals(new int[]{0, 5}, segments.get(0));
    }

    @Test
    void segments_leadingMarkerDoesNotCreateEmptyChunk() {
        StoryText leadingMarker = StoryText.parse("---\n\n" + storyOf(500, 100));

        List<Integer> breaks = aligner.align(leadingMarker, List.of(), 0);

        assertEquals(List.of(), breaks);
        assertEquals(1, aligner.segments(leadingMarker, breaks).size());
    }
}
