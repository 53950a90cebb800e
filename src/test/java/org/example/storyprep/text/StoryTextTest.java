package org.example.storyprep.text;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StoryTextTest {

    @Test
    void parse_splitsOnBlankLinesAndFlagsSceneBreaks() {
        StoryText story = StoryText.parse("""
                The rain had not stopped for three days.

                * * *

                Morning came grey and cold.
                She did not get up.
                """);

        assertEquals(3, story.size());
        assertFalse(story.get(0).sceneBreak());
        assertTrue(story.get(1).sceneBreak());
        assertEquals("Morning came grey and cold.\nShe did not get up.", story.get(2).text());
        assertEquals(List.of(1), story.sceneBreakIndices());
    }

    @Test
    void parse_dividerLineBetweenSingleNewlines_becomesItsOwnMarker() {
        StoryText story = StoryText.parse("The door shut behind her.\nLast line of scene one.\n* * *\nFirst line of scene two.\nHe waited.");

        assertEquals(3, story.size());
        assertEquals("The door shut behind her.\nLast line of scene one.", story.get(0).text());
        assertTrue(story.get(1).sceneBreak());
        assertEquals("* * *", story.get(1).text());
        assertEquals("First line of scene two.\nHe waited.", story.get(2).text());
        assertEquals(List.of(1), story.sceneBreakIndices());
        assertEquals(17, story.narrativeWords());
    }

    @Test
    void parse_handlesWindowsLineEndings() {
        StoryText story = StoryText.parse("First paragraph.\r\n\r\nSecond paragraph.");

        assertEquals(2, story.size());
        assertEquals("Second paragraph.", story.get(1).text());
    }

    @Test
    void parse_blankInput_isEmpty() {
        assertTrue(StoryText.parse(null).isEmpty());
        assertTrue(StoryText.parse("   \n\n  ").isEmpty());
        assertEquals(0, StoryText.parse("").narrativeWords());
    }

    @Test
    void isSceneBreak_recognisesCommonDividers() {
        assertTrue(StoryText.isSceneBreak("* * *"));
        assertTrue(StoryText.isSceneBreak("***"));
        assertTrue(StoryText.isSceneBreak("---"));
        assertTrue(StoryText.isSceneBreak("~~~"));
        assertTrue(StoryText.isSceneBreak("#"));
        assertTrue(StoryText.isSceneBreak("═══════"));
        assertFalse(StoryText.isSceneBreak("- Hello there"));
        assertFalse(StoryText.isSceneBreak("Chapter 2"));
        assertFalse(StoryText.isSceneBreak(""));
    }

    @Test
    void narrativeWords_excludeMarkers() {
        StoryText story = StoryText.parse("one two three\n\n---\n\nfour five");

        assertEquals(5, story.narrativeWords());
        assertEquals(0, story.get(1).wordCount());
        assertEquals(2, story.wordsBetween(1, 3));
    }

    @Test
    void join_skipsSceneBreakParagraphs() {
        StoryText story = StoryText.parse("Alpha.\n\n* * *\n\nBeta.\n\nGamma.");

        assertEquals("Alpha.\n\nBeta.\n\nGamma.", story.join(0, story.size()));
        assertEquals("Beta.", story.join(1, 3));
    }
}
