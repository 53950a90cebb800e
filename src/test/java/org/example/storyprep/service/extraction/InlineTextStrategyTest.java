package org.example.storyprep.service.extraction;

import org.example.storyprep.config.ExtractionProperties;
import org.example.storyprep.model.RawStoryContent;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InlineTextStrategyTest {

    private static final String SENTENCE = "The lighthouse keeper counted the ships that never came back to harbor. ";

    private final InlineTextStrategy strategy = new InlineTextStrategy(new ExtractionProperties());

    @Test
    void attempt_htmlBody_returnsCleanParagraphText() throws Exception {
        String html = "<p>View in browser</p>"
                + "<p>" + SENTENCE.repeat(5) + "</p>"
                + "<hr>"
                + "<p>" + SENTENCE.repeat(4) + "</p>"
                + "<p>Unsubscribe</p>";
        RawStoryContent content = new RawStoryContent("msg-1", null, html, "Fwd: The Keeper, Part 3",
                "Ann Author <ann@example.com>", null, null);

        ExtractedContent extracted = strategy.attempt(content);

        assertEquals("inline", extracted.extractionMethod());
        assertEquals(ExtractionConfidence.HIGH, extracted.confidence());
        assertEquals("The Keeper, Part 3", extracted.title());
        assertEquals("Ann Author", extracted.author());
        assertTrue(extracted.text().contains("\n\n* * *\n\n"));
        assertFalse(extracted.text().contains("View in browser"));
        assertFalse(extracted.text().contains("Unsubscribe"));
        assertEquals(9 * 12, extracted.wordCount());
    }

    @Test
    void attempt_shortBody_isBelowMinimumLength() {
        RawStoryContent content = new RawStoryContent("msg-2", "See the link: https://example.com/ch-4", null,
                "Chapter 4", "ann@example.com", null, null);

        ExtractionException ex = assertThrows(ExtractionException.class, () -> strategy.attempt(content));
        assertEquals(ExtractionFailureReason.BELOW_MINIMUM_LENGTH, ex.getReason());
    }

    @Test
    void attempt_bodyThatIsAllBoilerplate_isRejected() {
        RawStoryContent content = new RawStoryContent("msg-3", "Unsubscribe from this list\n\n".repeat(30), null,
                "Newsletter", "ann@example.com", null, null);

        ExtractionException ex = assertThrows(ExtractionException.class, () -> strategy.attempt(content));
        assertEquals(ExtractionFailureReason.BELOW_MINIMUM_LENGTH, ex.getReason());
        assertTrue(ex.getMessage().contains("after cleaning"));
    }
}
