package org.example.storyprep.service.extraction;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class EmailHeuristicsTest {

    @Test
    void cleanSubject_stripsReplyAndForwardPrefixes() {
        assertEquals("Chapter 12: The Long Night", EmailHeuristics.cleanSubject("Re: Fwd: FW: Chapter 12: The Long Night"));
        assertEquals(EmailHeuristics.DEFAULT_TITLE, EmailHeuristics.cleanSubject(null));
        assertEquals(EmailHeuristics.DEFAULT_TITLE, EmailHeuristics.cleanSubject("Re:  "));
    }

    @Test
    void extractAuthor_prefersDisplayName() {
        assertEquals("Jane Writer", EmailHeuristics.extractAuthor("\"Jane Writer\" <jane@example.com>"));
        assertEquals("Jane Writer", EmailHeuristics.extractAuthor("Jane Writer <jane@example.com>"));
        assertEquals("jane", EmailHeuristics.extractAuthor("jane@example.com"));
        assertEquals("jane", EmailHeuristics.extractAuthor("<jane@example.com>"));
        assertNull(EmailHeuristics.extractAuthor("  "));
    }

    @Test
    void findUrl_stripsTrailingPunctuation() {
        assertEquals(Optional.of("https://example.com/story/12"),
                EmailHeuristics.findUrl("Read it here: https://example.com/story/12. Enjoy!"));
        assertEquals(Optional.empty(), EmailHeuristics.findUrl("No link today."));
    }

    @Test
    void findPassword_handlesCommonPhrasings() {
        assertEquals(Optional.of("moonlight"), EmailHeuristics.findPassword("Password: moonlight"));
        assertEquals(Optional.of("hunter2"), EmailHeuristics.findPassword("Password:\n   hunter2"));
        assertEquals(Optional.of("swordfish"), EmailHeuristics.findPassword("pw: swordfish!"));
        assertEquals(Optional.of("ember"), EmailHeuristics.findPassword("Use code \"ember\" to unlock."));
    }

    @Test
    void findPassword_rejectsLinksAndStopWords() {
        assertEquals(Optional.empty(), EmailHeuristics.findPassword("Use the password for the page"));
        assertEquals(Optional.empty(), EmailHeuristics.findPassword("password: https://example.com/login"));
        assertEquals(Optional.empty(), EmailHeuristics.findPassword(null));
    }
}
