package org.example.storyprep.service.chunking;

import org.example.storyprep.config.ChunkingProperties;
import org.example.storyprep.service.llm.LlmOptions;
import org.example.storyprep.service.llm.LlmProvider;
import org.example.storyprep.service.llm.LlmProviderException;
import org.example.storyprep.text.StoryText;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.example.storyprep.service.chunking.SimpleChunkingStrategyTest.storyOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmChunkingStrategyTest {

    @Mock
    private LlmProvider llmProvider;

    private LlmChunkingStrategy strategy;

    // 20 paragraphs of 400 words.
    private final StoryText longStory = StoryText.parse(storyOf(8000, 400));
    private final StoryText shortStory = StoryText.parse(storyOf(1600, 400));

    @BeforeEach
    void setUp() {
        strategy = new LlmChunkingStrategy(llmProvider, new ChunkingProperties());
    }

    @Test
    void proposeBreaks_parsesBreakLines() throws Exception {
        when(llmProvider.generate(anyString(), any(LlmOptions.class)))
                .thenReturn("BREAK_PARA: 10\nbreak_para: [15]\n");

        assertEquals(List.of(10, 15), strategy.proposeBreaks(longStory, 5000));
    }

    @Test
    void parseResponse_dropsBreaksLeavingTooLittleText() {
        // Breaking after paragraph 19 would leave a single 400-word paragraph.
        ChunkingException ex = assertThrows(ChunkingException.class,
                () -> strategy.parseResponse(longStory, 5000, "BREAK_PARA: 19"));
        assertTrue(ex.getMessage().contains("19"));
    }

    @Test
    void parseResponse_noBreaksForShortStory_isAccepted() throws Exception {
        assertTrue(strategy.parseResponse(shortStory, 5000, "NO_BREAKS_NEEDED").isEmpty());
    }

    @Test
    void parseResponse_noBreaksForLongStory_isRejected() {
        assertThrows(ChunkingException.class,
                () -> strategy.parseResponse(longStory, 5000, "NO_BREAKS_NEEDED"));
    }

    @Test
    void parseResponse_garbage_isRejected() {
        assertThrows(ChunkingException.class,
                () -> strategy.parseResponse(longStory, 5000, "I think the story flows well as is."));
        assertThrows(ChunkingException.class,
                () -> strategy.parseResponse(longStory, 5000, "  "));
    }

    @Test
    void proposeBreaks_providerFailure_becomesChunkingException() {
        when(llmProvider.generate(anyString(), any(LlmOptions.class)))
                .thenThrow(new LlmProviderException("timed out"));

        ChunkingException ex = assertThrows(ChunkingException.class, () -> strategy.proposeBreaks(longStory, 5000));
        assertTrue(ex.getMessage().contains("timed out"));
    }
}
