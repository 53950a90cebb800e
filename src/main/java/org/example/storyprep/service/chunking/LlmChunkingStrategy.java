package org.example.storyprep.service.chunking;

import org.example.storyprep.config.ChunkingProperties;
import org.example.storyprep.service.llm.LlmOptions;
import org.example.storyprep.service.llm.LlmProvider;
import org.example.storyprep.service.llm.LlmProviderException;
import org.example.storyprep.text.StoryText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single model call that lists natural break points as {@code BREAK_PARA: n} lines.
 */
@Component
public class LlmChunkingStrategy implements ChunkingStrategy {

    private static final Logger log = LoggerFactory.getLogger(LlmChunkingStrategy.class);

    public static final String NAME = "llm";

    private static final Pattern BREAK_LINE = Pattern.compile("BREAK_PARA\\s*:\\s*\\[?(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NO_BREAKS = Pattern.compile("NO[_ ]BREAKS", Pattern.CASE_INSENSITIVE);

    private final LlmProvider llmProvider;
    private final ChunkingProperties properties;

    public LlmChunkingStrategy(
            @Qualifier("chunkingLlmProvider") LlmProvider llmProvider,
            ChunkingProperties properties) {
        this.llmProvider = llmProvider;
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return properties.isLlmEnabled();
    }

    @Override
    public List<Integer> proposeBreaks(StoryText story, int targetWords) throws ChunkingException {
        String response;
        try {
            response = llmProvider.generate(buildPrompt(story, targetWords), LlmOptions.precise(600));
        } catch (LlmProviderException e) {
            throw new ChunkingException("break analysis call failed: " + e.getMessage(), e);
        }
        List<Integer> breaks = parseResponse(story, targetWords, response);
        log.info("LLM chunker proposed {} breaks via {}", breaks.size(), llmProvider.getProviderName());
        return breaks;
    }

    List<Integer> parseResponse(StoryText story, int targetWords, String response) throws ChunkingException {
        if (response == null || response.isBlank()) {
            throw new ChunkingException("empty break analysis");
        }

        List<Integer> numbers = new ArrayList<>();
        Matcher matcher = BREAK_LINE.matcher(response);
        while (matcher.find()) {
            numbers.add(Integer.parseInt(matcher.group(1)));
        }

        if (numbers.isEmpty()) {
            if (!NO_BREAKS.matcher(response).find()) {
                throw new ChunkingException("no BREAK_PARA lines in model output");
            }
            if (story.narrativeWords() > maxWords(targetWords)) {
                throw new ChunkingException("model proposed no breaks for a " + story.narrativeWords() + " word story");
            }
            return List.of();
        }

        List<Integer> starts = ParagraphBreaks.toStartIndices(story, numbers, properties.getMinTrailingWords());
        if (starts.isEmpty() && story.narrativeWords() > maxWords(targetWords)) {
            throw new ChunkingException("none of the proposed breaks " + numbers + " were usable");
        }
        return starts;
    }

    private int maxWords(int targetWords) {
        return (int) Math.floor(targetWords * (1 + properties.getTolerance()));
    }

    private String buildPrompt(StoryText story, int targetWords) {
        return String.format("""
            Analyze this story and identify natural break points for splitting it into reading chunks
            of roughly %d words each (about %d chunks). The story has %d paragraphs and %d words.

            BREAK PRIORITIES (best first):
            1. Explicit scene breaks (paragraphs marked <SCENE BREAK>). These are mandatory.
            2. Scene transitions: change of location, time skip, or point of view.
            3. The end of a resolved conflict or a completed emotional beat.
            Never break in the middle of dialogue, combat, or a climactic moment.
            Chunks may range from about %d to %d words when that puts the break at a real scene change.

            PARAGRAPHS:
            %s

            Answer with one line per break, where n is the paragraph AFTER which the break falls:
            BREAK_PARA: n
            If the story should stay in one piece, answer exactly: NO_BREAKS_NEEDED
            """,
                targetWords,
                ParagraphBreaks.estimatedChunks(story, targetWords),
                story.size(),
                story.narrativeWords(),
                targetWords / 2,
                targetWords * 3 / 2,
                ParagraphBreaks.numberedParagraphs(story, properties.getMaxPromptChars())
        );
    }
}
