package org.example.storyprep.service.chunking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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

/**
 * Holistic break planning: the model reads the whole story and returns every break with a reason,
 * as JSON.
 */
@Component
public class AgentChunkingStrategy implements ChunkingStrategy {

    private static final Logger log = LoggerFactory.getLogger(AgentChunkingStrategy.class);

    public static final String NAME = "agent";

    private final LlmProvider llmProvider;
    private final ChunkingProperties properties;
    private final ObjectMapper objectMapper;

    public AgentChunkingStrategy(
            @Qualifier("chunkingLlmProvider") LlmProvider llmProvider,
            ChunkingProperties properties,
            ObjectMapper objectMapper) {
        this.llmProvider = llmProvider;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return properties.isAgentEnabled();
    }

    @Override
    public List<Integer> proposeBreaks(StoryText story, int targetWords) throws ChunkingException {
        if (!llmProvider.isAvailable()) {
            throw new ChunkingException("chunking model " + llmProvider.getProviderName() + " is not available");
        }
        String response;
        try {
            response = llmProvider.generate(buildPrompt(story, targetWords), LlmOptions.json(1500));
        } catch (LlmProviderException e) {
            throw new ChunkingException("agent break planning failed: " + e.getMessage(), e);
        }
        return parseResponse(story, targetWords, response);
    }

    List<Integer> parseResponse(StoryText story, int targetWords, String response) throws ChunkingException {
        JsonNode breaksNode = readJson(response).path("breaks");
        if (!breaksNode.isArray()) {
            throw new ChunkingException("agent response has no 'breaks' array");
        }

        List<Integer> numbers = new ArrayList<>();
        for (JsonNode entry : breaksNode) {
            JsonNode paragraph = entry.isObject() ? entry.path("paragraph") : entry;
            if (!paragraph.canConvertToInt()) {
                continue;
            }
            numbers.add(paragraph.asInt());
            if (entry.hasNonNull("reason")) {
                log.debug("Agent break after paragraph {}: {}", paragraph.asInt(), entry.get("reason").asText());
            }
        }

        int maxWords = (int) Math.floor(targetWords * (1 + properties.getTolerance()));
        List<Integer> starts = ParagraphBreaks.toStartIndices(story, numbers, properties.getMinTrailingWords());
        if (starts.isEmpty() && story.narrativeWords() > maxWords) {
            throw new ChunkingException(numbers.isEmpty()
                    ? "agent proposed no breaks for a " + story.narrativeWords() + " word story"
                    : "none of the agent's breaks " + numbers + " were usable");
        }
        log.info("Agent chunker proposed {} usable breaks out of {}", starts.size(), numbers.size());
        return starts;
    }

    private JsonNode readJson(String response) throws ChunkingException {
        if (response == null || response.isBlank()) {
            throw new ChunkingException("empty agent response");
        }
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new ChunkingException("no JSON object in agent response");
        }
        try {
            return objectMapper.readTree(response.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new ChunkingException("invalid JSON in agent response", e);
        }
    }

    private String buildPrompt(StoryText story, int targetWords) {
        return String.format("""
            You are planning how to serialize a story into daily reading chunks.
            Read the whole story first, then choose every break at once.

            TARGET: about %d words per chunk, roughly %d chunks for %d words in %d paragraphs.

            PRIORITIES:
            1. Paragraphs marked <SCENE BREAK> are mandatory boundaries.
            2. Scene transitions: new location, time skip, or a shift in point of view.
            3. Resolutions: the end of a conflict or confrontation.
            4. Completed emotional arcs or reveals that give the reader a natural pause.
            AVOID breaking mid-dialogue, mid-combat, or right before a climax pays off.
            Uneven chunks are fine (for example 2500 and 4500 words) when that lands the break
            on a real scene change.

            PARAGRAPHS:
            %s

            Return ONLY JSON. "paragraph" is the paragraph number AFTER which the break falls:
            {"breaks":[{"paragraph":12,"reason":"time skip to the next morning"}]}
            Return {"breaks":[]} if the story should not be split.
            """,
                targetWords,
                ParagraphBreaks.estimatedChunks(story, targetWords),
                story.narrativeWords(),
                story.size(),
                ParagraphBreaks.numberedParagraphs(story, properties.getMaxPromptChars())
        );
    }
}
