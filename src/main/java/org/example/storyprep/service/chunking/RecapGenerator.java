package org.example.storyprep.service.chunking;

import org.example.storyprep.config.ChunkingProperties;
import org.example.storyprep.service.llm.LlmOptions;
import org.example.storyprep.service.llm.LlmProvider;
import org.example.storyprep.text.TextMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Builds the "Previously:" header that opens every chunk after the first.
 */
@Component
public class RecapGenerator {

    private static final Logger log = LoggerFactory.getLogger(RecapGenerator.class);

    public static final String RULE = "───────────────────────────────────────";
    public static final String HEADING = "*Previously:*";

    private final LlmProvider recapProvider;
    private final ChunkingProperties properties;

    public RecapGenerator(
            @Qualifier("recapLlmProvider") LlmProvider recapProvider,
            ChunkingProperties properties) {
        this.recapProvider = recapProvider;
        this.properties = properties;
    }

    public String header(String previousNarrative) {
        return format(synopsis(previousNarrative));
    }

    public static String format(String synopsis) {
        return RULE + "\n" + HEADING + "\n> " + synopsis + "\n" + RULE;
    }

    String synopsis(String previousNarrative) {
        ChunkingProperties.Recap recap = properties.getRecap();
        if (recap.isLlmEnabled() && recapProvider.isAvailable()) {
            try {
                String generated = llmSynopsis(previousNarrative, recap);
                if (!generated.isBlank()) {
                    return generated;
                }
                log.warn("Recap model returned nothing; using extractive recap");
            } catch (Exception e) {
                log.warn("Recap generation via {} failed; using extractive recap", recapProvider.getProviderName(), e);
            }
        }
        return extractive(previousNarrative, recap.getTargetWords(), recap.getMaxSentences());
    }

    /**
     * Trailing sentences of the previous chunk, up to {@code targetWords} words and {@code maxSentences}
     * sentences. Always keeps at least the final sentence.
     */
    static String extractive(String previousNarrative, int targetWords, int maxSentences) {
        List<String> sentences = TextMetrics.splitSentences(previousNarrative);
        Deque<String> picked = new ArrayDeque<>();
        int words = 0;
        for (int i = sentences.size() - 1; i >= 0; i--) {
            String sentence = sentences.get(i);
            int sentenceWords = TextMetrics.countWords(sentence);
            if (!picked.isEmpty() && words + sentenceWords > targetWords) {
                break;
            }
            picked.addFirst(sentence);
            words += sentenceWords;
            if (picked.size() >= maxSentences) {
                break;
            }
        }
        return String.join(" ", picked).trim();
    }

    private String llmSynopsis(String previousNarrative, ChunkingProperties.Recap recap) {
        String context = previousNarrative.length() > recap.getMaxContextChars()
                ? previousNarrative.substring(previousNarrative.length() - recap.getMaxContextChars())
                : previousNarrative;

        String prompt = String.format("""
            Write a short "previously on" recap for a reader about to continue a serialized story.

            RULES:
            - At most %d words, in plain prose, past tense.
            - Use ONLY events from the text below; do not guess what happens next.
            - Focus on where the last part left off: who is where, and what is unresolved.
            - No headings, no bullet points, no preamble.

            PREVIOUS PART:
            %s
            """, recap.getTargetWords(), context);

        String generated = recapProvider.generate(prompt, LlmOptions.withTemperature(0.3, recap.getTargetWords() * 2));
        return TextMetrics.normalizeWhitespace(generated == null ? "" : generated);
    }
}
