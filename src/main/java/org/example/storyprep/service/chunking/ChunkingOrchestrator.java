package org.example.storyprep.service.chunking;

import org.example.storyprep.config.ChunkingProperties;
import org.example.storyprep.service.PipelineMetricsService;
import org.example.storyprep.text.StoryText;
import org.example.storyprep.text.TextMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits clean story text into numbered chunks. Strategies are tried in order (agent, llm, simple);
 * the first one that returns breaks wins. Scene breaks are then forced onto boundaries and every
 * chunk after the first gets a recap header.
 */
@Service
public class ChunkingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ChunkingOrchestrator.class);

    private final List<ChunkingStrategy> strategies;
    private final SceneBreakAligner sceneBreakAligner;
    private final RecapGenerator recapGenerator;
    private final ChunkingProperties properties;
    private final PipelineMetricsService metricsService;

    @Autowired
    public ChunkingOrchestrator(
            AgentChunkingStrategy agentStrategy,
            LlmChunkingStrategy llmStrategy,
            SimpleChunkingStrategy simpleStrategy,
            SceneBreakAligner sceneBreakAligner,
            RecapGenerator recapGenerator,
            ChunkingProperties properties,
            PipelineMetricsService metricsService) {
        this(List.of(agentStrategy, llmStrategy, simpleStrategy),
                sceneBreakAligner, recapGenerator, properties, metricsService);
    }

    public ChunkingOrchestrator(
            List<ChunkingStrategy> strategies,
            SceneBreakAligner sceneBreakAligner,
            RecapGenerator recapGenerator,
            ChunkingProperties properties,
            PipelineMetricsService metricsService) {
        this.strategies = List.copyOf(strategies);
        this.sceneBreakAligner = sceneBreakAligner;
        this.recapGenerator = recapGenerator;
        this.properties = properties;
        this.metricsService = metricsService;
    }

    public ChunkingResult chunk(String text) {
        return chunk(text, properties.getTargetWords(), null);
    }

    public ChunkingResult chunk(String text, int targetWords, String preferredStrategy) {
        if (targetWords <= 0) {
            throw new IllegalArgumentException("targetWords must be positive, got " + targetWords);
        }
        StoryText story = StoryText.parse(text);
        if (story.narrativeWords() == 0) {
            throw new IllegalArgumentException("No narrative text to chunk");
        }

        List<String> failed = new ArrayList<>();
        List<Integer> proposed = null;
        String used = null;
        for (ChunkingStrategy strategy : orderedStrategies(preferredStrategy)) {
            if (!strategy.isEnabled()) {
                continue;
            }
            try {
                proposed = strategy.proposeBreaks(story, targetWords);
                used = strategy.name();
                break;
            } catch (ChunkingException | RuntimeException e) {
                failed.add(strategy.name());
                metricsService.recordChunkingFallback();
                log.warn("Chunking strategy {} failed, falling back: {}", strategy.name(), e.getMessage());
            }
        }
        if (proposed == null) {
            throw new IllegalStateException("No chunking strategy produced breaks; tried " + failed);
        }

        int snapWords = properties.resolveSceneBreakSnapWords(targetWords);
        List<Integer> breaks = sceneBreakAligner.align(story, proposed, snapWords);
        List<int[]> segments = sceneBreakAligner.segments(story, breaks);

        List<ChunkDraft> drafts = buildDrafts(story, segments);
        metricsService.recordChunkingCompleted(used);
        log.info("Chunked {} words into {} chunks with strategy {} (target {})",
                story.narrativeWords(), drafts.size(), used, targetWords);
        return new ChunkingResult(drafts, used, story.narrativeWords(), failed);
    }

    private List<ChunkDraft> buildDrafts(StoryText story, List<int[]> segments) {
        int total = segments.size();
        List<ChunkDraft> drafts = new ArrayList<>(total);
        String previousNarrative = null;
        for (int i = 0; i < total; i++) {
            int[] range = segments.get(i);
            String narrative = story.join(range[0], range[1]);
            int narrativeWords = story.wordsBetween(range[0], range[1]);

            String text = narrative;
            boolean hasRecap = false;
            if (previousNarrative != null) {
                text = recapGenerator.header(previousNarrative) + "\n\n" + narrative;
                hasRecap = true;
            }
            drafts.add(new ChunkDraft(i + 1, total, text, TextMetrics.countWords(text), narrativeWords, hasRecap));
            previousNarrative = narrative;
        }
        return drafts;
    }

    private List<ChunkingStrategy> orderedStrategies(String preferredStrategy) {
        if (preferredStrategy == null || preferredStrategy.isBlank()) {
            return strategies;
        }
        List<ChunkingStrategy> ordered = new ArrayList<>(strategies.size());
        strategies.stream()
                .filter(s -> s.name().equalsIgnoreCase(preferredStrategy.trim()))
                .findFirst()
                .ifPresent(ordered::add);
        for (ChunkingStrategy strategy : strategies) {
            if (!ordered.contains(strategy)) {
                ordered.add(strategy);
            }
        }
        return ordered;
    }
}
