package org.example.storyprep.service.extraction;

import org.example.storyprep.model.RawStoryContent;
import org.example.storyprep.service.PipelineMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the extraction strategies in priority order (agent, inline, url) and returns the first result.
 */
@Service
public class ExtractionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ExtractionOrchestrator.class);

    private final List<ExtractionStrategy> strategies;
    private final PipelineMetricsService metricsService;

    @Autowired
    public ExtractionOrchestrator(
            AgentExtractionStrategy agentStrategy,
            InlineTextStrategy inlineStrategy,
            PasswordProtectedUrlStrategy urlStrategy,
            PipelineMetricsService metricsService) {
        this(List.of(agentStrategy, inlineStrategy, urlStrategy), metricsService);
    }

    public ExtractionOrchestrator(List<ExtractionStrategy> strategies, PipelineMetricsService metricsService) {
        this.strategies = List.copyOf(strategies);
        this.metricsService = metricsService;
    }

    public List<String> strategyNames() {
        return strategies.stream().map(ExtractionStrategy::name).toList();
    }

    /**
     * @throws ExtractionFailedException when no strategy produced content; the message lists every attempt
     */
    public ExtractedContent extract(RawStoryContent content) {
        List<ExtractionAttempt> attempts = new ArrayList<>();

        for (ExtractionStrategy strategy : strategies) {
            if (!strategy.isEnabled()) {
                attempts.add(ExtractionAttempt.failure(strategy.name(), ExtractionFailureReason.DISABLED, "skipped"));
                continue;
            }
            try {
                ExtractedContent extracted = strategy.attempt(content);
                attempts.add(ExtractionAttempt.success(strategy.name()));
                metricsService.recordExtractionSucceeded(strategy.name());
                log.info("Extracted '{}' ({} words) with strategy {}",
                        extracted.title(), extracted.wordCount(), strategy.name());
                return extracted.extractionMethod() == null
                        ? extracted.withExtractionMethod(strategy.name())
                        : extracted;
            } catch (ExtractionException e) {
                attempts.add(ExtractionAttempt.failure(strategy.name(), e.getReason(), e.getMessage()));
                log.warn("Extraction strategy {} failed ({}): {}", strategy.name(), e.getReason(), e.getMessage());
            } catch (RuntimeException e) {
                attempts.add(ExtractionAttempt.failure(strategy.name(), ExtractionFailureReason.PARSE,
                        e.getClass().getSimpleName() + ": " + e.getMessage()));
                log.warn("Extraction strategy {} threw unexpectedly", strategy.name(), e);
            }
        }

        metricsService.recordExtractionFailed();
        ExtractionFailedException failure = new ExtractionFailedException(attempts);
        log.error("Extraction failed for {}: {}", content.sourceRef(), failure.getMessage());
        throw failure;
    }
}
