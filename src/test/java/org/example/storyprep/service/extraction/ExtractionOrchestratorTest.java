package org.example.storyprep.service.extraction;

import org.example.storyprep.model.RawStoryContent;
import org.example.storyprep.service.PipelineMetricsService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class ExtractionOrchestratorTest {

    private static final RawStoryContent CONTENT =
            new RawStoryContent("msg-1", "body", null, "Title", "a@example.com", null, null);

    @Mock
    private PipelineMetricsService metricsService;

    @Test
    void extract_firstSuccessfulStrategyWins() {
        FakeStrategy inline = FakeStrategy.succeeding("inline", result("inline"));
        FakeStrategy url = FakeStrategy.succeeding("url", result("url"));
        ExtractionOrchestrator orchestrator = new ExtractionOrchestrator(List.of(inline, url), metricsService);

        ExtractedContent extracted = orchestrator.extract(CONTENT);

        assertEquals("inline", extracted.extractionMethod());
        assertEquals(0, url.calls);
        verify(metricsService).recordExtractionSucceeded("inline");
    }

    @Test
    void extract_disabledStrategyIsSkippedAndNeverCalled() {
        FakeStrategy agent = new FakeStrategy("agent", false, result("agent"), null);
        FakeStrategy inline = FakeStrategy.succeeding("inline", result(null));
        ExtractionOrchestrator orchestrator = new ExtractionOrchestrator(List.of(agent, inline), metricsService);

        ExtractedContent extracted = orchestrator.extract(CONTENT);

        assertEquals(0, agent.calls);
        assertEquals("inline", extracted.extractionMethod());
    }

    @Test
    void extract_allStrategiesFail_listsEveryAttempt() {
        FakeStrategy agent = new FakeStrategy("agent", false, null, null);
        FakeStrategy inline = FakeStrategy.failing("inline",
                new ExtractionException(ExtractionFailureReason.BELOW_MINIMUM_LENGTH, "body too short"));
        FakeStrategy url = FakeStrategy.failing("url",
                new ExtractionException(ExtractionFailureReason.NETWORK, "HTTP 503 fetching https://example.com"));
        ExtractionOrchestrator orchestrator = new ExtractionOrchestrator(List.of(agent, inline, url), metricsService);

        ExtractionFailedException ex = assertThrows(ExtractionFailedException.class, () -> orchestrator.extract(CONTENT));

        assertEquals("All extraction strategies failed: agent: DISABLED - skipped; "
                        + "inline: BELOW_MINIMUM_LENGTH - body too short; "
                        + "url: NETWORK - HTTP 503 fetching https://example.com",
                ex.getMessage());
        assertEquals(3, ex.getAttempts().size());
        verify(metricsService).recordExtractionFailed();
        verify(metricsService, never()).recordExtractionSucceeded("url");
    }

    @Test
    void extract_unexpectedRuntimeException_isRecordedAndChainContinues() {
        FakeStrategy broken = new FakeStrategy("inline", true, null, null);
        broken.runtimeFailure = new IllegalStateException("bad markup");
        FakeStrategy url = FakeStrategy.succeeding("url", result("url"));
        ExtractionOrchestrator orchestrator = new ExtractionOrchestrator(List.of(broken, url), metricsService);

        ExtractedContent extracted = orchestrator.extract(CONTENT);

        assertEquals("url", extracted.extractionMethod());
        assertEquals(1, broken.calls);
    }

    @Test
    void strategyNames_reflectConfiguredOrder() {
        ExtractionOrchestrator orchestrator = new ExtractionOrchestrator(List.of(
                FakeStrategy.succeeding("agent", null),
                FakeStrategy.succeeding("inline", null),
                FakeStrategy.succeeding("url", null)), metricsService);

        assertEquals(List.of("agent", "inline", "url"), orchestrator.strategyNames());
        assertTrue(orchestrator.strategyNames().indexOf("inline") < orchestrator.strategyNames().indexOf("url"));
    }

    private static ExtractedContent result(String method) {
        return new ExtractedContent("Once upon a time.", "Title", null, method, 4, ExtractionConfidence.HIGH);
    }

    private static final class FakeStrategy implements ExtractionStrategy {

        private final String name;
        private final boolean enabled;
        private final ExtractedContent result;
        private final ExtractionException failure;
        private RuntimeException runtimeFailure;
        private int calls;

        private FakeStrategy(String name, boolean enabled, ExtractedContent result, ExtractionException failure) {
            this.name = name;
            this.enabled = enabled;
            this.result = result;
            this.failure = failure;
        }

        static FakeStrategy succeeding(String name, ExtractedContent result) {
            return new FakeStrategy(name, true, result, null);
        }

        static FakeStrategy failing(String name, ExtractionException failure) {
            return new FakeStrategy(name, true, null, failure);
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }

        @Override
        public ExtractedContent attempt(RawStoryContent content) throws ExtractionException {
            calls++;
            if (runtimeFailure != null) {
                throw runtimeFailure;
            }
            if (failure != null) {
                throw failure;
            }
            return result;
        }
    }
}
