package org.example.storyprep.controller;

import jakarta.servlet.http.HttpServletRequest;
import org.example.storyprep.config.RequestCorrelation;
import org.example.storyprep.entity.StoryStatus;
import org.example.storyprep.repository.StoryChunkRepository;
import org.example.storyprep.service.PipelineMetricsService;
import org.example.storyprep.service.StoryLifecycleManager;
import org.example.storyprep.service.StoryProcessingService;
import org.example.storyprep.service.llm.LlmProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.Map;

@RestController
public class HealthController {

    private final StoryProcessingService processingService;
    private final StoryLifecycleManager lifecycleManager;
    private final StoryChunkRepository chunkRepository;
    private final PipelineMetricsService metricsService;
    private final LlmProvider extractionLlmProvider;
    private final LlmProvider chunkingLlmProvider;
    private final LlmProvider recapLlmProvider;

    public HealthController(
            StoryProcessingService processingService,
            StoryLifecycleManager lifecycleManager,
            StoryChunkRepository chunkRepository,
            PipelineMetricsService metricsService,
            @Qualifier("extractionLlmProvider") LlmProvider extractionLlmProvider,
            @Qualifier("chunkingLlmProvider") LlmProvider chunkingLlmProvider,
            @Qualifier("recapLlmProvider") LlmProvider recapLlmProvider) {
        this.processingService = processingService;
        this.lifecycleManager = lifecycleManager;
        this.chunkRepository = chunkRepository;
        this.metricsService = metricsService;
        this.extractionLlmProvider = extractionLlmProvider;
        this.chunkingLlmProvider = chunkingLlmProvider;
        this.recapLlmProvider = recapLlmProvider;
    }

    @GetMapping("/health")
    public Health health() {
        return new Health("ok");
    }

    @GetMapping("/health/details")
    public HealthDetails healthDetails(HttpServletRequest request) {
        ProviderHealth providers = new ProviderHealth(
                extractionLlmProvider.getProviderName(),
                extractionLlmProvider.isAvailable(),
                chunkingLlmProvider.getProviderName(),
                chunkingLlmProvider.isAvailable(),
                recapLlmProvider.getProviderName(),
                recapLlmProvider.isAvailable()
        );
        QueueHealth queues = new QueueHealth(
                processingService.isQueueProcessorRunning(),
                processingService.getQueueDepth(),
                chunkRepository.countUnsent(StoryStatus.CHUNKED),
                lifecycleManager.findStoriesNeedingAttention().size()
        );

        return new HealthDetails(
                queues.processingQueueRunning() ? "ok" : "degraded",
                RequestCorrelation.resolveRequestId(request),
                LocalDateTime.now(),
                providers,
                queues,
                metricsService.snapshot()
        );
    }

    public record Health(String status) {}

    public record HealthDetails(
            String status,
            String requestId,
            LocalDateTime asOf,
            ProviderHealth providers,
            QueueHealth queues,
            Map<String, Object> metrics
    ) {
    }

    public record ProviderHealth(
            String extractionProvider,
            boolean extractionAvailable,
            String chunkingProvider,
            boolean chunkingAvailable,
            String recapProvider,
            boolean recapAvailable
    ) {
    }

    public record QueueHealth(
            boolean processingQueueRunning,
            int processingQueueDepth,
            long unsentChunks,
            int storiesNeedingAttention
    ) {
    }
}
