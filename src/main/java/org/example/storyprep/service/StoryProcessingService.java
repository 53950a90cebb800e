package org.example.storyprep.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.example.storyprep.config.RequestCorrelation;
import org.example.storyprep.entity.StoryEntity;
import org.example.storyprep.entity.StoryStatus;
import org.example.storyprep.model.RawStoryContent;
import org.example.storyprep.service.chunking.ChunkingOrchestrator;
import org.example.storyprep.service.chunking.ChunkingResult;
import org.example.storyprep.service.extraction.ExtractedContent;
import org.example.storyprep.service.extraction.ExtractionFailedException;
import org.example.storyprep.service.extraction.ExtractionOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Background pipeline: extraction, chunking and the chunk batch write for one story at a time per
 * worker. Stories are independent, so workers never share state beyond the queue.
 */
@Service
public class StoryProcessingService {

    private static final Logger log = LoggerFactory.getLogger(StoryProcessingService.class);

    public static final String MDC_STORY_ID = RequestCorrelation.MDC_STORY_ID;

    private final StoryLifecycleManager lifecycleManager;
    private final ExtractionOrchestrator extractionOrchestrator;
    private final ChunkingOrchestrator chunkingOrchestrator;
    private final PipelineMetricsService metricsService;
    private final int workerThreads;
    private final BlockingQueue<String> requestQueue = new LinkedBlockingQueue<>();
    private ExecutorService executor;
    private volatile boolean running = true;

    public StoryProcessingService(
            StoryLifecycleManager lifecycleManager,
            ExtractionOrchestrator extractionOrchestrator,
            ChunkingOrchestrator chunkingOrchestrator,
            PipelineMetricsService metricsService,
            @Value("${processing.worker-threads:2}") int workerThreads) {
        this.lifecycleManager = lifecycleManager;
        this.extractionOrchestrator = extractionOrchestrator;
        this.chunkingOrchestrator = chunkingOrchestrator;
        this.metricsService = metricsService;
        this.workerThreads = Math.max(1, workerThreads);
    }

    @PostConstruct
    public void init() {
        executor = Executors.newFixedThreadPool(workerThreads);
        for (int i = 0; i < workerThreads; i++) {
            executor.submit(this::processQueue);
        }
        log.info("Story processing started with {} workers", workerThreads);
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        if (executor != null) {
            executor.shutdownNow();
        }
        log.info("Story processing shutting down");
    }

    public boolean isQueueProcessorRunning() {
        return running && executor != null && !executor.isShutdown();
    }

    public int getQueueDepth() {
        return requestQueue.size();
    }

    public boolean enqueue(String storyId) {
        if (requestQueue.contains(storyId)) {
            log.debug("Story {} is already queued", storyId);
            return false;
        }
        boolean offered = requestQueue.offer(storyId);
        if (offered) {
            log.debug("Queued story {} for processing", storyId);
        }
        return offered;
    }

    private void processQueue() {
        while (running) {
            try {
                String storyId = requestQueue.take();
                process(storyId);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Error processing story queue", e);
            }
        }
    }

    /**
     * Runs one story through the pipeline. Stories that are not PENDING or FAILED are skipped.
     */
    public void process(String storyId) {
        MDC.put(MDC_STORY_ID, storyId);
        try {
            StoryEntity story;
            try {
                story = lifecycleManager.beginProcessing(storyId);
            } catch (IllegalStoryTransitionException e) {
                log.info("Skipping story {}: {}", storyId, e.getMessage());
                return;
            } catch (StoryNotFoundException e) {
                log.warn("Skipping story {}: no longer exists", storyId);
                return;
            }
            runPipeline(story);
        } finally {
            MDC.remove(MDC_STORY_ID);
        }
    }

    private void runPipeline(StoryEntity story) {
        String storyId = story.getId();
        long startedAtMs = System.currentTimeMillis();
        try {
            ExtractedContent extracted = extractionOrchestrator.extract(toRawContent(story));
            ChunkingResult result = chunkingOrchestrator.chunk(extracted.text());
            lifecycleManager.markChunked(storyId, extracted, result);
            metricsService.recordStoryChunked(elapsedSince(startedAtMs));
        } catch (ExtractionFailedException e) {
            lifecycleManager.markFailed(storyId, e.getMessage());
            metricsService.recordStoryFailed(elapsedSince(startedAtMs));
        } catch (DataAccessException e) {
            log.error("Persistence failure while processing story {}; leaving it for startup recovery", storyId, e);
            throw e;
        } catch (RuntimeException e) {
            log.error("Processing failed for story {}", storyId, e);
            lifecycleManager.markFailed(storyId, "Processing failed: " + e.getMessage());
            metricsService.recordStoryFailed(elapsedSince(startedAtMs));
        }
    }

    static RawStoryContent toRawContent(StoryEntity story) {
        return new RawStoryContent(
                story.getSourceRef(),
                story.getRawText(),
                story.getRawHtml(),
                story.getSubject(),
                story.getSender(),
                story.getSourceUrl(),
                story.getSourcePassword()
        );
    }

    /**
     * Requeues a FAILED story regardless of its retry count.
     */
    public boolean requeueFailed(StoryEntity story) {
        if (story.getStatus() != StoryStatus.FAILED) {
            throw new IllegalStoryTransitionException(story.getId(), story.getStatus(), StoryStatus.PROCESSING);
        }
        return enqueue(story.getId());
    }

    private static long elapsedSince(long startedAtMs) {
        return Math.max(0L, System.currentTimeMillis() - startedAtMs);
    }
}
