package org.example.storyprep.service;

import org.example.storyprep.config.LifecycleProperties;
import org.example.storyprep.entity.StoryEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodically requeues FAILED stories that are still under the retry cap.
 */
@Component
public class StoryRetryScheduler {

    private static final Logger log = LoggerFactory.getLogger(StoryRetryScheduler.class);

    private final StoryLifecycleManager lifecycleManager;
    private final StoryProcessingService processingService;
    private final PipelineMetricsService metricsService;
    private final LifecycleProperties properties;

    public StoryRetryScheduler(
            StoryLifecycleManager lifecycleManager,
            StoryProcessingService processingService,
            PipelineMetricsService metricsService,
            LifecycleProperties properties) {
        this.lifecycleManager = lifecycleManager;
        this.processingService = processingService;
        this.metricsService = metricsService;
        this.properties = properties;
    }

    @Scheduled(
            fixedDelayString = "${lifecycle.retry-interval:PT6H}",
            initialDelayString = "${lifecycle.retry-initial-delay:PT5M}")
    public void scheduledSweep() {
        if (!properties.isRetryEnabled()) {
            log.debug("Story retry sweep disabled");
            return;
        }
        sweep();
    }

    public int sweep() {
        List<StoryEntity> candidates = lifecycleManager.findRetryCandidates();
        int requeued = 0;
        for (StoryEntity story : candidates) {
            if (!lifecycleManager.isRetryEligible(story)) {
                continue;
            }
            if (processingService.enqueue(story.getId())) {
                metricsService.recordStoryRetried();
                requeued++;
                log.info("Requeued story {} '{}' (attempt {} of {})",
                        story.getId(), story.getTitle(), story.getRetryCount() + 1, lifecycleManager.maxRetries());
            }
        }

        int needsAttention = lifecycleManager.findStoriesNeedingAttention().size();
        if (needsAttention > 0) {
            log.warn("{} stories have exhausted their retries and need manual intervention", needsAttention);
        }
        if (requeued > 0) {
            log.info("Retry sweep requeued {} of {} failed stories", requeued, candidates.size());
        }
        return requeued;
    }
}
