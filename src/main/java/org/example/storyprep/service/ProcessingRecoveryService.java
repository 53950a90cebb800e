package org.example.storyprep.service;

import org.example.storyprep.config.LifecycleProperties;
import org.example.storyprep.entity.StoryEntity;
import org.example.storyprep.entity.StoryStatus;
import org.example.storyprep.repository.StoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * The processing queue lives in memory, so a restart loses it. On startup, stories caught mid-run are
 * failed (and so become retry candidates) and PENDING stories are queued again.
 */
@Service
public class ProcessingRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(ProcessingRecoveryService.class);

    static final String INTERRUPTED_MESSAGE = "Processing interrupted by application restart";

    private final StoryRepository storyRepository;
    private final StoryLifecycleManager lifecycleManager;
    private final StoryProcessingService processingService;
    private final LifecycleProperties properties;

    public ProcessingRecoveryService(
            StoryRepository storyRepository,
            StoryLifecycleManager lifecycleManager,
            StoryProcessingService processingService,
            LifecycleProperties properties) {
        this.storyRepository = storyRepository;
        this.lifecycleManager = lifecycleManager;
        this.processingService = processingService;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverOnStartup() {
        recoverInterruptedWork();
    }

    RecoverySummary recoverInterruptedWork() {
        if (!properties.isRecoveryEnabled()) {
            log.info("Processing recovery is disabled");
            return new RecoverySummary(0, 0);
        }

        List<StoryEntity> interrupted = storyRepository.findByStatus(StoryStatus.PROCESSING);
        int failed = 0;
        for (StoryEntity story : interrupted) {
            try {
                lifecycleManager.markFailed(story.getId(), INTERRUPTED_MESSAGE);
                failed++;
            } catch (IllegalStoryTransitionException e) {
                log.info("Story {} left PROCESSING before recovery reached it: {}", story.getId(), e.getMessage());
            }
        }

        int requeued = 0;
        for (StoryEntity story : storyRepository.findByStatus(StoryStatus.PENDING)) {
            if (processingService.enqueue(story.getId())) {
                requeued++;
            }
        }

        RecoverySummary summary = new RecoverySummary(failed, requeued);
        if (failed > 0 || requeued > 0) {
            log.info("Processing recovery: interruptedFailed={}, pendingRequeued={}", failed, requeued);
        } else {
            log.info("Processing recovery found no interrupted or pending stories");
        }
        return summary;
    }

    record RecoverySummary(int interruptedFailed, int pendingRequeued) {
    }
}
