package org.example.storyprep.service.delivery;

import org.example.storyprep.config.DeliveryProperties;
import org.example.storyprep.entity.StoryChunkEntity;
import org.example.storyprep.entity.StoryEntity;
import org.example.storyprep.entity.StoryStatus;
import org.example.storyprep.model.DeliveryOutcome;
import org.example.storyprep.repository.StoryChunkRepository;
import org.example.storyprep.service.PipelineMetricsService;
import org.example.storyprep.service.event.PipelineEvent;
import org.example.storyprep.service.event.PipelineEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Sends at most one chunk per run. A chunk is claimed with a conditional update before sending and
 * marked sent with another conditional update afterwards, so overlapping runs (cron plus a manual
 * trigger, or two instances) never deliver the same chunk twice.
 */
@Service
public class DeliveryScheduler {

    private static final Logger log = LoggerFactory.getLogger(DeliveryScheduler.class);

    static final String TEST_SUBJECT_PREFIX = "[TEST] ";

    private final StoryChunkRepository chunkRepository;
    private final ChunkRenderer chunkRenderer;
    private final DeliveryTransport transport;
    private final DeliveryProperties properties;
    private final PipelineMetricsService metricsService;
    private final ApplicationEventPublisher eventPublisher;
    private final String workerId;

    public DeliveryScheduler(
            StoryChunkRepository chunkRepository,
            ChunkRenderer chunkRenderer,
            DeliveryTransport transport,
            DeliveryProperties properties,
            PipelineMetricsService metricsService,
            ApplicationEventPublisher eventPublisher,
            @Value("${delivery.worker-id:}") String configuredWorkerId) {
        this.chunkRepository = chunkRepository;
        this.chunkRenderer = chunkRenderer;
        this.transport = transport;
        this.properties = properties;
        this.metricsService = metricsService;
        this.eventPublisher = eventPublisher;
        this.workerId = (configuredWorkerId != null && !configuredWorkerId.isBlank())
                ? configuredWorkerId
                : "delivery-" + UUID.randomUUID();
    }

    @Scheduled(cron = "${delivery.cron:0 0 20 * * *}", zone = "${delivery.zone:UTC}")
    public void scheduledDelivery() {
        if (!properties.isScheduleEnabled()) {
            log.debug("Scheduled delivery disabled");
            return;
        }
        DeliveryOutcome outcome = deliverNext();
        log.info("Scheduled delivery finished: {} ({})", outcome.status(), outcome.message());
    }

    public DeliveryOutcome deliverNext() {
        LocalDateTime now = LocalDateTime.now();
        List<StoryChunkEntity> candidates = chunkRepository.findDeliveryCandidates(
                StoryStatus.CHUNKED, now, PageRequest.of(0, Math.max(1, properties.getMaxClaimAttempts())));

        if (candidates.isEmpty()) {
            log.info("Delivery queue is empty");
            metricsService.recordQueueEmpty();
            eventPublisher.publishEvent(PipelineEvent.of(PipelineEventType.QUEUE_EMPTY, null, null, null));
            return DeliveryOutcome.queueEmpty();
        }

        for (StoryChunkEntity candidate : candidates) {
            String claimOwner = workerId + ":" + UUID.randomUUID();
            LocalDateTime claimedAt = LocalDateTime.now();
            int claimed = chunkRepository.claimDelivery(
                    candidate.getId(),
                    claimOwner,
                    claimedAt,
                    claimedAt.plusMinutes(Math.max(1, properties.getClaimMinutes())));
            if (claimed == 0) {
                log.debug("Chunk {} was claimed by another delivery run", candidate.getId());
                metricsService.recordDeliveryClaimLost();
                continue;
            }
            return send(candidate, claimOwner);
        }

        log.info("All {} delivery candidates were claimed by other runs", candidates.size());
        return new DeliveryOutcome(DeliveryOutcome.Status.QUEUE_EMPTY, null, null, null, null, null, null,
                "All available chunks are being delivered by another run");
    }

    private DeliveryOutcome send(StoryChunkEntity chunk, String claimOwner) {
        StoryEntity story = chunk.getStory();
        String recipient = properties.resolveRecipient();
        try {
            if (recipient == null || recipient.isBlank()) {
                throw new DeliveryException("No delivery recipient configured (delivery.device-email)");
            }
            DeliveryArtifact artifact = chunkRenderer.render(story, chunk);
            String body = "";
            if (properties.isTestMode()) {
                artifact = artifact.withSubject(TEST_SUBJECT_PREFIX + artifact.subject());
                body = "[TEST MODE - Would have sent to " + properties.getDeviceEmail() + "]";
            }
            transport.send(recipient, artifact, body);
        } catch (DeliveryException | RuntimeException e) {
            chunkRepository.releaseClaim(chunk.getId(), claimOwner);
            metricsService.recordDeliveryFailed();
            log.error("Delivery of chunk {} ({} part {}/{}) failed",
                    chunk.getId(), story.getTitle(), chunk.getChunkNumber(), chunk.getTotalChunks(), e);
            eventPublisher.publishEvent(PipelineEvent.of(PipelineEventType.DELIVERY_FAILED, story.getId(), chunk.getId(),
                    PipelineEvent.details(
                            "title", story.getTitle(),
                            "chunkNumber", chunk.getChunkNumber(),
                            "totalChunks", chunk.getTotalChunks(),
                            "error", e.getMessage())));
            return outcome(DeliveryOutcome.Status.FAILED, chunk, recipient, "Delivery failed: " + e.getMessage());
        }

        int marked = chunkRepository.markSent(chunk.getId(), claimOwner, LocalDateTime.now());
        if (marked == 0) {
            log.warn("Chunk {} was sent but its claim had already been released or taken over", chunk.getId());
        }
        metricsService.recordChunkDelivered();
        log.info("Delivered chunk {} ({} part {}/{}) to {}",
                chunk.getId(), story.getTitle(), chunk.getChunkNumber(), chunk.getTotalChunks(), recipient);
        eventPublisher.publishEvent(PipelineEvent.of(PipelineEventType.CHUNK_DELIVERED, story.getId(), chunk.getId(),
                PipelineEvent.details(
                        "title", story.getTitle(),
                        "chunkNumber", chunk.getChunkNumber(),
                        "totalChunks", chunk.getTotalChunks(),
                        "recipient", recipient)));
        return outcome(DeliveryOutcome.Status.DELIVERED, chunk, recipient,
                "Delivered part " + chunk.getChunkNumber() + " of " + chunk.getTotalChunks());
    }

    /**
     * Clears the sent marker and any claim so the chunk is delivered again.
     */
    public void resetChunk(String chunkId) {
        int updated = chunkRepository.resetDelivery(chunkId);
        if (updated == 0) {
            throw new ChunkNotFoundException(chunkId);
        }
        log.info("Reset delivery state of chunk {}", chunkId);
    }

    private static DeliveryOutcome outcome(
            DeliveryOutcome.Status status, StoryChunkEntity chunk, String recipient, String message) {
        StoryEntity story = chunk.getStory();
        return new DeliveryOutcome(
                status,
                chunk.getId(),
                story.getId(),
                story.getTitle(),
                chunk.getChunkNumber(),
                chunk.getTotalChunks(),
                recipient,
                message);
    }
}
