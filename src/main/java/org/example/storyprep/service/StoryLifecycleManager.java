package org.example.storyprep.service;

import org.example.storyprep.config.LifecycleProperties;
import org.example.storyprep.entity.StoryChunkEntity;
import org.example.storyprep.entity.StoryEntity;
import org.example.storyprep.entity.StoryStatus;
import org.example.storyprep.repository.StoryChunkRepository;
import org.example.storyprep.repository.StoryRepository;
import org.example.storyprep.service.chunking.ChunkDraft;
import org.example.storyprep.service.chunking.ChunkingResult;
import org.example.storyprep.service.delivery.ChunkRenderer;
import org.example.storyprep.service.event.PipelineEvent;
import org.example.storyprep.service.event.PipelineEventType;
import org.example.storyprep.service.extraction.ExtractedContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns story status changes. Every change is checked against {@link StoryStatus#allowedTargets()};
 * anything else raises {@link IllegalStoryTransitionException}.
 */
@Service
public class StoryLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(StoryLifecycleManager.class);

    private final StoryRepository storyRepository;
    private final StoryChunkRepository chunkRepository;
    private final ChunkRenderer chunkRenderer;
    private final LifecycleProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    public StoryLifecycleManager(
            StoryRepository storyRepository,
            StoryChunkRepository chunkRepository,
            ChunkRenderer chunkRenderer,
            LifecycleProperties properties,
            ApplicationEventPublisher eventPublisher) {
        this.storyRepository = storyRepository;
        this.chunkRepository = chunkRepository;
        this.chunkRenderer = chunkRenderer;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
    }

    public int maxRetries() {
        return properties.getMaxRetries();
    }

    /**
     * PENDING or FAILED to PROCESSING. The write is conditional on the status read here, so two
     * workers racing for the same story cannot both start it.
     */
    public StoryEntity beginProcessing(String storyId) {
        StoryEntity story = load(storyId);
        StoryStatus current = story.getStatus();
        requireTransition(story, StoryStatus.PROCESSING);

        int updated = storyRepository.transitionStatus(
                storyId, List.of(current), StoryStatus.PROCESSING, LocalDateTime.now());
        if (updated == 0) {
            StoryStatus now = storyRepository.findById(storyId).map(StoryEntity::getStatus).orElse(null);
            throw new IllegalStoryTransitionException(storyId, now, StoryStatus.PROCESSING);
        }
        log.info("Story {} moved {} -> PROCESSING", storyId, current);
        return load(storyId);
    }

    /**
     * PROCESSING to CHUNKED, persisting the whole chunk batch in the same transaction.
     */
    @Transactional
    public StoryEntity markChunked(String storyId, ExtractedContent extracted, ChunkingResult result) {
        StoryEntity story = load(storyId);
        requireTransition(story, StoryStatus.CHUNKED);
        if (result.chunks().isEmpty()) {
            throw new IllegalArgumentException("Chunk batch for story " + storyId + " is empty");
        }

        if (extracted.title() != null && !extracted.title().isBlank()) {
            story.setTitle(extracted.title());
        }
        if (extracted.author() != null && !extracted.author().isBlank()) {
            story.setAuthor(extracted.author());
        }
        story.setWordCount(extracted.wordCount());
        story.setExtractionMethod(extracted.extractionMethod());
        story.setChunkingStrategy(result.strategy());
        story.setErrorMessage(null);
        story.setProcessedAt(LocalDateTime.now());
        story.setStatus(StoryStatus.CHUNKED);
        storyRepository.save(story);

        LocalDateTime batchCreatedAt = LocalDateTime.now();
        int total = result.totalChunks();
        List<StoryChunkEntity> chunks = new ArrayList<>(total);
        for (ChunkDraft draft : result.chunks()) {
            StoryChunkEntity chunk = new StoryChunkEntity(story, draft.chunkNumber(), total, draft.text());
            chunk.setWordCount(draft.wordCount());
            chunk.setNarrativeWordCount(draft.narrativeWordCount());
            chunk.setStoragePath(chunkRenderer.fileName(story.getTitle(), draft.chunkNumber(), total));
            chunk.setCreatedAt(batchCreatedAt);
            chunks.add(chunk);
        }
        chunkRepository.saveAll(chunks);

        log.info("Story {} moved PROCESSING -> CHUNKED ({} chunks, extraction={}, chunking={})",
                storyId, total, story.getExtractionMethod(), story.getChunkingStrategy());
        eventPublisher.publishEvent(PipelineEvent.of(PipelineEventType.STORY_CHUNKED, storyId, null,
                PipelineEvent.details(
                        "title", story.getTitle(),
                        "totalChunks", total,
                        "wordCount", story.getWordCount(),
                        "extractionMethod", story.getExtractionMethod(),
                        "chunkingStrategy", story.getChunkingStrategy())));
        return story;
    }

    /**
     * PROCESSING to FAILED. Increments the retry count; once it reaches the cap the story waits for
     * manual intervention.
     */
    @Transactional
    public StoryEntity markFailed(String storyId, String errorMessage) {
        StoryEntity story = load(storyId);
        requireTransition(story, StoryStatus.FAILED);

        story.setStatus(StoryStatus.FAILED);
        story.setRetryCount(story.getRetryCount() + 1);
        story.setErrorMessage(errorMessage == null || errorMessage.isBlank() ? "Unknown processing error" : errorMessage);
        storyRepository.save(story);

        boolean retryEligible = isRetryEligible(story);
        log.warn("Story {} moved PROCESSING -> FAILED (retry {}/{}, {}): {}",
                storyId, story.getRetryCount(), maxRetries(),
                retryEligible ? "will retry" : "needs manual intervention", story.getErrorMessage());
        eventPublisher.publishEvent(PipelineEvent.of(PipelineEventType.STORY_FAILED, storyId, null,
                PipelineEvent.details(
                        "title", story.getTitle(),
                        "error", story.getErrorMessage(),
                        "retryCount", story.getRetryCount(),
                        "maxRetries", maxRetries(),
                        "retryEligible", retryEligible)));
        return story;
    }

    public boolean isRetryEligible(StoryEntity story) {
        return story.getStatus() == StoryStatus.FAILED && story.getRetryCount() < maxRetries();
    }

    @Transactional(readOnly = true)
    public List<StoryEntity> findRetryCandidates() {
        return storyRepository.findByStatusAndRetryCountLessThanOrderByUpdatedAtAsc(StoryStatus.FAILED, maxRetries());
    }

    @Transactional(readOnly = true)
    public List<StoryEntity> findStoriesNeedingAttention() {
        return storyRepository.findByStatusAndRetryCountGreaterThanEqualOrderByUpdatedAtDesc(StoryStatus.FAILED, maxRetries());
    }

    private StoryEntity load(String storyId) {
        return storyRepository.findById(storyId).orElseThrow(() -> new StoryNotFoundException(storyId));
    }

    private void requireTransition(StoryEntity story, StoryStatus target) {
        if (story.getStatus() == null || !story.getStatus().canTransitionTo(target)) {
            throw new IllegalStoryTransitionException(story.getId(), story.getStatus(), target);
        }
    }
}
