package org.example.storyprep.service;

import org.example.storyprep.entity.StoryChunkEntity;
import org.example.storyprep.entity.StoryEntity;
import org.example.storyprep.model.StoryChunkResponse;
import org.example.storyprep.model.StoryResponse;
import org.example.storyprep.repository.StoryChunkRepository;
import org.example.storyprep.repository.StoryRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class StoryQueryService {

    private final StoryRepository storyRepository;
    private final StoryChunkRepository chunkRepository;
    private final StoryLifecycleManager lifecycleManager;
    private final StoryProcessingService processingService;

    public StoryQueryService(
            StoryRepository storyRepository,
            StoryChunkRepository chunkRepository,
            StoryLifecycleManager lifecycleManager,
            StoryProcessingService processingService) {
        this.storyRepository = storyRepository;
        this.chunkRepository = chunkRepository;
        this.lifecycleManager = lifecycleManager;
        this.processingService = processingService;
    }

    @Transactional(readOnly = true)
    public List<StoryResponse> recentStories() {
        return storyRepository.findTop50ByOrderByReceivedAtDesc().stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public StoryResponse getStory(String storyId) {
        return toResponse(load(storyId));
    }

    @Transactional(readOnly = true)
    public List<StoryChunkResponse> getChunks(String storyId) {
        load(storyId);
        return chunkRepository.findByStoryIdOrderByChunkNumberAsc(storyId).stream()
                .map(chunk -> toChunkResponse(storyId, chunk))
                .toList();
    }

    /**
     * Manual requeue of a FAILED story. Ignores the retry cap.
     */
    public StoryResponse retry(String storyId) {
        StoryEntity story = load(storyId);
        processingService.requeueFailed(story);
        return toResponse(story);
    }

    StoryResponse toResponse(StoryEntity story) {
        long totalChunks = chunkRepository.countByStoryId(story.getId());
        long deliveredChunks = chunkRepository.countByStoryIdAndSentAtIsNotNull(story.getId());
        return new StoryResponse(
                story.getId(),
                story.getSourceRef(),
                story.getTitle(),
                story.getAuthor(),
                story.getStatus() != null ? story.getStatus().name() : null,
                story.getWordCount(),
                story.getExtractionMethod(),
                story.getChunkingStrategy(),
                story.getRetryCount(),
                lifecycleManager.isRetryEligible(story),
                story.getErrorMessage(),
                story.getReceivedAt(),
                story.getProcessedAt(),
                totalChunks,
                deliveredChunks,
                totalChunks > 0 && deliveredChunks == totalChunks
        );
    }

    private static StoryChunkResponse toChunkResponse(String storyId, StoryChunkEntity chunk) {
        return new StoryChunkResponse(
                chunk.getId(),
                storyId,
                chunk.getChunkNumber(),
                chunk.getTotalChunks(),
                chunk.getWordCount(),
                chunk.getNarrativeWordCount(),
                chunk.getStoragePath(),
                chunk.getCreatedAt(),
                chunk.getSentAt()
        );
    }

    private StoryEntity load(String storyId) {
        return storyRepository.findById(storyId).orElseThrow(() -> new StoryNotFoundException(storyId));
    }
}
