package org.example.storyprep.service;

import org.example.storyprep.entity.StoryEntity;
import org.example.storyprep.model.IngestStoryRequest;
import org.example.storyprep.repository.StoryRepository;
import org.example.storyprep.service.event.PipelineEvent;
import org.example.storyprep.service.event.PipelineEventType;
import org.example.storyprep.service.extraction.EmailHeuristics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;

/**
 * Records an inbound story as PENDING and queues it for processing.
 */
@Service
public class StoryIngestService {

    private static final Logger log = LoggerFactory.getLogger(StoryIngestService.class);

    private final StoryRepository storyRepository;
    private final StoryProcessingService processingService;
    private final ApplicationEventPublisher eventPublisher;

    public StoryIngestService(
            StoryRepository storyRepository,
            StoryProcessingService processingService,
            ApplicationEventPublisher eventPublisher) {
        this.storyRepository = storyRepository;
        this.processingService = processingService;
        this.eventPublisher = eventPublisher;
    }

    public StoryEntity ingest(IngestStoryRequest request) {
        if (isBlank(request.text()) && isBlank(request.html()) && isBlank(request.url())) {
            throw new IllegalArgumentException("A story needs text, html or a url");
        }

        String sourceRef = resolveSourceRef(request);
        storyRepository.findBySourceRef(sourceRef).ifPresent(existing -> {
            throw new DuplicateStoryException(sourceRef, existing.getId());
        });

        StoryEntity story = new StoryEntity(sourceRef, EmailHeuristics.cleanSubject(request.subject()));
        story.setAuthor(EmailHeuristics.extractAuthor(request.from()));
        story.setSubject(request.subject());
        story.setSender(request.from());
        story.setRawText(request.text());
        story.setRawHtml(request.html());
        story.setSourceUrl(blankToNull(request.url()));
        story.setSourcePassword(blankToNull(request.password()));
        try {
            story = storyRepository.save(story);
        } catch (DataIntegrityViolationException e) {
            // A concurrent ingest of the same source won the unique constraint.
            StoryEntity winner = storyRepository.findBySourceRef(sourceRef).orElseThrow(() -> e);
            log.info("Story for source {} was stored concurrently as {}", sourceRef, winner.getId());
            throw new DuplicateStoryException(sourceRef, winner.getId());
        }

        log.info("Received story {} '{}' from {}", story.getId(), story.getTitle(), request.from());
        eventPublisher.publishEvent(PipelineEvent.of(PipelineEventType.STORY_RECEIVED, story.getId(), null,
                PipelineEvent.details(
                        "title", story.getTitle(),
                        "author", story.getAuthor(),
                        "sourceRef", sourceRef)));
        processingService.enqueue(story.getId());
        return story;
    }

    /**
     * The caller's reference (usually the email message id), else the link, else a digest of the content.
     */
    static String resolveSourceRef(IngestStoryRequest request) {
        if (!isBlank(request.sourceRef())) {
            return request.sourceRef().trim();
        }
        if (!isBlank(request.url())) {
            return request.url().trim();
        }
        String fingerprint = String.join("\u0000",
                nullToEmpty(request.subject()),
                nullToEmpty(request.from()),
                nullToEmpty(request.text()),
                nullToEmpty(request.html()));
        return "content:" + DigestUtils.md5DigestAsHex(fingerprint.getBytes(StandardCharsets.UTF_8));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
