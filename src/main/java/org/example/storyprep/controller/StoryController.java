package org.example.storyprep.controller;

import org.example.storyprep.entity.StoryEntity;
import org.example.storyprep.model.IngestStoryRequest;
import org.example.storyprep.model.IngestStoryResponse;
import org.example.storyprep.model.StoryChunkResponse;
import org.example.storyprep.model.StoryResponse;
import org.example.storyprep.service.StoryIngestService;
import org.example.storyprep.service.StoryQueryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/stories")
public class StoryController {

    private final StoryIngestService ingestService;
    private final StoryQueryService queryService;

    public StoryController(StoryIngestService ingestService, StoryQueryService queryService) {
        this.ingestService = ingestService;
        this.queryService = queryService;
    }

    @PostMapping
    public ResponseEntity<IngestStoryResponse> ingest(@RequestBody IngestStoryRequest request) {
        StoryEntity story = ingestService.ingest(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new IngestStoryResponse(story.getId(), story.getStatus().name()));
    }

    @GetMapping
    public List<StoryResponse> recentStories() {
        return queryService.recentStories();
    }

    @GetMapping("/{storyId}")
    public StoryResponse getStory(@PathVariable String storyId) {
        return queryService.getStory(storyId);
    }

    @GetMapping("/{storyId}/chunks")
    public List<StoryChunkResponse> getChunks(@PathVariable String storyId) {
        return queryService.getChunks(storyId);
    }

    @PostMapping("/{storyId}/retry")
    public ResponseEntity<StoryResponse> retry(@PathVariable String storyId) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(queryService.retry(storyId));
    }
}
