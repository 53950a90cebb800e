package org.example.storyprep.service.delivery;

import org.example.storyprep.config.DeliveryProperties;
import org.example.storyprep.entity.StoryChunkEntity;
import org.example.storyprep.entity.StoryEntity;
import org.example.storyprep.entity.StoryStatus;
import org.example.storyprep.model.DeliveryOutcome;
import org.example.storyprep.repository.StoryChunkRepository;
import org.example.storyprep.repository.StoryRepository;
import org.example.storyprep.service.PipelineMetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.ApplicationEventPublisher;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DataJpaTest
class DeliverySchedulerPersistenceTest {

    @Autowired
    private StoryRepository storyRepository;

    @Autowired
    private StoryChunkRepository chunkRepository;

    private DeliveryTransport transport;
    private PipelineMetricsService metricsService;
    private DeliveryScheduler scheduler;

    @BeforeEach
    void setUp() {
        DeliveryProperties properties = new DeliveryProperties();
        properties.setDeviceEmail("reader@kindle.example.com");
        transport = mock(DeliveryTransport.class);
        metricsService = new PipelineMetricsService();
        scheduler = new DeliveryScheduler(chunkRepository, new HtmlChunkRenderer(properties), transport, properties,
                metricsService, mock(ApplicationEventPublisher.class), "worker-a");
    }

    @Test
    void deliverNext_twiceInARow_sendsTheOnlyChunkOnceThenFindsQueueEmpty() throws Exception {
        StoryEntity story = new StoryEntity("ref-once", "Lanterns");
        story.setStatus(StoryStatus.CHUNKED);
        story = storyRepository.save(story);
        StoryChunkEntity chunk = new StoryChunkEntity(story, 1, 1, "The only part.");
        chunk.setWordCount(3);
        chunk.setNarrativeWordCount(3);
        chunk.setCreatedAt(LocalDateTime.now().minusMinutes(5));
        chunk = chunkRepository.save(chunk);

        DeliveryOutcome first = scheduler.deliverNext();
        DeliveryOutcome second = scheduler.deliverNext();

        assertEquals(DeliveryOutcome.Status.DELIVERED, first.status());
        assertEquals(chunk.getId(), first.chunkId());
        assertEquals(DeliveryOutcome.Status.QUEUE_EMPTY, second.status());
        verify(transport, times(1)).send(eq("reader@kindle.example.com"), any(DeliveryArtifact.class), anyString());

        StoryChunkEntity stored = chunkRepository.findById(chunk.getId()).orElseThrow();
        assertNotNull(stored.getSentAt());
        assertNull(stored.getDeliveryClaimOwner());
        assertEquals(1L, metricsService.snapshot().get("chunksDelivered"));
        assertEquals(1L, metricsService.snapshot().get("deliveryQueueEmpty"));
    }
}
