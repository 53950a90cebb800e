package org.example.storyprep.service;

import org.example.storyprep.config.LifecycleProperties;
import org.example.storyprep.entity.StoryEntity;
import org.example.storyprep.entity.StoryStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StoryRetrySchedulerTest {

    @Mock
    private StoryLifecycleManager lifecycleManager;

    @Mock
    private StoryProcessingService processingService;

    @Mock
    private PipelineMetricsService metricsService;

    private LifecycleProperties properties;
    private StoryRetryScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new LifecycleProperties();
        scheduler = new StoryRetryScheduler(lifecycleManager, processingService, metricsService, properties);
    }

    @Test
    void sweep_requeuesEligibleFailedStories() {
        StoryEntity first = failed("s-1", 0);
        StoryEntity second = failed("s-2", 2);
        when(lifecycleManager.findRetryCandidates()).thenReturn(List.of(first, second));
        when(lifecycleManager.isRetryEligible(first)).thenReturn(true);
        when(lifecycleManager.isRetryEligible(second)).thenReturn(true);
        when(lifecycleManager.maxRetries()).thenReturn(3);
        when(processingService.enqueue("s-1")).thenReturn(true);
        when(processingService.enqueue("s-2")).thenReturn(true);
        when(lifecycleManager.findStoriesNeedingAttention()).thenReturn(List.of(failed("s-9", 3)));

        assertEquals(2, scheduler.sweep());

        verify(metricsService, times(2)).recordStoryRetried();
    }

    @Test
    void sweep_alreadyQueuedStory_isNotCountedTwice() {
        StoryEntity story = failed("s-1", 1);
        when(lifecycleManager.findRetryCandidates()).thenReturn(List.of(story));
        when(lifecycleManager.isRetryEligible(story)).thenReturn(true);
        when(processingService.enqueue("s-1")).thenReturn(false);
        when(lifecycleManager.findStoriesNeedingAttention()).thenReturn(List.of());

        assertEquals(0, scheduler.sweep());

        verify(metricsService, never()).recordStoryRetried();
    }

    @Test
    void scheduledSweep_disabled_doesNothing() {
        properties.setRetryEnabled(false);

        scheduler.scheduledSweep();

        verifyNoInteractions(lifecycleManager, processingService, metricsService);
    }

    private static StoryEntity failed(String id, int retryCount) {
        StoryEntity story = new StoryEntity("ref-" + id, "Story " + id);
        story.setId(id);
        story.setStatus(StoryStatus.FAILED);
        story.setRetryCount(retryCount);
        return story;
    }
}
