package org.example.storyprep.service;

import org.example.storyprep.config.LifecycleProperties;
import org.example.storyprep.entity.StoryEntity;
import org.example.storyprep.entity.StoryStatus;
import org.example.storyprep.repository.StoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProcessingRecoveryServiceTest {

    @Mock
    private StoryRepository storyRepository;

    @Mock
    private StoryLifecycleManager lifecycleManager;

    @Mock
    private StoryProcessingService processingService;

    private LifecycleProperties properties;
    private ProcessingRecoveryService service;

    @BeforeEach
    void setUp() {
        properties = new LifecycleProperties();
        service = new ProcessingRecoveryService(storyRepository, lifecycleManager, processingService, properties);
    }

    @Test
    void recoverInterruptedWork_failsProcessingAndRequeuesPending() {
        when(storyRepository.findByStatus(StoryStatus.PROCESSING))
                .thenReturn(List.of(story("s-1", StoryStatus.PROCESSING), story("s-2", StoryStatus.PROCESSING)));
        lenient().when(lifecycleManager.markFailed("s-2", ProcessingRecoveryService.INTERRUPTED_MESSAGE))
                .thenThrow(new IllegalStoryTransitionException("s-2", StoryStatus.CHUNKED, StoryStatus.FAILED));
        when(storyRepository.findByStatus(StoryStatus.PENDING))
                .thenReturn(List.of(story("s-3", StoryStatus.PENDING), story("s-4", StoryStatus.PENDING)));
        when(processingService.enqueue("s-3")).thenReturn(true);
        when(processingService.enqueue("s-4")).thenReturn(true);

        ProcessingRecoveryService.RecoverySummary summary = service.recoverInterruptedWork();

        assertEquals(1, summary.interruptedFailed());
        assertEquals(2, summary.pendingRequeued());
        verify(lifecycleManager).markFailed("s-1", ProcessingRecoveryService.INTERRUPTED_MESSAGE);
    }

    @Test
    void recoverInterruptedWork_disabled_touchesNothing() {
        properties.setRecoveryEnabled(false);

        ProcessingRecoveryService.RecoverySummary summary = service.recoverInterruptedWork();

        assertEquals(0, summary.interruptedFailed());
        assertEquals(0, summary.pendingRequeued());
        verifyNoInteractions(storyRepository, lifecycleManager, processingService);
    }

    private static StoryEntity story(String id, StoryStatus status) {
        StoryEntity story = new StoryEntity("ref-" + id, "Story " + id);
        story.setId(id);
        story.setStatus(status);
        return story;
    }
}
