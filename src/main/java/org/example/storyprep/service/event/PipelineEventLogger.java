package org.example.storyprep.service.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class PipelineEventLogger {

    private static final Logger log = LoggerFactory.getLogger(PipelineEventLogger.class);

    @EventListener
    public void onPipelineEvent(PipelineEvent event) {
        switch (event.type()) {
            case STORY_FAILED, DELIVERY_FAILED -> log.warn("pipeline event={} storyId={} chunkId={} details={}",
                    event.type(), event.storyId(), event.chunkId(), event.details());
            default -> log.info("pipeline event={} storyId={} chunkId={} details={}",
                    event.type(), event.storyId(), event.chunkId(), event.details());
        }
    }
}
