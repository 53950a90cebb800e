package org.example.storyprep.service.event;

import org.example.storyprep.config.DeliveryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.stream.Collectors;

/**
 * Emails the admin about pipeline events. Runs after the surrounding transaction commits; a failed
 * notification is logged and never affects the pipeline.
 */
@Component
public class AdminEmailNotifier {

    private static final Logger log = LoggerFactory.getLogger(AdminEmailNotifier.class);

    private final JavaMailSender mailSender;
    private final DeliveryProperties properties;

    public AdminEmailNotifier(JavaMailSender mailSender, DeliveryProperties properties) {
        this.mailSender = mailSender;
        this.properties = properties;
    }

    @TransactionalEventListener(fallbackExecution = true)
    public void onPipelineEvent(PipelineEvent event) {
        if (!properties.hasAdminEmail()) {
            return;
        }
        SimpleMailMessage message = new SimpleMailMessage();
        message.setTo(properties.getAdminEmail());
        if (properties.getFromEmail() != null && !properties.getFromEmail().isBlank()) {
            message.setFrom(properties.getFromEmail());
        }
        message.setSubject(subject(event));
        message.setText(body(event));
        try {
            mailSender.send(message);
        } catch (MailException e) {
            log.warn("Failed to send admin notification for {} (story {})", event.type(), event.storyId(), e);
        }
    }

    static String subject(PipelineEvent event) {
        String title = event.detail("title") == null ? "story " + event.storyId() : event.detail("title");
        return switch (event.type()) {
            case STORY_RECEIVED -> "New Story Received: " + title;
            case STORY_CHUNKED -> "Story Chunked: " + title + " (" + event.detail("totalChunks") + " chunks)";
            case STORY_FAILED -> "Error: Processing Failed - " + title;
            case CHUNK_DELIVERED -> "Delivered: " + title
                    + " (Part " + event.detail("chunkNumber") + "/" + event.detail("totalChunks") + ")";
            case DELIVERY_FAILED -> "Error: Delivery Failed - " + title;
            case QUEUE_EMPTY -> "Story Queue Empty";
        };
    }

    static String body(PipelineEvent event) {
        String details = event.details().entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .sorted()
                .collect(Collectors.joining("\n"));
        StringBuilder body = new StringBuilder()
                .append("Event: ").append(event.type()).append('\n')
                .append("Time: ").append(event.occurredAt()).append('\n');
        if (event.storyId() != null) {
            body.append("Story: ").append(event.storyId()).append('\n');
        }
        if (event.chunkId() != null) {
            body.append("Chunk: ").append(event.chunkId()).append('\n');
        }
        if (event.type() == PipelineEventType.QUEUE_EMPTY) {
            body.append("\nThere are no unsent chunks left. Forward a new story to keep the daily delivery going.\n");
        }
        if (!details.isEmpty()) {
            body.append('\n').append(details).append('\n');
        }
        return body.toString();
    }
}
