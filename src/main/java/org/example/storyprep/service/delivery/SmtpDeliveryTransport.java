package org.example.storyprep.service.delivery;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.example.storyprep.config.DeliveryProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

@Component
public class SmtpDeliveryTransport implements DeliveryTransport {

    private static final Logger log = LoggerFactory.getLogger(SmtpDeliveryTransport.class);

    private final JavaMailSender mailSender;
    private final DeliveryProperties properties;

    public SmtpDeliveryTransport(JavaMailSender mailSender, DeliveryProperties properties) {
        this.mailSender = mailSender;
        this.properties = properties;
    }

    @Override
    public void send(String recipient, DeliveryArtifact artifact, String bodyText) throws DeliveryException {
        if (recipient == null || recipient.isBlank()) {
            throw new DeliveryException("No recipient address configured");
        }
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
            helper.setTo(recipient);
            if (properties.getFromEmail() != null && !properties.getFromEmail().isBlank()) {
                helper.setFrom(properties.getFromEmail());
            }
            helper.setSubject(artifact.subject());
            helper.setText(bodyText == null ? "" : bodyText);
            helper.addAttachment(artifact.fileName(), new ByteArrayResource(artifact.content()), artifact.contentType());
            mailSender.send(message);
            log.info("Sent '{}' ({} bytes) to {}", artifact.subject(), artifact.content().length, recipient);
        } catch (MessagingException | MailException e) {
            throw new DeliveryException("SMTP delivery to " + recipient + " failed: " + e.getMessage(), e);
        }
    }
}
