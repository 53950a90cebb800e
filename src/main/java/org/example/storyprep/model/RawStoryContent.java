package org.example.storyprep.model;

/**
 * Inbound content descriptor: an email body and/or a link to the story, with an optional access password.
 */
public record RawStoryContent(
        String sourceRef,
        String text,
        String html,
        String subject,
        String from,
        String url,
        String password
) {

    public RawStoryContent {
        text = text == null ? "" : text;
        html = html == null ? "" : html;
        subject = subject == null ? "" : subject;
        from = from == null ? "" : from;
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }

    public boolean hasPassword() {
        return password != null && !password.isBlank();
    }

    public int bodyLength() {
        return text.length() + html.length();
    }

    public RawStoryContent withUrlAndPassword(String newUrl, String newPassword) {
        return new RawStoryContent(sourceRef, text, html, subject, from, newUrl, newPassword);
    }
}
