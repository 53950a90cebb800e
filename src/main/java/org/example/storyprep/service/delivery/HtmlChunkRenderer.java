package org.example.storyprep.service.delivery;

import org.example.storyprep.config.DeliveryProperties;
import org.example.storyprep.entity.StoryChunkEntity;
import org.example.storyprep.entity.StoryEntity;
import org.example.storyprep.service.chunking.RecapGenerator;
import org.example.storyprep.text.StoryText;
import org.jsoup.nodes.Entities;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.Locale;

/**
 * Self-contained XHTML document per chunk. The recap header becomes a styled blockquote between rules.
 */
@Component
public class HtmlChunkRenderer implements ChunkRenderer {

    public static final String CONTENT_TYPE = "text/html";

    private final DeliveryProperties properties;

    public HtmlChunkRenderer(DeliveryProperties properties) {
        this.properties = properties;
    }

    @Override
    public DeliveryArtifact render(StoryEntity story, StoryChunkEntity chunk) {
        String subject = ChunkRenderer.subject(story.getTitle(), chunk.getChunkNumber(), chunk.getTotalChunks());
        String html = renderDocument(subject, story.getAuthor(), chunk.getText());
        return new DeliveryArtifact(
                fileName(story.getTitle(), chunk.getChunkNumber(), chunk.getTotalChunks()),
                CONTENT_TYPE,
                html.getBytes(StandardCharsets.UTF_8),
                subject
        );
    }

    @Override
    public String fileName(String title, int chunkNumber, int totalChunks) {
        return slug(title) + "-part-" + chunkNumber + "-of-" + totalChunks + ".html";
    }

    String renderDocument(String heading, String author, String text) {
        StringBuilder html = new StringBuilder();
        html.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
                .append("<!DOCTYPE html>\n")
                .append("<html xmlns=\"http://www.w3.org/1999/xhtml\" lang=\"en\">\n")
                .append("<head>\n")
                .append("<meta charset=\"UTF-8\"/>\n")
                .append("<title>").append(escape(heading)).append("</title>\n");
        if (author != null && !author.isBlank()) {
            html.append("<meta name=\"author\" content=\"").append(escape(author)).append("\"/>\n");
        }
        html.append("<meta name=\"publisher\" content=\"").append(escape(properties.getPublisher())).append("\"/>\n")
                .append("<style>body{font-family:serif;line-height:1.5;} blockquote.recap{font-style:italic;}</style>\n")
                .append("</head>\n<body>\n")
                .append("<h1>").append(escape(heading)).append("</h1>\n");
        if (author != null && !author.isBlank()) {
            html.append("<p class=\"author\">by ").append(escape(author)).append("</p>\n");
        }
        appendBody(html, text == null ? "" : text);
        html.append("</body>\n</html>\n");
        return html.toString();
    }

    private void appendBody(StringBuilder html, String text) {
        String body = text;
        String recapOpening = RecapGenerator.RULE + "\n" + RecapGenerator.HEADING;
        if (text.startsWith(recapOpening)) {
            // The recap is framed by rule lines that would otherwise parse as scene breaks.
            int closing = text.indexOf("\n" + RecapGenerator.RULE, recapOpening.length());
            int end = closing < 0 ? text.length() : closing + 1 + RecapGenerator.RULE.length();
            appendRecap(html, text.substring(0, end));
            body = text.substring(end);
        }
        for (StoryText.Paragraph paragraph : StoryText.parse(body).paragraphs()) {
            String value = paragraph.text();
            if (paragraph.sceneBreak()) {
                html.append("<p class=\"scene-break\">").append(escape(StoryText.SCENE_BREAK)).append("</p>\n");
            } else {
                html.append("<p>").append(escape(value).replace("\n", "<br/>")).append("</p>\n");
            }
        }
    }

    private void appendRecap(StringBuilder html, String recapBlock) {
        StringBuilder synopsis = new StringBuilder();
        for (String line : recapBlock.split("\n")) {
            if (line.startsWith("> ")) {
                synopsis.append(line.substring(2));
            }
        }
        html.append("<hr/>\n<p><em>Previously:</em></p>\n")
                .append("<blockquote class=\"recap\">").append(escape(synopsis.toString().trim())).append("</blockquote>\n")
                .append("<hr/>\n");
    }

    private static String escape(String value) {
        return Entities.escape(value == null ? "" : value);
    }

    static String slug(String title) {
        String base = title == null ? "" : Normalizer.normalize(title, Normalizer.Form.NFKD)
                .replaceAll("\\p{M}", "")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "-")
                .replaceAll("(^-+|-+$)", "");
        if (base.isEmpty()) {
            return "story";
        }
        return base.length() > 60 ? base.substring(0, 60).replaceAll("-+$", "") : base;
    }
}
