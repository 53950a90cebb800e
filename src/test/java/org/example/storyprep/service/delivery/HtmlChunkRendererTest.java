package org.example.storyprep.service.delivery;

import org.example.storyprep.config.DeliveryProperties;
import org.example.storyprep.entity.StoryChunkEntity;
import org.example.storyprep.entity.StoryEntity;
import org.example.storyprep.service.chunking.RecapGenerator;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HtmlChunkRendererTest {

    private final HtmlChunkRenderer renderer = new HtmlChunkRenderer(new DeliveryProperties());

    @Test
    void render_buildsTitledDocumentWithSubject() {
        StoryEntity story = new StoryEntity("ref", "Lanterns & Salt");
        story.setAuthor("Mel");
        StoryChunkEntity chunk = new StoryChunkEntity(story, 2, 3,
                RecapGenerator.format("Ada found the key.") + "\n\nShe opened the door.\n\n* * *\n\nMorning came.");

        DeliveryArtifact artifact = renderer.render(story, chunk);

        assertEquals("Lanterns & Salt - Part 2/3", artifact.subject());
        assertEquals("lanterns-salt-part-2-of-3.html", artifact.fileName());
        assertEquals(HtmlChunkRenderer.CONTENT_TYPE, artifact.contentType());

        Document doc = Jsoup.parse(new String(artifact.content(), StandardCharsets.UTF_8));
        assertEquals("Lanterns & Salt - Part 2/3", doc.selectFirst("h1").text());
        assertEquals("by Mel", doc.selectFirst("p.author").text());
        assertEquals("Ada found the key.", doc.selectFirst("blockquote.recap").text());
        assertEquals(1, doc.select("p.scene-break").size());
        assertTrue(doc.select("p").eachText().contains("Morning came."));
        assertFalse(doc.body().text().contains(RecapGenerator.RULE));
    }

    @Test
    void render_escapesMarkupInStoryText() {
        StoryEntity story = new StoryEntity("ref", "Tags");
        StoryChunkEntity chunk = new StoryChunkEntity(story, 1, 1, "He typed <script>alert(1)</script> and waited.");

        String html = new String(renderer.render(story, chunk).content(), StandardCharsets.UTF_8);

        assertFalse(html.contains("<script>"));
        assertTrue(html.contains("&lt;script&gt;"));
    }

    @Test
    void slug_normalizesAccentsAndFallsBack() {
        assertEquals("cafe-noir-chapter-3", HtmlChunkRenderer.slug("Café Noir: Chapter 3!"));
        assertEquals("story", HtmlChunkRenderer.slug("???"));
        assertEquals("story", HtmlChunkRenderer.slug(null));
    }
}
