package org.example.storyprep.web;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.List;
import java.util.Optional;

@Component
public class StoryPageParser {

    public static final String PASSWORD_FORM_SELECTOR = "form.post-password-form";
    public static final String DEFAULT_PASSWORD_ACTION = "/wp-login.php?action=postpass";

    // WordPress and common blog layouts, most specific first.
    static final List<String> CONTENT_SELECTORS = List.of(
            "article .entry-content",
            ".entry-content",
            ".post-content",
            ".article-content",
            "article .content",
            ".chapter-content",
            "article",
            "main"
    );

    private static final String NOISE_SELECTOR =
            "script, style, nav, .sharedaddy, .jp-relatedposts, .comments, footer";

    private static final int GENERIC_SELECTOR_START = CONTENT_SELECTORS.indexOf("article");

    public record ContentBlock(Element element, String selector, int textLength) {

        public boolean specificSelector() {
            int index = CONTENT_SELECTORS.indexOf(selector);
            return index >= 0 && index < GENERIC_SELECTOR_START;
        }
    }

    public boolean hasPasswordForm(Document doc) {
        return doc != null && !doc.select(PASSWORD_FORM_SELECTOR).isEmpty();
    }

    /**
     * Absolute URL the password form posts to, falling back to the WordPress default endpoint.
     */
    public String passwordFormAction(Document doc, String pageUrl) {
        Element form = doc.selectFirst(PASSWORD_FORM_SELECTOR);
        String action = form != null ? form.absUrl("action") : "";
        if (!action.isBlank()) {
            return action;
        }
        String base = doc.location() == null || doc.location().isBlank() ? pageUrl : doc.location();
        return resolve(base, DEFAULT_PASSWORD_ACTION);
    }

    /**
     * Walks the selectors in priority order and returns the largest block under the first selector
     * that has one with more than {@code minChars} characters of text. Noise is removed from the
     * returned element.
     */
    public Optional<ContentBlock> findContent(Document doc, int minChars) {
        if (doc == null) {
            return Optional.empty();
        }
        for (String selector : CONTENT_SELECTORS) {
            Elements candidates = doc.select(selector);
            ContentBlock best = null;
            for (Element candidate : candidates) {
                Element cleaned = candidate.clone();
                cleaned.select(NOISE_SELECTOR).remove();
                int length = cleaned.text().length();
                if (length > minChars && (best == null || length > best.textLength())) {
                    best = new ContentBlock(cleaned, selector, length);
                }
            }
            if (best != null) {
                return Optional.of(best);
            }
        }
        return Optional.empty();
    }

    public String pageTitle(Document doc) {
        if (doc == null) {
            return null;
        }
        Element heading = doc.selectFirst("h1.entry-title, article h1, h1");
        if (heading != null && !heading.text().isBlank()) {
            return heading.text().trim();
        }
        String title = doc.title();
        return title == null || title.isBlank() ? null : title.trim();
    }

    private static String resolve(String base, String path) {
        if (base == null || base.isBlank()) {
            return path;
        }
        try {
            return URI.create(base).resolve(path).toString();
        } catch (IllegalArgumentException e) {
            return path;
        }
    }
}
