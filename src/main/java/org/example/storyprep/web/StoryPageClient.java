package org.example.storyprep.web;

import org.example.storyprep.config.ExtractionProperties;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Fetches a story page, unlocking WordPress password-protected posts when a password is supplied.
 */
@Component
public class StoryPageClient {

    private static final Logger log = LoggerFactory.getLogger(StoryPageClient.class);

    private final StoryPageParser parser;
    private final ExtractionProperties properties;

    public StoryPageClient(StoryPageParser parser, ExtractionProperties properties) {
        this.parser = parser;
        this.properties = properties;
    }

    public record FetchedPage(Document document, boolean passwordSubmitted, boolean passwordRequired) {
    }

    public FetchedPage fetch(String url, String password) throws IOException {
        Connection session = Jsoup.newSession()
                .userAgent(properties.getUserAgent())
                .timeout(properties.getFetchTimeoutSeconds() * 1000)
                .followRedirects(true);

        Document page = session.newRequest().url(url).get();
        if (!parser.hasPasswordForm(page)) {
            return new FetchedPage(page, false, false);
        }
        if (password == null || password.isBlank()) {
            log.info("Password-protected page without a password: {}", url);
            return new FetchedPage(page, false, true);
        }

        String action = parser.passwordFormAction(page, url);
        log.info("Password-protected page detected, submitting password to {}", action);
        Document unlocked = session.newRequest()
                .url(action)
                .data("post_password", password)
                .data("Submit", "Enter")
                .post();
        return new FetchedPage(unlocked, true, true);
    }
}
