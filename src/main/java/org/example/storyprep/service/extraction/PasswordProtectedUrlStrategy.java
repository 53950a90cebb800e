package org.example.storyprep.service.extraction;

import org.example.storyprep.config.ExtractionProperties;
import org.example.storyprep.model.RawStoryContent;
import org.example.storyprep.text.HtmlText;
import org.example.storyprep.text.TextMetrics;
import org.example.storyprep.web.StoryPageClient;
import org.example.storyprep.web.StoryPageParser;
import org.jsoup.HttpStatusException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * Follows the story link, unlocking WordPress password-protected posts, and pulls the largest
 * content block out of the page.
 */
@Component
public class PasswordProtectedUrlStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(PasswordProtectedUrlStrategy.class);

    public static final String NAME = "url";

    private final StoryPageClient pageClient;
    private final StoryPageParser pageParser;
    private final ExtractionProperties properties;

    public PasswordProtectedUrlStrategy(
            StoryPageClient pageClient,
            StoryPageParser pageParser,
            ExtractionProperties properties) {
        this.pageClient = pageClient;
        this.pageParser = pageParser;
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExtractedContent attempt(RawStoryContent content) throws ExtractionException {
        String body = content.text().isBlank() ? HtmlText.toParagraphText(content.html()) : content.text();
        String url = content.hasUrl()
                ? content.url().trim()
                : EmailHeuristics.findUrl(body)
                .or(() -> EmailHeuristics.findUrl(content.html()))
                .orElseThrow(() -> new ExtractionException(ExtractionFailureReason.NOT_APPLICABLE, "no story link found"));
        String password = content.hasPassword()
                ? content.password().trim()
                : EmailHeuristics.findPassword(body).orElse(null);

        StoryPageClient.FetchedPage page;
        try {
            page = pageClient.fetch(url, password);
        } catch (HttpStatusException e) {
            throw new ExtractionException(ExtractionFailureReason.NETWORK,
                    "HTTP " + e.getStatusCode() + " fetching " + url, e);
        } catch (IOException e) {
            throw new ExtractionException(ExtractionFailureReason.NETWORK,
                    "failed to fetch " + url + ": " + e.getMessage(), e);
        }

        if (page.passwordRequired() && !page.passwordSubmitted()) {
            throw new ExtractionException(ExtractionFailureReason.MISSING_PASSWORD,
                    "page is password protected and no password was supplied");
        }
        if (page.passwordSubmitted() && pageParser.hasPasswordForm(page.document())) {
            throw new ExtractionException(ExtractionFailureReason.MISSING_PASSWORD, "password rejected");
        }

        Optional<StoryPageParser.ContentBlock> block =
                pageParser.findContent(page.document(), properties.getUrlMinBlockChars());
        if (block.isEmpty()) {
            throw new ExtractionException(ExtractionFailureReason.PARSE,
                    "no content block with more than " + properties.getUrlMinBlockChars() + " characters");
        }

        String text = HtmlText.toParagraphText(block.get().element());
        int words = TextMetrics.countWords(text);
        log.info("Extracted {} words from {} using selector '{}'", words, url, block.get().selector());

        String title = content.subject().isBlank()
                ? Optional.ofNullable(pageParser.pageTitle(page.document())).orElse(EmailHeuristics.DEFAULT_TITLE)
                : EmailHeuristics.cleanSubject(content.subject());

        return new ExtractedContent(
                text,
                title,
                EmailHeuristics.extractAuthor(content.from()),
                NAME,
                words,
                block.get().specificSelector() ? ExtractionConfidence.HIGH : ExtractionConfidence.MEDIUM
        );
    }
}
