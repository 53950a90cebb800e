package org.example.storyprep.service.extraction;

import org.example.storyprep.config.ExtractionProperties;
import org.example.storyprep.model.RawStoryContent;
import org.example.storyprep.text.BoilerplateFilter;
import org.example.storyprep.text.HtmlText;
import org.example.storyprep.text.TextMetrics;
import org.springframework.stereotype.Component;

/**
 * Takes the story straight from the email body when the body is long enough to hold one.
 */
@Component
public class InlineTextStrategy implements ExtractionStrategy {

    public static final String NAME = "inline";

    private final ExtractionProperties properties;

    public InlineTextStrategy(ExtractionProperties properties) {
        this.properties = properties;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ExtractedContent attempt(RawStoryContent content) throws ExtractionException {
        int bodyLength = content.bodyLength();
        if (bodyLength <= properties.getInlineMinChars()) {
            throw new ExtractionException(ExtractionFailureReason.BELOW_MINIMUM_LENGTH,
                    "email body has " + bodyLength + " characters, need more than " + properties.getInlineMinChars());
        }

        String body = content.html().isBlank()
                ? content.text()
                : HtmlText.toParagraphText(content.html());
        String cleaned = BoilerplateFilter.clean(body);

        if (cleaned.strip().length() < properties.getMinContentChars()) {
            throw new ExtractionException(ExtractionFailureReason.BELOW_MINIMUM_LENGTH,
                    "only " + cleaned.strip().length() + " characters of text after cleaning");
        }

        return new ExtractedContent(
                cleaned.strip(),
                EmailHeuristics.cleanSubject(content.subject()),
                EmailHeuristics.extractAuthor(content.from()),
                NAME,
                TextMetrics.countWords(cleaned),
                ExtractionConfidence.HIGH
        );
    }
}
