package org.example.storyprep.service.extraction;

import org.example.storyprep.config.ExtractionProperties;
import org.example.storyprep.model.RawStoryContent;
import org.example.storyprep.service.llm.LlmOptions;
import org.example.storyprep.service.llm.LlmProvider;
import org.example.storyprep.service.llm.LlmProviderException;
import org.example.storyprep.text.HtmlText;
import org.example.storyprep.text.TextMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lets the extraction model decide where the story lives (inline or behind a link) and then
 * pulls it out, either through the URL strategy or with a second narrative-only extraction call.
 */
@Component
public class AgentExtractionStrategy implements ExtractionStrategy {

    private static final Logger log = LoggerFactory.getLogger(AgentExtractionStrategy.class);

    public static final String NAME = "agent";

    private static final int MAX_BODY_CHARS = 60_000;
    private static final Pattern CODE_FENCE = Pattern.compile("^```[a-zA-Z]*\\s*|\\s*```$");

    private final LlmProvider llmProvider;
    private final PasswordProtectedUrlStrategy urlStrategy;
    private final ExtractionProperties properties;

    public AgentExtractionStrategy(
            @Qualifier("extractionLlmProvider") LlmProvider llmProvider,
            PasswordProtectedUrlStrategy urlStrategy,
            ExtractionProperties properties) {
        this.llmProvider = llmProvider;
        this.urlStrategy = urlStrategy;
        this.properties = properties;
    }

    record Analysis(String strategy, String url, String password, ExtractionConfidence confidence, String reasoning) {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isEnabled() {
        return properties.isAgentEnabled();
    }

    @Override
    public ExtractedContent attempt(RawStoryContent content) throws ExtractionException {
        if (!llmProvider.isAvailable()) {
            throw new ExtractionException(ExtractionFailureReason.NOT_APPLICABLE,
                    "extraction model " + llmProvider.getProviderName() + " is not available");
        }

        String body = bodyText(content);
        Analysis analysis = analyze(content, body);
        log.info("Extraction agent chose strategy={} confidence={} ({})",
                analysis.strategy(), analysis.confidence(), analysis.reasoning());

        if (!analysis.confidence().atLeast(properties.getAgentMinConfidence())) {
            throw new ExtractionException(ExtractionFailureReason.LOW_CONFIDENCE,
                    "agent confidence " + analysis.confidence() + " is below " + properties.getAgentMinConfidence());
        }

        ExtractedContent extracted = switch (analysis.strategy()) {
            case "url" -> extractFromUrl(content, analysis);
            case "inline", "mixed" -> extractInline(content, body);
            default -> throw new ExtractionException(ExtractionFailureReason.PARSE,
                    "agent returned unknown strategy '" + analysis.strategy() + "'");
        };

        if (extracted.wordCount() < properties.getMinAgentWords()) {
            throw new ExtractionException(ExtractionFailureReason.BELOW_MINIMUM_LENGTH,
                    "agent extracted " + extracted.wordCount() + " words, need " + properties.getMinAgentWords());
        }
        return extracted.withExtractionMethod(NAME).withConfidence(analysis.confidence());
    }

    Analysis analyze(RawStoryContent content, String body) throws ExtractionException {
        String prompt = String.format("""
            You are looking at an email that delivers a chapter of serialized fiction.
            Decide where the actual story text is.

            - "inline": the email body itself contains the narrative (prose, dialogue, scenes).
            - "url": the body is mostly a link (often with a password) to the story on a website.
            Chapter numbers, dates, "View in app", author notes, Patreon links and social buttons
            are not story content.

            SUBJECT: %s
            FROM: %s
            EXPLICIT URL: %s

            EMAIL BODY:
            %s

            Respond in exactly this format:
            STRATEGY: <inline|url>
            URL: <exact url if found, otherwise none>
            PASSWORD: <exact password if found, otherwise none>
            CONFIDENCE: <high|medium|low>
            REASONING: <one or two sentences>
            """,
                content.subject(),
                content.from(),
                content.hasUrl() ? content.url() : "none",
                TextMetrics.trimToLength(body, MAX_BODY_CHARS)
        );

        String response;
        try {
            response = llmProvider.generate(prompt, LlmOptions.precise(400));
        } catch (LlmProviderException e) {
            throw new ExtractionException(ExtractionFailureReason.NETWORK,
                    "agent analysis call failed: " + e.getMessage(), e);
        }
        return parseAnalysis(response);
    }

    static Analysis parseAnalysis(String response) throws ExtractionException {
        if (response == null || response.isBlank()) {
            throw new ExtractionException(ExtractionFailureReason.PARSE, "empty agent analysis");
        }
        String strategy = field(response, "STRATEGY");
        if (strategy == null) {
            throw new ExtractionException(ExtractionFailureReason.PARSE, "agent analysis has no STRATEGY line");
        }
        return new Analysis(
                strategy.toLowerCase(Locale.ROOT),
                noneToNull(field(response, "URL")),
                noneToNull(field(response, "PASSWORD")),
                ExtractionConfidence.parse(field(response, "CONFIDENCE")),
                field(response, "REASONING")
        );
    }

    private ExtractedContent extractFromUrl(RawStoryContent content, Analysis analysis) throws ExtractionException {
        String url = analysis.url() != null ? analysis.url() : content.url();
        if (url == null || url.isBlank()) {
            throw new ExtractionException(ExtractionFailureReason.NOT_APPLICABLE, "agent chose url but found no link");
        }
        String password = analysis.password() != null ? analysis.password() : content.password();
        return urlStrategy.attempt(content.withUrlAndPassword(url, password));
    }

    private ExtractedContent extractInline(RawStoryContent content, String body) throws ExtractionException {
        String prompt = String.format("""
            Extract ONLY the story from this email. Remove headers, chapter numbers and dates,
            "View in app" / "Read online" links, author notes, Patreon pitches, social buttons
            and unsubscribe footers. Keep the narrative exactly as written, including dialogue
            and scene breaks such as "---" or "* * *". Separate paragraphs with a blank line.
            Output the story text only, with no preamble.

            EMAIL BODY:
            %s
            """, TextMetrics.trimToLength(body, MAX_BODY_CHARS));

        String response;
        try {
            response = llmProvider.generate(prompt, LlmOptions.precise(16_000));
        } catch (LlmProviderException e) {
            throw new ExtractionException(ExtractionFailureReason.NETWORK,
                    "agent extraction call failed: " + e.getMessage(), e);
        }
        String text = CODE_FENCE.matcher(response == null ? "" : response.strip()).replaceAll("").strip();
        if (text.isEmpty()) {
            throw new ExtractionException(ExtractionFailureReason.PARSE, "agent returned no story text");
        }
        return new ExtractedContent(
                text,
                EmailHeuristics.cleanSubject(content.subject()),
                EmailHeuristics.extractAuthor(content.from()),
                NAME,
                TextMetrics.countWords(text),
                ExtractionConfidence.MEDIUM
        );
    }

    private static String bodyText(RawStoryContent content) {
        if (!content.html().isBlank()) {
            return HtmlText.toParagraphText(content.html());
        }
        return content.text();
    }

    private static String field(String response, String name) {
        Matcher matcher = Pattern.compile("^\\s*\\**" + name + "\\**\\s*:\\s*(.+?)\\s*$",
                Pattern.CASE_INSENSITIVE | Pattern.MULTILINE).matcher(response);
        return matcher.find() ? matcher.group(1).trim() : null;
    }

    private static String noneToNull(String value) {
        if (value == null || value.isBlank() || "none".equalsIgnoreCase(value.trim())) {
            return null;
        }
        return value.trim();
    }
}
