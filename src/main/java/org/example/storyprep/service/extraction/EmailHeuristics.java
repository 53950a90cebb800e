package org.example.storyprep.service.extraction;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Title, author, link and password detection for story emails.
 */
public final class EmailHeuristics {

    public static final String DEFAULT_TITLE = "Untitled Story";

    private static final Pattern REPLY_PREFIX = Pattern.compile("^\\s*(re|fwd|fw)\\s*:\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern DISPLAY_NAME = Pattern.compile("^\\s*\"?([^<\"]+?)\"?\\s*<");
    private static final Pattern LOCAL_PART = Pattern.compile("^\\s*<?([^@<\\s]+)@");
    private static final Pattern URL = Pattern.compile("https?://[^\\s<>\"')\\]]+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;!?]+$");

    private static final List<Pattern> PASSWORD_PATTERNS = List.of(
            Pattern.compile("\\bpassword[:\\s]+[\"']?([^\\s\"'<>]+)[\"']?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bpass[:\\s]+[\"']?([^\\s\"'<>]+)[\"']?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bcode[:\\s]+[\"']?([^\\s\"'<>]+)[\"']?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bpw[:\\s]+[\"']?([^\\s\"'<>]+)[\"']?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bpassword:\\s*\\n\\s*(\\S+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bpass:\\s*\\n\\s*(\\S+)", Pattern.CASE_INSENSITIVE)
    );

    private static final Set<String> STOP_WORDS = Set.of("the", "is", "a", "for", "to", "and", "of");

    private EmailHeuristics() {
    }

    public static String cleanSubject(String subject) {
        if (subject == null) {
            return DEFAULT_TITLE;
        }
        String cleaned = subject.trim();
        Matcher matcher = REPLY_PREFIX.matcher(cleaned);
        while (matcher.lookingAt()) {
            cleaned = cleaned.substring(matcher.end()).trim();
            matcher = REPLY_PREFIX.matcher(cleaned);
        }
        return cleaned.isEmpty() ? DEFAULT_TITLE : cleaned;
    }

    /**
     * Display name of {@code Name <addr>}, else the local part of the address, else null.
     */
    public static String extractAuthor(String from) {
        if (from == null || from.isBlank()) {
            return null;
        }
        Matcher display = DISPLAY_NAME.matcher(from);
        if (display.find() && !display.group(1).isBlank()) {
            return display.group(1).trim();
        }
        Matcher local = LOCAL_PART.matcher(from);
        if (local.find()) {
            return local.group(1).trim();
        }
        return null;
    }

    public static Optional<String> findUrl(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = URL.matcher(text);
        if (matcher.find()) {
            return Optional.of(TRAILING_PUNCTUATION.matcher(matcher.group()).replaceAll(""));
        }
        return Optional.empty();
    }

    public static Optional<String> findPassword(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        for (Pattern pattern : PASSWORD_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String candidate = TRAILING_PUNCTUATION.matcher(matcher.group(1).trim()).replaceAll("");
                if (isPlausiblePassword(candidate)) {
                    return Optional.of(candidate);
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isPlausiblePassword(String candidate) {
        if (candidate.isEmpty()) {
            return false;
        }
        String lower = candidate.toLowerCase(Locale.ROOT);
        return !lower.startsWith("http") && !STOP_WORDS.contains(lower);
    }
}
