package org.example.storyprep.text;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Drops newsletter and platform chrome (app links, Patreon pitches, unsubscribe footers)
 * that email delivery wraps around a story.
 */
public final class BoilerplateFilter {

    private static final int MAX_BOILERPLATE_LENGTH = 240;

    private static final List<String> BOILERPLATE_PHRASES = List.of(
            "view in app",
            "view in browser",
            "read online",
            "open in browser",
            "open in app",
            "unsubscribe",
            "manage your subscription",
            "update your preferences",
            "you are receiving this",
            "you're receiving this",
            "support me on patreon",
            "become a patron",
            "patreon.com",
            "share this post",
            "like this post",
            "forwarded this email"
    );

    private static final Pattern DATE_LINE = Pattern.compile(
            "^(jan|feb|mar|apr|may|jun|jul|aug|sep|sept|oct|nov|dec)[a-z]*\\.?\\s+\\d{1,2},\\s+\\d{4}$",
            Pattern.CASE_INSENSITIVE
    );

    private BoilerplateFilter() {
    }

    public static String clean(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        List<String> kept = new ArrayList<>();
        for (String paragraph : text.split("\\n\\s*\\n")) {
            List<String> lines = new ArrayList<>();
            for (String line : paragraph.split("\\n")) {
                if (!isBoilerplate(line)) {
                    lines.add(line.strip());
                }
            }
            String joined = String.join("\n", lines).strip();
            if (!joined.isEmpty()) {
                kept.add(joined);
            }
        }
        return String.join("\n\n", kept);
    }

    public static boolean isBoilerplate(String line) {
        if (line == null) {
            return false;
        }
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.length() > MAX_BOILERPLATE_LENGTH) {
            return false;
        }
        if (DATE_LINE.matcher(trimmed).matches()) {
            return true;
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (String phrase : BOILERPLATE_PHRASES) {
            if (lower.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
