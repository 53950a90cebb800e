package org.example.storyprep.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Clean story text split into paragraphs, with explicit scene-break markers identified.
 */
public final class StoryText {

    public static final String SCENE_BREAK = "* * *";

    private static final Pattern PARAGRAPH_SEPARATOR = Pattern.compile("\\n\\s*\\n");

    // "---", "***", "* * *", "═══", "~~~", "#", "--", "• • •" and similar divider runs.
    private static final Pattern SCENE_BREAK_PATTERN = Pattern.compile(
            "^(?:[-*_=~#•·═─]\\s*)+$"
    );

    public record Paragraph(int index, String text, int wordCount, boolean sceneBreak) {
    }

    private final List<Paragraph> paragraphs;
    private final int narrativeWords;

    private StoryText(List<Paragraph> paragraphs) {
        this.paragraphs = Collections.unmodifiableList(paragraphs);
        this.narrativeWords = paragraphs.stream()
                .filter(p -> !p.sceneBreak())
                .mapToInt(Paragraph::wordCount)
                .sum();
    }

    public static StoryText parse(String text) {
        List<Paragraph> paragraphs = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return new StoryText(paragraphs);
        }
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        for (String block : PARAGRAPH_SEPARATOR.split(normalized)) {
            // A divider line is its own paragraph even when only single newlines surround it.
            List<String> pending = new ArrayList<>();
            for (String line : block.split("\n")) {
                if (isSceneBreak(line)) {
                    addParagraph(paragraphs, pending);
                    paragraphs.add(new Paragraph(paragraphs.size(), line.strip(), 0, true));
                } else {
                    pending.add(line);
                }
            }
            addParagraph(paragraphs, pending);
        }
        return new StoryText(paragraphs);
    }

    private static void addParagraph(List<Paragraph> paragraphs, List<String> lines) {
        String paragraph = String.join("\n", lines).strip();
        lines.clear();
        if (!paragraph.isEmpty()) {
            paragraphs.add(new Paragraph(paragraphs.size(), paragraph, TextMetrics.countWords(paragraph), false));
        }
    }

    public static boolean isSceneBreak(String paragraph) {
        if (paragraph == null) {
            return false;
        }
        String trimmed = paragraph.strip();
        if (trimmed.isEmpty() || trimmed.length() > 40) {
            return false;
        }
        return SCENE_BREAK_PATTERN.matcher(trimmed).matches();
    }

    public List<Paragraph> paragraphs() {
        return paragraphs;
    }

    public int size() {
        return paragraphs.size();
    }

    public boolean isEmpty() {
        return paragraphs.isEmpty();
    }

    public Paragraph get(int index) {
        return paragraphs.get(index);
    }

    public int narrativeWords() {
        return narrativeWords;
    }

    public List<Integer> sceneBreakIndices() {
        List<Integer> indices = new ArrayList<>();
        for (Paragraph paragraph : paragraphs) {
            if (paragraph.sceneBreak()) {
                indices.add(paragraph.index());
            }
        }
        return indices;
    }

    /**
     * Narrative words in paragraphs [from, to).
     */
    public int wordsBetween(int from, int to) {
        int total = 0;
        for (int i = Math.max(0, from); i < Math.min(to, paragraphs.size()); i++) {
            total += paragraphs.get(i).wordCount();
        }
        return total;
    }

    /**
     * Joins the non-marker paragraphs in [from, to) with blank lines.
     */
    public String join(int from, int to) {
        StringBuilder builder = new StringBuilder();
        for (int i = Math.max(0, from); i < Math.min(to, paragraphs.size()); i++) {
            Paragraph paragraph = paragraphs.get(i);
            if (paragraph.sceneBreak()) {
                continue;
            }
            if (!builder.isEmpty()) {
                builder.append("\n\n");
            }
            builder.append(paragraph.text());
        }
        return builder.toString();
    }
}
