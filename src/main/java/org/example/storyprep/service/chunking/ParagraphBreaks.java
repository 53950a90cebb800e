package org.example.storyprep.service.chunking;

import org.example.storyprep.text.StoryText;
import org.example.storyprep.text.TextMetrics;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Helpers shared by the model-backed chunkers.
 */
final class ParagraphBreaks {

    private ParagraphBreaks() {
    }

    /**
     * Numbered paragraph listing for prompts, 1-based, cut off once {@code maxChars} is reached.
     */
    static String numberedParagraphs(StoryText story, int maxChars) {
        StringBuilder out = new StringBuilder();
        for (StoryText.Paragraph paragraph : story.paragraphs()) {
            String line = paragraph.sceneBreak()
                    ? "[" + (paragraph.index() + 1) + "] <SCENE BREAK>\n\n"
                    : "[" + (paragraph.index() + 1) + "] (" + paragraph.wordCount() + " words) "
                    + TextMetrics.normalizeWhitespace(paragraph.text()) + "\n\n";
            if (out.length() + line.length() > maxChars) {
                out.append("[... remaining paragraphs truncated ...]\n");
                break;
            }
            out.append(line);
        }
        return out.toString();
    }

    /**
     * Converts 1-based "break after paragraph n" numbers into chunk start indices, dropping values out
     * of range and breaks that would leave fewer than {@code minTrailingWords} behind them.
     */
    static List<Integer> toStartIndices(StoryText story, List<Integer> paragraphNumbers, int minTrailingWords) {
        TreeSet<Integer> starts = new TreeSet<>();
        for (Integer number : paragraphNumbers) {
            if (number == null || number < 1 || number >= story.size()) {
                continue;
            }
            if (story.wordsBetween(number, story.size()) < minTrailingWords) {
                continue;
            }
            starts.add(number);
        }
        return new ArrayList<>(starts);
    }

    static int estimatedChunks(StoryText story, int targetWords) {
        return Math.max(1, (int) Math.round(story.narrativeWords() / (double) Math.max(1, targetWords)));
    }
}
