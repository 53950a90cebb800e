package org.example.storyprep.text;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns email or page HTML into paragraph text: one paragraph per block element,
 * separated by blank lines, with {@code <hr>} kept as a scene break.
 */
public final class HtmlText {

    private static final String NOISE_SELECTOR = "script, style, noscript, head, title";

    private HtmlText() {
    }

    public static String toParagraphText(String html) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document doc = Jsoup.parse(html);
        return toParagraphText(doc.body() != null ? doc.body() : doc);
    }

    public static String toParagraphText(Element root) {
        if (root == null) {
            return "";
        }
        Element copy = root.clone();
        copy.select(NOISE_SELECTOR).remove();

        StringBuilder raw = new StringBuilder();
        NodeTraversor.traverse(new ParagraphVisitor(raw), copy);
        return normalizeParagraphs(raw.toString());
    }

    static String normalizeParagraphs(String raw) {
        List<String> paragraphs = new ArrayList<>();
        for (String block : raw.split("\\n\\s*\\n")) {
            List<String> lines = new ArrayList<>();
            for (String line : block.split("\\n")) {
                String trimmed = TextMetrics.normalizeWhitespace(line.replace('\u00A0', ' '));
                if (trimmed.isEmpty()) {
                    continue;
                }
                if (StoryText.isSceneBreak(trimmed)) {
                    flush(paragraphs, lines);
                    paragraphs.add(trimmed);
                } else {
                    lines.add(trimmed);
                }
            }
            flush(paragraphs, lines);
        }
        return String.join("\n\n", paragraphs);
    }

    private static void flush(List<String> paragraphs, List<String> lines) {
        if (!lines.isEmpty()) {
            paragraphs.add(String.join("\n", lines));
            lines.clear();
        }
    }

    private static final class ParagraphVisitor implements NodeVisitor {

        private final StringBuilder out;

        private ParagraphVisitor(StringBuilder out) {
            this.out = out;
        }

        @Override
        public void head(Node node, int depth) {
            if (node instanceof TextNode textNode) {
                out.append(textNode.getWholeText().replace('\n', ' '));
            } else if (node instanceof Element element) {
                String tag = element.normalName();
                if ("br".equals(tag)) {
                    out.append('\n');
                } else if ("hr".equals(tag)) {
                    out.append("\n\n").append(StoryText.SCENE_BREAK).append("\n\n");
                } else if (element.isBlock()) {
                    out.append("\n\n");
                }
            }
        }

        @Override
        public void tail(Node node, int depth) {
            if (node instanceof Element element && element.isBlock() && !"hr".equals(element.normalName())) {
                out.append("\n\n");
            }
        }
    }
}
