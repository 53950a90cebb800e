package org.example.storyprep.text;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class HtmlTextTest {

    @Test
    void toParagraphText_keepsParagraphsLineBreaksAndRules() {
        String html = """
                <html><head><title>Ignored</title><style>p { color: red; }</style></head>
                <body>
                  <p>One</p>
                  <p>Two<br>Three</p>
                  <hr>
                  <p>Four</p>
                  <script>alert('x')</script>
                </body></html>
                """;

        assertEquals("One\n\nTwo\nThree\n\n* * *\n\nFour", HtmlText.toParagraphText(html));
    }

    @Test
    void toParagraphText_dividerBetweenLineBreaks_isSetApartAsSceneBreak() {
        String text = HtmlText.toParagraphText("<p>End of scene.<br>* * *<br>Next scene.</p>");

        assertEquals("End of scene.\n\n* * *\n\nNext scene.", text);
        assertEquals(List.of(1), StoryText.parse(text).sceneBreakIndices());
    }

    @Test
    void toParagraphText_replacesNonBreakingSpaces() {
        assertEquals("A B", HtmlText.toParagraphText("<p>A&nbsp;B</p>"));
    }

    @Test
    void toParagraphText_blankInput_returnsEmpty() {
        assertEquals("", HtmlText.toParagraphText((String) null));
        assertEquals("", HtmlText.toParagraphText("  "));
    }
}
