package org.smileyface.sitecrawler.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContentExtractorTest {

    private final ContentExtractor extractor = new ContentExtractor();

    @Test
    void extract_nullOrBlankHtml_returnsEmptyString() {
        assertEquals("", extractor.extractReadableText((String) null));
        assertEquals("", extractor.extractReadableText("   "));
    }

    @Test
    void extract_prefersArticleParagraphs() {
        String html = """
                <html><body>
                  <nav><p>Menu entry</p></nav>
                  <article>
                    <h1>Heading</h1>
                    <p>First article paragraph.</p>
                    <p>Second article paragraph.</p>
                  </article>
                  <footer><p>Footer text</p></footer>
                </body></html>
                """;

        String text = extractor.extractReadableText(html);

        assertEquals("First article paragraph.\n\nSecond article paragraph.", text);
    }

    @Test
    void extract_usesAllParagraphs_whenNoArticle() {
        String html = """
                <html><body>
                  <div><p>One</p></div>
                  <p>   </p>
                  <section><p>Two</p></section>
                </body></html>
                """;

        assertEquals("One\n\nTwo", extractor.extractReadableText(html));
    }

    @Test
    void extract_articleWithoutParagraphs_fallsBackToDocumentParagraphs() {
        String html = """
                <html><body>
                  <article><div>Only a div</div></article>
                  <p>Outside paragraph</p>
                </body></html>
                """;

        assertEquals("Outside paragraph", extractor.extractReadableText(html));
    }

    @Test
    void extract_fallsBackToVisibleText_whenNoParagraphs() {
        String html = """
                <html><head><title>Ignored title</title></head><body>
                  <div>Line one</div>
                  <script>var x = 1;</script>
                  <style>.a { color: red; }</style>
                  <span>Line two</span>
                </body></html>
                """;

        assertEquals("Line one\nLine two", extractor.extractReadableText(html));
    }

    @Test
    void extract_skipsHiddenContent() {
        String html = """
                <html><body>
                  <p>Visible</p>
                  <div style="display: none"><p>Hidden by style</p></div>
                  <p hidden>Hidden by attribute</p>
                  <noscript><p>Enable JavaScript</p></noscript>
                </body></html>
                """;

        assertEquals("Visible", extractor.extractReadableText(html));
    }

    @Test
    void extract_nestedParagraphContent_isNotDuplicated() {
        Document doc = Jsoup.parse("<p>Outer <b>bold</b> text</p>");

        assertEquals("Outer bold text", extractor.extractReadableText(doc));
        assertEquals(1, extractor.extractContent(doc.body()).size());
    }

    @Test
    void extract_emptyPage_returnsEmptyString() {
        assertEquals("", extractor.extractReadableText("<html><body><script>x()</script></body></html>"));
    }

    @Test
    void visibleText_nullRoot_isEmpty() {
        assertEquals("", extractor.visibleText(null));
        assertTrue(extractor.extractContent(null).isEmpty());
    }
}
