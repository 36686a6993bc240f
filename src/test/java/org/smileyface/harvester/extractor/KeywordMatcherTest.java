package org.smileyface.harvester.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class KeywordMatcherTest {

    private static Document doc() {
        return Jsoup.parse("<html><head><title>Cardiology Clinic</title>"
                + "<meta name='description' content='Heart care in Los Angeles'></head><body>"
                + "<h1>Cardiology</h1><p>Our cardiology team runs heart checks. Cardiologyx is not a word.</p>"
                + "</body></html>", "https://example.com/");
    }

    /**
     * Title 10, description 8, one heading 5, body hits 0.5 each.
     */
    @Test
    void testScoresBySection() {
        KeywordMatcher matcher = new KeywordMatcher(List.of("Cardiology", " heart ", "dentist", " ", "cardiology"));

        Map<String, Double> scores = matcher.score(doc());

        assertEquals(List.of("cardiology", "heart"), List.copyOf(scores.keySet()));
        assertEquals(16.0, scores.get("cardiology"));
        assertEquals(8.5, scores.get("heart"));
        assertNull(scores.get("dentist"));
    }

    @Test
    void testBodyScoreIsCapped() {
        KeywordMatcher matcher = new KeywordMatcher(List.of("care"));
        Document d = Jsoup.parse("<html><body><p>" + "care ".repeat(30) + "</p></body></html>");

        assertEquals(5.0, matcher.score(d).get("care"));
    }

    @Test
    void testExtractorStoresMatchedKeywords() {
        assertTrue(new KeywordMatcher(null).isEmpty());
        HtmlPageExtractor plain = new HtmlPageExtractor(new PageClassifier(), false);
        assertFalse(plain.extract(doc().outerHtml(), "https://example.com/").fields().containsKey(HtmlPageExtractor.KEYWORDS));

        HtmlPageExtractor extractor = new HtmlPageExtractor(new PageClassifier(), false, new KeywordMatcher(List.of("heart", "dentist")));
        Extraction extraction = extractor.extract(doc().outerHtml(), "https://example.com/");

        assertEquals(List.of("heart"), extraction.field(HtmlPageExtractor.KEYWORDS));
        assertEquals(Map.of("heart", 8.5), extraction.field(HtmlPageExtractor.KEYWORD_SCORES));
    }
}
