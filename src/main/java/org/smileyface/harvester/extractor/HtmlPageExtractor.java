package org.smileyface.harvester.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.smileyface.harvester.util.CrawlerUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Generic extractor used by the crawler: page title, page classification, configured keywords found on the page
 * and every outgoing http(s) link.
 */
public class HtmlPageExtractor implements PageExtractor {

    public static final String TITLE = "title";
    public static final String CONTENT_TYPE = "contentType";
    public static final String REQUIRES_JS = "requiresJs";
    public static final String KEYWORDS = "keywords";
    public static final String KEYWORD_SCORES = "keywordScores";

    private final PageClassifier classifier;
    private final boolean detectJs;
    private final KeywordMatcher keywords;

    public HtmlPageExtractor(PageClassifier classifier, boolean detectJs) {
        this(classifier, detectJs, new KeywordMatcher(List.of()));
    }

    public HtmlPageExtractor(PageClassifier classifier, boolean detectJs, KeywordMatcher keywords) {
        this.classifier = classifier;
        this.detectJs = detectJs;
        this.keywords = keywords == null ? new KeywordMatcher(List.of()) : keywords;
    }

    @Override
    public Extraction extract(String html, String url) {
        if (html == null) {
            throw new ExtractionException("No content for " + url);
        }
        Document doc = Jsoup.parse(html, url);

        Map<String, Object> fields = new LinkedHashMap<>();
        String title = CrawlerUtils.cleanText(doc.title());
        if (title != null && !title.isEmpty()) fields.put(TITLE, title);
        fields.put(CONTENT_TYPE, classifier.classify(doc));
        if (detectJs) fields.put(REQUIRES_JS, classifier.requiresJavaScript(doc));
        if (!keywords.isEmpty()) {
            Map<String, Double> scores = keywords.score(doc);
            fields.put(KEYWORDS, new ArrayList<>(scores.keySet()));
            fields.put(KEYWORD_SCORES, scores);
        }

        Set<String> links = new LinkedHashSet<>();
        for (Element a : doc.select("a[href]")) {
            String normalized = CrawlerUtils.normalizeUrl(a.absUrl("href"));
            if (normalized != null) links.add(normalized);
        }
        return new Extraction(fields, new ArrayList<>(links), List.of(), null);
    }
}
