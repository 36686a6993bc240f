package org.smileyface.harvester.extractor;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores configured keywords against a page. A hit in the title counts 10, in the meta description 8, each
 * heading hit 5 (at most three), and each whole-word hit in the body 0.5 (at most 5). Matching ignores case.
 */
public class KeywordMatcher {

    private final List<String> keywords;

    public KeywordMatcher(List<String> keywords) {
        Set<String> out = new LinkedHashSet<>();
        if (keywords != null) {
            for (String k : keywords) {
                if (k != null && !k.isBlank()) out.add(k.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.keywords = List.copyOf(out);
    }

    public boolean isEmpty() {
        return keywords.isEmpty();
    }

    /**
     * @return score per matched keyword, in configuration order; keywords that do not occur are absent
     */
    public Map<String, Double> score(Document doc) {
        Map<String, Double> scores = new LinkedHashMap<>();
        if (keywords.isEmpty()) return scores;

        String title = doc.title().toLowerCase(Locale.ROOT);
        Element meta = doc.selectFirst("meta[name=description]");
        String description = meta == null ? "" : meta.attr("content").toLowerCase(Locale.ROOT);
        List<String> headingTexts = new ArrayList<>();
        for (Element h : doc.select("h1, h2, h3, h4, h5, h6")) {
            headingTexts.add(h.text());
        }
        String headings = String.join(" ", headingTexts);
        String body = doc.body() == null ? "" : doc.body().text();

        for (String keyword : keywords) {
            double score = 0;
            if (title.contains(keyword)) score += 10;
            if (description.contains(keyword)) score += 8;
            Pattern word = Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
            score += 5.0 * Math.min(count(word, headings), 3);
            score += Math.min(count(word, body) * 0.5, 5.0);
            if (score > 0) scores.put(keyword, score);
        }
        return scores;
    }

    private static int count(Pattern pattern, String text) {
        int n = 0;
        Matcher m = pattern.matcher(text);
        while (m.find()) n++;
        return n;
    }
}
