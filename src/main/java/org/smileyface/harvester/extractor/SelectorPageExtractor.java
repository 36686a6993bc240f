package org.smileyface.harvester.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.smileyface.harvester.util.CrawlerUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts fields, lists, groups, entity links and pagination from a page according to {@link ExtractorRules}.
 * Empty values are omitted so that they can never overwrite stored data.
 */
public class SelectorPageExtractor implements PageExtractor {

    private static final Pattern ATTRIBUTE_SUFFIX = Pattern.compile("^(.*?)@([\\w:-]+)$");

    private final ExtractorRules rules;

    public SelectorPageExtractor(ExtractorRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    @Override
    public Extraction extract(String html, String url) {
        if (html == null || html.isBlank()) {
            throw new ExtractionException("Empty page: " + url);
        }
        try {
            Document doc = Jsoup.parse(html, url);
            Map<String, Object> fields = new LinkedHashMap<>();

            rules.getFields().forEach((name, selector) -> putIfPresent(fields, name, first(doc, selector)));
            rules.getListFields().forEach((name, selector) -> putIfPresent(fields, name, all(doc, selector)));
            rules.getGroups().forEach((name, group) -> putIfPresent(fields, name, group(doc, group)));

            for (String req : rules.getRequired()) {
                if (!fields.containsKey(req)) {
                    throw new ExtractionException("Required field '" + req + "' missing on " + url);
                }
            }

            List<DiscoveredEntity> discovered = new ArrayList<>();
            for (ExtractorRules.EntityRule rule : rules.getEntities()) {
                discovered.addAll(entities(doc, rule));
            }

            String next = null;
            if (rules.getNextPage() != null && !rules.getNextPage().isBlank()) {
                next = CrawlerUtils.normalizeUrl(first(doc, withDefaultAttribute(rules.getNextPage(), "href")));
            }
            return new Extraction(fields, links(doc), discovered, next);
        } catch (Selector.SelectorParseException e) {
            throw new ExtractionException("Invalid selector while extracting " + url + ": " + e.getMessage(), e);
        }
    }

    private List<Map<String, Object>> group(Element root, ExtractorRules.GroupRule group) {
        List<Map<String, Object>> out = new ArrayList<>();
        for (Element item : root.select(group.getItemSelector())) {
            Map<String, Object> row = new LinkedHashMap<>();
            group.getFields().forEach((name, selector) -> putIfPresent(row, name, first(item, selector)));
            if (!row.isEmpty()) out.add(row);
        }
        return out;
    }

    private List<DiscoveredEntity> entities(Document doc, ExtractorRules.EntityRule rule) {
        Map<String, DiscoveredEntity> byUrl = new LinkedHashMap<>();
        for (Element item : doc.select(rule.getItemSelector())) {
            String rawLink;
            Element linkElement;
            if (rule.getLink() != null && !rule.getLink().isBlank()) {
                rawLink = first(item, withDefaultAttribute(rule.getLink(), "href"));
                linkElement = null;
            } else {
                linkElement = item.hasAttr("href") ? item : item.selectFirst("a[href]");
                rawLink = linkElement == null ? null : linkElement.absUrl("href");
            }
            String url = CrawlerUtils.normalizeUrl(rawLink);
            if (url == null || byUrl.containsKey(url)) continue;

            String name;
            if (rule.getName() != null && !rule.getName().isBlank()) {
                name = first(item, rule.getName());
            } else {
                name = linkElement == null ? null : CrawlerUtils.cleanText(linkElement.text());
            }
            Map<String, Object> extra = new LinkedHashMap<>();
            rule.getFields().forEach((field, selector) -> putIfPresent(extra, field, first(item, selector)));
            byUrl.put(url, new DiscoveredEntity(rule.getType(), url, emptyToNull(name), extra));
        }
        return new ArrayList<>(byUrl.values());
    }

    private static List<String> links(Document doc) {
        Set<String> out = new LinkedHashSet<>();
        for (Element a : doc.select("a[href]")) {
            String normalized = CrawlerUtils.normalizeUrl(a.absUrl("href"));
            if (normalized != null) out.add(normalized);
        }
        return new ArrayList<>(out);
    }

    /**
     * First non-empty value for a value selector within {@code root}.
     */
    static String first(Element root, String valueSelector) {
        ValueSelector vs = ValueSelector.parse(valueSelector);
        Elements matches = vs.css().isEmpty() ? new Elements(root) : root.select(vs.css());
        for (Element el : matches) {
            String v = vs.read(el);
            if (v != null && !v.isEmpty()) return v;
        }
        return null;
    }

    static List<String> all(Element root, String valueSelector) {
        ValueSelector vs = ValueSelector.parse(valueSelector);
        Set<String> out = new LinkedHashSet<>();
        Elements matches = vs.css().isEmpty() ? new Elements(root) : root.select(vs.css());
        for (Element el : matches) {
            String v = vs.read(el);
            if (v != null && !v.isEmpty()) out.add(v);
        }
        return new ArrayList<>(out);
    }

    private static String withDefaultAttribute(String selector, String attribute) {
        return ATTRIBUTE_SUFFIX.matcher(selector).matches() ? selector : selector + "@" + attribute;
    }

    private static void putIfPresent(Map<String, Object> target, String name, Object value) {
        if (value == null) return;
        if (value instanceof String s && s.isEmpty()) return;
        if (value instanceof Collection<?> c && c.isEmpty()) return;
        target.put(name, value);
    }

    private static String emptyToNull(String s) {
        return s == null || s.isEmpty() ? null : s;
    }

    private record ValueSelector(String css, String attribute) {

        static ValueSelector parse(String raw) {
            String s = raw == null ? "" : raw.trim();
            Matcher m = ATTRIBUTE_SUFFIX.matcher(s);
            if (m.matches()) {
                return new ValueSelector(m.group(1).trim(), m.group(2));
            }
            return new ValueSelector(s, null);
        }

        String read(Element el) {
            if (attribute == null) {
                return CrawlerUtils.cleanText(el.text());
            }
            if (attribute.equals("href") || attribute.equals("src")) {
                return el.absUrl(attribute);
            }
            return CrawlerUtils.cleanText(el.attr(attribute));
        }
    }
}
