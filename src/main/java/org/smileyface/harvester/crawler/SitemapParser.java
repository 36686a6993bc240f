package org.smileyface.harvester.crawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads page URLs from sitemap.xml files, following sitemap indexes.
 */
public class SitemapParser {

    private static final Logger log = LoggerFactory.getLogger(SitemapParser.class);

    private static final int MAX_SITEMAPS = 50;

    private final TextFetcher fetcher;

    public SitemapParser(TextFetcher fetcher) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    /**
     * One parsed sitemap document.
     *
     * @param pages    {@code <url><loc>} entries
     * @param children {@code <sitemap><loc>} entries of a sitemap index
     */
    public record Sitemap(List<String> pages, List<String> children) {}

    public static Sitemap parse(String xml) {
        if (xml == null || xml.isBlank()) return new Sitemap(List.of(), List.of());
        Document doc = Jsoup.parse(xml, "", Parser.xmlParser());
        List<String> pages = new ArrayList<>();
        for (Element loc : doc.select("url > loc")) {
            String v = loc.text().trim();
            if (!v.isEmpty()) pages.add(v);
        }
        List<String> children = new ArrayList<>();
        for (Element loc : doc.select("sitemap > loc")) {
            String v = loc.text().trim();
            if (!v.isEmpty()) children.add(v);
        }
        return new Sitemap(pages, children);
    }

    /**
     * Collects page URLs starting from the given sitemap locations (breadth first, at most 50 sitemap files).
     * Unreadable sitemaps are skipped.
     */
    public List<String> collect(List<String> sitemapUrls) {
        Set<String> pages = new LinkedHashSet<>();
        Deque<String> pending = new ArrayDeque<>(sitemapUrls);
        Set<String> visited = new HashSet<>();
        while (!pending.isEmpty() && visited.size() < MAX_SITEMAPS) {
            String url = pending.poll();
            if (!visited.add(url)) continue;
            try {
                Sitemap sm = parse(fetcher.fetch(url));
                pages.addAll(sm.pages());
                pending.addAll(sm.children());
            } catch (IOException e) {
                log.warn("Could not read sitemap {}: {}", url, e.getMessage());
            }
        }
        return new ArrayList<>(pages);
    }
}
