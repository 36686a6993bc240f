package org.smileyface.harvester.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.harvester.crawler.Frontier;
import org.smileyface.harvester.crawler.RobotsPolicy;
import org.smileyface.harvester.extractor.AssetExtractor;
import org.smileyface.harvester.extractor.Extraction;
import org.smileyface.harvester.extractor.ExtractionException;
import org.smileyface.harvester.extractor.HtmlPageExtractor;
import org.smileyface.harvester.model.CrawlStatus;
import org.smileyface.harvester.model.PageAsset;
import org.smileyface.harvester.model.PageRecord;
import org.smileyface.harvester.model.WorkItem;
import org.smileyface.harvester.processor.WorkerStats;
import org.smileyface.harvester.render.PageRenderException;
import org.smileyface.harvester.render.PageRenderer;
import org.smileyface.harvester.store.DocumentStore;
import org.smileyface.harvester.store.Documents;
import org.smileyface.harvester.store.StoreCollections;
import org.smileyface.harvester.store.StoreFilter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Crawls one frontier item: skips pages already crawled or disallowed by robots.txt, renders the page,
 * stores its {@link PageRecord} and feeds the discovered links back into the frontier. With an
 * {@link AssetExtractor} it also records the assets the page references.
 * Fetch and extraction failures are recorded on the page and in the counters; they are not rethrown.
 */
public class PageCrawler {

    private static final Logger log = LoggerFactory.getLogger(PageCrawler.class);

    private final DocumentStore store;
    private final Frontier frontier;
    private final HtmlPageExtractor extractor;
    private final RobotsPolicy robots;
    private final Clock clock;
    private final AssetExtractor assets;

    public PageCrawler(DocumentStore store, Frontier frontier, HtmlPageExtractor extractor, RobotsPolicy robots, Clock clock) {
        this(store, frontier, extractor, robots, clock, null);
    }

    public PageCrawler(DocumentStore store, Frontier frontier, HtmlPageExtractor extractor, RobotsPolicy robots, Clock clock,
                       AssetExtractor assets) {
        this.store = Objects.requireNonNull(store, "store");
        this.frontier = Objects.requireNonNull(frontier, "frontier");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.robots = Objects.requireNonNull(robots, "robots");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.assets = assets;
    }

    public void crawl(WorkItem item, PageRenderer renderer, WorkerStats stats) {
        String url = item.getKey();
        if (isAlreadyCrawled(url)) {
            log.debug("Skipping {}: already crawled", url);
            stats.increment(WorkerStats.SKIPPED);
            frontier.markDone(item);
            return;
        }
        if (!robots.isAllowed(url)) {
            log.info("Skipping {}: disallowed by robots.txt", url);
            stats.increment(WorkerStats.SKIPPED);
            frontier.markDone(item);
            return;
        }

        PageRecord page = new PageRecord(url, item.getDomain(), item.getDepth(), item.getParentKey());
        try {
            String html = renderer.open(url);
            page.setStatusCode(renderer.statusCode());
            Extraction extraction = extractor.extract(html, url);
            page.setTitle((String) extraction.field(HtmlPageExtractor.TITLE));
            page.setContentType((String) extraction.field(HtmlPageExtractor.CONTENT_TYPE));
            page.setRequiresJs((Boolean) extraction.field(HtmlPageExtractor.REQUIRES_JS));
            page.setLinksFound(extraction.links().size());
            page.setKeywords(keywordsOf(extraction));
            page.setKeywordScores(scoresOf(extraction));
            int added = frontier.enqueueDiscovered(extraction.links(), item.getDepth(), url);
            page.setCrawlStatus(CrawlStatus.CRAWLED);
            save(page);
            if (assets != null) {
                stats.add(WorkerStats.ASSETS, saveAssets(assets.extract(html, url)));
            }
            frontier.markDone(item);
            stats.increment(WorkerStats.CRAWLED);
            stats.add(WorkerStats.LINKS_FOUND, extraction.links().size());
            log.info("Crawled {} (depth={}, links={}, new={})", url, item.getDepth(), extraction.links().size(), added);
        } catch (PageRenderException e) {
            if (e.getStatusCode() > 0) page.setStatusCode(e.getStatusCode());
            fail(item, page, e.getMessage(), stats);
        } catch (ExtractionException e) {
            fail(item, page, e.getMessage(), stats);
        }
    }

    private void fail(WorkItem item, PageRecord page, String error, WorkerStats stats) {
        log.warn("Failed to crawl {}: {}", page.getUrl(), error);
        page.setCrawlStatus(CrawlStatus.FAILED);
        page.setErrorMessage(error);
        save(page);
        frontier.markFailed(item, error);
        stats.increment(WorkerStats.FAILED);
    }

    /**
     * @return number of assets not recorded before
     */
    private int saveAssets(List<PageAsset> found) {
        int added = 0;
        for (PageAsset asset : found) {
            asset.setDiscoveredAt(clock.millis());
            Map<String, Object> doc = Documents.toDocument(asset);
            if (store.insertIfAbsent(StoreCollections.ASSETS, StoreFilter.byField("url", asset.getUrl()), doc)) added++;
        }
        if (added > 0) log.debug("Recorded {} new assets", added);
        return added;
    }

    private static List<String> keywordsOf(Extraction extraction) {
        if (!(extraction.field(HtmlPageExtractor.KEYWORDS) instanceof List<?> found) || found.isEmpty()) return null;
        List<String> out = new ArrayList<>();
        for (Object keyword : found) out.add(String.valueOf(keyword));
        return out;
    }

    private static Map<String, Double> scoresOf(Extraction extraction) {
        if (!(extraction.field(HtmlPageExtractor.KEYWORD_SCORES) instanceof Map<?, ?> scores) || scores.isEmpty()) return null;
        Map<String, Double> out = new LinkedHashMap<>();
        scores.forEach((k, v) -> out.put(String.valueOf(k), ((Number) v).doubleValue()));
        return out;
    }

    private boolean isAlreadyCrawled(String url) {
        return store.findOne(StoreCollections.PAGES,
                StoreFilter.byField("url", url).eq("crawlStatus", CrawlStatus.CRAWLED.name())).isPresent();
    }

    private void save(PageRecord page) {
        page.setCrawledAt(clock.millis());
        Map<String, Object> doc = Documents.toDocument(page);
        doc.remove("url");
        store.upsert(StoreCollections.PAGES, StoreFilter.byField("url", page.getUrl()), doc);
    }
}
