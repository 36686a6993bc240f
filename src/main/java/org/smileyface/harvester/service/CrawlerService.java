package org.smileyface.harvester.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.harvester.crawler.CrawlerProperties;
import org.smileyface.harvester.crawler.DistributedFrontier;
import org.smileyface.harvester.crawler.Frontier;
import org.smileyface.harvester.crawler.LocalFrontier;
import org.smileyface.harvester.crawler.RobotsPolicy;
import org.smileyface.harvester.crawler.SitemapParser;
import org.smileyface.harvester.crawler.TextFetcher;
import org.smileyface.harvester.crawler.UrlPolicy;
import org.smileyface.harvester.extractor.AssetExtractor;
import org.smileyface.harvester.extractor.HtmlPageExtractor;
import org.smileyface.harvester.extractor.KeywordMatcher;
import org.smileyface.harvester.extractor.PageClassifier;
import org.smileyface.harvester.graph.SiteGraph;
import org.smileyface.harvester.graph.SiteGraphBuilder;
import org.smileyface.harvester.lease.InstanceHeartbeat;
import org.smileyface.harvester.lease.LeaseKeeper;
import org.smileyface.harvester.lease.LeaseManager;
import org.smileyface.harvester.model.CrawlStatus;
import org.smileyface.harvester.model.PageRecord;
import org.smileyface.harvester.model.WorkItem;
import org.smileyface.harvester.processor.ItemHandler;
import org.smileyface.harvester.processor.WorkerContext;
import org.smileyface.harvester.processor.WorkerPool;
import org.smileyface.harvester.processor.WorkerStats;
import org.smileyface.harvester.render.PageRenderer;
import org.smileyface.harvester.render.PageRendererFactory;
import org.smileyface.harvester.store.DocumentStore;
import org.smileyface.harvester.store.Documents;
import org.smileyface.harvester.store.StoreCollections;
import org.smileyface.harvester.store.StoreFilter;
import org.smileyface.harvester.util.CrawlerUtils;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Crawls the configured start URLs in one of three modes and writes a page record per URL plus one site graph per
 * start domain. Every mode shares the same frontier semantics: URLs are enqueued once, children inherit
 * {@code depth + 1}, and the {@code maxPages} budget stops the run once that many pages were attempted.
 */
@Service
public class CrawlerService {

    private static final Logger log = LoggerFactory.getLogger(CrawlerService.class);

    private static final String JOB = "crawl";

    private final DocumentStore store;
    private final CrawlerProperties properties;
    private final PageRendererFactory rendererFactory;
    private final TextFetcher fetcher;
    private final Clock clock;
    private final SiteGraphBuilder graphBuilder = new SiteGraphBuilder();

    private volatile WorkerPool<WorkItem> activePool;

    public CrawlerService(DocumentStore store, CrawlerProperties properties, PageRendererFactory rendererFactory,
                          TextFetcher fetcher, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.rendererFactory = Objects.requireNonNull(rendererFactory, "rendererFactory");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Runs a full crawl.
     *
     * @param mode       how the frontier is consumed
     * @param resetQueue in distributed mode, drop the shared queue before seeding; ignored otherwise
     * @throws IllegalArgumentException when no valid start URL is configured
     */
    public CrawlReport crawl(CrawlMode mode, boolean resetQueue) {
        List<String> starts = startUrls();
        if (starts.isEmpty()) {
            throw new IllegalArgumentException("No valid start URL configured (crawler.startUrls)");
        }
        long startedAt = clock.millis();
        StoreCollections.ensureIndexes(store);

        UrlPolicy policy = new UrlPolicy(properties);
        RobotsPolicy robots = new RobotsPolicy(fetcher, properties.getUserAgent(), properties.isRespectRobotsTxt());
        HtmlPageExtractor extractor = new HtmlPageExtractor(new PageClassifier(), properties.isDetectJs(),
                new KeywordMatcher(properties.getKeywords()));
        log.info("Crawl starting: mode={}, startUrls={}, maxDepth={}, maxPages={}, assets={}",
                mode, starts, properties.getMaxDepth(), properties.getMaxPages(), properties.isDiscoverAssets());

        WorkerStats stats;
        switch (mode) {
            case SINGLE -> {
                LocalFrontier frontier = localFrontier(policy);
                seed(frontier, starts, policy, robots);
                stats = runSingle(frontier, pageCrawler(frontier, extractor, robots));
            }
            case THREADED -> {
                LocalFrontier frontier = localFrontier(policy);
                seed(frontier, starts, policy, robots);
                stats = runPool(frontier, pageCrawler(frontier, extractor, robots), null);
            }
            case DISTRIBUTED -> stats = runDistributed(starts, policy, robots, extractor, resetQueue);
            default -> throw new IllegalArgumentException("Unsupported crawl mode: " + mode);
        }

        List<SiteGraph> graphs = saveSiteGraphs(starts);
        long duration = clock.millis() - startedAt;
        log.info("Crawl finished: mode={}, {} in {} ms", mode, stats, duration);
        return new CrawlReport(mode, stats.asMap(), graphs, duration);
    }

    /**
     * Stops a running worker pool after the items in progress, e.g. when the application context closes on SIGINT.
     */
    @PreDestroy
    public void shutdown() {
        WorkerPool<WorkItem> pool = activePool;
        if (pool != null && pool.isRunning()) {
            log.info("Shutdown requested; stopping crawl workers");
            pool.stopAll();
        }
    }

    private LocalFrontier localFrontier(UrlPolicy policy) {
        return new LocalFrontier(policy, properties.getMaxDepth(), properties.getMaxRedeliveries());
    }

    private PageCrawler pageCrawler(Frontier frontier, HtmlPageExtractor extractor, RobotsPolicy robots) {
        AssetExtractor assets = properties.isDiscoverAssets() ? new AssetExtractor() : null;
        return new PageCrawler(store, frontier, extractor, robots, clock, assets);
    }

    private WorkerStats runSingle(Frontier frontier, PageCrawler crawler) {
        WorkerStats stats = new WorkerStats();
        AtomicInteger budget = new AtomicInteger();
        try (PageRenderer renderer = rendererFactory.create()) {
            WorkItem item;
            while ((item = frontier.next()) != null) {
                if (!withinBudget(budget)) {
                    log.info("Page budget of {} reached", properties.getMaxPages());
                    frontier.release(item);
                    break;
                }
                try {
                    crawler.crawl(item, renderer, stats);
                } catch (RuntimeException e) {
                    log.warn("Crawling {} failed: {}", item.getKey(), e.toString());
                    stats.increment(WorkerStats.FAILED);
                    frontier.markFailed(item, e.getMessage());
                }
                if (Thread.currentThread().isInterrupted()) {
                    log.info("Crawl interrupted");
                    break;
                }
                pause();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Crawl interrupted");
        }
        return stats;
    }

    private WorkerStats runPool(Frontier frontier, PageCrawler crawler, LeaseManager leases) {
        AtomicInteger budget = new AtomicInteger();
        ItemHandler<WorkItem> handler = new ItemHandler<>() {
            @Override
            public void handle(WorkItem item, WorkerContext<WorkItem> ctx) {
                if (!withinBudget(budget)) {
                    frontier.release(item);
                    ctx.stopPool();
                    return;
                }
                if (leases == null) {
                    crawler.crawl(item, ctx.renderer(), ctx.stats());
                    return;
                }
                if (!leases.claim(item.getKey())) {
                    log.debug("{} is leased by another instance", item.getKey());
                    ctx.stats().increment(WorkerStats.SKIPPED);
                    ctx.requeue(item, "lease held elsewhere");
                    return;
                }
                try {
                    crawler.crawl(item, ctx.renderer(), ctx.stats());
                } finally {
                    leases.release(item.getKey());
                }
            }

            @Override
            public void onFailure(WorkItem item, Exception error, WorkerContext<WorkItem> ctx) {
                ctx.stats().increment(WorkerStats.FAILED);
                frontier.markFailed(item, error.getMessage());
            }

            @Override
            public String describe(WorkItem item) {
                return item.getKey();
            }
        };

        WorkerPool<WorkItem> pool = new WorkerPool<>(JOB);
        WorkerPool.Settings settings = new WorkerPool.Settings(
                Duration.ofMillis(properties.getPollTimeoutMs()),
                Duration.ofMillis(properties.getIdleGraceMs()),
                Duration.ofMillis(properties.getDelayBetweenRequestsMs()));
        activePool = pool;
        try {
            pool.start(properties.getWorkerCount(), frontier, handler, rendererFactory, settings);
            pool.awaitAll(null);
        } finally {
            if (pool.isRunning()) pool.stopAll();
            activePool = null;
        }
        return pool.aggregateStats();
    }

    private WorkerStats runDistributed(List<String> starts, UrlPolicy policy, RobotsPolicy robots,
                                       HtmlPageExtractor extractor, boolean resetQueue) {
        String instanceId = properties.getInstanceId() != null
                ? properties.getInstanceId()
                : "harvester-" + UUID.randomUUID().toString().substring(0, 8);
        DistributedFrontier frontier = new DistributedFrontier(store, policy, properties, instanceId, clock);
        if (resetQueue) {
            frontier.init();
        }
        LeaseManager leases = new LeaseManager(store, instanceId, Duration.ofMillis(properties.getLeaseDurationMs()), clock);
        InstanceHeartbeat heartbeat = new InstanceHeartbeat(store, instanceId, JOB, clock);
        log.info("Distributed crawl instance {} (pending={})", instanceId, frontier.pendingCount());

        try (LeaseKeeper keeper = new LeaseKeeper(leases, heartbeat,
                Duration.ofMillis(properties.getHeartbeatIntervalMs()), List.of(frontier::reclaimExpired))) {
            keeper.start();
            // Seeds are deduplicated by the shared queue, so every instance may seed.
            seed(frontier, starts, policy, robots);
            return runPool(frontier, pageCrawler(frontier, extractor, robots), leases);
        }
    }

    private void seed(Frontier frontier, List<String> starts, UrlPolicy policy, RobotsPolicy robots) {
        for (String start : starts) {
            if (frontier.enqueue(start, 0, null, Frontier.SEED_PRIORITY)) {
                log.info("Seeded {}", start);
            }
            if (properties.isUseSitemap() && properties.getMaxDepth() >= 1) {
                int added = 0;
                for (String page : new SitemapParser(fetcher).collect(sitemapsFor(start, robots))) {
                    String url = CrawlerUtils.normalizeUrl(page);
                    if (url == null || !policy.accepts(url)) continue;
                    if (frontier.enqueue(url, 1, start, Frontier.SITEMAP_PRIORITY)) added++;
                }
                if (added > 0) log.info("Seeded {} URLs from sitemaps of {}", added, start);
            }
        }
    }

    private List<String> sitemapsFor(String start, RobotsPolicy robots) {
        List<String> declared = robots.sitemapsOf(start);
        if (!declared.isEmpty()) return declared;
        URI uri = URI.create(start);
        String port = uri.getPort() > 0 ? ":" + uri.getPort() : "";
        return List.of(uri.getScheme() + "://" + uri.getHost() + port + "/sitemap.xml");
    }

    private List<SiteGraph> saveSiteGraphs(List<String> starts) {
        Map<String, String> rootByDomain = new LinkedHashMap<>();
        for (String start : starts) {
            rootByDomain.putIfAbsent(CrawlerUtils.domainOf(start), start);
        }
        List<SiteGraph> graphs = new ArrayList<>();
        rootByDomain.forEach((domain, root) -> {
            List<PageRecord> pages = new ArrayList<>();
            for (Map<String, Object> doc : store.find(StoreCollections.PAGES,
                    StoreFilter.byField("domain", domain).eq("crawlStatus", CrawlStatus.CRAWLED.name()), null, 0)) {
                pages.add(Documents.fromDocument(doc, PageRecord.class));
            }
            SiteGraph graph = graphBuilder.build(domain, root, pages);
            graph.setGeneratedAt(clock.millis());
            Map<String, Object> doc = Documents.toDocument(graph);
            doc.remove("domain");
            store.upsert(StoreCollections.SITE_MAPS, StoreFilter.byField("domain", domain), doc);
            log.info("Site graph for {}: {} pages, max depth {}", domain, graph.getTotalPages(), graph.getMaxDepth());
            graphs.add(graph);
        });
        return graphs;
    }

    private List<String> startUrls() {
        List<String> out = new ArrayList<>();
        for (String raw : properties.getStartUrls()) {
            String url = CrawlerUtils.normalizeUrl(raw);
            if (url == null) {
                log.warn("Ignoring invalid start URL: {}", raw);
            } else if (!out.contains(url)) {
                out.add(url);
            }
        }
        return out;
    }

    private boolean withinBudget(AtomicInteger attempted) {
        int max = properties.getMaxPages();
        return max <= 0 || attempted.incrementAndGet() <= max;
    }

    private void pause() throws InterruptedException {
        long delay = properties.getDelayBetweenRequestsMs();
        if (delay > 0) Thread.sleep(delay);
    }
}
