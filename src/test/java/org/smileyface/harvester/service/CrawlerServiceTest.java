package org.smileyface.harvester.service;

import com.sun.net.httpserver.HttpServer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.smileyface.harvester.crawler.CrawlerProperties;
import org.smileyface.harvester.crawler.TextFetcher;
import org.smileyface.harvester.graph.SiteGraph;
import org.smileyface.harvester.processor.WorkerStats;
import org.smileyface.harvester.render.PageRendererFactory;
import org.smileyface.harvester.store.DocumentStore;
import org.smileyface.harvester.store.InMemoryDocumentStore;
import org.smileyface.harvester.store.StoreCollections;
import org.smileyface.harvester.store.StoreException;
import org.smileyface.harvester.store.StoreFilter;
import org.smileyface.harvester.store.UpsertResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Crawls a small site served by an in-process HTTP server, in every mode, against the in-memory store.
 */
@SpringBootTest
@ActiveProfiles("test")
class CrawlerServiceTest {

    private static final Logger logger = LogManager.getLogger(CrawlerServiceTest.class);

    private HttpServer server;
    private String base;

    @Autowired
    private CrawlerProperties properties;

    @Autowired
    private DocumentStore store;

    @Autowired
    private CrawlerService crawler;

    @Autowired
    private PageRendererFactory rendererFactory;

    @Autowired
    private TextFetcher fetcher;

    @BeforeEach
    void setUp() throws IOException {
        for (String c : List.of(StoreCollections.PAGES, StoreCollections.ASSETS, StoreCollections.SITE_MAPS, StoreCollections.WORK_QUEUE,
                StoreCollections.LOCKS, StoreCollections.CRAWL_JOBS)) {
            store.drop(c);
        }
        base = startServer(site());
        properties.setStartUrls(List.of(base + "/"));
        properties.setAllowedDomains(List.of());
        properties.setMaxDepth(2);
        properties.setMaxPages(0);
        properties.setWorkerCount(3);
        properties.setDelayBetweenRequestsMs(0);
        properties.setPollTimeoutMs(50);
        properties.setIdleGraceMs(50);
        properties.setRespectRobotsTxt(false);
        properties.setUseSitemap(false);
        properties.setEmptyPollThreshold(3);
        properties.setEmptyPollIntervalMs(20);
        properties.setInstanceId("test-instance");
        properties.setMaxRedeliveries(5);
        properties.setDiscoverAssets(false);
        properties.setKeywords(List.of());
    }

    @AfterEach
    void tearDown() {
        if (server != null) server.stop(0);
    }

    private Map<String, String> site() {
        Map<String, String> pages = new LinkedHashMap<>();
        pages.put("/", html("Home", "<a href='/a'>A</a><a href='/b'>B</a><a href='/c?x=1'>C</a>"
                + "<a href='http://other.org/'>Elsewhere</a><a href='/file.pdf'>PDF</a><a href='mailto:x@example.com'>Mail</a>"
                + "<img src='/logo.png' alt='Logo'><script src='/app.js'></script>"));
        pages.put("/a", html("A", "<a href='/a/deep'>Deep</a><a href='/'>Home</a>"));
        pages.put("/b", html("B", "<a href='/missing'>Broken</a>"));
        pages.put("/c", html("C", "<p>query page</p>"));
        pages.put("/a/deep", html("Deep", "<a href='/a/deep/deeper'>Deeper</a>"));
        pages.put("/a/deep/deeper", html("Deeper", ""));
        pages.put("/from-sitemap", html("Sitemap only", ""));
        pages.put("/robots.txt", "User-agent: *\nDisallow: /c\n");
        pages.put("/sitemap.xml", "<?xml version='1.0'?><urlset><url><loc>__BASE__/from-sitemap</loc></url></urlset>");
        return pages;
    }

    private static String html(String title, String body) {
        return "<html><head><title>" + title + "</title></head><body>" + body + "</body></html>";
    }

    private String startServer(Map<String, String> pages) throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/", exchange -> {
            String path = exchange.getRequestURI().getPath();
            String body = pages.get(path);
            int status = body == null ? 404 : 200;
            if (body == null) body = "<html><body>Not found</body></html>";
            body = body.replace("__BASE__", "http://localhost:" + server.getAddress().getPort());
            String type = path.endsWith(".txt") ? "text/plain" : path.endsWith(".xml") ? "application/xml" : "text/html";
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", type + "; charset=UTF-8");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        });
        server.start();
        String url = "http://localhost:" + server.getAddress().getPort();
        logger.info("Test site at {}", url);
        return url;
    }

    private Map<String, Object> page(String path) {
        return store.findOne(StoreCollections.PAGES, StoreFilter.byField("url", base + path))
                .orElseThrow(() -> new AssertionError("page " + path + " not stored"));
    }

    private void assertStandardSiteCrawled(CrawlReport report) {
        assertThat(report.count(WorkerStats.CRAWLED)).isEqualTo(5);
        assertThat(report.count(WorkerStats.FAILED)).isEqualTo(1);
        assertThat(store.count(StoreCollections.PAGES, StoreFilter.all())).isEqualTo(6);

        assertThat(page("/")).containsEntry("crawlStatus", "CRAWLED").containsEntry("depth", 0)
                .containsEntry("title", "Home").containsEntry("statusCode", 200);
        assertThat(page("/a/deep")).containsEntry("depth", 2).containsEntry("parentUrl", base + "/a");
        assertThat(page("/missing")).containsEntry("crawlStatus", "FAILED").containsEntry("statusCode", 404);
        assertThat(store.findOne(StoreCollections.PAGES, StoreFilter.byField("url", base + "/a/deep/deeper"))).isEmpty();

        assertThat(report.siteGraphs()).hasSize(1);
        SiteGraph graph = report.siteGraphs().get(0);
        assertThat(graph.getDomain()).isEqualTo("localhost");
        assertThat(graph.getTotalPages()).isEqualTo(5);
        assertThat(graph.getMaxDepth()).isEqualTo(2);
        assertThat(store.findOne(StoreCollections.SITE_MAPS, StoreFilter.byField("domain", "localhost"))).isPresent();
    }

    @Test
    void singleMode_crawlsUpToMaxDepth() {
        CrawlReport report = crawler.crawl(CrawlMode.SINGLE, false);

        assertThat(report.mode()).isEqualTo(CrawlMode.SINGLE);
        assertStandardSiteCrawled(report);
    }

    @Test
    void threadedMode_crawlsEveryPageOnce() {
        CrawlReport report = crawler.crawl(CrawlMode.THREADED, false);

        assertStandardSiteCrawled(report);
        assertThat(report.count(WorkerStats.LINKS_FOUND)).isGreaterThanOrEqualTo(7);
    }

    @Test
    void distributedMode_usesTheSharedQueueAndReleasesLeases() {
        CrawlReport report = crawler.crawl(CrawlMode.DISTRIBUTED, true);

        assertStandardSiteCrawled(report);
        assertThat(store.count(StoreCollections.WORK_QUEUE, StoreFilter.byField("status", "DONE"))).isEqualTo(5);
        assertThat(store.count(StoreCollections.WORK_QUEUE, StoreFilter.byField("status", "FAILED"))).isEqualTo(1);
        assertThat(store.count(StoreCollections.LOCKS, StoreFilter.all())).isZero();
        assertThat(store.findOne(StoreCollections.CRAWL_JOBS, StoreFilter.byField("instanceId", "test-instance")))
                .hasValueSatisfying(doc -> assertThat(doc).containsEntry("status", "stopped").containsEntry("job", "crawl"));
    }

    @Test
    void robotsAndSitemap_areHonoured() {
        properties.setRespectRobotsTxt(true);
        properties.setUseSitemap(true);
        properties.setMaxDepth(1);

        CrawlReport report = crawler.crawl(CrawlMode.SINGLE, false);

        assertThat(report.count(WorkerStats.CRAWLED)).isEqualTo(4);
        assertThat(report.count(WorkerStats.SKIPPED)).isEqualTo(1);
        assertThat(page("/from-sitemap")).containsEntry("depth", 1).containsEntry("parentUrl", base + "/");
        assertThat(store.findOne(StoreCollections.PAGES, StoreFilter.byField("url", base + "/c?x=1"))).isEmpty();
    }

    @Test
    void pageBudget_stopsTheCrawl() {
        properties.setMaxPages(2);

        CrawlReport report = crawler.crawl(CrawlMode.THREADED, false);

        assertThat(report.count(WorkerStats.CRAWLED) + report.count(WorkerStats.FAILED)).isEqualTo(2);
        assertThat(store.count(StoreCollections.PAGES, StoreFilter.all())).isEqualTo(2);
    }

    @Test
    void pageBudget_leavesUnattemptedItemsPending() {
        properties.setMaxPages(1);
        properties.setMaxRedeliveries(0);

        CrawlReport report = crawler.crawl(CrawlMode.DISTRIBUTED, true);

        assertThat(report.count(WorkerStats.CRAWLED) + report.count(WorkerStats.FAILED)).isEqualTo(1);
        assertThat(store.count(StoreCollections.PAGES, StoreFilter.all())).isEqualTo(1);
        assertThat(store.count(StoreCollections.PAGES, StoreFilter.byField("crawlStatus", "FAILED"))).isZero();
        assertThat(store.count(StoreCollections.WORK_QUEUE, StoreFilter.byField("status", "FAILED"))).isZero();
        assertThat(store.count(StoreCollections.WORK_QUEUE, StoreFilter.byField("status", "DONE"))).isEqualTo(1);
        List<Map<String, Object>> pending = store.find(StoreCollections.WORK_QUEUE,
                StoreFilter.byField("status", "PENDING"), null, 0);
        assertThat(pending).isNotEmpty();
        assertThat(pending).allSatisfy(doc -> assertThat(((Number) doc.getOrDefault("redeliveries", 0)).intValue()).isZero());
    }

    @Test
    void pageBudget_inThreadedMode_failsNothing() {
        properties.setMaxPages(1);
        properties.setMaxRedeliveries(0);

        CrawlReport report = crawler.crawl(CrawlMode.THREADED, false);

        assertThat(report.count(WorkerStats.CRAWLED)).isEqualTo(1);
        assertThat(report.count(WorkerStats.FAILED)).isZero();
        assertThat(page("/")).containsEntry("crawlStatus", "CRAWLED");
        assertThat(store.count(StoreCollections.PAGES, StoreFilter.all())).isEqualTo(1);
    }

    @Test
    void storeErrorOnOnePage_doesNotAbortSingleModeCrawl() {
        InMemoryDocumentStore failing = new InMemoryDocumentStore() {
            @Override
            public UpsertResult upsert(String collection, StoreFilter filter, Map<String, Object> fields) {
                if (StoreCollections.PAGES.equals(collection) && "A".equals(fields.get("title"))) {
                    throw new StoreException("write rejected");
                }
                return super.upsert(collection, filter, fields);
            }
        };
        CrawlerService service = new CrawlerService(failing, properties, rendererFactory, fetcher, Clock.systemUTC());

        CrawlReport report = service.crawl(CrawlMode.SINGLE, false);

        assertThat(report.count(WorkerStats.FAILED)).isEqualTo(2);
        assertThat(failing.findOne(StoreCollections.PAGES, StoreFilter.byField("url", base + "/b")))
                .hasValueSatisfying(doc -> assertThat(doc).containsEntry("crawlStatus", "CRAWLED"));
        assertThat(failing.findOne(StoreCollections.PAGES, StoreFilter.byField("url", base + "/a"))).isEmpty();
        assertThat(failing.findOne(StoreCollections.PAGES, StoreFilter.byField("url", base + "/a/deep"))).isPresent();
    }

    @Test
    void assetsAndKeywords_areRecordedWhenConfigured() {
        properties.setDiscoverAssets(true);
        properties.setKeywords(List.of("Deep"));

        CrawlReport report = crawler.crawl(CrawlMode.SINGLE, false);

        assertThat(report.count(WorkerStats.ASSETS)).isEqualTo(2);
        assertThat(store.count(StoreCollections.ASSETS, StoreFilter.all())).isEqualTo(2);
        assertThat(store.findOne(StoreCollections.ASSETS, StoreFilter.byField("url", base + "/logo.png")))
                .hasValueSatisfying(doc -> assertThat(doc).containsEntry("assetType", "IMAGE")
                        .containsEntry("pageUrl", base + "/").containsEntry("altText", "Logo"));
        assertThat(page("/a/deep")).containsEntry("keywords", List.of("deep"))
                .containsEntry("keywordScores", Map.of("deep", 10.0));
        assertThat(page("/a")).containsEntry("keywords", List.of("deep"));
        assertThat(page("/")).doesNotContainKey("keywords");
    }

    @Test
    void assetsAreNotRecordedByDefault() {
        CrawlReport report = crawler.crawl(CrawlMode.SINGLE, false);

        assertThat(report.count(WorkerStats.ASSETS)).isZero();
        assertThat(store.count(StoreCollections.ASSETS, StoreFilter.all())).isZero();
    }

    @Test
    void secondRun_skipsPagesAlreadyCrawled() {
        crawler.crawl(CrawlMode.SINGLE, false);

        CrawlReport again = crawler.crawl(CrawlMode.SINGLE, false);

        assertThat(again.count(WorkerStats.CRAWLED)).isZero();
        assertThat(again.count(WorkerStats.SKIPPED)).isEqualTo(1);
    }

    @Test
    void invalidStartUrls_areRejected() {
        properties.setStartUrls(List.of("not a url", "ftp://example.com/"));

        assertThatThrownBy(() -> crawler.crawl(CrawlMode.SINGLE, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void crawlMode_parsesNames() {
        assertThat(CrawlMode.parse(null)).isEqualTo(CrawlMode.SINGLE);
        assertThat(CrawlMode.parse(" Threaded ")).isEqualTo(CrawlMode.THREADED);
        assertThatThrownBy(() -> CrawlMode.parse("swarm")).isInstanceOf(IllegalArgumentException.class);
    }
}
