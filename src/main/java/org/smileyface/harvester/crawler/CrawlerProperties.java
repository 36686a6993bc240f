package org.smileyface.harvester.crawler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.harvester.util.CrawlerUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration properties for the crawler.
 */
@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {

    private static final Logger log = LogManager.getLogger(CrawlerProperties.class);

    public static final List<String> DEFAULT_EXCLUDED_EXTENSIONS = List.of(
            ".pdf", ".doc", ".docx", ".xls", ".xlsx", ".ppt", ".pptx",
            ".zip", ".rar", ".tar", ".gz", ".7z",
            ".jpg", ".jpeg", ".png", ".gif", ".svg", ".webp", ".ico",
            ".mp4", ".avi", ".mov", ".wmv", ".flv", ".mp3", ".wav", ".ogg", ".flac",
            ".exe", ".dmg", ".deb", ".rpm");

    public static final List<String> DEFAULT_EXCLUDED_PATHS = List.of(
            "/feed", "/rss", "/atom", "/sitemap", "/robots.txt", "/api/", "/ajax/", "/json/");

    /** Entry points of the crawl. */
    private List<String> startUrls = new ArrayList<>();

    /**
     * Domains whose pages may be followed. Empty means "the domains of the start URLs".
     * Subdomains of an allowed domain are allowed too.
     */
    private List<String> allowedDomains = new ArrayList<>();

    /**
     * Maximum crawl depth starting from the entry URL. depth=0 means only the entry page.
     * Pages at this depth are crawled but their links are not followed.
     */
    private int maxDepth = 3;

    /** Stop after this many crawled pages; 0 means unlimited. */
    private int maxPages = 0;

    /**
     * List of Java regex patterns; a URL must match at least one include (if provided) to be accepted.
     */
    private List<String> includeUrlPatterns = new ArrayList<>();

    /**
     * List of Java regex patterns; a URL matching any exclude will be rejected.
     */
    private List<String> excludeUrlPatterns = new ArrayList<>();

    /** File extensions (with dot) never followed. */
    private List<String> excludedExtensions = new ArrayList<>(DEFAULT_EXCLUDED_EXTENSIONS);

    /** Path fragments never followed (feeds, APIs, robots and sitemap files). */
    private List<String> excludedPathPatterns = new ArrayList<>(DEFAULT_EXCLUDED_PATHS);

    /** Optional user agent used when fetching pages. */
    private String userAgent = "SmileyfaceHarvester/0.1";

    /** Fetch timeout in milliseconds. */
    private int requestTimeoutMs = 15000;

    /** Attempts per page before it is recorded as failed. */
    private int maxRetries = 3;

    private long retryBackoffMs = 2000;

    /** Pause of each worker after every page. */
    private long delayBetweenRequestsMs = 500;

    private boolean respectRobotsTxt = true;

    /** Seed the frontier from the sites' sitemap.xml. */
    private boolean useSitemap = true;

    /** Flag pages whose content needs a script-capable renderer. */
    private boolean detectJs = true;

    /** Record the images, stylesheets, scripts, fonts and videos of crawled pages. */
    private boolean discoverAssets = false;

    /** Terms looked up on every crawled page; matches are stored on the page record. */
    private List<String> keywords = new ArrayList<>();

    private int workerCount = 4;

    /** Identity of this process in a distributed run; generated when blank. */
    private String instanceId;

    private long leaseDurationMs = 300_000;

    private long heartbeatIntervalMs = 30_000;

    /** Distributed workers stop after this many consecutive polls found nothing to claim. */
    private int emptyPollThreshold = 10;

    private long emptyPollIntervalMs = 1000;

    /** How often an item may be put back after a lost claim or interruption. */
    private int maxRedeliveries = 5;

    private long pollTimeoutMs = 1000;

    private long idleGraceMs = 500;

    /**
     * Loads default values from classpath resource CrawlerConfig.json if available.
     * Spring will still bind/override values from application properties as usual.
     */
    public CrawlerProperties() {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("CrawlerConfig.json")) {
            if (in != null) {
                CrawlerConfig cfg = new ObjectMapper().readValue(in, CrawlerConfig.class);
                if (cfg.maxDepth != null) this.maxDepth = cfg.maxDepth;
                if (cfg.maxPages != null) this.maxPages = cfg.maxPages;
                if (cfg.userAgent != null && !cfg.userAgent.isBlank()) this.userAgent = cfg.userAgent;
                if (cfg.requestTimeoutMs != null && cfg.requestTimeoutMs > 0) this.requestTimeoutMs = cfg.requestTimeoutMs;
                if (cfg.includeUrlPatterns != null) this.includeUrlPatterns = new ArrayList<>(cfg.includeUrlPatterns);
                if (cfg.excludeUrlPatterns != null) this.excludeUrlPatterns = new ArrayList<>(cfg.excludeUrlPatterns);
                if (cfg.excludedExtensions != null) this.excludedExtensions = new ArrayList<>(cfg.excludedExtensions);
                if (cfg.excludedPathPatterns != null) this.excludedPathPatterns = new ArrayList<>(cfg.excludedPathPatterns);
            }
        } catch (Exception e) {
            // Keep defaults when file missing or malformed; do not fail application startup
            log.error("Failed to load default crawler configuration from classpath resource CrawlerConfig.json", e);
        }
    }

    /**
     * Allowed domains as configured, or derived from the start URLs (lower-case, without {@code www.}).
     */
    public List<String> effectiveAllowedDomains() {
        Set<String> out = new LinkedHashSet<>();
        List<String> source = allowedDomains.isEmpty() ? startUrls : allowedDomains;
        for (String s : source) {
            if (s == null || s.isBlank()) continue;
            String d = s.contains("://") ? CrawlerUtils.domainOf(s) : s.trim().toLowerCase();
            if (d != null && d.startsWith("www.")) d = d.substring(4);
            if (d != null && !d.isEmpty()) out.add(d);
        }
        return new ArrayList<>(out);
    }

    public List<String> getStartUrls() { return startUrls; }
    public void setStartUrls(List<String> startUrls) { this.startUrls = startUrls != null ? startUrls : new ArrayList<>(); }

    public List<String> getAllowedDomains() { return allowedDomains; }
    public void setAllowedDomains(List<String> allowedDomains) { this.allowedDomains = allowedDomains != null ? allowedDomains : new ArrayList<>(); }

    public int getMaxDepth() { return maxDepth; }
    public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }

    public int getMaxPages() { return maxPages; }
    public void setMaxPages(int maxPages) { this.maxPages = maxPages; }

    public List<String> getIncludeUrlPatterns() { return includeUrlPatterns; }
    public void setIncludeUrlPatterns(List<String> includeUrlPatterns) { this.includeUrlPatterns = includeUrlPatterns != null ? includeUrlPatterns : new ArrayList<>(); }

    public List<String> getExcludeUrlPatterns() { return excludeUrlPatterns; }
    public void setExcludeUrlPatterns(List<String> excludeUrlPatterns) { this.excludeUrlPatterns = excludeUrlPatterns != null ? excludeUrlPatterns : new ArrayList<>(); }

    public List<String> getExcludedExtensions() { return excludedExtensions; }
    public void setExcludedExtensions(List<String> excludedExtensions) { this.excludedExtensions = excludedExtensions != null ? excludedExtensions : new ArrayList<>(); }

    public List<String> getExcludedPathPatterns() { return excludedPathPatterns; }
    public void setExcludedPathPatterns(List<String> excludedPathPatterns) { this.excludedPathPatterns = excludedPathPatterns != null ? excludedPathPatterns : new ArrayList<>(); }

    public String getUserAgent() { return userAgent; }
    public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

    public int getRequestTimeoutMs() { return requestTimeoutMs; }
    public void setRequestTimeoutMs(int requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public long getRetryBackoffMs() { return retryBackoffMs; }
    public void setRetryBackoffMs(long retryBackoffMs) { this.retryBackoffMs = retryBackoffMs; }

    public long getDelayBetweenRequestsMs() { return delayBetweenRequestsMs; }
    public void setDelayBetweenRequestsMs(long delayBetweenRequestsMs) { this.delayBetweenRequestsMs = delayBetweenRequestsMs; }

    public boolean isRespectRobotsTxt() { return respectRobotsTxt; }
    public void setRespectRobotsTxt(boolean respectRobotsTxt) { this.respectRobotsTxt = respectRobotsTxt; }

    public boolean isUseSitemap() { return useSitemap; }
    public void setUseSitemap(boolean useSitemap) { this.useSitemap = useSitemap; }

    public boolean isDetectJs() { return detectJs; }
    public void setDetectJs(boolean detectJs) { this.detectJs = detectJs; }

    public boolean isDiscoverAssets() { return discoverAssets; }
    public void setDiscoverAssets(boolean discoverAssets) { this.discoverAssets = discoverAssets; }

    public List<String> getKeywords() { return keywords; }
    public void setKeywords(List<String> keywords) { this.keywords = keywords != null ? keywords : new ArrayList<>(); }

    public int getWorkerCount() { return workerCount; }
    public void setWorkerCount(int workerCount) { this.workerCount = workerCount; }

    public String getInstanceId() { return instanceId; }
    public void setInstanceId(String instanceId) { this.instanceId = (instanceId == null || instanceId.isBlank()) ? null : instanceId; }

    public long getLeaseDurationMs() { return leaseDurationMs; }
    public void setLeaseDurationMs(long leaseDurationMs) { this.leaseDurationMs = leaseDurationMs; }

    public long getHeartbeatIntervalMs() { return heartbeatIntervalMs; }
    public void setHeartbeatIntervalMs(long heartbeatIntervalMs) { this.heartbeatIntervalMs = heartbeatIntervalMs; }

    public int getEmptyPollThreshold() { return emptyPollThreshold; }
    public void setEmptyPollThreshold(int emptyPollThreshold) { this.emptyPollThreshold = emptyPollThreshold; }

    public long getEmptyPollIntervalMs() { return emptyPollIntervalMs; }
    public void setEmptyPollIntervalMs(long emptyPollIntervalMs) { this.emptyPollIntervalMs = emptyPollIntervalMs; }

    public int getMaxRedeliveries() { return maxRedeliveries; }
    public void setMaxRedeliveries(int maxRedeliveries) { this.maxRedeliveries = maxRedeliveries; }

    public long getPollTimeoutMs() { return pollTimeoutMs; }
    public void setPollTimeoutMs(long pollTimeoutMs) { this.pollTimeoutMs = pollTimeoutMs; }

    public long getIdleGraceMs() { return idleGraceMs; }
    public void setIdleGraceMs(long idleGraceMs) { this.idleGraceMs = idleGraceMs; }

    // --------- Nested config DTO for JSON mapping ---------
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CrawlerConfig {
        public Integer maxDepth;
        public Integer maxPages;
        public String userAgent;
        public Integer requestTimeoutMs;
        public List<String> includeUrlPatterns;
        public List<String> excludeUrlPatterns;
        public List<String> excludedExtensions;
        public List<String> excludedPathPatterns;
    }
}
