package org.smileyface.harvester.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * robots.txt checks with one cached {@link RobotsRules} per scheme and host. A robots.txt that cannot be read
 * allows everything.
 */
public class RobotsPolicy {

    private static final Logger log = LoggerFactory.getLogger(RobotsPolicy.class);

    private final TextFetcher fetcher;
    private final String userAgent;
    private final boolean enabled;
    private final Map<String, RobotsRules> cache = new ConcurrentHashMap<>();

    public RobotsPolicy(TextFetcher fetcher, String userAgent, boolean enabled) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.userAgent = userAgent;
        this.enabled = enabled;
    }

    public boolean isAllowed(String url) {
        if (!enabled) return true;
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            return false;
        }
        if (uri.getHost() == null) return false;
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) path = path + "?" + uri.getRawQuery();
        return rulesFor(uri).isAllowed(path);
    }

    /**
     * Sitemap URLs advertised by the host's robots.txt.
     */
    public List<String> sitemapsOf(String url) {
        try {
            return rulesFor(URI.create(url)).getSitemaps();
        } catch (IllegalArgumentException e) {
            return List.of();
        }
    }

    private RobotsRules rulesFor(URI uri) {
        String origin = uri.getScheme() + "://" + uri.getRawAuthority();
        return cache.computeIfAbsent(origin, this::load);
    }

    private RobotsRules load(String origin) {
        String robotsUrl = origin + "/robots.txt";
        try {
            String body = fetcher.fetch(robotsUrl);
            if (body == null) {
                log.debug("No robots.txt at {}", robotsUrl);
                return RobotsRules.allowAll();
            }
            return RobotsRules.parse(body, userAgent);
        } catch (IOException e) {
            log.warn("Could not read {}: {} (allowing all)", robotsUrl, e.getMessage());
            return RobotsRules.allowAll();
        }
    }
}
