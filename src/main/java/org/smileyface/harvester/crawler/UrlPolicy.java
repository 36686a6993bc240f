package org.smileyface.harvester.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.harvester.util.CrawlerUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides which discovered links may enter the frontier: http(s) only, allowed domains, no excluded file
 * types or paths, and the configured include/exclude regexes (excludes take precedence).
 */
public class UrlPolicy {

    private static final Logger log = LoggerFactory.getLogger(UrlPolicy.class);

    private final List<String> allowedDomains;
    private final List<String> excludedExtensions;
    private final List<String> excludedPaths;
    private final List<Pattern> includes;
    private final List<Pattern> excludes;

    public UrlPolicy(CrawlerProperties properties) {
        this.allowedDomains = properties.effectiveAllowedDomains();
        this.excludedExtensions = lowerCase(properties.getExcludedExtensions());
        this.excludedPaths = lowerCase(properties.getExcludedPathPatterns());
        this.includes = compilePatterns(properties.getIncludeUrlPatterns());
        this.excludes = compilePatterns(properties.getExcludeUrlPatterns());
    }

    /**
     * @param url a URL already normalized with {@link CrawlerUtils#normalizeUrl}
     */
    public boolean accepts(String url) {
        if (url == null) return false;
        String domain = CrawlerUtils.domainOf(url);
        if (domain == null) return false;
        if (!allowedDomains.isEmpty() && allowedDomains.stream().noneMatch(d -> CrawlerUtils.isSameOrSubdomain(domain, d))) {
            return false;
        }
        String path = URI.create(url).getPath();
        String lowerPath = path == null ? "" : path.toLowerCase(Locale.ROOT);
        for (String ext : excludedExtensions) {
            if (lowerPath.endsWith(ext)) return false;
        }
        for (String p : excludedPaths) {
            if (lowerPath.contains(p)) return false;
        }
        return isAcceptedByFilters(url);
    }

    public List<String> getAllowedDomains() {
        return allowedDomains;
    }

    private boolean isAcceptedByFilters(String url) {
        // Excludes take precedence
        for (Pattern p : excludes) {
            if (p.matcher(url).find()) return false;
        }
        if (includes.isEmpty()) return true; // no includes means accept all (subject to excludes)
        for (Pattern p : includes) {
            if (p.matcher(url).find()) return true;
        }
        return false;
    }

    private static List<Pattern> compilePatterns(List<String> raw) {
        List<Pattern> out = new ArrayList<>();
        if (raw == null) return out;
        for (String s : raw) {
            if (s == null || s.isBlank()) continue;
            try {
                out.add(Pattern.compile(s));
            } catch (Exception e) {
                log.warn("Invalid regex pattern in crawler config: {} (ignored)", s);
            }
        }
        return out;
    }

    private static List<String> lowerCase(List<String> values) {
        List<String> out = new ArrayList<>();
        if (values == null) return out;
        for (String v : values) {
            if (v != null && !v.isBlank()) out.add(v.trim().toLowerCase(Locale.ROOT));
        }
        return out;
    }
}
