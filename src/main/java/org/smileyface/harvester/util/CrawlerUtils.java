package org.smileyface.harvester.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public class CrawlerUtils {

    private CrawlerUtils() {
        // No instanciation
    }

    /**
     * Collapses runs of whitespace and trims; null stays null.
     */
    public static String cleanText(String input) {
        if (input == null) {
            return null;
        }
        return input.replaceAll("\\s+", " ").trim();
    }

    /**
     * Canonical form of an http(s) URL used as the dedup and queue key: lower-case scheme and host, no default
     * port, no fragment, and no trailing slash except for the root path.
     *
     * @return null for blank input, relative or non-http(s) URLs, and unparseable strings
     */
    public static String normalizeUrl(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            URI uri = new URI(raw.trim());
            String scheme = uri.getScheme();
            if (scheme == null) return null;
            String lowerScheme = scheme.toLowerCase(Locale.ROOT);
            if (!lowerScheme.equals("http") && !lowerScheme.equals("https")) {
                return null;
            }
            String host = uri.getHost();
            if (host == null) return null;
            String path = uri.getRawPath();
            if (path == null || path.isBlank()) path = "/";
            if (path.length() > 1 && path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            String query = uri.getRawQuery();

            StringBuilder sb = new StringBuilder();
            sb.append(lowerScheme).append("://").append(host.toLowerCase(Locale.ROOT));
            if (uri.getPort() != -1 && uri.getPort() != defaultPort(lowerScheme)) {
                sb.append(':').append(uri.getPort());
            }
            sb.append(path);
            if (query != null && !query.isBlank()) sb.append('?').append(query);
            return sb.toString();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * Host of the URL without port and without a leading {@code www.}, lower-cased; null when absent.
     */
    public static String domainOf(String url) {
        if (url == null) return null;
        try {
            String host = new URI(url.trim()).getHost();
            if (host == null) return null;
            host = host.toLowerCase(Locale.ROOT);
            return host.startsWith("www.") ? host.substring(4) : host;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * True when {@code domain} equals {@code allowed} or is a subdomain of it.
     */
    public static boolean isSameOrSubdomain(String domain, String allowed) {
        if (domain == null || allowed == null) return false;
        return domain.equals(allowed) || domain.endsWith("." + allowed);
    }

    private static int defaultPort(String scheme) {
        return "https".equals(scheme) ? 443 : 80;
    }
}
