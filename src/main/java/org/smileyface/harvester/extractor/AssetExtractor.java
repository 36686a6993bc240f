package org.smileyface.harvester.extractor;

import org.jsoup.Jsoup;
import org.jsoup.internal.StringUtil;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.smileyface.harvester.model.AssetType;
import org.smileyface.harvester.model.PageAsset;
import org.smileyface.harvester.util.CrawlerUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lists the images, stylesheets, scripts, fonts and videos a page references, including {@code url(...)}
 * references inside its {@code <style>} blocks. Each asset URL is reported once per page, with the first type
 * it was found as.
 */
public class AssetExtractor {

    private static final Pattern CSS_URL = Pattern.compile("url\\(\\s*['\"]?([^'\")]+)['\"]?\\s*\\)");
    private static final List<String> IMAGE_EXTENSIONS = List.of(".jpg", ".jpeg", ".png", ".gif", ".svg", ".webp");
    private static final List<String> FONT_EXTENSIONS = List.of(".woff", ".woff2", ".ttf", ".otf", ".eot");

    public List<PageAsset> extract(String html, String pageUrl) {
        if (html == null) {
            return List.of();
        }
        return extract(Jsoup.parse(html, pageUrl), pageUrl);
    }

    public List<PageAsset> extract(Document doc, String pageUrl) {
        String domain = CrawlerUtils.domainOf(pageUrl);
        Map<String, PageAsset> byUrl = new LinkedHashMap<>();

        for (Element img : doc.select("img[src]")) {
            PageAsset asset = add(byUrl, img.absUrl("src"), AssetType.IMAGE, pageUrl, domain);
            if (asset == null) continue;
            String alt = CrawlerUtils.cleanText(img.attr("alt"));
            if (alt != null && !alt.isEmpty()) asset.setAltText(alt);
            Integer width = parseDimension(img.attr("width"));
            Integer height = parseDimension(img.attr("height"));
            if (width != null && height != null) {
                asset.setWidth(width);
                asset.setHeight(height);
            }
        }
        for (Element link : doc.select("link[href]")) {
            String rel = link.attr("rel").toLowerCase(Locale.ROOT);
            String href = link.absUrl("href");
            if (rel.contains("stylesheet")) {
                add(byUrl, href, AssetType.STYLESHEET, pageUrl, domain);
            } else if (rel.contains("font") || "font".equalsIgnoreCase(link.attr("as")) || hasExtension(href, FONT_EXTENSIONS)) {
                add(byUrl, href, AssetType.FONT, pageUrl, domain);
            }
        }
        for (Element script : doc.select("script[src]")) {
            add(byUrl, script.absUrl("src"), AssetType.SCRIPT, pageUrl, domain);
        }
        for (Element video : doc.select("video[src], video source[src]")) {
            add(byUrl, video.absUrl("src"), AssetType.VIDEO, pageUrl, domain);
        }
        for (Element style : doc.select("style")) {
            Matcher m = CSS_URL.matcher(style.data());
            while (m.find()) {
                String ref = m.group(1).trim();
                String resolved = StringUtil.resolve(doc.location(), ref);
                if (hasExtension(ref, IMAGE_EXTENSIONS)) {
                    add(byUrl, resolved, AssetType.IMAGE, pageUrl, domain);
                } else if (hasExtension(ref, FONT_EXTENSIONS)) {
                    add(byUrl, resolved, AssetType.FONT, pageUrl, domain);
                }
            }
        }
        return new ArrayList<>(byUrl.values());
    }

    private static PageAsset add(Map<String, PageAsset> into, String raw, AssetType type, String pageUrl, String domain) {
        String url = CrawlerUtils.normalizeUrl(raw);
        if (url == null || into.containsKey(url)) return null;
        PageAsset asset = new PageAsset(url, type, pageUrl, domain);
        into.put(url, asset);
        return asset;
    }

    private static boolean hasExtension(String url, List<String> extensions) {
        String lower = url.toLowerCase(Locale.ROOT);
        int query = lower.indexOf('?');
        String path = query >= 0 ? lower.substring(0, query) : lower;
        for (String ext : extensions) {
            if (path.endsWith(ext)) return true;
        }
        return false;
    }

    private static Integer parseDimension(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
