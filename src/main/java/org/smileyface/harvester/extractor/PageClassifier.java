package org.smileyface.harvester.extractor;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.util.List;
import java.util.Locale;

/**
 * Heuristics over a parsed page: what kind of page it is, and whether its content depends on JavaScript.
 */
public class PageClassifier {

    public static final String SEARCH = "search";
    public static final String FORM = "form";
    public static final String LISTING = "listing";
    public static final String DETAIL = "detail";
    public static final String PAGE = "page";

    private static final int MIN_STATIC_TEXT = 100;
    private static final int MIN_LISTING_ITEMS = 3;

    private static final List<String> FRAMEWORK_MARKERS = List.of(
            "react", "vue", "angular", "ember", "backbone", "next.js", "nuxt", "gatsby",
            "__next_data__", "__react_devtools__", "ng-app", "data-reactroot", "data-vue");

    private static final List<String> MOUNT_POINT_HINTS = List.of("app", "root", "main", "container");

    /**
     * A page needs a script-capable renderer when its body is nearly empty and it either loads a known
     * front-end framework or only contains empty mount points.
     */
    public boolean requiresJavaScript(Document doc) {
        Element body = doc.body();
        String text = body == null ? "" : body.text().trim();
        if (text.length() >= MIN_STATIC_TEXT) {
            return false;
        }
        for (Element script : doc.select("script")) {
            String src = script.attr("src").toLowerCase(Locale.ROOT);
            String inline = script.data().toLowerCase(Locale.ROOT);
            for (String marker : FRAMEWORK_MARKERS) {
                if (src.contains(marker) || inline.contains(marker)) return true;
            }
        }
        if (body != null) {
            if (!body.select("[ng-app], [data-reactroot], [data-vue]").isEmpty()) return true;
            Elements divs = body.select("div");
            int limit = Math.min(5, divs.size());
            for (int i = 0; i < limit; i++) {
                Element div = divs.get(i);
                String idAndClass = (div.id() + " " + div.className()).toLowerCase(Locale.ROOT);
                boolean mountPoint = MOUNT_POINT_HINTS.stream().anyMatch(idAndClass::contains);
                if (mountPoint && div.text().trim().length() < 50) return true;
            }
        }
        return false;
    }

    public String classify(Document doc) {
        if (!doc.select("input[type=search], form[role=search], form[action*=search]").isEmpty()) {
            return SEARCH;
        }
        Elements forms = doc.select("form");
        if (!forms.isEmpty() && forms.select("input:not([type=hidden]), textarea, select").size() >= 3) {
            return FORM;
        }
        if (looksLikeListing(doc)) {
            return LISTING;
        }
        if (!doc.select("article, [itemtype], main h1").isEmpty()) {
            return DETAIL;
        }
        return PAGE;
    }

    private static boolean looksLikeListing(Document doc) {
        Elements cards = doc.select("[class~=(?i)(card|item|result|listing)]");
        if (cards.size() >= MIN_LISTING_ITEMS) return true;
        for (Element table : doc.select("table")) {
            if (table.select("tr").size() > MIN_LISTING_ITEMS) return true;
        }
        return false;
    }
}
