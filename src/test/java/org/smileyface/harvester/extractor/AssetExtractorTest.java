package org.smileyface.harvester.extractor;

import org.junit.jupiter.api.Test;
import org.smileyface.harvester.model.AssetType;
import org.smileyface.harvester.model.PageAsset;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AssetExtractorTest {

    private static final String PAGE = "https://www.example.com/clinic";

    private final AssetExtractor extractor = new AssetExtractor();

    @Test
    void testFindsEveryKindOfAssetOncePerUrl() {
        String html = "<html><head>"
                + "<link rel='stylesheet' href='/css/site.css'>"
                + "<link rel='preload' as='font' href='/fonts/body.woff2'>"
                + "<link rel='icon' href='/favicon.ico'>"
                + "<style>.hero { background: url('/img/hero.png'); } @font-face { src: url(/fonts/head.ttf); }"
                + " .x { background: url(data:image/png;base64,AAAA); }</style>"
                + "<script src='https://cdn.example.net/app.js'></script><script>var inline = 1;</script>"
                + "</head><body>"
                + "<img src='/img/logo.png' alt=' Clinic  logo ' width='120' height='40'>"
                + "<img src='/img/logo.png#again'>"
                + "<img src='/img/map.png' width='300'>"
                + "<video><source src='/media/tour.mp4' type='video/mp4'></video>"
                + "</body></html>";

        List<PageAsset> assets = extractor.extract(html, PAGE);

        List<String> urls = new ArrayList<>();
        for (PageAsset a : assets) urls.add(a.getAssetType() + " " + a.getUrl());
        assertEquals(List.of(
                "IMAGE https://www.example.com/img/logo.png",
                "IMAGE https://www.example.com/img/map.png",
                "STYLESHEET https://www.example.com/css/site.css",
                "FONT https://www.example.com/fonts/body.woff2",
                "SCRIPT https://cdn.example.net/app.js",
                "VIDEO https://www.example.com/media/tour.mp4",
                "IMAGE https://www.example.com/img/hero.png",
                "FONT https://www.example.com/fonts/head.ttf"), urls);

        PageAsset logo = assets.get(0);
        assertEquals("Clinic logo", logo.getAltText());
        assertEquals(120, logo.getWidth());
        assertEquals(40, logo.getHeight());
        assertEquals(PAGE, logo.getPageUrl());
        assertEquals("example.com", logo.getDomain());

        PageAsset map = assets.get(1);
        assertNull(map.getWidth(), "dimensions need both width and height");
        assertNull(map.getAltText());
    }

    @Test
    void testPageWithoutAssets() {
        assertTrue(extractor.extract("<html><body><p>Text only</p><a href='/next'>next</a></body></html>", PAGE).isEmpty());
        assertTrue(extractor.extract((String) null, PAGE).isEmpty());
    }

    @Test
    void testVideoSourceAttributeAndAssetTypes() {
        List<PageAsset> assets = extractor.extract("<html><body><video src='/media/intro.webm'></video></body></html>", PAGE);

        assertEquals(1, assets.size());
        assertEquals(AssetType.VIDEO, assets.get(0).getAssetType());
        assertEquals("https://www.example.com/media/intro.webm", assets.get(0).getUrl());
    }
}
