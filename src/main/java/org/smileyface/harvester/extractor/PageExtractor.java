package org.smileyface.harvester.extractor;

/**
 * Pure function from rendered HTML to structured data; implementations hold no per-page state.
 */
@FunctionalInterface
public interface PageExtractor {

    /**
     * @param html rendered page
     * @param url  address the HTML was loaded from, used to resolve relative links
     * @throws ExtractionException when the page cannot be interpreted
     */
    Extraction extract(String html, String url);
}
