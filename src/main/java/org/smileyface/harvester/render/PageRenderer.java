package org.smileyface.harvester.render;

import java.time.Duration;

/**
 * A browsing session owned by exactly one worker. Not thread-safe.
 */
public interface PageRenderer extends AutoCloseable {

    /**
     * Navigates to {@code url} and returns the resulting HTML.
     *
     * @throws RenderTimeoutException when the page does not load in time
     * @throws PageRenderException on any other transport or HTTP failure
     */
    String open(String url) throws PageRenderException;

    /**
     * Blocks until an element matching {@code selector} is present.
     *
     * @throws RenderTimeoutException when it does not appear within {@code timeout}
     */
    void waitFor(String selector, Duration timeout) throws PageRenderException;

    /**
     * Clicks the first element matching {@code selector}.
     *
     * @return false when no such element exists on the current page
     */
    boolean click(String selector) throws PageRenderException;

    String currentHtml();

    String currentUrl();

    /**
     * HTTP status of the last navigation, or {@code -1} before the first one.
     */
    int statusCode();

    @Override
    void close();
}
