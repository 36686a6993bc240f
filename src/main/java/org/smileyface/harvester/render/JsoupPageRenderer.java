package org.smileyface.harvester.render;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Objects;

/**
 * Renders pages by fetching and parsing them with jsoup. Documents are static: {@link #waitFor} succeeds only
 * when the element is already present, and {@link #click} follows the element's {@code href}
 * (or {@code data-href}) to the next document.
 */
public class JsoupPageRenderer implements PageRenderer {

    private static final Logger log = LoggerFactory.getLogger(JsoupPageRenderer.class);

    public static final String DEFAULT_USER_AGENT = "SmileyfaceHarvester/0.1";

    private final String userAgent;
    private final int timeoutMs;

    private Document current;
    private int statusCode = -1;

    public JsoupPageRenderer(String userAgent, int timeoutMs) {
        this.userAgent = Objects.toString(userAgent, DEFAULT_USER_AGENT);
        this.timeoutMs = Math.max(0, timeoutMs);
    }

    @Override
    public String open(String url) throws PageRenderException {
        long start = System.currentTimeMillis();
        try {
            Connection.Response res = Jsoup.connect(url)
                    .userAgent(userAgent)
                    .timeout(timeoutMs)
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .execute();
            statusCode = res.statusCode();
            if (statusCode >= 400) {
                throw new PageRenderException("HTTP " + statusCode + " for " + url, statusCode, null);
            }
            current = res.parse();
            log.debug("Rendered {} (status={}, {} ms)", url, statusCode, System.currentTimeMillis() - start);
            return current.outerHtml();
        } catch (SocketTimeoutException e) {
            throw new RenderTimeoutException("Timed out after " + timeoutMs + " ms loading " + url, e);
        } catch (PageRenderException e) {
            throw e;
        } catch (IOException | IllegalArgumentException e) {
            throw new PageRenderException("Failed to load " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void waitFor(String selector, Duration timeout) throws PageRenderException {
        requireDocument();
        if (current.selectFirst(selector) == null) {
            throw new RenderTimeoutException("Selector '" + selector + "' not present on " + currentUrl());
        }
    }

    @Override
    public boolean click(String selector) throws PageRenderException {
        requireDocument();
        Element el = current.selectFirst(selector);
        if (el == null) {
            return false;
        }
        String target = el.hasAttr("href") ? el.absUrl("href") : el.absUrl("data-href");
        if (target.isBlank()) {
            throw new PageRenderException("Element '" + selector + "' on " + currentUrl() + " has no link to follow");
        }
        open(target);
        return true;
    }

    @Override
    public String currentHtml() {
        return current == null ? "" : current.outerHtml();
    }

    @Override
    public String currentUrl() {
        return current == null ? null : current.location();
    }

    @Override
    public int statusCode() {
        return statusCode;
    }

    @Override
    public void close() {
        current = null;
    }

    private void requireDocument() {
        if (current == null) {
            throw new IllegalStateException("No page open");
        }
    }
}
