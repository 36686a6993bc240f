package org.smileyface.harvester.render;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;

/**
 * Retries navigation of a delegate renderer a bounded number of times with a fixed backoff.
 * Timeouts are logged as warnings, other failures as errors; the last failure is rethrown.
 */
public class RetryingPageRenderer implements PageRenderer {

    private static final Logger log = LogManager.getLogger();

    private final PageRenderer delegate;
    private final int maxAttempts;
    private final long backoffMs;

    public RetryingPageRenderer(PageRenderer delegate, int maxAttempts, long backoffMs) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMs = Math.max(0, backoffMs);
    }

    @Override
    public String open(String url) throws PageRenderException {
        return withRetry("open " + url, () -> delegate.open(url));
    }

    @Override
    public void waitFor(String selector, Duration timeout) throws PageRenderException {
        delegate.waitFor(selector, timeout);
    }

    @Override
    public boolean click(String selector) throws PageRenderException {
        return withRetry("click " + selector, () -> delegate.click(selector));
    }

    @Override
    public String currentHtml() {
        return delegate.currentHtml();
    }

    @Override
    public String currentUrl() {
        return delegate.currentUrl();
    }

    @Override
    public int statusCode() {
        return delegate.statusCode();
    }

    @Override
    public void close() {
        delegate.close();
    }

    @FunctionalInterface
    private interface Attempt<T> {
        T run() throws PageRenderException;
    }

    private <T> T withRetry(String what, Attempt<T> attempt) throws PageRenderException {
        for (int i = 1; ; i++) {
            try {
                return attempt.run();
            } catch (RenderTimeoutException e) {
                log.warn("Attempt {}/{} to {} timed out: {}", i, maxAttempts, what, e.getMessage());
                if (i >= maxAttempts) throw e;
            } catch (PageRenderException e) {
                if (!e.isRetryable()) {
                    log.warn("Giving up on {}: {}", what, e.getMessage());
                    throw e;
                }
                log.error("Attempt {}/{} to {} failed", i, maxAttempts, what, e);
                if (i >= maxAttempts) throw e;
            }
            sleepBackoff();
        }
    }

    private void sleepBackoff() throws PageRenderException {
        if (backoffMs == 0) return;
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PageRenderException("Interrupted while waiting to retry", e);
        }
    }
}
