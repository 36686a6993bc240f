package org.smileyface.harvester.render;

import java.io.IOException;

/**
 * Transient I/O failure while rendering a page.
 */
public class PageRenderException extends IOException {

    private final int statusCode;

    public PageRenderException(String message) {
        this(message, -1, null);
    }

    public PageRenderException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public PageRenderException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status that caused the failure, or {@code -1} for transport errors.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Client errors other than 408 and 429 will not change on retry.
     */
    public boolean isRetryable() {
        return statusCode < 400 || statusCode >= 500 || statusCode == 408 || statusCode == 429;
    }
}
