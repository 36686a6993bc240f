package org.smileyface.harvester.extractor;

/**
 * Page content could not be interpreted (malformed markup, missing required data, bad selector).
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
