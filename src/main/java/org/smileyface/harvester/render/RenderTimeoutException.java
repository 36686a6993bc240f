package org.smileyface.harvester.render;

public class RenderTimeoutException extends PageRenderException {

    public RenderTimeoutException(String message) {
        super(message);
    }

    public RenderTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
