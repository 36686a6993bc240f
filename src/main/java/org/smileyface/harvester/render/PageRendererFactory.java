package org.smileyface.harvester.render;

/**
 * Creates one {@link PageRenderer} per worker.
 */
@FunctionalInterface
public interface PageRendererFactory {

    PageRenderer create();
}
