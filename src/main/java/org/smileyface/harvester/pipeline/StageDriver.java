package org.smileyface.harvester.pipeline;

import org.smileyface.harvester.render.PageRenderException;
import org.smileyface.harvester.render.PageRenderer;

/**
 * Fetches and extracts one entity's page for a stage. Drivers do not write to the store; the
 * {@link StageRunner} applies the returned outcome.
 */
@FunctionalInterface
public interface StageDriver {

    /**
     * @throws PageRenderException on fetch failures, after the renderer's own retries
     * @throws org.smileyface.harvester.extractor.ExtractionException when the page does not have the expected shape
     */
    StageOutcome process(EntityRecord record, PageRenderer renderer) throws PageRenderException;
}
