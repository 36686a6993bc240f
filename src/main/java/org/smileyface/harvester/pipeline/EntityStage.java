package org.smileyface.harvester.pipeline;

/**
 * Lifecycle stages of a directory entity. Which stages apply, and in what order, depends on the
 * {@link EntityType}.
 */
public enum EntityStage {
    PENDING,
    SCRAPED,
    ENRICHED,
    MEMBERS_COLLECTED,
    PROCESSED
}
