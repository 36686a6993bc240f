package org.smileyface.harvester.pipeline;

import org.smileyface.harvester.store.StoreCollections;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Kinds of directory records, each stored in its own collection and moving through its own ordered stages.
 */
public enum EntityType {

    SOURCE(StoreCollections.SOURCES, EntityStage.PENDING, EntityStage.SCRAPED),
    LOCATION(StoreCollections.LOCATIONS, EntityStage.PENDING, EntityStage.SCRAPED),
    ORGANIZATION(StoreCollections.ORGANIZATIONS, EntityStage.PENDING, EntityStage.ENRICHED, EntityStage.MEMBERS_COLLECTED),
    PERSON(StoreCollections.PERSONS, EntityStage.PENDING, EntityStage.PROCESSED);

    private final String collection;
    private final List<EntityStage> lifecycle;

    EntityType(String collection, EntityStage... lifecycle) {
        this.collection = collection;
        this.lifecycle = List.of(lifecycle);
    }

    public String collection() {
        return collection;
    }

    public List<EntityStage> lifecycle() {
        return lifecycle;
    }

    public EntityStage initialStage() {
        return lifecycle.get(0);
    }

    /**
     * Position of {@code stage} in this type's lifecycle.
     *
     * @throws IllegalArgumentException when the stage does not apply to this type
     */
    public int rank(EntityStage stage) {
        int i = lifecycle.indexOf(stage);
        if (i < 0) {
            throw new IllegalArgumentException(stage + " is not a stage of " + this);
        }
        return i;
    }

    /**
     * Stages strictly before {@code stage}; an entity in one of them has not yet reached it.
     */
    public List<EntityStage> stagesBefore(EntityStage stage) {
        return new ArrayList<>(lifecycle.subList(0, rank(stage)));
    }

    public boolean precedes(EntityStage a, EntityStage b) {
        return rank(a) < rank(b);
    }

    public static EntityType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entity type must not be blank");
        }
        return EntityType.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
