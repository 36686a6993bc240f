package org.smileyface.harvester.pipeline;

import java.util.Objects;

/**
 * One step of the pipeline: entities of {@code type} that have not reached {@code exit} are fed to the driver
 * and moved to {@code exit} on success.
 */
public record StageDefinition(int index, String name, EntityType type, EntityStage exit, StageDriver driver) {

    public StageDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(exit, "exit");
        Objects.requireNonNull(driver, "driver");
        if (type.rank(exit) == 0) {
            throw new IllegalArgumentException("Stage " + name + " must exit past the initial stage of " + type);
        }
    }

    /**
     * Lease key for one entity in this stage.
     */
    public String leaseKey(String entityKey) {
        return name + ":" + entityKey;
    }
}
