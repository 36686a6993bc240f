package org.smileyface.harvester.pipeline;

/**
 * Parameters of one pipeline run.
 *
 * @param stage      index of the only stage to run, or null for every stage in order
 * @param limit      entities per stage; {@code <= 0} uses the configured batch limit
 * @param workers    pool size; {@code <= 0} uses the configured worker count
 * @param resume     skip seeding and continue from the stages stored on each entity
 * @param leased     lease every entity per stage, for instances sharing one store
 * @param instanceId lease owner, or null to generate one
 */
public record PipelineRequest(Integer stage, int limit, int workers, boolean resume, boolean leased, String instanceId) {

    public static PipelineRequest all() {
        return new PipelineRequest(null, 0, 0, false, false, null);
    }
}
