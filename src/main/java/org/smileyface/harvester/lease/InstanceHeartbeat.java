package org.smileyface.harvester.lease;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.harvester.store.DocumentStore;
import org.smileyface.harvester.store.StoreCollections;
import org.smileyface.harvester.store.StoreException;
import org.smileyface.harvester.store.StoreFilter;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Records liveness of one running instance in {@code crawl_jobs}.
 */
public class InstanceHeartbeat {

    private static final Logger log = LogManager.getLogger();

    private final DocumentStore store;
    private final String instanceId;
    private final String job;
    private final Clock clock;

    public InstanceHeartbeat(DocumentStore store, String instanceId, String job, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.instanceId = Objects.requireNonNull(instanceId, "instanceId");
        this.job = job;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void beat(String status) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("job", job);
        fields.put("status", status);
        fields.put("lastHeartbeat", clock.millis());
        try {
            store.upsert(StoreCollections.CRAWL_JOBS, StoreFilter.byField("instanceId", instanceId), fields);
        } catch (StoreException e) {
            log.warn("Heartbeat for {} failed: {}", instanceId, e.getMessage());
        }
    }

    public String getInstanceId() {
        return instanceId;
    }
}
