package org.smileyface.harvester.pipeline;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Stored form of a directory entity. The natural key is the normalized URL of the entity's page; the stage is
 * the entity's checkpoint in the pipeline and {@code version} guards concurrent payload writes.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EntityRecord {

    private String key;
    private EntityStage stage;
    private Map<String, Object> payload = new LinkedHashMap<>();
    private int retryCount;
    private String lastError;
    private boolean failed;
    private long version;
    private Long createdAt;
    private Long updatedAt;

    public EntityRecord() {}

    public EntityRecord(String key, EntityStage stage, Map<String, Object> payload) {
        this.key = key;
        this.stage = stage;
        setPayload(payload);
    }

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public EntityStage getStage() { return stage; }
    public void setStage(EntityStage stage) { this.stage = stage; }

    public Map<String, Object> getPayload() { return payload; }
    public void setPayload(Map<String, Object> payload) { this.payload = payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>(); }

    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    public boolean isFailed() { return failed; }
    public void setFailed(boolean failed) { this.failed = failed; }

    public long getVersion() { return version; }
    public void setVersion(long version) { this.version = version; }

    public Long getCreatedAt() { return createdAt; }
    public void setCreatedAt(Long createdAt) { this.createdAt = createdAt; }

    public Long getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Long updatedAt) { this.updatedAt = updatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityRecord that)) return false;
        return Objects.equals(key, that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(key);
    }

    @Override
    public String toString() {
        return "EntityRecord{" + key + ", stage=" + stage + ", retries=" + retryCount + '}';
    }
}
