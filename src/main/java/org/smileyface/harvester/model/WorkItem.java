package org.smileyface.harvester.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * A unit of work in the shared queue, identified by a unique key (usually a normalized URL).
 * While {@code status == CLAIMED}, {@code owner}, {@code claimedAt} and {@code expiresAt} are always set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkItem {

    private String key;
    private String domain;
    private int depth;
    private String parentKey;
    private int priority;
    private WorkStatus status = WorkStatus.PENDING;
    private String owner;
    private Long claimedAt;          // epoch millis
    private Long expiresAt;          // epoch millis
    private Long createdAt;          // epoch millis
    private int redeliveries;
    private String lastError;

    public WorkItem() {
        // for JSON mapping
    }

    public WorkItem(String key, String domain, int depth, String parentKey, int priority) {
        this.key = key;
        this.domain = domain;
        this.depth = depth;
        this.parentKey = parentKey;
        this.priority = priority;
    }

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public String getDomain() { return domain; }
    public void setDomain(String domain) { this.domain = domain; }

    public int getDepth() { return depth; }
    public void setDepth(int depth) { this.depth = depth; }

    public String getParentKey() { return parentKey; }
    public void setParentKey(String parentKey) { this.parentKey = parentKey; }

    public int getPriority() { return priority; }
    public void setPriority(int priority) { this.priority = priority; }

    public WorkStatus getStatus() { return status; }
    public void setStatus(WorkStatus status) { this.status = status; }

    public String getOwner() { return owner; }
    public void setOwner(String owner) { this.owner = owner; }

    public Long getClaimedAt() { return claimedAt; }
    public void setClaimedAt(Long claimedAt) { this.claimedAt = claimedAt; }

    public Long getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Long expiresAt) { this.expiresAt = expiresAt; }

    public Long getCreatedAt() { return createdAt; }
    public void setCreatedAt(Long createdAt) { this.createdAt = createdAt; }

    public int getRedeliveries() { return redeliveries; }
    public void setRedeliveries(int redeliveries) { this.redeliveries = redeliveries; }

    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkItem other)) return false;
        return Objects.equals(key, other.key);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(key);
    }

    @Override
    public String toString() {
        return "WorkItem{key='" + key + "', depth=" + depth + ", priority=" + priority + ", status=" + status + '}';
    }
}
