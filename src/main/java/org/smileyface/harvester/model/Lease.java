package org.smileyface.harvester.model;

/**
 * Advisory exclusive claim on a resource. Expiry is checked by every reader; nothing deletes it automatically.
 */
public record Lease(String resourceKey, String ownerId, long acquiredAt, long expiresAt) {

    public boolean isExpired(long nowMillis) {
        return expiresAt < nowMillis;
    }
}
