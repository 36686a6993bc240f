package org.smileyface.harvester.lease;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.harvester.model.Lease;
import org.smileyface.harvester.store.Documents;
import org.smileyface.harvester.store.DocumentStore;
import org.smileyface.harvester.store.DuplicateKeyStoreException;
import org.smileyface.harvester.store.StoreCollections;
import org.smileyface.harvester.store.StoreException;
import org.smileyface.harvester.store.StoreFilter;
import org.smileyface.harvester.store.StoreUpdate;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Exclusive, time-bounded claims on resource keys, stored in the {@code locks} collection and guarded by its
 * unique index. At most one owner holds an unexpired lease on a key; an expired lease may be taken over.
 *
 * <p>{@link #claim} and {@link #release} never throw: a store failure simply means "not acquired".</p>
 */
public class LeaseManager {

    private static final Logger log = LogManager.getLogger();

    public static final Duration DEFAULT_LEASE = Duration.ofMinutes(5);

    private static final String RESOURCE_KEY = "resourceKey";
    private static final String OWNER_ID = "ownerId";
    private static final String EXPIRES_AT = "expiresAt";

    private final DocumentStore store;
    private final String ownerId;
    private final long leaseMs;
    private final Clock clock;
    private final Set<String> held = ConcurrentHashMap.newKeySet();

    public LeaseManager(DocumentStore store, String ownerId, Duration leaseDuration, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.ownerId = Objects.requireNonNull(ownerId, "ownerId");
        this.leaseMs = (leaseDuration == null ? DEFAULT_LEASE : leaseDuration).toMillis();
        this.clock = Objects.requireNonNull(clock, "clock");
        // exclusivity rests on this index
        store.ensureUniqueIndex(StoreCollections.LOCKS, RESOURCE_KEY);
    }

    public String getOwnerId() {
        return ownerId;
    }

    /**
     * Tries to take the lease on {@code key}. An unexpired lease held by anyone (including this owner) wins;
     * an expired one is deleted and the insert retried once.
     */
    public boolean claim(String key) {
        try {
            if (tryInsert(key)) {
                return true;
            }
            long now = clock.millis();
            long removed = store.deleteMany(StoreCollections.LOCKS, StoreFilter.byField(RESOURCE_KEY, key).lt(EXPIRES_AT, now));
            if (removed == 0) {
                log.debug("Lease on {} is held by another owner", key);
                return false;
            }
            log.info("Took over expired lease on {} (owner={})", key, ownerId);
            return tryInsert(key);
        } catch (StoreException e) {
            log.warn("Lease claim on {} failed: {}", key, e.getMessage());
            return false;
        }
    }

    private boolean tryInsert(String key) {
        long now = clock.millis();
        Lease lease = new Lease(key, ownerId, now, now + leaseMs);
        try {
            store.insert(StoreCollections.LOCKS, Documents.toDocument(lease));
            held.add(key);
            return true;
        } catch (DuplicateKeyStoreException conflict) {
            return false;
        }
    }

    /**
     * Pushes the expiry of a lease this owner holds.
     *
     * @return false when the lease is gone or belongs to someone else
     */
    public boolean renew(String key) {
        try {
            long matched = store.updateMany(StoreCollections.LOCKS, ownedBy(key),
                    StoreUpdate.create().set(EXPIRES_AT, clock.millis() + leaseMs));
            if (matched == 0) {
                held.remove(key);
                log.warn("Lease on {} was lost before renewal (owner={})", key, ownerId);
                return false;
            }
            return true;
        } catch (StoreException e) {
            log.warn("Lease renewal on {} failed: {}", key, e.getMessage());
            return false;
        }
    }

    /**
     * Renews every lease currently held by this owner.
     *
     * @return number of leases still held
     */
    public int renewHeld() {
        int kept = 0;
        for (String key : Set.copyOf(held)) {
            if (renew(key)) kept++;
        }
        return kept;
    }

    /**
     * Drops the lease if this owner still holds it. Never throws.
     */
    public void release(String key) {
        held.remove(key);
        try {
            store.deleteMany(StoreCollections.LOCKS, ownedBy(key));
        } catch (RuntimeException e) {
            log.warn("Lease release on {} failed: {}", key, e.getMessage());
        }
    }

    /**
     * Deletes every expired lease. Idempotent and safe to run from every worker.
     *
     * @return number of leases removed
     */
    public long reapExpired() {
        try {
            long removed = store.deleteMany(StoreCollections.LOCKS, StoreFilter.all().lt(EXPIRES_AT, clock.millis()));
            if (removed > 0) {
                log.info("Reaped {} expired leases", removed);
            }
            return removed;
        } catch (StoreException e) {
            log.warn("Reaping expired leases failed: {}", e.getMessage());
            return 0;
        }
    }

    public Set<String> heldKeys() {
        return Set.copyOf(held);
    }

    private StoreFilter ownedBy(String key) {
        return StoreFilter.byField(RESOURCE_KEY, key).eq(OWNER_ID, ownerId);
    }
}
