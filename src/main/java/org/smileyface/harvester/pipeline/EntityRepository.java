package org.smileyface.harvester.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.harvester.merge.MergePolicy;
import org.smileyface.harvester.merge.RecordMerger;
import org.smileyface.harvester.store.DocumentStore;
import org.smileyface.harvester.store.Documents;
import org.smileyface.harvester.store.StoreException;
import org.smileyface.harvester.store.StoreFilter;
import org.smileyface.harvester.store.StoreSort;
import org.smileyface.harvester.store.StoreUpdate;
import org.smileyface.harvester.store.UpsertResult;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Stage-aware access to the entity collections. Stages only move forward: {@link #advance} matches on the stages
 * before its target, so a record that already reached it keeps its stage and only gains payload values.
 * Payload writes are merged through {@link RecordMerger} and applied with an optimistic version check.
 */
public class EntityRepository {

    private static final Logger log = LogManager.getLogger();

    static final String KEY = "key";
    static final String STAGE = "stage";
    static final String PAYLOAD = "payload";
    static final String RETRY_COUNT = "retryCount";
    static final String LAST_ERROR = "lastError";
    static final String FAILED = "failed";
    static final String VERSION = "version";
    static final String CREATED_AT = "createdAt";
    static final String UPDATED_AT = "updatedAt";

    private static final int MAX_WRITE_ATTEMPTS = 5;

    private final DocumentStore store;
    private final RecordMerger merger;
    private final MergePolicy mergePolicy;
    private final Clock clock;

    public EntityRepository(DocumentStore store, RecordMerger merger, MergePolicy mergePolicy, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.merger = Objects.requireNonNull(merger, "merger");
        this.mergePolicy = mergePolicy == null ? MergePolicy.defaults() : mergePolicy;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Next batch needing a stage: records whose stage precedes {@code exit}, oldest first.
     *
     * @param maxRetries records that failed this many times are left out; {@code <= 0} means no bound
     * @param limit      maximum batch size; {@code <= 0} means all
     */
    public List<EntityRecord> selectForStage(EntityType type, EntityStage exit, int maxRetries, int limit) {
        StoreFilter filter = StoreFilter.all().in(STAGE, stageNames(type.stagesBefore(exit)));
        if (maxRetries > 0) {
            filter = filter.lt(RETRY_COUNT, maxRetries);
        }
        List<EntityRecord> out = new ArrayList<>();
        for (Map<String, Object> doc : store.find(type.collection(), filter, StoreSort.asc(CREATED_AT), Math.max(0, limit))) {
            out.add(Documents.fromDocument(doc, EntityRecord.class));
        }
        return out;
    }

    public Optional<EntityRecord> find(EntityType type, String key) {
        return store.findOne(type.collection(), StoreFilter.byField(KEY, key))
                .map(doc -> Documents.fromDocument(doc, EntityRecord.class));
    }

    /**
     * Creates the record at the type's initial stage unless one with the same key exists.
     *
     * @return true when the record was created
     */
    public boolean insertIfAbsent(EntityType type, String key, Map<String, Object> payload) {
        long now = clock.millis();
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put(STAGE, type.initialStage().name());
        doc.put(PAYLOAD, payload == null ? Map.of() : payload);
        doc.put(RETRY_COUNT, 0);
        doc.put(FAILED, false);
        doc.put(VERSION, 0L);
        doc.put(CREATED_AT, now);
        doc.put(UPDATED_AT, now);
        return store.insertIfAbsent(type.collection(), StoreFilter.byField(KEY, key), doc);
    }

    /**
     * Merges {@code fields} into the stored payload of an existing record.
     *
     * @return {@link UpsertResult#UNCHANGED} when the record is missing or already carries every value
     */
    public UpsertResult mergeInto(EntityType type, String key, Map<String, Object> fields) {
        return write(type, key, fields, null);
    }

    /**
     * Merges {@code fields} into the payload and moves the record to {@code to} if it has not reached it yet.
     * Clears the last error on a stage move.
     */
    public UpsertResult advance(EntityType type, String key, EntityStage to, Map<String, Object> fields) {
        type.rank(to);
        return write(type, key, fields, to);
    }

    /**
     * Notes a failed attempt. The stage is left as is so the record stays selectable until the retry bound.
     *
     * @return the record's retry count after this failure, or -1 when it does not exist
     */
    public int recordFailure(EntityType type, String key, String error, int maxRetries) {
        StoreUpdate update = StoreUpdate.create()
                .inc(RETRY_COUNT, 1)
                .set(LAST_ERROR, error == null ? "unknown error" : error)
                .set(UPDATED_AT, clock.millis());
        Optional<Map<String, Object>> after = store.findAndUpdate(type.collection(), StoreFilter.byField(KEY, key), update, null);
        if (after.isEmpty()) {
            return -1;
        }
        int retries = ((Number) after.get().getOrDefault(RETRY_COUNT, 1)).intValue();
        if (maxRetries > 0 && retries >= maxRetries) {
            store.updateMany(type.collection(), StoreFilter.byField(KEY, key), StoreUpdate.create().set(FAILED, true));
            log.warn("{} {} gave up after {} attempts: {}", type, key, retries, error);
        }
        return retries;
    }

    public Map<EntityStage, Long> countByStage(EntityType type) {
        Map<EntityStage, Long> out = new EnumMap<>(EntityStage.class);
        for (EntityStage stage : type.lifecycle()) {
            out.put(stage, store.count(type.collection(), StoreFilter.byField(STAGE, stage.name())));
        }
        return out;
    }

    public long countFailed(EntityType type) {
        return store.count(type.collection(), StoreFilter.byField(FAILED, true));
    }

    private UpsertResult write(EntityType type, String key, Map<String, Object> fields, EntityStage to) {
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            Optional<EntityRecord> current = find(type, key);
            if (current.isEmpty()) {
                log.debug("{} {} not found; nothing to write", type, key);
                return UpsertResult.UNCHANGED;
            }
            EntityRecord record = current.get();
            Optional<Map<String, Object>> updates = merger.merge(record.getPayload(), fields, mergePolicy);
            boolean moves = to != null && type.precedes(record.getStage(), to);
            if (!moves && updates.isEmpty()) {
                return UpsertResult.UNCHANGED;
            }
            StoreUpdate update = StoreUpdate.create()
                    .set(UPDATED_AT, clock.millis())
                    .inc(VERSION, 1);
            if (updates.isPresent()) {
                update = update.set(PAYLOAD, RecordMerger.apply(record.getPayload(), updates.get()));
            }
            if (moves) {
                update = update.set(STAGE, to.name()).set(FAILED, false).unset(LAST_ERROR);
            }
            StoreFilter guard = StoreFilter.byField(KEY, key).eq(VERSION, record.getVersion());
            if (store.findAndUpdate(type.collection(), guard, update, null).isPresent()) {
                if (moves) log.debug("{} {} {} -> {}", type, key, record.getStage(), to);
                return UpsertResult.MODIFIED;
            }
            log.debug("{} {} changed concurrently, retrying write (attempt {})", type, key, attempt);
        }
        throw new StoreException("Concurrent modification of " + type + " " + key + " after " + MAX_WRITE_ATTEMPTS + " attempts");
    }

    private static List<String> stageNames(List<EntityStage> stages) {
        List<String> names = new ArrayList<>(stages.size());
        for (EntityStage s : stages) names.add(s.name());
        return names;
    }
}
