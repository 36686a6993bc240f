package org.smileyface.harvester.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Minimal document store abstraction shared by every worker and every process.
 * Documents are plain maps of field name to value (strings, numbers, booleans, nested maps and lists).
 *
 * <p>Implementations must make {@link #insert}, {@link #upsert}, {@link #insertIfAbsent} and
 * {@link #findAndUpdate} atomic per document. Failures surface as {@link StoreException}.</p>
 */
public interface DocumentStore {

    /**
     * Creates (if missing) a unique index on a single top-level field of a collection.
     */
    void ensureUniqueIndex(String collection, String field);

    /**
     * Inserts a new document.
     *
     * @throws DuplicateKeyStoreException when a unique index is violated
     */
    void insert(String collection, Map<String, Object> document);

    /**
     * Sets the given fields on the first document matching the filter, inserting a new document
     * (filter equality values plus fields) when none matches.
     */
    UpsertResult upsert(String collection, StoreFilter filter, Map<String, Object> fields);

    /**
     * Inserts the document only when nothing matches the filter; an existing document is left untouched.
     *
     * @return true when a new document was created
     */
    boolean insertIfAbsent(String collection, StoreFilter filter, Map<String, Object> document);

    Optional<Map<String, Object>> findOne(String collection, StoreFilter filter);

    /**
     * Atomically picks the first document matching the filter in sort order, applies the update and
     * returns the updated document. Two concurrent callers never receive the same document unless the
     * update leaves it matching the filter.
     */
    Optional<Map<String, Object>> findAndUpdate(String collection, StoreFilter filter, StoreUpdate update, StoreSort sort);

    /**
     * @return number of matched documents
     */
    long updateMany(String collection, StoreFilter filter, StoreUpdate update);

    /**
     * @return number of deleted documents
     */
    long deleteMany(String collection, StoreFilter filter);

    /**
     * @param limit maximum number of documents, or {@code 0} for no limit
     */
    List<Map<String, Object>> find(String collection, StoreFilter filter, StoreSort sort, int limit);

    long count(String collection, StoreFilter filter);

    void drop(String collection);

    /**
     * Verifies the store is reachable.
     *
     * @throws StoreUnavailableException when it is not
     */
    void ping();
}
