package org.smileyface.harvester.store;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process {@link DocumentStore} backed by in-memory lists, one per collection.
 * Every operation on a collection runs under that collection's monitor, which gives the same per-document
 * atomicity the shared store provides. Documents are deep-copied on the way in and out.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private static final Logger log = LogManager.getLogger();

    private final Map<String, Table> tables = new ConcurrentHashMap<>();

    private static final class Table {
        final List<Map<String, Object>> rows = new ArrayList<>();
        final Set<String> uniqueFields = new LinkedHashSet<>();
    }

    private Table table(String collection) {
        Objects.requireNonNull(collection, "collection");
        return tables.computeIfAbsent(collection, c -> new Table());
    }

    @Override
    public void ensureUniqueIndex(String collection, String field) {
        Table t = table(collection);
        synchronized (t) {
            if (t.uniqueFields.add(field)) {
                log.debug("Unique index {}.{} registered", collection, field);
            }
        }
    }

    @Override
    public void insert(String collection, Map<String, Object> document) {
        Table t = table(collection);
        Map<String, Object> copy = Documents.deepCopy(document);
        synchronized (t) {
            checkUnique(collection, t, copy, null);
            t.rows.add(copy);
        }
    }

    @Override
    public UpsertResult upsert(String collection, StoreFilter filter, Map<String, Object> fields) {
        Table t = table(collection);
        synchronized (t) {
            Map<String, Object> existing = firstMatch(t, filter, StoreSort.none());
            if (existing == null) {
                Map<String, Object> created = new LinkedHashMap<>(Documents.deepCopy(filter.equalityValues()));
                created.putAll(Documents.deepCopy(withoutNulls(fields)));
                checkUnique(collection, t, created, null);
                t.rows.add(created);
                return UpsertResult.INSERTED;
            }
            Map<String, Object> updated = new LinkedHashMap<>(existing);
            StoreUpdate.create().setAll(fields).applyTo(updated);
            if (sameDocument(existing, updated)) {
                return UpsertResult.UNCHANGED;
            }
            checkUnique(collection, t, updated, existing);
            existing.clear();
            existing.putAll(updated);
            return UpsertResult.MODIFIED;
        }
    }

    @Override
    public boolean insertIfAbsent(String collection, StoreFilter filter, Map<String, Object> document) {
        Table t = table(collection);
        synchronized (t) {
            if (firstMatch(t, filter, StoreSort.none()) != null) {
                return false;
            }
            Map<String, Object> created = new LinkedHashMap<>(Documents.deepCopy(filter.equalityValues()));
            created.putAll(Documents.deepCopy(withoutNulls(document)));
            checkUnique(collection, t, created, null);
            t.rows.add(created);
            return true;
        }
    }

    @Override
    public Optional<Map<String, Object>> findOne(String collection, StoreFilter filter) {
        Table t = table(collection);
        synchronized (t) {
            return Optional.ofNullable(Documents.deepCopy(firstMatch(t, filter, StoreSort.none())));
        }
    }

    @Override
    public Optional<Map<String, Object>> findAndUpdate(String collection, StoreFilter filter, StoreUpdate update, StoreSort sort) {
        Table t = table(collection);
        synchronized (t) {
            Map<String, Object> doc = firstMatch(t, filter, sort);
            if (doc == null) {
                return Optional.empty();
            }
            Map<String, Object> updated = new LinkedHashMap<>(doc);
            update.applyTo(updated);
            checkUnique(collection, t, updated, doc);
            doc.clear();
            doc.putAll(updated);
            return Optional.of(Documents.deepCopy(doc));
        }
    }

    @Override
    public long updateMany(String collection, StoreFilter filter, StoreUpdate update) {
        Table t = table(collection);
        synchronized (t) {
            long matched = 0;
            for (Map<String, Object> row : t.rows) {
                if (filter.matches(row)) {
                    update.applyTo(row);
                    matched++;
                }
            }
            return matched;
        }
    }

    @Override
    public long deleteMany(String collection, StoreFilter filter) {
        Table t = table(collection);
        synchronized (t) {
            long removed = 0;
            for (Iterator<Map<String, Object>> it = t.rows.iterator(); it.hasNext(); ) {
                if (filter.matches(it.next())) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        }
    }

    @Override
    public List<Map<String, Object>> find(String collection, StoreFilter filter, StoreSort sort, int limit) {
        Table t = table(collection);
        synchronized (t) {
            List<Map<String, Object>> matched = new ArrayList<>();
            for (Map<String, Object> row : t.rows) {
                if (filter.matches(row)) matched.add(row);
            }
            if (sort != null && !sort.isEmpty()) {
                // List.sort is stable, so ties keep insertion order
                matched.sort(sort.comparator());
            }
            int n = limit > 0 ? Math.min(limit, matched.size()) : matched.size();
            List<Map<String, Object>> out = new ArrayList<>(n);
            for (int i = 0; i < n; i++) out.add(Documents.deepCopy(matched.get(i)));
            return out;
        }
    }

    @Override
    public long count(String collection, StoreFilter filter) {
        Table t = table(collection);
        synchronized (t) {
            return t.rows.stream().filter(filter::matches).count();
        }
    }

    @Override
    public void drop(String collection) {
        Table t = table(collection);
        synchronized (t) {
            t.rows.clear();
        }
    }

    @Override
    public void ping() {
        // always reachable
    }

    private static Map<String, Object> firstMatch(Table t, StoreFilter filter, StoreSort sort) {
        Map<String, Object> best = null;
        for (Map<String, Object> row : t.rows) {
            if (!filter.matches(row)) continue;
            if (best == null) {
                best = row;
                if (sort == null || sort.isEmpty()) break;
            } else if (sort.comparator().compare(row, best) < 0) {
                best = row;
            }
        }
        return best;
    }

    private static void checkUnique(String collection, Table t, Map<String, Object> candidate, Map<String, Object> self) {
        for (String field : t.uniqueFields) {
            Object value = candidate.get(field);
            if (value == null) continue;
            for (Map<String, Object> row : t.rows) {
                if (row == self) continue;
                if (StoreFilter.valueEquals(row.get(field), value)) {
                    throw new DuplicateKeyStoreException(
                            "Duplicate key in " + collection + ": " + field + "=" + value);
                }
            }
        }
    }

    private static boolean sameDocument(Map<String, Object> a, Map<String, Object> b) {
        if (!a.keySet().equals(b.keySet())) return false;
        for (Map.Entry<String, Object> e : a.entrySet()) {
            if (!deepEquals(e.getValue(), b.get(e.getKey()))) return false;
        }
        return true;
    }

    private static boolean deepEquals(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return StoreFilter.valueEquals(a, b);
        }
        return Objects.equals(a, b);
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> fields) {
        Map<String, Object> out = new LinkedHashMap<>();
        fields.forEach((k, v) -> {
            if (v != null) out.put(k, v);
        });
        return out;
    }
}
