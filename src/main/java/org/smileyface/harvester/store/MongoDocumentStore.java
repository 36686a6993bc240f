package org.smileyface.harvester.store;

import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.UpdateResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * {@link DocumentStore} over a MongoDB database, shared by every process of a distributed run.
 */
public class MongoDocumentStore implements DocumentStore {

    private static final Logger log = LogManager.getLogger();

    private final MongoTemplate mongoTemplate;

    public MongoDocumentStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate");
    }

    @Override
    public void ensureUniqueIndex(String collection, String field) {
        run("ensureUniqueIndex " + collection + "." + field, () ->
                mongoTemplate.indexOps(collection).ensureIndex(new Index().on(field, Sort.Direction.ASC).unique()));
    }

    @Override
    public void insert(String collection, Map<String, Object> document) {
        run("insert into " + collection, () -> mongoTemplate.insert(toBson(document), collection));
    }

    @Override
    public UpsertResult upsert(String collection, StoreFilter filter, Map<String, Object> fields) {
        Update update = new Update();
        fields.forEach((k, v) -> {
            if (v == null) update.unset(k);
            else update.set(k, toBsonValue(v));
        });
        Query query = toQuery(filter);
        UpdateResult result;
        try {
            result = call("upsert into " + collection, () -> mongoTemplate.upsert(query, update, collection));
        } catch (DuplicateKeyStoreException race) {
            // a concurrent upsert created the document first; the second attempt updates it
            result = call("upsert into " + collection, () -> mongoTemplate.upsert(query, update, collection));
        }
        if (result.getUpsertedId() != null) return UpsertResult.INSERTED;
        return result.getModifiedCount() > 0 ? UpsertResult.MODIFIED : UpsertResult.UNCHANGED;
    }

    @Override
    public boolean insertIfAbsent(String collection, StoreFilter filter, Map<String, Object> document) {
        Update update = new Update();
        document.forEach((k, v) -> {
            if (v != null) update.setOnInsert(k, toBsonValue(v));
        });
        try {
            UpdateResult result = call("insertIfAbsent into " + collection,
                    () -> mongoTemplate.upsert(toQuery(filter), update, collection));
            return result.getUpsertedId() != null;
        } catch (DuplicateKeyStoreException race) {
            return false;
        }
    }

    @Override
    public Optional<Map<String, Object>> findOne(String collection, StoreFilter filter) {
        Document doc = call("findOne in " + collection, () -> mongoTemplate.findOne(toQuery(filter), Document.class, collection));
        return Optional.ofNullable(fromBson(doc));
    }

    @Override
    public Optional<Map<String, Object>> findAndUpdate(String collection, StoreFilter filter, StoreUpdate update, StoreSort sort) {
        Query query = toQuery(filter).with(toSort(sort));
        Document doc = call("findAndUpdate in " + collection, () -> mongoTemplate.findAndModify(
                query, toUpdate(update), FindAndModifyOptions.options().returnNew(true), Document.class, collection));
        return Optional.ofNullable(fromBson(doc));
    }

    @Override
    public long updateMany(String collection, StoreFilter filter, StoreUpdate update) {
        UpdateResult result = call("updateMany in " + collection,
                () -> mongoTemplate.updateMulti(toQuery(filter), toUpdate(update), collection));
        return result.getMatchedCount();
    }

    @Override
    public long deleteMany(String collection, StoreFilter filter) {
        DeleteResult result = call("deleteMany in " + collection,
                () -> mongoTemplate.remove(toQuery(filter), collection));
        return result.getDeletedCount();
    }

    @Override
    public List<Map<String, Object>> find(String collection, StoreFilter filter, StoreSort sort, int limit) {
        Query query = toQuery(filter).with(toSort(sort));
        if (limit > 0) query.limit(limit);
        List<Document> docs = call("find in " + collection, () -> mongoTemplate.find(query, Document.class, collection));
        List<Map<String, Object>> out = new ArrayList<>(docs.size());
        for (Document d : docs) out.add(fromBson(d));
        return out;
    }

    @Override
    public long count(String collection, StoreFilter filter) {
        return call("count in " + collection, () -> mongoTemplate.count(toQuery(filter), collection));
    }

    @Override
    public void drop(String collection) {
        run("drop " + collection, () -> mongoTemplate.dropCollection(collection));
    }

    @Override
    public void ping() {
        try {
            Document result = mongoTemplate.executeCommand("{ ping: 1 }");
            log.debug("MongoDB ping: {}", result.toJson());
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("MongoDB is not reachable: " + e.getMessage(), e);
        }
    }

    // ---------------- translation ----------------

    static Query toQuery(StoreFilter filter) {
        List<Criteria> parts = new ArrayList<>();
        for (StoreFilter.Condition c : filter.getConditions()) {
            Criteria where = Criteria.where(c.field());
            Object v = toBsonValue(c.value());
            parts.add(switch (c.op()) {
                case EQ -> where.is(v);
                case NE -> where.ne(v);
                case IN -> where.in((Collection<?>) v);
                case NIN -> where.nin((Collection<?>) v);
                case LT -> where.lt(v);
                case LTE -> where.lte(v);
                case GT -> where.gt(v);
                case GTE -> where.gte(v);
                case EXISTS -> where.exists((Boolean) v);
            });
        }
        if (parts.isEmpty()) return new Query();
        if (parts.size() == 1) return new Query(parts.get(0));
        return new Query(new Criteria().andOperator(parts));
    }

    /**
     * Sort with {@code _id} appended so equal keys come back in insertion order.
     */
    static Sort toSort(StoreSort sort) {
        List<Sort.Order> orders = new ArrayList<>();
        if (sort != null) {
            for (StoreSort.Key k : sort.getKeys()) {
                orders.add(k.ascending() ? Sort.Order.asc(k.field()) : Sort.Order.desc(k.field()));
            }
        }
        if (orders.isEmpty()) return Sort.unsorted();
        orders.add(Sort.Order.asc("_id"));
        return Sort.by(orders);
    }

    private static Update toUpdate(StoreUpdate update) {
        Update u = new Update();
        update.getSets().forEach((k, v) -> u.set(k, toBsonValue(v)));
        update.getUnsets().forEach(u::unset);
        update.getIncrements().forEach(u::inc);
        return u;
    }

    private static Document toBson(Map<String, Object> document) {
        Document doc = new Document();
        document.forEach((k, v) -> {
            if (v != null) doc.put(k, toBsonValue(v));
        });
        return doc;
    }

    private static Object toBsonValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Document d = new Document();
            map.forEach((k, v) -> d.put(String.valueOf(k), toBsonValue(v)));
            return d;
        }
        if (value instanceof Collection<?> col) {
            List<Object> out = new ArrayList<>(col.size());
            for (Object o : col) out.add(toBsonValue(o));
            return out;
        }
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        return value;
    }

    /**
     * Converts a BSON document into plain maps and lists, dropping the store-assigned {@code _id}.
     */
    private static Map<String, Object> fromBson(Document doc) {
        if (doc == null) return null;
        Map<String, Object> out = new LinkedHashMap<>();
        doc.forEach((k, v) -> {
            if (!"_id".equals(k)) out.put(k, fromBsonValue(v));
        });
        return out;
    }

    private static Object fromBsonValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(k), fromBsonValue(v)));
            return out;
        }
        if (value instanceof Collection<?> col) {
            List<Object> out = new ArrayList<>(col.size());
            for (Object o : col) out.add(fromBsonValue(o));
            return out;
        }
        return value;
    }

    private static <T> T call(String what, Supplier<T> action) {
        try {
            return action.get();
        } catch (DuplicateKeyException e) {
            throw new DuplicateKeyStoreException(what + ": " + e.getMessage(), e);
        } catch (DataAccessException e) {
            throw new StoreException(what + " failed: " + e.getMessage(), e);
        }
    }

    private static void run(String what, Runnable action) {
        call(what, () -> {
            action.run();
            return null;
        });
    }
}
