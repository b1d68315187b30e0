package com.loantracker.store.mongo;

import com.loantracker.common.RecordId;
import com.loantracker.common.exception.StoreException;
import com.loantracker.store.DocumentStore;
import com.loantracker.store.DocumentValues;
import com.mongodb.MongoException;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.types.Decimal128;
import org.bson.types.ObjectId;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MongoDB implementation of {@link DocumentStore}.
 *
 * Works on raw {@link Document}s through {@link MongoTemplate}, so collections stay
 * schema-less. The native {@code _id} is an {@link ObjectId} generated here before
 * insert; it is exposed to callers only as its hex string under {@code id}.
 *
 * Decimals are written as Decimal128 and timestamps as BSON dates; both are
 * converted back on read.
 */
@Slf4j
public class MongoDocumentStore implements DocumentStore {

    private static final String MONGO_ID_FIELD = "_id";

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoDocumentStore(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
        log.info("MongoDB document store initialized: database={}", mongoTemplate.getDb().getName());
    }

    @Override
    public String create(String collection, Map<String, Object> record) {
        if (record.containsKey(ID_FIELD) || record.containsKey(MONGO_ID_FIELD)) {
            throw new IllegalArgumentException("Record must not carry its own id");
        }

        ObjectId id = RecordId.generate().toObjectId();
        Date now = Date.from(clock.instant());

        Document document = new Document(MONGO_ID_FIELD, id);
        record.forEach((field, value) -> document.put(field, toBson(value)));
        document.put(CREATED_AT_FIELD, now);
        document.put(UPDATED_AT_FIELD, now);

        try {
            mongoTemplate.insert(document, collection);
        } catch (DataAccessException | MongoException e) {
            log.error("Insert into {} failed", collection, e);
            throw new StoreException("Failed to insert into " + collection, collection, "create", e);
        }

        log.debug("Inserted {} into {}", id, collection);
        return id.toHexString();
    }

    @Override
    public List<Map<String, Object>> list(String collection, Map<String, Object> filter) {
        Query query = new Query();
        filter.forEach((field, value) -> query.addCriteria(Criteria.where(field).is(toBson(value))));

        List<Document> documents;
        try {
            documents = mongoTemplate.find(query, Document.class, collection);
        } catch (DataAccessException | MongoException e) {
            log.error("Query on {} failed: filter={}", collection, filter, e);
            throw new StoreException("Failed to list " + collection, collection, "list", e);
        }

        List<Map<String, Object>> result = new ArrayList<>(documents.size());
        for (Document document : documents) {
            result.add(fromBson(document));
        }
        log.debug("Listed {} records from {} with filter {}", result.size(), collection, filter);
        return result;
    }

    @Override
    public Optional<Map<String, Object>> findById(String collection, String id) {
        Optional<RecordId> recordId = RecordId.tryParse(id);
        if (recordId.isEmpty()) {
            log.debug("Lookup in {} with malformed id '{}'", collection, id);
            return Optional.empty();
        }

        try {
            Document document = mongoTemplate.findById(recordId.get().toObjectId(), Document.class, collection);
            return Optional.ofNullable(document).map(MongoDocumentStore::fromBson);
        } catch (DataAccessException | MongoException e) {
            log.error("Lookup of {} in {} failed", id, collection, e);
            throw new StoreException("Failed to look up " + id + " in " + collection, collection, "findById", e);
        }
    }

    @Override
    public List<String> collectionNames() {
        try {
            return new ArrayList<>(mongoTemplate.getCollectionNames());
        } catch (DataAccessException | MongoException e) {
            throw new StoreException("Failed to list collections", null, "collectionNames", e);
        }
    }

    @Override
    public String databaseName() {
        return mongoTemplate.getDb().getName();
    }

    @Override
    public String getAdapterName() {
        return "MongoDB";
    }

    private static Object toBson(Object value) {
        if (value instanceof BigDecimal) {
            return new Decimal128((BigDecimal) value);
        }
        if (value instanceof Instant) {
            return Date.from((Instant) value);
        }
        return value;
    }

    private static Map<String, Object> fromBson(Document document) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put(ID_FIELD, DocumentValues.normalize(document.get(MONGO_ID_FIELD)));
        document.forEach((field, value) -> {
            if (!MONGO_ID_FIELD.equals(field)) {
                record.put(field, DocumentValues.normalize(value));
            }
        });
        return record;
    }
}
