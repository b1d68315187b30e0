package com.loantracker.store.memory;

import com.loantracker.common.RecordId;
import com.loantracker.store.DocumentStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory document store for testing and local development.
 *
 * Keeps every collection in an insertion-ordered map and hands out copies,
 * so callers can never mutate stored state. Identifiers are generated the same
 * way the MongoDB store generates them.
 *
 * NOT FOR PRODUCTION: nothing survives a restart.
 */
@Slf4j
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, Map<String, Map<String, Object>>> collections = new ConcurrentHashMap<>();

    private final String databaseName;
    private final Clock clock;

    public InMemoryDocumentStore(String databaseName, Clock clock) {
        this.databaseName = databaseName;
        this.clock = clock;
    }

    @Override
    public String create(String collection, Map<String, Object> record) {
        if (record.containsKey(ID_FIELD)) {
            throw new IllegalArgumentException("Record must not carry its own id");
        }

        String id = RecordId.generate().toString();
        Instant now = clock.instant();

        Map<String, Object> stored = new LinkedHashMap<>(record);
        stored.put(CREATED_AT_FIELD, now);
        stored.put(UPDATED_AT_FIELD, now);

        Map<String, Map<String, Object>> documents = collection(collection);
        synchronized (documents) {
            documents.put(id, stored);
        }

        log.debug("In-memory: inserted {} into {}", id, collection);
        return id;
    }

    @Override
    public List<Map<String, Object>> list(String collection, Map<String, Object> filter) {
        Map<String, Map<String, Object>> documents = collection(collection);
        List<Map<String, Object>> result = new ArrayList<>();

        synchronized (documents) {
            documents.forEach((id, document) -> {
                if (matches(document, filter)) {
                    result.add(withId(id, document));
                }
            });
        }

        log.debug("In-memory: listed {} records from {} with filter {}", result.size(), collection, filter);
        return result;
    }

    @Override
    public Optional<Map<String, Object>> findById(String collection, String id) {
        Optional<RecordId> recordId = RecordId.tryParse(id);
        if (recordId.isEmpty()) {
            return Optional.empty();
        }

        String canonicalId = recordId.get().toString();
        Map<String, Map<String, Object>> documents = collection(collection);
        synchronized (documents) {
            Map<String, Object> document = documents.get(canonicalId);
            return document == null ? Optional.empty() : Optional.of(withId(canonicalId, document));
        }
    }

    @Override
    public List<String> collectionNames() {
        return new ArrayList<>(collections.keySet());
    }

    @Override
    public String databaseName() {
        return databaseName;
    }

    @Override
    public String getAdapterName() {
        return "InMemory";
    }

    /**
     * Clear all state (for test cleanup).
     */
    public void reset() {
        collections.clear();
    }

    private Map<String, Map<String, Object>> collection(String name) {
        return collections.computeIfAbsent(name, key -> new LinkedHashMap<>());
    }

    private static boolean matches(Map<String, Object> document, Map<String, Object> filter) {
        return filter.entrySet().stream()
            .allMatch(entry -> Objects.equals(document.get(entry.getKey()), entry.getValue()));
    }

    private static Map<String, Object> withId(String id, Map<String, Object> document) {
        Map<String, Object> copy = new LinkedHashMap<>();
        copy.put(ID_FIELD, id);
        copy.putAll(document);
        return copy;
    }
}
