package com.loantracker.store;

import com.loantracker.common.exception.StoreException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Generic interface for a schema-less document database.
 *
 * Records are plain key/value maps grouped into named collections. The store assigns
 * every record an opaque identifier at insert time; records handed back to callers
 * carry it as a string under {@link #ID_FIELD}.
 *
 * Values read back are normalized regardless of the backing database:
 * identifiers as {@code String}, timestamps as {@code Instant}, decimals as
 * {@code BigDecimal}.
 *
 * Implementations:
 * - MongoDB (production)
 * - In-memory (tests and local development)
 */
public interface DocumentStore {

    String ID_FIELD = "id";
    String CREATED_AT_FIELD = "created_at";
    String UPDATED_AT_FIELD = "updated_at";

    /**
     * Insert a record and stamp its creation timestamps.
     *
     * @param collection target collection name
     * @param record field values; must not contain {@link #ID_FIELD}
     * @return the newly assigned identifier in canonical string form
     * @throws StoreException if the store is unreachable or the write fails
     */
    String create(String collection, Map<String, Object> record);

    /**
     * List every record in a collection whose fields equal all filter entries.
     *
     * The result is fully materialized. Ordering is store-defined, which is
     * insertion order for both shipped implementations.
     *
     * @param collection collection name
     * @param filter equality filter; empty matches everything
     * @throws StoreException if the store is unreachable or the read fails
     */
    List<Map<String, Object>> list(String collection, Map<String, Object> filter);

    default List<Map<String, Object>> list(String collection) {
        return list(collection, Map.of());
    }

    /**
     * Look up a single record.
     *
     * A malformed identifier is not an error: it simply matches nothing.
     *
     * @throws StoreException if the store is unreachable or the read fails
     */
    Optional<Map<String, Object>> findById(String collection, String id);

    /**
     * Names of the collections that currently exist.
     *
     * @throws StoreException if the store is unreachable
     */
    List<String> collectionNames();

    /**
     * Name of the database this store writes to.
     */
    String databaseName();

    /**
     * Name of this store adapter, used for logging and diagnostics.
     */
    String getAdapterName();
}
