package com.loantracker.store.memory;

import com.loantracker.common.RecordId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDocumentStoreTest {

    private static final Instant NOW = Instant.parse("2024-03-15T10:00:00Z");

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore("loan_tracker_test", Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void testCreateAssignsFreshIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 20; i++) {
            String id = store.create("customer", Map.of("first_name", "C" + i));
            assertTrue(RecordId.tryParse(id).isPresent());
            assertTrue(ids.add(id), "id reused: " + id);
        }
    }

    @Test
    void testListReturnsFieldsWithIdAndTimestamps() {
        String id = store.create("customer", Map.of("first_name", "Ada", "last_name", "Lovelace"));

        List<Map<String, Object>> records = store.list("customer");

        assertEquals(1, records.size());
        Map<String, Object> record = records.get(0);
        assertEquals(id, record.get("id"));
        assertEquals("Ada", record.get("first_name"));
        assertEquals(NOW, record.get("created_at"));
        assertEquals(NOW, record.get("updated_at"));
    }

    @Test
    void testListFiltersByEqualityInInsertionOrder() {
        String first = store.create("loan", Map.of("status", "funded"));
        store.create("loan", Map.of("status", "applied"));
        String third = store.create("loan", Map.of("status", "funded"));

        List<Map<String, Object>> funded = store.list("loan", Map.of("status", "funded"));

        assertEquals(List.of(first, third), funded.stream().map(r -> r.get("id")).collect(Collectors.toList()));
        assertEquals(3, store.list("loan").size());
    }

    @Test
    void testFindById() {
        String id = store.create("partner", Map.of("name", "Acme"));

        assertEquals("Acme", store.findById("partner", id).orElseThrow().get("name"));
        assertTrue(store.findById("customer", id).isEmpty());
        assertTrue(store.findById("partner", RecordId.generate().toString()).isEmpty());
    }

    @Test
    void testFindByUpperCaseId_ReturnsCanonicalId() {
        String id = store.create("customer", Map.of("first_name", "Ada"));

        Map<String, Object> record = store.findById("customer", id.toUpperCase()).orElseThrow();

        assertEquals(id, record.get("id"));
        assertEquals("Ada", record.get("first_name"));
    }

    @Test
    void testFindByMalformedIdIsEmpty() {
        store.create("partner", Map.of("name", "Acme"));

        assertTrue(store.findById("partner", "not-an-id").isEmpty());
        assertTrue(store.findById("partner", null).isEmpty());
    }

    @Test
    void testReturnedRecordsAreCopies() {
        String id = store.create("customer", Map.of("first_name", "Ada"));

        store.findById("customer", id).orElseThrow().put("first_name", "Changed");

        assertEquals("Ada", store.findById("customer", id).orElseThrow().get("first_name"));
    }

    @Test
    void testRejectsCallerSuppliedId() {
        assertThrows(IllegalArgumentException.class, () -> store.create("customer", Map.of("id", "x")));
    }

    @Test
    void testCollectionNamesAndReset() {
        store.create("customer", Map.of("first_name", "Ada"));
        store.create("loan", Map.of("status", "applied"));

        assertEquals(Set.of("customer", "loan"), new HashSet<>(store.collectionNames()));

        store.reset();
        assertTrue(store.collectionNames().isEmpty());
    }
}
