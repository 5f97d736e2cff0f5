package com.adforge.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcItemStoreTest {

    private JdbcItemStore store;

    @BeforeEach
    void setUp() throws Exception {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:items-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        store = new JdbcItemStore(dataSource, new ObjectMapper());
        store.createTables();
    }

    @Test
    @DisplayName("register, save and reload round-trip through the database")
    void persistsOutcomes() {
        assertTrue(store.register("storyboard-1", "scene-1",
                JsonNodeFactory.instance.objectNode().put("sceneNumber", 1).put("videoPrompt", "sunrise")));

        var patch = JsonNodeFactory.instance.objectNode().put("videoUrl", "https://cdn/1.mp4");
        var saved = store.save("scene-1", ItemOutcome.succeeded(patch));

        assertNotNull(saved.completedAt());
        var loaded = store.load("scene-1").orElseThrow();
        assertEquals("https://cdn/1.mp4", loaded.payload().get("videoUrl").asText());
        assertEquals("sunrise", loaded.payload().get("videoPrompt").asText());
        assertNull(loaded.lastError());
    }

    @Test
    @DisplayName("re-registering an existing item returns false and changes nothing")
    void registerIsIdempotent() {
        store.register("ds", "ad-1", JsonNodeFactory.instance.objectNode().put("v", 1));
        assertFalse(store.register("ds", "ad-1", JsonNodeFactory.instance.objectNode().put("v", 2)));
        assertEquals(1, store.load("ad-1").orElseThrow().payload().get("v").asInt());
    }

    @Test
    @DisplayName("a failure keeps the completion marker")
    void failureKeepsMarker() {
        store.register("ds", "ad-1", JsonNodeFactory.instance.objectNode());
        store.save("ad-1", ItemOutcome.succeeded(JsonNodeFactory.instance.objectNode().put("transcript", "hi")));
        store.save("ad-1", ItemOutcome.failed("boom"));

        var loaded = store.load("ad-1").orElseThrow();
        assertEquals("hi", loaded.payload().get("transcript").asText());
        assertEquals("boom", loaded.lastError());
        assertTrue(CompletionMarker.nonBlankText("transcript").isPresent(loaded));
    }

    @Test
    @DisplayName("listByBatch returns only the batch's items in registration order")
    void listByBatch() {
        store.register("ds", "b", JsonNodeFactory.instance.objectNode());
        store.register("other", "x", JsonNodeFactory.instance.objectNode());
        store.register("ds", "a", JsonNodeFactory.instance.objectNode());

        assertEquals(List.of("b", "a"), store.listByBatch("ds").stream().map(ItemRecord::id).toList());
        assertTrue(store.load("missing").isEmpty());
    }
}
