package com.adforge.core.job;

import com.adforge.core.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobStoreTest {

    private final MutableClock clock = new MutableClock();
    private JdbcJobStore store;

    @BeforeEach
    void setUp() throws Exception {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:jobs-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        store = new JdbcJobStore(dataSource, new ObjectMapper(), clock);
        store.createTables();
    }

    @Test
    @DisplayName("created jobs are found with their payload")
    void createAndFind() {
        JobRecord job = store.create("scene-videos",
                JsonNodeFactory.instance.objectNode().put("storyboardId", "sb-7"));

        JobRecord loaded = store.find(job.id()).orElseThrow();
        assertEquals("scene-videos", loaded.type());
        assertEquals(JobStatus.PENDING, loaded.status());
        assertEquals("sb-7", loaded.payload().get("storyboardId").asText());
    }

    @Test
    @DisplayName("update persists status, summary and error")
    void updatePersists() {
        JobRecord job = store.create("scene-videos", null);
        clock.advance(Duration.ofSeconds(5));
        JobRecord running = store.update(job.transitionTo(JobStatus.RUNNING, clock.instant()));
        store.update(running.failed("[config] KIE_API_KEY is not set", clock.instant()));

        JobRecord loaded = store.find(job.id()).orElseThrow();
        assertEquals(JobStatus.FAILED, loaded.status());
        assertEquals("[config] KIE_API_KEY is not set", loaded.error());
        assertTrue(loaded.updatedAt().isAfter(loaded.createdAt()));
    }

    @Test
    @DisplayName("updating a missing job throws")
    void updateMissing() {
        JobRecord job = store.create("scene-videos", null);
        var ghost = new JobRecord("ghost", job.type(), JobStatus.RUNNING, job.payload(), null, null,
                job.createdAt(), job.updatedAt());

        assertThrows(IllegalArgumentException.class, () -> store.update(ghost));
    }

    @Test
    @DisplayName("recent returns newest jobs first")
    void recentOrder() {
        store.create("a", null);
        clock.advance(Duration.ofSeconds(1));
        JobRecord newest = store.create("b", null);

        assertEquals(newest.id(), store.recent(1).get(0).id());
        assertEquals(2, store.recent(5).size());
    }

    @Test
    @DisplayName("unknown ids are empty")
    void unknownIsEmpty() {
        assertTrue(store.find("nope").isEmpty());
    }
}
