package com.adforge.core.job;

import com.adforge.core.MutableClock;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryJobStoreTest {

    private final MutableClock clock = new MutableClock();
    private final InMemoryJobStore store = new InMemoryJobStore(clock);

    @Test
    @DisplayName("create stores a PENDING job with a copy of the payload")
    void createCopiesPayload() {
        var payload = JsonNodeFactory.instance.objectNode().put("batchId", "ds-1");

        JobRecord job = store.create("ad-transcripts", payload);
        payload.put("batchId", "changed");

        assertEquals(JobStatus.PENDING, job.status());
        assertEquals("ds-1", store.find(job.id()).orElseThrow().payload().get("batchId").asText());
    }

    @Test
    @DisplayName("update rejects unknown jobs")
    void updateUnknown() {
        JobRecord job = store.create("ad-transcripts", null);
        var ghost = new JobRecord("ghost", job.type(), JobStatus.RUNNING, job.payload(), null, null,
                job.createdAt(), job.updatedAt());

        assertThrows(IllegalArgumentException.class, () -> store.update(ghost));
    }

    @Test
    @DisplayName("recent lists newest first and honours the limit")
    void recentNewestFirst() {
        JobRecord first = store.create("a", null);
        clock.advance(Duration.ofSeconds(1));
        JobRecord second = store.create("b", null);
        clock.advance(Duration.ofSeconds(1));
        JobRecord third = store.create("c", null);

        assertEquals(List.of(third.id(), second.id()), store.recent(2).stream().map(JobRecord::id).toList());
        assertEquals(3, store.recent(10).size());
        assertEquals(first.id(), store.recent(10).get(2).id());
    }
}
