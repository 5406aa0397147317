package dev.mars.cirrus.monitoring;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TransferEngineHealthCheck and the status snapshots it carries.
 */
class TransferEngineHealthCheckTest {

    @Test
    void testBuilderWithMinimalConfiguration() {
        TransferEngineHealthCheck check = TransferEngineHealthCheck.builder().build();

        assertEquals(TransferEngineHealthCheck.Status.UP, check.getStatus());
        assertNotNull(check.getTimestamp());
        assertNull(check.getMessage());
        assertTrue(check.getQueueMetrics().isEmpty());
        assertTrue(check.isHealthy());
    }

    @Test
    void testDegradedWithQueueStatus() {
        Instant now = Instant.ofEpochSecond(1_700_000_000L);
        QueueStatus status = new QueueStatus(4, "transfer-1", 10, 2, false, 90, 1);

        TransferEngineHealthCheck check = TransferEngineHealthCheck.builder()
                .degraded()
                .timestamp(now)
                .version("1.0.0")
                .message("1 request(s) outstanding beyond 35000ms")
                .queueStatus(status)
                .build();

        assertFalse(check.isHealthy());
        assertEquals(4, check.getQueueMetrics().get("queue_size"));
        assertEquals("transfer-1", check.getQueueMetrics().get("processing"));

        JsonObject json = check.toJson();
        assertEquals("DEGRADED", json.getString("status"));
        assertEquals(1_700_000_000L, json.getLong("timestamp"));
        assertEquals("1.0.0", json.getString("version"));
        assertEquals(10, json.getJsonObject("queue").getInteger("completed"));
        assertEquals(1, json.getJsonObject("queue").getInteger("pending_folders"));
    }

    @Test
    void testQueueStatusJson() {
        JsonObject idle = new QueueStatus(0, null, 3, 1, true, 12, 0).toJson();

        assertNull(idle.getString("processing"));
        assertTrue(idle.getBoolean("paused"));
        assertEquals(12L, idle.getLong("elapsed_time"));
        assertTrue(new QueueStatus(0, null, 0, 0, false, 0, 0).isIdle());
    }

    @Test
    void testCleanupReport() {
        CleanupReport report = new CleanupReport(List.of("a", "b"));

        assertEquals(2, report.cleanedCount());
        assertEquals(2, report.toJson().getInteger("cleaned_count"));
    }
}
