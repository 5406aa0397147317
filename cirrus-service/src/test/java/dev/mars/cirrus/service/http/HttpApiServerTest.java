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


package dev.mars.cirrus.service.http;

import dev.mars.cirrus.config.CirrusConfiguration;
import dev.mars.cirrus.transfer.QueueTransferEngine;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the administrative HTTP API against a real, paused queue engine.
 *
 * <p>The engine's channel and uploader discard everything, so selected items stay queued
 * and every response is deterministic.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@ExtendWith(VertxExtension.class)
@DisplayName("HttpApiServer Tests")
class HttpApiServerTest {

    @TempDir
    Path tempDir;

    private QueueTransferEngine engine;
    private HttpApiServer server;
    private WebClient client;
    private int port;
    private Path file;

    @BeforeEach
    void setUp(Vertx vertx) throws Exception {
        engine = new QueueTransferEngine(new CirrusConfiguration(new Properties()),
                (event, payload) -> { },
                (transferId, url, body, timeout, maxAttempts) -> { });
        engine.pauseTransfers();

        server = new HttpApiServer(vertx, 0, engine);
        server.start().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
        port = server.actualPort();
        client = WebClient.create(vertx);

        file = Files.writeString(tempDir.resolve("notes.txt"), "hello");
    }

    @AfterEach
    void tearDown() throws Exception {
        client.close();
        server.stop().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
        engine.shutdown(2);
    }

    private JsonObject filesRequest(String... paths) {
        return new JsonObject().put("paths", new JsonArray(List.of(paths))).put("share_id", "share-1");
    }

    // ==================== Status ====================

    @Nested
    @DisplayName("Status endpoints")
    class StatusTests {

        @Test
        @DisplayName("GET /health returns UP with queue metrics")
        void testHealth(VertxTestContext ctx) {
            client.get(port, "localhost", "/health")
                    .send()
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(200, response.statusCode());
                        JsonObject body = response.bodyAsJsonObject();
                        assertEquals("UP", body.getString("status"));
                        assertEquals("1.0.0", body.getString("version"));
                        assertTrue(body.getJsonObject("queue").getBoolean("paused"));
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("GET /health returns 503 once the engine is shut down")
        void testHealthDown(VertxTestContext ctx) {
            engine.shutdown(2);
            client.get(port, "localhost", "/health")
                    .send()
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(503, response.statusCode());
                        assertEquals("DOWN", response.bodyAsJsonObject().getString("status"));
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("GET /api/v1/queue/details lists queued items")
        void testQueueDetails(VertxTestContext ctx) {
            String id = engine.selectFiles(List.of(file.toString()), null, null).get(0);

            client.get(port, "localhost", "/api/v1/queue/details")
                    .send()
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(200, response.statusCode());
                        JsonObject body = response.bodyAsJsonObject();
                        assertEquals(1, body.getInteger("queue_size"));
                        JsonObject item = body.getJsonArray("queue_items").getJsonObject(0);
                        assertEquals(id, item.getString("id"));
                        assertEquals("file", item.getString("type"));
                        assertEquals("notes.txt", item.getString("name"));
                        ctx.completeNow();
                    })));
        }
    }

    // ==================== Commands ====================

    @Nested
    @DisplayName("Transfer commands")
    class CommandTests {

        @Test
        @DisplayName("POST /api/v1/transfers/files queues valid paths and skips invalid ones")
        void testSelectFiles(VertxTestContext ctx) {
            client.post(port, "localhost", "/api/v1/transfers/files")
                    .sendJsonObject(filesRequest(file.toString(), tempDir.resolve("missing.txt").toString()))
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(200, response.statusCode());
                        JsonArray ids = response.bodyAsJsonObject().getJsonArray("transfer_ids");
                        assertEquals(1, ids.size());
                        assertEquals(1, engine.getQueueStatus().queueSize());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("POST /api/v1/transfers/folders rejects a file path")
        void testSelectFolders(VertxTestContext ctx) {
            client.post(port, "localhost", "/api/v1/transfers/folders")
                    .sendJsonObject(filesRequest(tempDir.toString(), file.toString()))
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(200, response.statusCode());
                        assertEquals(1, response.bodyAsJsonObject().getJsonArray("transfer_ids").size());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Missing paths field returns MISSING_REQUIRED_FIELD")
        void testMissingPaths(VertxTestContext ctx) {
            client.post(port, "localhost", "/api/v1/transfers/files")
                    .sendJsonObject(new JsonObject().put("share_id", "share-1"))
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(400, response.statusCode());
                        JsonObject error = response.bodyAsJsonObject().getJsonObject("error");
                        assertEquals("MISSING_REQUIRED_FIELD", error.getString("code"));
                        assertEquals("C-1002", error.getString("shortCode"));
                        assertEquals("Required field 'paths' is missing", error.getString("message"));
                        assertEquals("/api/v1/transfers/files", error.getString("path"));
                        assertTrue(error.getString("requestId").startsWith("req-"));
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Malformed JSON returns BAD_REQUEST")
        void testMalformedBody(VertxTestContext ctx) {
            client.post(port, "localhost", "/api/v1/transfers/files")
                    .putHeader("Content-Type", "application/json")
                    .sendBuffer(Buffer.buffer("{paths:"))
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(400, response.statusCode());
                        assertEquals("BAD_REQUEST",
                                response.bodyAsJsonObject().getJsonObject("error").getString("code"));
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("Resume updates the session anchor and unpauses the queue")
        void testPauseAndResume(VertxTestContext ctx) {
            client.post(port, "localhost", "/api/v1/transfers/resume")
                    .sendJsonObject(new JsonObject().put("share_id", "share-9"))
                    .compose(resumed -> {
                        ctx.verify(() -> {
                            assertEquals("resumed", resumed.bodyAsJsonObject().getString("status"));
                            assertFalse(engine.getQueueStatus().paused());
                        });
                        return client.post(port, "localhost", "/api/v1/transfers/pause").send();
                    })
                    .onComplete(ctx.succeeding(paused -> ctx.verify(() -> {
                        assertEquals("paused", paused.bodyAsJsonObject().getString("status"));
                        assertTrue(engine.getQueueStatus().paused());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("DELETE /api/v1/transfers/:id cancels a queued item")
        void testCancelQueued(VertxTestContext ctx) {
            String id = engine.selectFiles(List.of(file.toString()), null, null).get(0);

            client.delete(port, "localhost", "/api/v1/transfers/" + id)
                    .send()
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(200, response.statusCode());
                        assertEquals(id, response.bodyAsJsonObject().getString("transfer_id"));
                        assertTrue(response.bodyAsJsonObject().getBoolean("cancelled"));
                        assertEquals(1, engine.getQueueStatus().failedCount());
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("DELETE of an unknown id returns TRANSFER_NOT_FOUND")
        void testCancelUnknown(VertxTestContext ctx) {
            client.delete(port, "localhost", "/api/v1/transfers/nope")
                    .send()
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(404, response.statusCode());
                        JsonObject error = response.bodyAsJsonObject().getJsonObject("error");
                        assertEquals("TRANSFER_NOT_FOUND", error.getString("code"));
                        assertEquals("Transfer 'nope' not found or already finished", error.getString("message"));
                        ctx.completeNow();
                    })));
        }

        @Test
        @DisplayName("DELETE /api/v1/transfers cancels everything")
        void testCancelAll(VertxTestContext ctx) throws Exception {
            Path other = Files.writeString(tempDir.resolve("other.txt"), "world");
            engine.selectFiles(List.of(file.toString(), other.toString()), null, null);

            client.delete(port, "localhost", "/api/v1/transfers")
                    .send()
                    .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
                        assertEquals(2, response.bodyAsJsonObject().getInteger("cancelled_count"));
                        assertEquals(0, engine.getQueueStatus().queueSize());
                        ctx.completeNow();
                    })));
        }
    }

    // ==================== Maintenance ====================

    @Test
    @DisplayName("Maintenance endpoints report nothing to do on a healthy queue")
    void testMaintenance(VertxTestContext ctx) {
        client.post(port, "localhost", "/api/v1/maintenance/cleanup")
                .send()
                .compose(cleanup -> {
                    ctx.verify(() -> {
                        assertEquals(200, cleanup.statusCode());
                        assertEquals(0, cleanup.bodyAsJsonObject().getInteger("cleaned_count"));
                    });
                    return client.post(port, "localhost", "/api/v1/maintenance/repair").send();
                })
                .onComplete(ctx.succeeding(repair -> ctx.verify(() -> {
                    assertEquals(200, repair.statusCode());
                    assertEquals(0, repair.bodyAsJsonObject().getInteger("repaired_count"));
                    ctx.completeNow();
                })));
    }
}
