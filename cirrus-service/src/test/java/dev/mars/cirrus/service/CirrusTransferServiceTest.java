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


package dev.mars.cirrus.service;

import dev.mars.cirrus.config.CirrusConfiguration;
import io.vertx.core.Vertx;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Wiring test: selection goes out on the event bus, the reply comes back through the
 * inbound bridge, and the HTTP API reports the result.
 */
@ExtendWith(VertxExtension.class)
class CirrusTransferServiceTest {

    private static final String PREFIX = "svc-test";

    @TempDir
    Path tempDir;

    private CirrusTransferService service;
    private Vertx vertx;

    @BeforeEach
    void setUp(Vertx vertx) throws Exception {
        this.vertx = vertx;
        Properties properties = new Properties();
        properties.setProperty(CirrusConfiguration.HTTP_PORT, "0");
        properties.setProperty(CirrusConfiguration.EVENTBUS_PREFIX, PREFIX);
        service = new CirrusTransferService(vertx, new CirrusConfiguration(properties));
        service.start().toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void testRoundTripOverEventBus() throws Exception {
        CompletableFuture<JsonObject> init = new CompletableFuture<>();
        vertx.eventBus().<JsonObject>consumer(PREFIX + ".outbound.init-file-upload", message -> {
            init.complete(message.body());
            vertx.eventBus().send(PREFIX + ".inbound.upload-error",
                    new JsonObject().put("transfer_id", message.body().getString("id")).put("error", "Quota exceeded"));
        });
        Path file = Files.writeString(tempDir.resolve("a.txt"), "payload");

        String id = service.getEngine().selectFiles(List.of(file.toString()), null, null).get(0);

        assertEquals(id, init.get(5, TimeUnit.SECONDS).getString("id"));
        await().atMost(Duration.ofSeconds(5)).until(() -> service.getEngine().getQueueStatus().failedCount() == 1);
    }

    @Test
    void testHttpApiIsServed() throws Exception {
        assertTrue(service.getHttpPort() > 0);
        WebClient client = WebClient.create(vertx);
        try {
            JsonObject queue = client.get(service.getHttpPort(), "localhost", "/api/v1/queue")
                    .send()
                    .toCompletionStage().toCompletableFuture().get(5, TimeUnit.SECONDS)
                    .bodyAsJsonObject();
            assertEquals(0, queue.getInteger("queue_size"));
            assertFalse(queue.getBoolean("paused"));
        } finally {
            client.close();
        }
    }

    @Test
    void testShutdownIsIdempotent() {
        service.shutdown();
        service.shutdown();

        assertTrue(service.start().failed());
        assertEquals("DOWN", service.getEngine().checkHealth().getStatus().name());
    }
}
