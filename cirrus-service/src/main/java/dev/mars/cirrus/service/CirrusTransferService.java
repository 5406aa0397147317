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

import dev.mars.cirrus.channel.EventBusInboundBridge;
import dev.mars.cirrus.channel.EventBusOrchestrationChannel;
import dev.mars.cirrus.config.CirrusConfiguration;
import dev.mars.cirrus.monitoring.CleanupReport;
import dev.mars.cirrus.service.http.HttpApiServer;
import dev.mars.cirrus.transfer.QueueTransferEngine;
import dev.mars.cirrus.transfer.TransferEngine;
import dev.mars.cirrus.upload.HttpBlockUploader;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runnable transfer service.
 *
 * <p>Wires the queue engine to the Vert.x event bus in both directions, starts the
 * administrative HTTP API and runs stuck-request cleanup on a Vert.x periodic timer.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class CirrusTransferService {

    private static final Logger logger = LoggerFactory.getLogger(CirrusTransferService.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final Vertx vertx;
    private final CirrusConfiguration config;
    private final TransferEngine engine;
    private final EventBusInboundBridge inboundBridge;
    private final HttpApiServer apiServer;

    private long maintenanceTimerId = 0;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean running = false;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public CirrusTransferService(Vertx vertx, CirrusConfiguration config) {
        this.vertx = Objects.requireNonNull(vertx, "Vertx instance cannot be null");
        this.config = Objects.requireNonNull(config, "CirrusConfiguration cannot be null");

        String prefix = config.getEventBusPrefix();
        this.engine = new QueueTransferEngine(config,
                new EventBusOrchestrationChannel(vertx.eventBus(), prefix),
                new HttpBlockUploader(vertx, config.getUploadRetryDelayMs()));
        this.inboundBridge = new EventBusInboundBridge(vertx.eventBus(), prefix, engine);
        this.apiServer = new HttpApiServer(vertx, config.getHttpPort(), engine);
    }

    public static void main(String[] args) {
        logger.info("Starting Cirrus transfer service...");

        Vertx vertx = Vertx.vertx();

        try {
            CirrusConfiguration config = new CirrusConfiguration();
            config.validate();
            config.logConfiguration();

            CirrusTransferService service = new CirrusTransferService(vertx, config);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutdown signal received");
                service.shutdown();

                vertx.close().onComplete(ar -> {
                    if (ar.succeeded()) {
                        logger.info("Vert.x instance closed successfully");
                    } else {
                        logger.error("Error closing Vert.x instance", ar.cause());
                    }
                });
            }));

            service.start().toCompletionStage().toCompletableFuture().get();
            service.awaitShutdown();

        } catch (Exception e) {
            logger.error("Failed to start Cirrus transfer service", e);
            vertx.close();
            System.exit(1);
        }

        logger.info("Cirrus transfer service stopped");
    }

    public Future<Void> start() {
        if (closed.get()) {
            return Future.failedFuture(new IllegalStateException("Service is closed, cannot start"));
        }

        inboundBridge.start();
        return apiServer.start().onSuccess(v -> {
            long interval = config.getMaintenanceIntervalMs();
            maintenanceTimerId = vertx.setPeriodic(interval, id -> runMaintenance());
            running = true;
            logger.info("Cirrus transfer service started (maintenance interval: {}ms)", interval);
        });
    }

    private void runMaintenance() {
        vertx.executeBlocking(engine::cleanupStuckTransfers, false)
                .onSuccess(report -> logCleanup(report))
                .onFailure(err -> logger.error("Error during stuck transfer cleanup", err));
    }

    private void logCleanup(CleanupReport report) {
        if (report.cleanedCount() > 0) {
            logger.warn("Cleaned up {} stuck transfer(s): {}", report.cleanedCount(), report.cleanedIds());
        }
    }

    public void shutdown() {
        if (closed.getAndSet(true)) {
            logger.info("Service already closed, skipping shutdown");
            return;
        }

        if (!running) {
            logger.info("Service not running, performing cleanup only");
            engine.shutdown(SHUTDOWN_TIMEOUT_SECONDS);
            shutdownLatch.countDown();
            return;
        }

        logger.info("Shutting down Cirrus transfer service...");
        running = false;

        try {
            if (maintenanceTimerId != 0) {
                vertx.cancelTimer(maintenanceTimerId);
                maintenanceTimerId = 0;
            }
            inboundBridge.stop();
            apiServer.stop();
            if (!engine.shutdown(SHUTDOWN_TIMEOUT_SECONDS)) {
                logger.warn("Transfer scheduler did not stop within {}s", SHUTDOWN_TIMEOUT_SECONDS);
            }
            logger.info("Cirrus transfer service shutdown complete");
        } catch (Exception e) {
            logger.error("Error during shutdown", e);
        } finally {
            shutdownLatch.countDown();
        }
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public TransferEngine getEngine() {
        return engine;
    }

    public int getHttpPort() {
        return apiServer.actualPort();
    }
}
