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


import dev.mars.cirrus.core.ItemKind;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the transfer engine.
 *
 * <ul>
 *   <li>cirrus.items.started / completed / failed / cancelled (counters, by item kind)</li>
 *   <li>cirrus.items.active (gauge)</li>
 *   <li>cirrus.blocks.uploaded, cirrus.bytes.uploaded (counters)</li>
 *   <li>cirrus.upload.retries, cirrus.requests.timed_out (counters)</li>
 *   <li>cirrus.block.duration.seconds (histogram)</li>
 * </ul>
 *
 * <p>With no SDK registered the global meter is a no-op, so recording never affects processing.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TransferTelemetryMetrics {

    private static final Logger logger = LoggerFactory.getLogger(TransferTelemetryMetrics.class);
    private static final String METER_NAME = "cirrus-core";

    private static TransferTelemetryMetrics instance;

    private final LongCounter itemsStarted;
    private final LongCounter itemsCompleted;
    private final LongCounter itemsFailed;
    private final LongCounter itemsCancelled;
    private final LongCounter blocksUploaded;
    private final LongCounter bytesUploaded;
    private final LongCounter uploadRetries;
    private final LongCounter requestTimeouts;
    private final DoubleHistogram blockDuration;

    private final AtomicLong activeItems = new AtomicLong(0);

    private static final AttributeKey<String> KIND_KEY = AttributeKey.stringKey("kind");
    private static final AttributeKey<String> ERROR_TYPE_KEY = AttributeKey.stringKey("error.type");

    private TransferTelemetryMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        itemsStarted = meter.counterBuilder("cirrus.items.started")
                .setDescription("Items taken off the queue for processing")
                .setUnit("1")
                .build();

        itemsCompleted = meter.counterBuilder("cirrus.items.completed")
                .setDescription("Items that reached completed")
                .setUnit("1")
                .build();

        itemsFailed = meter.counterBuilder("cirrus.items.failed")
                .setDescription("Items that reached failed")
                .setUnit("1")
                .build();

        itemsCancelled = meter.counterBuilder("cirrus.items.cancelled")
                .setDescription("Items cancelled by the user")
                .setUnit("1")
                .build();

        blocksUploaded = meter.counterBuilder("cirrus.blocks.uploaded")
                .setDescription("Encrypted blocks uploaded")
                .setUnit("1")
                .build();

        bytesUploaded = meter.counterBuilder("cirrus.bytes.uploaded")
                .setDescription("Plaintext bytes uploaded")
                .setUnit("By")
                .build();

        uploadRetries = meter.counterBuilder("cirrus.upload.retries")
                .setDescription("Block upload retry attempts")
                .setUnit("1")
                .build();

        requestTimeouts = meter.counterBuilder("cirrus.requests.timed_out")
                .setDescription("Orchestration requests resolved by the staleness sweep")
                .setUnit("1")
                .build();

        blockDuration = meter.histogramBuilder("cirrus.block.duration.seconds")
                .setDescription("Time to read, encrypt and upload one block")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("cirrus.items.active")
                .setDescription("Items currently being processed")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeItems.get()));

        logger.info("TransferTelemetryMetrics initialized");
    }

    public static synchronized TransferTelemetryMetrics getInstance() {
        if (instance == null) {
            instance = new TransferTelemetryMetrics();
        }
        return instance;
    }

    public void recordItemStarted(ItemKind kind) {
        itemsStarted.add(1, kindAttributes(kind));
        activeItems.incrementAndGet();
    }

    public void recordItemCompleted(ItemKind kind) {
        decrementActive();
        itemsCompleted.add(1, kindAttributes(kind));
    }

    public void recordItemFailed(ItemKind kind, String errorType) {
        decrementActive();
        itemsFailed.add(1, Attributes.builder()
                .put(KIND_KEY, kind.wireName())
                .put(ERROR_TYPE_KEY, errorType != null ? errorType : "unknown")
                .build());
    }

    public void recordItemCancelled(ItemKind kind) {
        decrementActive();
        itemsCancelled.add(1, kindAttributes(kind));
    }

    public void recordBlockUploaded(long plaintextBytes, double durationSeconds) {
        blocksUploaded.add(1);
        bytesUploaded.add(plaintextBytes);
        blockDuration.record(durationSeconds);
    }

    public void recordRetryAttempt(int attemptNumber) {
        uploadRetries.add(1);
    }

    public void recordRequestTimeout() {
        requestTimeouts.add(1);
    }

    public long getActiveItems() {
        return activeItems.get();
    }

    private void decrementActive() {
        activeItems.updateAndGet(current -> current > 0 ? current - 1 : 0);
    }

    private static Attributes kindAttributes(ItemKind kind) {
        return Attributes.of(KIND_KEY, kind.wireName());
    }
}
