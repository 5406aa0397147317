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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health probe result for the transfer engine.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TransferEngineHealthCheck {

    public enum Status {
        UP,       // Scheduler running, no stuck requests
        DOWN,     // Engine shut down
        DEGRADED  // Requests outstanding past the staleness threshold
    }

    private final Status status;
    private final Instant timestamp;
    private final String version;
    private final String message;
    private final Map<String, Object> queueMetrics;

    private TransferEngineHealthCheck(Builder builder) {
        this.status = builder.status;
        this.timestamp = builder.timestamp != null ? builder.timestamp : Instant.now();
        this.version = builder.version;
        this.message = builder.message;
        this.queueMetrics = new LinkedHashMap<>(builder.queueMetrics);
    }

    public Status getStatus() {
        return status;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getVersion() {
        return version;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Object> getQueueMetrics() {
        return new LinkedHashMap<>(queueMetrics);
    }

    public boolean isHealthy() {
        return status == Status.UP;
    }

    public JsonObject toJson() {
        JsonObject json = new JsonObject()
                .put("status", status.name())
                .put("timestamp", timestamp.getEpochSecond())
                .put("version", version);
        if (message != null) {
            json.put("message", message);
        }
        if (!queueMetrics.isEmpty()) {
            json.put("queue", new JsonObject(new LinkedHashMap<>(queueMetrics)));
        }
        return json;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Status status = Status.UP;
        private Instant timestamp;
        private String version;
        private String message;
        private final Map<String, Object> queueMetrics = new LinkedHashMap<>();

        public Builder status(Status status) {
            this.status = status;
            return this;
        }

        public Builder up() {
            return status(Status.UP);
        }

        public Builder down() {
            return status(Status.DOWN);
        }

        public Builder degraded() {
            return status(Status.DEGRADED);
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder queueMetric(String key, Object value) {
            this.queueMetrics.put(key, value);
            return this;
        }

        public Builder queueStatus(QueueStatus status) {
            this.queueMetrics.putAll(status.toJson().getMap());
            return this;
        }

        public TransferEngineHealthCheck build() {
            return new TransferEngineHealthCheck(this);
        }
    }
}
