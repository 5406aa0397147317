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

/**
 * Point-in-time snapshot of the transfer queue.
 *
 * @param queueSize          items waiting in the queue
 * @param activeId           id of the item being processed, or null when idle
 * @param completedCount     items that reached completed
 * @param failedCount        items that reached failed
 * @param paused             whether new dequeues are suspended
 * @param elapsedSeconds     seconds since the engine was created
 * @param pendingFolderCount folders whose creation is not yet confirmed
 */
public record QueueStatus(int queueSize,
                          String activeId,
                          int completedCount,
                          int failedCount,
                          boolean paused,
                          long elapsedSeconds,
                          int pendingFolderCount) {

    public boolean isIdle() {
        return activeId == null;
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("queue_size", queueSize)
                .put("processing", activeId)
                .put("completed", completedCount)
                .put("failed", failedCount)
                .put("paused", paused)
                .put("elapsed_time", elapsedSeconds)
                .put("pending_folders", pendingFolderCount);
    }
}
