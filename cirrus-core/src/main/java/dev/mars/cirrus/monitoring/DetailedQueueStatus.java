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


import dev.mars.cirrus.core.QueueItem;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.Map;

/**
 * Queue snapshot with the contents of the queue and the tracking sets, for diagnostics.
 */
public record DetailedQueueStatus(QueueStatus summary,
                                  List<QueueItem> queuedItems,
                                  List<String> pendingFolders,
                                  Map<String, String> folderMappings,
                                  int initializedFileCount,
                                  int initializedFolderCount,
                                  int blockNotificationCount,
                                  int outstandingRequestCount) {

    public JsonObject toJson() {
        JsonArray items = new JsonArray();
        for (QueueItem item : queuedItems) {
            items.add(new JsonObject()
                    .put("id", item.getId())
                    .put("type", item.getKind().wireName())
                    .put("name", item.getName())
                    .put("depth", item.getDepth())
                    .put("parent_id", item.getParentRef()));
        }

        JsonObject mappings = new JsonObject();
        folderMappings.forEach(mappings::put);

        return new JsonObject()
                .put("queue_size", summary.queueSize())
                .put("processing", summary.activeId())
                .put("completed_count", summary.completedCount())
                .put("failed_count", summary.failedCount())
                .put("paused", summary.paused())
                .put("elapsed_time", summary.elapsedSeconds())
                .put("pending_folders_count", summary.pendingFolderCount())
                .put("queue_items", items)
                .put("pending_folders", new JsonArray(pendingFolders))
                .put("folder_mappings", mappings)
                .put("initialized_files_count", initializedFileCount)
                .put("initialized_folders_count", initializedFolderCount)
                .put("block_completion_sent_count", blockNotificationCount)
                .put("outstanding_requests", outstandingRequestCount);
    }
}
