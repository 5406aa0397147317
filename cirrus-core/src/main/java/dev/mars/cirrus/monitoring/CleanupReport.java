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


import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.util.List;

/**
 * Result of a stuck-transfer sweep.
 */
public record CleanupReport(List<String> cleanedIds) {

    public CleanupReport {
        cleanedIds = List.copyOf(cleanedIds);
    }

    public int cleanedCount() {
        return cleanedIds.size();
    }

    public JsonObject toJson() {
        return new JsonObject()
                .put("cleaned_count", cleanedCount())
                .put("cleaned_ids", new JsonArray(cleanedIds));
    }
}
