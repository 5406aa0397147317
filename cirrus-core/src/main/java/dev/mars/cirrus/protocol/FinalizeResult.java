package dev.mars.cirrus.protocol;

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


import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of server-side content verification for a finalized file.
 * The item is completed whether or not verification succeeded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FinalizeResult(
        @JsonProperty("transfer_id") String transferId,
        @JsonProperty("file_id") String fileId,
        @JsonProperty("parent_id") String parentId,
        @JsonProperty("success") boolean success,
        @JsonProperty("error") String error) {

    @JsonCreator
    public FinalizeResult {
    }

    public String completionMessage() {
        if (success) {
            return "Upload complete and verified";
        }
        return "Upload complete, but verification failed: " + (error != null ? error : "unknown error");
    }
}
