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
 * Pre-authorized destination for one encrypted block.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PresignedBlockUrl {

    private final String url;
    private final String blockId;
    private final int index;
    private final long expiresIn;

    @JsonCreator
    public PresignedBlockUrl(
            @JsonProperty("url") String url,
            @JsonProperty("block_id") String blockId,
            @JsonProperty("index") int index,
            @JsonProperty("expires_in") long expiresIn) {
        this.url = url;
        this.blockId = blockId;
        this.index = index;
        this.expiresIn = expiresIn;
    }

    @JsonProperty("url")
    public String getUrl() {
        return url;
    }

    @JsonProperty("block_id")
    public String getBlockId() {
        return blockId;
    }

    @JsonProperty("index")
    public int getIndex() {
        return index;
    }

    /**
     * Seconds the URL stays valid after issue.
     */
    @JsonProperty("expires_in")
    public long getExpiresIn() {
        return expiresIn;
    }

    /**
     * Key used to deduplicate block completion notices.
     */
    public String notificationKey() {
        return blockId + ":" + index;
    }

    @Override
    public String toString() {
        return "PresignedBlockUrl{blockId='" + blockId + "', index=" + index + '}';
    }
}
