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
 * Destination for an encrypted thumbnail. The content key is the file's own key.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ThumbnailTarget {

    private final String id;
    private final String url;
    private final long expiresIn;
    private final String contentKey;

    @JsonCreator
    public ThumbnailTarget(
            @JsonProperty("id") String id,
            @JsonProperty("url") String url,
            @JsonProperty("expires_in") long expiresIn,
            @JsonProperty("content_key") String contentKey) {
        this.id = id;
        this.url = url;
        this.expiresIn = expiresIn;
        this.contentKey = contentKey;
    }

    @JsonProperty("id")
    public String getId() {
        return id;
    }

    @JsonProperty("url")
    public String getUrl() {
        return url;
    }

    @JsonProperty("expires_in")
    public long getExpiresIn() {
        return expiresIn;
    }

    @JsonProperty("content_key")
    public String getContentKey() {
        return contentKey;
    }

    @Override
    public String toString() {
        return "ThumbnailTarget{id='" + id + "'}";
    }
}
