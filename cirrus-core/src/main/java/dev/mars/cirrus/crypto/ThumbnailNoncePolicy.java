package dev.mars.cirrus.crypto;

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


import java.util.Arrays;

/**
 * Selects the nonce used to encrypt thumbnails with the file content key.
 */
public enum ThumbnailNoncePolicy {

    /**
     * All-zero nonce. Equal to the nonce of block 0 under the same key, kept for
     * compatibility with thumbnails already stored by the orchestration service.
     */
    LEGACY_ZERO("legacy-zero"),

    /**
     * Nonce with the trailing four bytes set to 0xFF. Block nonces only use the
     * leading eight bytes, so this value can never be produced for a block.
     */
    RESERVED("reserved");

    private final String propertyValue;

    ThumbnailNoncePolicy(String propertyValue) {
        this.propertyValue = propertyValue;
    }

    public String propertyValue() {
        return propertyValue;
    }

    public static ThumbnailNoncePolicy fromPropertyValue(String value) {
        return Arrays.stream(values())
                .filter(p -> p.propertyValue.equalsIgnoreCase(value == null ? "" : value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown thumbnail nonce policy: " + value));
    }
}
