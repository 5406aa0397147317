package dev.mars.cirrus.upload;

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


import dev.mars.cirrus.core.exceptions.UploadException;

import java.time.Duration;

/**
 * Uploads one encrypted payload to a presigned destination.
 *
 * <p>Implementations block the calling thread until the upload succeeds or every attempt
 * has failed. They are called from the scheduler thread only, never from an event loop.</p>
 */
public interface BlockUploader {

    /**
     * PUT {@code body} to {@code url}.
     *
     * @param transferId  item the payload belongs to, for error reporting
     * @param url         presigned destination
     * @param body        ciphertext
     * @param timeout     per-attempt timeout
     * @param maxAttempts total attempts, at least 1
     * @throws UploadException when every attempt failed
     */
    void upload(String transferId, String url, byte[] body, Duration timeout, int maxAttempts)
            throws UploadException;

    default void close() {
    }
}
