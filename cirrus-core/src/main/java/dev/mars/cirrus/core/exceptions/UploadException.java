package dev.mars.cirrus.core.exceptions;

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


/**
 * Thrown when a block or thumbnail PUT keeps failing after all retry attempts.
 */
public class UploadException extends TransferException {

    private final int attempts;
    private final int lastStatusCode;

    public UploadException(String transferId, String message, int attempts, int lastStatusCode) {
        super(transferId, message);
        this.attempts = attempts;
        this.lastStatusCode = lastStatusCode;
    }

    public UploadException(String transferId, String message, int attempts, Throwable cause) {
        super(transferId, message, cause);
        this.attempts = attempts;
        this.lastStatusCode = -1;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * HTTP status of the last attempt, or -1 when the last attempt failed at transport level.
     */
    public int getLastStatusCode() {
        return lastStatusCode;
    }
}
