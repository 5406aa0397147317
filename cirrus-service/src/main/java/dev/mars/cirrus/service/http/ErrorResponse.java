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

package dev.mars.cirrus.service.http;

import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.UUID;

/**
 * Error body for every failed API call.
 *
 * <pre>{@code
 * {
 *   "error": {
 *     "shortCode": "C-2001",
 *     "code": "TRANSFER_NOT_FOUND",
 *     "message": "Transfer 'abc' not found or already finished",
 *     "timestamp": "2026-10-17T10:00:00Z",
 *     "path": "/api/v1/transfers/abc",
 *     "requestId": "req-1a2b3c4d"
 *   }
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public record ErrorResponse(
    String shortCode,
    String code,
    String message,
    Instant timestamp,
    String path,
    String requestId
) {

    public static ErrorResponse withMessage(ErrorCode code, String path, String message) {
        return new ErrorResponse(code.shortCode(), code.code(), message, Instant.now(), path, generateRequestId());
    }

    /**
     * Creates an ErrorResponse from an exception, falling back to the code's template when the
     * exception has no message.
     */
    public static ErrorResponse fromException(ErrorCode code, Throwable cause, String path) {
        String message = cause.getMessage() != null
            ? cause.getMessage()
            : code.messageTemplate();
        return withMessage(code, path, message);
    }

    public JsonObject toJson() {
        return new JsonObject()
            .put("error", new JsonObject()
                .put("shortCode", shortCode)
                .put("code", code)
                .put("message", message)
                .put("timestamp", timestamp.toString())
                .put("path", path)
                .put("requestId", requestId));
    }

    /**
     * HTTP status derived from the error code, 500 for unknown codes.
     */
    public int httpStatus() {
        return ErrorCode.fromCode(code)
            .map(ErrorCode::httpStatus)
            .orElse(500);
    }

    private static String generateRequestId() {
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
