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

import java.util.Arrays;
import java.util.Optional;

/**
 * Error codes returned by the administrative HTTP API.
 *
 * <p>Each code carries a stable string identifier, a short code for support lookups,
 * the HTTP status and a message template.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum ErrorCode {

    // ==================== Client Errors ====================

    /** Request body is missing or malformed */
    BAD_REQUEST("BAD_REQUEST", "C-1000", 400, "Invalid request: %s"),

    /** Request validation failed */
    VALIDATION_ERROR("VALIDATION_ERROR", "C-1001", 400, "Validation failed: %s"),

    /** Required field is missing */
    MISSING_REQUIRED_FIELD("MISSING_REQUIRED_FIELD", "C-1002", 400, "Required field '%s' is missing"),

    NOT_FOUND("NOT_FOUND", "C-1004", 404, "Resource not found: %s"),

    METHOD_NOT_ALLOWED("METHOD_NOT_ALLOWED", "C-1005", 405, "Method %s not allowed"),

    // ==================== Transfer Errors ====================

    /** No queued or active item with this id */
    TRANSFER_NOT_FOUND("TRANSFER_NOT_FOUND", "C-2001", 404, "Transfer '%s' not found or already finished"),

    // ==================== Server Errors ====================

    INTERNAL_ERROR("INTERNAL_ERROR", "C-5000", 500, "Internal server error: %s"),

    /** Engine is shut down or unhealthy */
    SERVICE_UNAVAILABLE("SERVICE_UNAVAILABLE", "C-5003", 503, "Service temporarily unavailable: %s");

    private final String code;
    private final String shortCode;
    private final int httpStatus;
    private final String messageTemplate;

    ErrorCode(String code, String shortCode, int httpStatus, String messageTemplate) {
        this.code = code;
        this.shortCode = shortCode;
        this.httpStatus = httpStatus;
        this.messageTemplate = messageTemplate;
    }

    public String code() {
        return code;
    }

    public String shortCode() {
        return shortCode;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String messageTemplate() {
        return messageTemplate;
    }

    /**
     * Formats the message template with the provided arguments.
     */
    public String formatMessage(Object... args) {
        return String.format(messageTemplate, args);
    }

    /**
     * Looks up an ErrorCode by its string code.
     */
    public static Optional<ErrorCode> fromCode(String code) {
        return Arrays.stream(values())
            .filter(e -> e.code.equals(code))
            .findFirst();
    }
}
