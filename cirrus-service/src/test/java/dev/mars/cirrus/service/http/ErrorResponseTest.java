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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Error Response Tests")
class ErrorResponseTest {

    @Test
    void testErrorCodeHttpStatus() {
        assertEquals(400, ErrorCode.BAD_REQUEST.httpStatus());
        assertEquals(400, ErrorCode.MISSING_REQUIRED_FIELD.httpStatus());
        assertEquals(404, ErrorCode.TRANSFER_NOT_FOUND.httpStatus());
        assertEquals(500, ErrorCode.INTERNAL_ERROR.httpStatus());
        assertEquals(503, ErrorCode.SERVICE_UNAVAILABLE.httpStatus());
    }

    @Test
    void testShortCodesAreUnique() {
        long distinct = Arrays.stream(ErrorCode.values()).map(ErrorCode::shortCode).distinct().count();
        assertEquals(ErrorCode.values().length, distinct);
    }

    @Test
    void testFromCode() {
        assertEquals(Optional.of(ErrorCode.TRANSFER_NOT_FOUND), ErrorCode.fromCode("TRANSFER_NOT_FOUND"));
        assertTrue(ErrorCode.fromCode("NO_SUCH_CODE").isEmpty());
    }

    @Test
    void testApiExceptionFormatsTemplate() {
        CirrusApiException ex = CirrusApiException.notFound(ErrorCode.TRANSFER_NOT_FOUND, "abc");

        assertEquals("Transfer 'abc' not found or already finished", ex.getMessage());
        assertEquals(404, ex.getHttpStatus());
    }

    @Test
    void testToJson() {
        ErrorResponse response = ErrorResponse.withMessage(ErrorCode.VALIDATION_ERROR, "/api/v1/queue", "bad value");

        JsonObject error = response.toJson().getJsonObject("error");
        assertEquals("C-1001", error.getString("shortCode"));
        assertEquals("VALIDATION_ERROR", error.getString("code"));
        assertEquals("bad value", error.getString("message"));
        assertEquals("/api/v1/queue", error.getString("path"));
        assertNotNull(error.getString("timestamp"));
        assertEquals(400, response.httpStatus());
    }

    @Test
    void testFromExceptionWithoutMessageUsesTemplate() {
        ErrorResponse response = ErrorResponse.fromException(ErrorCode.INTERNAL_ERROR, new IllegalStateException(), "/x");

        assertEquals(ErrorCode.INTERNAL_ERROR.messageTemplate(), response.message());
        assertEquals(500, response.httpStatus());
    }
}
