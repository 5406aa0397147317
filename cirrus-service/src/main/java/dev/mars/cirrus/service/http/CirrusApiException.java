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

/**
 * Thrown by API handlers to signal a known error condition. {@link GlobalErrorHandler}
 * turns it into an {@link ErrorResponse} with the status of its {@link ErrorCode}.
 *
 * <pre>{@code
 * if (!engine.cancelTransfer(id)) {
 *     throw CirrusApiException.notFound(ErrorCode.TRANSFER_NOT_FOUND, id);
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class CirrusApiException extends RuntimeException {

    private final ErrorCode errorCode;

    public CirrusApiException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getHttpStatus() {
        return errorCode.httpStatus();
    }

    public static CirrusApiException notFound(ErrorCode code, Object... args) {
        return new CirrusApiException(code, code.formatMessage(args));
    }

    public static CirrusApiException badRequest(ErrorCode code, Object... args) {
        return new CirrusApiException(code, code.formatMessage(args));
    }
}
