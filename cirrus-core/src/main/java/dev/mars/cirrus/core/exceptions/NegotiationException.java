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
 * Exception raised when a request to the orchestration service does not produce
 * a usable reply.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-20
 * @version 1.0
 */
public class NegotiationException extends TransferException {

    public enum Reason {
        /** The orchestration service answered with an error payload */
        REJECTED,
        /** No reply arrived within the configured timeout or staleness window */
        TIMEOUT,
        /** The outbound channel could not deliver the request */
        CHANNEL_CLOSED,
        /** The item was cancelled while the request was outstanding */
        CANCELLED
    }

    private final Reason reason;

    public NegotiationException(String transferId, Reason reason, String message) {
        super(transferId, message);
        this.reason = reason;
    }

    public NegotiationException(String transferId, Reason reason, String message, Throwable cause) {
        super(transferId, message, cause);
        this.reason = reason;
    }

    public Reason getNegotiationReason() {
        return reason;
    }
}
