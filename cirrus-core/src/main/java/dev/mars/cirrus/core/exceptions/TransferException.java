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
 * Exception thrown when processing a queued item fails.
 * Covers file system errors, negotiation failures, encryption and upload failures.
 *
 * <p>{@link #getReason()} returns the bare reason that is recorded against the item
 * and reported to the orchestration service, while {@link #getMessage()} carries the
 * item id for log output.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 1.1
 */
public class TransferException extends CirrusException {

    private final String transferId;

    public TransferException(String transferId, String message) {
        super(message);
        this.transferId = transferId;
    }

    public TransferException(String transferId, String message, Throwable cause) {
        super(message, cause);
        this.transferId = transferId;
    }

    public String getTransferId() {
        return transferId;
    }

    /**
     * The failure reason without the transfer id prefix.
     */
    public String getReason() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return String.format("Transfer %s failed: %s", transferId, super.getMessage());
    }
}
