package dev.mars.cirrus.core;

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
 * Status values reported on {@code transfer-progress} and {@code transfer-complete} events.
 *
 * <h3>Reporting Flow:</h3>
 * <pre>
 * file:   PREPARING → UPLOADING → {COMPLETED | FAILED}
 * folder: PREPARING → PROCESSING → {COMPLETED | FAILED}
 * </pre>
 *
 * <p>A file stays in UPLOADING after its last block until the orchestration service
 * confirms content verification. COMPLETED and FAILED are terminal.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public enum TransferStatus {
    /** Item taken from the queue, parameters not yet negotiated */
    PREPARING("preparing"),

    /** Folder created, children being enumerated */
    PROCESSING("processing"),

    /** Blocks are being encrypted and uploaded */
    UPLOADING("uploading"),

    COMPLETED("completed"),

    FAILED("failed");

    private final String wireName;

    TransferStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
