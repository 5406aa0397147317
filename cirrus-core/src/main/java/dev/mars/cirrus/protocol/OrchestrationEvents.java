package dev.mars.cirrus.protocol;

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
 * Event names exchanged with the orchestration service.
 *
 * <p>Outbound events go from the engine to the orchestration service; inbound events are
 * replies correlated by {@code transfer_id}.</p>
 */
public final class OrchestrationEvents {

    // Outbound
    public static final String INIT_FILE_UPLOAD = "init-file-upload";
    public static final String CREATE_FOLDER = "create-folder";
    public static final String BLOCK_COMPLETE = "block-complete";
    public static final String THUMBNAIL_COMPLETE = "thumbnail-complete";
    public static final String FINALIZE_TRANSFER = "finalize-transfer";
    public static final String TRANSFER_PROGRESS = "transfer-progress";
    public static final String TRANSFER_COMPLETE = "transfer-complete";
    public static final String TRANSFER_ERROR = "transfer-error";

    // Inbound
    public static final String UPLOAD_URLS = "upload-urls";
    public static final String UPLOAD_ERROR = "upload-error";
    public static final String FOLDER_CREATED = "folder-created";
    public static final String FOLDER_ERROR = "folder-error";
    public static final String FINALIZE_COMPLETE = "finalize-complete";

    private OrchestrationEvents() {
    }
}
