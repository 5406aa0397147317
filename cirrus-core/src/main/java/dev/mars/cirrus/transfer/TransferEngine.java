package dev.mars.cirrus.transfer;

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


import dev.mars.cirrus.monitoring.CleanupReport;
import dev.mars.cirrus.monitoring.DetailedQueueStatus;
import dev.mars.cirrus.monitoring.QueueStatus;
import dev.mars.cirrus.monitoring.TransferEngineHealthCheck;
import dev.mars.cirrus.protocol.ErrorReply;
import dev.mars.cirrus.protocol.FinalizeResult;
import dev.mars.cirrus.protocol.FolderCreated;
import dev.mars.cirrus.protocol.UploadParameters;

import java.util.List;

/**
 * Core interface for the upload transfer engine.
 * Defines the commands, the inbound reply handlers and the administrative queries.
 */
public interface TransferEngine {

    /**
     * Queue files for upload. Paths that are not regular files are reported with
     * {@code transfer-error} and skipped.
     *
     * @param shareId  session anchor for the selection, may be null
     * @param parentId server folder id the files go into, may be null
     * @return ids of the queued items, in selection order
     */
    List<String> selectFiles(List<String> paths, String shareId, String parentId);

    /**
     * Queue folders for upload. Paths that are not directories are reported with
     * {@code transfer-error} and skipped.
     *
     * @return ids of the queued items, in selection order
     */
    List<String> selectFolders(List<String> paths, String shareId, String parentId);

    /**
     * Cancel one queued or active item.
     *
     * @return true if the item was cancelled, false if unknown or already finished
     */
    boolean cancelTransfer(String id);

    /**
     * Cancel everything queued or active.
     *
     * @return number of items cancelled
     */
    int cancelAllTransfers();

    void pauseTransfers();

    /**
     * @param shareId new session anchor, or null to keep the current one
     */
    void resumeTransfers(String shareId);

    // Inbound replies from the orchestration service

    void onUploadParameters(UploadParameters parameters);

    void onUploadError(ErrorReply error);

    void onFolderCreated(FolderCreated created);

    void onFolderError(ErrorReply error);

    void onFinalizeComplete(FinalizeResult result);

    // Administration

    QueueStatus getQueueStatus();

    DetailedQueueStatus getDetailedQueueStatus();

    TransferEngineHealthCheck checkHealth();

    /**
     * Fail every item whose outstanding request is older than the staleness threshold and
     * restart the scheduler.
     */
    CleanupReport cleanupStuckTransfers();

    /**
     * Drop pending-folder entries with no queued or active folder and restart the
     * scheduler if anything was removed.
     *
     * @return number of entries removed
     */
    int repairPendingFolders();

    /**
     * Shutdown the engine gracefully.
     *
     * @param timeoutSeconds maximum time to wait for the scheduler thread
     * @return true if the scheduler stopped within the timeout
     */
    boolean shutdown(long timeoutSeconds);
}
