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


import dev.mars.cirrus.channel.ChannelException;
import dev.mars.cirrus.channel.OrchestrationChannel;
import dev.mars.cirrus.core.ItemKind;
import dev.mars.cirrus.core.QueueItem;
import dev.mars.cirrus.core.TransferStatus;
import dev.mars.cirrus.protocol.OrchestrationEvents;
import dev.mars.cirrus.protocol.PresignedBlockUrl;
import dev.mars.cirrus.protocol.UploadParameters;
import dev.mars.cirrus.storage.FileInspector.FileMetadata;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and emits the outbound orchestration events.
 *
 * <p>Two kinds of emission:</p>
 * <ul>
 *   <li>requests and notices the orchestration service acts on ({@code init-file-upload},
 *       {@code create-folder}, {@code block-complete}, {@code thumbnail-complete},
 *       {@code finalize-transfer}). These propagate {@link ChannelException} so the item fails.</li>
 *   <li>user-facing status ({@code transfer-progress}, {@code transfer-complete},
 *       {@code transfer-error}). Best effort: a channel failure is logged and swallowed so a
 *       status update can never fail a transfer.</li>
 * </ul>
 */
public class TransferEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(TransferEventPublisher.class);

    private final OrchestrationChannel channel;

    public TransferEventPublisher(OrchestrationChannel channel) {
        this.channel = channel;
    }

    // ==================== Requests ====================

    public void initFileUpload(QueueItem item, String parentId, String shareId, FileMetadata metadata)
            throws ChannelException {
        JsonObject payload = new JsonObject()
                .put("id", item.getId())
                .put("name", item.getName())
                .put("path", item.getPath().toString())
                .put("parent_id", parentId)
                .put("share_id", shareId)
                .put("size", metadata.size())
                .put("mime_type", metadata.mimeType())
                .put("modified_date", metadata.modifiedEpochSeconds())
                .put("needs_thumbnail", metadata.thumbnailEligible());
        if (metadata.extendedAttributes() != null) {
            payload.put("xattrs", metadata.extendedAttributes());
        }
        channel.emit(OrchestrationEvents.INIT_FILE_UPLOAD, payload);
    }

    public void createFolder(QueueItem folder, String parentId, String shareId) throws ChannelException {
        JsonObject payload = new JsonObject()
                .put("id", folder.getId())
                .put("name", folder.getName())
                .put("path", folder.getPath().toString())
                .put("parent_id", parentId)
                .put("share_id", shareId);
        channel.emit(OrchestrationEvents.CREATE_FOLDER, payload);
    }

    public void blockComplete(PresignedBlockUrl block, String ciphertextHash, String fileId)
            throws ChannelException {
        channel.emit(OrchestrationEvents.BLOCK_COMPLETE, new JsonObject()
                .put("block_id", block.getBlockId())
                .put("hash", ciphertextHash)
                .put("index", block.getIndex())
                .put("file_id", fileId));
    }

    public void thumbnailComplete(String thumbnailId, String ciphertextHash, int size) throws ChannelException {
        channel.emit(OrchestrationEvents.THUMBNAIL_COMPLETE, new JsonObject()
                .put("thumbnail_id", thumbnailId)
                .put("hash", ciphertextHash)
                .put("size", size));
    }

    public void finalizeTransfer(QueueItem item, long size, String contentHash, UploadParameters parameters,
                                 String parentId) throws ChannelException {
        channel.emit(OrchestrationEvents.FINALIZE_TRANSFER, new JsonObject()
                .put("id", item.getId())
                .put("name", item.getName())
                .put("size", size)
                .put("content_hash", contentHash)
                .put("file_id", parameters.getFileId())
                .put("parent_id", parentId)
                .put("revision_id", parameters.getRevisionId()));
    }

    // ==================== Status ====================

    public void progress(QueueItem item, double progress, TransferStatus status, String message) {
        notify(OrchestrationEvents.TRANSFER_PROGRESS, baseProgress(item, progress, status, message));
    }

    public void fileProgress(QueueItem item, double progress, TransferStatus status, String message, long size) {
        notify(OrchestrationEvents.TRANSFER_PROGRESS, baseProgress(item, progress, status, message)
                .put("size", size));
    }

    /**
     * Per-block update carrying speed, ETA and the cumulative byte count.
     */
    public void blockProgress(QueueItem item, ProgressTracker tracker, int totalBlocks) {
        String message = "Uploading block " + tracker.getCompletedBlocks() + "/" + totalBlocks;
        notify(OrchestrationEvents.TRANSFER_PROGRESS,
                baseProgress(item, tracker.getProgress(), TransferStatus.UPLOADING, message)
                        .put("speed", tracker.getSpeedBytesPerSecond())
                        .put("remaining_time", tracker.getEstimatedRemainingSeconds())
                        .put("size", tracker.getTotalBytes())
                        .put("uploaded_bytes", tracker.getTransferredBytes()));
    }

    public void complete(String id, String name, TransferStatus status, String message) {
        notify(OrchestrationEvents.TRANSFER_COMPLETE, new JsonObject()
                .put("id", id)
                .put("name", name)
                .put("status", status.wireName())
                .put("message", message));
    }

    /**
     * Failure progress followed by the terminal {@code transfer-complete}.
     */
    public void failure(String id, String name, ItemKind kind, Long size, String reason) {
        JsonObject progress = new JsonObject()
                .put("id", id)
                .put("name", name)
                .put("type", kind.wireName())
                .put("progress", 0.0)
                .put("status", TransferStatus.FAILED.wireName())
                .put("message", reason);
        if (size != null) {
            progress.put("size", size);
        }
        notify(OrchestrationEvents.TRANSFER_PROGRESS, progress);
        complete(id, name, TransferStatus.FAILED, reason);
    }

    public void selectionError(String message) {
        notify(OrchestrationEvents.TRANSFER_ERROR, new JsonObject().put("message", message));
    }

    private JsonObject baseProgress(QueueItem item, double progress, TransferStatus status, String message) {
        JsonObject json = new JsonObject()
                .put("id", item.getId())
                .put("name", item.getName())
                .put("type", item.getKind().wireName())
                .put("progress", progress)
                .put("status", status.wireName());
        if (message != null) {
            json.put("message", message);
        }
        return json;
    }

    private void notify(String event, JsonObject payload) {
        try {
            channel.emit(event, payload);
        } catch (ChannelException e) {
            logger.warn("Dropped {} for {}: {}", event, payload.getString("id", "-"), e.getMessage());
        }
    }
}
