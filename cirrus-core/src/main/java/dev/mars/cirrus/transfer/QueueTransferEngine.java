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


import dev.mars.cirrus.channel.OrchestrationChannel;
import dev.mars.cirrus.config.CirrusConfiguration;
import dev.mars.cirrus.core.ItemKind;
import dev.mars.cirrus.core.QueueItem;
import dev.mars.cirrus.core.TransferStatus;
import dev.mars.cirrus.core.exceptions.TransferException;
import dev.mars.cirrus.correlation.CorrelationManager;
import dev.mars.cirrus.monitoring.CleanupReport;
import dev.mars.cirrus.monitoring.DetailedQueueStatus;
import dev.mars.cirrus.monitoring.QueueStatus;
import dev.mars.cirrus.monitoring.TransferEngineHealthCheck;
import dev.mars.cirrus.monitoring.TransferTelemetryMetrics;
import dev.mars.cirrus.protocol.ErrorReply;
import dev.mars.cirrus.protocol.FinalizeResult;
import dev.mars.cirrus.protocol.FolderCreated;
import dev.mars.cirrus.protocol.UploadParameters;
import dev.mars.cirrus.state.TransferState;
import dev.mars.cirrus.storage.FolderScanner;
import dev.mars.cirrus.upload.BlockUploader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-flight implementation of {@link TransferEngine}.
 *
 * <p>One scheduler thread runs a drain loop: take the next ready item, expand it or upload
 * it, repeat until the queue is empty, the engine is paused, nothing is ready, or the
 * current item is left active waiting for the orchestration service. Commands and inbound
 * replies arrive on other threads; they only touch {@link TransferState} and, when the
 * scheduler may have work, re-submit the drain loop.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class QueueTransferEngine implements TransferEngine {

    private static final Logger logger = LoggerFactory.getLogger(QueueTransferEngine.class);

    private final CirrusConfiguration config;
    private final TransferState state;
    private final TransferEventPublisher publisher;
    private final BlockUploader uploader;
    private final CorrelationManager<UploadParameters> uploadReplies;
    private final CorrelationManager<FolderCreated> folderReplies;
    private final FolderExpander expander;
    private final FileTransferPipeline pipeline;
    private final TransferTelemetryMetrics metrics;
    private final Duration staleThreshold;

    private final ExecutorService scheduler;
    private final AtomicBoolean drainScheduled = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public QueueTransferEngine(CirrusConfiguration config, OrchestrationChannel channel, BlockUploader uploader) {
        this(config, channel, uploader, new TransferState());
    }

    public QueueTransferEngine(CirrusConfiguration config, OrchestrationChannel channel, BlockUploader uploader,
                               TransferState state) {
        this.config = config;
        this.state = state;
        this.uploader = uploader;
        this.publisher = new TransferEventPublisher(channel);
        this.uploadReplies = new CorrelationManager<>("upload parameters");
        this.folderReplies = new CorrelationManager<>("folder creation");
        this.expander = new FolderExpander(state, publisher, folderReplies, new FolderScanner(),
                config.getNegotiationTimeout());
        this.pipeline = new FileTransferPipeline(state, publisher, uploadReplies, uploader, config);
        this.metrics = TransferTelemetryMetrics.getInstance();
        this.staleThreshold = config.getStaleThreshold();

        this.scheduler = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "cirrus-scheduler");
            t.setDaemon(true);
            return t;
        });

        logger.info("QueueTransferEngine initialized (negotiationTimeout={}ms, staleThreshold={}ms)",
                config.getNegotiationTimeout().toMillis(), staleThreshold.toMillis());
    }

    // ==================== Selection ====================

    @Override
    public List<String> selectFiles(List<String> paths, String shareId, String parentId) {
        return select(paths, shareId, parentId, ItemKind.FILE);
    }

    @Override
    public List<String> selectFolders(List<String> paths, String shareId, String parentId) {
        return select(paths, shareId, parentId, ItemKind.FOLDER);
    }

    private List<String> select(List<String> paths, String shareId, String parentId, ItemKind kind) {
        List<QueueItem> items = new ArrayList<>();
        for (String raw : paths) {
            Optional<Path> path = resolveSelection(raw, kind);
            if (path.isEmpty()) {
                logger.warn("Rejected {} selection: {}", kind.wireName(), raw);
                publisher.selectionError("Invalid " + kind.wireName() + " path: " + raw);
                continue;
            }
            items.add(QueueItem.builder()
                    .kind(kind)
                    .path(path.get())
                    .parentRef(parentId)
                    .depth(0)
                    .build());
        }

        if (shareId != null && !shareId.isBlank()) {
            state.setSessionAnchor(shareId);
        }
        if (items.isEmpty()) {
            return List.of();
        }

        boolean start = state.enqueue(items);
        logger.info("Queued {} {} item(s)", items.size(), kind.wireName());
        if (start) {
            trigger();
        }

        List<String> ids = new ArrayList<>(items.size());
        for (QueueItem item : items) {
            ids.add(item.getId());
        }
        return ids;
    }

    private static Optional<Path> resolveSelection(String raw, ItemKind kind) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        Path path;
        try {
            path = Paths.get(raw);
        } catch (InvalidPathException e) {
            return Optional.empty();
        }
        boolean valid = kind == ItemKind.FILE ? Files.isRegularFile(path) : Files.isDirectory(path);
        return valid ? Optional.of(path) : Optional.empty();
    }

    // ==================== Commands ====================

    @Override
    public boolean cancelTransfer(String id) {
        Optional<QueueItem> cancelled = state.cancel(id);
        if (cancelled.isEmpty()) {
            logger.debug("Cancel ignored for {}: not queued or active", id);
            return false;
        }
        QueueItem item = cancelled.get();
        wakeWaiter(id);
        publisher.failure(id, item.getName(), item.getKind(), sizeOf(item), TransferState.CANCELLED_REASON);
        metrics.recordItemCancelled(item.getKind());
        logger.info("Cancelled {} ({})", item.getName(), id);
        trigger();
        return true;
    }

    @Override
    public int cancelAllTransfers() {
        List<QueueItem> cancelled = state.cancelAll();
        for (QueueItem item : cancelled) {
            wakeWaiter(item.getId());
            publisher.failure(item.getId(), item.getName(), item.getKind(), sizeOf(item), TransferState.CANCELLED_REASON);
            metrics.recordItemCancelled(item.getKind());
        }
        logger.info("Cancelled all transfers ({} items)", cancelled.size());
        return cancelled.size();
    }

    @Override
    public void pauseTransfers() {
        state.pause();
        logger.info("Transfers paused");
    }

    @Override
    public void resumeTransfers(String shareId) {
        boolean start = state.resume(shareId);
        logger.info("Transfers resumed");
        if (start) {
            trigger();
        }
    }

    private void wakeWaiter(String id) {
        uploadReplies.cancel(id);
        folderReplies.cancel(id);
    }

    // ==================== Inbound replies ====================

    @Override
    public void onUploadParameters(UploadParameters parameters) {
        String id = parameters.getTransferId();
        if (acceptReply(id, "upload-urls")) {
            settle(id, uploadReplies.resolve(id, parameters));
        }
    }

    @Override
    public void onUploadError(ErrorReply error) {
        String id = error.transferId();
        if (acceptReply(id, "upload-error")) {
            settle(id, uploadReplies.reject(id, errorText(error)));
        }
    }

    @Override
    public void onFolderCreated(FolderCreated created) {
        String id = created.transferId();
        if (acceptReply(id, "folder-created")) {
            settle(id, folderReplies.resolve(id, created));
        }
    }

    @Override
    public void onFolderError(ErrorReply error) {
        String id = error.transferId();
        if (acceptReply(id, "folder-error")) {
            settle(id, folderReplies.reject(id, errorText(error)));
        }
    }

    @Override
    public void onFinalizeComplete(FinalizeResult result) {
        String id = result.transferId();
        Optional<QueueItem> item = id != null ? state.findItem(id) : Optional.empty();
        if (item.isEmpty()) {
            logger.warn("finalize-complete for unknown transfer {}", id);
            return;
        }
        if (!state.completeFile(id)) {
            logger.debug("finalize-complete for {} ignored, already finished", id);
            return;
        }
        if (!result.success()) {
            logger.warn("Content verification failed for {}: {}", item.get().getName(), result.error());
        }
        publisher.complete(id, item.get().getName(), TransferStatus.COMPLETED, result.completionMessage());
        metrics.recordItemCompleted(ItemKind.FILE);
        logger.info("Transfer complete: {} ({})", item.get().getName(), id);
        trigger();
    }

    private boolean acceptReply(String id, String event) {
        if (id == null || id.isBlank()) {
            logger.warn("Dropped {} without transfer_id", event);
            return false;
        }
        if (!state.markResponseReceived(id)) {
            logger.debug("Duplicate {} for {} dropped", event, id);
            return false;
        }
        return true;
    }

    private void settle(String id, CorrelationManager.Delivery delivery) {
        if (delivery == CorrelationManager.Delivery.ORPHANED) {
            state.clearResponseTracking(id);
        }
    }

    private static String errorText(ErrorReply error) {
        return error.error() != null ? error.error() : "Unknown error";
    }

    // ==================== Scheduler ====================

    private void trigger() {
        if (shutdown.get()) {
            return;
        }
        if (drainScheduled.compareAndSet(false, true)) {
            try {
                scheduler.execute(() -> {
                    drainScheduled.set(false);
                    drain();
                });
            } catch (RejectedExecutionException e) {
                drainScheduled.set(false);
                logger.warn("Scheduler rejected drain request: {}", e.getMessage());
            }
        }
    }

    private void drain() {
        while (!shutdown.get()) {
            TransferState.Dequeue next = state.beginDequeue(staleThreshold);
            for (String staleId : next.staleIds()) {
                logger.warn("Request for {} exceeded {}ms without a reply", staleId, staleThreshold.toMillis());
                uploadReplies.expire(staleId, TransferState.TIMED_OUT_REASON);
                folderReplies.expire(staleId, TransferState.TIMED_OUT_REASON);
                metrics.recordRequestTimeout();
            }
            if (!next.hasItem()) {
                return;
            }
            process(next.item());
        }
    }

    private void process(QueueItem item) {
        logger.info("Processing {} {} ({})", item.getKind().wireName(), item.getName(), item.getId());
        metrics.recordItemStarted(item.getKind());
        try {
            if (item.isFolder()) {
                if (expander.expand(item) == FolderExpander.Outcome.COMPLETED) {
                    metrics.recordItemCompleted(ItemKind.FOLDER);
                }
            } else {
                FileTransferPipeline.Outcome outcome = pipeline.transfer(item);
                logger.debug("File {} left the pipeline: {}", item.getId(), outcome);
            }
        } catch (TransferException e) {
            handleFailure(item, e.getReason(), e);
        } catch (RuntimeException e) {
            logger.error("Unexpected error processing {}", item.getId(), e);
            handleFailure(item, "Unexpected error: " + e.getMessage(), e);
        }
    }

    private void handleFailure(QueueItem item, String reason, Exception cause) {
        if (!state.fail(item.getId(), reason)) {
            logger.debug("Failure of {} not recorded, already finished: {}", item.getId(), reason);
            return;
        }
        logger.warn("Transfer of {} failed: {}", item.getName(), reason);
        publisher.failure(item.getId(), item.getName(), item.getKind(), sizeOf(item), reason);
        metrics.recordItemFailed(item.getKind(), cause.getClass().getSimpleName());
    }

    /** Size reported with a file's failure, or null for folders and unreadable files. */
    private static Long sizeOf(QueueItem item) {
        if (item.isFolder()) {
            return null;
        }
        try {
            return Files.size(item.getPath());
        } catch (IOException e) {
            logger.debug("No size for {}: {}", item.getId(), e.getMessage());
            return null;
        }
    }

    // ==================== Administration ====================

    @Override
    public QueueStatus getQueueStatus() {
        return state.status();
    }

    @Override
    public DetailedQueueStatus getDetailedQueueStatus() {
        return state.detailedStatus();
    }

    @Override
    public TransferEngineHealthCheck checkHealth() {
        TransferEngineHealthCheck.Builder builder = TransferEngineHealthCheck.builder()
                .version(config.getVersion())
                .queueStatus(state.status());

        if (shutdown.get()) {
            return builder.down().message("Transfer engine is shut down").build();
        }
        int stale = state.countStaleRequests(staleThreshold);
        if (stale > 0) {
            return builder.degraded()
                    .message(stale + " request(s) outstanding beyond " + staleThreshold.toMillis() + "ms")
                    .build();
        }
        return builder.up().message("Transfer engine operational").build();
    }

    @Override
    public CleanupReport cleanupStuckTransfers() {
        List<TransferState.StaleRequest> purged = state.purgeStaleRequests(staleThreshold);
        List<String> ids = new ArrayList<>(purged.size());
        for (TransferState.StaleRequest stale : purged) {
            ids.add(stale.id());
            uploadReplies.expire(stale.id(), TransferState.TIMED_OUT_REASON);
            folderReplies.expire(stale.id(), TransferState.TIMED_OUT_REASON);
            publisher.complete(stale.id(), stale.name(), TransferStatus.FAILED, TransferState.TIMED_OUT_REASON);
            metrics.recordRequestTimeout();
            if (stale.item() != null) {
                metrics.recordItemFailed(stale.item().getKind(), "timeout");
            }
        }
        if (!ids.isEmpty()) {
            logger.warn("Cleaned up {} stuck transfer(s): {}", ids.size(), ids);
        }
        if (state.isIdleWithWork()) {
            trigger();
        }
        return new CleanupReport(ids);
    }

    @Override
    public int repairPendingFolders() {
        int repaired = state.repairPendingFolders();
        if (repaired > 0) {
            logger.info("Repaired {} pending folder entr{}", repaired, repaired == 1 ? "y" : "ies");
            trigger();
        }
        return repaired;
    }

    @Override
    public boolean shutdown(long timeoutSeconds) {
        if (shutdown.getAndSet(true)) {
            return true;
        }
        logger.info("Shutting down transfer engine...");
        scheduler.shutdown();
        try {
            boolean terminated = scheduler.awaitTermination(timeoutSeconds, TimeUnit.SECONDS);
            if (!terminated) {
                logger.warn("Transfer engine shutdown timed out, forcing shutdown");
                scheduler.shutdownNow();
            }
            logger.info("Transfer engine shutdown completed");
            return terminated;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
            return false;
        } finally {
            uploader.close();
        }
    }

    TransferState getState() {
        return state;
    }
}
