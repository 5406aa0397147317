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
import dev.mars.cirrus.config.CirrusConfiguration;
import dev.mars.cirrus.core.QueueItem;
import dev.mars.cirrus.core.TransferStatus;
import dev.mars.cirrus.core.exceptions.TransferException;
import dev.mars.cirrus.core.exceptions.ValidationException;
import dev.mars.cirrus.correlation.CorrelationManager;
import dev.mars.cirrus.crypto.BlockCipher;
import dev.mars.cirrus.crypto.ThumbnailNoncePolicy;
import dev.mars.cirrus.monitoring.TransferTelemetryMetrics;
import dev.mars.cirrus.protocol.PresignedBlockUrl;
import dev.mars.cirrus.protocol.ThumbnailTarget;
import dev.mars.cirrus.protocol.UploadParameters;
import dev.mars.cirrus.state.TransferState;
import dev.mars.cirrus.storage.ChecksumCalculator;
import dev.mars.cirrus.storage.FileInspector;
import dev.mars.cirrus.storage.FileInspector.FileMetadata;
import dev.mars.cirrus.thumbnail.ThumbnailGenerator;
import dev.mars.cirrus.upload.BlockUploader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.List;

/**
 * Uploads one file: negotiate, then read, hash, encrypt and PUT each block in index order,
 * then request finalization.
 *
 * <h3>Hashes:</h3>
 * <ul>
 *   <li>{@code content_hash} on {@code finalize-transfer}: SHA-256 of the whole plaintext</li>
 *   <li>{@code hash} on {@code block-complete}: SHA-256 of that block's ciphertext</li>
 * </ul>
 *
 * <p>The item is not completed here. It stays active after {@code finalize-transfer}
 * until the orchestration service reports {@code finalize-complete}.</p>
 *
 * <p>Cancellation and pause are checked at the top of every block. A paused file is put
 * back at the head of the queue and continues from its cached parameters: blocks already
 * reported are read and hashed again but not re-uploaded.</p>
 */
public class FileTransferPipeline {

    private static final Logger logger = LoggerFactory.getLogger(FileTransferPipeline.class);

    public enum Outcome {
        /** All blocks uploaded, waiting for {@code finalize-complete} */
        AWAITING_FINALIZATION,
        /** Paused mid-file and put back at the head of the queue */
        SUSPENDED,
        /** No longer active when checked; the cancelling side reports it */
        CANCELLED,
        /** Already completed or failed */
        SKIPPED
    }

    private final TransferState state;
    private final TransferEventPublisher publisher;
    private final CorrelationManager<UploadParameters> uploadReplies;
    private final BlockUploader uploader;
    private final FileInspector inspector;
    private final ThumbnailGenerator thumbnails;
    private final TransferTelemetryMetrics metrics;

    private final Duration negotiationTimeout;
    private final Duration uploadTimeout;
    private final Duration thumbnailUploadTimeout;
    private final int maxAttempts;
    private final ThumbnailNoncePolicy thumbnailNonce;
    private final int speedSamples;
    private final long etaFallbackSeconds;

    public FileTransferPipeline(TransferState state,
                                TransferEventPublisher publisher,
                                CorrelationManager<UploadParameters> uploadReplies,
                                BlockUploader uploader,
                                CirrusConfiguration config) {
        this.state = state;
        this.publisher = publisher;
        this.uploadReplies = uploadReplies;
        this.uploader = uploader;
        this.inspector = new FileInspector(config.getThumbnailMaxSourceBytes());
        this.thumbnails = new ThumbnailGenerator(config.getThumbnailMaxDimension());
        this.metrics = TransferTelemetryMetrics.getInstance();
        this.negotiationTimeout = config.getNegotiationTimeout();
        this.uploadTimeout = config.getUploadTimeout();
        this.thumbnailUploadTimeout = config.getThumbnailUploadTimeout();
        this.maxAttempts = config.getUploadMaxAttempts();
        this.thumbnailNonce = config.getThumbnailNoncePolicy();
        this.speedSamples = config.getSpeedSamples();
        this.etaFallbackSeconds = config.getEtaFallbackSeconds();
    }

    public Outcome transfer(QueueItem item) throws TransferException {
        String id = item.getId();
        Path path = item.getPath();

        TransferState.Entry entry = state.enterFile(id);
        if (entry == TransferState.Entry.SKIP_TERMINAL) {
            logger.debug("File {} already finished, skipping", id);
            state.releaseActive(id);
            return Outcome.SKIPPED;
        }

        FileMetadata metadata = inspect(item);
        String parentId = state.resolveParentId(item.getParentRef());

        UploadParameters parameters;
        boolean resumed = entry == TransferState.Entry.REENTER;
        if (resumed) {
            // an earlier entry either cached parameters or failed the file terminally
            parameters = state.cachedParameters(id).orElseThrow(() ->
                    new TransferException(id, "Resumed without cached upload parameters"));
            logger.info("Resuming {} from cached parameters", item.getName());
        } else {
            parameters = negotiate(item, parentId, metadata);
        }

        List<PresignedBlockUrl> blocks = parameters.getUploadUrls();
        validateLayout(id, parameters, metadata.size());

        BlockCipher cipher = BlockCipher.fromBase64Key(id, parameters.getContentKey());

        if (!resumed) {
            parameters.thumbnailTarget().ifPresent(target -> uploadThumbnail(item, metadata, cipher, target));
            publisher.fileProgress(item, 0.05, TransferStatus.UPLOADING,
                    "Starting upload of " + blocks.size() + " blocks...", metadata.size());
        }

        ChecksumCalculator contentHash = new ChecksumCalculator();
        ProgressTracker tracker = new ProgressTracker(id, metadata.size(), speedSamples, etaFallbackSeconds);
        int blockSize = (int) parameters.getBlockSize();
        byte[] buffer = new byte[(int) Math.min(blockSize, metadata.size())];

        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long lastBlockEnd = System.nanoTime();

            for (PresignedBlockUrl block : blocks) {
                switch (state.checkActive(id)) {
                    case CANCELLED:
                        logger.info("File {} no longer active, stopping at block {}", item.getName(), block.getIndex());
                        return Outcome.CANCELLED;
                    case PAUSED:
                        if (state.suspendActive(id)) {
                            logger.info("File {} paused at block {}", item.getName(), block.getIndex());
                            return Outcome.SUSPENDED;
                        }
                        return Outcome.CANCELLED;
                    default:
                        break;
                }

                long offset = (long) block.getIndex() * blockSize;
                int length = (int) Math.min(blockSize, metadata.size() - offset);
                readFully(id, channel, buffer, offset, length);
                contentHash.update(buffer, 0, length);

                String blockKey = block.notificationKey();
                if (state.isBlockNotified(id, blockKey)) {
                    tracker.skipBlock(length);
                    lastBlockEnd = System.nanoTime();
                    continue;
                }

                byte[] ciphertext = cipher.encryptBlock(block.getIndex(), buffer, length);
                uploader.upload(id, block.getUrl(), ciphertext, uploadTimeout, maxAttempts);

                if (state.markBlockNotified(id, blockKey)) {
                    emitOrFail(id, () -> publisher.blockComplete(block, ChecksumCalculator.sha256Hex(ciphertext),
                            parameters.getFileId()));
                }

                long now = System.nanoTime();
                Duration elapsed = Duration.ofNanos(now - lastBlockEnd);
                lastBlockEnd = now;
                tracker.recordBlock(length, elapsed);
                metrics.recordBlockUploaded(length, elapsed.toNanos() / 1_000_000_000.0);
                publisher.blockProgress(item, tracker, blocks.size());
            }
        } catch (IOException e) {
            throw new TransferException(id, "Failed to read file block: " + e.getMessage(), e);
        }

        if (state.checkActive(id) == TransferState.ActiveCheck.CANCELLED) {
            return Outcome.CANCELLED;
        }

        String hash = contentHash.getChecksum();
        // deadline first: finalize-complete may arrive before emit returns
        state.recordRequestStarted(id);
        if (state.markFinalizationSent(id)) {
            publisher.fileProgress(item, 1.0, TransferStatus.UPLOADING, "Upload complete, finalizing...", metadata.size());
            emitOrFail(id, () -> publisher.finalizeTransfer(item, metadata.size(), hash, parameters, parentId));
            logger.info("All {} blocks of {} uploaded, finalization requested", blocks.size(), item.getName());
        }
        return Outcome.AWAITING_FINALIZATION;
    }

    private FileMetadata inspect(QueueItem item) throws TransferException {
        String id = item.getId();
        Path path = item.getPath();
        if (!Files.isRegularFile(path)) {
            throw new ValidationException(id, "File not found or not a regular file: " + path);
        }
        FileMetadata metadata;
        try {
            metadata = inspector.inspect(path);
        } catch (IOException e) {
            throw new TransferException(id, "Failed to read file metadata: " + e.getMessage(), e);
        }
        if (metadata.size() == 0) {
            throw new ValidationException(id, "File is empty (0 bytes): " + path);
        }
        return metadata;
    }

    private UploadParameters negotiate(QueueItem item, String parentId, FileMetadata metadata)
            throws TransferException {
        String id = item.getId();
        String shareId = state.getSessionAnchor().orElse(null);

        publisher.fileProgress(item, 0.0, TransferStatus.PREPARING, "Preparing upload...", metadata.size());

        state.recordRequestStarted(id);
        UploadParameters parameters = uploadReplies.await(id,
                () -> publisher.initFileUpload(item, parentId, shareId, metadata),
                negotiationTimeout);
        state.cacheParameters(id, parameters);
        logger.debug("Negotiated {} for {}", parameters, item.getName());
        return parameters;
    }

    private void validateLayout(String id, UploadParameters parameters, long size) throws ValidationException {
        long blockSize = parameters.getBlockSize();
        if (blockSize <= 0 || blockSize > Integer.MAX_VALUE - BlockCipher.TAG_LENGTH_BYTES) {
            throw new ValidationException(id, "Invalid block size: " + blockSize);
        }
        List<PresignedBlockUrl> blocks = parameters.getUploadUrls();
        if (blocks.isEmpty()) {
            throw new ValidationException(id, "No upload URLs received");
        }
        // sorted by index, so the layout is valid only if the indexes are exactly 0..n-1
        long expected = (size + blockSize - 1) / blockSize;
        boolean contiguous = blocks.size() == expected;
        for (int i = 0; contiguous && i < blocks.size(); i++) {
            contiguous = blocks.get(i).getIndex() == i;
        }
        if (!contiguous) {
            List<Integer> indexes = blocks.stream().map(PresignedBlockUrl::getIndex).toList();
            throw new ValidationException(id, "Upload URLs must cover block indexes 0.." + (expected - 1)
                    + " exactly once, got " + indexes);
        }
    }

    /**
     * Generate, encrypt and upload the thumbnail. Never fails the file.
     */
    private void uploadThumbnail(QueueItem item, FileMetadata metadata, BlockCipher cipher, ThumbnailTarget target) {
        String id = item.getId();
        publisher.fileProgress(item, 0.02, TransferStatus.PREPARING, "Generating thumbnail...", metadata.size());
        try {
            byte[] jpeg = thumbnails.generate(item.getPath());
            byte[] encrypted = cipher.encryptThumbnail(thumbnailNonce, jpeg);
            uploader.upload(id, target.getUrl(), encrypted, thumbnailUploadTimeout, 1);
            publisher.thumbnailComplete(target.getId(), ChecksumCalculator.sha256Hex(encrypted), encrypted.length);
            logger.debug("Thumbnail for {} uploaded ({} bytes)", item.getName(), encrypted.length);
        } catch (IOException | TransferException | ChannelException e) {
            logger.warn("Thumbnail for {} skipped: {}", item.getName(), e.getMessage());
        }
    }

    private static void readFully(String id, FileChannel channel, byte[] buffer, long offset, int length)
            throws IOException {
        ByteBuffer target = ByteBuffer.wrap(buffer, 0, length);
        long position = offset;
        while (target.hasRemaining()) {
            int read = channel.read(target, position);
            if (read < 0) {
                throw new EOFException("Unexpected end of file for " + id + " at offset " + position);
            }
            position += read;
        }
    }

    @FunctionalInterface
    private interface Emission {
        void emit() throws ChannelException;
    }

    private static void emitOrFail(String id, Emission emission) throws TransferException {
        try {
            emission.emit();
        } catch (ChannelException e) {
            throw new TransferException(id, e.getMessage(), e);
        }
    }
}
