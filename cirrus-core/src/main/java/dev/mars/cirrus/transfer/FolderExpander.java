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


import dev.mars.cirrus.core.QueueItem;
import dev.mars.cirrus.core.TransferStatus;
import dev.mars.cirrus.core.exceptions.TransferException;
import dev.mars.cirrus.core.exceptions.ValidationException;
import dev.mars.cirrus.correlation.CorrelationManager;
import dev.mars.cirrus.protocol.FolderCreated;
import dev.mars.cirrus.state.TransferState;
import dev.mars.cirrus.storage.FolderScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates a folder on the server and queues its immediate children.
 *
 * <p>Children are queued files first, then subfolders, and the whole block goes ahead of
 * everything already waiting, so a folder's contents drain before its queued siblings.
 * Every child carries the server folder id as its parent reference.</p>
 */
public class FolderExpander {

    private static final Logger logger = LoggerFactory.getLogger(FolderExpander.class);

    public enum Outcome {
        COMPLETED,
        SKIPPED
    }

    private final TransferState state;
    private final TransferEventPublisher publisher;
    private final CorrelationManager<FolderCreated> folderReplies;
    private final FolderScanner scanner;
    private final Duration negotiationTimeout;

    public FolderExpander(TransferState state,
                          TransferEventPublisher publisher,
                          CorrelationManager<FolderCreated> folderReplies,
                          FolderScanner scanner,
                          Duration negotiationTimeout) {
        this.state = state;
        this.publisher = publisher;
        this.folderReplies = folderReplies;
        this.scanner = scanner;
        this.negotiationTimeout = negotiationTimeout;
    }

    /**
     * Expand one active folder item.
     *
     * @throws TransferException on any failure; the caller records it and the folder's
     *                           pending entry is released with it
     */
    public Outcome expand(QueueItem folder) throws TransferException {
        String id = folder.getId();
        Path path = folder.getPath();

        if (!Files.isDirectory(path)) {
            throw new ValidationException(id, "Folder not found or not a directory: " + path);
        }

        String folderId;
        switch (state.enterFolder(id)) {
            case SKIP_TERMINAL:
                logger.debug("Folder {} already finished, skipping", id);
                state.releasePendingFolder(path);
                state.releaseActive(id);
                return Outcome.SKIPPED;

            case REENTER:
                // an earlier entry either mapped this folder or failed it terminally
                folderId = state.folderIdFor(path).orElseThrow(() ->
                        new TransferException(id, "Folder re-entered without a server id"));
                logger.debug("Folder {} re-entered, reusing server id {}", id, folderId);
                break;

            default:
                folderId = requestCreation(folder);
                break;
        }

        FolderScanner.Listing listing;
        try {
            listing = scanner.scan(path);
        } catch (IOException e) {
            throw new TransferException(id, "Failed to read folder: " + e.getMessage(), e);
        }

        publisher.progress(folder, 0.3, TransferStatus.PROCESSING,
                "Found " + listing.files().size() + " files and " + listing.folders().size() + " subfolders");

        List<QueueItem> children = new ArrayList<>(listing.files().size() + listing.folders().size());
        for (Path file : listing.files()) {
            children.add(child(QueueItem.builder().file(file), folder, folderId));
        }
        for (Path sub : listing.folders()) {
            children.add(child(QueueItem.builder().folder(sub), folder, folderId));
        }
        state.insertAhead(children);
        logger.info("Folder {} expanded: {} files, {} subfolders queued ahead",
                folder.getName(), listing.files().size(), listing.folders().size());

        if (state.markFinalizationSent(id)) {
            publisher.progress(folder, 1.0, TransferStatus.COMPLETED, "Folder processing complete, starting contents...");
            publisher.complete(id, folder.getName(), TransferStatus.COMPLETED, "Folder created successfully");
        }
        state.completeFolder(folder);
        return Outcome.COMPLETED;
    }

    private String requestCreation(QueueItem folder) throws TransferException {
        String id = folder.getId();
        String parentId = state.resolveParentId(folder.getParentRef());
        String shareId = state.getSessionAnchor().orElse(null);

        publisher.progress(folder, 0.0, TransferStatus.PREPARING, "Scanning folder contents...");

        state.recordRequestStarted(id);
        FolderCreated created = folderReplies.await(id,
                () -> publisher.createFolder(folder, parentId, shareId),
                negotiationTimeout);

        if (created.folderId() == null || created.folderId().isBlank()) {
            throw new TransferException(id, "Folder creation reply carried no folder id");
        }
        String folderId = state.mapFolder(folder.getPath(), created.folderId());
        logger.debug("Folder {} created with server id {}", folder.getName(), folderId);
        return folderId;
    }

    private static QueueItem child(QueueItem.Builder builder, QueueItem parent, String parentFolderId) {
        return builder
                .parentRef(parentFolderId)
                .depth(parent.getDepth() + 1)
                .build();
    }
}
