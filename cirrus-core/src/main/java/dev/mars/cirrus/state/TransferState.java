package dev.mars.cirrus.state;

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
import dev.mars.cirrus.monitoring.DetailedQueueStatus;
import dev.mars.cirrus.monitoring.QueueStatus;
import dev.mars.cirrus.protocol.UploadParameters;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single shared state of the transfer engine.
 *
 * <p>All fields are guarded by one {@link ReentrantLock}. Every public method acquires the
 * lock, applies one complete transition and releases it again; callers never hold the lock
 * across file I/O, channel emission, reply waits or uploads.</p>
 *
 * <h3>Membership:</h3>
 * <p>An item id is in at most one of {queue, active, completed, failed}. Reaching completed
 * or failed clears every per-id tracking entry in the same transition:</p>
 * <ul>
 *   <li>initialized files and folders (guard the initial request)</li>
 *   <li>received responses (guard against duplicate inbound replies)</li>
 *   <li>block notifications (guard {@code block-complete})</li>
 *   <li>finalizations (guard {@code finalize-transfer} and the folder completion event)</li>
 *   <li>request deadlines and cached upload parameters</li>
 * </ul>
 *
 * <h3>Readiness:</h3>
 * <p>A file whose parent directory is in {@code pendingFolders} is not ready. Dequeue takes a
 * folder at the head unconditionally, otherwise the first folder or ready file.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class TransferState {

    public static final String CANCELLED_REASON = "Cancelled by user";
    public static final String TIMED_OUT_REASON = "Request timed out";

    /** Result of entering an item that was just dequeued. */
    public enum Entry {
        /** First time: emit the initial request */
        FRESH,
        /** Already initialized: continue without re-emitting */
        REENTER,
        /** Already completed or failed: exit silently */
        SKIP_TERMINAL
    }

    /** Result of the per-block cooperative check. */
    public enum ActiveCheck {
        CONTINUE,
        /** The item is no longer active (cancelled, failed or swept) */
        CANCELLED,
        PAUSED
    }

    /** Where an id currently lives. */
    public enum Membership {
        QUEUED,
        ACTIVE,
        COMPLETED,
        FAILED,
        UNKNOWN
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private final Instant startTime;

    private final LinkedList<QueueItem> queue = new LinkedList<>();
    private QueueItem active;
    private final Set<String> completed = new LinkedHashSet<>();
    private final Map<String, String> failed = new LinkedHashMap<>();
    private final Map<String, String> folderIdMap = new LinkedHashMap<>();
    private final Set<String> pendingFolders = new LinkedHashSet<>();

    private final Set<String> initializedFiles = new HashSet<>();
    private final Set<String> initializedFolders = new HashSet<>();
    private final Set<String> receivedResponses = new HashSet<>();
    private final Set<String> finalizationsSent = new HashSet<>();
    private final Map<String, Set<String>> blockNotifications = new HashMap<>();
    private final Map<String, Instant> requestDeadlines = new LinkedHashMap<>();
    private final Map<String, UploadParameters> negotiated = new HashMap<>();
    private final Map<String, QueueItem> itemsById = new HashMap<>();

    private boolean paused;
    private String sessionAnchor;

    public TransferState() {
        this(Clock.systemUTC());
    }

    public TransferState(Clock clock) {
        this.clock = clock;
        this.startTime = clock.instant();
    }

    // ==================== Queue & Scheduling ====================

    /**
     * Appends items to the queue.
     *
     * @return true if the scheduler is idle and not paused, i.e. processing should be triggered
     */
    public boolean enqueue(Collection<QueueItem> items) {
        lock.lock();
        try {
            for (QueueItem item : items) {
                queue.addLast(item);
                itemsById.put(item.getId(), item);
            }
            return active == null && !paused && !queue.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Places items ahead of everything already queued, keeping their relative order.
     */
    public void insertAhead(List<QueueItem> items) {
        lock.lock();
        try {
            queue.addAll(0, items);
            for (QueueItem item : items) {
                itemsById.put(item.getId(), item);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Picks the next ready item and makes it active.
     *
     * <p>Does nothing while an item is active or the engine is paused. Otherwise stale request
     * deadlines are swept first; their ids are returned so the caller can expire the matching
     * reply slots outside the lock.</p>
     */
    public Dequeue beginDequeue(Duration staleThreshold) {
        lock.lock();
        try {
            if (active != null || paused) {
                return Dequeue.IDLE;
            }
            List<String> stale = sweepStaleLocked(staleThreshold);
            if (queue.isEmpty()) {
                return new Dequeue(null, stale);
            }

            QueueItem chosen = null;
            Iterator<QueueItem> it = queue.iterator();
            while (it.hasNext()) {
                QueueItem candidate = it.next();
                if (candidate.isFolder() || !isGatedLocked(candidate)) {
                    chosen = candidate;
                    it.remove();
                    break;
                }
            }
            if (chosen == null) {
                return new Dequeue(null, stale);
            }

            active = chosen;
            if (chosen.isFolder()) {
                pendingFolders.add(pathKey(chosen.getPath()));
            }
            return new Dequeue(chosen, stale);
        } finally {
            lock.unlock();
        }
    }

    public void pause() {
        lock.lock();
        try {
            paused = true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears the pause flag.
     *
     * @param shareId new session anchor, or null to keep the current one
     * @return true if processing should be triggered
     */
    public boolean resume(String shareId) {
        lock.lock();
        try {
            paused = false;
            if (shareId != null && !shareId.isBlank()) {
                sessionAnchor = shareId;
            }
            return active == null && !queue.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    /**
     * True when nothing is active, the engine is not paused and something is queued.
     */
    public boolean isIdleWithWork() {
        lock.lock();
        try {
            return active == null && !paused && !queue.isEmpty();
        } finally {
            lock.unlock();
        }
    }

    public void setSessionAnchor(String shareId) {
        lock.lock();
        try {
            this.sessionAnchor = shareId;
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> getSessionAnchor() {
        lock.lock();
        try {
            return Optional.ofNullable(sessionAnchor);
        } finally {
            lock.unlock();
        }
    }

    // ==================== Item entry & idempotency ====================

    public Entry enterFile(String id) {
        return enter(id, initializedFiles);
    }

    public Entry enterFolder(String id) {
        return enter(id, initializedFolders);
    }

    private Entry enter(String id, Set<String> initialized) {
        lock.lock();
        try {
            if (isTerminalLocked(id)) {
                return Entry.SKIP_TERMINAL;
            }
            return initialized.add(id) ? Entry.FRESH : Entry.REENTER;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a block completion notice.
     *
     * @return true if this (item, block key) pair had not been reported yet
     */
    public boolean markBlockNotified(String id, String blockKey) {
        lock.lock();
        try {
            return blockNotifications.computeIfAbsent(id, k -> new HashSet<>()).add(blockKey);
        } finally {
            lock.unlock();
        }
    }

    public boolean isBlockNotified(String id, String blockKey) {
        lock.lock();
        try {
            Set<String> keys = blockNotifications.get(id);
            return keys != null && keys.contains(blockKey);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true if finalization had not been reported for this id yet
     */
    public boolean markFinalizationSent(String id) {
        lock.lock();
        try {
            return finalizationsSent.add(id);
        } finally {
            lock.unlock();
        }
    }

    // ==================== Request tracking ====================

    public void recordRequestStarted(String id) {
        lock.lock();
        try {
            requestDeadlines.put(id, clock.instant());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records an inbound reply for {@code id} and clears its deadline.
     *
     * @return false if a reply for this id was already received
     */
    public boolean markResponseReceived(String id) {
        lock.lock();
        try {
            requestDeadlines.remove(id);
            return receivedResponses.add(id);
        } finally {
            lock.unlock();
        }
    }

    public void clearResponseTracking(String id) {
        lock.lock();
        try {
            requestDeadlines.remove(id);
            receivedResponses.remove(id);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of outstanding requests older than the threshold. Read-only, nothing is swept.
     */
    public int countStaleRequests(Duration staleThreshold) {
        lock.lock();
        try {
            Instant cutoff = clock.instant().minus(staleThreshold);
            int count = 0;
            for (Instant started : requestDeadlines.values()) {
                if (started.isBefore(cutoff)) {
                    count++;
                }
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    public boolean hasDeadline(String id) {
        lock.lock();
        try {
            return requestDeadlines.containsKey(id);
        } finally {
            lock.unlock();
        }
    }

    // ==================== Folder mapping ====================

    /**
     * Resolves a parent reference through the folder id map, falling back to the reference itself.
     */
    public String resolveParentId(String parentRef) {
        lock.lock();
        try {
            if (parentRef == null) {
                return null;
            }
            return folderIdMap.getOrDefault(parentRef, parentRef);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Maps a local folder path to its server id. Write-once: an existing mapping is kept.
     *
     * @return the mapping in effect after the call
     */
    public String mapFolder(Path path, String folderId) {
        lock.lock();
        try {
            String existing = folderIdMap.putIfAbsent(pathKey(path), folderId);
            return existing != null ? existing : folderId;
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> folderIdFor(Path path) {
        lock.lock();
        try {
            return Optional.ofNullable(folderIdMap.get(pathKey(path)));
        } finally {
            lock.unlock();
        }
    }

    public void markFolderPending(Path path) {
        lock.lock();
        try {
            pendingFolders.add(pathKey(path));
        } finally {
            lock.unlock();
        }
    }

    public boolean isFolderPending(Path path) {
        lock.lock();
        try {
            return pendingFolders.contains(pathKey(path));
        } finally {
            lock.unlock();
        }
    }

    public void releasePendingFolder(Path path) {
        lock.lock();
        try {
            pendingFolders.remove(pathKey(path));
        } finally {
            lock.unlock();
        }
    }

    // ==================== Negotiated parameters ====================

    public void cacheParameters(String id, UploadParameters parameters) {
        lock.lock();
        try {
            negotiated.put(id, parameters);
        } finally {
            lock.unlock();
        }
    }

    public Optional<UploadParameters> cachedParameters(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(negotiated.get(id));
        } finally {
            lock.unlock();
        }
    }

    // ==================== Active item transitions ====================

    public ActiveCheck checkActive(String id) {
        lock.lock();
        try {
            if (active == null || !active.getId().equals(id)) {
                return ActiveCheck.CANCELLED;
            }
            return paused ? ActiveCheck.PAUSED : ActiveCheck.CONTINUE;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Puts the active item back at the head of the queue so it is continued on resume.
     *
     * @return false if {@code id} is no longer active
     */
    public boolean suspendActive(String id) {
        lock.lock();
        try {
            if (active == null || !active.getId().equals(id)) {
                return false;
            }
            queue.addFirst(active);
            active = null;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears the active slot if it still holds {@code id}, without changing its outcome.
     */
    public void releaseActive(String id) {
        lock.lock();
        try {
            if (active != null && active.getId().equals(id)) {
                active = null;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks a folder completed and releases its pending entry.
     *
     * @return false if the folder had already reached a terminal state
     */
    public boolean completeFolder(QueueItem folder) {
        lock.lock();
        try {
            pendingFolders.remove(pathKey(folder.getPath()));
            return completeLocked(folder.getId());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks a file completed once the orchestration service confirmed finalization.
     *
     * @return false if the file had already reached a terminal state
     */
    public boolean completeFile(String id) {
        lock.lock();
        try {
            queue.removeIf(item -> item.getId().equals(id));
            return completeLocked(id);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a failure. The first reason recorded for an id wins.
     *
     * @return false if the id had already reached a terminal state
     */
    public boolean fail(String id, String reason) {
        lock.lock();
        try {
            return failLocked(id, reason);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels one queued or active item.
     */
    public Optional<QueueItem> cancel(String id) {
        lock.lock();
        try {
            QueueItem item = null;
            if (active != null && active.getId().equals(id)) {
                item = active;
            } else {
                for (QueueItem queued : queue) {
                    if (queued.getId().equals(id)) {
                        item = queued;
                        break;
                    }
                }
            }
            if (item == null || !failLocked(id, CANCELLED_REASON)) {
                return Optional.empty();
            }
            return Optional.of(item);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the active item and everything queued, then clears pending folders and block tracking.
     */
    public List<QueueItem> cancelAll() {
        lock.lock();
        try {
            List<QueueItem> cancelled = new ArrayList<>();
            if (active != null) {
                cancelled.add(active);
            }
            cancelled.addAll(queue);
            for (QueueItem item : cancelled) {
                failLocked(item.getId(), CANCELLED_REASON);
            }
            queue.clear();
            active = null;
            pendingFolders.clear();
            blockNotifications.clear();
            return cancelled;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Administrative sweep: fails every item whose outstanding request is older than the
     * threshold, clears its tracking and releases its pending folder.
     *
     * @return the swept items, in deadline order
     */
    public List<StaleRequest> purgeStaleRequests(Duration staleThreshold) {
        lock.lock();
        try {
            List<StaleRequest> purged = new ArrayList<>();
            for (String id : sweepStaleLocked(staleThreshold)) {
                QueueItem item = itemsById.get(id);
                if (item != null && item.isFolder()) {
                    pendingFolders.remove(pathKey(item.getPath()));
                }
                if (failLocked(id, TIMED_OUT_REASON)) {
                    purged.add(new StaleRequest(id, item));
                }
            }
            return purged;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops pending folder entries that have no matching queued or active folder.
     *
     * @return the number of entries removed
     */
    public int repairPendingFolders() {
        lock.lock();
        try {
            Set<String> live = new HashSet<>();
            if (active != null && active.isFolder()) {
                live.add(pathKey(active.getPath()));
            }
            for (QueueItem item : queue) {
                if (item.isFolder()) {
                    live.add(pathKey(item.getPath()));
                }
            }
            int before = pendingFolders.size();
            pendingFolders.retainAll(live);
            return before - pendingFolders.size();
        } finally {
            lock.unlock();
        }
    }

    // ==================== Queries ====================

    public Optional<QueueItem> findItem(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(itemsById.get(id));
        } finally {
            lock.unlock();
        }
    }

    public Optional<QueueItem> getActive() {
        lock.lock();
        try {
            return Optional.ofNullable(active);
        } finally {
            lock.unlock();
        }
    }

    public Optional<String> failureReason(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(failed.get(id));
        } finally {
            lock.unlock();
        }
    }

    public boolean isTerminal(String id) {
        lock.lock();
        try {
            return isTerminalLocked(id);
        } finally {
            lock.unlock();
        }
    }

    public Membership membershipOf(String id) {
        lock.lock();
        try {
            if (active != null && active.getId().equals(id)) {
                return Membership.ACTIVE;
            }
            if (completed.contains(id)) {
                return Membership.COMPLETED;
            }
            if (failed.containsKey(id)) {
                return Membership.FAILED;
            }
            for (QueueItem item : queue) {
                if (item.getId().equals(id)) {
                    return Membership.QUEUED;
                }
            }
            return Membership.UNKNOWN;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of collections an id appears in. Always 0 or 1 outside a transition.
     */
    public int membershipCount(String id) {
        lock.lock();
        try {
            int count = 0;
            if (active != null && active.getId().equals(id)) count++;
            if (completed.contains(id)) count++;
            if (failed.containsKey(id)) count++;
            for (QueueItem item : queue) {
                if (item.getId().equals(id)) count++;
            }
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * True if any per-id tracking entry remains for {@code id}.
     */
    public boolean hasTracking(String id) {
        lock.lock();
        try {
            return initializedFiles.contains(id)
                    || initializedFolders.contains(id)
                    || receivedResponses.contains(id)
                    || finalizationsSent.contains(id)
                    || blockNotifications.containsKey(id)
                    || requestDeadlines.containsKey(id)
                    || negotiated.containsKey(id);
        } finally {
            lock.unlock();
        }
    }

    public List<QueueItem> queuedItems() {
        lock.lock();
        try {
            return List.copyOf(queue);
        } finally {
            lock.unlock();
        }
    }

    public QueueStatus status() {
        lock.lock();
        try {
            return statusLocked();
        } finally {
            lock.unlock();
        }
    }

    public DetailedQueueStatus detailedStatus() {
        lock.lock();
        try {
            int blockCount = blockNotifications.values().stream().mapToInt(Set::size).sum();
            return new DetailedQueueStatus(
                    statusLocked(),
                    List.copyOf(queue),
                    List.copyOf(pendingFolders),
                    Map.copyOf(folderIdMap),
                    initializedFiles.size(),
                    initializedFolders.size(),
                    blockCount,
                    requestDeadlines.size());
        } finally {
            lock.unlock();
        }
    }

    // ==================== Internals (lock held) ====================

    private QueueStatus statusLocked() {
        return new QueueStatus(
                queue.size(),
                active != null ? active.getId() : null,
                completed.size(),
                failed.size(),
                paused,
                Duration.between(startTime, clock.instant()).toSeconds(),
                pendingFolders.size());
    }

    private boolean isGatedLocked(QueueItem file) {
        Path parent = file.getParentPath();
        return parent != null && pendingFolders.contains(pathKey(parent));
    }

    private boolean isTerminalLocked(String id) {
        return completed.contains(id) || failed.containsKey(id);
    }

    private boolean completeLocked(String id) {
        if (isTerminalLocked(id)) {
            return false;
        }
        if (active != null && active.getId().equals(id)) {
            active = null;
        }
        completed.add(id);
        clearTrackingLocked(id);
        return true;
    }

    private boolean failLocked(String id, String reason) {
        if (isTerminalLocked(id)) {
            return false;
        }
        queue.removeIf(item -> item.getId().equals(id));
        if (active != null && active.getId().equals(id)) {
            active = null;
        }
        failed.put(id, reason);
        clearTrackingLocked(id);

        QueueItem item = itemsById.get(id);
        if (item != null && item.isFolder()) {
            pendingFolders.remove(pathKey(item.getPath()));
        }
        return true;
    }

    private void clearTrackingLocked(String id) {
        initializedFiles.remove(id);
        initializedFolders.remove(id);
        receivedResponses.remove(id);
        finalizationsSent.remove(id);
        blockNotifications.remove(id);
        requestDeadlines.remove(id);
        negotiated.remove(id);
    }

    private List<String> sweepStaleLocked(Duration threshold) {
        Instant cutoff = clock.instant().minus(threshold);
        List<String> stale = new ArrayList<>();
        Iterator<Map.Entry<String, Instant>> it = requestDeadlines.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Instant> entry = it.next();
            if (entry.getValue().isBefore(cutoff)) {
                stale.add(entry.getKey());
                receivedResponses.remove(entry.getKey());
                it.remove();
            }
        }
        return stale;
    }

    private static String pathKey(Path path) {
        return path.toAbsolutePath().normalize().toString();
    }

    /**
     * Outcome of {@link #beginDequeue}: the item made active (or null) and the ids whose
     * requests were found stale.
     */
    public record Dequeue(QueueItem item, List<String> staleIds) {
        static final Dequeue IDLE = new Dequeue(null, List.of());

        public boolean hasItem() {
            return item != null;
        }
    }

    /**
     * An item removed by the administrative stale sweep. {@code item} is null for ids the
     * state never saw queued.
     */
    public record StaleRequest(String id, QueueItem item) {
        public String name() {
            return item != null ? item.getName() : "Unknown";
        }
    }
}
