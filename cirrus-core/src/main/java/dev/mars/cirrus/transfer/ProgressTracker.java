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


import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Tracks upload progress of one file with a rolling-window speed and an ETA estimate.
 *
 * <p>Each completed block contributes one instantaneous speed sample
 * ({@code blockBytes / blockElapsed}); the reported speed is the mean of the last
 * {@code windowSize} samples. Below {@value #MIN_MEANINGFUL_SPEED} B/s the estimate falls
 * back to a fixed value.</p>
 *
 * <p>Used from the scheduler thread only, not thread-safe.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-17
 * @version 2.0
 */
public class ProgressTracker {

    static final double MIN_MEANINGFUL_SPEED = 0.1;

    private final String itemId;
    private final long totalBytes;
    private final int windowSize;
    private final long fallbackRemainingSeconds;
    private final Deque<Double> samples = new ArrayDeque<>();

    private long transferredBytes;
    private int completedBlocks;

    public ProgressTracker(String itemId, long totalBytes, int windowSize, long fallbackRemainingSeconds) {
        this.itemId = itemId;
        this.totalBytes = totalBytes;
        this.windowSize = Math.max(1, windowSize);
        this.fallbackRemainingSeconds = fallbackRemainingSeconds;
    }

    public String getItemId() {
        return itemId;
    }

    /**
     * Records a finished block.
     *
     * @param blockBytes plaintext size of the block
     * @param elapsed    wall time since the previous block finished
     */
    public void recordBlock(long blockBytes, Duration elapsed) {
        double seconds = elapsed.toNanos() / 1_000_000_000.0;
        if (seconds > 0) {
            samples.addLast(blockBytes / seconds);
            while (samples.size() > windowSize) {
                samples.removeFirst();
            }
        }
        transferredBytes += blockBytes;
        completedBlocks++;
    }

    /**
     * Counts a block that was uploaded before the transfer was paused. It adds bytes but
     * no speed sample.
     */
    public void skipBlock(long blockBytes) {
        transferredBytes += blockBytes;
        completedBlocks++;
    }

    public long getTotalBytes() {
        return totalBytes;
    }

    public long getTransferredBytes() {
        return transferredBytes;
    }

    public int getCompletedBlocks() {
        return completedBlocks;
    }

    public double getProgress() {
        if (totalBytes <= 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) transferredBytes / totalBytes);
    }

    /**
     * Mean of the speed samples in the window, in bytes per second. 0 before the first sample.
     */
    public double getSpeedBytesPerSecond() {
        if (samples.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (double sample : samples) {
            sum += sample;
        }
        return sum / samples.size();
    }

    public long getEstimatedRemainingSeconds() {
        double speed = getSpeedBytesPerSecond();
        if (speed <= MIN_MEANINGFUL_SPEED) {
            return fallbackRemainingSeconds;
        }
        long remaining = Math.max(0, totalBytes - transferredBytes);
        return (long) (remaining / speed);
    }

    public int getSampleCount() {
        return samples.size();
    }

    public String getEstimatedRemainingTime() {
        long seconds = getEstimatedRemainingSeconds();
        if (seconds < 60) {
            return seconds + "s";
        } else if (seconds < 3600) {
            return (seconds / 60) + "m " + (seconds % 60) + "s";
        } else {
            long hours = seconds / 3600;
            long minutes = (seconds % 3600) / 60;
            return hours + "h " + minutes + "m";
        }
    }

    @Override
    public String toString() {
        return String.format("ProgressTracker{itemId='%s', progress=%.1f%%, rate=%.2f MB/s, ETA=%s}",
                itemId,
                getProgress() * 100,
                getSpeedBytesPerSecond() / (1024.0 * 1024.0),
                getEstimatedRemainingTime());
    }
}
