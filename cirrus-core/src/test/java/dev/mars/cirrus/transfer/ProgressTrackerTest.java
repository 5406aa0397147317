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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ProgressTrackerTest {

    private static final long MIB = 1024 * 1024;

    private ProgressTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new ProgressTracker("item-1", 10 * MIB, 5, 3600);
    }

    @Test
    void testInitialState() {
        assertEquals("item-1", tracker.getItemId());
        assertEquals(0.0, tracker.getProgress(), 0.0001);
        assertEquals(0.0, tracker.getSpeedBytesPerSecond(), 0.0001);
        assertEquals(3600, tracker.getEstimatedRemainingSeconds());
        assertEquals("1h 0m", tracker.getEstimatedRemainingTime());
    }

    @Test
    void testRecordBlock() {
        tracker.recordBlock(4 * MIB, Duration.ofSeconds(2));

        assertEquals(4 * MIB, tracker.getTransferredBytes());
        assertEquals(1, tracker.getCompletedBlocks());
        assertEquals(0.4, tracker.getProgress(), 0.0001);
        assertEquals(2 * MIB, tracker.getSpeedBytesPerSecond(), 0.0001);
        assertEquals(3, tracker.getEstimatedRemainingSeconds());
    }

    @Test
    void testSpeedIsMeanOfLastFiveSamples() {
        ProgressTracker big = new ProgressTracker("item-2", 100 * MIB, 5, 3600);
        big.recordBlock(MIB, Duration.ofMillis(100));   // 10 MiB/s, falls out of the window
        for (int i = 0; i < 5; i++) {
            big.recordBlock(MIB, Duration.ofSeconds(1));  // 1 MiB/s
        }

        assertEquals(5, big.getSampleCount());
        assertEquals(MIB, big.getSpeedBytesPerSecond(), 0.0001);
    }

    @Test
    void testSkippedBlocksAddBytesButNoSample() {
        tracker.skipBlock(4 * MIB);

        assertEquals(4 * MIB, tracker.getTransferredBytes());
        assertEquals(1, tracker.getCompletedBlocks());
        assertEquals(0, tracker.getSampleCount());
        assertEquals(3600, tracker.getEstimatedRemainingSeconds());
    }

    @Test
    void testZeroElapsedTimeAddsNoSample() {
        tracker.recordBlock(MIB, Duration.ZERO);

        assertEquals(0, tracker.getSampleCount());
        assertEquals(MIB, tracker.getTransferredBytes());
    }

    @Test
    void testNegligibleSpeedUsesFallback() {
        tracker.recordBlock(1, Duration.ofSeconds(100)); // 0.01 B/s

        assertEquals(3600, tracker.getEstimatedRemainingSeconds());
    }

    @Test
    void testProgressIsCapped() {
        tracker.recordBlock(11 * MIB, Duration.ofSeconds(1));

        assertEquals(1.0, tracker.getProgress(), 0.0001);
        assertEquals(0, tracker.getEstimatedRemainingSeconds());
    }

    @Test
    void testFormattedRemainingTime() {
        ProgressTracker shortJob = new ProgressTracker("s", 100, 5, 42);
        assertEquals("42s", shortJob.getEstimatedRemainingTime());

        ProgressTracker mediumJob = new ProgressTracker("m", 100, 5, 125);
        assertEquals("2m 5s", mediumJob.getEstimatedRemainingTime());
    }
}
