package dev.mars.cirrus.storage;

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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class FileInspectorTest {

    @TempDir
    Path tempDir;

    private final FileInspector inspector = new FileInspector(1024);

    @Test
    void testBasicMetadata() throws IOException {
        Path file = tempDir.resolve("notes.txt");
        Files.writeString(file, "hello");
        Instant modified = Instant.parse("2025-06-01T12:00:00Z");
        Files.setLastModifiedTime(file, FileTime.from(modified));

        FileInspector.FileMetadata metadata = inspector.inspect(file);

        assertEquals(5, metadata.size());
        assertEquals(modified.getEpochSecond(), metadata.modifiedEpochSeconds());
        assertThat(metadata.mimeType()).startsWith("text/");
        assertFalse(metadata.thumbnailEligible());
    }

    @Test
    void testSmallImageIsThumbnailEligible() throws IOException {
        Path image = tempDir.resolve("photo.png");
        Files.write(image, new byte[100]);

        FileInspector.FileMetadata metadata = inspector.inspect(image);

        assertEquals("image/png", metadata.mimeType());
        assertTrue(metadata.thumbnailEligible());
    }

    @Test
    void testLargeImageIsNotThumbnailEligible() throws IOException {
        Path image = tempDir.resolve("poster.png");
        Files.write(image, new byte[2048]);

        assertFalse(inspector.inspect(image).thumbnailEligible());
    }

    @Test
    void testUnknownExtensionFallsBackToOctetStream() {
        assertEquals(FileInspector.DEFAULT_MIME_TYPE, FileInspector.detectMimeType(tempDir.resolve("blob.cirrusunknown")));
        assertEquals(FileInspector.DEFAULT_MIME_TYPE, FileInspector.detectMimeType(tempDir.resolve("noextension")));
    }

    @Test
    void testMissingFile() {
        assertThrows(IOException.class, () -> inspector.inspect(tempDir.resolve("missing.txt")));
    }
}
