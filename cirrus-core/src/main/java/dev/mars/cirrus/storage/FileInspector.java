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


import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.UserDefinedFileAttributeView;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Collects the metadata sent with an upload initialization request.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class FileInspector {

    private static final Logger logger = LoggerFactory.getLogger(FileInspector.class);

    public static final String DEFAULT_MIME_TYPE = "application/octet-stream";

    private static final Map<String, String> MIME_BY_EXTENSION = Map.ofEntries(
            Map.entry("jpg", "image/jpeg"),
            Map.entry("jpeg", "image/jpeg"),
            Map.entry("png", "image/png"),
            Map.entry("gif", "image/gif"),
            Map.entry("bmp", "image/bmp"),
            Map.entry("webp", "image/webp"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("pdf", "application/pdf"),
            Map.entry("txt", "text/plain"),
            Map.entry("csv", "text/csv"),
            Map.entry("json", "application/json"),
            Map.entry("xml", "application/xml"),
            Map.entry("html", "text/html"),
            Map.entry("zip", "application/zip"),
            Map.entry("mp3", "audio/mpeg"),
            Map.entry("mp4", "video/mp4"),
            Map.entry("mov", "video/quicktime"),
            Map.entry("doc", "application/msword"),
            Map.entry("docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
            Map.entry("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet")
    );

    private final long thumbnailMaxSourceBytes;

    public FileInspector(long thumbnailMaxSourceBytes) {
        this.thumbnailMaxSourceBytes = thumbnailMaxSourceBytes;
    }

    /**
     * Reads size, timestamps, MIME type and extended attribute names of a regular file.
     *
     * @throws IOException if the basic attributes cannot be read
     */
    public FileMetadata inspect(Path path) throws IOException {
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class);
        long size = attrs.size();
        long modifiedSeconds = attrs.lastModifiedTime().toInstant().getEpochSecond();
        String mimeType = detectMimeType(path);
        boolean thumbnailEligible = mimeType.startsWith("image/") && size < thumbnailMaxSourceBytes;
        return new FileMetadata(size, mimeType, modifiedSeconds, readExtendedAttributes(path), thumbnailEligible);
    }

    /**
     * Probes the platform first, then falls back to the extension table.
     */
    public static String detectMimeType(Path path) {
        try {
            String probed = Files.probeContentType(path);
            if (probed != null && !probed.isBlank()) {
                return probed;
            }
        } catch (IOException e) {
            logger.debug("Content type probe failed for {}: {}", path, e.getMessage());
        }

        String fileName = path.getFileName() != null ? path.getFileName().toString() : "";
        int dot = fileName.lastIndexOf('.');
        if (dot >= 0 && dot < fileName.length() - 1) {
            String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
            return MIME_BY_EXTENSION.getOrDefault(extension, DEFAULT_MIME_TYPE);
        }
        return DEFAULT_MIME_TYPE;
    }

    /**
     * Comma-joined names of user-defined attributes, or null when there are none
     * or the file system does not support them.
     */
    static String readExtendedAttributes(Path path) {
        try {
            UserDefinedFileAttributeView view = Files.getFileAttributeView(
                    path, UserDefinedFileAttributeView.class, LinkOption.NOFOLLOW_LINKS);
            if (view == null) {
                return null;
            }
            List<String> names = view.list();
            return names.isEmpty() ? null : String.join(", ", names);
        } catch (IOException | UnsupportedOperationException | SecurityException e) {
            logger.debug("Extended attributes unavailable for {}: {}", path, e.getMessage());
            return null;
        }
    }

    /**
     * Snapshot of the file attributes the pipeline needs.
     */
    public record FileMetadata(long size, String mimeType, long modifiedEpochSeconds,
                               String extendedAttributes, boolean thumbnailEligible) {
    }
}
