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


import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 hashing for whole-file content and individual encrypted blocks.
 *
 * <p>The pipeline keeps one running instance per file over the plaintext and uses
 * {@link #sha256Hex(byte[])} for each block's ciphertext.</p>
 */
public class ChecksumCalculator {
    private static final String ALGORITHM = "SHA-256";
    private static final int BUFFER_SIZE = 8192;

    private final MessageDigest digest;

    public ChecksumCalculator() {
        this.digest = newDigest();
    }

    /**
     * Update the running hash with a portion of data
     */
    public void update(byte[] data, int offset, int length) {
        digest.update(data, offset, length);
    }

    /**
     * Get the final checksum as a hexadecimal string. Resets the running hash.
     */
    public String getChecksum() {
        return bytesToHex(digest.digest());
    }

    /**
     * Hash a single buffer, used for encrypted blocks and thumbnails
     */
    public static String sha256Hex(byte[] data) {
        return bytesToHex(newDigest().digest(data));
    }

    /**
     * Calculate checksum for an entire file
     */
    public static String calculateFileChecksum(Path filePath) throws IOException {
        MessageDigest fileDigest = newDigest();
        try (InputStream inputStream = Files.newInputStream(filePath)) {
            byte[] buffer = new byte[BUFFER_SIZE];
            int bytesRead;

            while ((bytesRead = inputStream.read(buffer)) != -1) {
                fileDigest.update(buffer, 0, bytesRead);
            }
        }
        return bytesToHex(fileDigest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unsupported checksum algorithm: " + ALGORITHM, e);
        }
    }

    /**
     * Convert byte array to lowercase hexadecimal string
     */
    static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }

    @Override
    public String toString() {
        return "ChecksumCalculator{algorithm='" + ALGORITHM + "'}";
    }
}
