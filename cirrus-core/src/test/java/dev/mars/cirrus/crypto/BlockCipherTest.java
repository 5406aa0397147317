package dev.mars.cirrus.crypto;

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

import dev.mars.cirrus.core.exceptions.EncryptionException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class BlockCipherTest {

    private static final byte[] KEY = new byte[BlockCipher.KEY_LENGTH_BYTES];

    static {
        for (int i = 0; i < KEY.length; i++) {
            KEY[i] = (byte) (i * 7 + 3);
        }
    }

    @Test
    void testBlockRoundTrip() throws Exception {
        BlockCipher cipher = new BlockCipher("t-1", KEY);
        byte[] plaintext = "block contents".getBytes(StandardCharsets.UTF_8);

        byte[] ciphertext = cipher.encryptBlock(3, plaintext, plaintext.length);

        assertEquals(plaintext.length + BlockCipher.TAG_LENGTH_BYTES, ciphertext.length);
        assertArrayEquals(plaintext, cipher.decryptBlock(3, ciphertext));
    }

    @Test
    void testEncryptsOnlyRequestedLength() throws Exception {
        BlockCipher cipher = new BlockCipher("t-1", KEY);
        byte[] buffer = new byte[64];
        Arrays.fill(buffer, (byte) 'x');

        byte[] ciphertext = cipher.encryptBlock(0, buffer, 10);

        assertEquals(10 + BlockCipher.TAG_LENGTH_BYTES, ciphertext.length);
        assertArrayEquals(Arrays.copyOf(buffer, 10), cipher.decryptBlock(0, ciphertext));
    }

    @Test
    void testWrongIndexFailsAuthentication() throws Exception {
        BlockCipher cipher = new BlockCipher("t-1", KEY);
        byte[] plaintext = "data".getBytes(StandardCharsets.UTF_8);
        byte[] ciphertext = cipher.encryptBlock(1, plaintext, plaintext.length);

        assertThrows(EncryptionException.class, () -> cipher.decryptBlock(2, ciphertext));
    }

    @Test
    void testSameBlockEncryptsDeterministically() throws Exception {
        BlockCipher cipher = new BlockCipher("t-1", KEY);
        byte[] plaintext = "repeat".getBytes(StandardCharsets.UTF_8);

        assertArrayEquals(cipher.encryptBlock(5, plaintext, plaintext.length),
                cipher.encryptBlock(5, plaintext, plaintext.length));
    }

    @Test
    void testBlockNonceLayout() {
        byte[] nonce = BlockCipher.blockNonce(258);

        assertEquals(BlockCipher.NONCE_LENGTH_BYTES, nonce.length);
        // big-endian index in the first 8 bytes, zero padding after
        assertArrayEquals(new byte[]{0, 0, 0, 0, 0, 0, 1, 2, 0, 0, 0, 0}, nonce);
    }

    @Test
    void testNegativeIndexRejected() {
        assertThrows(IllegalArgumentException.class, () -> BlockCipher.blockNonce(-1));
    }

    @Test
    void testLegacyThumbnailNonceMatchesFirstBlock() {
        assertArrayEquals(BlockCipher.blockNonce(0), BlockCipher.thumbnailNonce(ThumbnailNoncePolicy.LEGACY_ZERO));
    }

    @Test
    void testReservedThumbnailNonceNeverMatchesABlock() {
        byte[] reserved = BlockCipher.thumbnailNonce(ThumbnailNoncePolicy.RESERVED);

        for (long index : new long[]{0, 1, 255, 65_536, Long.MAX_VALUE}) {
            assertFalse(Arrays.equals(reserved, BlockCipher.blockNonce(index)), "collides with block " + index);
        }
    }

    @Test
    void testThumbnailRoundTrip() throws Exception {
        BlockCipher cipher = new BlockCipher("t-1", KEY);
        byte[] jpeg = {(byte) 0xFF, (byte) 0xD8, 1, 2, 3};

        byte[] encrypted = cipher.encryptThumbnail(ThumbnailNoncePolicy.RESERVED, jpeg);

        assertArrayEquals(jpeg, cipher.decryptThumbnail(ThumbnailNoncePolicy.RESERVED, encrypted));
        assertThrows(EncryptionException.class,
                () -> cipher.decryptThumbnail(ThumbnailNoncePolicy.LEGACY_ZERO, encrypted));
    }

    @Test
    void testKeyLengthIsChecked() {
        EncryptionException e = assertThrows(EncryptionException.class, () -> new BlockCipher("t-1", new byte[16]));
        assertTrue(e.getReason().contains("expected 32 bytes, got 16"));
    }

    @Test
    void testBase64Key() throws Exception {
        String encoded = Base64.getEncoder().encodeToString(KEY);
        BlockCipher cipher = BlockCipher.fromBase64Key("t-1", encoded);
        byte[] plaintext = {42};

        assertArrayEquals(plaintext, new BlockCipher("t-1", KEY).decryptBlock(0,
                cipher.encryptBlock(0, plaintext, 1)));

        assertThrows(EncryptionException.class, () -> BlockCipher.fromBase64Key("t-1", "not base64!"));
        assertThrows(EncryptionException.class, () -> BlockCipher.fromBase64Key("t-1", null));
    }

    @Test
    void testPolicyPropertyValues() {
        assertEquals(ThumbnailNoncePolicy.RESERVED, ThumbnailNoncePolicy.fromPropertyValue("reserved"));
        assertEquals(ThumbnailNoncePolicy.LEGACY_ZERO, ThumbnailNoncePolicy.fromPropertyValue("legacy-zero"));
        assertThrows(IllegalArgumentException.class, () -> ThumbnailNoncePolicy.fromPropertyValue("random"));
    }
}
