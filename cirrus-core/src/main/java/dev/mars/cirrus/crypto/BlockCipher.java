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

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.util.Base64;

/**
 * AES-256-GCM encryption of file blocks and thumbnails under a negotiated content key.
 *
 * <p>Output is the ciphertext followed by the 16 byte authentication tag, so an
 * encrypted block is always {@link #TAG_LENGTH_BYTES} longer than its plaintext.</p>
 *
 * <h3>Nonce layout:</h3>
 * <pre>
 * block i:   [ i as 8 byte big-endian ][ 00 00 00 00 ]
 * thumbnail: [ 00 x 12 ]                      (legacy-zero)
 *            [ 00 x 8 ][ FF FF FF FF ]        (reserved)
 * </pre>
 *
 * <p>A fresh {@link Cipher} is obtained for every operation, so instances can be shared.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class BlockCipher {

    public static final String TRANSFORMATION = "AES/GCM/NoPadding";
    public static final int KEY_LENGTH_BYTES = 32;
    public static final int NONCE_LENGTH_BYTES = 12;
    public static final int TAG_LENGTH_BYTES = 16;

    private final String transferId;
    private final SecretKeySpec key;

    public BlockCipher(String transferId, byte[] rawKey) throws EncryptionException {
        this.transferId = transferId;
        if (rawKey == null || rawKey.length != KEY_LENGTH_BYTES) {
            throw new EncryptionException(transferId,
                    "Invalid encryption key length: expected " + KEY_LENGTH_BYTES + " bytes, got "
                            + (rawKey == null ? 0 : rawKey.length));
        }
        this.key = new SecretKeySpec(rawKey, "AES");
    }

    /**
     * Decodes a base64 content key and builds a cipher for it.
     */
    public static BlockCipher fromBase64Key(String transferId, String base64Key) throws EncryptionException {
        byte[] raw;
        try {
            raw = Base64.getDecoder().decode(base64Key == null ? "" : base64Key.trim());
        } catch (IllegalArgumentException e) {
            throw new EncryptionException(transferId, "Failed to decode encryption key", e);
        }
        return new BlockCipher(transferId, raw);
    }

    public byte[] encryptBlock(long index, byte[] plaintext, int length) throws EncryptionException {
        return encrypt(blockNonce(index), plaintext, length);
    }

    public byte[] encryptThumbnail(ThumbnailNoncePolicy policy, byte[] plaintext) throws EncryptionException {
        return encrypt(thumbnailNonce(policy), plaintext, plaintext.length);
    }

    public byte[] decryptBlock(long index, byte[] ciphertext) throws EncryptionException {
        return decrypt(blockNonce(index), ciphertext);
    }

    public byte[] decryptThumbnail(ThumbnailNoncePolicy policy, byte[] ciphertext) throws EncryptionException {
        return decrypt(thumbnailNonce(policy), ciphertext);
    }

    public static byte[] blockNonce(long index) {
        if (index < 0) {
            throw new IllegalArgumentException("Block index cannot be negative: " + index);
        }
        return ByteBuffer.allocate(NONCE_LENGTH_BYTES).putLong(index).array();
    }

    public static byte[] thumbnailNonce(ThumbnailNoncePolicy policy) {
        byte[] nonce = new byte[NONCE_LENGTH_BYTES];
        if (policy == ThumbnailNoncePolicy.RESERVED) {
            for (int i = Long.BYTES; i < NONCE_LENGTH_BYTES; i++) {
                nonce[i] = (byte) 0xFF;
            }
        }
        return nonce;
    }

    private byte[] encrypt(byte[] nonce, byte[] plaintext, int length) throws EncryptionException {
        try {
            // GCM providers refuse to re-init one Cipher with a (key, nonce) pair it just used
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BYTES * 8, nonce));
            return cipher.doFinal(plaintext, 0, length);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException(transferId, "Encryption failed: " + e.getMessage(), e);
        }
    }

    private byte[] decrypt(byte[] nonce, byte[] ciphertext) throws EncryptionException {
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH_BYTES * 8, nonce));
            return cipher.doFinal(ciphertext);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException(transferId, "Decryption failed: " + e.getMessage(), e);
        }
    }
}
