package dev.flyzex.bot.security;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import javax.crypto.Cipher;
import javax.crypto.Mac;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Arrays;
import java.util.Base64;

/**
 * Authenticated symmetric encryption of the state snapshot.
 *
 * <p>
 * Tokens use the Fernet layout so snapshots written by earlier deployments stay
 * readable:
 *
 * <pre>
 * 0x80 | timestamp (8, big-endian seconds) | IV (16) | AES-128-CBC ciphertext | HMAC-SHA256 (32)
 * </pre>
 *
 * encoded as URL-safe base64. The key is the URL-safe base64 form of 32 bytes:
 * the first half signs, the second half encrypts.
 *
 * <p>
 * The MAC is verified before anything is decrypted, so a wrong key or a
 * corrupted file never yields plaintext. A new {@link Cipher} and {@link Mac}
 * are created per call, which makes instances safe for concurrent use.
 */
public class StateCipher {

    private static final byte VERSION = (byte) 0x80;
    private static final int KEY_LENGTH = 32;
    private static final int HALF_KEY_LENGTH = 16;
    private static final int TIMESTAMP_LENGTH = 8;
    private static final int IV_LENGTH = 16;
    private static final int HMAC_LENGTH = 32;
    private static final int BLOCK_SIZE = 16;
    private static final int HEADER_LENGTH = 1 + TIMESTAMP_LENGTH + IV_LENGTH;
    private static final int MIN_TOKEN_LENGTH = HEADER_LENGTH + BLOCK_SIZE + HMAC_LENGTH;
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String AES_ALGORITHM = "AES";
    private static final String AES_TRANSFORMATION = "AES/CBC/PKCS5Padding";
    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final byte[] signingKey;
    private final byte[] encryptionKey;
    private final Clock clock;

    /**
     * @param key
     *            URL-safe base64 encoding of a 32-byte key
     * @throws IllegalArgumentException
     *             if the key is not valid base64 or has the wrong length
     */
    public StateCipher(String key) {
        this(key, Clock.systemUTC());
    }

    StateCipher(String key, Clock clock) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Encryption key must not be empty");
        }
        byte[] raw;
        try {
            raw = Base64.getUrlDecoder().decode(key.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Encryption key must be URL-safe base64", e);
        }
        if (raw.length != KEY_LENGTH) {
            throw new IllegalArgumentException(
                    "Encryption key must decode to " + KEY_LENGTH + " bytes, got " + raw.length);
        }
        this.signingKey = Arrays.copyOfRange(raw, 0, HALF_KEY_LENGTH);
        this.encryptionKey = Arrays.copyOfRange(raw, HALF_KEY_LENGTH, KEY_LENGTH);
        this.clock = clock;
    }

    /**
     * Generates a fresh random key in the format accepted by the constructor.
     */
    public static String generateKey() {
        byte[] raw = new byte[KEY_LENGTH];
        SECURE_RANDOM.nextBytes(raw);
        return Base64.getUrlEncoder().encodeToString(raw);
    }

    public byte[] encrypt(byte[] plaintext) {
        byte[] iv = new byte[IV_LENGTH];
        SECURE_RANDOM.nextBytes(iv);
        return encrypt(plaintext, iv, clock.instant().getEpochSecond());
    }

    byte[] encrypt(byte[] plaintext, byte[] iv, long timestampSeconds) {
        try {
            Cipher cipher = Cipher.getInstance(AES_TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(encryptionKey, AES_ALGORITHM),
                    new IvParameterSpec(iv));
            byte[] ciphertext = cipher.doFinal(plaintext);

            ByteBuffer buffer = ByteBuffer.allocate(HEADER_LENGTH + ciphertext.length + HMAC_LENGTH);
            buffer.put(VERSION);
            buffer.putLong(timestampSeconds);
            buffer.put(iv);
            buffer.put(ciphertext);
            byte[] signed = Arrays.copyOf(buffer.array(), buffer.position());
            buffer.put(sign(signed));

            return Base64.getUrlEncoder().encode(buffer.array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to encrypt state payload", e);
        }
    }

    /**
     * Decrypts and authenticates a token.
     *
     * @throws StateDecryptionException
     *             if the token is malformed, was produced with another key, or
     *             has been altered
     */
    public byte[] decrypt(byte[] token) {
        byte[] data;
        try {
            String text = new String(token, StandardCharsets.US_ASCII).trim();
            data = Base64.getUrlDecoder().decode(text);
        } catch (IllegalArgumentException e) {
            throw new StateDecryptionException("Token is not valid base64", e);
        }
        if (data.length < MIN_TOKEN_LENGTH) {
            throw new StateDecryptionException("Token is too short");
        }
        if (data[0] != VERSION) {
            throw new StateDecryptionException("Unsupported token version");
        }
        if ((data.length - HEADER_LENGTH - HMAC_LENGTH) % BLOCK_SIZE != 0) {
            throw new StateDecryptionException("Ciphertext is not block aligned");
        }

        int macOffset = data.length - HMAC_LENGTH;
        byte[] signed = Arrays.copyOfRange(data, 0, macOffset);
        byte[] mac = Arrays.copyOfRange(data, macOffset, data.length);
        try {
            if (!MessageDigest.isEqual(sign(signed), mac)) {
                throw new StateDecryptionException("Signature mismatch; wrong key or corrupted data");
            }
            byte[] iv = Arrays.copyOfRange(data, 1 + TIMESTAMP_LENGTH, HEADER_LENGTH);
            Cipher cipher = Cipher.getInstance(AES_TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(encryptionKey, AES_ALGORITHM),
                    new IvParameterSpec(iv));
            return cipher.doFinal(data, HEADER_LENGTH, macOffset - HEADER_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new StateDecryptionException("Failed to decrypt token", e);
        }
    }

    private byte[] sign(byte[] data) throws GeneralSecurityException {
        Mac mac = Mac.getInstance(HMAC_ALGORITHM);
        mac.init(new SecretKeySpec(signingKey, HMAC_ALGORITHM));
        return mac.doFinal(data);
    }
}
