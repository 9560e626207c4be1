/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */

package io.sealedtokens;

import static io.sealedtokens.Utils.require;
import static java.util.Objects.requireNonNull;

import java.security.GeneralSecurityException;
import java.security.InvalidAlgorithmParameterException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;

import javax.crypto.Cipher;
import javax.crypto.NoSuchPaddingException;
import javax.crypto.spec.GCMParameterSpec;

import io.sealedtokens.TokenException.Kind;

/**
 * Wraps an opaque byte string in an AES-256-GCM envelope. The envelope is the random nonce followed by the
 * ciphertext and authentication tag, encoded as {@linkplain Base64url URL-safe base64}. No associated data is
 * authenticated.
 */
public final class EnvelopeCipher {
    private static final RedactedLogger logger = RedactedLogger.getLogger(EnvelopeCipher.class);
    private static final String ENC_ALGORITHM = "AES/GCM/NoPadding";
    static final int NONCE_SIZE_BYTES = 12;
    static final int TAG_SIZE_BITS = 128;
    private static final int MIN_ENVELOPE_SIZE_BYTES = NONCE_SIZE_BYTES + TAG_SIZE_BITS / 8;

    private static final ThreadLocal<Cipher> CIPHER_THREAD_LOCAL =
            ThreadLocal.withInitial(() -> {
                try {
                    return Cipher.getInstance(ENC_ALGORITHM);
                } catch (NoSuchAlgorithmException | NoSuchPaddingException e) {
                    throw new AssertionError("JVM doesn't support AES/GCM encryption", e);
                }
            });

    /**
     * Encrypts the plaintext under a fresh random nonce.
     *
     * @param plaintext the data to encrypt. Not modified.
     * @param key a 32-byte AES key.
     * @return the envelope text.
     */
    public String encrypt(byte[] plaintext, DestroyableSecretKey key) {
        requireNonNull(plaintext, "plaintext");
        checkKey(key);
        var nonce = Crypto.randomBytes(NONCE_SIZE_BYTES);
        var cipher = getCipher(Cipher.ENCRYPT_MODE, key, nonce);
        try {
            var ciphertext = cipher.doFinal(plaintext);
            return Base64url.encode(Utils.concat(nonce, ciphertext));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Decrypts and authenticates an envelope. Unverified plaintext is never released.
     *
     * @param envelope the envelope text produced by {@link #encrypt(byte[], DestroyableSecretKey)}.
     * @param key the 32-byte AES key the envelope was encrypted with.
     * @return the plaintext.
     * @throws TokenException with kind {@link Kind#MALFORMED_ENVELOPE} if the text is not valid base64url or is too
     * short to contain a nonce, or {@link Kind#DECRYPTION_FAILED} if the tag is missing or authentication fails for
     * any reason.
     */
    public byte[] decrypt(String envelope, DestroyableSecretKey key) throws TokenException {
        requireNonNull(envelope, "envelope");
        checkKey(key);
        byte[] decoded;
        try {
            decoded = Base64url.decode(envelope);
        } catch (IllegalArgumentException e) {
            logger.debug("Envelope is not valid base64url: {}", e.getMessage());
            throw new TokenException(Kind.MALFORMED_ENVELOPE);
        }
        if (decoded.length < NONCE_SIZE_BYTES) {
            logger.debug("Envelope too short: {} bytes", decoded.length);
            throw new TokenException(Kind.MALFORMED_ENVELOPE);
        }
        if (decoded.length < MIN_ENVELOPE_SIZE_BYTES) {
            // The provider fails with an unchecked exception when the tag is truncated
            logger.trace("Envelope has no room for a tag: {} bytes", decoded.length);
            throw new TokenException(Kind.DECRYPTION_FAILED);
        }

        var nonce = Arrays.copyOf(decoded, NONCE_SIZE_BYTES);
        var cipher = getCipher(Cipher.DECRYPT_MODE, key, nonce);
        try {
            return cipher.doFinal(decoded, NONCE_SIZE_BYTES, decoded.length - NONCE_SIZE_BYTES);
        } catch (GeneralSecurityException e) {
            // Same outcome for a wrong key and a modified envelope
            logger.trace("Envelope authentication failed", e);
            throw new TokenException(Kind.DECRYPTION_FAILED);
        }
    }

    private static void checkKey(DestroyableSecretKey key) {
        require(!requireNonNull(key, "key").isDestroyed(), "Key has been destroyed");
        require(key.size() == KeyDerivation.KEY_SIZE_BYTES, "Key must be 32 bytes");
    }

    private static Cipher getCipher(int mode, DestroyableSecretKey key, byte[] nonce) {
        var cipher = CIPHER_THREAD_LOCAL.get();
        try {
            cipher.init(mode, key, new GCMParameterSpec(TAG_SIZE_BITS, nonce));
            return cipher;
        } catch (InvalidKeyException | InvalidAlgorithmParameterException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
