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
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.security.NoSuchAlgorithmException;
import java.security.spec.InvalidKeySpecException;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

/**
 * Derives the envelope encryption key from the service's long-lived shared secret and its per-deployment salt,
 * using PBKDF2. Derivation is deterministic, so every call with the same inputs reproduces the same key and no key
 * needs to be kept between operations.
 */
public final class KeyDerivation {
    /**
     * The size of every derived key, matching the AES-256 key used by {@link EnvelopeCipher}.
     */
    public static final int KEY_SIZE_BYTES = 32;

    /**
     * Versioned PBKDF2 parameters. Changing the version used by a deployment changes the derived key, and so
     * invalidates every token issued under the previous version.
     */
    public enum Version {
        /**
         * PBKDF2-HMAC-SHA1 with 4096 iterations. Kept for compatibility with tokens issued by earlier services.
         */
        V1("PBKDF2WithHmacSHA1", 4096),
        /**
         * PBKDF2-HMAC-SHA256 with 210,000 iterations.
         */
        V2("PBKDF2WithHmacSHA256", 210_000);

        private final String algorithm;
        private final int iterations;

        Version(String algorithm, int iterations) {
            this.algorithm = algorithm;
            this.iterations = iterations;
        }

        public String algorithm() {
            return algorithm;
        }

        public int iterations() {
            return iterations;
        }
    }

    private final Version version;

    public KeyDerivation(Version version) {
        this.version = requireNonNull(version, "version");
    }

    public Version version() {
        return version;
    }

    /**
     * Derives a 32-byte AES key. The caller should {@linkplain DestroyableSecretKey#destroy() destroy} the key as
     * soon as it has been used.
     *
     * @param sharedSecret the service's shared secret. Not modified.
     * @param salt the deployment salt.
     * @return the derived key.
     * @throws IllegalArgumentException if the secret or salt is empty.
     */
    public DestroyableSecretKey deriveKey(char[] sharedSecret, byte[] salt) {
        require(requireNonNull(sharedSecret, "sharedSecret").length > 0, "Shared secret must not be empty");
        require(requireNonNull(salt, "salt").length > 0, "Salt must not be empty");

        var spec = new PBEKeySpec(sharedSecret, salt, version.iterations, KEY_SIZE_BYTES * 8);
        byte[] keyMaterial = null;
        try {
            keyMaterial = SecretKeyFactory.getInstance(version.algorithm).generateSecret(spec).getEncoded();
            return new DestroyableSecretKey("AES", keyMaterial);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("JVM doesn't support " + version.algorithm, e);
        } catch (InvalidKeySpecException e) {
            throw new IllegalArgumentException(e);
        } finally {
            spec.clearPassword();
            Utils.wipe(keyMaterial);
        }
    }

    public DestroyableSecretKey deriveKey(String sharedSecret, String salt) {
        var secretChars = requireNonNull(sharedSecret, "sharedSecret").toCharArray();
        try {
            return deriveKey(secretChars, requireNonNull(salt, "salt").getBytes(UTF_8));
        } finally {
            Utils.wipe(secretChars);
        }
    }
}
