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

import static java.util.Objects.requireNonNull;

import java.util.Arrays;

import javax.crypto.SecretKey;

/**
 * A secret key held as an in-memory byte array. Unlike {@link javax.crypto.spec.SecretKeySpec}, the
 * {@link #destroy()} method really does scrub the key material from memory. Derived envelope keys and per-call
 * signing keys are both held in this form and destroyed as soon as the operation that needed them completes.
 * <p>
 * Instances deliberately use identity equality: key material is never compared outside of a constant-time MAC
 * check.
 */
public final class DestroyableSecretKey implements SecretKey {
    private static final long serialVersionUID = 1L;

    private final String algorithm;
    private final byte[] keyMaterial;
    private volatile boolean destroyed = false;

    /**
     * Copies the given key material into a new key object. The caller remains responsible for wiping its own copy.
     *
     * @param algorithm the JCA algorithm name, such as {@code "AES"} or {@code "HmacSHA256"}.
     * @param keyMaterial the raw key bytes.
     */
    public DestroyableSecretKey(String algorithm, byte[] keyMaterial) {
        this.algorithm = requireNonNull(algorithm, "algorithm");
        this.keyMaterial = requireNonNull(keyMaterial, "keyMaterial").clone();
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    @Override
    public String getFormat() {
        return "RAW";
    }

    @Override
    public byte[] getEncoded() {
        if (destroyed) {
            throw new IllegalStateException("Key material has been destroyed");
        }
        return keyMaterial.clone();
    }

    /**
     * The length of the key in bytes. Unlike {@link #getEncoded()}, this doesn't create a copy of the key.
     */
    public int size() {
        return keyMaterial.length;
    }

    @Override
    public void destroy() {
        destroyed = true;
        Arrays.fill(keyMaterial, (byte) 0);
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        return "DestroyableSecretKey{" +
                "algorithm='" + algorithm + '\'' +
                ", size=" + keyMaterial.length +
                ", destroyed=" + destroyed +
                '}';
    }
}
