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

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import io.sealedtokens.data.ClaimValue;

/**
 * An immutable set of claims about the holder of a token. A claim set that has just been verified may lack any of
 * the registered claims, so every accessor returns an {@link Optional}; it is up to
 * {@link TokenService#validate(Claims)} to decide which of them are required.
 */
public final class Claims {
    public static final String SUBJECT = "sub";
    public static final String DISPLAY_NAME = "name";
    public static final String ISSUER = "iss";
    public static final String EXPIRY = "exp";
    public static final String ISSUED_AT = "iat";
    public static final String EXTENSION_DATA = "ext";

    private final SortedMap<String, ClaimValue> claims;

    Claims(Map<String, ? extends ClaimValue> claims) {
        this.claims = Collections.unmodifiableSortedMap(new TreeMap<>(claims));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> subject() {
        return get(SUBJECT).flatMap(ClaimValue::asString);
    }

    public Optional<String> displayName() {
        return get(DISPLAY_NAME).flatMap(ClaimValue::asString);
    }

    public Optional<String> issuer() {
        return get(ISSUER).flatMap(ClaimValue::asString);
    }

    public Optional<Instant> expiry() {
        return get(EXPIRY).flatMap(ClaimValue::asInstant);
    }

    public Optional<Instant> issuedAt() {
        return get(ISSUED_AT).flatMap(ClaimValue::asInstant);
    }

    /**
     * The caller-supplied extension data, or an empty map if the token has none.
     */
    public Map<String, ClaimValue> extensionData() {
        return get(EXTENSION_DATA).flatMap(ClaimValue::asMap).orElse(Map.of());
    }

    public Optional<ClaimValue> get(String claimName) {
        return Optional.ofNullable(claims.get(claimName));
    }

    /**
     * All claims, in claim-name order.
     */
    public Map<String, ClaimValue> asMap() {
        return claims;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) { return true; }
        if (!(other instanceof Claims)) { return false; }
        Claims that = (Claims) other;
        return this.claims.equals(that.claims);
    }

    @Override
    public int hashCode() {
        return Objects.hash(claims);
    }

    @Override
    public String toString() {
        return "Claims" + claims;
    }

    public static final class Builder {
        private final Map<String, ClaimValue> claims = new TreeMap<>();

        private Builder() {}

        public Builder subject(String subject) {
            return claim(SUBJECT, ClaimValue.string(requireNonNull(subject, "subject")));
        }

        public Builder displayName(String displayName) {
            return claim(DISPLAY_NAME, ClaimValue.string(requireNonNull(displayName, "displayName")));
        }

        public Builder issuer(String issuer) {
            return claim(ISSUER, ClaimValue.string(requireNonNull(issuer, "issuer")));
        }

        /**
         * Sets the expiry time. Claims only have a resolution of one second, so any fraction of a second is
         * discarded.
         */
        public Builder expiry(Instant expiry) {
            return claim(EXPIRY, ClaimValue.numeric(requireNonNull(expiry, "expiry").getEpochSecond()));
        }

        public Builder issuedAt(Instant issuedAt) {
            return claim(ISSUED_AT, ClaimValue.numeric(requireNonNull(issuedAt, "issuedAt").getEpochSecond()));
        }

        /**
         * Attaches extension data to the claims. An empty map removes any previously attached data.
         */
        public Builder extensionData(Map<String, ? extends ClaimValue> extensionData) {
            if (requireNonNull(extensionData, "extensionData").isEmpty()) {
                claims.remove(EXTENSION_DATA);
                return this;
            }
            return claim(EXTENSION_DATA, ClaimValue.map(extensionData));
        }

        public Builder claim(String claimName, ClaimValue value) {
            claims.put(requireNonNull(claimName, "claimName"), requireNonNull(value, "value"));
            return this;
        }

        public Claims build() {
            return new Claims(claims);
        }
    }
}
