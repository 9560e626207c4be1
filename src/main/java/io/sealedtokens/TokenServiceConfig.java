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
import static io.sealedtokens.Utils.requireNotBlank;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.time.Duration;
import java.util.Properties;

/**
 * The immutable settings of a {@link TokenService}: the shared secret and salt the envelope key is derived from,
 * the issuer written into and expected from every token, and how long tokens stay valid.
 * <p>
 * The shared secret is a capability: anyone holding it (and the salt) can decrypt every token the service has
 * issued. The salt must stay the same for the lifetime of a deployment, since changing it invalidates all
 * outstanding tokens. Neither is ever included in {@link #toString()}.
 */
public final class TokenServiceConfig {
    public static final String SECRET = "token.secret";
    public static final String SALT = "token.salt";
    public static final String ISSUER = "token.issuer";
    public static final String TIMEOUT_MINUTES = "token.timeout-minutes";
    public static final String KDF_VERSION = "token.kdf-version";
    public static final String CLOCK_SKEW_SECONDS = "token.clock-skew-seconds";

    /**
     * The longest token lifetime. Expiry times stay well inside the range a JSON number holds exactly.
     */
    public static final Duration MAX_TIMEOUT = Duration.ofDays(36_500);
    public static final Duration MAX_CLOCK_SKEW = Duration.ofDays(1);

    private static final RedactedLogger logger = RedactedLogger.getLogger(TokenServiceConfig.class);

    private final char[] sharedSecret;
    private final byte[] salt;
    private final String issuer;
    private final Duration timeout;
    private final KeyDerivation.Version kdfVersion;
    private final Duration clockSkew;

    private TokenServiceConfig(Builder builder) {
        this.sharedSecret = builder.sharedSecret.toCharArray();
        this.salt = builder.salt.getBytes(UTF_8);
        this.issuer = builder.issuer;
        this.timeout = builder.timeout;
        this.kdfVersion = builder.kdfVersion;
        this.clockSkew = builder.clockSkew;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads the configuration from properties:
     * <ul>
     *     <li>{@value #SECRET} (required)</li>
     *     <li>{@value #SALT} (required)</li>
     *     <li>{@value #ISSUER} (required)</li>
     *     <li>{@value #TIMEOUT_MINUTES} (required, zero up to {@link #MAX_TIMEOUT})</li>
     *     <li>{@value #KDF_VERSION} ({@code V1} or {@code V2}, defaults to {@code V2})</li>
     *     <li>{@value #CLOCK_SKEW_SECONDS} (zero up to {@link #MAX_CLOCK_SKEW}, defaults to 0)</li>
     * </ul>
     *
     * @param properties the properties to read.
     * @return the configuration.
     * @throws IllegalArgumentException if a required property is missing or a value is invalid. The message names
     * the property but never includes its value.
     */
    public static TokenServiceConfig fromProperties(Properties properties) {
        requireNonNull(properties, "properties");
        var config = builder()
                .sharedSecret(required(properties, SECRET))
                .salt(required(properties, SALT))
                .issuer(required(properties, ISSUER))
                .timeoutMinutes(parseLong(TIMEOUT_MINUTES, required(properties, TIMEOUT_MINUTES)))
                .kdfVersion(parseVersion(properties.getProperty(KDF_VERSION, KeyDerivation.Version.V2.name())))
                .clockSkewSeconds(parseLong(CLOCK_SKEW_SECONDS, properties.getProperty(CLOCK_SKEW_SECONDS, "0")))
                .build();
        logger.info("Loaded token service configuration: {}", config);
        return config;
    }

    /**
     * Loads the configuration from a properties file. See {@link #fromProperties(Properties)} for the keys.
     *
     * @param in the properties file contents, in UTF-8.
     * @return the configuration.
     * @throws IOException if the file cannot be read.
     */
    public static TokenServiceConfig load(InputStream in) throws IOException {
        var properties = new Properties();
        try (var reader = new InputStreamReader(requireNonNull(in, "in"), UTF_8)) {
            properties.load(reader);
        }
        return fromProperties(properties);
    }

    private static String required(Properties properties, String key) {
        var value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required property: " + key);
        }
        return value;
    }

    private static long parseLong(String key, String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " must be a whole number");
        }
    }

    private static KeyDerivation.Version parseVersion(String value) {
        try {
            return KeyDerivation.Version.valueOf(value.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Property " + KDF_VERSION + " must be one of V1, V2");
        }
    }

    /**
     * A fresh copy of the shared secret. The caller should wipe it after use.
     */
    char[] sharedSecret() {
        return sharedSecret.clone();
    }

    /**
     * A fresh copy of the salt bytes.
     */
    byte[] salt() {
        return salt.clone();
    }

    public String issuer() {
        return issuer;
    }

    public Duration timeout() {
        return timeout;
    }

    public KeyDerivation.Version kdfVersion() {
        return kdfVersion;
    }

    public Duration clockSkew() {
        return clockSkew;
    }

    @Override
    public String toString() {
        return "TokenServiceConfig{" +
                "issuer='" + issuer + '\'' +
                ", timeout=" + timeout +
                ", kdfVersion=" + kdfVersion +
                ", clockSkew=" + clockSkew +
                '}';
    }

    public static final class Builder {
        private String sharedSecret;
        private String salt;
        private String issuer;
        private Duration timeout;
        private KeyDerivation.Version kdfVersion = KeyDerivation.Version.V2;
        private Duration clockSkew = Duration.ZERO;

        private Builder() {}

        public Builder sharedSecret(String sharedSecret) {
            this.sharedSecret = sharedSecret;
            return this;
        }

        public Builder salt(String salt) {
            this.salt = salt;
            return this;
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder timeoutMinutes(long minutes) {
            require(minutes >= 0 && minutes <= MAX_TIMEOUT.toMinutes(), "Timeout out of range");
            return timeout(Duration.ofMinutes(minutes));
        }

        public Builder kdfVersion(KeyDerivation.Version kdfVersion) {
            this.kdfVersion = kdfVersion;
            return this;
        }

        public Builder clockSkew(Duration clockSkew) {
            this.clockSkew = clockSkew;
            return this;
        }

        public Builder clockSkewSeconds(long seconds) {
            require(seconds >= 0 && seconds <= MAX_CLOCK_SKEW.toSeconds(), "Clock skew out of range");
            return clockSkew(Duration.ofSeconds(seconds));
        }

        /**
         * Validates the settings and builds the configuration.
         *
         * @throws IllegalArgumentException if a required setting is missing or invalid.
         */
        public TokenServiceConfig build() {
            requireNotBlank(sharedSecret, "Shared secret must be set");
            require(salt != null && !salt.isEmpty(), "Salt must be set");
            requireNotBlank(issuer, "Issuer must be set");
            require(timeout != null && !timeout.isNegative(), "Timeout must be set and not negative");
            require(timeout.compareTo(MAX_TIMEOUT) <= 0, "Timeout must not exceed " + MAX_TIMEOUT.toDays() + " days");
            require(kdfVersion != null, "Key derivation version must be set");
            require(clockSkew != null && !clockSkew.isNegative(), "Clock skew must not be negative");
            require(clockSkew.compareTo(MAX_CLOCK_SKEW) <= 0, "Clock skew must not exceed one day");
            return new TokenServiceConfig(this);
        }
    }
}
