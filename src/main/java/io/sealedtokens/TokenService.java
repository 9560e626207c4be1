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

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.time.Clock;
import java.util.Map;

import io.sealedtokens.TokenException.Kind;
import io.sealedtokens.data.ClaimValue;

/**
 * Issues and redeems session tokens. A token is a signed claim set (see {@link ClaimSigner}) sealed inside an
 * encrypted envelope (see {@link EnvelopeCipher}).
 * <p>
 * Two different secrets are involved. The <em>caller secret</em> passed to each operation signs the inner claims,
 * so only holders of that secret can later verify them. The envelope is always encrypted under a key derived from
 * the service's own shared secret and salt, so every outgoing token is protected the same way regardless of who
 * signed it.
 * <p>
 * Redeeming a token doesn't consume it: a token can be redeemed any number of times until it expires. The service
 * holds no mutable state and may be used from many threads at once.
 *
 * <pre>{@code
 * var service = new TokenService(TokenServiceConfig.builder()
 *         .sharedSecret("s3cr3t").salt("pepper").issuer("svc").timeoutMinutes(60).build());
 * var token = service.issueToken("s3cr3t", "u1", "Alice");
 * var identity = service.redeemToken(token, "s3cr3t"); // Identity[subjectId=u1, displayName=Alice]
 * }</pre>
 */
public final class TokenService {
    private static final RedactedLogger logger = RedactedLogger.getLogger(TokenService.class);

    private final TokenServiceConfig config;
    private final Clock clock;
    private final KeyDerivation keyDerivation;
    private final EnvelopeCipher envelopeCipher = new EnvelopeCipher();
    private final ClaimSigner claimSigner = new ClaimSigner();

    public TokenService(TokenServiceConfig config) {
        this(config, Clock.systemUTC());
    }

    public TokenService(TokenServiceConfig config, Clock clock) {
        this.config = requireNonNull(config, "config");
        this.clock = requireNonNull(clock, "clock");
        this.keyDerivation = new KeyDerivation(config.kdfVersion());
    }

    public String issueToken(String callerSecret, String subjectId, String displayName) {
        return issueToken(callerSecret, subjectId, displayName, Map.of());
    }

    /**
     * Issues a new token that expires after the configured timeout.
     *
     * @param callerSecret the secret to sign the claims with. The same secret must be supplied to redeem the token.
     * @param subjectId the identifier of the user.
     * @param displayName the user's display name.
     * @param extensionData additional data to carry in the token, which may be empty.
     * @return the token.
     * @throws IllegalArgumentException if the caller secret is empty.
     */
    public String issueToken(String callerSecret, String subjectId, String displayName,
            Map<String, ? extends ClaimValue> extensionData) {
        var now = clock.instant();
        var claims = Claims.builder()
                .subject(subjectId)
                .displayName(displayName)
                .issuer(config.issuer())
                .issuedAt(now)
                .expiry(now.plus(config.timeout()))
                .extensionData(extensionData)
                .build();

        var secret = requireNonNull(callerSecret, "callerSecret").getBytes(UTF_8);
        try {
            var token = encryptToken(claimSigner.sign(claims, secret));
            logger.trace("Issued token expiring at {}", claims.expiry().orElseThrow());
            return token;
        } finally {
            Utils.wipe(secret);
        }
    }

    /**
     * Redeems a token, returning the identity it was issued to.
     *
     * @param token the token, exactly as returned by {@link #issueToken(String, String, String)}.
     * @param callerSecret the secret the token was signed with.
     * @return the identity carried by the token.
     * @throws TokenException if the token is rejected for any reason. See {@link #parse(String, String)}.
     */
    public Identity redeemToken(String token, String callerSecret) throws TokenException {
        var claims = parse(token, callerSecret);
        return new Identity(claims.subject().orElseThrow(), claims.displayName().orElse(""));
    }

    /**
     * Decrypts, verifies and validates a token, returning all of its claims.
     *
     * @param token the token.
     * @param callerSecret the secret the token was signed with.
     * @return the validated claims.
     * @throws TokenException in the order the checks are made: {@link Kind#MALFORMED_ENVELOPE} or
     * {@link Kind#DECRYPTION_FAILED} if the envelope can't be opened, {@link Kind#MALFORMED_TOKEN} or
     * {@link Kind#INVALID_SIGNATURE} if the inner token can't be verified, then any failure from
     * {@link #validate(Claims)}.
     */
    public Claims parse(String token, String callerSecret) throws TokenException {
        var signedToken = decryptToken(token);
        var secret = requireNonNull(callerSecret, "callerSecret").getBytes(UTF_8);
        try {
            var claims = claimSigner.verify(signedToken, secret);
            validate(claims);
            return claims;
        } catch (TokenException e) {
            logger.debug("Token rejected: {}", e.kind());
            throw e;
        } finally {
            Utils.wipe(secret);
        }
    }

    /**
     * Checks the business rules for a verified claim set: the subject, issuer and expiry claims must all be present,
     * the token must not have expired or have been issued in the future (allowing for the configured clock skew),
     * and the issuer must be this service's issuer.
     *
     * @param claims the claims to check.
     * @throws TokenException with kind {@link Kind#TOKEN_MISSING_CLAIMS}, {@link Kind#INVALID_TOKEN} or
     * {@link Kind#INVALID_ISSUER}, checked in that order.
     */
    public void validate(Claims claims) throws TokenException {
        requireNonNull(claims, "claims");
        if (claims.subject().isEmpty() || claims.issuer().isEmpty() || claims.expiry().isEmpty()) {
            throw new TokenException(Kind.TOKEN_MISSING_CLAIMS);
        }

        var now = clock.instant();
        var skew = config.clockSkew();
        // A token is already expired at its expiry time
        if (!now.isBefore(claims.expiry().get().plus(skew))) {
            throw new TokenException(Kind.INVALID_TOKEN);
        }
        if (claims.issuedAt().map(iat -> iat.isAfter(now.plus(skew))).orElse(false)) {
            throw new TokenException(Kind.INVALID_TOKEN);
        }

        if (!config.issuer().equals(claims.issuer().get())) {
            throw new TokenException(Kind.INVALID_ISSUER);
        }
    }

    /**
     * Seals a signed token in an envelope encrypted under the service key.
     *
     * @param signedToken the signed token.
     * @return the envelope text.
     */
    public String encryptToken(String signedToken) {
        var plaintext = requireNonNull(signedToken, "signedToken").getBytes(UTF_8);
        var key = deriveServiceKey();
        try {
            return envelopeCipher.encrypt(plaintext, key);
        } finally {
            key.destroy();
        }
    }

    /**
     * Opens an envelope encrypted under the service key, without verifying its contents.
     *
     * @param token the envelope text.
     * @return the signed token inside the envelope.
     * @throws TokenException with kind {@link Kind#MALFORMED_ENVELOPE} or {@link Kind#DECRYPTION_FAILED}.
     */
    public String decryptToken(String token) throws TokenException {
        requireNonNull(token, "token");
        var key = deriveServiceKey();
        try {
            return new String(envelopeCipher.decrypt(token, key), UTF_8);
        } catch (TokenException e) {
            logger.debug("Token rejected: {}", e.kind());
            throw e;
        } finally {
            key.destroy();
        }
    }

    // Derived fresh for each operation rather than cached, so the key only lives as long as one call
    private DestroyableSecretKey deriveServiceKey() {
        var secret = config.sharedSecret();
        try {
            return keyDerivation.deriveKey(secret, config.salt());
        } finally {
            Utils.wipe(secret);
        }
    }
}
