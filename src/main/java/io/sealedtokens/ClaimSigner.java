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
import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import com.grack.nanojson.JsonObject;
import com.grack.nanojson.JsonParser;
import com.grack.nanojson.JsonParserException;
import com.grack.nanojson.JsonWriter;
import com.grack.nanojson.JsonWriterException;

import io.sealedtokens.TokenException.Kind;
import io.sealedtokens.data.ClaimValue;
import software.pando.crypto.nacl.Bytes;

/**
 * Signs and verifies claim sets in the JWS compact serialization, always with HMAC-SHA256 ({@code HS256}).
 * The algorithm is fixed: the {@code alg} header of an incoming token is checked against it but never used to
 * choose how the token is verified.
 * <p>
 * The claims are written as JSON with their keys in sorted order at every level of nesting, so a given claim set
 * always produces the same signed token under the same secret.
 */
public final class ClaimSigner {
    private static final RedactedLogger logger = RedactedLogger.getLogger(ClaimSigner.class);
    static final String ALGORITHM = "HS256";
    static final String TOKEN_TYPE = "JWT";

    private static final String ENCODED_HEADER;
    static {
        var header = new LinkedHashMap<String, Object>();
        header.put("alg", ALGORITHM);
        header.put("typ", TOKEN_TYPE);
        ENCODED_HEADER = Base64url.encode(JsonWriter.string(header).getBytes(UTF_8));
    }

    /**
     * Signs the claims.
     *
     * @param claims the claims to sign.
     * @param secret the signing secret. Not modified.
     * @return the signed token.
     * @throws IllegalArgumentException if the secret is empty or the claims cannot be serialized.
     */
    public String sign(Claims claims, byte[] secret) {
        requireNonNull(claims, "claims");
        var key = signingKey(secret);
        try {
            var payload = new TreeMap<String, Object>();
            claims.asMap().forEach((name, value) -> payload.put(name, value.toJsonValue()));
            var signingInput = ENCODED_HEADER + "." + Base64url.encode(JsonWriter.string(payload).getBytes(UTF_8));
            var tag = Crypto.hmac(key, signingInput.getBytes(US_ASCII));
            return signingInput + "." + Base64url.encode(tag);
        } catch (JsonWriterException e) {
            throw new IllegalArgumentException("Claims cannot be serialized", e);
        } finally {
            key.destroy();
        }
    }

    /**
     * Checks the signature on a signed token and returns its claims. The header and payload are only parsed once
     * the signature has been found to match. Expiry and issuer are not checked.
     *
     * @param signedToken the signed token.
     * @param secret the secret the token is expected to have been signed with. Not modified.
     * @return the claims carried by the token.
     * @throws TokenException with kind {@link Kind#MALFORMED_TOKEN} if the token cannot be parsed, or
     * {@link Kind#INVALID_SIGNATURE} if the signature doesn't match or the token claims a different algorithm.
     */
    public Claims verify(String signedToken, byte[] secret) throws TokenException {
        requireNonNull(signedToken, "signedToken");
        var parts = signedToken.split("\\.", -1);
        if (parts.length != 3) {
            logger.debug("Signed token has {} parts, expected 3", parts.length);
            throw new TokenException(Kind.MALFORMED_TOKEN);
        }

        byte[] header, payload, providedTag;
        try {
            header = Base64url.decode(parts[0]);
            payload = Base64url.decode(parts[1]);
            providedTag = Base64url.decode(parts[2]);
        } catch (IllegalArgumentException e) {
            logger.debug("Signed token is not valid base64url: {}", e.getMessage());
            throw new TokenException(Kind.MALFORMED_TOKEN);
        }

        var key = signingKey(secret);
        try {
            var computedTag = Crypto.hmac(key, (parts[0] + "." + parts[1]).getBytes(US_ASCII));
            if (computedTag.length != providedTag.length || !Bytes.equal(computedTag, providedTag)) {
                logger.trace("Tag mismatch: computed={}, provided={}", computedTag, providedTag);
                throw new TokenException(Kind.INVALID_SIGNATURE);
            }
        } finally {
            key.destroy();
        }

        if (!ALGORITHM.equals(parseJson(header).get("alg"))) {
            logger.debug("Signed token does not use {}", ALGORITHM);
            throw new TokenException(Kind.INVALID_SIGNATURE);
        }

        var claims = new LinkedHashMap<String, ClaimValue>();
        for (var entry : parseJson(payload).entrySet()) {
            var value = ClaimValue.convert(entry.getValue());
            if (value.isEmpty()) {
                logger.debug("Unsupported value for claim '{}'", entry.getKey());
                throw new TokenException(Kind.MALFORMED_TOKEN);
            }
            claims.put(entry.getKey(), value.get());
        }
        return new Claims(claims);
    }

    private static Map<String, Object> parseJson(byte[] json) throws TokenException {
        Object parsed;
        try {
            parsed = JsonParser.any().from(new String(json, UTF_8));
        } catch (JsonParserException e) {
            logger.debug("Unable to parse signed token JSON: {}", e.getMessage());
            throw new TokenException(Kind.MALFORMED_TOKEN);
        }
        if (!(parsed instanceof JsonObject)) {
            logger.debug("Signed token JSON is not an object");
            throw new TokenException(Kind.MALFORMED_TOKEN);
        }
        return (JsonObject) parsed;
    }

    private static DestroyableSecretKey signingKey(byte[] secret) {
        require(requireNonNull(secret, "secret").length > 0, "Signing secret must not be empty");
        return new DestroyableSecretKey(Crypto.HMAC_ALGORITHM, secret);
    }
}
