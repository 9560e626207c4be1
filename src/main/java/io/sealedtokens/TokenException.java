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

/**
 * Indicates that a token was rejected. The {@link #kind()} identifies which check failed, so that callers can map
 * each failure to an appropriate response without parsing messages. Messages are fixed per kind and never include
 * token contents, key material or the underlying cause.
 */
public final class TokenException extends Exception {
    private static final long serialVersionUID = 1L;

    /**
     * The reasons a token can be rejected. None of them are retryable: presenting the same token again will fail in
     * the same way.
     */
    public enum Kind {
        /**
         * The envelope is not valid base64url text, or is too short to contain a nonce.
         */
        MALFORMED_ENVELOPE("Malformed token envelope"),
        /**
         * Authenticated decryption of the envelope failed. This covers both a tampered envelope and one that was
         * encrypted under a different key, and intentionally doesn't say which.
         */
        DECRYPTION_FAILED("Unable to decrypt token"),
        /**
         * The signed token inside the envelope could not be parsed.
         */
        MALFORMED_TOKEN("Malformed signed token"),
        /**
         * The signature on the inner token does not match.
         */
        INVALID_SIGNATURE("Invalid token signature"),
        /**
         * One of the required claims (subject, issuer, expiry) is absent.
         */
        TOKEN_MISSING_CLAIMS("Token is missing required claims"),
        /**
         * The token is expired, or was issued in the future.
         */
        INVALID_TOKEN("Token is not valid"),
        /**
         * The token was issued by a different issuer.
         */
        INVALID_ISSUER("Invalid token issuer");

        private final String message;

        Kind(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private final Kind kind;

    public TokenException(Kind kind) {
        super(requireNonNull(kind, "kind").message());
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
