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

import java.util.Base64;

/**
 * URL-safe Base64 without padding, used for the envelope text and for each part of a signed token. Tokens in this
 * form can be placed in headers, cookies and query strings without further escaping.
 */
public final class Base64url {
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    public static String encode(byte[] data) {
        return ENCODER.encodeToString(data);
    }

    /**
     * Decodes URL-safe base64 text. Only the exact text {@link #encode(byte[])} produces is accepted: padding and
     * non-zero unused bits in the final character are rejected, so no two strings decode to the same bytes.
     *
     * @param encoded the encoded data to decode.
     * @return the decoded data.
     * @throws IllegalArgumentException if the encoded data is not valid.
     */
    public static byte[] decode(String encoded) {
        var decoded = DECODER.decode(encoded);
        if (!ENCODER.encodeToString(decoded).equals(encoded)) {
            throw new IllegalArgumentException("Non-canonical base64url encoding");
        }
        return decoded;
    }

    private Base64url() {}
}
