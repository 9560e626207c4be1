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
 * The verified identity carried by a redeemed token.
 *
 * @param subjectId the identifier of the user the token was issued to.
 * @param displayName the user's display name, or an empty string if the token didn't carry one.
 */
public record Identity(String subjectId, String displayName) {
    public Identity {
        requireNonNull(subjectId, "subjectId");
        requireNonNull(displayName, "displayName");
    }
}
