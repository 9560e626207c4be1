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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class Base64urlTest {

    @Test
    public void shouldEncodeWithoutPadding() {
        assertThat(Base64url.encode(new byte[] { (byte) 0xFB, (byte) 0xFF })).isEqualTo("-_8");
        assertThat(Base64url.decode("-_8")).containsExactly(0xFB, 0xFF);
    }

    @Test
    public void shouldDecodeCanonicalText() {
        assertThat(Base64url.decode("QQ")).containsExactly('A');
    }

    @DataProvider
    public Object[][] nonCanonicalText() {
        return new Object[][] { { "QR" }, { "QQ==" }, { "-_9" }, { "QUI=" } };
    }

    @Test(dataProvider = "nonCanonicalText")
    public void shouldRejectNonCanonicalText(String encoded) {
        assertThatThrownBy(() -> Base64url.decode(encoded)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldRejectStandardAlphabet() {
        assertThatThrownBy(() -> Base64url.decode("+/8")).isInstanceOf(IllegalArgumentException.class);
    }
}
