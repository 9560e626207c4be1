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

package io.sealedtokens.data;

import static io.sealedtokens.data.ClaimValue.bool;
import static io.sealedtokens.data.ClaimValue.map;
import static io.sealedtokens.data.ClaimValue.numeric;
import static io.sealedtokens.data.ClaimValue.string;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class ClaimValueTest {

    @Test
    public void shouldConvertParsedJsonValues() {
        var parsed = new LinkedHashMap<String, Object>();
        parsed.put("name", "Alice");
        parsed.put("age", 42);
        parsed.put("score", 1.25);
        parsed.put("active", true);
        parsed.put("address", Map.of("city", "Leeds"));

        var converted = ClaimValue.convert(parsed).orElseThrow();

        assertThat(converted).isEqualTo(map(Map.of(
                "name", string("Alice"),
                "age", numeric(42),
                "score", numeric(1.25),
                "active", bool(true),
                "address", map(Map.of("city", string("Leeds"))))));
    }

    @DataProvider
    public Object[][] unsupportedValues() {
        var nullValue = new LinkedHashMap<String, Object>();
        nullValue.put("a", null);
        return new Object[][] {
                { null },
                { List.of("a", "b") },
                { Map.of(1, "non-string key") },
                { Map.of("nested", List.of(1)) },
                { nullValue },
                { Double.NaN },
                { Double.POSITIVE_INFINITY },
                { new Object() },
        };
    }

    @Test(dataProvider = "unsupportedValues")
    public void shouldRejectUnsupportedValues(Object value) {
        assertThat(ClaimValue.convert(value)).isEmpty();
    }

    @Test
    public void shouldRejectNonFiniteNumbers() {
        assertThatThrownBy(() -> numeric(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> numeric(Double.NEGATIVE_INFINITY)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void shouldOnlyConvertExactIntegersToLong() {
        assertThat(numeric(1686571584L).asLong()).hasValue(1686571584L);
        assertThat(numeric(1.5).asLong()).isEmpty();
        assertThat(numeric(1e300).asLong()).isEmpty();
        assertThat(string("5").asLong()).isEmpty();
    }

    @Test
    public void shouldInterpretIntegersAsEpochSeconds() {
        assertThat(numeric(1686571584L).asInstant()).hasValue(Instant.ofEpochSecond(1686571584L));
        assertThat(numeric(0.5).asInstant()).isEmpty();
    }

    @Test
    public void shouldWriteIntegralNumbersAsLongs() {
        assertThat(numeric(3).toJsonValue()).isEqualTo(3L);
        assertThat(numeric(0.5).toJsonValue()).isEqualTo(0.5);
        assertThat(bool(false).toJsonValue()).isEqualTo(false);
        assertThat(string("x").toJsonValue()).isEqualTo("x");
    }

    @Test
    @SuppressWarnings("unchecked")
    public void shouldKeepMapsInSortedOrder() {
        var unordered = new LinkedHashMap<String, ClaimValue>();
        unordered.put("zebra", string("z"));
        unordered.put("apple", string("a"));
        unordered.put("mango", string("m"));

        var value = map(unordered);

        assertThat(value.asMap().orElseThrow().keySet()).containsExactly("apple", "mango", "zebra");
        assertThat(((Map<String, ?>) value.toJsonValue()).keySet()).containsExactly("apple", "mango", "zebra");
    }

    @Test
    public void shouldNotBeAffectedByChangesToSourceMap() {
        var source = new LinkedHashMap<String, ClaimValue>();
        source.put("a", string("1"));
        var value = map(source);

        source.put("b", string("2"));

        assertThat(value.asMap().orElseThrow()).containsOnlyKeys("a");
        assertThatThrownBy(() -> value.asMap().orElseThrow().put("c", string("3")))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    public void shouldOnlyExposeMatchingType() {
        assertThat(string("x").asString()).hasValue("x");
        assertThat(string("x").asBoolean()).isEmpty();
        assertThat(bool(true).asBoolean()).hasValue(true);
        assertThat(bool(true).asNumeric()).isEmpty();
        assertThat(numeric(2.5).asNumeric()).hasValue(2.5);
        assertThat(numeric(2.5).asMap()).isEmpty();
    }
}
