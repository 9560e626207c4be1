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

import static java.util.Objects.requireNonNull;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.TreeMap;

/**
 * The values that may appear in a token's claims, including caller-supplied extension data. This is a closed set
 * of JSON-compatible shapes:
 * <ul>
 *     <li>A Unicode string.</li>
 *     <li>A finite number, represented as IEEE 754 double precision floating point.</li>
 *     <li>The Boolean values <code>true</code> or <code>false</code>.</li>
 *     <li>A map whose keys are strings and whose values are themselves claim values.</li>
 * </ul>
 * There is no null and no array. Maps always iterate in sorted key order, so that a given claim set has exactly
 * one serialized form.
 */
public sealed interface ClaimValue {

    /**
     * Converts a value produced by a JSON parser into a claim value.
     *
     * @param value the parsed value.
     * @return the converted value, or an empty result if the value (or anything nested inside it) is not one of the
     * supported shapes.
     */
    static Optional<ClaimValue> convert(Object value) {
        if (value instanceof String str) {
            return Optional.of(string(str));
        } else if (value instanceof Boolean b) {
            return Optional.of(bool(b));
        } else if (value instanceof Number n) {
            var d = n.doubleValue();
            return Double.isFinite(d) ? Optional.of(numeric(d)) : Optional.empty();
        } else if (value instanceof Map<?, ?> m) {
            var converted = new TreeMap<String, ClaimValue>();
            for (var entry : m.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    return Optional.empty();
                }
                var element = convert(entry.getValue());
                if (element.isEmpty()) {
                    return Optional.empty();
                }
                converted.put(key, element.get());
            }
            return Optional.of(new MapValue(converted));
        }
        return Optional.empty();
    }

    static ClaimValue string(String value) {
        return new StringValue(value);
    }

    static ClaimValue numeric(double value) {
        return new NumericValue(value);
    }

    static ClaimValue bool(boolean value) {
        return value ? BooleanValue.TRUE : BooleanValue.FALSE;
    }

    static ClaimValue map(Map<String, ? extends ClaimValue> elements) {
        return new MapValue(Collections.<String, ClaimValue>unmodifiableMap(elements));
    }

    default Optional<String> asString() {
        return this instanceof StringValue sv ? Optional.of(sv.value) : Optional.empty();
    }

    default OptionalDouble asNumeric() {
        return this instanceof NumericValue nv ? OptionalDouble.of(nv.value) : OptionalDouble.empty();
    }

    default OptionalLong asLong() {
        return this instanceof NumericValue nv ? nv.asLong() : OptionalLong.empty();
    }

    /**
     * Interprets a numeric value as a number of seconds since the epoch, as used by the {@code exp} and {@code iat}
     * claims.
     */
    default Optional<Instant> asInstant() {
        return asLong().stream().mapToObj(Instant::ofEpochSecond).findFirst();
    }

    default Optional<Boolean> asBoolean() {
        return this instanceof BooleanValue bv ? Optional.of(bv == BooleanValue.TRUE) : Optional.empty();
    }

    default Optional<Map<String, ClaimValue>> asMap() {
        return this instanceof MapValue mv ? Optional.of(mv.map) : Optional.empty();
    }

    /**
     * Converts this value into the plain Java objects understood by a JSON writer: {@link String}, {@link Long}
     * (for integral numbers that a double represents exactly), {@link Double}, {@link Boolean} or a sorted
     * {@link Map}.
     */
    Object toJsonValue();

    /**
     * A string value.
     *
     * @param value the string.
     */
    record StringValue(String value) implements ClaimValue {
        public StringValue {
            requireNonNull(value, "value");
        }

        @Override
        public Object toJsonValue() {
            return value;
        }
    }

    /**
     * A double-precision numeric value. NaN and the infinities have no JSON representation and are rejected.
     *
     * @param value the value
     */
    record NumericValue(double value) implements ClaimValue {
        private static final double MAX_EXACT_INTEGER = 0x1p53;

        public NumericValue {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Numeric claim values must be finite");
            }
        }

        /**
         * Attempts to convert the numeric value to a long if it can be.
         *
         * @return the value as a long if it can be exactly converted, or an empty value if it is not integral.
         */
        public OptionalLong asLong() {
            return isExactInteger() ? OptionalLong.of((long) value) : OptionalLong.empty();
        }

        @Override
        public Object toJsonValue() {
            return isExactInteger() ? (Object) (long) value : (Object) value;
        }

        private boolean isExactInteger() {
            return Math.abs(value) <= MAX_EXACT_INTEGER && (long) value == value;
        }
    }

    /**
     * A boolean value.
     */
    enum BooleanValue implements ClaimValue {
        TRUE, FALSE;

        @Override
        public Object toJsonValue() {
            return this == TRUE;
        }
    }

    /**
     * A map from string keys to claim values, iterated in key order.
     *
     * @param map the map.
     */
    record MapValue(Map<String, ClaimValue> map) implements ClaimValue {
        public MapValue {
            var copy = new TreeMap<String, ClaimValue>();
            requireNonNull(map, "map").forEach((key, value) ->
                    copy.put(requireNonNull(key, "key"), requireNonNull(value, "value")));
            map = Collections.unmodifiableSortedMap(copy);
        }

        @Override
        public Object toJsonValue() {
            var json = new TreeMap<String, Object>();
            map.forEach((key, value) -> json.put(key, value.toJsonValue()));
            return json;
        }
    }
}
