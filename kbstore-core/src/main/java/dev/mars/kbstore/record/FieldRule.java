/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.kbstore.record;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Constraints on one property of a record.
 * <p>
 * Immutable; the {@code with}-style methods return modified copies.
 *
 * @param type      expected JSON type
 * @param minLength minimum string length, or null
 * @param maxLength maximum string length, or null
 * @param allowed   permitted string values, empty for any
 * @param pattern   regex the string must match from its start, or null
 * @param minimum   minimum integer value, or null
 */
public record FieldRule(FieldType type, Integer minLength, Integer maxLength, List<String> allowed,
                        Pattern pattern, Long minimum) {

    /** JSON types a property can be constrained to. */
    public enum FieldType {
        STRING, INTEGER, ARRAY
    }

    public static FieldRule string() {
        return new FieldRule(FieldType.STRING, null, null, List.of(), null, null);
    }

    public static FieldRule integer() {
        return new FieldRule(FieldType.INTEGER, null, null, List.of(), null, null);
    }

    public static FieldRule array() {
        return new FieldRule(FieldType.ARRAY, null, null, List.of(), null, null);
    }

    public FieldRule minLength(int min) {
        return new FieldRule(type, min, maxLength, allowed, pattern, minimum);
    }

    public FieldRule maxLength(int max) {
        return new FieldRule(type, minLength, max, allowed, pattern, minimum);
    }

    public FieldRule oneOf(String... values) {
        return new FieldRule(type, minLength, maxLength, List.of(values), pattern, minimum);
    }

    public FieldRule matching(String regex) {
        return new FieldRule(type, minLength, maxLength, allowed, Pattern.compile(regex), minimum);
    }

    public FieldRule minimum(long min) {
        return new FieldRule(type, minLength, maxLength, allowed, pattern, min);
    }
}
