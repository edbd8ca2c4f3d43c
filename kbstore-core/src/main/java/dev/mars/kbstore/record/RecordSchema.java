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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Required fields and per-property constraints for one kind of record.
 * Properties not declared here are not checked.
 */
public final class RecordSchema {

    private final List<String> required;
    private final Map<String, FieldRule> properties;

    private RecordSchema(Builder builder) {
        this.required = Collections.unmodifiableList(new ArrayList<>(builder.required));
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.properties));
    }

    public List<String> required() {
        return required;
    }

    public Map<String, FieldRule> properties() {
        return properties;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for {@link RecordSchema}.
     */
    public static final class Builder {
        private final List<String> required = new ArrayList<>();
        private final Map<String, FieldRule> properties = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder required(String... fields) {
            required.addAll(List.of(fields));
            return this;
        }

        public Builder property(String name, FieldRule rule) {
            properties.put(name, rule);
            return this;
        }

        public RecordSchema build() {
            return new RecordSchema(this);
        }
    }
}
