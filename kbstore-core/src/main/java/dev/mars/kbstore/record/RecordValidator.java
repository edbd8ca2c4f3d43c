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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Checks record documents against a {@link RecordSchema}.
 * <p>
 * Required fields are checked first, then each declared property present in the
 * document, in document order. The first problem found is reported.
 */
public final class RecordValidator {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private RecordValidator() {
    }

    public static ValidationResult validateBug(JsonNode data) {
        return validate(data, RecordType.BUG.schema());
    }

    public static ValidationResult validateRequirement(JsonNode data) {
        return validate(data, RecordType.REQUIREMENT.schema());
    }

    public static ValidationResult validateDecision(JsonNode data) {
        return validate(data, RecordType.DECISION.schema());
    }

    public static ValidationResult validate(JsonNode data, RecordType type) {
        return validate(data, type.schema());
    }

    public static ValidationResult validate(JsonNode data, RecordSchema schema) {
        if (data == null || !data.isObject()) {
            return ValidationResult.invalid("Record must be a JSON object");
        }

        for (String field : schema.required()) {
            if (!data.has(field)) {
                return ValidationResult.invalid("Missing required field: " + field);
            }
        }

        Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            FieldRule rule = schema.properties().get(field.getKey());
            if (rule != null) {
                ValidationResult result = check(field.getKey(), field.getValue(), rule);
                if (!result.valid()) {
                    return result;
                }
            }
        }
        return ValidationResult.ok();
    }

    private static ValidationResult check(String name, JsonNode value, FieldRule rule) {
        switch (rule.type()) {
            case STRING:
                if (!value.isTextual()) {
                    return ValidationResult.invalid("Field " + name + " must be a string");
                }
                return checkString(name, value.textValue(), rule);
            case INTEGER:
                if (!value.isIntegralNumber()) {
                    return ValidationResult.invalid("Field " + name + " must be an integer");
                }
                if (rule.minimum() != null && value.longValue() < rule.minimum()) {
                    return ValidationResult.invalid("Field " + name + " must not be less than " + rule.minimum());
                }
                return ValidationResult.ok();
            case ARRAY:
                if (!value.isArray()) {
                    return ValidationResult.invalid("Field " + name + " must be an array");
                }
                return ValidationResult.ok();
            default:
                return ValidationResult.ok();
        }
    }

    private static ValidationResult checkString(String name, String value, FieldRule rule) {
        int length = value.codePointCount(0, value.length());
        if (rule.minLength() != null && length < rule.minLength()) {
            return ValidationResult.invalid("Field " + name + " must be at least " + rule.minLength() + " characters");
        }
        if (rule.maxLength() != null && length > rule.maxLength()) {
            return ValidationResult.invalid("Field " + name + " must be at most " + rule.maxLength() + " characters");
        }
        if (!rule.allowed().isEmpty() && !rule.allowed().contains(value)) {
            return ValidationResult.invalid("Field " + name + " must be one of: " + String.join(", ", rule.allowed()));
        }
        if (rule.pattern() != null && !rule.pattern().matcher(value).lookingAt()) {
            return ValidationResult.invalid("Field " + name + " has an invalid format");
        }
        return ValidationResult.ok();
    }

    /**
     * Checks that a file exists and holds parseable JSON.
     */
    public static ValidationResult validateJsonFile(Path file) {
        if (!Files.exists(file)) {
            return ValidationResult.invalid("File does not exist: " + file);
        }
        try {
            JsonNode node = MAPPER.readTree(file.toFile());
            if (node == null || node.isMissingNode()) {
                return ValidationResult.invalid("JSON format error: empty document");
            }
            return ValidationResult.ok();
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            return ValidationResult.invalid(location == null
                    ? "JSON format error: " + e.getOriginalMessage()
                    : "JSON format error: " + e.getOriginalMessage() +
                      " (line " + location.getLineNr() + ", column " + location.getColumnNr() + ")");
        } catch (IOException e) {
            return ValidationResult.invalid("Failed to read file: " + e.getMessage());
        }
    }
}
