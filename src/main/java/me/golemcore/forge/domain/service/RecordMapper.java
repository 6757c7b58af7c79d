package me.golemcore.forge.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converts between domain objects and the untyped records held by the record
 * store, and measures serialized JSON size for diff and regression
 * heuristics.
 */
@Component
@RequiredArgsConstructor
public class RecordMapper {

    private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public Map<String, Object> toRecord(Object value) {
        Map<String, Object> record = objectMapper.convertValue(value, RECORD_TYPE);
        record.values().removeIf(Objects::isNull);
        return record;
    }

    public <T> T fromRecord(Map<String, Object> record, Class<T> type) {
        return objectMapper.convertValue(record, type);
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not serializable as JSON", e);
        }
    }

    /**
     * Length in characters of the compact JSON serialization of a value.
     */
    public int serializedLength(Object value) {
        return toJson(value).length();
    }
}
