package me.golemcore.forge.domain.model;

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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Arbitrary JSON object without the sections convention. Every string value,
 * at any depth, is a text leaf.
 */
public final class FlatDocument implements PromptDocument {

    private final Map<String, Object> raw;

    FlatDocument(Map<String, Object> raw) {
        this.raw = raw != null ? raw : new LinkedHashMap<>();
    }

    @Override
    public Set<String> topLevelKeys() {
        return new LinkedHashSet<>(raw.keySet());
    }

    @Override
    public List<TextLeaf> textLeaves() {
        List<TextLeaf> leaves = new ArrayList<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            collect(entry.getKey(), entry.getValue(), leaves);
        }
        return leaves;
    }

    static void collect(String path, Object value, List<TextLeaf> leaves) {
        if (value instanceof String text) {
            leaves.add(new TextLeaf(path, null, text));
        } else if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                collect(path + "." + entry.getKey(), entry.getValue(), leaves);
            }
        } else if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                collect(path + "[" + i + "]", list.get(i), leaves);
            }
        }
    }

    @Override
    public List<PromptSection> sections() {
        return List.of();
    }

    @Override
    public Map<String, Object> variables() {
        return JsonValueSupport.asMap(raw.get(VARIABLES));
    }

    @Override
    public Map<String, Object> metadata() {
        return JsonValueSupport.asMap(raw.get(METADATA));
    }

    @Override
    public Map<String, Object> toMap() {
        return JsonValueSupport.deepCopyMap(raw);
    }
}
