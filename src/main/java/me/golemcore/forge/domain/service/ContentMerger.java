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

import me.golemcore.forge.domain.model.JsonValueSupport;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deep merge of a partial update into a content document.
 *
 * <ul>
 * <li>a {@code null} patch value deletes the key</li>
 * <li>an object patch value over an object base value is merged
 * recursively</li>
 * <li>anything else (scalars, arrays) replaces the base value as a whole</li>
 * </ul>
 * The base document is never mutated.
 */
@Component
public class ContentMerger {

    public Map<String, Object> merge(Map<String, Object> base, Map<String, Object> patch) {
        Map<String, Object> result = JsonValueSupport.deepCopyMap(base);
        if (patch == null) {
            return result;
        }
        apply(result, patch);
        return result;
    }

    private void apply(Map<String, Object> target, Map<?, ?> patch) {
        for (Map.Entry<?, ?> entry : patch.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (value == null) {
                target.remove(key);
            } else if (value instanceof Map<?, ?> patchMap && target.get(key) instanceof Map<?, ?> baseMap) {
                Map<String, Object> nested = new LinkedHashMap<>(JsonValueSupport.asMap(baseMap));
                apply(nested, patchMap);
                target.put(key, nested);
            } else {
                target.put(key, JsonValueSupport.deepCopy(value));
            }
        }
    }
}
