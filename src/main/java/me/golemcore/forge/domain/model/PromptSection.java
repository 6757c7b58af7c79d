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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry of a sectioned document's {@code sections} array. The id is unique
 * within its document; any keys besides id/label/content are carried through
 * untouched in {@code extra}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptSection {

    public static final String ID = "id";
    public static final String LABEL = "label";
    public static final String CONTENT = "content";

    private String id;
    private String label;
    private String content;

    @Builder.Default
    private Map<String, Object> extra = new LinkedHashMap<>();

    public static PromptSection fromMap(Map<?, ?> raw) {
        Map<String, Object> extra = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (!ID.equals(key) && !LABEL.equals(key) && !CONTENT.equals(key)) {
                extra.put(key, entry.getValue());
            }
        }
        return PromptSection.builder()
                .id(raw.get(ID) != null ? String.valueOf(raw.get(ID)) : "unknown")
                .label(raw.get(LABEL) != null ? String.valueOf(raw.get(LABEL)) : null)
                .content(raw.get(CONTENT) != null ? String.valueOf(raw.get(CONTENT)) : "")
                .extra(extra)
                .build();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(ID, id);
        if (label != null) {
            map.put(LABEL, label);
        }
        map.put(CONTENT, content != null ? content : "");
        if (extra != null) {
            map.putAll(extra);
        }
        return map;
    }
}
