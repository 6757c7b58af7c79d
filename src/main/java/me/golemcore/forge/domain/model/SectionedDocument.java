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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Document following the sections convention: an ordered {@code sections}
 * array of {@code {id, label, content}} entries plus {@code variables} and
 * {@code metadata} maps. Any other top-level keys are preserved, and their
 * strings are text leaves like those of a flat document.
 */
public final class SectionedDocument implements PromptDocument {

    private final Map<String, Object> raw;
    private final List<PromptSection> sections;

    SectionedDocument(Map<String, Object> raw) {
        this.raw = raw;
        List<PromptSection> parsed = new ArrayList<>();
        if (raw.get(SECTIONS) instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> sectionMap) {
                    parsed.add(PromptSection.fromMap(sectionMap));
                }
            }
        }
        this.sections = Collections.unmodifiableList(parsed);
    }

    /**
     * Builds the canonical three-key sectioned object.
     */
    public static Map<String, Object> assemble(List<PromptSection> sections, Map<String, Object> variables,
            Map<String, Object> metadata) {
        List<Object> sectionMaps = new ArrayList<>();
        for (PromptSection section : sections) {
            sectionMaps.add(section.toMap());
        }
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(SECTIONS, sectionMaps);
        document.put(VARIABLES, JsonValueSupport.deepCopyMap(variables));
        document.put(METADATA, JsonValueSupport.deepCopyMap(metadata));
        return document;
    }

    /**
     * Sections keyed by id, preserving order. A later duplicate id replaces the
     * earlier entry in place.
     */
    public Map<String, PromptSection> sectionsById() {
        Map<String, PromptSection> byId = new LinkedHashMap<>();
        for (PromptSection section : sections) {
            byId.put(section.getId(), section);
        }
        return byId;
    }

    @Override
    public Set<String> topLevelKeys() {
        return new LinkedHashSet<>(raw.keySet());
    }

    @Override
    public List<TextLeaf> textLeaves() {
        List<TextLeaf> leaves = new ArrayList<>();
        for (PromptSection section : sections) {
            leaves.add(new TextLeaf(SECTIONS + "." + section.getId(), section.getId(),
                    section.getContent() != null ? section.getContent() : ""));
        }
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            if (!SECTIONS.equals(entry.getKey())) {
                FlatDocument.collect(entry.getKey(), entry.getValue(), leaves);
            }
        }
        return leaves;
    }

    @Override
    public List<PromptSection> sections() {
        return sections;
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
