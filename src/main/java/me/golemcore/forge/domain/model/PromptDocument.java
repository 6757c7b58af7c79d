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

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view over a content document. Content is stored as a plain JSON
 * object; this view lets diff, scan and composition work the same way on the
 * sectioned shape ({@code sections}/{@code variables}/{@code metadata}) and on
 * arbitrary flat objects.
 */
public interface PromptDocument {

    String SECTIONS = "sections";
    String VARIABLES = "variables";
    String METADATA = "metadata";

    /**
     * Top-level keys of the underlying object, in document order.
     */
    Set<String> topLevelKeys();

    /**
     * Every text leaf that should be scanned or rendered.
     */
    List<TextLeaf> textLeaves();

    /**
     * Ordered sections; empty for flat documents.
     */
    List<PromptSection> sections();

    Map<String, Object> variables();

    Map<String, Object> metadata();

    /**
     * A mutable deep copy of the underlying JSON object.
     */
    Map<String, Object> toMap();

    static PromptDocument of(Map<String, Object> content) {
        if (content != null && content.get(SECTIONS) instanceof List<?>) {
            return new SectionedDocument(content);
        }
        return new FlatDocument(content);
    }
}
