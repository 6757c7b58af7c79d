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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of prompt content on one {@code (promptId, branch)} line.
 * {@code version} is the 1-based position within that line.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptVersion {

    private String id;
    private String promptId;
    private int version;
    private String branch;

    @Builder.Default
    private Map<String, Object> content = new LinkedHashMap<>();

    private String message;
    private String author;
    private String parentVersionId; // head of the branch at commit time
    private Instant createdAt;
}
