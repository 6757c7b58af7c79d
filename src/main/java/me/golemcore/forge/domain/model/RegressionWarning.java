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

/**
 * One triggered regression condition: {@code keys_removed},
 * {@code fields_emptied} or {@code content_reduction}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegressionWarning {

    public static final String KEYS_REMOVED = "keys_removed";
    public static final String FIELDS_EMPTIED = "fields_emptied";
    public static final String CONTENT_REDUCTION = "content_reduction";

    private String type;
    private Object detail; // machine-readable: key list or percentage
    private String message;
}
