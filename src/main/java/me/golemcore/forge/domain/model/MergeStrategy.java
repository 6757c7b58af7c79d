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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import me.golemcore.forge.domain.exception.UnknownMergeStrategyException;

import java.util.Locale;

/**
 * How the head of a source branch is folded into a target branch.
 *
 * <ul>
 * <li>{@link #OURS} keeps the target head content verbatim</li>
 * <li>{@link #THEIRS} replaces it with the source head content</li>
 * <li>{@link #SECTION_MERGE} unions sections by id, source wins on
 * collisions</li>
 * </ul>
 */
public enum MergeStrategy {

    OURS, THEIRS, SECTION_MERGE;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MergeStrategy fromValue(String value) {
        if (value == null || value.isBlank()) {
            return THEIRS;
        }
        for (MergeStrategy strategy : values()) {
            if (strategy.getValue().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return strategy;
            }
        }
        throw new UnknownMergeStrategyException(value);
    }
}
