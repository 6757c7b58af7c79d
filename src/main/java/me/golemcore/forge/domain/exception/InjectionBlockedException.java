package me.golemcore.forge.domain.exception;

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

import lombok.Getter;
import me.golemcore.forge.domain.model.ScanFinding;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Commit rejected because the content carries critical injection findings.
 * There is no override.
 */
@Getter
public class InjectionBlockedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final transient List<ScanFinding> findings;

    public InjectionBlockedException(List<ScanFinding> findings) {
        super("Critical injection findings detected: " + describe(findings));
        this.findings = List.copyOf(findings);
    }

    private static String describe(List<ScanFinding> findings) {
        return findings.stream()
                .map(f -> f.getPatternName() + ": " + f.getDescription())
                .collect(Collectors.joining("; "));
    }
}
