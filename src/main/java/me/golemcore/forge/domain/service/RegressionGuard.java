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

import lombok.RequiredArgsConstructor;
import me.golemcore.forge.domain.model.JsonValueSupport;
import me.golemcore.forge.domain.model.RegressionReport;
import me.golemcore.forge.domain.model.RegressionWarning;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Heuristic check for accidental content loss between a document and its
 * successor. Thresholds are fixed.
 */
@Component
@RequiredArgsConstructor
public class RegressionGuard {

    static final double WARN_REDUCTION_PCT = 20.0;
    static final double BLOCK_REDUCTION_PCT = 50.0;
    static final double BLOCK_KEYS_REMOVED_PCT = 50.0;

    private final RecordMapper recordMapper;

    public RegressionReport check(Map<String, Object> parent, Map<String, Object> candidate) {
        Map<String, Object> oldMap = parent != null ? parent : Map.of();
        Map<String, Object> newMap = candidate != null ? candidate : Map.of();

        Set<String> removed = new TreeSet<>(oldMap.keySet());
        removed.removeAll(newMap.keySet());
        Set<String> added = new TreeSet<>(newMap.keySet());
        added.removeAll(oldMap.keySet());

        List<String> emptied = new ArrayList<>();
        for (String key : new TreeSet<>(oldMap.keySet())) {
            if (newMap.containsKey(key)
                    && JsonValueSupport.isTruthy(oldMap.get(key))
                    && JsonValueSupport.isEmptyTextOrList(newMap.get(key))) {
                emptied.add(key);
            }
        }

        int oldSize = recordMapper.serializedLength(oldMap);
        int newSize = recordMapper.serializedLength(newMap);
        double reductionPct = 0.0;
        if (oldSize > 0 && newSize < oldSize) {
            reductionPct = StructuralDiffer.round((oldSize - newSize) * 100.0 / oldSize, 1);
        }
        double keysRemovedPct = oldMap.isEmpty() ? 0.0 : removed.size() * 100.0 / oldMap.size();

        List<RegressionWarning> warnings = new ArrayList<>();
        if (!removed.isEmpty()) {
            warnings.add(RegressionWarning.builder()
                    .type(RegressionWarning.KEYS_REMOVED)
                    .detail(new ArrayList<>(removed))
                    .message("Keys removed: " + String.join(", ", removed))
                    .build());
        }
        if (!emptied.isEmpty()) {
            warnings.add(RegressionWarning.builder()
                    .type(RegressionWarning.FIELDS_EMPTIED)
                    .detail(new ArrayList<>(emptied))
                    .message("Fields emptied: " + String.join(", ", emptied))
                    .build());
        }
        if (reductionPct > WARN_REDUCTION_PCT) {
            warnings.add(RegressionWarning.builder()
                    .type(RegressionWarning.CONTENT_REDUCTION)
                    .detail(reductionPct)
                    .message(String.format(Locale.ROOT, "Content reduced by %.1f%%", reductionPct))
                    .build());
        }

        boolean warn = !removed.isEmpty() || reductionPct > WARN_REDUCTION_PCT;
        boolean block = reductionPct > BLOCK_REDUCTION_PCT || keysRemovedPct > BLOCK_KEYS_REMOVED_PCT;

        return RegressionReport.builder()
                .keysRemoved(new ArrayList<>(removed))
                .keysAdded(new ArrayList<>(added))
                .fieldsEmptied(emptied)
                .contentReductionPct(reductionPct)
                .keysRemovedPct(StructuralDiffer.round(keysRemovedPct, 1))
                .warn(warn)
                .block(block)
                .warnings(warnings)
                .build();
    }
}
