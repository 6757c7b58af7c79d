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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.forge.domain.model.Prompt;
import me.golemcore.forge.domain.model.UsageRecord;
import me.golemcore.forge.domain.model.UsageStats;
import me.golemcore.forge.port.outbound.RecordQuery;
import me.golemcore.forge.port.outbound.RecordStorePort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static me.golemcore.forge.domain.model.RecordCollections.FIELD_CREATED_AT;
import static me.golemcore.forge.domain.model.RecordCollections.FIELD_PROMPT_ID;
import static me.golemcore.forge.domain.model.RecordCollections.USAGE_LOG;

/**
 * Append-only log of prompt usage outcomes reported by agents, and the
 * aggregates read by the best-performing resolution strategy.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class UsageLogService {

    private static final Set<String> OUTCOMES = Set.of(UsageRecord.OUTCOME_SUCCESS, UsageRecord.OUTCOME_FAILURE,
            UsageRecord.OUTCOME_PARTIAL, UsageRecord.OUTCOME_UNKNOWN);

    private final RecordStorePort store;
    private final PromptRegistryService registry;
    private final RecordMapper recordMapper;

    public UsageRecord record(String promptId, String versionId, String agentId, String outcome, Long latencyMs,
            String feedback) {
        if (promptId == null || promptId.isBlank() || versionId == null || versionId.isBlank()) {
            throw new IllegalArgumentException("promptId and versionId are required");
        }
        String effectiveOutcome = outcome != null ? outcome : UsageRecord.OUTCOME_UNKNOWN;
        if (!OUTCOMES.contains(effectiveOutcome)) {
            throw new IllegalArgumentException("Outcome must be one of success|failure|partial|unknown");
        }
        UsageRecord usage = UsageRecord.builder()
                .promptId(promptId)
                .versionId(versionId)
                .agentId(agentId)
                .outcome(effectiveOutcome)
                .latencyMs(latencyMs)
                .feedback(feedback)
                .build();
        Map<String, Object> stored = StoreCalls.await(store.insert(USAGE_LOG, recordMapper.toRecord(usage)));
        log.debug("[Usage] Recorded: promptId={}, versionId={}, outcome={}", promptId, versionId, effectiveOutcome);
        return recordMapper.fromRecord(stored, UsageRecord.class);
    }

    /**
     * Usage records of a prompt in the order they were logged.
     */
    public List<UsageRecord> findByPrompt(String promptId) {
        List<Map<String, Object>> records = StoreCalls.await(store.select(USAGE_LOG, RecordQuery.builder()
                .filters(new LinkedHashMap<>(Map.of(FIELD_PROMPT_ID, promptId)))
                .orderBy(FIELD_CREATED_AT)
                .build()));
        return records.stream().map(r -> recordMapper.fromRecord(r, UsageRecord.class)).toList();
    }

    public UsageStats statsFor(String slug) {
        Prompt prompt = registry.requirePrompt(slug);
        List<UsageRecord> records = findByPrompt(prompt.getId());

        int total = records.size();
        long successes = records.stream().filter(UsageRecord::isSuccess).count();
        List<Long> latencies = records.stream()
                .map(UsageRecord::getLatencyMs)
                .filter(latency -> latency != null)
                .toList();
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        for (UsageRecord usage : records) {
            String versionId = usage.getVersionId() != null ? usage.getVersionId() : "unknown";
            breakdown.merge(versionId, 1, Integer::sum);
        }

        return UsageStats.builder()
                .promptSlug(slug)
                .totalUses(total)
                .successRate(total > 0 ? (double) successes / total : 0.0)
                .avgLatencyMs(latencies.isEmpty()
                        ? null
                        : latencies.stream().mapToLong(Long::longValue).average().orElse(0.0))
                .versionBreakdown(breakdown)
                .build();
    }
}
