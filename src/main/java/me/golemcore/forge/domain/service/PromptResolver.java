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
import me.golemcore.forge.domain.exception.PromptNotFoundException;
import me.golemcore.forge.domain.model.Prompt;
import me.golemcore.forge.domain.model.PromptVersion;
import me.golemcore.forge.domain.model.ResolveStrategy;
import me.golemcore.forge.domain.model.UsageRecord;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a slug into a concrete version using a resolution strategy.
 *
 * <ul>
 * <li>{@code latest} - head of the branch</li>
 * <li>{@code pinned} - exact version number</li>
 * <li>{@code best_performing} - highest recorded success rate among versions
 * with at least {@value #MIN_USES} uses, otherwise latest</li>
 * </ul>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PromptResolver {

    static final int MIN_USES = 3;

    private final PromptRegistryService registry;
    private final VersionControlService versionControl;
    private final UsageLogService usageLog;

    /**
     * @throws PromptNotFoundException
     *             if the prompt is missing or archived, or no matching version
     *             exists
     * @throws IllegalArgumentException
     *             if {@code pinned} is requested without a version
     */
    public PromptVersion resolve(String slug, String branch, Integer version, ResolveStrategy strategy) {
        Prompt prompt = registry.getPrompt(slug)
                .filter(p -> !p.isArchived())
                .orElseThrow(() -> new PromptNotFoundException("Prompt '" + slug + "' not found or archived"));
        String line = branch != null && !branch.isBlank() ? branch : versionControl.defaultBranch();
        ResolveStrategy effective = strategy != null ? strategy : ResolveStrategy.LATEST;

        PromptVersion resolved = switch (effective) {
        case PINNED -> {
            if (version == null) {
                throw new IllegalArgumentException("Pinned strategy requires a version number");
            }
            yield versionControl.getVersion(prompt.getId(), version, line)
                    .orElseThrow(() -> PromptNotFoundException.version(version, line));
        }
        case BEST_PERFORMING -> resolveBestPerforming(prompt, line);
        case LATEST -> resolveLatest(prompt, line);
        };
        log.debug("[Resolver] Resolved: slug={}, branch={}, strategy={}, version={}", slug, line,
                effective.getValue(), resolved.getVersion());
        return resolved;
    }

    private PromptVersion resolveLatest(Prompt prompt, String branch) {
        return versionControl.head(prompt.getId(), branch)
                .orElseThrow(() -> new PromptNotFoundException(
                        "No versions found for prompt '" + prompt.getSlug() + "' on branch '" + branch + "'"));
    }

    private PromptVersion resolveBestPerforming(Prompt prompt, String branch) {
        List<PromptVersion> versions = versionControl.allVersions(prompt.getId(), branch);
        if (versions.isEmpty()) {
            throw new PromptNotFoundException(
                    "No versions found for prompt '" + prompt.getSlug() + "' on branch '" + branch + "'");
        }

        List<UsageRecord> records = usageLog.findByPrompt(prompt.getId());
        if (records.isEmpty()) {
            log.debug("[Resolver] No usage data, falling back to latest: slug={}", prompt.getSlug());
            return resolveLatest(prompt, branch);
        }

        Map<String, int[]> counts = new HashMap<>();
        for (UsageRecord usage : records) {
            int[] tally = counts.computeIfAbsent(usage.getVersionId(), id -> new int[2]);
            tally[0]++;
            if (usage.isSuccess()) {
                tally[1]++;
            }
        }

        PromptVersion best = null;
        double bestRate = -1.0;
        for (PromptVersion candidate : versions) {
            int[] tally = counts.get(candidate.getId());
            if (tally == null || tally[0] < MIN_USES) {
                continue;
            }
            double rate = (double) tally[1] / tally[0];
            if (rate > bestRate) {
                best = candidate;
                bestRate = rate;
            }
        }

        if (best == null) {
            log.debug("[Resolver] Not enough usage data, falling back to latest: slug={}", prompt.getSlug());
            return resolveLatest(prompt, branch);
        }
        log.info("[Resolver] Best performing: slug={}, version={}, successRate={}", prompt.getSlug(),
                best.getVersion(), bestRate);
        return best;
    }
}
