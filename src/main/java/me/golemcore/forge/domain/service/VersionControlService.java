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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.forge.domain.exception.DuplicateBranchException;
import me.golemcore.forge.domain.exception.InjectionBlockedException;
import me.golemcore.forge.domain.exception.PromptNotFoundException;
import me.golemcore.forge.domain.exception.RegressionBlockedException;
import me.golemcore.forge.domain.model.BranchDiff;
import me.golemcore.forge.domain.model.BranchStatus;
import me.golemcore.forge.domain.model.CommitResult;
import me.golemcore.forge.domain.model.FieldDiff;
import me.golemcore.forge.domain.model.JsonValueSupport;
import me.golemcore.forge.domain.model.MergeStrategy;
import me.golemcore.forge.domain.model.PromptBranch;
import me.golemcore.forge.domain.model.PromptDocument;
import me.golemcore.forge.domain.model.PromptSection;
import me.golemcore.forge.domain.model.PromptVersion;
import me.golemcore.forge.domain.model.RegressionReport;
import me.golemcore.forge.domain.model.RegressionWarning;
import me.golemcore.forge.domain.model.ScanResult;
import me.golemcore.forge.domain.model.SectionedDocument;
import me.golemcore.forge.domain.model.StructuralDiff;
import me.golemcore.forge.infrastructure.config.ForgeProperties;
import me.golemcore.forge.port.outbound.RecordQuery;
import me.golemcore.forge.port.outbound.RecordStorePort;
import me.golemcore.forge.security.InjectionScanner;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import static me.golemcore.forge.domain.model.RecordCollections.BRANCHES;
import static me.golemcore.forge.domain.model.RecordCollections.FIELD_BRANCH;
import static me.golemcore.forge.domain.model.RecordCollections.FIELD_CREATED_AT;
import static me.golemcore.forge.domain.model.RecordCollections.FIELD_HEAD_VERSION_ID;
import static me.golemcore.forge.domain.model.RecordCollections.FIELD_NAME;
import static me.golemcore.forge.domain.model.RecordCollections.FIELD_PROMPT_ID;
import static me.golemcore.forge.domain.model.RecordCollections.FIELD_STATUS;
import static me.golemcore.forge.domain.model.RecordCollections.FIELD_VERSION;
import static me.golemcore.forge.domain.model.RecordCollections.VERSIONS;

/**
 * Git-like version log for prompt content.
 *
 * <p>
 * Each {@code (promptId, branch)} pair is an append-only, 1-indexed line of
 * versions. Every append goes through the injection scanner, which is a hard
 * gate for critical findings. Guarded mutations additionally run the
 * regression check against the current head; a block there can be overridden
 * by acknowledging the reduction.
 *
 * <p>
 * Reading the head and appending the next version happen under a lock per
 * {@code (promptId, branch)}, so concurrent commits to the same line never
 * reuse a version number. Unrelated lines proceed in parallel.
 */
@Service
@Slf4j
public class VersionControlService {

    private static final String SYSTEM_AUTHOR = "system";

    private final RecordStorePort store;
    private final InjectionScanner scanner;
    private final RegressionGuard regressionGuard;
    private final ContentMerger contentMerger;
    private final StructuralDiffer differ;
    private final RecordMapper recordMapper;
    private final ForgeProperties properties;

    private final Map<String, LineLock> lineLocks = new ConcurrentHashMap<>();

    public VersionControlService(RecordStorePort store, InjectionScanner scanner, RegressionGuard regressionGuard,
            ContentMerger contentMerger, StructuralDiffer differ, RecordMapper recordMapper,
            ForgeProperties properties) {
        this.store = store;
        this.scanner = scanner;
        this.regressionGuard = regressionGuard;
        this.contentMerger = contentMerger;
        this.differ = differ;
        this.recordMapper = recordMapper;
        this.properties = properties;
    }

    public String defaultBranch() {
        return properties.getVcs().getDefaultBranch();
    }

    // ==================== Commits ====================

    /**
     * Append a new version. Only the injection gate applies.
     *
     * @throws InjectionBlockedException
     *             if the content carries a critical finding
     */
    public CommitResult commit(String promptId, Map<String, Object> content, String message, String author,
            String branch) {
        String line = branchOrDefault(branch);
        return withLineLock(promptId, line,
                () -> append(promptId, content, message, author, line, List.of()));
    }

    /**
     * Append a new version after checking it against the current head for
     * accidental content loss.
     *
     * @throws RegressionBlockedException
     *             if the check blocks and {@code acknowledgeReduction} is false
     */
    public CommitResult commitGuarded(String promptId, Map<String, Object> content, String message, String author,
            String branch, boolean acknowledgeReduction) {
        String line = branchOrDefault(branch);
        return withLineLock(promptId, line, () -> {
            Optional<PromptVersion> head = findHead(promptId, line);
            List<RegressionWarning> warnings = head
                    .map(parent -> guard(parent, content, acknowledgeReduction))
                    .orElse(List.of());
            return append(promptId, content, message, author, line, warnings);
        });
    }

    /**
     * Deep-merge {@code patch} into the head content and commit the result,
     * guarded.
     */
    public CommitResult patch(String promptId, Map<String, Object> patch, String message, String author,
            String branch, boolean acknowledgeReduction) {
        String line = branchOrDefault(branch);
        return withLineLock(promptId, line, () -> {
            PromptVersion parent = findHead(promptId, line)
                    .orElseThrow(() -> new PromptNotFoundException("No versions found on branch '" + line
                            + "', use commit to create the first version"));
            Map<String, Object> merged = contentMerger.merge(parent.getContent(), patch);
            List<RegressionWarning> warnings = guard(parent, merged, acknowledgeReduction);
            return append(promptId, merged, message, author, line, warnings);
        });
    }

    /**
     * Copy an old version's content, optionally overlay a patch, and commit it
     * on top of the current head, guarded.
     */
    public CommitResult restore(String promptId, int fromVersion, Map<String, Object> patch, String message,
            String author, String branch, boolean acknowledgeReduction) {
        String line = branchOrDefault(branch);
        return withLineLock(promptId, line, () -> {
            PromptVersion source = getVersion(promptId, fromVersion, line)
                    .orElseThrow(() -> PromptNotFoundException.version(fromVersion, line));
            Map<String, Object> restored = patch != null && !patch.isEmpty()
                    ? contentMerger.merge(source.getContent(), patch)
                    : JsonValueSupport.deepCopyMap(source.getContent());
            String effectiveMessage = message != null && !message.isBlank()
                    ? message
                    : "Restore from version " + fromVersion;
            List<RegressionWarning> warnings = findHead(promptId, line)
                    .map(parent -> guard(parent, restored, acknowledgeReduction))
                    .orElse(List.of());
            return append(promptId, restored, effectiveMessage, author, line, warnings);
        });
    }

    /**
     * Re-commit the content of an old version as a new version. History is
     * never rewritten.
     *
     * @return the new version, or empty if the target version does not exist
     */
    public Optional<CommitResult> rollback(String promptId, int version, String author, String branch) {
        String line = branchOrDefault(branch);
        return withLineLock(promptId, line, () -> {
            Optional<PromptVersion> target = getVersion(promptId, version, line);
            if (target.isEmpty()) {
                log.debug("[VCS] Rollback target missing: promptId={}, branch={}, version={}", promptId, line,
                        version);
                return Optional.empty();
            }
            return Optional.of(append(promptId, target.get().getContent(), "Rollback to version " + version,
                    author, line, List.of()));
        });
    }

    // ==================== Reads ====================

    /**
     * Most recent first. The limit falls back to the configured default and is
     * capped at the configured maximum.
     */
    public List<PromptVersion> history(String promptId, String branch, Integer limit) {
        int effectiveLimit = limit != null && limit > 0 ? limit : properties.getVcs().getHistoryLimit();
        effectiveLimit = Math.min(effectiveLimit, properties.getVcs().getMaxHistoryLimit());
        List<Map<String, Object>> records = StoreCalls.await(store.select(VERSIONS,
                RecordQuery.latest(lineFilter(promptId, branchOrDefault(branch)), FIELD_VERSION, effectiveLimit)));
        return toVersions(records);
    }

    public Optional<PromptVersion> getVersion(String promptId, int version, String branch) {
        Map<String, Object> filters = lineFilter(promptId, branchOrDefault(branch));
        filters.put(FIELD_VERSION, version);
        List<Map<String, Object>> records = StoreCalls.await(store.select(VERSIONS, RecordQuery.where(filters)));
        return toVersions(records).stream().findFirst();
    }

    public Optional<PromptVersion> head(String promptId, String branch) {
        return findHead(promptId, branchOrDefault(branch));
    }

    /**
     * All versions of a line, oldest first.
     */
    public List<PromptVersion> allVersions(String promptId, String branch) {
        List<Map<String, Object>> records = StoreCalls.await(store.select(VERSIONS, RecordQuery.builder()
                .filters(lineFilter(promptId, branchOrDefault(branch)))
                .orderBy(FIELD_VERSION)
                .ascending(true)
                .build()));
        return toVersions(records);
    }

    // ==================== Diffs ====================

    public StructuralDiff diff(String promptId, int fromVersion, int toVersion, String branch) {
        String line = branchOrDefault(branch);
        PromptVersion from = requireVersion(promptId, fromVersion, line);
        PromptVersion to = requireVersion(promptId, toVersion, line);
        StructuralDiff diff = differ.diff(from.getContent(), to.getContent());
        diff.setFromVersion(fromVersion);
        diff.setToVersion(toVersion);
        return diff;
    }

    public FieldDiff fieldDiff(String promptId, int fromVersion, int toVersion, String branch) {
        String line = branchOrDefault(branch);
        PromptVersion from = requireVersion(promptId, fromVersion, line);
        PromptVersion to = requireVersion(promptId, toVersion, line);
        return differ.fieldDiff(from.getContent(), to.getContent(), fromVersion, toVersion);
    }

    // ==================== Branches ====================

    /**
     * Create a branch from the head of {@code fromBranch} and seed it with that
     * head's content as version 1. If the seed commit fails the branch record is
     * removed again.
     */
    public PromptBranch createBranch(String promptId, String name, String fromBranch) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Branch name is required");
        }
        String source = branchOrDefault(fromBranch);
        return withLineLock(promptId, name, () -> {
            if (findBranch(promptId, name).isPresent() || findHead(promptId, name).isPresent()) {
                throw new DuplicateBranchException(name);
            }
            PromptVersion sourceHead = findHead(promptId, source)
                    .orElseThrow(() -> PromptNotFoundException.emptyBranch(source));

            PromptBranch branch = PromptBranch.builder()
                    .promptId(promptId)
                    .name(name)
                    .headVersionId(sourceHead.getId())
                    .baseVersionId(sourceHead.getId())
                    .status(BranchStatus.ACTIVE)
                    .build();
            Map<String, Object> inserted = StoreCalls.await(store.insert(BRANCHES, recordMapper.toRecord(branch)));
            String branchId = (String) inserted.get("id");

            try {
                append(promptId, sourceHead.getContent(),
                        "Branch '" + name + "' from '" + source + "' v" + sourceHead.getVersion(),
                        SYSTEM_AUTHOR, name, List.of());
            } catch (RuntimeException e) {
                log.warn("[VCS] Seed commit failed, removing branch: promptId={}, branch={}, error={}", promptId,
                        name, e.getMessage());
                StoreCalls.await(store.delete(BRANCHES, branchId));
                throw e;
            }

            log.info("[VCS] Branch created: promptId={}, branch={}, from={} v{}", promptId, name, source,
                    sourceHead.getVersion());
            return findBranch(promptId, name)
                    .orElseThrow(() -> new IllegalStateException("Branch vanished after creation: " + name));
        });
    }

    public List<PromptBranch> listBranches(String promptId) {
        List<Map<String, Object>> records = StoreCalls.await(store.select(BRANCHES, RecordQuery.builder()
                .filters(new LinkedHashMap<>(Map.of(FIELD_PROMPT_ID, promptId)))
                .orderBy(FIELD_CREATED_AT)
                .build()));
        return records.stream().map(r -> recordMapper.fromRecord(r, PromptBranch.class)).toList();
    }

    public Optional<PromptBranch> getBranch(String promptId, String name) {
        return findBranch(promptId, name);
    }

    public CommitResult mergeBranch(String promptId, String source, String target, String strategy,
            String author) {
        return mergeBranch(promptId, source, target, MergeStrategy.fromValue(strategy), author);
    }

    /**
     * Fold the head of {@code source} into {@code target} as one new
     * single-parent version on {@code target}, then mark {@code source} as
     * merged.
     */
    public CommitResult mergeBranch(String promptId, String source, String target, MergeStrategy strategy,
            String author) {
        String targetLine = branchOrDefault(target);
        MergeStrategy effective = strategy != null ? strategy : MergeStrategy.THEIRS;
        CommitResult result = withLineLock(promptId, targetLine, () -> {
            PromptVersion sourceHead = findHead(promptId, source)
                    .orElseThrow(() -> new PromptNotFoundException(
                            "No versions on source branch '" + source + "'"));
            PromptVersion targetHead = findHead(promptId, targetLine)
                    .orElseThrow(() -> new PromptNotFoundException(
                            "No versions on target branch '" + targetLine + "'"));

            Map<String, Object> merged = switch (effective) {
            case OURS -> targetHead.getContent();
            case THEIRS -> sourceHead.getContent();
            case SECTION_MERGE -> sectionMerge(targetHead.getContent(), sourceHead.getContent());
            };

            return append(promptId, merged,
                    "Merge '" + source + "' into '" + targetLine + "' (" + effective.getValue() + ")",
                    author, targetLine, List.of());
        });

        findBranch(promptId, source).ifPresent(branch -> updateStatus(branch, BranchStatus.MERGED));
        log.info("[VCS] Branch merged: promptId={}, source={}, target={}, strategy={}", promptId, source,
                targetLine, effective.getValue());
        return result;
    }

    public PromptBranch rejectBranch(String promptId, String name) {
        PromptBranch branch = findBranch(promptId, name)
                .orElseThrow(() -> new PromptNotFoundException("Branch '" + name + "' not found"));
        PromptBranch updated = updateStatus(branch, BranchStatus.REJECTED);
        log.info("[VCS] Branch rejected: promptId={}, branch={}", promptId, name);
        return updated;
    }

    /**
     * Compare the head of {@code name} against the head of {@code against}
     * (default branch when null).
     */
    public BranchDiff branchDiff(String promptId, String name, String against) {
        String base = branchOrDefault(against);
        PromptVersion current = findHead(promptId, base).orElseThrow(() -> PromptNotFoundException.emptyBranch(base));
        PromptVersion proposed = findHead(promptId, name).orElseThrow(() -> PromptNotFoundException.emptyBranch(name));
        return BranchDiff.builder()
                .branchName(name)
                .againstBranch(base)
                .currentContent(current.getContent())
                .proposedContent(proposed.getContent())
                .summary(differ.describeChanges(current.getContent(), proposed.getContent()))
                .build();
    }

    // ==================== Internals ====================

    /**
     * Scan, read head, append. Callers hold the line lock.
     */
    private CommitResult append(String promptId, Map<String, Object> content, String message, String author,
            String branch, List<RegressionWarning> regressionWarnings) {
        ScanResult scan = scanner.scan(content);
        if (scan.isCritical()) {
            log.warn("[VCS] Commit blocked by injection scan: promptId={}, branch={}, findings={}", promptId,
                    branch, scan.getFindings().size());
            throw new InjectionBlockedException(scan.getFindings());
        }

        Optional<PromptVersion> head = findHead(promptId, branch);
        int nextVersion = head.map(v -> v.getVersion() + 1).orElse(1);

        PromptVersion version = PromptVersion.builder()
                .promptId(promptId)
                .version(nextVersion)
                .branch(branch)
                .content(JsonValueSupport.deepCopyMap(content))
                .message(message)
                .author(author != null ? author : SYSTEM_AUTHOR)
                .parentVersionId(head.map(PromptVersion::getId).orElse(null))
                .build();
        Map<String, Object> stored = StoreCalls.await(store.insert(VERSIONS, recordMapper.toRecord(version)));
        PromptVersion saved = recordMapper.fromRecord(stored, PromptVersion.class);

        findBranch(promptId, branch).ifPresent(record -> StoreCalls.await(store.update(BRANCHES, record.getId(),
                Map.of(FIELD_HEAD_VERSION_ID, saved.getId()))));

        log.info("[VCS] Committed: promptId={}, branch={}, version={}, author={}", promptId, branch, nextVersion,
                saved.getAuthor());
        return CommitResult.builder()
                .version(saved)
                .scanWarnings(new ArrayList<>(scan.getFindings()))
                .regressionWarnings(new ArrayList<>(regressionWarnings))
                .build();
    }

    private List<RegressionWarning> guard(PromptVersion parent, Map<String, Object> candidate,
            boolean acknowledgeReduction) {
        RegressionReport report = regressionGuard.check(parent.getContent(), candidate);
        if (report.isBlock() && !acknowledgeReduction) {
            Set<String> unchanged = new TreeSet<>(parent.getContent().keySet());
            unchanged.retainAll(candidate != null ? candidate.keySet() : Set.of());
            log.warn("[VCS] Commit blocked by regression guard: promptId={}, parentVersion={}, reduction={}%",
                    parent.getPromptId(), parent.getVersion(), report.getContentReductionPct());
            throw new RegressionBlockedException(report, parent.getVersion(), parent.getContent().size(),
                    new ArrayList<>(unchanged));
        }
        if (report.isBlock()) {
            log.info("[VCS] Regression block acknowledged: promptId={}, parentVersion={}", parent.getPromptId(),
                    parent.getVersion());
        }
        return report.isWarn() ? report.getWarnings() : List.of();
    }

    /**
     * Target sections first, source sections overlaid by id. Variables and
     * metadata are shallow-merged with source precedence.
     */
    private Map<String, Object> sectionMerge(Map<String, Object> targetContent, Map<String, Object> sourceContent) {
        PromptDocument target = PromptDocument.of(targetContent);
        PromptDocument source = PromptDocument.of(sourceContent);

        Map<String, PromptSection> sections = new LinkedHashMap<>();
        for (PromptSection section : target.sections()) {
            sections.put(section.getId(), section);
        }
        for (PromptSection section : source.sections()) {
            sections.put(section.getId(), section);
        }

        Map<String, Object> variables = new LinkedHashMap<>(target.variables());
        variables.putAll(source.variables());
        Map<String, Object> metadata = new LinkedHashMap<>(target.metadata());
        metadata.putAll(source.metadata());

        return SectionedDocument.assemble(new ArrayList<>(sections.values()), variables, metadata);
    }

    private PromptVersion requireVersion(String promptId, int version, String branch) {
        return getVersion(promptId, version, branch)
                .orElseThrow(() -> PromptNotFoundException.version(version, branch));
    }

    private Optional<PromptVersion> findHead(String promptId, String branch) {
        List<Map<String, Object>> records = StoreCalls.await(store.select(VERSIONS,
                RecordQuery.latest(lineFilter(promptId, branch), FIELD_VERSION, 1)));
        return toVersions(records).stream().findFirst();
    }

    private Optional<PromptBranch> findBranch(String promptId, String name) {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put(FIELD_PROMPT_ID, promptId);
        filters.put(FIELD_NAME, name);
        List<Map<String, Object>> records = StoreCalls.await(store.select(BRANCHES, RecordQuery.where(filters)));
        return records.stream().findFirst().map(r -> recordMapper.fromRecord(r, PromptBranch.class));
    }

    private PromptBranch updateStatus(PromptBranch branch, BranchStatus status) {
        Map<String, Object> updated = StoreCalls.await(store.update(BRANCHES, branch.getId(),
                Map.of(FIELD_STATUS, status.getValue())));
        return recordMapper.fromRecord(updated, PromptBranch.class);
    }

    private List<PromptVersion> toVersions(List<Map<String, Object>> records) {
        return records.stream().map(r -> recordMapper.fromRecord(r, PromptVersion.class)).toList();
    }

    private static Map<String, Object> lineFilter(String promptId, String branch) {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put(FIELD_PROMPT_ID, promptId);
        filters.put(FIELD_BRANCH, branch);
        return filters;
    }

    private String branchOrDefault(String branch) {
        return branch != null && !branch.isBlank() ? branch : defaultBranch();
    }

    private <T> T withLineLock(String promptId, String branch, Supplier<T> action) {
        String key = promptId + "\u0000" + branch;
        LineLock entry = lineLocks.compute(key, (k, existing) -> {
            LineLock held = existing != null ? existing : new LineLock();
            held.holders++;
            return held;
        });
        entry.lock.lock();
        try {
            return action.get();
        } finally {
            entry.lock.unlock();
            lineLocks.computeIfPresent(key, (k, held) -> --held.holders == 0 ? null : held);
        }
    }

    int activeLineLocks() {
        return lineLocks.size();
    }

    // holders is only touched inside ConcurrentHashMap.compute for its key
    private static final class LineLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
