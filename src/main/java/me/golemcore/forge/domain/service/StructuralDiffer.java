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
import me.golemcore.forge.domain.model.ChangeAction;
import me.golemcore.forge.domain.model.FieldChange;
import me.golemcore.forge.domain.model.FieldDiff;
import me.golemcore.forge.domain.model.FieldDiffSummary;
import me.golemcore.forge.domain.model.JsonValueSupport;
import me.golemcore.forge.domain.model.PromptDocument;
import me.golemcore.forge.domain.model.PromptSection;
import me.golemcore.forge.domain.model.SectionChange;
import me.golemcore.forge.domain.model.StructuralDiff;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Compares two content documents.
 *
 * <p>
 * {@link #diff} works at section granularity: sections are matched by id and
 * the {@code variables}/{@code metadata} maps are compared as whole objects.
 * {@link #fieldDiff} is format-agnostic and only looks at top-level keys and
 * their serialized sizes. Neither recurses into nested values.
 */
@Component
@RequiredArgsConstructor
public class StructuralDiffer {

    private static final int PREVIEW_LENGTH = 100;
    private static final int BEFORE_AFTER_PREVIEW_LENGTH = 80;
    static final long MAX_LCS_CELLS = 4_000_000L;

    private final RecordMapper recordMapper;

    public StructuralDiff diff(Map<String, Object> oldContent, Map<String, Object> newContent) {
        PromptDocument oldDoc = PromptDocument.of(oldContent);
        PromptDocument newDoc = PromptDocument.of(newContent);
        Map<String, PromptSection> oldSections = byId(oldDoc.sections());
        Map<String, PromptSection> newSections = byId(newDoc.sections());

        List<SectionChange> changes = new ArrayList<>();

        for (Map.Entry<String, PromptSection> entry : oldSections.entrySet()) {
            String sectionId = entry.getKey();
            PromptSection newSection = newSections.get(sectionId);
            String oldText = textOf(entry.getValue());
            if (newSection == null) {
                changes.add(SectionChange.builder()
                        .sectionId(sectionId)
                        .type(ChangeAction.REMOVED)
                        .content(oldText)
                        .build());
                continue;
            }
            String newText = textOf(newSection);
            if (!oldText.equals(newText)) {
                changes.add(SectionChange.builder()
                        .sectionId(sectionId)
                        .type(ChangeAction.MODIFIED)
                        .before(oldText)
                        .after(newText)
                        .similarity(round(similarity(oldText, newText), 2))
                        .build());
            }
        }

        for (Map.Entry<String, PromptSection> entry : newSections.entrySet()) {
            if (!oldSections.containsKey(entry.getKey())) {
                changes.add(SectionChange.builder()
                        .sectionId(entry.getKey())
                        .type(ChangeAction.ADDED)
                        .content(textOf(entry.getValue()))
                        .build());
            }
        }

        compareWhole(SectionChange.VARIABLES_ID, oldDoc.variables(), newDoc.variables(), changes);
        compareWhole(SectionChange.METADATA_ID, oldDoc.metadata(), newDoc.metadata(), changes);

        return StructuralDiff.builder()
                .changes(changes)
                .summary(summarize(changes))
                .build();
    }

    public FieldDiff fieldDiff(Map<String, Object> oldContent, Map<String, Object> newContent,
            int fromVersion, int toVersion) {
        Map<String, Object> oldMap = oldContent != null ? oldContent : Map.of();
        Map<String, Object> newMap = newContent != null ? newContent : Map.of();

        Set<String> removed = new TreeSet<>(oldMap.keySet());
        removed.removeAll(newMap.keySet());
        Set<String> added = new TreeSet<>(newMap.keySet());
        added.removeAll(oldMap.keySet());
        Set<String> shared = new TreeSet<>(oldMap.keySet());
        shared.retainAll(newMap.keySet());

        List<FieldChange> changes = new ArrayList<>();
        for (String key : removed) {
            changes.add(FieldChange.builder().field(key).action(ChangeAction.REMOVED).build());
        }
        for (String key : added) {
            changes.add(FieldChange.builder().field(key).action(ChangeAction.ADDED).build());
        }

        int modified = 0;
        int unchanged = 0;
        for (String key : shared) {
            Object oldValue = oldMap.get(key);
            Object newValue = newMap.get(key);
            if (JsonValueSupport.jsonEquals(oldValue, newValue)) {
                unchanged++;
            } else {
                changes.add(FieldChange.builder()
                        .field(key)
                        .action(ChangeAction.MODIFIED)
                        .fromLength(recordMapper.serializedLength(oldValue))
                        .toLength(recordMapper.serializedLength(newValue))
                        .build());
                modified++;
            }
        }

        int oldTotal = recordMapper.serializedLength(oldMap);
        int newTotal = recordMapper.serializedLength(newMap);
        double changePct = oldTotal > 0 ? round((newTotal - oldTotal) * 100.0 / oldTotal, 1) : 0.0;

        return FieldDiff.builder()
                .fromVersion(fromVersion)
                .toVersion(toVersion)
                .changes(changes)
                .summary(FieldDiffSummary.builder()
                        .added(added.size())
                        .removed(removed.size())
                        .modified(modified)
                        .unchanged(unchanged)
                        .contentChangePct(changePct)
                        .build())
                .build();
    }

    /**
     * Renders a section diff as {@code +}/{@code -}/{@code ~} lines with
     * truncated previews.
     */
    public String humanReadable(StructuralDiff diff) {
        StringBuilder sb = new StringBuilder();
        sb.append("Summary: ").append(diff.getSummary()).append("\n\n");
        for (SectionChange change : diff.getChanges()) {
            String section = change.getSectionId();
            switch (change.getType()) {
            case ADDED -> sb.append("+ [").append(section).append("] Added: ")
                    .append(preview(change.getContent(), PREVIEW_LENGTH)).append("...\n");
            case REMOVED -> sb.append("- [").append(section).append("] Removed: ")
                    .append(preview(change.getContent(), PREVIEW_LENGTH)).append("...\n");
            case MODIFIED -> {
                Object similarity = change.getSimilarity() != null ? change.getSimilarity() : "?";
                sb.append("~ [").append(section).append("] Modified (similarity: ").append(similarity)
                        .append(")\n");
                sb.append("  Before: ").append(preview(String.valueOf(change.getBefore()),
                        BEFORE_AFTER_PREVIEW_LENGTH)).append("...\n");
                sb.append("  After:  ").append(preview(String.valueOf(change.getAfter()),
                        BEFORE_AFTER_PREVIEW_LENGTH)).append("...\n");
            }
            default -> throw new IllegalStateException("Unexpected change type: " + change.getType());
            }
        }
        return sb.toString().stripTrailing();
    }

    /**
     * One-line description of how {@code proposed} differs from
     * {@code current}, listing section ids and counting variable changes.
     */
    public String describeChanges(Map<String, Object> current, Map<String, Object> proposed) {
        PromptDocument currentDoc = PromptDocument.of(current);
        PromptDocument proposedDoc = PromptDocument.of(proposed);
        Map<String, PromptSection> currentSections = byId(currentDoc.sections());
        Map<String, PromptSection> proposedSections = byId(proposedDoc.sections());

        List<String> parts = new ArrayList<>();

        List<String> addedSections = new ArrayList<>();
        List<String> modifiedSections = new ArrayList<>();
        for (Map.Entry<String, PromptSection> entry : proposedSections.entrySet()) {
            PromptSection existing = currentSections.get(entry.getKey());
            if (existing == null) {
                addedSections.add(entry.getKey());
            } else if (!textOf(existing).equals(textOf(entry.getValue()))) {
                modifiedSections.add(entry.getKey());
            }
        }
        List<String> removedSections = new ArrayList<>();
        for (String id : currentSections.keySet()) {
            if (!proposedSections.containsKey(id)) {
                removedSections.add(id);
            }
        }
        if (!addedSections.isEmpty()) {
            parts.add("Added " + addedSections.size() + " new section(s): " + String.join(", ", addedSections));
        }
        if (!removedSections.isEmpty()) {
            parts.add("Removed " + removedSections.size() + " section(s): " + String.join(", ", removedSections));
        }
        if (!modifiedSections.isEmpty()) {
            parts.add("Modified " + modifiedSections.size() + " section(s): "
                    + String.join(", ", modifiedSections));
        }

        Map<String, Object> currentVars = currentDoc.variables();
        Map<String, Object> proposedVars = proposedDoc.variables();
        long newVars = proposedVars.keySet().stream().filter(k -> !currentVars.containsKey(k)).count();
        long removedVars = currentVars.keySet().stream().filter(k -> !proposedVars.containsKey(k)).count();
        long modifiedVars = currentVars.keySet().stream()
                .filter(proposedVars::containsKey)
                .filter(k -> !JsonValueSupport.jsonEquals(currentVars.get(k), proposedVars.get(k)))
                .count();
        if (newVars > 0) {
            parts.add("Added " + newVars + " variable(s)");
        }
        if (removedVars > 0) {
            parts.add("Removed " + removedVars + " variable(s)");
        }
        if (modifiedVars > 0) {
            parts.add("Modified " + modifiedVars + " variable(s)");
        }
        if (!JsonValueSupport.jsonEquals(currentDoc.metadata(), proposedDoc.metadata())) {
            parts.add("Modified metadata");
        }

        return parts.isEmpty() ? "No changes detected" : String.join("; ", parts);
    }

    /**
     * Normalized similarity of two texts: {@code 2 * LCS / (|a| + |b|)}, in
     * {@code [0, 1]}. Display only.
     *
     * <p>
     * Above {@value #MAX_LCS_CELLS} table cells the ratio is computed from
     * shared character counts instead, which bounds the LCS from above.
     */
    static double similarity(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 1.0;
        }
        if ((long) a.length() * b.length() > MAX_LCS_CELLS) {
            return characterOverlap(a, b, total);
        }
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            char ch = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ch == b.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                } else {
                    current[j] = Math.max(previous[j], current[j - 1]);
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return 2.0 * previous[b.length()] / total;
    }

    private static double characterOverlap(String a, String b, int total) {
        Map<Character, Integer> counts = new HashMap<>();
        for (int i = 0; i < a.length(); i++) {
            counts.merge(a.charAt(i), 1, Integer::sum);
        }
        int shared = 0;
        for (int i = 0; i < b.length(); i++) {
            Integer remaining = counts.get(b.charAt(i));
            if (remaining != null && remaining > 0) {
                counts.put(b.charAt(i), remaining - 1);
                shared++;
            }
        }
        return 2.0 * shared / total;
    }

    private void compareWhole(String key, Map<String, Object> before, Map<String, Object> after,
            List<SectionChange> changes) {
        if (!JsonValueSupport.jsonEquals(before, after)) {
            changes.add(SectionChange.builder()
                    .sectionId(key)
                    .type(ChangeAction.MODIFIED)
                    .before(JsonValueSupport.deepCopyMap(before))
                    .after(JsonValueSupport.deepCopyMap(after))
                    .build());
        }
    }

    private static String summarize(List<SectionChange> changes) {
        long added = changes.stream().filter(c -> c.getType() == ChangeAction.ADDED).count();
        long removed = changes.stream().filter(c -> c.getType() == ChangeAction.REMOVED).count();
        long modified = changes.stream().filter(c -> c.getType() == ChangeAction.MODIFIED).count();

        List<String> parts = new ArrayList<>();
        if (added > 0) {
            parts.add(added + " section(s) added");
        }
        if (removed > 0) {
            parts.add(removed + " section(s) removed");
        }
        if (modified > 0) {
            parts.add(modified + " section(s) modified");
        }
        return parts.isEmpty() ? "No changes" : String.join(", ", parts);
    }

    private static Map<String, PromptSection> byId(List<PromptSection> sections) {
        Map<String, PromptSection> byId = new LinkedHashMap<>();
        for (PromptSection section : sections) {
            byId.put(section.getId(), section);
        }
        return byId;
    }

    private static String textOf(PromptSection section) {
        return section.getContent() != null ? section.getContent() : "";
    }

    private static String preview(String text, int length) {
        if (text == null) {
            return "";
        }
        return text.length() > length ? text.substring(0, length) : text;
    }

    static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
