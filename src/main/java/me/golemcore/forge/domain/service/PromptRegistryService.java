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
import me.golemcore.forge.domain.exception.CircularInheritanceException;
import me.golemcore.forge.domain.exception.DuplicateSlugException;
import me.golemcore.forge.domain.exception.InjectionBlockedException;
import me.golemcore.forge.domain.exception.PromptNotFoundException;
import me.golemcore.forge.domain.model.JsonValueSupport;
import me.golemcore.forge.domain.model.Prompt;
import me.golemcore.forge.domain.model.PromptDefinition;
import me.golemcore.forge.domain.model.PromptDocument;
import me.golemcore.forge.domain.model.PromptSection;
import me.golemcore.forge.domain.model.PromptType;
import me.golemcore.forge.domain.model.PromptUpdate;
import me.golemcore.forge.domain.model.PromptVersion;
import me.golemcore.forge.domain.model.ScanResult;
import me.golemcore.forge.domain.model.SectionedDocument;
import me.golemcore.forge.port.outbound.RecordQuery;
import me.golemcore.forge.port.outbound.RecordStorePort;
import me.golemcore.forge.security.InjectionScanner;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

import static me.golemcore.forge.domain.model.RecordCollections.FIELD_CREATED_AT;
import static me.golemcore.forge.domain.model.RecordCollections.FIELD_SLUG;
import static me.golemcore.forge.domain.model.RecordCollections.PROMPTS;

/**
 * Prompt registry: metadata CRUD and inheritance resolution.
 *
 * <p>
 * Prompts are identified by slug and may name a single parent. The effective
 * content of a prompt layers every ancestor's content from the root down,
 * with child sections replacing parent sections that share an id.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PromptRegistryService {

    private static final Pattern SLUG_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9-]*[a-z0-9]$");
    private static final int SLUG_MAX_LENGTH = 100;
    private static final int NAME_MAX_LENGTH = 200;
    private static final String SYSTEM_AUTHOR = "system";

    private final RecordStorePort store;
    private final VersionControlService versionControl;
    private final InjectionScanner scanner;
    private final RecordMapper recordMapper;

    /**
     * Register a prompt. When content is supplied it becomes version 1 on the
     * default branch and passes through the same injection gate as any commit.
     */
    public Prompt createPrompt(PromptDefinition definition) {
        validateSlug(definition.getSlug());
        validateName(definition.getName());
        if (definition.getType() == null) {
            throw new IllegalArgumentException("Prompt type is required");
        }
        if (findBySlug(definition.getSlug()).isPresent()) {
            throw new DuplicateSlugException(definition.getSlug());
        }
        String parentSlug = definition.getParentSlug();
        if (parentSlug != null && !parentSlug.isBlank() && findBySlug(parentSlug).isEmpty()) {
            throw new PromptNotFoundException("Parent prompt '" + parentSlug + "' not found");
        }
        if (definition.getContent() != null) {
            ScanResult scan = scanner.scan(definition.getContent());
            if (scan.isCritical()) {
                log.warn("[Registry] Prompt rejected by injection scan: slug={}", definition.getSlug());
                throw new InjectionBlockedException(scan.getFindings());
            }
        }

        Prompt prompt = Prompt.builder()
                .slug(definition.getSlug())
                .name(definition.getName())
                .type(definition.getType())
                .description(definition.getDescription() != null ? definition.getDescription() : "")
                .tags(definition.getTags() != null ? new ArrayList<>(definition.getTags()) : new ArrayList<>())
                .metadata(JsonValueSupport.deepCopyMap(definition.getMetadata()))
                .archived(false)
                .parentSlug(parentSlug != null && !parentSlug.isBlank() ? parentSlug : null)
                .build();
        Map<String, Object> stored = StoreCalls.await(store.insert(PROMPTS, recordMapper.toRecord(prompt)));
        Prompt saved = recordMapper.fromRecord(stored, Prompt.class);

        if (definition.getContent() != null) {
            versionControl.commit(saved.getId(), definition.getContent(), definition.getInitialMessage(),
                    SYSTEM_AUTHOR, versionControl.defaultBranch());
        }

        log.info("[Registry] Prompt created: slug={}, type={}", saved.getSlug(), saved.getType().getValue());
        return saved;
    }

    public Optional<Prompt> getPrompt(String slug) {
        return findBySlug(slug);
    }

    /**
     * @throws PromptNotFoundException
     *             if no prompt has this slug
     */
    public Prompt requirePrompt(String slug) {
        return findBySlug(slug).orElseThrow(() -> PromptNotFoundException.prompt(slug));
    }

    /**
     * List prompts, optionally narrowed by type, tag and a case-insensitive
     * search over name, description and slug.
     */
    public List<Prompt> listPrompts(PromptType type, String tag, String search, boolean archived) {
        Map<String, Object> filters = new LinkedHashMap<>();
        filters.put("archived", archived);
        if (type != null) {
            filters.put("type", type);
        }
        List<Map<String, Object>> records = StoreCalls.await(store.select(PROMPTS, RecordQuery.builder()
                .filters(filters)
                .orderBy(FIELD_CREATED_AT)
                .build()));

        String needle = search != null && !search.isBlank() ? search.toLowerCase(Locale.ROOT) : null;
        return records.stream()
                .map(r -> recordMapper.fromRecord(r, Prompt.class))
                .filter(p -> tag == null || tag.isBlank() || p.getTags().contains(tag))
                .filter(p -> needle == null || containsIgnoreCase(p.getName(), needle)
                        || containsIgnoreCase(p.getDescription(), needle)
                        || containsIgnoreCase(p.getSlug(), needle))
                .toList();
    }

    public Prompt updatePrompt(String slug, PromptUpdate update) {
        Prompt prompt = requirePrompt(slug);
        Map<String, Object> partial = new LinkedHashMap<>();
        if (update.getName() != null) {
            validateName(update.getName());
            partial.put("name", update.getName());
        }
        if (update.getDescription() != null) {
            partial.put("description", update.getDescription());
        }
        if (update.getTags() != null) {
            partial.put("tags", new ArrayList<>(update.getTags()));
        }
        if (update.getMetadata() != null) {
            partial.put("metadata", JsonValueSupport.deepCopyMap(update.getMetadata()));
        }
        if (partial.isEmpty()) {
            return prompt;
        }
        Map<String, Object> updated = StoreCalls.await(store.update(PROMPTS, prompt.getId(), partial));
        log.info("[Registry] Prompt updated: slug={}, fields={}", slug, partial.keySet());
        return recordMapper.fromRecord(updated, Prompt.class);
    }

    /**
     * Soft delete.
     *
     * @return false if no prompt has this slug
     */
    public boolean archivePrompt(String slug) {
        Optional<Prompt> prompt = findBySlug(slug);
        if (prompt.isEmpty()) {
            return false;
        }
        StoreCalls.await(store.update(PROMPTS, prompt.get().getId(), Map.of("archived", true)));
        log.info("[Registry] Prompt archived: slug={}", slug);
        return true;
    }

    /**
     * The inheritance chain from the prompt itself up to its root ancestor.
     *
     * @throws CircularInheritanceException
     *             if a slug is visited twice
     * @throws PromptNotFoundException
     *             if the prompt or any ancestor is missing
     */
    public List<Prompt> getPromptChain(String slug) {
        List<Prompt> chain = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        String current = slug;
        while (current != null && !current.isBlank()) {
            if (!seen.add(current)) {
                List<String> visited = new ArrayList<>(seen);
                List<String> cycle = new ArrayList<>(visited.subList(visited.indexOf(current), visited.size()));
                cycle.add(current);
                log.warn("[Registry] Circular inheritance: {}", cycle);
                throw new CircularInheritanceException(cycle);
            }
            String lookup = current;
            Prompt prompt = findBySlug(lookup).orElseThrow(() -> lookup.equals(slug)
                    ? PromptNotFoundException.prompt(lookup)
                    : new PromptNotFoundException("Prompt '" + lookup + "' not found in inheritance chain"));
            chain.add(prompt);
            current = prompt.getParentSlug();
        }
        return chain;
    }

    /**
     * Content of a prompt with its ancestors layered underneath.
     *
     * <p>
     * Walks the chain root first. Each prompt contributes the head of
     * {@code branch}, except the prompt itself when {@code version} is given.
     * Ancestors without versions on the branch are skipped. Sections replace
     * same-id sections from earlier layers in place; variables, metadata and
     * any other top-level keys are shallow-merged, later layers winning.
     *
     * @throws PromptNotFoundException
     *             if {@code version} is given and does not exist
     */
    public Map<String, Object> getEffectiveContent(String slug, String branch, Integer version) {
        List<Prompt> chain = new ArrayList<>(getPromptChain(slug));
        Collections.reverse(chain);

        Map<String, PromptSection> sections = new LinkedHashMap<>();
        Map<String, Object> variables = new LinkedHashMap<>();
        Map<String, Object> metadata = new LinkedHashMap<>();
        Map<String, Object> extraKeys = new LinkedHashMap<>();

        for (Prompt prompt : chain) {
            Optional<PromptVersion> layer;
            if (version != null && prompt.getSlug().equals(slug)) {
                layer = Optional.of(versionControl.getVersion(prompt.getId(), version, branch)
                        .orElseThrow(() -> PromptNotFoundException.version(version,
                                branch != null ? branch : versionControl.defaultBranch())));
            } else {
                layer = versionControl.head(prompt.getId(), branch);
            }
            if (layer.isEmpty()) {
                log.debug("[Registry] No content for ancestor: slug={}, branch={}", prompt.getSlug(), branch);
                continue;
            }

            Map<String, Object> content = layer.get().getContent();
            PromptDocument document = PromptDocument.of(content);
            for (PromptSection section : document.sections()) {
                sections.put(section.getId(), section);
            }
            variables.putAll(document.variables());
            metadata.putAll(document.metadata());
            for (Map.Entry<String, Object> entry : content.entrySet()) {
                String key = entry.getKey();
                if (!PromptDocument.SECTIONS.equals(key) && !PromptDocument.VARIABLES.equals(key)
                        && !PromptDocument.METADATA.equals(key)) {
                    extraKeys.put(key, JsonValueSupport.deepCopy(entry.getValue()));
                }
            }
        }

        Map<String, Object> effective = SectionedDocument.assemble(new ArrayList<>(sections.values()), variables,
                metadata);
        extraKeys.forEach(effective::putIfAbsent);
        return effective;
    }

    private Optional<Prompt> findBySlug(String slug) {
        if (slug == null) {
            return Optional.empty();
        }
        List<Map<String, Object>> records = StoreCalls.await(store.select(PROMPTS,
                RecordQuery.where(Map.of(FIELD_SLUG, slug))));
        return records.stream().findFirst().map(r -> recordMapper.fromRecord(r, Prompt.class));
    }

    private static void validateSlug(String slug) {
        if (slug == null || slug.length() < 2 || slug.length() > SLUG_MAX_LENGTH
                || !SLUG_PATTERN.matcher(slug).matches()) {
            throw new IllegalArgumentException("Invalid slug '" + slug
                    + "': use 2-100 lowercase letters, digits and hyphens, not starting or ending with a hyphen");
        }
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank() || name.length() > NAME_MAX_LENGTH) {
            throw new IllegalArgumentException("Name must be between 1 and 200 characters");
        }
    }

    private static boolean containsIgnoreCase(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
