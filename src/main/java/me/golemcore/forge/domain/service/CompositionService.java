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
import me.golemcore.forge.domain.model.ComponentRef;
import me.golemcore.forge.domain.model.CompositionManifest;
import me.golemcore.forge.domain.model.CompositionRequest;
import me.golemcore.forge.domain.model.CompositionResult;
import me.golemcore.forge.domain.model.PromptDocument;
import me.golemcore.forge.domain.model.PromptSection;
import me.golemcore.forge.domain.model.PromptType;
import me.golemcore.forge.domain.model.PromptVersion;
import me.golemcore.forge.domain.model.ResolveStrategy;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Assembles an agent prompt from a persona plus skills and constraints.
 *
 * <p>
 * Each component is resolved to a version for provenance and rendered from its
 * effective content, so inherited sections are included. Component texts are
 * joined persona first, then skills, then constraints, before variables are
 * substituted. A skill or constraint that fails to resolve is left out with a
 * warning; a persona failure propagates.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CompositionService {

    private static final List<String> FORMAT_KEYWORDS = List.of("json", "markdown", "plain text", "xml", "yaml");
    private static final String TEXT_KEY = "text";
    private static final int CHARS_PER_TOKEN = 4;

    private final PromptResolver resolver;
    private final PromptRegistryService registry;
    private final PromptTemplateEngine templateEngine;
    private final RecordMapper recordMapper;
    private final Clock clock;

    public CompositionResult compose(CompositionRequest request) {
        if (request.getPersona() == null || request.getPersona().isBlank()) {
            throw new IllegalArgumentException("Persona slug is required");
        }
        String branch = request.getBranch();
        ResolveStrategy strategy = request.getStrategy() != null ? request.getStrategy() : ResolveStrategy.LATEST;

        List<String> warnings = new ArrayList<>();
        List<ComponentRef> components = new ArrayList<>();
        List<String> texts = new ArrayList<>();

        ResolvedComponent persona = resolveComponent(request.getPersona(), PromptType.PERSONA, branch, strategy);
        components.add(persona.ref());
        texts.add(persona.text());

        for (String slug : safe(request.getSkills())) {
            addOptional(slug, PromptType.SKILL, branch, strategy, components, texts, warnings);
        }
        for (String slug : safe(request.getConstraints())) {
            addOptional(slug, PromptType.CONSTRAINT, branch, strategy, components, texts, warnings);
        }

        Map<String, String> variables = request.getVariables() != null ? request.getVariables() : Map.of();
        Set<String> applied = new LinkedHashSet<>();
        String promptText = templateEngine.renderTracking(String.join("\n\n", texts), variables, applied);

        List<String> unresolved = templateEngine.unresolvedPlaceholders(promptText);
        if (!unresolved.isEmpty()) {
            warnings.add("Unresolved variables: " + String.join(", ", unresolved));
        }
        warnings.addAll(detectConflicts(texts));

        Map<String, String> variablesApplied = new LinkedHashMap<>();
        for (String name : applied) {
            variablesApplied.put(name, variables.get(name));
        }
        int estimatedTokens = promptText.length() / CHARS_PER_TOKEN;

        CompositionManifest manifest = CompositionManifest.builder()
                .composedAt(clock.instant())
                .components(components)
                .variablesApplied(variablesApplied)
                .estimatedTokens(estimatedTokens)
                .build();

        log.info("[Compose] Assembled: persona={}, components={}, tokens={}, warnings={}", request.getPersona(),
                components.size(), estimatedTokens, warnings.size());
        return CompositionResult.builder()
                .promptText(promptText)
                .manifest(manifest)
                .warnings(warnings)
                .build();
    }

    private void addOptional(String slug, PromptType type, String branch, ResolveStrategy strategy,
            List<ComponentRef> components, List<String> texts, List<String> warnings) {
        try {
            ResolvedComponent component = resolveComponent(slug, type, branch, strategy);
            components.add(component.ref());
            texts.add(component.text());
        } catch (RuntimeException e) {
            log.warn("[Compose] Skipping {} '{}': {}", type.getValue(), slug, e.getMessage());
            warnings.add("Failed to resolve " + type.getValue() + " '" + slug + "': " + e.getMessage());
        }
    }

    private ResolvedComponent resolveComponent(String slug, PromptType type, String branch,
            ResolveStrategy strategy) {
        PromptVersion version = resolver.resolve(slug, branch, null, strategy);
        Map<String, Object> effective = registry.getEffectiveContent(slug, version.getBranch(),
                version.getVersion());
        ComponentRef ref = ComponentRef.builder()
                .slug(slug)
                .type(type)
                .version(version.getVersion())
                .branch(version.getBranch())
                .build();
        return new ResolvedComponent(ref, extractText(effective));
    }

    /**
     * Section texts joined by blank lines; a flat {@code text} value; or the
     * JSON of the whole document as a last resort.
     */
    String extractText(Map<String, Object> content) {
        List<PromptSection> sections = PromptDocument.of(content).sections();
        if (!sections.isEmpty()) {
            return sections.stream()
                    .map(section -> section.getContent() != null ? section.getContent() : "")
                    .collect(Collectors.joining("\n\n"));
        }
        if (content.get(TEXT_KEY) instanceof String text) {
            return text;
        }
        return recordMapper.toJson(content);
    }

    List<String> detectConflicts(List<String> texts) {
        Set<String> found = new LinkedHashSet<>();
        for (String text : texts) {
            String lower = text.toLowerCase(Locale.ROOT);
            for (String format : FORMAT_KEYWORDS) {
                if (lower.contains("respond in " + format) || lower.contains("output in " + format)) {
                    found.add(format);
                }
            }
        }
        if (found.size() > 1) {
            return List.of("Conflicting output formats detected: " + String.join(", ", found));
        }
        return List.of();
    }

    private static List<String> safe(List<String> slugs) {
        return slugs != null ? slugs : List.of();
    }

    private record ResolvedComponent(ComponentRef ref, String text) {
    }
}
