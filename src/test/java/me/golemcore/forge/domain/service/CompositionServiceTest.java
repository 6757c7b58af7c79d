package me.golemcore.forge.domain.service;

import me.golemcore.forge.domain.exception.PromptNotFoundException;
import me.golemcore.forge.domain.model.ComponentRef;
import me.golemcore.forge.domain.model.CompositionRequest;
import me.golemcore.forge.domain.model.CompositionResult;
import me.golemcore.forge.domain.model.PromptDefinition;
import me.golemcore.forge.domain.model.PromptType;
import me.golemcore.forge.domain.model.PromptVersion;
import me.golemcore.forge.domain.model.ResolveStrategy;
import me.golemcore.forge.testsupport.ForgeTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static me.golemcore.forge.testsupport.ForgeTestContext.sections;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CompositionServiceTest {

    private ForgeTestContext ctx;
    private CompositionService composition;

    @BeforeEach
    void setUp() {
        ctx = new ForgeTestContext();
        composition = ctx.composition;
    }

    @Test
    void shouldComposePersonaSkillsAndConstraintsInOrder() {
        create("reviewer", PromptType.PERSONA, sections("identity", "You are {{name}}.", "tone", "Be direct."), null);
        create("summarize", PromptType.SKILL, sections("rules", "Summarize changes."), null);
        create("no-secrets", PromptType.CONSTRAINT, sections("rules", "Never print secrets."), null);
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("name", "Ada");
        variables.put("unused", "x");

        CompositionResult result = composition.compose(CompositionRequest.builder()
                .persona("reviewer")
                .skills(List.of("summarize"))
                .constraints(List.of("no-secrets"))
                .variables(variables)
                .build());

        assertEquals("You are Ada.\n\nBe direct.\n\nSummarize changes.\n\nNever print secrets.",
                result.getPromptText());
        assertTrue(result.getWarnings().isEmpty());
        assertEquals(Map.of("name", "Ada"), result.getManifest().getVariablesApplied());
        assertEquals(result.getPromptText().length() / 4, result.getManifest().getEstimatedTokens());
        assertEquals(ForgeTestContext.NOW, result.getManifest().getComposedAt());

        List<ComponentRef> components = result.getManifest().getComponents();
        assertEquals(List.of("reviewer", "summarize", "no-secrets"),
                components.stream().map(ComponentRef::getSlug).toList());
        assertEquals(List.of(PromptType.PERSONA, PromptType.SKILL, PromptType.CONSTRAINT),
                components.stream().map(ComponentRef::getType).toList());
        assertEquals(1, components.get(0).getVersion());
        assertEquals("main", components.get(0).getBranch());
    }

    @Test
    void shouldWarnAboutConflictingOutputFormats() {
        create("api-bot", PromptType.PERSONA, sections("identity", "Always respond in JSON."), null);
        create("docs-writer", PromptType.SKILL, sections("rules", "Output in Markdown please."), null);

        CompositionResult result = composition.compose(CompositionRequest.builder()
                .persona("api-bot")
                .skills(List.of("docs-writer"))
                .build());

        assertEquals(List.of("Conflicting output formats detected: json, markdown"), result.getWarnings());
    }

    @Test
    void shouldWarnAboutUnresolvedVariables() {
        create("greeter", PromptType.PERSONA, sections("identity", "Hello {{user}} from {{team}} and {{user}}"),
                null);

        CompositionResult result = composition.compose(CompositionRequest.builder()
                .persona("greeter")
                .variables(Map.of("team", "core"))
                .build());

        assertEquals("Hello {{user}} from core and {{user}}", result.getPromptText());
        assertEquals(List.of("Unresolved variables: user"), result.getWarnings());
    }

    @Test
    void shouldSkipMissingOptionalComponentsWithWarning() {
        create("helper", PromptType.PERSONA, sections("identity", "You help."), null);

        CompositionResult result = composition.compose(CompositionRequest.builder()
                .persona("helper")
                .skills(List.of("missing-skill"))
                .constraints(List.of("missing-rule"))
                .build());

        assertEquals("You help.", result.getPromptText());
        assertEquals(List.of(
                "Failed to resolve skill 'missing-skill': Prompt 'missing-skill' not found or archived",
                "Failed to resolve constraint 'missing-rule': Prompt 'missing-rule' not found or archived"),
                result.getWarnings());
        assertEquals(1, result.getManifest().getComponents().size());
    }

    @Test
    void shouldFailWhenPersonaCannotBeResolved() {
        assertThrows(PromptNotFoundException.class,
                () -> composition.compose(CompositionRequest.builder().persona("nobody").build()));
        assertThrows(IllegalArgumentException.class,
                () -> composition.compose(CompositionRequest.builder().persona(" ").build()));
    }

    @Test
    void shouldIncludeInheritedSections() {
        create("base-persona", PromptType.PERSONA, sections("identity", "Base identity.", "tone", "Calm."), null);
        create("derived-persona", PromptType.PERSONA, sections("tone", "Energetic."), "base-persona");

        CompositionResult result = composition.compose(CompositionRequest.builder()
                .persona("derived-persona")
                .build());

        assertEquals("Base identity.\n\nEnergetic.", result.getPromptText());
    }

    @Test
    void shouldUseBestPerformingVersionForProvenanceAndText() {
        String id = create("tuned", PromptType.PERSONA, sections("identity", "First draft."), null);
        PromptVersion v1 = ctx.versionControl.head(id, null).orElseThrow();
        ctx.versionControl.commit(id, sections("identity", "Second draft."), "v2", "ana", null);
        for (int i = 0; i < 3; i++) {
            ctx.usageLog.record(id, v1.getId(), "agent", "success", null, null);
        }

        CompositionResult result = composition.compose(CompositionRequest.builder()
                .persona("tuned")
                .strategy(ResolveStrategy.BEST_PERFORMING)
                .build());

        assertEquals("First draft.", result.getPromptText());
        assertEquals(1, result.getManifest().getComponents().get(0).getVersion());
    }

    @Test
    void shouldExtractTextFromFlatContent() {
        assertEquals("Plain body", composition.extractText(Map.of("text", "Plain body")));
        assertEquals("{\"a\":1}", composition.extractText(Map.of("a", 1)));
    }

    @Test
    void shouldDetectNoConflictForSingleFormat() {
        assertTrue(composition.detectConflicts(List.of("Respond in JSON", "Output in json")).isEmpty());
    }

    private String create(String slug, PromptType type, Map<String, Object> content, String parent) {
        return ctx.registry.createPrompt(PromptDefinition.builder()
                .slug(slug)
                .name(slug)
                .type(type)
                .content(content)
                .parentSlug(parent)
                .build()).getId();
    }
}
