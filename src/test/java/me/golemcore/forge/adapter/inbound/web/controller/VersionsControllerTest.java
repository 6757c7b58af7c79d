package me.golemcore.forge.adapter.inbound.web.controller;

import me.golemcore.forge.adapter.inbound.web.dto.RollbackRequest;
import me.golemcore.forge.adapter.inbound.web.dto.VersionCreateRequest;
import me.golemcore.forge.adapter.inbound.web.dto.VersionRestoreRequest;
import me.golemcore.forge.domain.exception.PromptNotFoundException;
import me.golemcore.forge.domain.exception.RegressionBlockedException;
import me.golemcore.forge.domain.model.PromptDefinition;
import me.golemcore.forge.domain.model.PromptType;
import me.golemcore.forge.domain.model.PromptVersion;
import me.golemcore.forge.testsupport.ForgeTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static me.golemcore.forge.testsupport.ForgeTestContext.sections;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import reactor.test.StepVerifier;

class VersionsControllerTest {

    private static final String SLUG = "code-reviewer";

    private ForgeTestContext ctx;
    private VersionsController controller;

    @BeforeEach
    void setUp() {
        ctx = new ForgeTestContext();
        controller = new VersionsController(ctx.registry, ctx.versionControl, ctx.differ);
        ctx.registry.createPrompt(PromptDefinition.builder()
                .slug(SLUG)
                .name("Code Reviewer")
                .type(PromptType.PERSONA)
                .content(sections("identity", "You review code", "tone", "Be kind"))
                .build());
    }

    @Test
    void shouldCreateVersion() {
        StepVerifier.create(controller.createVersion(SLUG, create(sections("identity", "You review Java code",
                "tone", "Be kind"), false)))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals(2, response.getBody().getVersion().getVersion());
                    assertEquals("Update", response.getBody().getVersion().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldBlockRegressionUnlessAcknowledged() {
        Map<String, Object> big = new LinkedHashMap<>();
        big.put("a", "x".repeat(200));
        big.put("b", "y".repeat(200));
        controller.createVersion(SLUG, create(big, true)).block();

        assertThrows(RegressionBlockedException.class,
                () -> controller.createVersion(SLUG, create(Map.of("a", "x".repeat(20)), false)));

        StepVerifier.create(controller.createVersion(SLUG, create(Map.of("a", "x".repeat(20)), true)))
                .assertNext(response -> assertEquals(2, response.getBody().getRegressionWarnings().size()))
                .verifyComplete();
    }

    @Test
    void shouldRequireContent() {
        assertThrows(IllegalArgumentException.class, () -> controller.createVersion(SLUG, create(null, false)));
    }

    @Test
    void shouldFailForUnknownPrompt() {
        assertThrows(PromptNotFoundException.class,
                () -> controller.listVersions("ghost", null, null));
    }

    @Test
    void shouldPatchHead() {
        VersionCreateRequest request = create(Map.of("metadata", Map.of("owner", "platform")), false);

        StepVerifier.create(controller.patchVersion(SLUG, request))
                .assertNext(response -> {
                    Map<String, Object> content = response.getBody().getVersion().getContent();
                    assertEquals(Map.of("owner", "platform"), content.get("metadata"));
                    assertTrue(content.containsKey("sections"));
                })
                .verifyComplete();
    }

    @Test
    void shouldRestoreVersion() {
        controller.createVersion(SLUG, create(sections("identity", "Changed", "tone", "Be kind"), false)).block();
        VersionRestoreRequest request = new VersionRestoreRequest();
        request.setFromVersion(1);

        StepVerifier.create(controller.restoreVersion(SLUG, request))
                .assertNext(response -> {
                    PromptVersion version = response.getBody().getVersion();
                    assertEquals(3, version.getVersion());
                    assertEquals("Restore from version 1", version.getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldListAndFetchVersions() {
        controller.createVersion(SLUG, create(sections("identity", "Second", "tone", "Be kind"), false)).block();

        StepVerifier.create(controller.listVersions(SLUG, null, 10))
                .assertNext(response -> assertEquals(List.of(2, 1),
                        response.getBody().stream().map(PromptVersion::getVersion).toList()))
                .verifyComplete();
        StepVerifier.create(controller.getVersion(SLUG, 1, null))
                .assertNext(response -> assertEquals(1, response.getBody().getVersion()))
                .verifyComplete();
        assertThrows(ResponseStatusException.class, () -> controller.getVersion(SLUG, 7, null));
    }

    @Test
    void shouldRenderDiffs() {
        controller.createVersion(SLUG, create(sections("identity", "You review Go code", "format", "Bullets"),
                false)).block();

        StepVerifier.create(controller.diff(SLUG, 1, 2, null))
                .assertNext(response -> assertEquals(
                        "1 section(s) added, 1 section(s) removed, 1 section(s) modified",
                        response.getBody().getSummary()))
                .verifyComplete();
        StepVerifier.create(controller.diffText(SLUG, 1, 2, null))
                .assertNext(response -> {
                    String text = (String) response.getBody().get("text");
                    assertTrue(text.contains("- [tone] Removed: Be kind..."));
                    assertEquals(1, response.getBody().get("fromVersion"));
                })
                .verifyComplete();
        StepVerifier.create(controller.fieldDiff(SLUG, 1, 2, null))
                .assertNext(response -> assertEquals(1, response.getBody().getSummary().getModified()))
                .verifyComplete();
    }

    @Test
    void shouldRollback() {
        controller.createVersion(SLUG, create(sections("identity", "Other", "tone", "Be kind"), false)).block();
        RollbackRequest request = new RollbackRequest();
        request.setVersion(1);

        StepVerifier.create(controller.rollback(SLUG, request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("Rollback to version 1", response.getBody().getVersion().getMessage());
                })
                .verifyComplete();

        request.setVersion(99);
        ResponseStatusException error = assertThrows(ResponseStatusException.class,
                () -> controller.rollback(SLUG, request));
        assertEquals(HttpStatus.NOT_FOUND, error.getStatusCode());
    }

    private static VersionCreateRequest create(Map<String, Object> content, boolean acknowledge) {
        VersionCreateRequest request = new VersionCreateRequest();
        request.setContent(content);
        request.setAcknowledgeReduction(acknowledge);
        return request;
    }
}
