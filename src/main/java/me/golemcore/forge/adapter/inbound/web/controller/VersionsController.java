package me.golemcore.forge.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.forge.adapter.inbound.web.dto.RollbackRequest;
import me.golemcore.forge.adapter.inbound.web.dto.VersionCreateRequest;
import me.golemcore.forge.adapter.inbound.web.dto.VersionRestoreRequest;
import me.golemcore.forge.domain.model.CommitResult;
import me.golemcore.forge.domain.model.FieldDiff;
import me.golemcore.forge.domain.model.Prompt;
import me.golemcore.forge.domain.model.PromptVersion;
import me.golemcore.forge.domain.model.StructuralDiff;
import me.golemcore.forge.domain.service.PromptRegistryService;
import me.golemcore.forge.domain.service.StructuralDiffer;
import me.golemcore.forge.domain.service.VersionControlService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Version control endpoints: commits, history, diffs, restore and rollback.
 */
@RestController
@RequestMapping("/api/prompts/{slug}")
@RequiredArgsConstructor
public class VersionsController {

    private final PromptRegistryService registry;
    private final VersionControlService versionControl;
    private final StructuralDiffer differ;

    @PostMapping("/versions")
    public Mono<ResponseEntity<CommitResult>> createVersion(@PathVariable String slug,
            @RequestBody VersionCreateRequest request) {
        Prompt prompt = registry.requirePrompt(slug);
        requireContent(request.getContent());
        CommitResult result = versionControl.commitGuarded(prompt.getId(), request.getContent(),
                request.getMessage(), request.getAuthor(), request.getBranch(), request.isAcknowledgeReduction());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(result));
    }

    @PatchMapping("/versions")
    public Mono<ResponseEntity<CommitResult>> patchVersion(@PathVariable String slug,
            @RequestBody VersionCreateRequest request) {
        Prompt prompt = registry.requirePrompt(slug);
        requireContent(request.getContent());
        CommitResult result = versionControl.patch(prompt.getId(), request.getContent(), request.getMessage(),
                request.getAuthor(), request.getBranch(), request.isAcknowledgeReduction());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(result));
    }

    @PostMapping("/versions/restore")
    public Mono<ResponseEntity<CommitResult>> restoreVersion(@PathVariable String slug,
            @RequestBody VersionRestoreRequest request) {
        Prompt prompt = registry.requirePrompt(slug);
        if (request.getFromVersion() == null) {
            throw new IllegalArgumentException("fromVersion is required");
        }
        CommitResult result = versionControl.restore(prompt.getId(), request.getFromVersion(), request.getPatch(),
                request.getMessage(), request.getAuthor(), request.getBranch(), request.isAcknowledgeReduction());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(result));
    }

    @GetMapping("/versions")
    public Mono<ResponseEntity<List<PromptVersion>>> listVersions(@PathVariable String slug,
            @RequestParam(required = false) String branch,
            @RequestParam(required = false) Integer limit) {
        Prompt prompt = registry.requirePrompt(slug);
        return Mono.just(ResponseEntity.ok(versionControl.history(prompt.getId(), branch, limit)));
    }

    @GetMapping("/versions/{version}")
    public Mono<ResponseEntity<PromptVersion>> getVersion(@PathVariable String slug, @PathVariable int version,
            @RequestParam(required = false) String branch) {
        Prompt prompt = registry.requirePrompt(slug);
        PromptVersion found = versionControl.getVersion(prompt.getId(), version, branch)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Version " + version + " not found"));
        return Mono.just(ResponseEntity.ok(found));
    }

    @GetMapping("/versions/{from}/diff/{to}")
    public Mono<ResponseEntity<FieldDiff>> fieldDiff(@PathVariable String slug, @PathVariable int from,
            @PathVariable int to, @RequestParam(required = false) String branch) {
        Prompt prompt = registry.requirePrompt(slug);
        return Mono.just(ResponseEntity.ok(versionControl.fieldDiff(prompt.getId(), from, to, branch)));
    }

    @GetMapping("/diff")
    public Mono<ResponseEntity<StructuralDiff>> diff(@PathVariable String slug,
            @RequestParam int from, @RequestParam int to,
            @RequestParam(required = false) String branch) {
        Prompt prompt = registry.requirePrompt(slug);
        return Mono.just(ResponseEntity.ok(versionControl.diff(prompt.getId(), from, to, branch)));
    }

    @GetMapping("/diff/text")
    public Mono<ResponseEntity<Map<String, Object>>> diffText(@PathVariable String slug,
            @RequestParam int from, @RequestParam int to,
            @RequestParam(required = false) String branch) {
        Prompt prompt = registry.requirePrompt(slug);
        StructuralDiff diff = versionControl.diff(prompt.getId(), from, to, branch);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("fromVersion", from);
        body.put("toVersion", to);
        body.put("text", differ.humanReadable(diff));
        return Mono.just(ResponseEntity.ok(body));
    }

    @PostMapping("/rollback")
    public Mono<ResponseEntity<CommitResult>> rollback(@PathVariable String slug,
            @RequestBody RollbackRequest request) {
        Prompt prompt = registry.requirePrompt(slug);
        if (request.getVersion() == null) {
            throw new IllegalArgumentException("version is required");
        }
        CommitResult result = versionControl.rollback(prompt.getId(), request.getVersion(), request.getAuthor(),
                request.getBranch())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Version " + request.getVersion() + " not found"));
        return Mono.just(ResponseEntity.ok(result));
    }

    private static void requireContent(Map<String, Object> content) {
        if (content == null) {
            throw new IllegalArgumentException("content is required");
        }
    }
}
