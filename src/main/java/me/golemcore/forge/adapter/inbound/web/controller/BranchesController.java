package me.golemcore.forge.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.forge.adapter.inbound.web.dto.BranchCreateRequest;
import me.golemcore.forge.adapter.inbound.web.dto.BranchMergeRequest;
import me.golemcore.forge.domain.model.BranchDiff;
import me.golemcore.forge.domain.model.CommitResult;
import me.golemcore.forge.domain.model.Prompt;
import me.golemcore.forge.domain.model.PromptBranch;
import me.golemcore.forge.domain.service.PromptRegistryService;
import me.golemcore.forge.domain.service.VersionControlService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Branch endpoints: create, list, diff, merge and reject.
 */
@RestController
@RequestMapping("/api/prompts/{slug}/branches")
@RequiredArgsConstructor
public class BranchesController {

    private final PromptRegistryService registry;
    private final VersionControlService versionControl;

    @PostMapping
    public Mono<ResponseEntity<PromptBranch>> createBranch(@PathVariable String slug,
            @RequestBody BranchCreateRequest request) {
        Prompt prompt = registry.requirePrompt(slug);
        PromptBranch branch = versionControl.createBranch(prompt.getId(), request.getName(),
                request.getFromBranch());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(branch));
    }

    @GetMapping
    public Mono<ResponseEntity<List<PromptBranch>>> listBranches(@PathVariable String slug) {
        Prompt prompt = registry.requirePrompt(slug);
        return Mono.just(ResponseEntity.ok(versionControl.listBranches(prompt.getId())));
    }

    @GetMapping("/{name}/diff")
    public Mono<ResponseEntity<BranchDiff>> diffBranch(@PathVariable String slug, @PathVariable String name,
            @RequestParam(required = false) String against) {
        Prompt prompt = registry.requirePrompt(slug);
        return Mono.just(ResponseEntity.ok(versionControl.branchDiff(prompt.getId(), name, against)));
    }

    @PostMapping("/{name}/merge")
    public Mono<ResponseEntity<CommitResult>> mergeBranch(@PathVariable String slug, @PathVariable String name,
            @RequestBody BranchMergeRequest request) {
        Prompt prompt = registry.requirePrompt(slug);
        CommitResult result = versionControl.mergeBranch(prompt.getId(), name, request.getTargetBranch(),
                request.getStrategy(), request.getAuthor());
        return Mono.just(ResponseEntity.ok(result));
    }

    @PostMapping("/{name}/reject")
    public Mono<ResponseEntity<PromptBranch>> rejectBranch(@PathVariable String slug, @PathVariable String name) {
        Prompt prompt = registry.requirePrompt(slug);
        return Mono.just(ResponseEntity.ok(versionControl.rejectBranch(prompt.getId(), name)));
    }
}
