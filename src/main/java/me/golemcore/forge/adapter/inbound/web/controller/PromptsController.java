package me.golemcore.forge.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.forge.adapter.inbound.web.dto.PromptCreateRequest;
import me.golemcore.forge.adapter.inbound.web.dto.PromptUpdateRequest;
import me.golemcore.forge.domain.model.Prompt;
import me.golemcore.forge.domain.model.PromptDefinition;
import me.golemcore.forge.domain.model.PromptType;
import me.golemcore.forge.domain.model.PromptUpdate;
import me.golemcore.forge.domain.service.PromptRegistryService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Prompt registry endpoints.
 */
@RestController
@RequestMapping("/api/prompts")
@RequiredArgsConstructor
public class PromptsController {

    private final PromptRegistryService registry;

    @PostMapping
    public Mono<ResponseEntity<Prompt>> createPrompt(@RequestBody PromptCreateRequest request) {
        PromptDefinition definition = PromptDefinition.builder()
                .slug(request.getSlug())
                .name(request.getName())
                .type(PromptType.fromValue(request.getType()))
                .description(request.getDescription())
                .tags(request.getTags())
                .metadata(request.getMetadata())
                .content(request.getContent())
                .initialMessage(request.getInitialMessage())
                .parentSlug(request.getParentSlug())
                .build();
        Prompt prompt = registry.createPrompt(definition);
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(prompt));
    }

    @GetMapping
    public Mono<ResponseEntity<List<Prompt>>> listPrompts(
            @RequestParam(required = false) String type,
            @RequestParam(required = false) String tag,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "false") boolean archived) {
        PromptType promptType = type != null && !type.isBlank() ? PromptType.fromValue(type) : null;
        return Mono.just(ResponseEntity.ok(registry.listPrompts(promptType, tag, search, archived)));
    }

    @GetMapping("/{slug}")
    public Mono<ResponseEntity<Prompt>> getPrompt(@PathVariable String slug) {
        Prompt prompt = registry.getPrompt(slug)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "Prompt '" + slug + "' not found"));
        return Mono.just(ResponseEntity.ok(prompt));
    }

    @PutMapping("/{slug}")
    public Mono<ResponseEntity<Prompt>> updatePrompt(@PathVariable String slug,
            @RequestBody PromptUpdateRequest request) {
        PromptUpdate update = PromptUpdate.builder()
                .name(request.getName())
                .description(request.getDescription())
                .tags(request.getTags())
                .metadata(request.getMetadata())
                .build();
        return Mono.just(ResponseEntity.ok(registry.updatePrompt(slug, update)));
    }

    @DeleteMapping("/{slug}")
    public Mono<ResponseEntity<Void>> archivePrompt(@PathVariable String slug) {
        if (!registry.archivePrompt(slug)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Prompt '" + slug + "' not found");
        }
        return Mono.just(ResponseEntity.noContent().build());
    }

    @GetMapping("/{slug}/chain")
    public Mono<ResponseEntity<List<Prompt>>> getChain(@PathVariable String slug) {
        return Mono.just(ResponseEntity.ok(registry.getPromptChain(slug)));
    }

    @GetMapping("/{slug}/effective")
    public Mono<ResponseEntity<Map<String, Object>>> getEffectiveContent(@PathVariable String slug,
            @RequestParam(required = false) String branch,
            @RequestParam(required = false) Integer version) {
        return Mono.just(ResponseEntity.ok(registry.getEffectiveContent(slug, branch, version)));
    }
}
