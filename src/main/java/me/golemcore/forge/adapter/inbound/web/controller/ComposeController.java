package me.golemcore.forge.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.forge.adapter.inbound.web.dto.ComposeRequest;
import me.golemcore.forge.adapter.inbound.web.dto.ResolveRequest;
import me.golemcore.forge.adapter.inbound.web.dto.ScanRequest;
import me.golemcore.forge.domain.model.CompositionRequest;
import me.golemcore.forge.domain.model.CompositionResult;
import me.golemcore.forge.domain.model.PromptVersion;
import me.golemcore.forge.domain.model.ResolveStrategy;
import me.golemcore.forge.domain.model.ScanResult;
import me.golemcore.forge.domain.service.CompositionService;
import me.golemcore.forge.domain.service.PromptResolver;
import me.golemcore.forge.security.InjectionScanner;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Composition, single-prompt resolution and dry-run scanning.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ComposeController {

    private final CompositionService compositionService;
    private final PromptResolver resolver;
    private final InjectionScanner scanner;

    @PostMapping("/compose")
    public Mono<ResponseEntity<CompositionResult>> compose(@RequestBody ComposeRequest request) {
        CompositionRequest composition = CompositionRequest.builder()
                .persona(request.getPersona())
                .skills(request.getSkills())
                .constraints(request.getConstraints())
                .variables(request.getVariables())
                .branch(request.getBranch())
                .strategy(ResolveStrategy.fromValue(request.getStrategy()))
                .build();
        return Mono.just(ResponseEntity.ok(compositionService.compose(composition)));
    }

    @PostMapping("/resolve")
    public Mono<ResponseEntity<PromptVersion>> resolve(@RequestBody ResolveRequest request) {
        PromptVersion version = resolver.resolve(request.getSlug(), request.getBranch(), request.getVersion(),
                ResolveStrategy.fromValue(request.getStrategy()));
        return Mono.just(ResponseEntity.ok(version));
    }

    @PostMapping("/scan")
    public Mono<ResponseEntity<ScanResult>> scan(@RequestBody ScanRequest request) {
        if (request.getContent() == null) {
            throw new IllegalArgumentException("content is required");
        }
        return Mono.just(ResponseEntity.ok(scanner.scan(request.getContent())));
    }
}
