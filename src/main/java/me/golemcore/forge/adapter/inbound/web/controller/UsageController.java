package me.golemcore.forge.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.forge.adapter.inbound.web.dto.UsageLogRequest;
import me.golemcore.forge.domain.model.UsageRecord;
import me.golemcore.forge.domain.model.UsageStats;
import me.golemcore.forge.domain.service.UsageLogService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Prompt usage logging and statistics endpoints.
 */
@RestController
@RequestMapping("/api/usage")
@RequiredArgsConstructor
public class UsageController {

    private final UsageLogService usageLogService;

    @PostMapping
    public Mono<ResponseEntity<UsageRecord>> logUsage(@RequestBody UsageLogRequest request) {
        UsageRecord record = usageLogService.record(request.getPromptId(), request.getVersionId(),
                request.getAgentId(), request.getOutcome(), request.getLatencyMs(), request.getFeedback());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(record));
    }

    @GetMapping("/stats/{slug}")
    public Mono<ResponseEntity<UsageStats>> getStats(@PathVariable String slug) {
        return Mono.just(ResponseEntity.ok(usageLogService.statsFor(slug)));
    }
}
