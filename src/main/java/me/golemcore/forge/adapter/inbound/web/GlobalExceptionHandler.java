package me.golemcore.forge.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.forge.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.forge.domain.exception.CircularInheritanceException;
import me.golemcore.forge.domain.exception.InjectionBlockedException;
import me.golemcore.forge.domain.exception.PromptNotFoundException;
import me.golemcore.forge.domain.exception.RegressionBlockedException;
import me.golemcore.forge.domain.model.RegressionReport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Centralized exception handler for the API controllers. Domain failures map
 * to 404 (not found), 409 (conflicts and blocked regressions), 422 (blocked
 * injection) and 400 (validation and inheritance cycles).
 */
@ControllerAdvice(basePackages = "me.golemcore.forge.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    static final String INJECTION_BLOCKED = "injection_blocked";
    static final String CIRCULAR_INHERITANCE = "circular_inheritance";

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .message(ex.getReason())
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }

    @ExceptionHandler(PromptNotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(PromptNotFoundException ex) {
        log.debug("[API] Not found: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.NOT_FOUND.value())
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND).body(body));
    }

    @ExceptionHandler(RegressionBlockedException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleRegressionBlocked(RegressionBlockedException ex) {
        log.warn("[API] Regression blocked: {}", ex.getMessage());
        RegressionReport report = ex.getReport();
        Map<String, Object> diff = new LinkedHashMap<>();
        diff.put("keysRemoved", report.getKeysRemoved());
        diff.put("keysAdded", report.getKeysAdded());
        diff.put("keysUnchanged", ex.getKeysUnchanged());
        diff.put("parentVersion", ex.getParentVersion());
        diff.put("contentReductionPct", report.getContentReductionPct());
        diff.put("report", report);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.CONFLICT.value())
                .error(RegressionBlockedException.ERROR_CODE)
                .message(ex.getMessage())
                .detail(diff)
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).body(body));
    }

    @ExceptionHandler(InjectionBlockedException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInjectionBlocked(InjectionBlockedException ex) {
        log.warn("[API] Injection blocked: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.UNPROCESSABLE_ENTITY.value())
                .error(INJECTION_BLOCKED)
                .message(ex.getMessage())
                .detail(ex.getFindings())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body));
    }

    @ExceptionHandler(CircularInheritanceException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleCircularInheritance(CircularInheritanceException ex) {
        log.warn("[API] {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .error(CIRCULAR_INHERITANCE)
                .message(ex.getMessage())
                .detail(ex.getCycle())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body));
    }

    @ExceptionHandler(IllegalStateException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalState(IllegalStateException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.CONFLICT.value())
                .message(ex.getMessage())
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.CONFLICT).body(body));
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .message("Internal server error")
                .build();
        return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body));
    }
}
