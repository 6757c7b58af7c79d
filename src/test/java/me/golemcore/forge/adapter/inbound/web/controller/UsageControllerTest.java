package me.golemcore.forge.adapter.inbound.web.controller;

import me.golemcore.forge.adapter.inbound.web.dto.UsageLogRequest;
import me.golemcore.forge.domain.model.UsageRecord;
import me.golemcore.forge.domain.model.UsageStats;
import me.golemcore.forge.domain.service.UsageLogService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import reactor.test.StepVerifier;

class UsageControllerTest {

    private UsageLogService usageLogService;
    private UsageController controller;

    @BeforeEach
    void setUp() {
        usageLogService = mock(UsageLogService.class);
        controller = new UsageController(usageLogService);
    }

    @Test
    void shouldLogUsage() {
        UsageLogRequest request = new UsageLogRequest();
        request.setPromptId("p1");
        request.setVersionId("v1");
        request.setOutcome("success");
        request.setLatencyMs(120L);
        UsageRecord record = UsageRecord.builder().id("u1").outcome("success").build();
        when(usageLogService.record("p1", "v1", null, "success", 120L, null)).thenReturn(record);

        StepVerifier.create(controller.logUsage(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals("u1", response.getBody().getId());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnStats() {
        when(usageLogService.statsFor("reviewer"))
                .thenReturn(UsageStats.builder().promptSlug("reviewer").totalUses(3).successRate(1.0).build());

        StepVerifier.create(controller.getStats("reviewer"))
                .assertNext(response -> assertEquals(3, response.getBody().getTotalUses()))
                .verifyComplete();
    }
}
