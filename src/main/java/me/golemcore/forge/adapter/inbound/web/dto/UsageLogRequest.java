package me.golemcore.forge.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UsageLogRequest {
    private String promptId;
    private String versionId;
    private String agentId;
    private String outcome = "unknown";
    private Long latencyMs;
    private String feedback;
}
