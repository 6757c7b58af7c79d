package me.golemcore.forge.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class VersionRestoreRequest {
    private Integer fromVersion;
    private Map<String, Object> patch;
    private String message;
    private String author = "system";
    private String branch;
    private boolean acknowledgeReduction;
}
