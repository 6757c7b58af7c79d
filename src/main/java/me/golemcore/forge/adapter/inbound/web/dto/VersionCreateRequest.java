package me.golemcore.forge.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Body of a commit. Also used for PATCH, where {@code content} is the partial
 * update to deep-merge into the head.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VersionCreateRequest {
    private Map<String, Object> content;
    private String message = "Update";
    private String author = "system";
    private String branch;
    private boolean acknowledgeReduction;
}
