package me.golemcore.forge.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PromptUpdateRequest {
    private String name;
    private String description;
    private List<String> tags;
    private Map<String, Object> metadata;
}
