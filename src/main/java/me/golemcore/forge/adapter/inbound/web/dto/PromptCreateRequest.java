package me.golemcore.forge.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PromptCreateRequest {
    private String slug;
    private String name;
    private String type;
    private String description = "";
    private List<String> tags = new ArrayList<>();
    private Map<String, Object> metadata = new LinkedHashMap<>();
    private Map<String, Object> content;
    private String initialMessage = "Initial version";
    private String parentSlug;
}
