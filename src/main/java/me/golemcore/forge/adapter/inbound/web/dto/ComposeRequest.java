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
public class ComposeRequest {
    private String persona;
    private List<String> skills = new ArrayList<>();
    private List<String> constraints = new ArrayList<>();
    private Map<String, String> variables = new LinkedHashMap<>();
    private String branch;
    private String strategy = "latest";
}
