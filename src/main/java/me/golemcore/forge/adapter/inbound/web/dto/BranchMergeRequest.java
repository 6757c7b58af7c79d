package me.golemcore.forge.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BranchMergeRequest {
    private String targetBranch;
    private String strategy = "theirs";
    private String author = "system";
}
