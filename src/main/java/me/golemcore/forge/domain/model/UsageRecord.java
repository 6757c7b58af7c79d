package me.golemcore.forge.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of one use of a prompt version by an agent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageRecord {

    public static final String OUTCOME_SUCCESS = "success";
    public static final String OUTCOME_FAILURE = "failure";
    public static final String OUTCOME_PARTIAL = "partial";
    public static final String OUTCOME_UNKNOWN = "unknown";

    private String id;
    private String promptId;
    private String versionId;
    private String agentId;
    private String outcome;
    private Long latencyMs;
    private String feedback;
    private Instant createdAt;

    public boolean isSuccess() {
        return OUTCOME_SUCCESS.equals(outcome);
    }
}
