package me.golemcore.forge.domain.exception;

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

import lombok.Getter;
import me.golemcore.forge.domain.model.RegressionReport;

import java.util.List;
import java.util.Locale;

/**
 * Mutation rejected because it looks like accidental content loss. Callers
 * may retry with an explicit acknowledgement.
 */
@Getter
public class RegressionBlockedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public static final String ERROR_CODE = "content_regression_blocked";

    private final transient RegressionReport report;
    private final int parentVersion;
    private final List<String> keysUnchanged;

    public RegressionBlockedException(RegressionReport report, int parentVersion, int parentKeyCount,
            List<String> keysUnchanged) {
        super(String.format(Locale.ROOT,
                "New version removes %d/%d keys and reduces content by %.1f%%. This looks accidental. "
                        + "To proceed, acknowledge the reduction explicitly.",
                report.getKeysRemoved().size(), parentKeyCount, report.getContentReductionPct()));
        this.report = report;
        this.parentVersion = parentVersion;
        this.keysUnchanged = List.copyOf(keysUnchanged);
    }
}
