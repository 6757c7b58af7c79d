package me.golemcore.forge.port.outbound;

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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Equality filters plus optional ordering and limit for
 * {@link RecordStorePort#select}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordQuery {

    @Builder.Default
    private Map<String, Object> filters = new LinkedHashMap<>();

    private String orderBy;

    @Builder.Default
    private boolean ascending = true;

    private Integer limit;

    public static RecordQuery all() {
        return RecordQuery.builder().build();
    }

    public static RecordQuery where(Map<String, Object> filters) {
        return RecordQuery.builder().filters(new LinkedHashMap<>(filters)).build();
    }

    /**
     * Highest value of {@code field} first, at most {@code limit} records.
     */
    public static RecordQuery latest(Map<String, Object> filters, String field, int limit) {
        return RecordQuery.builder()
                .filters(new LinkedHashMap<>(filters))
                .orderBy(field)
                .ascending(false)
                .limit(limit)
                .build();
    }
}
