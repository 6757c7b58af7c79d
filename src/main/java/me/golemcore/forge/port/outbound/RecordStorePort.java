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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the keyed-record store that backs prompts, versions, branches and
 * usage logs. Records are JSON objects grouped by collection; the store
 * assigns {@code id}, {@code createdAt} and {@code updatedAt}.
 *
 * <p>
 * Single-record {@code insert} and {@code update} must be atomic. The core
 * serializes read-then-append sequences itself and never retries a failed
 * call.
 */
public interface RecordStorePort {

    /**
     * Insert a record.
     *
     * @param collection
     *            collection name (e.g. "prompts", "prompt_versions")
     * @param record
     *            field values; {@code id} is generated when absent
     * @return the stored record including generated fields
     */
    CompletableFuture<Map<String, Object>> insert(String collection, Map<String, Object> record);

    /**
     * Select records matching every equality filter of the query, ordered and
     * limited as requested.
     */
    CompletableFuture<List<Map<String, Object>>> select(String collection, RecordQuery query);

    /**
     * Apply a partial update to one record.
     *
     * @return the record after the update
     */
    CompletableFuture<Map<String, Object>> update(String collection, String id, Map<String, Object> partial);

    /**
     * Delete one record. Deleting a missing record is a no-op.
     */
    CompletableFuture<Void> delete(String collection, String id);
}
