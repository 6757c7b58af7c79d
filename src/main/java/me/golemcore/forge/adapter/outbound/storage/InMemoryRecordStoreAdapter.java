package me.golemcore.forge.adapter.outbound.storage;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.forge.domain.model.JsonValueSupport;
import me.golemcore.forge.port.outbound.RecordQuery;
import me.golemcore.forge.port.outbound.RecordStorePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process implementation of {@link RecordStorePort}.
 *
 * <p>
 * Each collection is an insertion-ordered map guarded by its own monitor, so
 * single-record writes are atomic and collections are independent. A write
 * that cannot be persisted leaves the collection unchanged. Records
 * are deep-copied on the way in and out; callers never share state with the
 * store.
 *
 * <p>
 * Selected with {@code forge.storage.type=memory}. Also the base of
 * {@link JsonFileRecordStoreAdapter}.
 */
@Component
@ConditionalOnProperty(prefix = "forge.storage", name = "type", havingValue = "memory")
@Slf4j
public class InMemoryRecordStoreAdapter implements RecordStorePort {

    static final String ID = "id";
    static final String CREATED_AT = "createdAt";
    static final String UPDATED_AT = "updatedAt";

    private final Clock clock;
    private final Map<String, Map<String, Map<String, Object>>> collections = new ConcurrentHashMap<>();

    public InMemoryRecordStoreAdapter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public CompletableFuture<Map<String, Object>> insert(String collection, Map<String, Object> record) {
        Map<String, Map<String, Object>> records = collection(collection);
        synchronized (records) {
            Map<String, Object> stored = JsonValueSupport.deepCopyMap(record);
            Object id = stored.get(ID);
            if (id == null) {
                id = UUID.randomUUID().toString();
                stored.put(ID, id);
            } else if (records.containsKey(String.valueOf(id))) {
                return CompletableFuture.failedFuture(new IllegalStateException(
                        "Duplicate record id in " + collection + ": " + id));
            }
            String now = clock.instant().toString();
            stored.putIfAbsent(CREATED_AT, now);
            stored.put(UPDATED_AT, now);
            String key = String.valueOf(id);
            records.put(key, stored);
            try {
                afterWrite(collection, records);
            } catch (RuntimeException e) {
                records.remove(key);
                return CompletableFuture.failedFuture(e);
            }
            log.debug("[Storage] Inserted {}/{}", collection, id);
            return CompletableFuture.completedFuture(JsonValueSupport.deepCopyMap(stored));
        }
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> select(String collection, RecordQuery query) {
        RecordQuery effective = query != null ? query : RecordQuery.all();
        Map<String, Map<String, Object>> records = collection(collection);
        List<Map<String, Object>> matched = new ArrayList<>();
        synchronized (records) {
            for (Map<String, Object> stored : records.values()) {
                if (matches(stored, effective.getFilters())) {
                    matched.add(JsonValueSupport.deepCopyMap(stored));
                }
            }
        }
        if (effective.getOrderBy() != null) {
            Comparator<Map<String, Object>> comparator = Comparator.comparing(
                    r -> r.get(effective.getOrderBy()), InMemoryRecordStoreAdapter::compareValues);
            matched.sort(effective.isAscending() ? comparator : comparator.reversed());
        }
        if (effective.getLimit() != null && effective.getLimit() >= 0 && matched.size() > effective.getLimit()) {
            matched = new ArrayList<>(matched.subList(0, effective.getLimit()));
        }
        return CompletableFuture.completedFuture(matched);
    }

    @Override
    public CompletableFuture<Map<String, Object>> update(String collection, String id, Map<String, Object> partial) {
        Map<String, Map<String, Object>> records = collection(collection);
        synchronized (records) {
            Map<String, Object> stored = records.get(id);
            if (stored == null) {
                return CompletableFuture.failedFuture(new IllegalArgumentException(
                        "Record not found: " + collection + "/" + id));
            }
            Map<String, Object> updated = new LinkedHashMap<>(stored);
            updated.putAll(JsonValueSupport.deepCopyMap(partial));
            updated.put(ID, stored.get(ID));
            updated.put(UPDATED_AT, clock.instant().toString());
            records.put(id, updated);
            try {
                afterWrite(collection, records);
            } catch (RuntimeException e) {
                records.put(id, stored);
                return CompletableFuture.failedFuture(e);
            }
            log.debug("[Storage] Updated {}/{} fields={}", collection, id, partial.keySet());
            return CompletableFuture.completedFuture(JsonValueSupport.deepCopyMap(updated));
        }
    }

    @Override
    public CompletableFuture<Void> delete(String collection, String id) {
        Map<String, Map<String, Object>> records = collection(collection);
        synchronized (records) {
            if (!records.containsKey(id)) {
                return CompletableFuture.completedFuture(null);
            }
            Map<String, Map<String, Object>> remaining = new LinkedHashMap<>(records);
            remaining.remove(id);
            try {
                afterWrite(collection, remaining);
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
            records.remove(id);
            log.debug("[Storage] Deleted {}/{}", collection, id);
        }
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Hook invoked while the collection monitor is held, with the collection
     * as it stands after the change. A runtime exception undoes the change and
     * fails the write.
     */
    protected void afterWrite(String collection, Map<String, Map<String, Object>> records) {
        // in-memory only
    }

    /**
     * Replace a collection wholesale, used when loading persisted state.
     */
    protected void load(String collection, List<Map<String, Object>> loaded) {
        Map<String, Map<String, Object>> records = collection(collection);
        synchronized (records) {
            records.clear();
            for (Map<String, Object> record : loaded) {
                Object id = record.get(ID);
                if (id != null) {
                    records.put(String.valueOf(id), JsonValueSupport.deepCopyMap(record));
                }
            }
        }
    }

    private Map<String, Map<String, Object>> collection(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Collection name is required");
        }
        return collections.computeIfAbsent(name, key -> new LinkedHashMap<>());
    }

    private static boolean matches(Map<String, Object> record, Map<String, Object> filters) {
        if (filters == null) {
            return true;
        }
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            Object expected = filter.getValue();
            Object actual = record.get(filter.getKey());
            if (expected == null) {
                if (actual != null) {
                    return false;
                }
            } else if (!JsonValueSupport.jsonEquals(normalize(expected), actual)) {
                return false;
            }
        }
        return true;
    }

    private static Object normalize(Object value) {
        if (value instanceof Enum<?> e) {
            return e.name().toLowerCase(Locale.ROOT);
        }
        return value;
    }

    @SuppressWarnings({ "unchecked", "rawtypes" })
    private static int compareValues(Object left, Object right) {
        if (left == null && right == null) {
            return 0;
        }
        if (left == null) {
            return 1;
        }
        if (right == null) {
            return -1;
        }
        if (left instanceof Number l && right instanceof Number r) {
            return Double.compare(l.doubleValue(), r.doubleValue());
        }
        if (left instanceof String l && right instanceof String r && looksLikeInstant(l) && looksLikeInstant(r)) {
            try {
                return Instant.parse(l).compareTo(Instant.parse(r));
            } catch (DateTimeParseException e) {
                log.trace("[Storage] Not a timestamp pair: {} / {}", l, r);
            }
        }
        if (left instanceof Comparable comparable && left.getClass().isInstance(right)) {
            return comparable.compareTo(right);
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    }

    // Instant.toString() drops trailing zero fractions, so the text form does
    // not sort chronologically
    private static boolean looksLikeInstant(String value) {
        return value.length() >= 20 && value.charAt(10) == 'T' && value.endsWith("Z");
    }
}
