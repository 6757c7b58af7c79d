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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.forge.infrastructure.config.ForgeProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of the record store.
 *
 * <p>
 * Keeps every collection in memory and mirrors it to
 * {@code <base-path>/<collection>.json} after each write. Files are replaced
 * atomically (temp file, fsync, rename), so a crash never leaves a half-written
 * collection behind.
 *
 * <p>
 * Base path configured via {@code forge.storage.local.base-path}, defaults to
 * {@code ${user.home}/.golemcore/forge}. Active unless
 * {@code forge.storage.type=memory}.
 */
@Component
@ConditionalOnProperty(prefix = "forge.storage", name = "type", havingValue = "file", matchIfMissing = true)
@Slf4j
public class JsonFileRecordStoreAdapter extends InMemoryRecordStoreAdapter {

    private static final String EXTENSION = ".json";
    private static final TypeReference<List<Map<String, Object>>> RECORDS_TYPE = new TypeReference<>() {
    };

    private final ForgeProperties properties;
    private final ObjectMapper objectMapper;

    private Path basePath;

    public JsonFileRecordStoreAdapter(Clock clock, ForgeProperties properties, ObjectMapper objectMapper) {
        super(clock);
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        String basePathStr = properties.getStorage().getLocal().getBasePath();
        this.basePath = Paths.get(basePathStr.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath);
            try (Stream<Path> files = Files.list(basePath)) {
                for (Path file : files.filter(this::isCollectionFile).toList()) {
                    String fileName = file.getFileName().toString();
                    String collection = fileName.substring(0, fileName.length() - EXTENSION.length());
                    List<Map<String, Object>> records = objectMapper.readValue(file.toFile(), RECORDS_TYPE);
                    load(collection, records);
                    log.info("[Storage] Loaded {} record(s) from {}", records.size(), fileName);
                }
            }
            log.info("[Storage] Record store initialized at: {}", basePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize record store at " + basePath, e);
        }
    }

    @Override
    protected void afterWrite(String collection, Map<String, Map<String, Object>> records) {
        Path targetPath = resolvePath(collection);
        Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
        try {
            byte[] bytes = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsBytes(new ArrayList<>(records.values()));
            try (OutputStream os = Files.newOutputStream(tempPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.SYNC);
                    FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                os.write(bytes);
                os.flush();
                channel.force(true);
            }

            try {
                Files.move(tempPath, targetPath,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("[Storage] Atomic move not supported, using regular move");
                Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("[Storage] Persisted {} ({} records)", collection, records.size());
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempPath);
            } catch (IOException cleanupEx) {
                log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
            }
            throw new UncheckedIOException("Failed to persist collection: " + collection, e);
        }
    }

    Path getBasePath() {
        return basePath;
    }

    private boolean isCollectionFile(Path file) {
        return Files.isRegularFile(file)
                && file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(EXTENSION);
    }

    private Path resolvePath(String collection) {
        Path resolved = basePath.resolve(collection + EXTENSION).normalize();
        if (!resolved.startsWith(basePath) || !resolved.getParent().equals(basePath)) {
            throw new IllegalArgumentException("Invalid collection name: " + collection);
        }
        return resolved;
    }
}
