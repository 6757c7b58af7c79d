package me.golemcore.forge.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code forge.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - record store selection and location</li>
 * <li>{@link VcsProperties} - default branch and history paging</li>
 * <li>{@link SecurityProperties} - injection scanning</li>
 * </ul>
 *
 * <p>
 * Regression thresholds and the best-performing usage threshold are fixed
 * constants and intentionally not configurable.
 */
@Component
@ConfigurationProperties(prefix = "forge")
@Data
public class ForgeProperties {

    private StorageProperties storage = new StorageProperties();
    private VcsProperties vcs = new VcsProperties();
    private SecurityProperties security = new SecurityProperties();

    @Data
    public static class StorageProperties {
        private String type = "file"; // file | memory
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/forge";
    }

    @Data
    public static class VcsProperties {
        private String defaultBranch = "main";
        private int historyLimit = 50;
        private int maxHistoryLimit = 200;
    }

    @Data
    public static class SecurityProperties {
        private boolean injectionScanEnabled = true;
    }
}
