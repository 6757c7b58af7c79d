package me.golemcore.forge;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Forge.
 *
 * <p>
 * Forge keeps versioned prompt documents for a fleet of agents: personas,
 * skills and constraints are committed to per-branch version logs, diffed,
 * merged and assembled into complete agent prompts.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Version control</b> - append-only per-branch history, branches,
 * rollback, restore and three merge strategies</li>
 * <li><b>Guarded mutation</b> - injection scanning before every commit and a
 * regression guard against accidental content loss</li>
 * <li><b>Structural diff</b> - section-level and field-level comparison</li>
 * <li><b>Composition</b> - persona + skills + constraints with single-parent
 * inheritance, variable substitution and conflict detection</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers (WebFlux)
 * Domain Layer       → VersionControlService, PromptRegistryService, CompositionService
 * Infrastructure     → Record store adapters (memory, JSON files)
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code forge.*}
 * prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForgeApplication.class, args);
    }

}
