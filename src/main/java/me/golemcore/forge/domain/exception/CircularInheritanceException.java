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

import java.util.List;

/**
 * Parent chain revisits a slug. {@code cycle} lists the walk from the starting
 * slug up to and including the repeated one.
 */
@Getter
public class CircularInheritanceException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final List<String> cycle;

    public CircularInheritanceException(List<String> cycle) {
        super("Circular inheritance detected: " + String.join(" → ", cycle));
        this.cycle = List.copyOf(cycle);
    }
}
