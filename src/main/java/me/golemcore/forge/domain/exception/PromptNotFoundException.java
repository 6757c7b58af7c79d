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

/**
 * A prompt, version or branch does not exist (or the prompt is archived where
 * an active one is required).
 */
public class PromptNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PromptNotFoundException(String message) {
        super(message);
    }

    public static PromptNotFoundException prompt(String slug) {
        return new PromptNotFoundException("Prompt '" + slug + "' not found");
    }

    public static PromptNotFoundException version(int version, String branch) {
        return new PromptNotFoundException("Version " + version + " not found on branch '" + branch + "'");
    }

    public static PromptNotFoundException emptyBranch(String branch) {
        return new PromptNotFoundException("No versions found on branch '" + branch + "'");
    }
}
