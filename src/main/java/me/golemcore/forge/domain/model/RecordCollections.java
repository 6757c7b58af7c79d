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

/**
 * Collection names and record field names used with the record store.
 */
public final class RecordCollections {

    private RecordCollections() {
    }

    public static final String PROMPTS = "prompts";
    public static final String VERSIONS = "prompt_versions";
    public static final String BRANCHES = "prompt_branches";
    public static final String USAGE_LOG = "prompt_usage_log";

    public static final String FIELD_ID = "id";
    public static final String FIELD_PROMPT_ID = "promptId";
    public static final String FIELD_BRANCH = "branch";
    public static final String FIELD_VERSION = "version";
    public static final String FIELD_NAME = "name";
    public static final String FIELD_SLUG = "slug";
    public static final String FIELD_STATUS = "status";
    public static final String FIELD_HEAD_VERSION_ID = "headVersionId";
    public static final String FIELD_CREATED_AT = "createdAt";
}
