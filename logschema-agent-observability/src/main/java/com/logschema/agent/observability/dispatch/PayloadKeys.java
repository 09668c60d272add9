/*
 * Copyright 2025-2026 The LogSchema Agent Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.logschema.agent.observability.dispatch;

/**
 * Keys understood in {@link LifecycleNotification#payload()}.
 */
public final class PayloadKeys {

    private PayloadKeys() {}

    // LLM
    public static final String MODEL = "model";
    public static final String MODEL_VERSION = "model_version";
    public static final String PROMPT_SIZE_BYTES = "prompt_size_bytes";
    public static final String TOKENS_PROMPT = "tokens_prompt";
    public static final String TOKENS_COMPLETION = "tokens_completion";
    public static final String TOKENS_TOTAL = "tokens_total";
    public static final String SUCCEEDED = "succeeded";

    // tool
    public static final String TOOL_NAME = "tool_name";
    public static final String ARGUMENTS = "arguments";
    public static final String RESULT = "result";

    // errors, any kind
    public static final String ERROR_KIND = "error_kind";
    public static final String MESSAGE = "message";

    // agent
    public static final String INPUTS = "inputs";
    public static final String OUTPUTS = "outputs";
    public static final String ACTION_KIND = "action_kind";
    public static final String ACTION_SUMMARY = "action_summary";
    public static final String OBSERVATION_SUMMARY = "observation_summary";

    // batch
    public static final String BATCH_NUMBER = "batch_number";
    public static final String PLANNED_LINES = "planned_lines";
    public static final String LINES_READ = "lines_read";
    public static final String CUMULATIVE_LINES = "cumulative_lines";
    public static final String NEW_LOG_TYPES = "new_log_types";
    public static final String NEW_FIELDS = "new_fields";

    // handle
    public static final String PATH = "path";
    public static final String TOTAL_LINES = "total_lines";
}
