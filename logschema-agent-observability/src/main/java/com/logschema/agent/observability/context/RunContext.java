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
package com.logschema.agent.observability.context;

import java.time.Instant;
import java.util.Objects;

/**
 * Identity of one logical agent run.
 *
 * @param runId     unique run identifier, {@code run_} followed by 32 hex chars
 * @param createdAt when the run was started
 */
public record RunContext(String runId, Instant createdAt) {

    public RunContext {
        if (runId == null || runId.isBlank()) {
            throw new IllegalArgumentException("runId must not be blank");
        }
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
