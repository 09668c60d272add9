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
package com.logschema.agent.observability.tool;

import com.logschema.agent.observability.policy.LoggingStrategy;

import java.util.Objects;

/**
 * Registration of one agent tool: its name, how its calls are logged, and its implementation.
 *
 * @param name            unique tool name as the agent calls it
 * @param loggingStrategy how arguments and results are logged at MID verbosity
 * @param description     human readable description offered to the agent
 * @param handler         the implementation
 */
public record ToolDescriptor(String name, LoggingStrategy loggingStrategy, String description, ToolHandler handler) {

    public ToolDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        Objects.requireNonNull(loggingStrategy, "loggingStrategy");
        Objects.requireNonNull(handler, "handler");
        description = description == null ? "" : description;
    }
}
