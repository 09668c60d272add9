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
package com.logschema.agent.observability.event;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What the agent decided to do in one reasoning iteration.
 */
public enum ActionKind {
    TOOL_CALL,
    FINISH;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire value, case-insensitively.
     *
     * @param value wire value such as {@code tool_call}
     * @return the action kind
     * @throws InvalidMetricEventException if the value is not a known action kind
     */
    public static ActionKind fromWireValue(String value) {
        for (ActionKind kind : values()) {
            if (kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new InvalidMetricEventException("Unknown action kind: " + value);
    }
}
