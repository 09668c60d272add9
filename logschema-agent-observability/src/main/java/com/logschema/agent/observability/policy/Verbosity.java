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
package com.logschema.agent.observability.policy;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * How much of a run a log destination shows. Ordered from least to most detail.
 */
public enum Verbosity {

    /** Final run summary, token summary and errors only. */
    LOW("INFO"),

    /** Full run summary and usage, tool detail per tool policy. */
    MID("DEBUG"),

    /** Everything, including full tool detail and the reasoning trace. */
    HIGH("TRACE");

    private final String levelAlias;

    Verbosity(String levelAlias) {
        this.levelAlias = levelAlias;
    }

    /**
     * Whether a destination at this verbosity shows content requiring {@code required}.
     *
     * @param required the minimum verbosity of the content
     * @return true if visible
     */
    public boolean includes(Verbosity required) {
        return compareTo(required) >= 0;
    }

    /**
     * Parses a verbosity name, case-insensitively. Log level names INFO, DEBUG and TRACE
     * are accepted as LOW, MID and HIGH.
     *
     * @param value the name to parse
     * @return the verbosity
     * @throws IllegalArgumentException listing the valid names if the value is unknown
     */
    public static Verbosity fromString(String value) {
        if (value != null) {
            String normalized = value.trim().toUpperCase(Locale.ROOT);
            for (Verbosity verbosity : values()) {
                if (verbosity.name().equals(normalized) || verbosity.levelAlias.equals(normalized)) {
                    return verbosity;
                }
            }
        }
        String valid = Arrays.stream(values())
                .map(v -> v.name().toLowerCase(Locale.ROOT) + "/" + v.levelAlias.toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(", "));
        throw new IllegalArgumentException("Invalid verbosity '" + value + "'. Valid values: " + valid);
    }
}
