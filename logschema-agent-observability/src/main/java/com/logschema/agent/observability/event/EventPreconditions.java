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

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class EventPreconditions {

    private EventPreconditions() {}

    static void requireBase(String runId, Instant timestamp) {
        requireText("run_id", runId);
        if (timestamp == null) {
            throw new InvalidMetricEventException("timestamp must not be null");
        }
    }

    static String requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidMetricEventException(field + " must not be blank");
        }
        return value;
    }

    static long requireNonNegative(String field, long value) {
        if (value < 0) {
            throw new InvalidMetricEventException(field + " must be >= 0 but was " + value);
        }
        return value;
    }

    static <T> T requirePresent(String field, T value) {
        if (value == null) {
            throw new InvalidMetricEventException(field + " must not be null");
        }
        return value;
    }

    static List<String> copyOf(List<String> values) {
        return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }

    // Tool arguments may legitimately contain null values, so Map.copyOf is not an option.
    static <V> Map<String, V> copyOf(Map<String, V> values) {
        return values == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    static Map<String, Long> sizesOf(Map<String, Long> values) {
        if (values == null) {
            return Map.of();
        }
        values.forEach((key, size) -> {
            if (size == null || size < 0) {
                throw new InvalidMetricEventException("size of '" + key + "' must be >= 0 but was " + size);
            }
        });
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
