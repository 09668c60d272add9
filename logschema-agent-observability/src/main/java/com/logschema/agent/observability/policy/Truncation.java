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

/**
 * Caps string values written to event logs.
 */
public final class Truncation {

    /** Appended to every value that was cut. */
    public static final String MARKER = "...[truncated]";

    private Truncation() {}

    /**
     * Truncates a value to {@code maxLength} characters, appending {@link #MARKER} if it was cut.
     *
     * @param value     value to cap, may be null
     * @param maxLength maximum number of characters kept from the value
     * @return the value, capped
     */
    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, Math.max(0, maxLength)) + MARKER;
    }
}
