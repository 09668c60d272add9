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
 * Resolved amount of tool detail written for one destination. Ordered from least to most.
 */
public enum Disclosure {
    NONE,
    METADATA,
    TRUNCATED,
    FULL;

    /**
     * Whether this disclosure shows at least as much as {@code other}.
     *
     * @param other disclosure to compare with
     * @return true if this is the same or more revealing
     */
    public boolean atLeast(Disclosure other) {
        return compareTo(other) >= 0;
    }
}
