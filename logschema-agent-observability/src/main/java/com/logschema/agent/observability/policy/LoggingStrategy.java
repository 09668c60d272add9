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
 * How much of a tool's arguments and result is logged at MID verbosity.
 */
public enum LoggingStrategy {

    /** Arguments and result logged verbatim. */
    FULL,

    /** Argument names only, no values and no result. */
    METADATA_ONLY,

    /** Every string field capped at the configured max length. */
    TRUNCATE
}
