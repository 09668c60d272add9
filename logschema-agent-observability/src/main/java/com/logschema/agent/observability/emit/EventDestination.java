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
package com.logschema.agent.observability.emit;

import com.logschema.agent.observability.policy.Verbosity;

import java.util.Objects;

/**
 * A named log destination with its own verbosity.
 *
 * @param name      destination name, e.g. {@code console}
 * @param verbosity how much of a run this destination shows
 * @param sink      where rendered lines go
 */
public record EventDestination(String name, Verbosity verbosity, EventSink sink) {

    public EventDestination {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(verbosity, "verbosity");
        Objects.requireNonNull(sink, "sink");
    }
}
