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

import org.slf4j.event.Level;

/**
 * Destination for rendered event lines.
 */
@FunctionalInterface
public interface EventSink {

    /**
     * Writes one rendered event.
     *
     * @param level severity of the event
     * @param line  the rendered event
     */
    void write(Level level, String line);
}
