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

import com.logschema.agent.observability.policy.Verbosity;
import org.slf4j.event.Level;

/**
 * Every kind of {@link MetricEvent}, with its wire name, default severity and the
 * lowest verbosity at which a destination shows it.
 */
public enum EventKind {

    LLM_START("llm.start", Level.DEBUG, Verbosity.MID),
    LLM_USAGE("llm.usage", Level.DEBUG, Verbosity.MID),
    LLM_END("llm.end", Level.DEBUG, Verbosity.MID),
    LLM_ERROR("llm.error", Level.ERROR, Verbosity.LOW),
    TOOL_START("tool.start", Level.DEBUG, Verbosity.MID),
    TOOL_END("tool.end", Level.DEBUG, Verbosity.MID),
    TOOL_ERROR("tool.error", Level.ERROR, Verbosity.LOW),
    AGENT_START("agent.start", Level.DEBUG, Verbosity.MID),
    AGENT_END("agent.end", Level.INFO, Verbosity.LOW),
    AGENT_TOKEN_SUMMARY("agent.tokens_summary", Level.INFO, Verbosity.LOW),
    AGENT_ITERATION("agent.iteration", Level.TRACE, Verbosity.HIGH),
    BATCH_START("batch.start", Level.DEBUG, Verbosity.MID),
    BATCH_END("batch.end", Level.DEBUG, Verbosity.MID),
    BATCH_DISCOVERY("batch.discovery", Level.DEBUG, Verbosity.MID),
    HANDLE_OPEN("handle.open", Level.DEBUG, Verbosity.MID),
    HANDLE_CLOSE("handle.close", Level.DEBUG, Verbosity.MID);

    private final String wireName;
    private final Level defaultSeverity;
    private final Verbosity minimumVerbosity;

    EventKind(String wireName, Level defaultSeverity, Verbosity minimumVerbosity) {
        this.wireName = wireName;
        this.defaultSeverity = defaultSeverity;
        this.minimumVerbosity = minimumVerbosity;
    }

    public String wireName() {
        return wireName;
    }

    public Level defaultSeverity() {
        return defaultSeverity;
    }

    public Verbosity minimumVerbosity() {
        return minimumVerbosity;
    }

    /**
     * Severity of a terminal event of this kind with the given outcome.
     *
     * @param status outcome of the invocation
     * @return WARN for cancelled invocations, ERROR for a failed run, otherwise the default
     */
    public Level severityFor(Status status) {
        if (status == Status.CANCELLED) {
            return Level.WARN;
        }
        if (status == Status.ERROR && this == AGENT_END) {
            return Level.ERROR;
        }
        return defaultSeverity;
    }
}
