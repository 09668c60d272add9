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

import com.logschema.agent.observability.tool.ToolDescriptor;
import com.logschema.agent.observability.tool.ToolRegistry;
import com.logschema.agent.observability.tool.UnknownToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps tool names to logging strategies and resolves how much tool detail a
 * destination at a given verbosity receives.
 *
 * <p>Resolution is monotonic in verbosity: LOW discloses nothing, HIGH discloses
 * everything, and MID follows the tool's strategy. Tools with no registration fall
 * back to {@link LoggingStrategy#METADATA_ONLY}.
 */
public class ToolLoggingPolicy {

    private static final Logger log = LoggerFactory.getLogger(ToolLoggingPolicy.class);

    /** Strategy of tools nobody registered. */
    public static final LoggingStrategy DEFAULT_STRATEGY = LoggingStrategy.METADATA_ONLY;

    private final Map<String, LoggingStrategy> strategies;
    private final Set<String> warnedUnregistered = ConcurrentHashMap.newKeySet();

    public ToolLoggingPolicy(Map<String, LoggingStrategy> strategies) {
        this.strategies = Collections.unmodifiableMap(new LinkedHashMap<>(strategies));
    }

    /**
     * Derives the policy from the registered tools, applying configured overrides.
     *
     * @param registry          registered tools
     * @param overrides         strategy overrides keyed by tool name
     * @param requireRegistered reject overrides for tools that are not registered
     * @return the policy
     * @throws UnknownToolException if an override names an unregistered tool and registration is required
     */
    public static ToolLoggingPolicy from(ToolRegistry registry, Map<String, LoggingStrategy> overrides,
                                         boolean requireRegistered) {
        Map<String, LoggingStrategy> strategies = new LinkedHashMap<>();
        for (ToolDescriptor descriptor : registry.descriptors()) {
            strategies.put(descriptor.name(), descriptor.loggingStrategy());
        }
        if (overrides != null) {
            overrides.forEach((toolName, strategy) -> {
                if (!registry.contains(toolName)) {
                    if (requireRegistered) {
                        throw new UnknownToolException(toolName,
                                "Logging policy override for unregistered tool '" + toolName
                                        + "'. Registered tools: " + registry.names());
                    }
                    log.warn("Logging policy override for unregistered tool '{}'", toolName);
                }
                strategies.put(toolName, strategy);
            });
        }
        return new ToolLoggingPolicy(strategies);
    }

    /**
     * Returns the strategy for a tool, falling back to {@link #DEFAULT_STRATEGY}.
     * The first lookup of an unregistered name is logged at WARN.
     *
     * @param toolName the tool
     * @return the strategy
     */
    public LoggingStrategy strategyFor(String toolName) {
        LoggingStrategy strategy = toolName == null ? null : strategies.get(toolName);
        if (strategy != null) {
            return strategy;
        }
        if (warnedUnregistered.add(String.valueOf(toolName))) {
            log.warn("Tool '{}' has no logging policy, logging metadata only", toolName);
        }
        return DEFAULT_STRATEGY;
    }

    public boolean isRegistered(String toolName) {
        return toolName != null && strategies.containsKey(toolName);
    }

    /**
     * Resolves how much of a tool's detail is written at a verbosity.
     *
     * @param toolName  the tool
     * @param verbosity the destination's verbosity
     * @return the disclosure
     */
    public Disclosure resolve(String toolName, Verbosity verbosity) {
        if (verbosity == Verbosity.LOW) {
            return Disclosure.NONE;
        }
        if (verbosity == Verbosity.HIGH) {
            return Disclosure.FULL;
        }
        return switch (strategyFor(toolName)) {
            case FULL -> Disclosure.FULL;
            case TRUNCATE -> Disclosure.TRUNCATED;
            case METADATA_ONLY -> Disclosure.METADATA;
        };
    }

    public Map<String, LoggingStrategy> strategies() {
        return strategies;
    }
}
