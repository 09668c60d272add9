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
package com.logschema.agent.observability;

import com.logschema.agent.observability.policy.LoggingStrategy;
import com.logschema.agent.observability.policy.Verbosity;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for agent run observability.
 *
 * <p>Console and file verbosity are independent: the same run may print only the
 * final summary on the console while the event file receives full tool detail.
 *
 * @since 0.1.0
 */
@ConfigurationProperties(prefix = "logschema.observability")
public class ObservabilityProperties {

    /**
     * Default constructor.
     */
    public ObservabilityProperties() {
    }

    /** Enable/disable observability. */
    private boolean enabled = true;

    /** Verbosity of the interactive console destination. */
    private Verbosity consoleVerbosity = Verbosity.LOW;

    /** Verbosity of the persistent event file destination. */
    private Verbosity fileVerbosity = Verbosity.MID;

    /** Max string field length for tools logged with the truncate strategy. */
    private int maxFieldLength = 200;

    /** Per-tool logging strategy overrides, keyed by tool name. */
    private Map<String, LoggingStrategy> toolPolicies = new LinkedHashMap<>();

    /** Fail startup when a tool policy override names a tool nobody registered. */
    private boolean requireRegisteredTools = true;

    /** Write event lines from a background thread instead of the calling thread. */
    private boolean asyncEmission = false;

    /** Queue capacity of the background event writer. */
    private int asyncQueueCapacity = 1024;

    /** Enable/disable Micrometer metrics derived from emitted events. */
    private boolean metricsEnabled = true;

    // Getters and Setters

    /**
     * Returns whether observability is enabled.
     * @return true if enabled
     */
    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Sets whether observability is enabled.
     * @param enabled true to enable
     */
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Returns the console verbosity.
     * @return the console verbosity
     */
    public Verbosity getConsoleVerbosity() {
        return consoleVerbosity;
    }

    /**
     * Sets the console verbosity.
     * @param consoleVerbosity the console verbosity
     */
    public void setConsoleVerbosity(Verbosity consoleVerbosity) {
        this.consoleVerbosity = consoleVerbosity;
    }

    /**
     * Returns the event file verbosity.
     * @return the file verbosity
     */
    public Verbosity getFileVerbosity() {
        return fileVerbosity;
    }

    /**
     * Sets the event file verbosity.
     * @param fileVerbosity the file verbosity
     */
    public void setFileVerbosity(Verbosity fileVerbosity) {
        this.fileVerbosity = fileVerbosity;
    }

    /**
     * Returns the max field length for truncated tool detail.
     * @return the max field length
     */
    public int getMaxFieldLength() {
        return maxFieldLength;
    }

    /**
     * Sets the max field length for truncated tool detail.
     * @param maxFieldLength the max field length
     */
    public void setMaxFieldLength(int maxFieldLength) {
        this.maxFieldLength = maxFieldLength;
    }

    /**
     * Returns the per-tool logging strategy overrides.
     * @return the overrides keyed by tool name
     */
    public Map<String, LoggingStrategy> getToolPolicies() {
        return toolPolicies;
    }

    /**
     * Sets the per-tool logging strategy overrides.
     * @param toolPolicies the overrides keyed by tool name
     */
    public void setToolPolicies(Map<String, LoggingStrategy> toolPolicies) {
        this.toolPolicies = toolPolicies;
    }

    /**
     * Returns whether overrides must name registered tools.
     * @return true if unregistered names fail startup
     */
    public boolean isRequireRegisteredTools() {
        return requireRegisteredTools;
    }

    /**
     * Sets whether overrides must name registered tools.
     * @param requireRegisteredTools true to fail startup on unregistered names
     */
    public void setRequireRegisteredTools(boolean requireRegisteredTools) {
        this.requireRegisteredTools = requireRegisteredTools;
    }

    /**
     * Returns whether event lines are written asynchronously.
     * @return true if asynchronous
     */
    public boolean isAsyncEmission() {
        return asyncEmission;
    }

    /**
     * Sets whether event lines are written asynchronously.
     * @param asyncEmission true to write from a background thread
     */
    public void setAsyncEmission(boolean asyncEmission) {
        this.asyncEmission = asyncEmission;
    }

    /**
     * Returns the background writer queue capacity.
     * @return the queue capacity
     */
    public int getAsyncQueueCapacity() {
        return asyncQueueCapacity;
    }

    /**
     * Sets the background writer queue capacity.
     * @param asyncQueueCapacity the queue capacity
     */
    public void setAsyncQueueCapacity(int asyncQueueCapacity) {
        this.asyncQueueCapacity = asyncQueueCapacity;
    }

    /**
     * Returns whether Micrometer metrics are enabled.
     * @return true if metrics are enabled
     */
    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    /**
     * Sets whether to enable Micrometer metrics.
     * @param metricsEnabled true to enable metrics
     */
    public void setMetricsEnabled(boolean metricsEnabled) {
        this.metricsEnabled = metricsEnabled;
    }
}
