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

import org.slf4j.event.Level;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.logschema.agent.observability.event.EventPreconditions.copyOf;
import static com.logschema.agent.observability.event.EventPreconditions.requireBase;
import static com.logschema.agent.observability.event.EventPreconditions.requireNonNegative;
import static com.logschema.agent.observability.event.EventPreconditions.requirePresent;
import static com.logschema.agent.observability.event.EventPreconditions.requireText;
import static com.logschema.agent.observability.event.EventPreconditions.sizesOf;

/**
 * One structured observation about an agent run.
 *
 * <p>Every variant carries the id of the run it belongs to and the instant it was
 * built. Variants validate themselves on construction and throw
 * {@link InvalidMetricEventException} for malformed values.
 */
public interface MetricEvent {

    String runId();

    Instant timestamp();

    EventKind kind();

    /**
     * Log level the event is written at.
     * @return the severity
     */
    default Level severity() {
        return kind().defaultSeverity();
    }

    // LLM calls

    record LlmStart(String runId, Instant timestamp, String invocationId, String model,
                    String modelVersion, long promptSizeBytes) implements MetricEvent {
        public LlmStart {
            requireBase(runId, timestamp);
            requireText("invocation_id", invocationId);
            requireText("model", model);
            requireNonNegative("prompt_size_bytes", promptSizeBytes);
        }

        @Override
        public EventKind kind() {
            return EventKind.LLM_START;
        }
    }

    record LlmUsage(String runId, Instant timestamp, String invocationId, long tokensPrompt,
                    long tokensCompletion, long tokensTotal) implements MetricEvent {
        public LlmUsage {
            requireBase(runId, timestamp);
            requireText("invocation_id", invocationId);
            requireNonNegative("tokens_prompt", tokensPrompt);
            requireNonNegative("tokens_completion", tokensCompletion);
            requireNonNegative("tokens_total", tokensTotal);
        }

        @Override
        public EventKind kind() {
            return EventKind.LLM_USAGE;
        }
    }

    record LlmEnd(String runId, Instant timestamp, String invocationId, Status status,
                  long durationMs) implements MetricEvent {
        public LlmEnd {
            requireBase(runId, timestamp);
            requireText("invocation_id", invocationId);
            requirePresent("status", status);
            requireNonNegative("duration_ms", durationMs);
        }

        @Override
        public EventKind kind() {
            return EventKind.LLM_END;
        }

        @Override
        public Level severity() {
            return kind().severityFor(status);
        }
    }

    record LlmError(String runId, Instant timestamp, String invocationId, String errorKind,
                    String message) implements MetricEvent {
        public LlmError {
            requireBase(runId, timestamp);
            requireText("invocation_id", invocationId);
            requireText("error_kind", errorKind);
            message = message == null ? "" : message;
        }

        @Override
        public EventKind kind() {
            return EventKind.LLM_ERROR;
        }
    }

    // Tool calls

    record ToolStart(String runId, Instant timestamp, String invocationId, String toolName,
                     long inputSizeBytes, Map<String, Object> arguments) implements MetricEvent {
        public ToolStart {
            requireBase(runId, timestamp);
            requireText("invocation_id", invocationId);
            requireText("tool_name", toolName);
            requireNonNegative("input_size_bytes", inputSizeBytes);
            arguments = copyOf(arguments);
        }

        @Override
        public EventKind kind() {
            return EventKind.TOOL_START;
        }
    }

    record ToolEnd(String runId, Instant timestamp, String invocationId, String toolName, Status status,
                   long durationMs, long outputSizeBytes, String resultSummary) implements MetricEvent {
        public ToolEnd {
            requireBase(runId, timestamp);
            requireText("invocation_id", invocationId);
            requireText("tool_name", toolName);
            requirePresent("status", status);
            requireNonNegative("duration_ms", durationMs);
            requireNonNegative("output_size_bytes", outputSizeBytes);
        }

        @Override
        public EventKind kind() {
            return EventKind.TOOL_END;
        }

        @Override
        public Level severity() {
            return kind().severityFor(status);
        }
    }

    record ToolError(String runId, Instant timestamp, String invocationId, String toolName,
                     String errorKind, String message) implements MetricEvent {
        public ToolError {
            requireBase(runId, timestamp);
            requireText("invocation_id", invocationId);
            requireText("tool_name", toolName);
            requireText("error_kind", errorKind);
            message = message == null ? "" : message;
        }

        @Override
        public EventKind kind() {
            return EventKind.TOOL_ERROR;
        }
    }

    // Agent runs

    record AgentStart(String runId, Instant timestamp, List<String> inputKeys,
                      Map<String, Long> inputSizes) implements MetricEvent {
        public AgentStart {
            requireBase(runId, timestamp);
            inputKeys = copyOf(inputKeys);
            inputSizes = sizesOf(inputSizes);
        }

        @Override
        public EventKind kind() {
            return EventKind.AGENT_START;
        }
    }

    record AgentEnd(String runId, Instant timestamp, Status status, long durationMs,
                    List<String> outputKeys, Map<String, Long> outputSizes) implements MetricEvent {
        public AgentEnd {
            requireBase(runId, timestamp);
            requirePresent("status", status);
            requireNonNegative("duration_ms", durationMs);
            outputKeys = copyOf(outputKeys);
            outputSizes = sizesOf(outputSizes);
        }

        @Override
        public EventKind kind() {
            return EventKind.AGENT_END;
        }

        @Override
        public Level severity() {
            return kind().severityFor(status);
        }
    }

    record AgentTokenSummary(String runId, Instant timestamp, long tokensBillableEstimate,
                             long tokensSuccessful) implements MetricEvent {
        public AgentTokenSummary {
            requireBase(runId, timestamp);
            requireNonNegative("tokens_billable_estimate", tokensBillableEstimate);
            requireNonNegative("tokens_successful", tokensSuccessful);
            if (tokensSuccessful > tokensBillableEstimate) {
                throw new InvalidMetricEventException("tokens_successful (" + tokensSuccessful
                        + ") exceeds tokens_billable_estimate (" + tokensBillableEstimate + ")");
            }
        }

        @Override
        public EventKind kind() {
            return EventKind.AGENT_TOKEN_SUMMARY;
        }
    }

    record AgentIteration(String runId, Instant timestamp, int iterationNumber, ActionKind actionKind,
                          String actionSummary, String observationSummary) implements MetricEvent {
        public AgentIteration {
            requireBase(runId, timestamp);
            if (iterationNumber < 1) {
                throw new InvalidMetricEventException("iteration_number must be >= 1 but was " + iterationNumber);
            }
            requirePresent("action_kind", actionKind);
            actionSummary = actionSummary == null ? "" : actionSummary;
            observationSummary = observationSummary == null ? "" : observationSummary;
        }

        @Override
        public EventKind kind() {
            return EventKind.AGENT_ITERATION;
        }
    }

    // Log file batches

    record BatchStart(String runId, Instant timestamp, int batchNumber, long plannedLines) implements MetricEvent {
        public BatchStart {
            requireBase(runId, timestamp);
            requireNonNegative("batch_number", batchNumber);
            requireNonNegative("planned_lines", plannedLines);
        }

        @Override
        public EventKind kind() {
            return EventKind.BATCH_START;
        }
    }

    record BatchEnd(String runId, Instant timestamp, int batchNumber, Status status, long linesRead,
                    long cumulativeLines, long durationMs) implements MetricEvent {
        public BatchEnd {
            requireBase(runId, timestamp);
            requireNonNegative("batch_number", batchNumber);
            requirePresent("status", status);
            requireNonNegative("lines_read", linesRead);
            requireNonNegative("cumulative_lines", cumulativeLines);
            requireNonNegative("duration_ms", durationMs);
        }

        @Override
        public EventKind kind() {
            return EventKind.BATCH_END;
        }

        @Override
        public Level severity() {
            return kind().severityFor(status);
        }
    }

    record BatchDiscovery(String runId, Instant timestamp, int batchNumber, List<String> newLogTypes,
                          List<String> newFields) implements MetricEvent {
        public BatchDiscovery {
            requireBase(runId, timestamp);
            requireNonNegative("batch_number", batchNumber);
            newLogTypes = copyOf(newLogTypes);
            newFields = copyOf(newFields);
        }

        @Override
        public EventKind kind() {
            return EventKind.BATCH_DISCOVERY;
        }
    }

    // JSONL file handles

    record HandleOpen(String runId, Instant timestamp, String handleId, String path,
                      Long totalLines) implements MetricEvent {
        public HandleOpen {
            requireBase(runId, timestamp);
            requireText("handle_id", handleId);
            requireText("path", path);
            if (totalLines != null) {
                requireNonNegative("total_lines", totalLines);
            }
        }

        @Override
        public EventKind kind() {
            return EventKind.HANDLE_OPEN;
        }
    }

    record HandleClose(String runId, Instant timestamp, String handleId, Status status, long linesRead,
                       long durationMs) implements MetricEvent {
        public HandleClose {
            requireBase(runId, timestamp);
            requireText("handle_id", handleId);
            requirePresent("status", status);
            requireNonNegative("lines_read", linesRead);
            requireNonNegative("duration_ms", durationMs);
        }

        @Override
        public EventKind kind() {
            return EventKind.HANDLE_CLOSE;
        }

        @Override
        public Level severity() {
            return kind().severityFor(status);
        }
    }
}
