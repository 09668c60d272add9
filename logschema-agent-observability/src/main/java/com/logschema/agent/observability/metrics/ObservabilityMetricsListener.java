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
package com.logschema.agent.observability.metrics;

import com.logschema.agent.observability.ObservabilityProperties;
import com.logschema.agent.observability.emit.MetricEventListener;
import com.logschema.agent.observability.event.MetricEvent;
import com.logschema.agent.observability.event.Status;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Derives Micrometer metrics from emitted {@link MetricEvent}s.
 *
 * <p>Metrics produced:
 * <ul>
 *   <li>{@code logschema.agent.active} (gauge): number of runs currently in progress</li>
 *   <li>{@code logschema.agent.errors.total} (counter): runs that ended in error</li>
 *   <li>{@code logschema.llm.tokens.total} (counter): LLM tokens, tagged by {@code direction}</li>
 *   <li>{@code logschema.llm.errors.total} (counter): LLM failures, tagged by {@code error_kind}</li>
 *   <li>{@code logschema.tool.errors.total} (counter): tool failures, tagged by {@code tool}</li>
 *   <li>{@code logschema.tool.duration} (timer): finished tool calls, tagged by {@code tool} and {@code status}</li>
 *   <li>{@code logschema.invocations.cancelled.total} (counter): cancelled invocations, tagged by {@code kind}</li>
 * </ul>
 */
public class ObservabilityMetricsListener implements MetricEventListener {

    private final MeterRegistry registry;
    private final ObservabilityProperties properties;
    private final AtomicInteger activeAgents = new AtomicInteger(0);

    /**
     * Creates the listener and registers the {@code logschema.agent.active} gauge.
     *
     * @param registry   registry to publish to
     * @param properties observability configuration controlling metrics emission
     */
    public ObservabilityMetricsListener(MeterRegistry registry, ObservabilityProperties properties) {
        this.registry = registry;
        this.properties = properties;
        Gauge.builder("logschema.agent.active", activeAgents, AtomicInteger::get)
                .description("Number of agent runs currently in progress")
                .register(registry);
    }

    @Override
    public void onEvent(MetricEvent event) {
        if (!properties.isMetricsEnabled()) {
            return;
        }
        if (event instanceof MetricEvent.AgentStart) {
            activeAgents.incrementAndGet();
        } else if (event instanceof MetricEvent.AgentEnd end) {
            activeAgents.updateAndGet(active -> Math.max(0, active - 1));
            if (end.status() == Status.ERROR) {
                Counter.builder("logschema.agent.errors.total")
                        .description("Total agent runs that ended in error")
                        .register(registry)
                        .increment();
            } else if (end.status() == Status.CANCELLED) {
                recordCancelled("agent");
            }
        } else if (event instanceof MetricEvent.LlmUsage usage) {
            recordTokens("input", usage.tokensPrompt());
            recordTokens("output", usage.tokensCompletion());
        } else if (event instanceof MetricEvent.LlmError error) {
            Counter.builder("logschema.llm.errors.total")
                    .description("Total LLM call failures")
                    .tag("error_kind", error.errorKind())
                    .register(registry)
                    .increment();
        } else if (event instanceof MetricEvent.LlmEnd end && end.status() == Status.CANCELLED) {
            recordCancelled("llm");
        } else if (event instanceof MetricEvent.ToolEnd end) {
            Timer.builder("logschema.tool.duration")
                    .description("Duration of finished tool calls")
                    .tag("tool", end.toolName())
                    .tag("status", end.status().wireValue())
                    .register(registry)
                    .record(Duration.ofMillis(end.durationMs()));
            if (end.status() == Status.CANCELLED) {
                recordCancelled("tool");
            }
        } else if (event instanceof MetricEvent.ToolError error) {
            Counter.builder("logschema.tool.errors.total")
                    .description("Total tool call failures")
                    .tag("tool", error.toolName())
                    .register(registry)
                    .increment();
        } else if (event instanceof MetricEvent.BatchEnd end && end.status() == Status.CANCELLED) {
            recordCancelled("batch");
        } else if (event instanceof MetricEvent.HandleClose close && close.status() == Status.CANCELLED) {
            recordCancelled("handle");
        }
    }

    private void recordTokens(String direction, long tokens) {
        if (tokens <= 0) {
            return;
        }
        Counter.builder("logschema.llm.tokens.total")
                .description("Total LLM tokens consumed")
                .tag("direction", direction)
                .register(registry)
                .increment(tokens);
    }

    private void recordCancelled(String kind) {
        Counter.builder("logschema.invocations.cancelled.total")
                .description("Total invocations cancelled before they finished")
                .tag("kind", kind)
                .register(registry)
                .increment();
    }
}
