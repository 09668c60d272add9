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
import com.logschema.agent.observability.event.MetricEvent;
import com.logschema.agent.observability.event.Status;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ObservabilityMetricsListener}.
 */
class ObservabilityMetricsListenerTest {

    private static final String RUN = "run_0123456789abcdef0123456789abcdef";
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    // ================================================================================
    // ACTIVE AGENT GAUGE TESTS
    // ================================================================================

    @Nested
    @DisplayName("Active Agent Gauge Tests")
    class ActiveAgentGaugeTests {

        @Test
        @DisplayName("Agent start should increment active agents gauge")
        void start_shouldIncrementGauge() {
            var registry = new SimpleMeterRegistry();
            var listener = new ObservabilityMetricsListener(registry, new ObservabilityProperties());

            listener.onEvent(new MetricEvent.AgentStart(RUN, NOW, List.of(), Map.of()));

            Gauge gauge = registry.find("logschema.agent.active").gauge();
            assertThat(gauge).isNotNull();
            assertThat(gauge.value()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Agent end should decrement active agents gauge and never go negative")
        void end_shouldDecrementGauge() {
            var registry = new SimpleMeterRegistry();
            var listener = new ObservabilityMetricsListener(registry, new ObservabilityProperties());

            listener.onEvent(new MetricEvent.AgentStart(RUN, NOW, List.of(), Map.of()));
            listener.onEvent(new MetricEvent.AgentEnd(RUN, NOW, Status.OK, 1, List.of(), Map.of()));
            listener.onEvent(new MetricEvent.AgentEnd(RUN, NOW, Status.OK, 1, List.of(), Map.of()));

            assertThat(registry.find("logschema.agent.active").gauge().value()).isEqualTo(0.0);
        }

        @Test
        @DisplayName("Failed run should count an agent error")
        void failedRun_shouldCountError() {
            var registry = new SimpleMeterRegistry();
            var listener = new ObservabilityMetricsListener(registry, new ObservabilityProperties());

            listener.onEvent(new MetricEvent.AgentEnd(RUN, NOW, Status.ERROR, 1, List.of(), Map.of()));

            Counter counter = registry.find("logschema.agent.errors.total").counter();
            assertThat(counter).isNotNull();
            assertThat(counter.count()).isEqualTo(1.0);
        }
    }

    // ================================================================================
    // LLM TESTS
    // ================================================================================

    @Nested
    @DisplayName("LLM Tests")
    class LlmTests {

        @Test
        @DisplayName("Usage should count input and output tokens")
        void usage_shouldCountTokens() {
            var registry = new SimpleMeterRegistry();
            var listener = new ObservabilityMetricsListener(registry, new ObservabilityProperties());

            listener.onEvent(new MetricEvent.LlmUsage(RUN, NOW, "inv", 100, 50, 150));
            listener.onEvent(new MetricEvent.LlmUsage(RUN, NOW, "inv", 80, 0, 80));

            assertThat(registry.find("logschema.llm.tokens.total").tag("direction", "input").counter().count())
                    .isEqualTo(180.0);
            assertThat(registry.find("logschema.llm.tokens.total").tag("direction", "output").counter().count())
                    .isEqualTo(50.0);
        }

        @Test
        @DisplayName("LLM error should be counted by error kind")
        void error_shouldBeCountedByKind() {
            var registry = new SimpleMeterRegistry();
            var listener = new ObservabilityMetricsListener(registry, new ObservabilityProperties());

            listener.onEvent(new MetricEvent.LlmError(RUN, NOW, "inv", "RateLimited", "slow down"));

            assertThat(registry.find("logschema.llm.errors.total").tag("error_kind", "RateLimited").counter())
                    .isNotNull();
        }
    }

    // ================================================================================
    // TOOL TESTS
    // ================================================================================

    @Nested
    @DisplayName("Tool Tests")
    class ToolTests {

        @Test
        @DisplayName("Tool end should record duration by tool and status")
        void toolEnd_shouldRecordDuration() {
            var registry = new SimpleMeterRegistry();
            var listener = new ObservabilityMetricsListener(registry, new ObservabilityProperties());

            listener.onEvent(new MetricEvent.ToolEnd(RUN, NOW, "inv", "line_count", Status.OK, 120, 3, "3"));

            Timer timer = registry.find("logschema.tool.duration")
                    .tag("tool", "line_count").tag("status", "ok").timer();
            assertThat(timer).isNotNull();
            assertThat(timer.count()).isEqualTo(1);
            assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(120.0);
        }

        @Test
        @DisplayName("Cancelled tool should be counted as cancelled invocation")
        void cancelledTool_shouldBeCounted() {
            var registry = new SimpleMeterRegistry();
            var listener = new ObservabilityMetricsListener(registry, new ObservabilityProperties());

            listener.onEvent(new MetricEvent.ToolEnd(RUN, NOW, "inv", "line_count", Status.CANCELLED, 0, 0, null));
            listener.onEvent(new MetricEvent.HandleClose(RUN, NOW, "jsonl_1", Status.CANCELLED, 0, 0));

            assertThat(registry.find("logschema.invocations.cancelled.total").tag("kind", "tool").counter().count())
                    .isEqualTo(1.0);
            assertThat(registry.find("logschema.invocations.cancelled.total").tag("kind", "handle").counter())
                    .isNotNull();
        }

        @Test
        @DisplayName("Tool error should be counted by tool")
        void toolError_shouldBeCounted() {
            var registry = new SimpleMeterRegistry();
            var listener = new ObservabilityMetricsListener(registry, new ObservabilityProperties());

            listener.onEvent(new MetricEvent.ToolError(RUN, NOW, "inv", "run_safe_command", "SecurityException", "x"));

            assertThat(registry.find("logschema.tool.errors.total").tag("tool", "run_safe_command").counter().count())
                    .isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("Disabled metrics should record nothing")
    void disabled_shouldRecordNothing() {
        var registry = new SimpleMeterRegistry();
        var properties = new ObservabilityProperties();
        properties.setMetricsEnabled(false);
        var listener = new ObservabilityMetricsListener(registry, properties);

        listener.onEvent(new MetricEvent.AgentStart(RUN, NOW, List.of(), Map.of()));
        listener.onEvent(new MetricEvent.LlmUsage(RUN, NOW, "inv", 100, 50, 150));

        assertThat(registry.find("logschema.agent.active").gauge().value()).isEqualTo(0.0);
        assertThat(registry.find("logschema.llm.tokens.total").counter()).isNull();
    }
}
