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

import com.logschema.agent.observability.event.ActionKind;
import com.logschema.agent.observability.event.MetricEvent;
import com.logschema.agent.observability.event.Status;
import com.logschema.agent.observability.policy.LoggingStrategy;
import com.logschema.agent.observability.policy.ToolLoggingPolicy;
import com.logschema.agent.observability.policy.Verbosity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.event.Level;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

/**
 * Tests for {@link MetricEventEmitter}.
 */
class MetricEventEmitterTest {

    private static final String RUN = "run_0123456789abcdef0123456789abcdef";
    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final ToolLoggingPolicy policy = new ToolLoggingPolicy(Map.of(
            "write_file_content", LoggingStrategy.METADATA_ONLY,
            "line_count", LoggingStrategy.FULL));
    private final EventRenderer renderer = new EventRenderer(200);

    private final RecordingEventSink console = new RecordingEventSink();
    private final RecordingEventSink file = new RecordingEventSink();
    private final RecordingEventSink trace = new RecordingEventSink();

    private MetricEventEmitter emitter() {
        return new MetricEventEmitter(List.of(
                new EventDestination("console", Verbosity.LOW, console),
                new EventDestination("file", Verbosity.MID, file),
                new EventDestination("trace", Verbosity.HIGH, trace)), renderer, policy);
    }

    // ================================================================================
    // VISIBILITY TESTS
    // ================================================================================

    @Nested
    @DisplayName("Visibility Tests")
    class VisibilityTests {

        @Test
        @DisplayName("Run summary should reach every destination")
        void agentEnd_shouldReachAll() {
            emitter().emit(new MetricEvent.AgentEnd(RUN, NOW, Status.OK, 10, List.of(), Map.of()));

            assertThat(console.lines()).hasSize(1);
            assertThat(file.lines()).hasSize(1);
            assertThat(trace.lines()).hasSize(1);
            assertThat(console.lines().get(0).level()).isEqualTo(Level.INFO);
        }

        @Test
        @DisplayName("Usage should be hidden from LOW destinations")
        void usage_shouldSkipLow() {
            emitter().emit(new MetricEvent.LlmUsage(RUN, NOW, "inv", 1, 1, 2));

            assertThat(console.lines()).isEmpty();
            assertThat(file.lines()).hasSize(1);
            assertThat(trace.lines()).hasSize(1);
        }

        @Test
        @DisplayName("Iterations should only reach HIGH destinations")
        void iteration_shouldOnlyReachHigh() {
            emitter().emit(new MetricEvent.AgentIteration(RUN, NOW, 1,
                    ActionKind.FINISH, "done", "ok"));

            assertThat(console.lines()).isEmpty();
            assertThat(file.lines()).isEmpty();
            assertThat(trace.lines()).hasSize(1);
        }

        @Test
        @DisplayName("Tool arguments should follow the tool policy per destination")
        void toolStart_shouldApplyPolicyPerDestination() {
            emitter().emit(new MetricEvent.ToolStart(RUN, NOW, "inv", "write_file_content", 10,
                    Map.of("content", "secret-body")));

            assertThat(file.texts().get(0)).contains("[redacted]").doesNotContain("secret-body");
            assertThat(trace.texts().get(0)).contains("secret-body");
        }

        @Test
        @DisplayName("Null event should be ignored")
        void nullEvent_shouldBeIgnored() {
            emitter().emit(null);

            assertThat(trace.lines()).isEmpty();
        }

        @Test
        @DisplayName("Max verbosity should be the highest destination")
        void maxVerbosity_shouldBeHighest() {
            assertThat(emitter().maxVerbosity()).isEqualTo(Verbosity.HIGH);
            assertThat(new MetricEventEmitter(List.of(), renderer, policy).maxVerbosity()).isEqualTo(Verbosity.LOW);
        }
    }

    // ================================================================================
    // FAILURE ISOLATION TESTS
    // ================================================================================

    @Nested
    @DisplayName("Failure Isolation Tests")
    class FailureIsolationTests {

        @Test
        @DisplayName("Failing sink should not stop other sinks or reach the caller")
        void failingSink_shouldBeIsolated() {
            EventSink broken = (level, line) -> {
                throw new IllegalStateException("disk full");
            };
            MetricEventEmitter emitter = new MetricEventEmitter(List.of(
                    new EventDestination("broken", Verbosity.HIGH, broken),
                    new EventDestination("file", Verbosity.MID, file)), renderer, policy);

            assertThatCode(() -> emitter.emit(new MetricEvent.LlmUsage(RUN, NOW, "inv", 1, 1, 2)))
                    .doesNotThrowAnyException();
            assertThat(file.lines()).hasSize(1);
        }

        @Test
        @DisplayName("Failing listener should not stop other listeners")
        void failingListener_shouldBeIsolated() {
            List<MetricEvent> seen = new ArrayList<>();
            MetricEventEmitter emitter = new MetricEventEmitter(List.of(), renderer, policy, List.of(
                    event -> {
                        throw new IllegalStateException("boom");
                    },
                    seen::add));

            emitter.emit(new MetricEvent.LlmUsage(RUN, NOW, "inv", 1, 1, 2));

            assertThat(seen).hasSize(1);
        }

        @Test
        @DisplayName("Added listeners should receive later events")
        void addListener_shouldReceiveEvents() {
            List<MetricEvent> seen = new ArrayList<>();
            MetricEventEmitter emitter = emitter();
            emitter.addListener(seen::add);

            emitter.emit(new MetricEvent.BatchStart(RUN, NOW, 1, 100));

            assertThat(seen).singleElement().isInstanceOf(MetricEvent.BatchStart.class);
        }
    }
}
