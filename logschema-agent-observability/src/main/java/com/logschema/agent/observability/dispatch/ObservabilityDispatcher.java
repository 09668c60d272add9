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
package com.logschema.agent.observability.dispatch;

import com.logschema.agent.observability.BestEffort;
import com.logschema.agent.observability.context.RunContextHolder;
import com.logschema.agent.observability.emit.MetricEventEmitter;
import com.logschema.agent.observability.event.ActionKind;
import com.logschema.agent.observability.event.MetricEvent;
import com.logschema.agent.observability.event.Status;
import com.logschema.agent.observability.ledger.TokenLedger;
import com.logschema.agent.observability.policy.ToolLoggingPolicy;
import com.logschema.agent.observability.policy.Truncation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns lifecycle notifications into {@link MetricEvent}s.
 *
 * <p>This is the only component that reads the active run context, consults the tool
 * logging policy and feeds the token ledger. Notifications received outside any active
 * run are dropped. Each notification is handled inside a {@link BestEffort} boundary, so
 * a malformed payload costs one event and nothing else.
 *
 * <p>Start instants are kept per {@code (run, kind, invocation)} until the matching end,
 * so overlapping invocations of the same tool are each timed from their own start.
 * When an agent run ends with invocations still open, each of them gets a terminal
 * event with status {@code cancelled}.
 *
 * <p>An LLM invocation's usage is recorded once: usage carried by an ERROR counts only
 * when no USAGE was received for that invocation. The run's ledger entries are dropped
 * once its token summary has been emitted.
 */
public class ObservabilityDispatcher implements LifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(ObservabilityDispatcher.class);

    /** Max length of iteration action and observation summaries. */
    public static final int SUMMARY_MAX_LENGTH = 200;

    private final MetricEventEmitter emitter;
    private final TokenLedger ledger;
    private final ToolLoggingPolicy policy;
    private final Clock clock;

    private final Map<InvocationKey, InFlight> inFlight = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> iterations = new ConcurrentHashMap<>();
    private final Set<InvocationKey> usageRecorded = ConcurrentHashMap.newKeySet();

    public ObservabilityDispatcher(MetricEventEmitter emitter, TokenLedger ledger, ToolLoggingPolicy policy,
                                   Clock clock) {
        this.emitter = emitter;
        this.ledger = ledger;
        this.policy = policy;
        this.clock = clock;
    }

    private record InvocationKey(String runId, InvocationKind kind, String invocationId) {
    }

    /**
     * @param startedAt when the invocation started
     * @param label     tool name for tools, path for handles
     * @param number    batch number for batches
     */
    private record InFlight(Instant startedAt, String label, int number) {
    }

    @Override
    public void onLifecycle(LifecycleNotification notification) {
        if (notification == null) {
            return;
        }
        BestEffort.run(log, "lifecycle " + notification.kind() + " " + notification.phase(),
                () -> dispatch(notification));
    }

    private void dispatch(LifecycleNotification notification) {
        Optional<String> runId = RunContextHolder.currentRunId();
        if (runId.isEmpty()) {
            log.debug("Dropping {} {} notification for {} outside any active run",
                    notification.kind(), notification.phase(), notification.invocationId());
            return;
        }
        switch (notification.kind()) {
            case AGENT -> onAgent(runId.get(), notification);
            case LLM -> onLlm(runId.get(), notification);
            case TOOL -> onTool(runId.get(), notification);
            case BATCH -> onBatch(runId.get(), notification);
            case HANDLE -> onHandle(runId.get(), notification);
        }
    }

    private void onAgent(String runId, LifecycleNotification n) {
        Map<String, Object> payload = n.payload();
        switch (n.phase()) {
            case START -> {
                start(runId, n, null, 0);
                iterations.put(runId, new AtomicInteger());
                Map<String, Object> inputs = Payloads.map(payload, PayloadKeys.INPUTS);
                emitter.emit(new MetricEvent.AgentStart(runId, clock.instant(), keysOf(inputs),
                        Payloads.sizesOf(inputs)));
            }
            case END -> finishRun(runId, n, Status.OK);
            case ERROR -> finishRun(runId, n, Status.ERROR);
            case CANCEL -> finishRun(runId, n, Status.CANCELLED);
            case STEP -> {
                int iteration = iterations.computeIfAbsent(runId, id -> new AtomicInteger()).incrementAndGet();
                emitter.emit(new MetricEvent.AgentIteration(runId, clock.instant(), iteration,
                        actionKind(payload.get(PayloadKeys.ACTION_KIND)),
                        Truncation.truncate(Payloads.text(payload, PayloadKeys.ACTION_SUMMARY), SUMMARY_MAX_LENGTH),
                        Truncation.truncate(Payloads.text(payload, PayloadKeys.OBSERVATION_SUMMARY),
                                SUMMARY_MAX_LENGTH)));
            }
            default -> ignored(n);
        }
    }

    private void finishRun(String runId, LifecycleNotification n, Status status) {
        InFlight started = inFlight.remove(key(runId, n));
        int cancelled = cancelRun(runId);
        if (cancelled > 0) {
            log.debug("Run {} ended with {} open invocations, marked cancelled", runId, cancelled);
        }
        Map<String, Object> outputs = Payloads.map(n.payload(), PayloadKeys.OUTPUTS);
        emitter.emit(new MetricEvent.AgentEnd(runId, clock.instant(), status, durationMs(started),
                keysOf(outputs), Payloads.sizesOf(outputs)));
        emitter.emit(ledger.summarize(runId));
        ledger.reset(runId);
        iterations.remove(runId);
        usageRecorded.removeIf(key -> key.runId().equals(runId));
    }

    private void onLlm(String runId, LifecycleNotification n) {
        Map<String, Object> payload = n.payload();
        switch (n.phase()) {
            case START -> {
                start(runId, n, null, 0);
                emitter.emit(new MetricEvent.LlmStart(runId, clock.instant(), n.invocationId(),
                        Payloads.requireText(payload, PayloadKeys.MODEL),
                        Payloads.text(payload, PayloadKeys.MODEL_VERSION),
                        Payloads.number(payload, PayloadKeys.PROMPT_SIZE_BYTES, 0)));
            }
            case USAGE -> {
                if (usageRecorded.add(key(runId, n))) {
                    recordUsage(runId, n, Payloads.flag(payload, PayloadKeys.SUCCEEDED, true));
                } else {
                    log.debug("Ignoring repeated usage for LLM invocation {}", n.invocationId());
                }
            }
            case END -> {
                InFlight started = inFlight.remove(key(runId, n));
                usageRecorded.remove(key(runId, n));
                emitter.emit(new MetricEvent.LlmEnd(runId, clock.instant(), n.invocationId(), Status.OK,
                        durationMs(started)));
            }
            case ERROR -> {
                inFlight.remove(key(runId, n));
                boolean usageSeen = usageRecorded.remove(key(runId, n));
                if (!usageSeen && Payloads.has(payload, PayloadKeys.TOKENS_TOTAL)) {
                    recordUsage(runId, n, false);
                }
                emitter.emit(new MetricEvent.LlmError(runId, clock.instant(), n.invocationId(),
                        errorKind(payload), Payloads.text(payload, PayloadKeys.MESSAGE)));
            }
            case CANCEL -> {
                InFlight started = inFlight.remove(key(runId, n));
                usageRecorded.remove(key(runId, n));
                emitter.emit(new MetricEvent.LlmEnd(runId, clock.instant(), n.invocationId(), Status.CANCELLED,
                        durationMs(started)));
            }
            default -> ignored(n);
        }
    }

    private void recordUsage(String runId, LifecycleNotification n, boolean succeeded) {
        Map<String, Object> payload = n.payload();
        long prompt = Payloads.number(payload, PayloadKeys.TOKENS_PROMPT, 0);
        long completion = Payloads.number(payload, PayloadKeys.TOKENS_COMPLETION, 0);
        long total = Payloads.number(payload, PayloadKeys.TOKENS_TOTAL, prompt + completion);
        MetricEvent.LlmUsage usage = new MetricEvent.LlmUsage(runId, clock.instant(), n.invocationId(),
                prompt, completion, total);
        ledger.record(usage, succeeded);
        emitter.emit(usage);
    }

    private void onTool(String runId, LifecycleNotification n) {
        Map<String, Object> payload = n.payload();
        switch (n.phase()) {
            case START -> {
                String toolName = Payloads.requireText(payload, PayloadKeys.TOOL_NAME);
                policy.strategyFor(toolName);
                start(runId, n, toolName, 0);
                Map<String, Object> arguments = Payloads.map(payload, PayloadKeys.ARGUMENTS);
                emitter.emit(new MetricEvent.ToolStart(runId, clock.instant(), n.invocationId(), toolName,
                        Payloads.sizeOf(arguments), arguments));
            }
            case END -> {
                InFlight started = inFlight.remove(key(runId, n));
                Object result = payload.get(PayloadKeys.RESULT);
                emitter.emit(new MetricEvent.ToolEnd(runId, clock.instant(), n.invocationId(),
                        toolName(payload, started), Status.OK, durationMs(started), Payloads.sizeOf(result),
                        result == null ? null : String.valueOf(result)));
            }
            case ERROR -> {
                InFlight started = inFlight.remove(key(runId, n));
                emitter.emit(new MetricEvent.ToolError(runId, clock.instant(), n.invocationId(),
                        toolName(payload, started), errorKind(payload), Payloads.text(payload, PayloadKeys.MESSAGE)));
            }
            case CANCEL -> {
                InFlight started = inFlight.remove(key(runId, n));
                emitter.emit(cancelledTool(runId, n.invocationId(), toolName(payload, started), started));
            }
            default -> ignored(n);
        }
    }

    private void onBatch(String runId, LifecycleNotification n) {
        Map<String, Object> payload = n.payload();
        switch (n.phase()) {
            case START -> {
                int batchNumber = (int) Payloads.number(payload, PayloadKeys.BATCH_NUMBER, 0);
                start(runId, n, null, batchNumber);
                emitter.emit(new MetricEvent.BatchStart(runId, clock.instant(), batchNumber,
                        Payloads.number(payload, PayloadKeys.PLANNED_LINES, 0)));
            }
            case END -> {
                InFlight started = inFlight.remove(key(runId, n));
                emitter.emit(new MetricEvent.BatchEnd(runId, clock.instant(), batchNumber(payload, started),
                        Status.OK, Payloads.number(payload, PayloadKeys.LINES_READ, 0),
                        Payloads.number(payload, PayloadKeys.CUMULATIVE_LINES, 0), durationMs(started)));
            }
            case DISCOVERY -> emitter.emit(new MetricEvent.BatchDiscovery(runId, clock.instant(),
                    (int) Payloads.number(payload, PayloadKeys.BATCH_NUMBER, 0),
                    Payloads.strings(payload, PayloadKeys.NEW_LOG_TYPES),
                    Payloads.strings(payload, PayloadKeys.NEW_FIELDS)));
            case ERROR -> {
                InFlight started = inFlight.remove(key(runId, n));
                emitter.emit(new MetricEvent.BatchEnd(runId, clock.instant(), batchNumber(payload, started),
                        Status.ERROR, Payloads.number(payload, PayloadKeys.LINES_READ, 0),
                        Payloads.number(payload, PayloadKeys.CUMULATIVE_LINES, 0), durationMs(started)));
            }
            case CANCEL -> {
                InFlight started = inFlight.remove(key(runId, n));
                emitter.emit(cancelledBatch(runId, batchNumber(payload, started), started));
            }
            default -> ignored(n);
        }
    }

    private void onHandle(String runId, LifecycleNotification n) {
        Map<String, Object> payload = n.payload();
        switch (n.phase()) {
            case START -> {
                String path = Payloads.requireText(payload, PayloadKeys.PATH);
                start(runId, n, path, 0);
                emitter.emit(new MetricEvent.HandleOpen(runId, clock.instant(), n.invocationId(), path,
                        Payloads.optionalNumber(payload, PayloadKeys.TOTAL_LINES)));
            }
            case END -> {
                InFlight started = inFlight.remove(key(runId, n));
                emitter.emit(new MetricEvent.HandleClose(runId, clock.instant(), n.invocationId(), Status.OK,
                        Payloads.number(payload, PayloadKeys.LINES_READ, 0), durationMs(started)));
            }
            case ERROR, CANCEL -> {
                InFlight started = inFlight.remove(key(runId, n));
                Status status = n.phase() == Phase.ERROR ? Status.ERROR : Status.CANCELLED;
                emitter.emit(new MetricEvent.HandleClose(runId, clock.instant(), n.invocationId(), status,
                        Payloads.number(payload, PayloadKeys.LINES_READ, 0), durationMs(started)));
            }
            default -> ignored(n);
        }
    }

    /**
     * Emits a cancelled terminal event for every LLM, tool, batch and handle invocation
     * of the run that has started and not finished.
     *
     * @param runId the run
     * @return number of invocations cancelled
     */
    public int cancelRun(String runId) {
        List<InvocationKey> open = new ArrayList<>();
        for (InvocationKey key : inFlight.keySet()) {
            if (key.runId().equals(runId) && key.kind() != InvocationKind.AGENT) {
                open.add(key);
            }
        }
        int cancelled = 0;
        for (InvocationKey key : open) {
            InFlight started = inFlight.remove(key);
            if (started == null) {
                continue;
            }
            cancelled++;
            BestEffort.run(log, "cancel " + key.kind() + " " + key.invocationId(),
                    () -> emitter.emit(cancelledEvent(key, started)));
        }
        return cancelled;
    }

    /**
     * @param runId the run
     * @return number of invocations of the run that started and have not finished
     */
    public int openInvocations(String runId) {
        int open = 0;
        for (InvocationKey key : inFlight.keySet()) {
            if (key.runId().equals(runId)) {
                open++;
            }
        }
        return open;
    }

    private MetricEvent cancelledEvent(InvocationKey key, InFlight started) {
        Instant now = clock.instant();
        return switch (key.kind()) {
            case LLM -> new MetricEvent.LlmEnd(key.runId(), now, key.invocationId(), Status.CANCELLED,
                    durationMs(started));
            case TOOL -> cancelledTool(key.runId(), key.invocationId(), started.label(), started);
            case BATCH -> cancelledBatch(key.runId(), started.number(), started);
            case HANDLE -> new MetricEvent.HandleClose(key.runId(), now, key.invocationId(), Status.CANCELLED, 0,
                    durationMs(started));
            case AGENT -> throw new IllegalStateException("Agent invocations are finished, not cancelled");
        };
    }

    private MetricEvent.ToolEnd cancelledTool(String runId, String invocationId, String toolName, InFlight started) {
        return new MetricEvent.ToolEnd(runId, clock.instant(), invocationId, toolName, Status.CANCELLED,
                durationMs(started), 0, null);
    }

    private MetricEvent.BatchEnd cancelledBatch(String runId, int batchNumber, InFlight started) {
        return new MetricEvent.BatchEnd(runId, clock.instant(), batchNumber, Status.CANCELLED, 0, 0,
                durationMs(started));
    }

    private void start(String runId, LifecycleNotification n, String label, int number) {
        inFlight.put(key(runId, n), new InFlight(clock.instant(), label, number));
    }

    private static InvocationKey key(String runId, LifecycleNotification n) {
        return new InvocationKey(runId, n.kind(), n.invocationId());
    }

    private long durationMs(InFlight started) {
        if (started == null) {
            return 0;
        }
        return Math.max(0, Duration.between(started.startedAt(), clock.instant()).toMillis());
    }

    private static String toolName(Map<String, Object> payload, InFlight started) {
        String toolName = Payloads.text(payload, PayloadKeys.TOOL_NAME);
        if (toolName == null && started != null) {
            toolName = started.label();
        }
        return toolName;
    }

    private static int batchNumber(Map<String, Object> payload, InFlight started) {
        if (Payloads.has(payload, PayloadKeys.BATCH_NUMBER)) {
            return (int) Payloads.number(payload, PayloadKeys.BATCH_NUMBER, 0);
        }
        return started == null ? 0 : started.number();
    }

    private static String errorKind(Map<String, Object> payload) {
        String errorKind = Payloads.text(payload, PayloadKeys.ERROR_KIND);
        return errorKind == null || errorKind.isBlank() ? "unknown" : errorKind;
    }

    private static ActionKind actionKind(Object value) {
        if (value instanceof ActionKind actionKind) {
            return actionKind;
        }
        return ActionKind.fromWireValue(value == null ? null : value.toString());
    }

    private static List<String> keysOf(Map<String, Object> values) {
        return values == null ? List.of() : new ArrayList<>(values.keySet());
    }

    private static void ignored(LifecycleNotification n) {
        log.debug("Ignoring {} notification for {} {}", n.phase(), n.kind(), n.invocationId());
    }
}
