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
package com.logschema.agent.observability.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Thread-scoped holder for the active {@link RunContext}.
 *
 * <p>A context is bound with {@link #activate(RunContext)} and stays bound until the
 * returned {@link RunScope} is closed. Work handed to another thread does not see the
 * binding unless it is wrapped with {@link #wrap(Runnable)} or submitted through an
 * executor decorated with {@link RunContextTaskDecorator}.
 *
 * <p>The run id is mirrored into the SLF4J MDC under {@link #MDC_RUN_ID} while bound.
 */
public final class RunContextHolder {

    private static final Logger log = LoggerFactory.getLogger(RunContextHolder.class);

    /** MDC key carrying the active run id. */
    public static final String MDC_RUN_ID = "logschema.run_id";

    private static final String RUN_ID_PREFIX = "run_";

    private static final ThreadLocal<RunContext> CURRENT = new ThreadLocal<>();

    private RunContextHolder() {}

    /**
     * Generates a fresh run id.
     *
     * @return {@code run_} followed by 32 lowercase hex chars
     */
    public static String generateRunId() {
        return RUN_ID_PREFIX + UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Creates a new run context stamped with the given clock.
     *
     * @param clock clock providing the creation instant
     * @return a context with a freshly generated id
     */
    public static RunContext newRun(Clock clock) {
        return new RunContext(generateRunId(), clock.instant());
    }

    /**
     * Binds the context to the current thread.
     *
     * @param context the context to bind
     * @return scope that restores the previous binding when closed
     * @throws IllegalStateException if a different run is already bound on this thread
     */
    public static RunScope activate(RunContext context) {
        Objects.requireNonNull(context, "context");
        RunContext previous = CURRENT.get();
        if (previous != null && !previous.runId().equals(context.runId())) {
            throw new IllegalStateException(
                    "Cannot activate run " + context.runId() + " while run " + previous.runId()
                            + " is active on thread " + Thread.currentThread().getName());
        }
        CURRENT.set(context);
        MDC.put(MDC_RUN_ID, context.runId());
        log.trace("Activated run {}", context.runId());
        return new RunScope(context, previous);
    }

    /**
     * Returns the context bound to the current thread.
     *
     * @return the active context, empty outside any activated scope
     */
    public static Optional<RunContext> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    /**
     * Returns the id of the context bound to the current thread.
     *
     * @return the active run id, empty outside any activated scope
     */
    public static Optional<String> currentRunId() {
        return current().map(RunContext::runId);
    }

    /**
     * Clears any binding on the current thread.
     */
    public static void deactivate() {
        CURRENT.remove();
        MDC.remove(MDC_RUN_ID);
    }

    /**
     * Captures the caller's context so the task runs inside it on whichever thread executes it.
     *
     * @param task the task to wrap
     * @return the wrapped task, or the task itself when no context is active
     */
    public static Runnable wrap(Runnable task) {
        RunContext captured = CURRENT.get();
        if (captured == null) {
            return task;
        }
        return () -> {
            try (RunScope ignored = activate(captured)) {
                task.run();
            }
        };
    }

    /**
     * Captures the caller's context so the task runs inside it on whichever thread executes it.
     *
     * @param task the task to wrap
     * @param <V>  result type
     * @return the wrapped task, or the task itself when no context is active
     */
    public static <V> Callable<V> wrap(Callable<V> task) {
        RunContext captured = CURRENT.get();
        if (captured == null) {
            return task;
        }
        return () -> {
            try (RunScope ignored = activate(captured)) {
                return task.call();
            }
        };
    }

    static void restore(RunContext previous) {
        if (previous == null) {
            deactivate();
        } else {
            CURRENT.set(previous);
            MDC.put(MDC_RUN_ID, previous.runId());
        }
    }
}
