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

/**
 * Binding of a {@link RunContext} to the thread that activated it.
 * Must be closed on that same thread.
 */
public final class RunScope implements AutoCloseable {

    private final RunContext context;
    private final RunContext previous;
    private final Thread owner;
    private boolean closed;

    RunScope(RunContext context, RunContext previous) {
        this.context = context;
        this.previous = previous;
        this.owner = Thread.currentThread();
    }

    /**
     * Returns the context bound by this scope.
     * @return the bound context
     */
    public RunContext context() {
        return context;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException(
                    "Run scope for " + context.runId() + " must be closed on thread " + owner.getName());
        }
        closed = true;
        RunContextHolder.restore(previous);
    }
}
