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

import org.slf4j.Logger;

/**
 * Error boundary for observability side effects.
 *
 * <p>Every place that records, renders or writes telemetry goes through
 * {@link #run(Logger, String, Runnable)}: a failure is logged at DEBUG on the
 * caller's logger and then dropped, so measuring a task can never fail the task.
 */
public final class BestEffort {

    private BestEffort() {}

    /**
     * Runs an observability action, swallowing any runtime failure.
     *
     * @param log       logger of the calling component
     * @param operation short description used in the failure message
     * @param action    the action to run
     * @return true if the action completed normally
     */
    public static boolean run(Logger log, String operation, Runnable action) {
        try {
            action.run();
            return true;
        } catch (RuntimeException | LinkageError e) {
            log.debug("Observability failure in {}: {}", operation, e.toString(), e);
            return false;
        }
    }
}
