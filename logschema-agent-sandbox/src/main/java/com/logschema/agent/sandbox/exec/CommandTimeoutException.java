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
package com.logschema.agent.sandbox.exec;

import java.time.Duration;

/**
 * Thrown when a command outlives its timeout. The process has been killed.
 */
public class CommandTimeoutException extends RuntimeException {

    private final String command;
    private final Duration timeout;

    public CommandTimeoutException(String command, Duration timeout) {
        super("Command '" + command + "' timed out after " + timeout.toMillis() + "ms");
        this.command = command;
        this.timeout = timeout;
    }

    public String getCommand() {
        return command;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
