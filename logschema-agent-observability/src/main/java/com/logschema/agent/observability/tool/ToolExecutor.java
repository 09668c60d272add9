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
package com.logschema.agent.observability.tool;

import com.logschema.agent.observability.BestEffort;
import com.logschema.agent.observability.dispatch.InvocationKind;
import com.logschema.agent.observability.dispatch.LifecycleListener;
import com.logschema.agent.observability.dispatch.LifecycleNotification;
import com.logschema.agent.observability.dispatch.Payloads;
import com.logschema.agent.observability.dispatch.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Runs registered tools and reports each call's lifecycle.
 *
 * <p>Runtime exceptions from a handler, sandbox violations included, reach the caller
 * unchanged. Checked exceptions are wrapped in {@link ToolExecutionException}.
 * An interrupted or cancelled handler is reported as cancelled, not failed, and the
 * thread's interrupt flag is restored.
 */
public class ToolExecutor {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutor.class);

    /** MDC key carrying the running tool's name. */
    public static final String MDC_TOOL_NAME = "logschema.tool.name";

    private final ToolRegistry registry;
    private final LifecycleListener listener;

    public ToolExecutor(ToolRegistry registry, LifecycleListener listener) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Runs a tool.
     *
     * @param toolName  registered tool name
     * @param arguments named arguments, may be null
     * @return the tool's result
     * @throws UnknownToolException   if no tool has that name
     * @throws ToolExecutionException if the handler throws a checked exception
     */
    public Object execute(String toolName, Map<String, Object> arguments) {
        ToolDescriptor descriptor = registry.require(toolName);
        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        String invocationId = UUID.randomUUID().toString();
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_TOOL_NAME, toolName)) {
            log.debug("Executing tool {} [{}]", toolName, invocationId);
            notify(invocationId, Phase.START, Payloads.toolStart(toolName, args));
            Object result;
            try {
                result = descriptor.handler().invoke(args);
            } catch (CancellationException e) {
                notify(invocationId, Phase.CANCEL, Payloads.toolCancel(toolName));
                throw e;
            } catch (RuntimeException | Error e) {
                notify(invocationId, Phase.ERROR, Payloads.toolError(toolName, e));
                throw e;
            } catch (InterruptedException e) {
                notify(invocationId, Phase.CANCEL, Payloads.toolCancel(toolName));
                Thread.currentThread().interrupt();
                throw new ToolExecutionException(toolName, e);
            } catch (Exception e) {
                notify(invocationId, Phase.ERROR, Payloads.toolError(toolName, e));
                throw new ToolExecutionException(toolName, e);
            }
            notify(invocationId, Phase.END, Payloads.toolEnd(toolName, result));
            return result;
        }
    }

    private void notify(String invocationId, Phase phase, Map<String, Object> payload) {
        BestEffort.run(log, "tool " + phase,
                () -> listener.onLifecycle(LifecycleNotification.of(InvocationKind.TOOL, phase, invocationId, payload)));
    }
}
