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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One lifecycle notification from the orchestration.
 *
 * @param invocationId identifies the invocation across its phases, unique within a run
 * @param kind         what is being invoked
 * @param phase        lifecycle phase
 * @param payload      phase details, keys from {@link PayloadKeys}
 */
public record LifecycleNotification(String invocationId, InvocationKind kind, Phase phase,
                                    Map<String, Object> payload) {

    public LifecycleNotification {
        Objects.requireNonNull(invocationId, "invocationId");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(phase, "phase");
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static LifecycleNotification of(InvocationKind kind, Phase phase, String invocationId,
                                           Map<String, Object> payload) {
        return new LifecycleNotification(invocationId, kind, phase, payload);
    }

    public static LifecycleNotification of(InvocationKind kind, Phase phase, String invocationId) {
        return new LifecycleNotification(invocationId, kind, phase, Map.of());
    }
}
