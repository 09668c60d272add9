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

import com.logschema.agent.observability.BestEffort;
import com.logschema.agent.observability.event.MetricEvent;
import com.logschema.agent.observability.policy.Disclosure;
import com.logschema.agent.observability.policy.ToolLoggingPolicy;
import com.logschema.agent.observability.policy.Verbosity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Writes {@link MetricEvent}s to every destination whose verbosity shows them, then
 * notifies listeners.
 *
 * <p>{@link #emit} never throws. Each destination and each listener runs inside its own
 * {@link BestEffort} boundary, so one failing sink does not starve the others.
 */
public class MetricEventEmitter {

    private static final Logger log = LoggerFactory.getLogger(MetricEventEmitter.class);

    private final List<EventDestination> destinations;
    private final EventRenderer renderer;
    private final ToolLoggingPolicy policy;
    private final List<MetricEventListener> listeners = new CopyOnWriteArrayList<>();

    public MetricEventEmitter(List<EventDestination> destinations, EventRenderer renderer, ToolLoggingPolicy policy) {
        this(destinations, renderer, policy, List.of());
    }

    public MetricEventEmitter(List<EventDestination> destinations, EventRenderer renderer, ToolLoggingPolicy policy,
                              List<? extends MetricEventListener> listeners) {
        this.destinations = List.copyOf(destinations);
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.listeners.addAll(listeners);
    }

    /**
     * Emits an event. Never throws.
     *
     * @param event the event, ignored if null
     */
    public void emit(MetricEvent event) {
        if (event == null) {
            return;
        }
        for (EventDestination destination : destinations) {
            if (!destination.verbosity().includes(event.kind().minimumVerbosity())) {
                continue;
            }
            BestEffort.run(log, "emit " + event.kind().wireName() + " to " + destination.name(), () -> {
                String line = renderer.render(event, disclosureFor(event, destination.verbosity()));
                destination.sink().write(event.severity(), line);
            });
        }
        for (MetricEventListener listener : listeners) {
            BestEffort.run(log, "notify listener of " + event.kind().wireName(), () -> listener.onEvent(event));
        }
    }

    private Disclosure disclosureFor(MetricEvent event, Verbosity verbosity) {
        if (event instanceof MetricEvent.ToolStart start) {
            return policy.resolve(start.toolName(), verbosity);
        }
        if (event instanceof MetricEvent.ToolEnd end) {
            return policy.resolve(end.toolName(), verbosity);
        }
        return Disclosure.FULL;
    }

    public void addListener(MetricEventListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * @return the highest verbosity of any destination, LOW when there are none
     */
    public Verbosity maxVerbosity() {
        Verbosity max = Verbosity.LOW;
        for (EventDestination destination : destinations) {
            if (destination.verbosity().compareTo(max) > 0) {
                max = destination.verbosity();
            }
        }
        return max;
    }

    public List<EventDestination> getDestinations() {
        return destinations;
    }
}
