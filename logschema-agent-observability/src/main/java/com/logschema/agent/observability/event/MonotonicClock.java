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
package com.logschema.agent.observability.event;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock whose instants never go backwards, even if the underlying wall clock does.
 * Shared by everything that stamps events, so start events never sort after their end.
 */
public class MonotonicClock extends Clock {

    private final Clock delegate;
    private final AtomicReference<Instant> last;

    public MonotonicClock(Clock delegate) {
        this(delegate, new AtomicReference<>(Instant.MIN));
    }

    private MonotonicClock(Clock delegate, AtomicReference<Instant> last) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.last = last;
    }

    /**
     * Monotonic clock over the system UTC clock.
     * @return a new clock
     */
    public static MonotonicClock systemUTC() {
        return new MonotonicClock(Clock.systemUTC());
    }

    @Override
    public Instant instant() {
        Instant now = delegate.instant();
        return last.updateAndGet(previous -> now.isAfter(previous) ? now : previous);
    }

    @Override
    public ZoneId getZone() {
        return delegate.getZone();
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MonotonicClock(delegate.withZone(zone), last);
    }
}
