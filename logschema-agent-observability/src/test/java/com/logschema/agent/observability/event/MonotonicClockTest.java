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

import com.logschema.agent.observability.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class MonotonicClockTest {

    @Test
    void instant_shouldNeverGoBackwards() {
        MutableClock wall = new MutableClock(Instant.parse("2025-01-01T00:00:10Z"));
        MonotonicClock clock = new MonotonicClock(wall);

        Instant first = clock.instant();
        wall.set(Instant.parse("2025-01-01T00:00:05Z"));

        assertThat(clock.instant()).isEqualTo(first);
        wall.advance(Duration.ofSeconds(10));
        assertThat(clock.instant()).isEqualTo(Instant.parse("2025-01-01T00:00:15Z"));
    }

    @Test
    void withZone_shouldShareHighWaterMark() {
        MutableClock wall = new MutableClock(Instant.parse("2025-01-01T00:00:10Z"));
        MonotonicClock clock = new MonotonicClock(wall);
        clock.instant();
        wall.set(Instant.parse("2025-01-01T00:00:01Z"));

        assertThat(clock.withZone(ZoneId.of("Europe/Paris")).instant())
                .isEqualTo(Instant.parse("2025-01-01T00:00:10Z"));
    }
}
