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
package com.logschema.agent.observability.ledger;

import com.logschema.agent.observability.MutableClock;
import com.logschema.agent.observability.event.MetricEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TokenLedgerTest {

    private static final String RUN = "run_aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";

    private final MutableClock clock = new MutableClock();
    private final TokenLedger ledger = new TokenLedger(clock);

    private MetricEvent.LlmUsage usage(String runId, long prompt, long completion) {
        return new MetricEvent.LlmUsage(runId, clock.instant(), "inv", prompt, completion, prompt + completion);
    }

    @Test
    void summarize_shouldCountFailedCallsAsBillableOnly() {
        ledger.record(usage(RUN, 100, 50), true);
        ledger.record(usage(RUN, 80, 0), false);

        MetricEvent.AgentTokenSummary summary = ledger.summarize(RUN);

        assertThat(summary.runId()).isEqualTo(RUN);
        assertThat(summary.tokensSuccessful()).isEqualTo(150);
        assertThat(summary.tokensBillableEstimate()).isEqualTo(230);
        assertThat(summary.timestamp()).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Test
    void snapshot_shouldAggregateDirectionsAndCalls() {
        ledger.record(usage(RUN, 100, 50), true);
        ledger.record(usage(RUN, 80, 0), false);
        ledger.record(usage(RUN, 10, 5), true);

        TokenLedger.Totals totals = ledger.snapshot(RUN);

        assertThat(totals.tokensPrompt()).isEqualTo(190);
        assertThat(totals.tokensCompletion()).isEqualTo(55);
        assertThat(totals.successfulCalls()).isEqualTo(2);
        assertThat(totals.failedCalls()).isEqualTo(1);
        assertThat(totals.calls()).isEqualTo(3);
    }

    @Test
    void summarize_unknownRun_shouldBeZero() {
        MetricEvent.AgentTokenSummary summary = ledger.summarize("run_unknown");

        assertThat(summary.tokensBillableEstimate()).isZero();
        assertThat(summary.tokensSuccessful()).isZero();
        assertThat(ledger.snapshot("run_unknown")).isEqualTo(TokenLedger.Totals.EMPTY);
    }

    @Test
    void runs_shouldBeKeptApart() {
        ledger.record(usage(RUN, 10, 10), true);
        ledger.record(usage("run_other", 1, 1), true);

        assertThat(ledger.summarize(RUN).tokensBillableEstimate()).isEqualTo(20);
        assertThat(ledger.summarize("run_other").tokensBillableEstimate()).isEqualTo(2);
    }

    @Test
    void reset_shouldDropRunEntries() {
        ledger.record(usage(RUN, 10, 10), true);

        ledger.reset(RUN);

        assertThat(ledger.snapshot(RUN)).isEqualTo(TokenLedger.Totals.EMPTY);
    }

    @Test
    void record_null_shouldBeIgnored() {
        ledger.record(null, true);

        assertThat(ledger.snapshot(RUN).calls()).isZero();
    }

    @Test
    void concurrentRecording_shouldLoseNothing() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                boolean succeeded = t % 2 == 0;
                futures.add(CompletableFuture.runAsync(() -> {
                    for (int i = 0; i < 1000; i++) {
                        ledger.record(usage(RUN, 1, 1), succeeded);
                        ledger.summarize(RUN);
                    }
                }, executor));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(30, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        TokenLedger.Totals totals = ledger.snapshot(RUN);
        assertThat(totals.calls()).isEqualTo(8000);
        assertThat(totals.tokensBillable()).isEqualTo(16000);
        assertThat(totals.tokensSuccessful()).isEqualTo(8000);
    }
}
