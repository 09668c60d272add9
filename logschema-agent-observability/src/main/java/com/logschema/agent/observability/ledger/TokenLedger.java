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

import com.logschema.agent.observability.event.MetricEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Per-run, append-only record of LLM token usage.
 *
 * <p>{@link #record} never blocks and never fails; {@link #summarize} walks a lock-free
 * queue and so never blocks recorders either. Every call that reported usage counts
 * toward the billable estimate, only successful calls count as successful tokens.
 */
public class TokenLedger {

    private static final Logger log = LoggerFactory.getLogger(TokenLedger.class);

    private final Map<String, Queue<Entry>> entriesByRun = new ConcurrentHashMap<>();
    private final Clock clock;

    public TokenLedger(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * One LLM call's usage.
     *
     * @param tokensPrompt     prompt tokens
     * @param tokensCompletion completion tokens
     * @param tokensTotal      total tokens as reported by the provider
     * @param succeeded        whether the call produced a usable result
     */
    public record Entry(long tokensPrompt, long tokensCompletion, long tokensTotal, boolean succeeded) {
    }

    /**
     * Aggregated view of a run's entries.
     *
     * @param tokensPrompt     prompt tokens over all calls
     * @param tokensCompletion completion tokens over all calls
     * @param tokensBillable   total tokens over all calls
     * @param tokensSuccessful total tokens over successful calls
     * @param successfulCalls  number of successful calls
     * @param failedCalls      number of failed calls
     */
    public record Totals(long tokensPrompt, long tokensCompletion, long tokensBillable,
                         long tokensSuccessful, int successfulCalls, int failedCalls) {

        public static final Totals EMPTY = new Totals(0, 0, 0, 0, 0, 0);

        public int calls() {
            return successfulCalls + failedCalls;
        }
    }

    /**
     * Appends the usage of one LLM call to its run.
     *
     * @param usage     the usage event, attributed to {@code usage.runId()}
     * @param succeeded whether the call succeeded
     */
    public void record(MetricEvent.LlmUsage usage, boolean succeeded) {
        if (usage == null) {
            log.debug("Ignoring null usage");
            return;
        }
        entriesByRun.computeIfAbsent(usage.runId(), id -> new ConcurrentLinkedQueue<>())
                .add(new Entry(usage.tokensPrompt(), usage.tokensCompletion(), usage.tokensTotal(), succeeded));
    }

    /**
     * Summarizes a run's token usage.
     *
     * @param runId the run to summarize
     * @return the summary, zeros for an unknown run
     */
    public MetricEvent.AgentTokenSummary summarize(String runId) {
        Totals totals = snapshot(runId);
        return new MetricEvent.AgentTokenSummary(runId, clock.instant(), totals.tokensBillable(),
                totals.tokensSuccessful());
    }

    /**
     * Aggregates a run's entries.
     *
     * @param runId the run
     * @return the totals, {@link Totals#EMPTY} for an unknown run
     */
    public Totals snapshot(String runId) {
        Queue<Entry> entries = runId == null ? null : entriesByRun.get(runId);
        if (entries == null) {
            return Totals.EMPTY;
        }
        long prompt = 0;
        long completion = 0;
        long billable = 0;
        long successful = 0;
        int successfulCalls = 0;
        int failedCalls = 0;
        for (Entry entry : entries) {
            prompt += entry.tokensPrompt();
            completion += entry.tokensCompletion();
            billable += entry.tokensTotal();
            if (entry.succeeded()) {
                successful += entry.tokensTotal();
                successfulCalls++;
            } else {
                failedCalls++;
            }
        }
        return new Totals(prompt, completion, billable, successful, successfulCalls, failedCalls);
    }

    /**
     * Drops a finished run's entries.
     *
     * @param runId the run
     */
    public void reset(String runId) {
        if (runId != null && entriesByRun.remove(runId) != null) {
            log.debug("Reset token ledger for run {}", runId);
        }
    }
}
