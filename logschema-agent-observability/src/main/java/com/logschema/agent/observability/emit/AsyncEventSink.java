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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands event lines to a single background writer through a bounded queue.
 *
 * <p>Callers never block: when the queue is full the line is dropped and counted.
 * Lines are written in submission order.
 */
public class AsyncEventSink implements EventSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AsyncEventSink.class);

    private final EventSink delegate;
    private final ThreadPoolExecutor writer;
    private final AtomicLong dropped = new AtomicLong();

    public AsyncEventSink(EventSink delegate, int queueCapacity) {
        this(delegate, queueCapacity, "logschema-event-writer-");
    }

    public AsyncEventSink(EventSink delegate, int queueCapacity, String threadNamePrefix) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1 but was " + queueCapacity);
        }
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(threadNamePrefix);
        threadFactory.setDaemon(true);
        this.writer = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity), threadFactory,
                (task, executor) -> {
                    long count = dropped.incrementAndGet();
                    log.debug("Event queue full, dropped {} lines so far", count);
                });
    }

    @Override
    public void write(Level level, String line) {
        writer.execute(() -> BestEffort.run(log, "async event write", () -> delegate.write(level, line)));
    }

    /**
     * @return number of lines dropped because the queue was full or the sink closed
     */
    public long droppedCount() {
        return dropped.get();
    }

    /**
     * Stops accepting lines and waits briefly for queued lines to be written.
     */
    @Override
    public void close() {
        writer.shutdown();
        try {
            if (!writer.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Event writer did not drain within 5s, {} lines pending", writer.getQueue().size());
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            writer.shutdownNow();
        }
    }
}
