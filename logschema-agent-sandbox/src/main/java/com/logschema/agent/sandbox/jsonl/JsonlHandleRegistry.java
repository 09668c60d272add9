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
package com.logschema.agent.sandbox.jsonl;

import com.logschema.agent.observability.BestEffort;
import com.logschema.agent.observability.dispatch.InvocationKind;
import com.logschema.agent.observability.dispatch.LifecycleListener;
import com.logschema.agent.observability.dispatch.LifecycleNotification;
import com.logschema.agent.observability.dispatch.Payloads;
import com.logschema.agent.observability.dispatch.Phase;
import com.logschema.agent.sandbox.CapabilitySandbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Open JSONL log files the agent reads incrementally, batch by batch.
 *
 * <p>Opening and closing a handle are reported as HANDLE lifecycle notifications, with
 * the handle id as invocation id.
 */
public class JsonlHandleRegistry {

    private static final Logger log = LoggerFactory.getLogger(JsonlHandleRegistry.class);

    private static final String EXTENSION = ".jsonl";

    private final CapabilitySandbox sandbox;
    private final LifecycleListener listener;
    private final Map<String, Handle> handles = new ConcurrentHashMap<>();

    public JsonlHandleRegistry(CapabilitySandbox sandbox, LifecycleListener listener) {
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    private static final class Handle {
        private final String id;
        private final Path path;
        private final BufferedReader reader;
        private long linesRead;

        private Handle(String id, Path path, BufferedReader reader) {
            this.id = id;
            this.path = path;
            this.reader = reader;
        }
    }

    /**
     * Opens a JSONL file for incremental reading.
     *
     * @param path the file, must end in {@code .jsonl}
     * @return the handle id
     */
    public String open(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        if (!path.toString().toLowerCase(Locale.ROOT).endsWith(EXTENSION)) {
            throw new IllegalArgumentException("Only " + EXTENSION + " files can be registered: " + path);
        }
        Path real = sandbox.authorizeRead(path);
        if (!Files.isRegularFile(real)) {
            throw new IOException("Not a regular file: " + path);
        }
        long totalLines;
        try (Stream<String> lines = Files.lines(real, StandardCharsets.UTF_8)) {
            totalLines = lines.count();
        }
        String id = "jsonl_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        handles.put(id, new Handle(id, real, Files.newBufferedReader(real, StandardCharsets.UTF_8)));
        log.debug("Opened JSONL handle {} for {} ({} lines)", id, real, totalLines);
        notify(id, Phase.START, Payloads.handleOpen(real.toString(), totalLines));
        return id;
    }

    /**
     * Reads the next lines of an open handle.
     *
     * @param handleId the handle
     * @param n        maximum number of lines, at least 1
     * @return up to {@code n} lines, empty at end of file
     */
    public List<String> readLines(String handleId, int n) throws IOException {
        if (n < 1) {
            throw new IllegalArgumentException("n must be >= 1 but was " + n);
        }
        Handle handle = require(handleId);
        List<String> lines = new ArrayList<>(Math.min(n, 1024));
        synchronized (handle) {
            String line;
            while (lines.size() < n && (line = handle.reader.readLine()) != null) {
                lines.add(line);
            }
            handle.linesRead += lines.size();
        }
        return lines;
    }

    /**
     * Closes a handle.
     *
     * @param handleId the handle
     * @return number of lines read through the handle
     */
    public long close(String handleId) throws IOException {
        Handle handle = handles.remove(handleId);
        if (handle == null) {
            throw new UnknownHandleException(handleId);
        }
        long linesRead;
        synchronized (handle) {
            linesRead = handle.linesRead;
            handle.reader.close();
        }
        log.debug("Closed JSONL handle {} for {} after {} lines", handle.id, handle.path, linesRead);
        notify(handle.id, Phase.END, Payloads.handleClose(linesRead));
        return linesRead;
    }

    /**
     * Closes every open handle, logging failures.
     */
    public void closeAll() {
        for (String handleId : Set.copyOf(handles.keySet())) {
            try {
                close(handleId);
            } catch (IOException | UnknownHandleException e) {
                log.warn("Failed to close JSONL handle {}: {}", handleId, e.getMessage());
            }
        }
    }

    public Set<String> openHandles() {
        return Set.copyOf(handles.keySet());
    }

    private Handle require(String handleId) {
        Handle handle = handleId == null ? null : handles.get(handleId);
        if (handle == null) {
            throw new UnknownHandleException(handleId);
        }
        return handle;
    }

    private void notify(String handleId, Phase phase, Map<String, Object> payload) {
        BestEffort.run(log, "handle " + phase,
                () -> listener.onLifecycle(LifecycleNotification.of(InvocationKind.HANDLE, phase, handleId, payload)));
    }
}
