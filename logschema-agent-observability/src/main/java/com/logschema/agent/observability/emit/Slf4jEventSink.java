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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import java.util.Objects;

/**
 * Writes event lines to an SLF4J logger. Routing the logger to a console or a
 * file is left to the host's logging configuration.
 */
public class Slf4jEventSink implements EventSink {

    /** Logger receiving console destination lines. */
    public static final String CONSOLE_LOGGER = "logschema.events.console";

    /** Logger receiving file destination lines. */
    public static final String FILE_LOGGER = "logschema.events.file";

    private final Logger logger;

    public Slf4jEventSink(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    public Slf4jEventSink(String loggerName) {
        this(LoggerFactory.getLogger(loggerName));
    }

    public static Slf4jEventSink console() {
        return new Slf4jEventSink(CONSOLE_LOGGER);
    }

    public static Slf4jEventSink file() {
        return new Slf4jEventSink(FILE_LOGGER);
    }

    @Override
    public void write(Level level, String line) {
        logger.atLevel(level).log(line);
    }

    public String getLoggerName() {
        return logger.getName();
    }
}
