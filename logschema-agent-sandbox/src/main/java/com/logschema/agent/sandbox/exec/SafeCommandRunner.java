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
package com.logschema.agent.sandbox.exec;

import com.logschema.agent.sandbox.CapabilitySandbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs granted commands for agent-generated code, typically tests and linters over
 * custom parsers.
 *
 * <p>The command is started directly, never through a shell, after the sandbox has
 * authorized the command line and the working directory. Output is captured in full.
 * A process that outlives its timeout is killed.
 */
public class SafeCommandRunner {

    private static final Logger log = LoggerFactory.getLogger(SafeCommandRunner.class);

    private final CapabilitySandbox sandbox;
    private final Duration defaultTimeout;

    public SafeCommandRunner(CapabilitySandbox sandbox, Duration defaultTimeout) {
        this.sandbox = Objects.requireNonNull(sandbox, "sandbox");
        if (defaultTimeout == null || defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTimeout must be positive but was " + defaultTimeout);
        }
        this.defaultTimeout = defaultTimeout;
    }

    /**
     * Runs a command with the default timeout in the default working directory.
     */
    public CommandResult run(String command, List<String> args) throws IOException, InterruptedException {
        return run(command, args, null, null);
    }

    /**
     * Runs a command.
     *
     * @param command          bare, granted command name
     * @param args             arguments
     * @param timeout          timeout, null for the default
     * @param workingDirectory working directory, null for the first readable root
     * @return exit code and output
     * @throws com.logschema.agent.sandbox.SandboxViolationException if the command line or directory is denied
     * @throws CommandTimeoutException                               if the process outlives the timeout
     */
    public CommandResult run(String command, List<String> args, Duration timeout, Path workingDirectory)
            throws IOException, InterruptedException {
        List<String> arguments = args == null ? List.of() : List.copyOf(args);
        Path directory = workingDirectory != null
                ? workingDirectory
                : sandbox.defaultWorkingDirectory().orElseThrow(() ->
                new IllegalStateException("No working directory given and no readable root exists"));
        Path realDirectory = sandbox.authorizeRead(directory);
        if (!Files.isDirectory(realDirectory)) {
            throw new NotDirectoryException(directory.toString());
        }
        sandbox.authorizeExecute(command, arguments, realDirectory);
        Duration limit = timeout == null ? defaultTimeout : timeout;

        List<String> commandLine = new ArrayList<>();
        commandLine.add(command);
        commandLine.addAll(arguments);

        Path stdout = Files.createTempFile("logschema-cmd-", ".out");
        Path stderr = Files.createTempFile("logschema-cmd-", ".err");
        try {
            ProcessBuilder builder = new ProcessBuilder(commandLine)
                    .directory(realDirectory.toFile())
                    .redirectInput(ProcessBuilder.Redirect.from(nullDevice()))
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile());
            log.debug("Running {} in {} with timeout {}", commandLine, realDirectory, limit);
            Process process = builder.start();
            boolean finished;
            try {
                finished = process.waitFor(limit.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                throw new CommandTimeoutException(command, limit);
            }
            CommandResult result = new CommandResult(process.exitValue(),
                    new String(Files.readAllBytes(stdout), StandardCharsets.UTF_8),
                    new String(Files.readAllBytes(stderr), StandardCharsets.UTF_8));
            log.debug("{} exited with {}", command, result.exitCode());
            return result;
        } finally {
            Files.deleteIfExists(stdout);
            Files.deleteIfExists(stderr);
        }
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    private static File nullDevice() {
        return new File(System.getProperty("os.name").startsWith("Windows") ? "NUL" : "/dev/null");
    }
}
