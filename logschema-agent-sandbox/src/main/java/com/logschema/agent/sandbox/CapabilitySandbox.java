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
package com.logschema.agent.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether agent-generated code may read a path, write a path or run a command.
 *
 * <p>Paths are judged on their real location: symbolic links are followed and
 * {@code ..} segments resolved before the containment test, so a link inside a granted
 * root that points outside it is denied. Roots are resolved again on every call.
 * Checks never perform the access they judge.
 */
public class CapabilitySandbox {

    private static final Logger log = LoggerFactory.getLogger(CapabilitySandbox.class);

    private static final Pattern UNSAFE_COMMAND_CHARS = Pattern.compile("[\\s;&|<>$`\\\\\"'(){}\\[\\]*?!~#%=,]");

    private final CapabilityGrant grant;

    public CapabilitySandbox(CapabilityGrant grant) {
        this.grant = Objects.requireNonNull(grant, "grant");
    }

    public CapabilityGrant getGrant() {
        return grant;
    }

    /**
     * Checks read access. The target must exist and its real path must lie under a readable root.
     *
     * @param path the path to read
     * @return the decision
     */
    public SandboxDecision checkRead(Path path) {
        if (path == null) {
            return SandboxDecision.deny(Boundary.READ, "null", "no path given");
        }
        String subject = path.toString();
        Path real;
        try {
            real = path.toRealPath();
        } catch (IOException | SecurityException e) {
            return SandboxDecision.deny(Boundary.READ, subject, "path does not exist or cannot be resolved");
        }
        return contained(Boundary.READ, subject, real, grant.readableRoots());
    }

    /**
     * Checks write access. An existing target is judged on its real path; a new file on
     * the real path of its existing parent directory plus its file name.
     *
     * @param path the path to create or replace
     * @return the decision
     */
    public SandboxDecision checkWrite(Path path) {
        if (path == null) {
            return SandboxDecision.deny(Boundary.WRITE, "null", "no path given");
        }
        String subject = path.toString();
        Path real;
        try {
            if (Files.exists(path)) {
                real = path.toRealPath();
            } else if (Files.isSymbolicLink(path)) {
                return SandboxDecision.deny(Boundary.WRITE, subject, "target is a dangling symbolic link");
            } else {
                Path fileName = path.getFileName();
                if (fileName == null || fileName.toString().equals(".") || fileName.toString().equals("..")) {
                    return SandboxDecision.deny(Boundary.WRITE, subject, "target has no file name");
                }
                Path parent = path.toAbsolutePath().getParent();
                if (parent == null || !Files.isDirectory(parent)) {
                    return SandboxDecision.deny(Boundary.WRITE, subject, "parent directory does not exist");
                }
                real = parent.toRealPath().resolve(fileName.toString());
            }
        } catch (IOException | SecurityException e) {
            return SandboxDecision.deny(Boundary.WRITE, subject, "path cannot be resolved");
        }
        return contained(Boundary.WRITE, subject, real, grant.writableRoots());
    }

    /**
     * Checks that a command may be run with the given arguments. Relative path arguments
     * are resolved against the JVM working directory.
     *
     * @param command bare command name
     * @param args    arguments
     * @return the decision
     */
    public SandboxDecision checkExecute(String command, List<String> args) {
        return checkExecute(command, args, null);
    }

    /**
     * Checks that a command may be run with the given arguments.
     *
     * <p>The command must be a bare name, free of path separators, whitespace and shell
     * metacharacters, that exactly matches a granted command, and the arguments must be
     * accepted by that command's {@link CommandPolicy}. Every path argument must pass
     * {@link #checkRead(Path)}.
     *
     * @param command          bare command name
     * @param args             arguments
     * @param workingDirectory directory relative path arguments are resolved against, null for the JVM's
     * @return the decision
     */
    public SandboxDecision checkExecute(String command, List<String> args, Path workingDirectory) {
        List<String> arguments = args == null ? List.of() : args;
        String subject = commandLine(command, arguments);
        if (command == null || command.isBlank()) {
            return SandboxDecision.deny(Boundary.EXECUTE, subject, "no command given");
        }
        if (command.indexOf('/') >= 0 || command.indexOf('\\') >= 0) {
            return SandboxDecision.deny(Boundary.EXECUTE, subject, "command must be a bare name without path separators");
        }
        if (command.indexOf('\0') >= 0 || UNSAFE_COMMAND_CHARS.matcher(command).find()) {
            return SandboxDecision.deny(Boundary.EXECUTE, subject, "command contains whitespace or shell metacharacters");
        }
        Optional<CommandPolicy> policy = grant.policyFor(command);
        if (policy.isEmpty()) {
            return SandboxDecision.deny(Boundary.EXECUTE, subject,
                    "command not granted, allowed commands: " + grant.executableCommands());
        }
        for (String arg : arguments) {
            if (arg == null || arg.indexOf('\0') >= 0) {
                return SandboxDecision.deny(Boundary.EXECUTE, subject, "argument contains NUL or is missing");
            }
        }
        Optional<String> violation = policy.get().violation(arguments);
        if (violation.isPresent()) {
            return SandboxDecision.deny(Boundary.EXECUTE, subject, violation.get());
        }
        for (String arg : arguments) {
            if (CommandPolicy.isPathArgument(arg)) {
                Path argPath;
                try {
                    argPath = workingDirectory == null ? Path.of(arg) : workingDirectory.resolve(arg);
                } catch (InvalidPathException e) {
                    return SandboxDecision.deny(Boundary.EXECUTE, subject, "argument is not a valid path: " + arg);
                }
                SandboxDecision read = checkRead(argPath);
                if (!read.allowed()) {
                    return SandboxDecision.deny(Boundary.EXECUTE, subject,
                            "path argument '" + arg + "' is not readable: " + read.reason());
                }
            }
        }
        return SandboxDecision.allow(Boundary.EXECUTE, subject);
    }

    /**
     * Checks that a directory may be searched. Its real path must lie under a search root.
     *
     * @param directory the directory to walk
     * @return the decision
     */
    public SandboxDecision checkSearch(Path directory) {
        if (directory == null) {
            return SandboxDecision.deny(Boundary.SEARCH, "null", "no directory given");
        }
        String subject = directory.toString();
        Path real;
        try {
            real = directory.toRealPath();
        } catch (IOException | SecurityException e) {
            return SandboxDecision.deny(Boundary.SEARCH, subject, "directory does not exist or cannot be resolved");
        }
        if (!Files.isDirectory(real)) {
            return SandboxDecision.deny(Boundary.SEARCH, subject, "not a directory");
        }
        return contained(Boundary.SEARCH, subject, real, grant.effectiveSearchRoots());
    }

    /**
     * @param path a path found by a search
     * @return whether the path's real location lies under a search root
     */
    public boolean isSearchable(Path path) {
        try {
            Path real = path.toRealPath();
            return contained(Boundary.SEARCH, path.toString(), real, grant.effectiveSearchRoots()).allowed();
        } catch (IOException | SecurityException e) {
            return false;
        }
    }

    /**
     * @return the real path of the directory to search
     * @throws SandboxViolationException if searching is denied
     */
    public Path authorizeSearch(Path directory) {
        return authorize(checkSearch(directory)).resolvedPath();
    }

    /**
     * @return the real path of the read-authorized file
     * @throws SandboxViolationException if reading is denied
     */
    public Path authorizeRead(Path path) {
        return authorize(checkRead(path)).resolvedPath();
    }

    /**
     * @return the real path writes must go to
     * @throws SandboxViolationException if writing is denied
     */
    public Path authorizeWrite(Path path) {
        return authorize(checkWrite(path)).resolvedPath();
    }

    /**
     * @throws SandboxViolationException if running the command is denied
     */
    public void authorizeExecute(String command, List<String> args) {
        authorize(checkExecute(command, args));
    }

    /**
     * @throws SandboxViolationException if running the command is denied
     */
    public void authorizeExecute(String command, List<String> args, Path workingDirectory) {
        authorize(checkExecute(command, args, workingDirectory));
    }

    /**
     * First readable root that currently exists, used as the default working directory.
     *
     * @return the root
     */
    public Optional<Path> defaultWorkingDirectory() {
        return grant.readableRoots().stream().filter(Files::isDirectory).findFirst();
    }

    private SandboxDecision authorize(SandboxDecision decision) {
        if (!decision.allowed()) {
            log.warn("Sandbox denied {} of '{}': {}", decision.boundary(), decision.subject(), decision.reason());
            throw new SandboxViolationException(decision);
        }
        return decision;
    }

    private SandboxDecision contained(Boundary boundary, String subject, Path real, List<Path> roots) {
        for (Path root : roots) {
            Optional<Path> realRoot = realRoot(root);
            if (realRoot.isPresent() && real.startsWith(realRoot.get())) {
                log.trace("Sandbox allowed {} of {} under {}", boundary, real, realRoot.get());
                return SandboxDecision.allow(boundary, subject, real);
            }
        }
        return SandboxDecision.deny(boundary, subject, "resolves outside every " + boundary.name().toLowerCase(Locale.ROOT)
                + " root: " + real);
    }

    private static Optional<Path> realRoot(Path root) {
        try {
            return Optional.of(root.toRealPath());
        } catch (IOException | SecurityException e) {
            log.debug("Skipping unresolvable sandbox root {}: {}", root, e.toString());
            return Optional.empty();
        }
    }

    private static String commandLine(String command, List<String> args) {
        StringBuilder line = new StringBuilder(String.valueOf(command));
        for (String arg : args) {
            line.append(' ').append(arg);
        }
        return line.toString();
    }
}
