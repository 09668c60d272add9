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

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration of the capability sandbox for agent-generated code.
 *
 * <pre>
 * logschema:
 *   sandbox:
 *     readable-roots: [/repo]
 *     writable-roots: [/repo/custom_parsers, /repo/tests/custom_parsers]
 *     search-roots: [/repo/logs, /repo/custom_parsers]
 *     executable-commands: [ruff, black]
 *     commands:
 *       pytest:
 *         allowed-args: [-v, -x, --tb=short]
 *         value-flags: [-k]
 *       python:
 *         allowed-args: [--version, -m, py_compile]
 *         forbidden-patterns: [-c, exec, eval, os.system, subprocess]
 * </pre>
 *
 * Commands listed only under {@code executable-commands} accept path and number
 * arguments. An entry under {@code commands} grants the command with its own argument
 * policy.
 */
@ConfigurationProperties(prefix = "logschema.sandbox")
public class SandboxProperties {

    /**
     * Default constructor.
     */
    public SandboxProperties() {
    }

    /** Enable/disable the sandbox and its tools. */
    private boolean enabled = true;

    /** Directories agent-generated code may read. */
    private List<String> readableRoots = new ArrayList<>();

    /** Directories agent-generated code may write. */
    private List<String> writableRoots = new ArrayList<>();

    /** Directories file searches may walk. Defaults to the readable roots. */
    private List<String> searchRoots = new ArrayList<>();

    /** Bare names of the commands agent-generated code may run with path arguments only. */
    private List<String> executableCommands = new ArrayList<>();

    /** Commands agent-generated code may run, keyed by bare name, with their argument policy. */
    private Map<String, Command> commands = new LinkedHashMap<>();

    /** Default timeout of commands run by agent-generated code. */
    private Duration commandTimeout = Duration.ofSeconds(30);

    /**
     * Converts the configured roots and commands into a grant.
     *
     * @return the grant
     * @throws IllegalArgumentException if a root or command is blank
     */
    public CapabilityGrant toGrant() {
        Map<String, CommandPolicy> policies = new LinkedHashMap<>();
        for (String command : executableCommands) {
            if (command == null || command.isBlank()) {
                throw new IllegalArgumentException("Blank executable command in logschema.sandbox configuration");
            }
            policies.put(command.trim(), CommandPolicy.pathsOnly());
        }
        commands.forEach((name, command) -> policies.put(name.trim(), command.toPolicy()));
        return new CapabilityGrant(paths("readable", readableRoots), paths("writable", writableRoots),
                paths("search", searchRoots), policies);
    }

    private static List<Path> paths(String kind, List<String> roots) {
        List<Path> paths = new ArrayList<>();
        for (String root : roots) {
            if (root == null || root.isBlank()) {
                throw new IllegalArgumentException("Blank " + kind + " root in logschema.sandbox configuration");
            }
            paths.add(Path.of(root.trim()));
        }
        return paths;
    }

    // Getters and Setters

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getReadableRoots() {
        return readableRoots;
    }

    public void setReadableRoots(List<String> readableRoots) {
        this.readableRoots = readableRoots;
    }

    public List<String> getWritableRoots() {
        return writableRoots;
    }

    public void setWritableRoots(List<String> writableRoots) {
        this.writableRoots = writableRoots;
    }

    public List<String> getSearchRoots() {
        return searchRoots;
    }

    public void setSearchRoots(List<String> searchRoots) {
        this.searchRoots = searchRoots;
    }

    public List<String> getExecutableCommands() {
        return executableCommands;
    }

    public void setExecutableCommands(List<String> executableCommands) {
        this.executableCommands = executableCommands;
    }

    public Map<String, Command> getCommands() {
        return commands;
    }

    public void setCommands(Map<String, Command> commands) {
        this.commands = commands;
    }

    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public void setCommandTimeout(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    /**
     * Argument policy of one command.
     */
    public static class Command {

        /** Flags and sub-commands the command accepts, a flag may carry {@code =value}. */
        private List<String> allowedArgs = new ArrayList<>();

        /** Flags whose following argument is passed through unchecked. */
        private List<String> valueFlags = new ArrayList<>();

        /** Substrings no argument may contain. */
        private List<String> forbiddenPatterns = new ArrayList<>();

        /** Accept every argument apart from forbidden patterns and unreadable paths. */
        private boolean allowAnyArguments = false;

        CommandPolicy toPolicy() {
            return allowAnyArguments
                    ? new CommandPolicy(allowedArgs, valueFlags, forbiddenPatterns, true)
                    : CommandPolicy.of(allowedArgs, valueFlags, forbiddenPatterns);
        }

        public List<String> getAllowedArgs() {
            return allowedArgs;
        }

        public void setAllowedArgs(List<String> allowedArgs) {
            this.allowedArgs = allowedArgs;
        }

        public List<String> getValueFlags() {
            return valueFlags;
        }

        public void setValueFlags(List<String> valueFlags) {
            this.valueFlags = valueFlags;
        }

        public List<String> getForbiddenPatterns() {
            return forbiddenPatterns;
        }

        public void setForbiddenPatterns(List<String> forbiddenPatterns) {
            this.forbiddenPatterns = forbiddenPatterns;
        }

        public boolean isAllowAnyArguments() {
            return allowAnyArguments;
        }

        public void setAllowAnyArguments(boolean allowAnyArguments) {
            this.allowAnyArguments = allowAnyArguments;
        }
    }
}
