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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * What agent-generated code may touch: directories it may read, directories it may
 * write, directories it may search and the commands it may run with their arguments.
 * Built once at startup and never modified.
 *
 * @param readableRoots  directories whose contents may be read
 * @param writableRoots  directories whose contents may be created or replaced
 * @param searchRoots    directories file searches may walk, the readable roots when empty
 * @param commands       bare command names that may be run, with the arguments each accepts
 */
public record CapabilityGrant(List<Path> readableRoots, List<Path> writableRoots, List<Path> searchRoots,
                              Map<String, CommandPolicy> commands) {

    public CapabilityGrant {
        readableRoots = absoluteRoots("readable", readableRoots);
        writableRoots = absoluteRoots("writable", writableRoots);
        searchRoots = absoluteRoots("search", searchRoots);
        Map<String, CommandPolicy> granted = new LinkedHashMap<>();
        if (commands != null) {
            for (Map.Entry<String, CommandPolicy> command : commands.entrySet()) {
                if (command.getKey() == null || command.getKey().isBlank()) {
                    throw new IllegalArgumentException("Executable command must not be blank");
                }
                granted.put(command.getKey().trim(),
                        command.getValue() == null ? CommandPolicy.pathsOnly() : command.getValue());
            }
        }
        commands = Collections.unmodifiableMap(granted);
    }

    /**
     * Grant of commands by name only, each accepting path and number arguments.
     */
    public CapabilityGrant(List<Path> readableRoots, List<Path> writableRoots, Set<String> executableCommands) {
        this(readableRoots, writableRoots, List.of(), pathsOnly(executableCommands));
    }

    /**
     * Grant that allows nothing.
     * @return an empty grant
     */
    public static CapabilityGrant none() {
        return new CapabilityGrant(List.of(), List.of(), List.of(), Map.of());
    }

    public Set<String> executableCommands() {
        return commands.keySet();
    }

    public Optional<CommandPolicy> policyFor(String command) {
        return Optional.ofNullable(commands.get(command));
    }

    /**
     * @return the directories searches may walk
     */
    public List<Path> effectiveSearchRoots() {
        return searchRoots.isEmpty() ? readableRoots : searchRoots;
    }

    private static Map<String, CommandPolicy> pathsOnly(Set<String> names) {
        Map<String, CommandPolicy> policies = new LinkedHashMap<>();
        if (names != null) {
            for (String name : names) {
                if (name == null || name.isBlank()) {
                    throw new IllegalArgumentException("Executable command must not be blank");
                }
                policies.put(name, CommandPolicy.pathsOnly());
            }
        }
        return policies;
    }

    private static List<Path> absoluteRoots(String kind, List<Path> roots) {
        List<Path> absolute = new ArrayList<>();
        if (roots != null) {
            for (Path root : roots) {
                if (root == null || root.toString().isBlank()) {
                    throw new IllegalArgumentException("Blank " + kind + " root");
                }
                absolute.add(root.toAbsolutePath().normalize());
            }
        }
        return Collections.unmodifiableList(absolute);
    }
}
