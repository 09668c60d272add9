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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Arguments a granted command accepts.
 *
 * <p>Path arguments (containing {@code /} or ending in a known data or source file
 * suffix) and plain numbers are accepted here and checked for read access by the
 * sandbox. Any other argument must equal an allowed argument or start with one followed
 * by {@code =}, unless it is the value following a value flag such as pytest's
 * {@code -k}. No argument may contain a forbidden pattern.
 *
 * @param allowedArgs       flags and sub-commands the command accepts
 * @param valueFlags        flags whose next argument is passed through unchecked
 * @param forbiddenPatterns substrings no argument may contain
 * @param anyArguments      accept every argument, forbidden patterns and path checks still apply
 */
public record CommandPolicy(List<String> allowedArgs, List<String> valueFlags, List<String> forbiddenPatterns,
                            boolean anyArguments) {

    /** Suffixes that mark an argument without a separator as a file path. */
    public static final List<String> PATH_SUFFIXES = List.of(".py", ".jsonl", ".json", ".txt", ".log");

    public CommandPolicy {
        allowedArgs = copy("allowed argument", allowedArgs);
        valueFlags = copy("value flag", valueFlags);
        forbiddenPatterns = copy("forbidden pattern", forbiddenPatterns);
    }

    /**
     * Policy accepting path and number arguments only.
     *
     * @return the policy
     */
    public static CommandPolicy pathsOnly() {
        return new CommandPolicy(List.of(), List.of(), List.of(), false);
    }

    public static CommandPolicy of(List<String> allowedArgs, List<String> valueFlags, List<String> forbiddenPatterns) {
        return new CommandPolicy(allowedArgs, valueFlags, forbiddenPatterns, false);
    }

    public static CommandPolicy anyArguments(List<String> forbiddenPatterns) {
        return new CommandPolicy(List.of(), List.of(), forbiddenPatterns, true);
    }

    /**
     * Checks arguments against this policy. Path arguments still need a read check.
     *
     * @param args the arguments, none null
     * @return why the arguments are refused, empty if they are accepted
     */
    public Optional<String> violation(List<String> args) {
        for (String arg : args) {
            for (String pattern : forbiddenPatterns) {
                if (arg.contains(pattern)) {
                    return Optional.of("forbidden pattern '" + pattern + "' in argument '" + arg + "'");
                }
            }
        }
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if (anyArguments || isPathArgument(arg) || isNumber(arg)) {
                continue;
            }
            if (i > 0 && valueFlags.contains(args.get(i - 1))) {
                continue;
            }
            if (!isAllowed(arg)) {
                return Optional.of("argument '" + arg + "' not allowed, allowed: " + allowedArgs);
            }
        }
        return Optional.empty();
    }

    private boolean isAllowed(String arg) {
        for (String allowed : allowedArgs) {
            if (arg.equals(allowed) || arg.startsWith(allowed + "=")) {
                return true;
            }
        }
        return valueFlags.contains(arg);
    }

    /**
     * @param arg a command argument
     * @return whether the argument names a file and must be readable
     */
    public static boolean isPathArgument(String arg) {
        if (arg.indexOf('/') >= 0) {
            return true;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        return PATH_SUFFIXES.stream().anyMatch(lower::endsWith);
    }

    private static boolean isNumber(String arg) {
        return !arg.isEmpty() && arg.chars().allMatch(Character::isDigit);
    }

    private static List<String> copy(String kind, List<String> values) {
        List<String> copy = new ArrayList<>();
        if (values != null) {
            for (String value : values) {
                if (value == null || value.isBlank()) {
                    throw new IllegalArgumentException("Blank " + kind + " in command policy");
                }
                copy.add(value.trim());
            }
        }
        return Collections.unmodifiableList(copy);
    }
}
