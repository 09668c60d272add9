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

/**
 * Outcome of a sandbox check.
 *
 * @param allowed      whether the access is permitted
 * @param boundary     the kind of access checked
 * @param subject      the path or command line that was checked, as requested
 * @param reason       why access was denied, or a short confirmation when allowed
 * @param resolvedPath the real path the access was judged on, null for commands and unresolvable paths
 */
public record SandboxDecision(boolean allowed, Boundary boundary, String subject, String reason, Path resolvedPath) {

    public static SandboxDecision allow(Boundary boundary, String subject, Path resolvedPath) {
        return new SandboxDecision(true, boundary, subject, "allowed", resolvedPath);
    }

    public static SandboxDecision allow(Boundary boundary, String subject) {
        return new SandboxDecision(true, boundary, subject, "allowed", null);
    }

    public static SandboxDecision deny(Boundary boundary, String subject, String reason) {
        return new SandboxDecision(false, boundary, subject, reason, null);
    }
}
