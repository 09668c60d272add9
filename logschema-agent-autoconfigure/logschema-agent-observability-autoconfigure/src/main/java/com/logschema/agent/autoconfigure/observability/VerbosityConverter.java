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
package com.logschema.agent.autoconfigure.observability;

import com.logschema.agent.observability.policy.Verbosity;
import org.springframework.core.convert.converter.Converter;

/**
 * Binds verbosity properties through {@link Verbosity#fromString(String)}, so
 * {@code debug} works as well as {@code mid}.
 */
public class VerbosityConverter implements Converter<String, Verbosity> {

    @Override
    public Verbosity convert(String source) {
        return Verbosity.fromString(source);
    }
}
