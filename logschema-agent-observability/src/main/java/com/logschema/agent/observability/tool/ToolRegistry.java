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
package com.logschema.agent.observability.tool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static set of tools known to the agent, built once at startup.
 */
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, ToolDescriptor> tools;

    /**
     * @param descriptors the tools
     * @throws IllegalStateException if two descriptors share a name
     */
    public ToolRegistry(Collection<ToolDescriptor> descriptors) {
        Map<String, ToolDescriptor> byName = new LinkedHashMap<>();
        for (ToolDescriptor descriptor : descriptors) {
            ToolDescriptor existing = byName.putIfAbsent(descriptor.name(), descriptor);
            if (existing != null) {
                throw new IllegalStateException("Duplicate tool registration: " + descriptor.name());
            }
        }
        this.tools = Collections.unmodifiableMap(byName);
        log.debug("Registered {} tools: {}", tools.size(), tools.keySet());
    }

    /**
     * Builds a registry from every tool of every catalog.
     *
     * @param catalogs the catalogs
     * @return the registry
     */
    public static ToolRegistry fromCatalogs(Collection<? extends ToolCatalog> catalogs) {
        List<ToolDescriptor> descriptors = new ArrayList<>();
        catalogs.forEach(catalog -> descriptors.addAll(catalog.tools()));
        return new ToolRegistry(descriptors);
    }

    public static ToolRegistry empty() {
        return new ToolRegistry(List.of());
    }

    public Optional<ToolDescriptor> find(String name) {
        return Optional.ofNullable(name == null ? null : tools.get(name));
    }

    /**
     * @param name tool name
     * @return the descriptor
     * @throws UnknownToolException if no tool has that name
     */
    public ToolDescriptor require(String name) {
        return find(name).orElseThrow(() ->
                new UnknownToolException(name, "Unknown tool '" + name + "'. Registered tools: " + tools.keySet()));
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    public Set<String> names() {
        return tools.keySet();
    }

    public Collection<ToolDescriptor> descriptors() {
        return tools.values();
    }
}
