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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.logschema.agent.observability.event.MetricEvent;
import com.logschema.agent.observability.policy.Disclosure;
import com.logschema.agent.observability.policy.Truncation;

import java.util.Iterator;
import java.util.Map;

/**
 * Renders a {@link MetricEvent} as a single-line JSON object.
 *
 * <p>The line starts with the {@code event} wire name, followed by the event's fields in
 * snake_case. Null fields are omitted. Tool arguments and result summaries are reduced
 * according to the {@link Disclosure} of the destination.
 */
public class EventRenderer {

    static final String EVENT_FIELD = "event";
    static final String ARGUMENTS_FIELD = "arguments";
    static final String RESULT_SUMMARY_FIELD = "result_summary";
    static final String REDACTED = "[redacted]";

    private final ObjectMapper objectMapper;
    private final int maxFieldLength;

    public EventRenderer(int maxFieldLength) {
        this(defaultObjectMapper(), maxFieldLength);
    }

    public EventRenderer(ObjectMapper objectMapper, int maxFieldLength) {
        if (maxFieldLength < 1) {
            throw new IllegalArgumentException("maxFieldLength must be >= 1 but was " + maxFieldLength);
        }
        this.objectMapper = objectMapper;
        this.maxFieldLength = maxFieldLength;
    }

    /**
     * Mapper used for event lines: snake_case names, ISO-8601 instants, nulls omitted.
     * @return a new mapper
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Renders the event.
     *
     * @param event      the event
     * @param disclosure how much tool detail to keep
     * @return the JSON line
     */
    public String render(MetricEvent event, Disclosure disclosure) {
        ObjectNode line = objectMapper.createObjectNode();
        line.put(EVENT_FIELD, event.kind().wireName());
        line.setAll((ObjectNode) objectMapper.valueToTree(event));
        if (event instanceof MetricEvent.ToolStart || event instanceof MetricEvent.ToolEnd) {
            applyDisclosure(line, disclosure);
        }
        try {
            return objectMapper.writeValueAsString(line);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render " + event.kind().wireName() + " event", e);
        }
    }

    private void applyDisclosure(ObjectNode line, Disclosure disclosure) {
        switch (disclosure) {
            case NONE -> {
                line.remove(ARGUMENTS_FIELD);
                line.remove(RESULT_SUMMARY_FIELD);
            }
            case METADATA -> {
                JsonNode arguments = line.get(ARGUMENTS_FIELD);
                if (arguments instanceof ObjectNode) {
                    Iterator<Map.Entry<String, JsonNode>> fields = arguments.fields();
                    while (fields.hasNext()) {
                        fields.next().setValue(TextNode.valueOf(REDACTED));
                    }
                }
                line.remove(RESULT_SUMMARY_FIELD);
            }
            case TRUNCATED -> {
                truncateStrings(line.get(ARGUMENTS_FIELD));
                JsonNode summary = line.get(RESULT_SUMMARY_FIELD);
                if (summary != null && summary.isTextual()) {
                    line.put(RESULT_SUMMARY_FIELD, Truncation.truncate(summary.asText(), maxFieldLength));
                }
            }
            case FULL -> {
            }
        }
    }

    private void truncateStrings(JsonNode node) {
        if (node instanceof ObjectNode) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isTextual()) {
                    field.setValue(TextNode.valueOf(Truncation.truncate(field.getValue().asText(), maxFieldLength)));
                } else {
                    truncateStrings(field.getValue());
                }
            }
        } else if (node instanceof ArrayNode array) {
            for (int i = 0; i < array.size(); i++) {
                JsonNode element = array.get(i);
                if (element.isTextual()) {
                    array.set(i, TextNode.valueOf(Truncation.truncate(element.asText(), maxFieldLength)));
                } else {
                    truncateStrings(element);
                }
            }
        }
    }
}
