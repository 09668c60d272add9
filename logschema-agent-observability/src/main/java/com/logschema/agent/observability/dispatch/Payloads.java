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
package com.logschema.agent.observability.dispatch;

import com.logschema.agent.observability.event.ActionKind;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds notification payloads for producers, and reads them back for the dispatcher.
 */
public final class Payloads {

    private Payloads() {}

    // Builders

    public static Map<String, Object> llmStart(String model, String modelVersion, long promptSizeBytes) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.MODEL, model);
        payload.put(PayloadKeys.MODEL_VERSION, modelVersion);
        payload.put(PayloadKeys.PROMPT_SIZE_BYTES, promptSizeBytes);
        return payload;
    }

    public static Map<String, Object> llmUsage(long tokensPrompt, long tokensCompletion, long tokensTotal,
                                               boolean succeeded) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.TOKENS_PROMPT, tokensPrompt);
        payload.put(PayloadKeys.TOKENS_COMPLETION, tokensCompletion);
        payload.put(PayloadKeys.TOKENS_TOTAL, tokensTotal);
        payload.put(PayloadKeys.SUCCEEDED, succeeded);
        return payload;
    }

    public static Map<String, Object> error(Throwable error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.ERROR_KIND, error.getClass().getSimpleName());
        payload.put(PayloadKeys.MESSAGE, error.getMessage());
        return payload;
    }

    public static Map<String, Object> toolStart(String toolName, Map<String, ?> arguments) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.TOOL_NAME, toolName);
        payload.put(PayloadKeys.ARGUMENTS, arguments);
        return payload;
    }

    public static Map<String, Object> toolEnd(String toolName, Object result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.TOOL_NAME, toolName);
        payload.put(PayloadKeys.RESULT, result);
        return payload;
    }

    public static Map<String, Object> toolError(String toolName, Throwable error) {
        Map<String, Object> payload = error(error);
        payload.put(PayloadKeys.TOOL_NAME, toolName);
        return payload;
    }

    public static Map<String, Object> toolCancel(String toolName) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.TOOL_NAME, toolName);
        return payload;
    }

    public static Map<String, Object> agentStart(Map<String, ?> inputs) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.INPUTS, inputs);
        return payload;
    }

    public static Map<String, Object> agentEnd(Map<String, ?> outputs) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.OUTPUTS, outputs);
        return payload;
    }

    public static Map<String, Object> agentStep(ActionKind actionKind, String actionSummary,
                                                String observationSummary) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.ACTION_KIND, actionKind);
        payload.put(PayloadKeys.ACTION_SUMMARY, actionSummary);
        payload.put(PayloadKeys.OBSERVATION_SUMMARY, observationSummary);
        return payload;
    }

    public static Map<String, Object> batchStart(int batchNumber, long plannedLines) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.BATCH_NUMBER, batchNumber);
        payload.put(PayloadKeys.PLANNED_LINES, plannedLines);
        return payload;
    }

    public static Map<String, Object> batchEnd(int batchNumber, long linesRead, long cumulativeLines) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.BATCH_NUMBER, batchNumber);
        payload.put(PayloadKeys.LINES_READ, linesRead);
        payload.put(PayloadKeys.CUMULATIVE_LINES, cumulativeLines);
        return payload;
    }

    public static Map<String, Object> batchDiscovery(int batchNumber, List<String> newLogTypes,
                                                     List<String> newFields) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.BATCH_NUMBER, batchNumber);
        payload.put(PayloadKeys.NEW_LOG_TYPES, newLogTypes);
        payload.put(PayloadKeys.NEW_FIELDS, newFields);
        return payload;
    }

    public static Map<String, Object> handleOpen(String path, Long totalLines) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.PATH, path);
        payload.put(PayloadKeys.TOTAL_LINES, totalLines);
        return payload;
    }

    public static Map<String, Object> handleClose(long linesRead) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(PayloadKeys.LINES_READ, linesRead);
        return payload;
    }

    // Readers

    static String text(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        return value == null ? null : value.toString();
    }

    static String requireText(Map<String, Object> payload, String key) {
        String value = text(payload, key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Payload is missing '" + key + "'");
        }
        return value;
    }

    static boolean has(Map<String, Object> payload, String key) {
        return payload.get(key) != null;
    }

    static long number(Map<String, Object> payload, String key, long defaultValue) {
        Long value = optionalNumber(payload, key);
        return value == null ? defaultValue : value;
    }

    static Long optionalNumber(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Payload '" + key + "' is not a number: " + value, e);
        }
    }

    static boolean flag(Map<String, Object> payload, String key, boolean defaultValue) {
        Object value = payload.get(key);
        if (value == null) {
            return defaultValue;
        }
        return value instanceof Boolean bool ? bool : Boolean.parseBoolean(value.toString());
    }

    static List<String> strings(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        List<String> values = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            collection.forEach(element -> values.add(String.valueOf(element)));
        } else if (value != null) {
            values.add(value.toString());
        }
        return values;
    }

    static Map<String, Object> map(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> raw)) {
            throw new IllegalArgumentException("Payload '" + key + "' is not a map: " + value.getClass().getName());
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        raw.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return copy;
    }

    /**
     * Size of a value as rendered text, in UTF-8 bytes.
     */
    static long sizeOf(Object value) {
        return value == null ? 0 : String.valueOf(value).getBytes(StandardCharsets.UTF_8).length;
    }

    static Map<String, Long> sizesOf(Map<String, Object> values) {
        Map<String, Long> sizes = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((key, value) -> sizes.put(key, sizeOf(value)));
        }
        return sizes;
    }
}
