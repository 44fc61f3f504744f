package me.golemcore.tutor.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tutor.domain.component.TutorTool;
import me.golemcore.tutor.domain.model.PendingToolCall;
import me.golemcore.tutor.domain.model.ToolCallRecord;
import me.golemcore.tutor.domain.model.ToolDefinition;
import me.golemcore.tutor.domain.model.ToolDispatchResult;
import me.golemcore.tutor.domain.model.ToolFailureKind;
import me.golemcore.tutor.domain.model.ToolResult;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.domain.model.TutorToolName;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routes assistant function calls to tutor tools.
 *
 * <p>
 * Never throws for a bad call: unknown names, unparsable arguments and tool
 * exceptions all become failure results that the assistant can read back.
 */
@Component
@Slf4j
public class ToolDispatcher {

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final Map<TutorToolName, TutorTool> toolRegistry = new EnumMap<>(TutorToolName.class);
    private final ObjectMapper objectMapper;

    public ToolDispatcher(List<TutorTool> tools, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        for (TutorTool tool : tools) {
            TutorTool previous = toolRegistry.put(tool.getToolName(), tool);
            if (previous != null) {
                log.warn("[Tools] {} registered twice, keeping {}", tool.getToolName(),
                        tool.getClass().getSimpleName());
            }
        }
        log.info("[Tools] Registered {} tools: {}", toolRegistry.size(), toolRegistry.keySet());
    }

    /**
     * Function definitions in tool-name order, for assistant creation.
     */
    public List<ToolDefinition> definitions() {
        return toolRegistry.values().stream()
                .map(TutorTool::getDefinition)
                .toList();
    }

    /**
     * Execute every call of a run in order against the same context. Later
     * calls see the effects of earlier ones.
     */
    public List<ToolDispatchResult> dispatchAll(List<PendingToolCall> calls, TutorContext context) {
        List<ToolDispatchResult> results = new ArrayList<>();
        if (calls == null) {
            return results;
        }
        for (PendingToolCall call : calls) {
            results.add(dispatch(call, context));
        }
        return results;
    }

    public ToolDispatchResult dispatch(PendingToolCall call, TutorContext context) {
        String name = sanitizeToolName(call.getName());
        Map<String, Object> parameters;
        try {
            parameters = parseArguments(call.getArguments());
        } catch (JsonProcessingException e) {
            log.warn("[Tools] Unparsable arguments for {}: {}", name, e.getOriginalMessage());
            return toDispatchResult(call.getId(), TutorToolName.fromWireName(name).orElse(null), Map.of(),
                    ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                            "Invalid JSON arguments: " + e.getOriginalMessage()));
        }
        Optional<TutorToolName> toolName = TutorToolName.fromWireName(name);
        ToolResult result = dispatch(toolName.orElse(null), name, parameters, context);
        return toDispatchResult(call.getId(), toolName.orElse(null), parameters, result);
    }

    /**
     * Execute a single tool by wire name with already decoded parameters.
     */
    public ToolResult dispatch(String toolName, Map<String, Object> parameters, TutorContext context) {
        String name = sanitizeToolName(toolName);
        return dispatch(TutorToolName.fromWireName(name).orElse(null), name, parameters, context);
    }

    private ToolResult dispatch(TutorToolName toolName, String rawName, Map<String, Object> parameters,
            TutorContext context) {
        TutorTool tool = toolName != null ? toolRegistry.get(toolName) : null;
        if (tool == null) {
            log.warn("[Tools] Unknown tool requested: {}", rawName);
            return ToolResult.failure(ToolFailureKind.UNKNOWN_TOOL, "Unknown tool: " + rawName);
        }
        Map<String, Object> args = parameters != null ? parameters : Map.of();
        try {
            ToolResult result = tool.execute(context, args);
            if (result == null) {
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED, "Tool returned no result");
            }
            log.debug("[Tools] {} -> {}", toolName.getWireName(), result.isSuccess() ? "ok" : result.getError());
            return result;
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, safeCauseMessage(e));
        } catch (IllegalStateException e) {
            return ToolResult.failure(ToolFailureKind.PRECONDITION_FAILED, safeCauseMessage(e));
        } catch (RuntimeException e) { // NOSONAR - a failing tool must not abort the run
            log.error("[Tools] Tool execution failed: {}", toolName.getWireName(), e);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Tool execution failed: " + safeCauseMessage(e));
        }
    }

    private Map<String, Object> parseArguments(String arguments) throws JsonProcessingException {
        if (arguments == null || arguments.isBlank()) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> parsed = objectMapper.readValue(arguments, ARGUMENTS_TYPE);
        return parsed != null ? parsed : new LinkedHashMap<>();
    }

    private ToolDispatchResult toDispatchResult(String callId, TutorToolName toolName,
            Map<String, Object> parameters, ToolResult result) {
        Map<String, Object> output = result.toOutputMap();
        ToolCallRecord record = ToolCallRecord.builder()
                .id(callId)
                .name(toolName)
                .parameters(new LinkedHashMap<>(parameters))
                .result(output)
                .build();
        return new ToolDispatchResult(callId, record, result, serialize(output));
    }

    private String serialize(Map<String, Object> output) {
        try {
            return objectMapper.writeValueAsString(output);
        } catch (JsonProcessingException e) {
            log.warn("[Tools] Failed to serialize tool output: {}", e.getOriginalMessage());
            return "{\"success\":false,\"error\":\"Tool output could not be serialized\"}";
        }
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && cause != cursor) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Strip special tokens some models leak into function names, e.g.
     * {@code lesson_complete<|channel|>commentary}.
     */
    private static String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }
}
