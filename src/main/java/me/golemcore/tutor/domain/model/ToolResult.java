package me.golemcore.tutor.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of executing a tutor tool. Failures are values, never exceptions, so
 * the assistant can read them back as tool output.
 */
@Data
@Builder
public class ToolResult {

    private boolean success;

    @Builder.Default
    private Map<String, Object> payload = new LinkedHashMap<>();

    private String error;
    private ToolFailureKind failureKind;

    @Builder.Default
    private List<InteractiveContent> contents = List.of();

    public static ToolResult success(Map<String, Object> payload) {
        return ToolResult.builder()
                .success(true)
                .payload(payload)
                .build();
    }

    public static ToolResult success(Map<String, Object> payload, List<InteractiveContent> contents) {
        return ToolResult.builder()
                .success(true)
                .payload(payload)
                .contents(contents)
                .build();
    }

    public static ToolResult failure(ToolFailureKind kind, String error) {
        return ToolResult.builder()
                .success(false)
                .error(error)
                .failureKind(kind)
                .build();
    }

    /**
     * Shape handed back to the assistant and stored in the conversation
     * history.
     */
    public Map<String, Object> toOutputMap() {
        if (!success) {
            Map<String, Object> output = new LinkedHashMap<>();
            output.put("success", false);
            output.put("error", error);
            return output;
        }
        return payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
    }
}
