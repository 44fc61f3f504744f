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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the conversation history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationTurn {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    private String role;
    private String content;
    private Instant timestamp;

    @Builder.Default
    private List<ToolCallRecord> toolCalls = new ArrayList<>();

    @JsonIgnore
    public boolean isUser() {
        return ROLE_USER.equals(role);
    }

    public static ConversationTurn user(String content, Instant timestamp) {
        return ConversationTurn.builder()
                .role(ROLE_USER)
                .content(content)
                .timestamp(timestamp)
                .build();
    }

    public static ConversationTurn assistant(String content, List<ToolCallRecord> toolCalls, Instant timestamp) {
        return ConversationTurn.builder()
                .role(ROLE_ASSISTANT)
                .content(content)
                .timestamp(timestamp)
                .toolCalls(toolCalls != null ? new ArrayList<>(toolCalls) : new ArrayList<>())
                .build();
    }
}
