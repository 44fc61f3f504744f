package me.golemcore.tutor.tools;

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

import me.golemcore.tutor.domain.component.TutorTool;
import me.golemcore.tutor.domain.model.ConversationTurn;
import me.golemcore.tutor.domain.model.ToolCallRecord;
import me.golemcore.tutor.domain.model.ToolDefinition;
import me.golemcore.tutor.domain.model.ToolFailureKind;
import me.golemcore.tutor.domain.model.ToolResult;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.domain.model.TutorToolName;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records interaction feedback in the conversation history, where later
 * turns can see it.
 */
@Component
public class FeedbackLogTool implements TutorTool {

    private final Clock clock;

    public FeedbackLogTool(Clock clock) {
        this.clock = clock;
    }

    @Override
    public TutorToolName getToolName() {
        return TutorToolName.FEEDBACK_LOG;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName().getWireName())
                .description("Log student interaction feedback for adaptive learning.")
                .inputSchema(ToolSchemas.object(List.of("interaction_type", "user_response"), Map.of(
                        "interaction_type", ToolSchemas.string("Type of interaction being logged"),
                        "user_response", ToolSchemas.string("How the student responded to the interaction"),
                        "success_rate", ToolSchemas.score("Success rate percentage (0-100)"),
                        "engagement_level", ToolSchemas.enumeration(
                                "Student engagement level during interaction", "low", "medium", "high"),
                        "notes", ToolSchemas.string("Additional notes about the interaction"))))
                .build();
    }

    @Override
    public ToolResult execute(TutorContext context, Map<String, Object> parameters) {
        String interactionType = ToolArguments.string(parameters, "interaction_type");
        if (interactionType == null) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "interaction_type is required");
        }

        ToolCallRecord record = ToolCallRecord.builder()
                .name(TutorToolName.FEEDBACK_LOG)
                .parameters(new LinkedHashMap<>(parameters))
                .result(new LinkedHashMap<>(Map.of("logged", true)))
                .build();
        context.appendTurn(ConversationTurn.assistant("Logged feedback: " + interactionType, List.of(record),
                Instant.now(clock)));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", true);
        payload.put("logged", true);
        payload.put("interactionType", interactionType);
        payload.put("engagementLevel", ToolArguments.string(parameters, "engagement_level"));
        payload.put("successRate", ToolArguments.number(parameters, "success_rate"));
        return ToolResult.success(payload);
    }
}
