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
import me.golemcore.tutor.domain.model.ToolDefinition;
import me.golemcore.tutor.domain.model.ToolFailureKind;
import me.golemcore.tutor.domain.model.ToolResult;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.domain.model.TutorToolName;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Surfaces a question the learner has to answer before the tutor continues.
 */
@Component
public class ClarifyingQuestionTool implements TutorTool {

    public static final String RESULT_TYPE = "clarifying_question";

    @Override
    public TutorToolName getToolName() {
        return TutorToolName.CLARIFYING_QUESTION;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName().getWireName())
                .description("Ask the student to clarify something unclear about their request or understanding.")
                .inputSchema(ToolSchemas.object(List.of("question", "context"), Map.of(
                        "question", ToolSchemas.string("The clarifying question to ask the student"),
                        "context", ToolSchemas.string("Context explaining why this clarification is needed"),
                        "options", ToolSchemas.stringArray("Optional multiple choice options for the student"))))
                .build();
    }

    @Override
    public ToolResult execute(TutorContext context, Map<String, Object> parameters) {
        String question = ToolArguments.string(parameters, "question");
        if (question == null) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "A question is required");
        }
        return ToolResult.success(question(question, ToolArguments.string(parameters, "context"),
                ToolArguments.stringList(parameters, "options")));
    }

    public static Map<String, Object> question(String question, String reason, List<String> options) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", RESULT_TYPE);
        payload.put("question", question);
        payload.put("context", reason);
        payload.put("options", options != null ? options : List.of());
        payload.put("requiresUserResponse", true);
        return payload;
    }
}
