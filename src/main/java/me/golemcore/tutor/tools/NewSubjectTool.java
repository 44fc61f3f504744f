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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.tutor.domain.component.TutorTool;
import me.golemcore.tutor.domain.model.LearnerLevel;
import me.golemcore.tutor.domain.model.Subject;
import me.golemcore.tutor.domain.model.ToolDefinition;
import me.golemcore.tutor.domain.model.ToolFailureKind;
import me.golemcore.tutor.domain.model.ToolResult;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.domain.model.TutorToolName;
import me.golemcore.tutor.domain.service.SubjectService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Starts a new subject and asks the learner for goals and level.
 */
@Component
@Slf4j
public class NewSubjectTool implements TutorTool {

    private final SubjectService subjectService;

    public NewSubjectTool(SubjectService subjectService) {
        this.subjectService = subjectService;
    }

    @Override
    public TutorToolName getToolName() {
        return TutorToolName.NEW_SUBJECT;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName().getWireName())
                .description("Start learning a new subject. Creates a new learning track with initial assessment.")
                .inputSchema(ToolSchemas.object(List.of("name"), Map.of(
                        "name", ToolSchemas.string(
                                "The name of the subject to learn (e.g., \"Algebra\", \"Biology\", \"Python Programming\")"),
                        "description", ToolSchemas.string(
                                "Brief description of what the student wants to learn in this subject"),
                        "difficulty_level", ToolSchemas.enumeration(
                                "The starting difficulty level based on student background", ToolSchemas.LEVELS))))
                .build();
    }

    @Override
    public ToolResult execute(TutorContext context, Map<String, Object> parameters) {
        String name = ToolArguments.string(parameters, "name");
        if (name == null) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "Subject name is required");
        }
        LearnerLevel level = ToolArguments.level(parameters, "difficulty_level");
        Subject subject = subjectService.startSubject(context, name,
                ToolArguments.string(parameters, "description"), level);
        subjectService.seedGoalsPrompt(context, subject.getName());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", true);
        payload.put("subject", subject);
        payload.put("message", "Started learning " + subject.getName()
                + ". Let's begin by understanding your current level and goals.");
        return ToolResult.success(payload);
    }
}
