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
import me.golemcore.tutor.domain.model.LearnerLevel;
import me.golemcore.tutor.domain.model.LessonPlan;
import me.golemcore.tutor.domain.model.ToolDefinition;
import me.golemcore.tutor.domain.model.ToolFailureKind;
import me.golemcore.tutor.domain.model.ToolResult;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.domain.model.TutorToolName;
import me.golemcore.tutor.domain.service.LessonPlanService;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates a lesson plan with one lesson per learning goal. Goals missing from
 * the call are taken from the context.
 */
@Component
public class NewLessonPlanTool implements TutorTool {

    private final LessonPlanService lessonPlanService;

    public NewLessonPlanTool(LessonPlanService lessonPlanService) {
        this.lessonPlanService = lessonPlanService;
    }

    @Override
    public TutorToolName getToolName() {
        return TutorToolName.NEW_LESSON_PLAN;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName().getWireName())
                .description("Create a structured lesson sequence for the current subject.")
                .inputSchema(ToolSchemas.object(List.of("subject", "difficulty_level", "learning_goals"), Map.of(
                        "subject", ToolSchemas.string("The subject name for which to create the lesson plan"),
                        "difficulty_level", ToolSchemas.enumeration(
                                "Target difficulty level for the lesson plan", ToolSchemas.LEVELS),
                        "learning_goals", ToolSchemas.stringArray(
                                "Specific learning objectives the student wants to achieve"),
                        "estimated_duration", ToolSchemas.string(
                                "How long the student expects to spend on this subject (e.g., \"2 weeks\", \"1 month\")"))))
                .build();
    }

    @Override
    public ToolResult execute(TutorContext context, Map<String, Object> parameters) {
        List<String> goals = ToolArguments.stringList(parameters, "learning_goals");
        if (goals.isEmpty() && context.getUserGoals() != null) {
            goals = context.getUserGoals();
        }
        if (goals.isEmpty()) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "Learning goals are required to create a lesson plan");
        }
        if (context.getUserGoals() == null || context.getUserGoals().isEmpty()) {
            context.setUserGoals(new ArrayList<>(goals));
        }

        String subjectName = ToolArguments.string(parameters, "subject");
        if (subjectName == null) {
            subjectName = context.getSubject() != null ? context.getSubject().getName() : "this subject";
        }
        LearnerLevel difficulty = ToolArguments.level(parameters, "difficulty_level");
        if (difficulty == null) {
            difficulty = context.getUserLevel();
        }

        LessonPlan plan = lessonPlanService.createPlan(context, subjectName, goals, difficulty,
                ToolArguments.string(parameters, "estimated_duration"));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", true);
        payload.put("lessonPlan", plan);
        payload.put("message", "Created a " + plan.getLessons().size() + "-lesson plan for " + subjectName
                + ". Ready to start with the first lesson?");
        return ToolResult.success(payload);
    }
}
