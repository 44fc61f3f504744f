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
import me.golemcore.tutor.domain.service.LessonPlanService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class SubjectCompleteTool implements TutorTool {

    private final LessonPlanService lessonPlanService;

    public SubjectCompleteTool(LessonPlanService lessonPlanService) {
        this.lessonPlanService = lessonPlanService;
    }

    @Override
    public TutorToolName getToolName() {
        return TutorToolName.SUBJECT_COMPLETE;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName().getWireName())
                .description("Mark the entire subject as complete and suggest next steps.")
                .inputSchema(ToolSchemas.object(List.of("subject_id"), Map.of(
                        "subject_id", ToolSchemas.string("ID of the completed subject"),
                        "final_score", ToolSchemas.score("Final assessment score (0-100)"),
                        "next_level", ToolSchemas.string("Recommended next subject or advanced level"))))
                .build();
    }

    @Override
    public ToolResult execute(TutorContext context, Map<String, Object> parameters) {
        if (!context.hasSubject()) {
            return ToolResult.failure(ToolFailureKind.PRECONDITION_FAILED, "No active subject");
        }
        lessonPlanService.completeSubject(context);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", true);
        payload.put("subjectCompleted", true);
        payload.put("finalScore", ToolArguments.number(parameters, "final_score"));
        payload.put("nextLevel", ToolArguments.string(parameters, "next_level"));
        payload.put("message", "Congratulations on completing this subject!");
        return ToolResult.success(payload);
    }
}
