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
public class UpdateLessonPlanTool implements TutorTool {

    private final LessonPlanService lessonPlanService;

    public UpdateLessonPlanTool(LessonPlanService lessonPlanService) {
        this.lessonPlanService = lessonPlanService;
    }

    @Override
    public TutorToolName getToolName() {
        return TutorToolName.UPDATE_LESSON_PLAN;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName().getWireName())
                .description("Modify the current lesson plan based on student progress or feedback.")
                .inputSchema(ToolSchemas.object(List.of("reason", "adjustments"), Map.of(
                        "reason", ToolSchemas.string("Why the lesson plan needs to be updated"),
                        "adjustments", ToolSchemas.stringArray("Specific changes to make to the lesson plan"),
                        "new_lessons", ToolSchemas.stringArray("New lessons to add to the plan"),
                        "remove_lessons", ToolSchemas.stringArray("Lessons to remove from the plan"))))
                .build();
    }

    @Override
    public ToolResult execute(TutorContext context, Map<String, Object> parameters) {
        if (context.getLessonPlan() == null) {
            return ToolResult.failure(ToolFailureKind.PRECONDITION_FAILED, "No lesson plan to update");
        }
        String reason = ToolArguments.string(parameters, "reason", "adjusted to learner progress");
        int lessonCount = lessonPlanService.updatePlan(context,
                ToolArguments.stringList(parameters, "new_lessons"),
                ToolArguments.stringList(parameters, "remove_lessons"));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", true);
        payload.put("reason", reason);
        payload.put("adjustments", ToolArguments.stringList(parameters, "adjustments"));
        payload.put("updatedLessons", lessonCount);
        payload.put("currentLessonIndex", context.getLessonPlan().getCurrentLessonIndex());
        payload.put("message", "Updated lesson plan: " + reason);
        return ToolResult.success(payload);
    }
}
