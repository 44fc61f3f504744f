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
import me.golemcore.tutor.domain.content.ContentNormalizer;
import me.golemcore.tutor.domain.content.ContentOutputs;
import me.golemcore.tutor.domain.content.DiversitySelector;
import me.golemcore.tutor.domain.model.AdvanceOutcome;
import me.golemcore.tutor.domain.model.ContentCategory;
import me.golemcore.tutor.domain.model.ContentType;
import me.golemcore.tutor.domain.model.InteractiveContent;
import me.golemcore.tutor.domain.model.LearnerLevel;
import me.golemcore.tutor.domain.model.Lesson;
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

/**
 * Advances to the next lesson once the current one is completed, and opens
 * it with an explainer followed by a practice item.
 */
@Component
public class NextLessonTool implements TutorTool {

    private final LessonPlanService lessonPlanService;
    private final ContentNormalizer contentNormalizer;
    private final DiversitySelector diversitySelector;

    public NextLessonTool(LessonPlanService lessonPlanService, ContentNormalizer contentNormalizer,
            DiversitySelector diversitySelector) {
        this.lessonPlanService = lessonPlanService;
        this.contentNormalizer = contentNormalizer;
        this.diversitySelector = diversitySelector;
    }

    @Override
    public TutorToolName getToolName() {
        return TutorToolName.NEXT_LESSON;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName().getWireName())
                .description("Move to the next lesson in the current lesson plan.")
                .inputSchema(ToolSchemas.object(List.of("current_lesson_id"), Map.of(
                        "current_lesson_id", ToolSchemas.string("ID of the current lesson"),
                        "readiness_check", ToolSchemas.bool(
                                "Whether to perform a readiness assessment before advancing"))))
                .build();
    }

    @Override
    public ToolResult execute(TutorContext context, Map<String, Object> parameters) {
        AdvanceOutcome outcome = lessonPlanService.advance(context);
        switch (outcome.status()) {
        case NO_PLAN:
            return ToolResult.failure(ToolFailureKind.PRECONDITION_FAILED, outcome.message());
        case NOT_COMPLETED:
            return ToolResult.failure(ToolFailureKind.PRECONDITION_FAILED, outcome.message());
        case SUBJECT_COMPLETE:
            Map<String, Object> done = new LinkedHashMap<>();
            done.put("success", true);
            done.put("completed", true);
            done.put("message", outcome.message());
            return ToolResult.success(done);
        default:
            break;
        }

        Lesson next = outcome.lesson();
        LearnerLevel level = LearnerLevel.orDefault(context.getUserLevel());
        String subjectId = context.getSubjectId();

        InteractiveContent explainer = contentNormalizer.lessonExplainer(next.getTitle(), next.getDescription(),
                level, subjectId);
        next.recordContentType(ContentType.EXPLAINER);

        ContentType practiceType = diversitySelector.selectType(ContentCategory.PRACTICE,
                next.getRecentContentTypes());
        Map<String, Object> practiceSeed = new LinkedHashMap<>();
        practiceSeed.put("title", "Practice: " + next.getTitle());
        practiceSeed.put("question", "Test your understanding of " + next.getTitle());
        InteractiveContent practice = contentNormalizer.create(practiceType, practiceSeed, next.getTitle(), level,
                subjectId);
        next.recordContentType(practiceType);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", true);
        payload.put("nextLesson", next);
        payload.put("lessonNumber", context.getLessonPlan().getCurrentLessonIndex() + 1);
        payload.put("totalLessons", context.getLessonPlan().getLessons().size());
        payload.put("explainerComponent", ContentOutputs.describe(explainer));
        payload.put("practiceComponent", ContentOutputs.describe(practice));
        return ToolResult.success(payload, List.of(explainer, practice));
    }
}
