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
import me.golemcore.tutor.domain.model.Lesson;
import me.golemcore.tutor.domain.model.LessonCompletion;
import me.golemcore.tutor.domain.model.MasteryDecision;
import me.golemcore.tutor.domain.model.ToolDefinition;
import me.golemcore.tutor.domain.model.ToolFailureKind;
import me.golemcore.tutor.domain.model.ToolResult;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.domain.model.TutorToolName;
import me.golemcore.tutor.domain.service.LessonPlanService;
import me.golemcore.tutor.domain.service.SummaryComposer;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records the outcome of a lesson. When a performance score is supplied the
 * mastery threshold decides completion instead of the assistant's flag.
 */
@Component
@Slf4j
public class LessonCompleteTool implements TutorTool {

    private static final int SCORE_SCALE = 100;

    private final LessonPlanService lessonPlanService;
    private final SummaryComposer summaryComposer;

    public LessonCompleteTool(LessonPlanService lessonPlanService, SummaryComposer summaryComposer) {
        this.lessonPlanService = lessonPlanService;
        this.summaryComposer = summaryComposer;
    }

    @Override
    public TutorToolName getToolName() {
        return TutorToolName.LESSON_COMPLETE;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(getToolName().getWireName())
                .description("Mark a lesson as complete or incomplete based on student performance.")
                .inputSchema(ToolSchemas.object(List.of("lesson_id", "completed"), Map.of(
                        "lesson_id", ToolSchemas.string("ID of the lesson being evaluated"),
                        "completed", ToolSchemas.bool("Whether the lesson is successfully completed"),
                        "performance_score", ToolSchemas.score("Student performance score (0-100)"),
                        "feedback", ToolSchemas.string(
                                "Feedback on student performance and areas for improvement"))))
                .build();
    }

    @Override
    public ToolResult execute(TutorContext context, Map<String, Object> parameters) {
        String lessonId = ToolArguments.string(parameters, "lesson_id");
        if (lessonId == null && context.getCurrentLesson() != null) {
            lessonId = context.getCurrentLesson().getId();
        }
        Boolean completedFlag = ToolArguments.bool(parameters, "completed");
        Double score = ToolArguments.number(parameters, "performance_score");

        MasteryDecision mastery = null;
        boolean completed = Boolean.TRUE.equals(completedFlag);
        if (score != null) {
            int bounded = (int) Math.round(Math.max(0, Math.min(SCORE_SCALE, score)));
            mastery = lessonPlanService.evaluateMastery(context, bounded, SCORE_SCALE, null);
            completed = mastery.passed();
        }

        LessonCompletion completion = lessonPlanService.recordCompletion(context, lessonId, completed);
        if (completion.status() == LessonCompletion.Status.NO_PLAN) {
            return ToolResult.failure(ToolFailureKind.PRECONDITION_FAILED, "No active lesson plan");
        }
        if (completion.status() == LessonCompletion.Status.LESSON_NOT_FOUND) {
            return ToolResult.failure(ToolFailureKind.NOT_FOUND, "Lesson not found: " + lessonId);
        }

        Lesson lesson = completion.lesson();
        String feedback = ToolArguments.string(parameters, "feedback");
        if (completed && feedback != null) {
            lesson.setAchievement(feedback);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", true);
        payload.put("lessonId", lesson.getId());
        payload.put("lessonCompleted", completed);
        payload.put("performanceScore", score);
        payload.put("feedback", feedback);
        payload.put("overallProgress", completion.subjectProgress());
        if (mastery != null) {
            payload.put("masteryThreshold", mastery.thresholdPercent());
            payload.put("masteryPassed", mastery.passed());
        }
        if (completed) {
            payload.put("lessonSummary", summaryComposer.lessonSummary(lesson));
        }
        if (completion.allLessonsCompleted()) {
            payload.put("subjectSummary", summaryComposer.subjectSummary(context));
        }
        log.debug("[Tools] lesson_complete {} -> {}", lesson.getId(), completed);
        return ToolResult.success(payload);
    }
}
