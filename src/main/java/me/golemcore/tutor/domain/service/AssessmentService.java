package me.golemcore.tutor.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tutor.domain.model.AssessmentRequest;
import me.golemcore.tutor.domain.model.AssessmentResult;
import me.golemcore.tutor.domain.model.LearnerLevel;
import me.golemcore.tutor.domain.model.LessonCompletion;
import me.golemcore.tutor.domain.model.MasteryDecision;
import me.golemcore.tutor.domain.model.TutorContext;
import org.springframework.stereotype.Service;

/**
 * Applies a graded assessment to a lesson outside of the conversation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssessmentService {

    static final String MASTERED_MESSAGE = "Lesson mastered! You can advance to the next lesson.";
    static final String LESSON_NOT_FOUND_ERROR = "Lesson not found";
    static final String NO_PLAN_ERROR = "No active lesson plan";

    private final TutorContextService contextService;
    private final LessonPlanService lessonPlanService;
    private final SummaryComposer summaryComposer;

    public AssessmentResult processAssessment(String userId, String subjectId, AssessmentRequest request) {
        if (request == null || request.lessonId() == null || request.lessonId().isBlank()
                || request.score() == null || request.total() == null) {
            throw new IllegalArgumentException("Missing or invalid parameters");
        }

        return contextService.withContext(userId, subjectId, context -> {
            AssessmentResult result = evaluate(context, request);
            contextService.saveAsync(context);
            return result;
        });
    }

    private AssessmentResult evaluate(TutorContext context, AssessmentRequest request) {
        LearnerLevel difficulty = request.difficulty() != null ? LearnerLevel.fromValue(request.difficulty()) : null;
        MasteryDecision decision = lessonPlanService.evaluateMastery(context, request.score(), request.total(),
                difficulty);

        LessonCompletion completion = lessonPlanService.recordAssessment(context, request.lessonId(),
                request.score(), request.total(), decision.passed());
        if (!completion.recorded()) {
            log.warn("[Assessment] Lesson {} not recorded: {}", request.lessonId(), completion.status());
            String error = completion.status() == LessonCompletion.Status.NO_PLAN
                    ? NO_PLAN_ERROR
                    : LESSON_NOT_FOUND_ERROR;
            return AssessmentResult.builder()
                    .success(false)
                    .error(error)
                    .message(error)
                    .build();
        }
        log.info("[Assessment] Lesson {} scored {}% against {}% (passed: {}, recorded: {})", request.lessonId(),
                decision.scorePercent(), decision.thresholdPercent(), decision.passed(), completion.status());

        if (!decision.passed()) {
            return AssessmentResult.builder()
                    .success(false)
                    .message("You scored " + decision.scorePercent() + "%. Mastery requires "
                            + decision.thresholdPercent() + "%. Try again or review the material.")
                    .scorePercent(decision.scorePercent())
                    .thresholdPercent(decision.thresholdPercent())
                    .build();
        }

        AssessmentResult.AssessmentResultBuilder result = AssessmentResult.builder()
                .success(true)
                .message(MASTERED_MESSAGE)
                .scorePercent(decision.scorePercent())
                .thresholdPercent(decision.thresholdPercent());
        result.summary(summaryComposer.lessonSummary(completion.lesson()));
        if (completion.allLessonsCompleted()) {
            result.subjectSummary(summaryComposer.subjectSummary(context));
        }
        return result.build();
    }
}
