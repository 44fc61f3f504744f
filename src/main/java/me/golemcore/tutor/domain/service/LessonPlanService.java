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
import me.golemcore.tutor.domain.content.MasteryEvaluator;
import me.golemcore.tutor.domain.model.AdvanceOutcome;
import me.golemcore.tutor.domain.model.LearnerLevel;
import me.golemcore.tutor.domain.model.LearningProgress;
import me.golemcore.tutor.domain.model.Lesson;
import me.golemcore.tutor.domain.model.LessonCompletion;
import me.golemcore.tutor.domain.model.LessonPlan;
import me.golemcore.tutor.domain.model.LessonPlanState;
import me.golemcore.tutor.domain.model.MasteryDecision;
import me.golemcore.tutor.domain.model.Subject;
import me.golemcore.tutor.domain.model.TutorContext;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Lesson plan state machine: {@code NO_PLAN -> ACTIVE(i) -> COMPLETE}.
 *
 * <p>
 * Advancing from lesson {@code i} requires lesson {@code i} to be completed.
 * Advancing past the final lesson moves the index to {@code lessons.size()}
 * and reports completion instead of failing.
 *
 * <p>
 * Callers must hold the subject's turn lock; the service mutates the given
 * {@link TutorContext} in place.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LessonPlanService {

    public static final String NOT_COMPLETED_MESSAGE = "Current lesson is not yet completed. "
            + "Please demonstrate understanding (e.g., pass the assessment or practice) "
            + "before advancing to the next lesson.";
    public static final String ALL_DONE_MESSAGE = "Congratulations! You have completed all lessons in this subject.";

    private static final String LESSON_ID_PREFIX = "lesson_";

    private final MasteryEvaluator masteryEvaluator;
    private final Clock clock;

    public LessonPlanState state(TutorContext context) {
        LessonPlan plan = context.getLessonPlan();
        return plan != null ? plan.getState() : LessonPlanState.NO_PLAN;
    }

    /**
     * Build a plan with one lesson per learning goal and start at lesson 0.
     *
     * @throws IllegalArgumentException
     *             when no goal is given
     */
    public LessonPlan createPlan(TutorContext context, String subjectName, List<String> goals,
            LearnerLevel difficulty, String estimatedDuration) {
        List<String> cleanGoals = goals == null ? List.of()
                : goals.stream()
                        .filter(goal -> goal != null && !goal.isBlank())
                        .map(String::trim)
                        .toList();
        if (cleanGoals.isEmpty()) {
            throw new IllegalArgumentException("At least one learning goal is required");
        }

        List<Lesson> lessons = new ArrayList<>();
        for (int i = 0; i < cleanGoals.size(); i++) {
            String goal = cleanGoals.get(i);
            lessons.add(Lesson.builder()
                    .id(LESSON_ID_PREFIX + (i + 1))
                    .title("Lesson " + (i + 1) + ": " + goal)
                    .description("Learn about " + goal + " with interactive examples and practice exercises.")
                    .learningObjectives(new ArrayList<>(List.of(goal)))
                    .build());
        }

        LessonPlan plan = LessonPlan.builder()
                .subject(subjectName)
                .difficulty(LearnerLevel.orDefault(difficulty))
                .estimatedDuration(estimatedDuration)
                .lessons(lessons)
                .currentLessonIndex(0)
                .build();
        context.setLessonPlan(plan);
        recomputeProgress(context);
        progress(context).syncWith(plan, true);
        log.info("[LessonPlan] Created {}-lesson plan for '{}'", lessons.size(), subjectName);
        return plan;
    }

    /**
     * Append lessons and remove lessons by title, keeping the current lesson
     * current when it survives.
     *
     * @return number of lessons after the update
     */
    public int updatePlan(TutorContext context, List<String> newLessonTitles, List<String> removeTitles) {
        LessonPlan plan = context.getLessonPlan();
        if (plan == null) {
            throw new IllegalStateException("No lesson plan to update");
        }
        Lesson current = plan.getCurrentLesson();
        List<Lesson> lessons = new ArrayList<>(plan.getLessons());

        if (removeTitles != null && !removeTitles.isEmpty()) {
            Set<String> toRemove = removeTitles.stream()
                    .filter(title -> title != null)
                    .map(title -> title.trim().toLowerCase(Locale.ROOT))
                    .collect(Collectors.toSet());
            lessons.removeIf(lesson -> lesson.getTitle() != null
                    && toRemove.contains(lesson.getTitle().trim().toLowerCase(Locale.ROOT)));
        }

        if (newLessonTitles != null) {
            int nextNumber = nextLessonNumber(lessons);
            for (String title : newLessonTitles) {
                if (title == null || title.isBlank()) {
                    continue;
                }
                lessons.add(Lesson.builder()
                        .id(LESSON_ID_PREFIX + nextNumber++)
                        .title(title.trim())
                        .description("Updated lesson: " + title.trim())
                        .build());
            }
        }

        plan.setLessons(lessons);
        int index = indexOf(lessons, current);
        if (index < 0) {
            index = Math.min(plan.getCurrentLessonIndex(), lessons.size());
        }
        plan.setCurrentLessonIndex(index);
        recomputeProgress(context);
        progress(context).syncWith(plan, !progress(context).isNeedsReview());
        log.info("[LessonPlan] Updated plan for '{}': {} lessons, current index {}",
                plan.getSubject(), lessons.size(), index);
        return lessons.size();
    }

    /**
     * Record an attempt at a lesson and set its completion flag.
     */
    public LessonCompletion recordCompletion(TutorContext context, String lessonId, boolean completed) {
        return applyCompletion(context, lessonId, completed, false,
                progress -> progress.recordAttempt(completed));
    }

    /**
     * Apply a graded assessment to a lesson. The score is counted once as
     * {@code score} correct out of {@code total} attempts, and a failed
     * assessment clears the lesson's completion flag.
     */
    public LessonCompletion recordAssessment(TutorContext context, String lessonId, int score, int total,
            boolean passed) {
        return applyCompletion(context, lessonId, passed, true, progress -> progress.recordScore(score, total));
    }

    private LessonCompletion applyCompletion(TutorContext context, String lessonId, boolean passed,
            boolean clearOnFailure, Consumer<LearningProgress> counter) {
        LessonPlan plan = context.getLessonPlan();
        if (plan == null || plan.getLessons() == null || plan.getLessons().isEmpty()) {
            return LessonCompletion.rejected(LessonCompletion.Status.NO_PLAN);
        }
        Lesson lesson = plan.findLesson(lessonId);
        if (lesson == null) {
            return LessonCompletion.rejected(LessonCompletion.Status.LESSON_NOT_FOUND);
        }

        if (passed) {
            lesson.setCompleted(true);
        } else if (clearOnFailure) {
            lesson.setCompleted(false);
        }
        LearningProgress progress = progress(context);
        counter.accept(progress);
        double subjectProgress = recomputeProgress(context);
        progress.syncWith(plan, passed);
        touchSubject(context);
        return new LessonCompletion(LessonCompletion.Status.RECORDED, lesson, plan.isAllCompleted(),
                subjectProgress);
    }

    /**
     * Decide mastery for a graded score against the current learner level and
     * the plan difficulty.
     */
    public MasteryDecision evaluateMastery(TutorContext context, int score, int total, LearnerLevel difficulty) {
        LearnerLevel lessonDifficulty = difficulty != null ? difficulty
                : context.getLessonPlan() != null ? context.getLessonPlan().getDifficulty() : null;
        return masteryEvaluator.evaluate(score, total, context.getUserLevel(), lessonDifficulty);
    }

    public AdvanceOutcome advance(TutorContext context) {
        LessonPlan plan = context.getLessonPlan();
        if (plan == null || plan.getLessons() == null || plan.getLessons().isEmpty()) {
            return new AdvanceOutcome(AdvanceOutcome.Status.NO_PLAN, null, "No active lesson plan");
        }
        if (plan.getState() == LessonPlanState.COMPLETE) {
            return new AdvanceOutcome(AdvanceOutcome.Status.SUBJECT_COMPLETE, null, ALL_DONE_MESSAGE);
        }

        Lesson current = plan.getCurrentLesson();
        if (!current.isCompleted()) {
            return new AdvanceOutcome(AdvanceOutcome.Status.NOT_COMPLETED, current, NOT_COMPLETED_MESSAGE);
        }

        plan.setCurrentLessonIndex(plan.getCurrentLessonIndex() + 1);
        progress(context).syncWith(plan, true);
        touchSubject(context);
        if (plan.getState() == LessonPlanState.COMPLETE) {
            log.info("[LessonPlan] All lessons of '{}' passed", plan.getSubject());
            return new AdvanceOutcome(AdvanceOutcome.Status.SUBJECT_COMPLETE, null, ALL_DONE_MESSAGE);
        }
        Lesson next = plan.getCurrentLesson();
        log.info("[LessonPlan] Advanced '{}' to lesson {}/{}", plan.getSubject(),
                plan.getCurrentLessonIndex() + 1, plan.getLessons().size());
        return new AdvanceOutcome(AdvanceOutcome.Status.ADVANCED, next, "Advanced to " + next.getTitle());
    }

    public void completeSubject(TutorContext context) {
        Subject subject = context.getSubject();
        if (subject == null) {
            throw new IllegalStateException("No active subject");
        }
        Instant now = Instant.now(clock);
        subject.setProgress(100.0);
        subject.setActive(false);
        subject.setCompletedAt(now);
        subject.touch(now);
        log.info("[LessonPlan] Subject '{}' completed", subject.getName());
    }

    /**
     * Set the subject's progress to the percentage of completed lessons.
     */
    public double recomputeProgress(TutorContext context) {
        LessonPlan plan = context.getLessonPlan();
        if (plan == null || plan.getLessons() == null || plan.getLessons().isEmpty()) {
            return 0.0;
        }
        double percent = plan.getCompletedCount() * 100.0 / plan.getLessons().size();
        if (context.getSubject() != null) {
            context.getSubject().setProgress(percent);
        }
        return percent;
    }

    private void touchSubject(TutorContext context) {
        if (context.getSubject() != null) {
            context.getSubject().touch(Instant.now(clock));
        }
    }

    private static LearningProgress progress(TutorContext context) {
        if (context.getLearningProgress() == null) {
            context.setLearningProgress(new LearningProgress());
        }
        return context.getLearningProgress();
    }

    private static int indexOf(List<Lesson> lessons, Lesson target) {
        for (int i = 0; i < lessons.size(); i++) {
            if (lessons.get(i) == target) {
                return i;
            }
        }
        return -1;
    }

    private static int nextLessonNumber(List<Lesson> lessons) {
        int max = 0;
        for (Lesson lesson : lessons) {
            String id = lesson.getId();
            if (id != null && id.startsWith(LESSON_ID_PREFIX)) {
                try {
                    max = Math.max(max, Integer.parseInt(id.substring(LESSON_ID_PREFIX.length())));
                } catch (NumberFormatException e) {
                    log.debug("[LessonPlan] Non-numeric lesson id: {}", id);
                }
            }
        }
        return Math.max(max, lessons.size()) + 1;
    }
}
