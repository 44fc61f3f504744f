package me.golemcore.tutor.domain.service;

import me.golemcore.tutor.domain.content.MasteryEvaluator;
import me.golemcore.tutor.domain.model.AdvanceOutcome;
import me.golemcore.tutor.domain.model.LearnerLevel;
import me.golemcore.tutor.domain.model.Lesson;
import me.golemcore.tutor.domain.model.LessonCompletion;
import me.golemcore.tutor.domain.model.LessonPlan;
import me.golemcore.tutor.domain.model.LessonPlanState;
import me.golemcore.tutor.domain.model.MasteryDecision;
import me.golemcore.tutor.domain.model.Subject;
import me.golemcore.tutor.domain.model.TutorContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LessonPlanServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private LessonPlanService service;
    private TutorContext context;

    @BeforeEach
    void setUp() {
        service = new LessonPlanService(new MasteryEvaluator(), Clock.fixed(NOW, ZoneOffset.UTC));
        context = new TutorContext();
        context.setUserId("user-1");
        context.setSubject(Subject.builder().id("subject_1").name("Algebra").build());
    }

    @Test
    void shouldReportNoPlanBeforeCreation() {
        assertEquals(LessonPlanState.NO_PLAN, service.state(context));
        assertEquals(AdvanceOutcome.Status.NO_PLAN, service.advance(context).status());
    }

    @Test
    void shouldCreateOneLessonPerGoal() {
        LessonPlan plan = service.createPlan(context, "Algebra", List.of("Variables", " ", "Equations"),
                LearnerLevel.INTERMEDIATE, "2 weeks");

        assertEquals(2, plan.getLessons().size());
        assertEquals("lesson_1", plan.getLessons().get(0).getId());
        assertEquals("Lesson 1: Variables", plan.getLessons().get(0).getTitle());
        assertEquals("Lesson 2: Equations", plan.getLessons().get(1).getTitle());
        assertEquals(0, plan.getCurrentLessonIndex());
        assertEquals(LearnerLevel.INTERMEDIATE, plan.getDifficulty());
        assertSame(plan, context.getLessonPlan());
        assertEquals(LessonPlanState.ACTIVE, service.state(context));
        assertEquals(2, context.getLearningProgress().getTotalLessons());
    }

    @Test
    void shouldRejectPlanWithoutGoals() {
        assertThrows(IllegalArgumentException.class,
                () -> service.createPlan(context, "Algebra", List.of(), null, null));
        assertThrows(IllegalArgumentException.class,
                () -> service.createPlan(context, "Algebra", null, null, null));
    }

    @Test
    void shouldNotAdvanceWhileCurrentLessonIncomplete() {
        service.createPlan(context, "Algebra", List.of("Variables", "Equations"), null, null);

        AdvanceOutcome outcome = service.advance(context);

        assertEquals(AdvanceOutcome.Status.NOT_COMPLETED, outcome.status());
        assertEquals(LessonPlanService.NOT_COMPLETED_MESSAGE, outcome.message());
        assertEquals(0, context.getLessonPlan().getCurrentLessonIndex());
    }

    @Test
    void shouldAdvanceAfterCompletion() {
        service.createPlan(context, "Algebra", List.of("Variables", "Equations"), null, null);
        LessonCompletion completion = service.recordCompletion(context, "lesson_1", true);

        AdvanceOutcome outcome = service.advance(context);

        assertTrue(completion.recorded());
        assertFalse(completion.allLessonsCompleted());
        assertEquals(50.0, completion.subjectProgress());
        assertEquals(AdvanceOutcome.Status.ADVANCED, outcome.status());
        assertEquals("lesson_2", outcome.lesson().getId());
        assertEquals(1, context.getLessonPlan().getCurrentLessonIndex());
        assertEquals(NOW, context.getSubject().getLastActiveAt());
    }

    @Test
    void shouldReportSubjectCompleteWhenAdvancingPastLastLesson() {
        service.createPlan(context, "Algebra", List.of("Variables"), null, null);
        LessonCompletion completion = service.recordCompletion(context, "lesson_1", true);

        AdvanceOutcome outcome = service.advance(context);

        assertTrue(completion.allLessonsCompleted());
        assertEquals(AdvanceOutcome.Status.SUBJECT_COMPLETE, outcome.status());
        assertEquals(LessonPlanService.ALL_DONE_MESSAGE, outcome.message());
        assertEquals(1, context.getLessonPlan().getCurrentLessonIndex());
        assertEquals(LessonPlanState.COMPLETE, service.state(context));
        assertNull(context.getCurrentLesson());
        assertEquals(AdvanceOutcome.Status.SUBJECT_COMPLETE, service.advance(context).status());
        assertEquals(1, context.getLessonPlan().getCurrentLessonIndex());
    }

    @Test
    void shouldKeepIndexWithinBoundsOverManyAdvances() {
        service.createPlan(context, "Algebra", List.of("A", "B", "C"), null, null);
        for (Lesson lesson : context.getLessonPlan().getLessons()) {
            service.recordCompletion(context, lesson.getId(), true);
        }

        for (int i = 0; i < 10; i++) {
            service.advance(context);
            int index = context.getLessonPlan().getCurrentLessonIndex();
            assertTrue(index >= 0 && index <= 3);
        }
    }

    @Test
    void failedCompletionShouldRecordAttemptButKeepLessonOpen() {
        service.createPlan(context, "Algebra", List.of("Variables"), null, null);

        LessonCompletion completion = service.recordCompletion(context, "lesson_1", false);

        assertTrue(completion.recorded());
        assertFalse(completion.lesson().isCompleted());
        assertEquals(1, context.getLearningProgress().getTotalAttempts());
        assertTrue(context.getLearningProgress().isNeedsReview());
    }

    @Test
    void shouldRejectCompletionWithoutPlanOrUnknownLesson() {
        assertEquals(LessonCompletion.Status.NO_PLAN,
                service.recordCompletion(context, "lesson_1", true).status());

        service.createPlan(context, "Algebra", List.of("Variables"), null, null);

        assertEquals(LessonCompletion.Status.LESSON_NOT_FOUND,
                service.recordCompletion(context, "lesson_9", true).status());
    }

    @Test
    void shouldUsePlanDifficultyForMastery() {
        service.createPlan(context, "Algebra", List.of("Variables"), LearnerLevel.ADVANCED, null);

        MasteryDecision decision = service.evaluateMastery(context, 8, 10, null);

        assertFalse(decision.passed());
        assertEquals(0.9, decision.threshold());
    }

    @Test
    void shouldKeepCurrentLessonWhenUpdatingPlan() {
        service.createPlan(context, "Algebra", List.of("A", "B", "C"), null, null);
        service.recordCompletion(context, "lesson_1", true);
        service.advance(context);

        int size = service.updatePlan(context, List.of("Bonus"), List.of("Lesson 1: A"));

        assertEquals(3, size);
        assertEquals("Lesson 2: B", context.getCurrentLesson().getTitle());
        assertEquals(0, context.getLessonPlan().getCurrentLessonIndex());
        assertEquals("lesson_4", context.getLessonPlan().getLessons().get(2).getId());
    }

    @Test
    void shouldRejectUpdateWithoutPlan() {
        assertThrows(IllegalStateException.class, () -> service.updatePlan(context, List.of("X"), null));
    }

    @Test
    void shouldCompleteSubject() {
        service.completeSubject(context);

        assertEquals(100.0, context.getSubject().getProgress());
        assertFalse(context.getSubject().isActive());
        assertEquals(NOW, context.getSubject().getCompletedAt());
    }

    @Test
    void shouldRejectSubjectCompletionWithoutSubject() {
        context.setSubject(null);

        assertThrows(IllegalStateException.class, () -> service.completeSubject(context));
    }
}
