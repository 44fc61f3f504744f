package me.golemcore.tutor.tools;

import me.golemcore.tutor.domain.content.ContentNormalizer;
import me.golemcore.tutor.domain.model.ContentType;
import me.golemcore.tutor.domain.model.InteractiveContent;
import me.golemcore.tutor.domain.model.LearnerLevel;
import me.golemcore.tutor.domain.model.Lesson;
import me.golemcore.tutor.domain.model.LessonPlan;
import me.golemcore.tutor.domain.model.Subject;
import me.golemcore.tutor.domain.model.ToolResult;
import me.golemcore.tutor.domain.model.TutorContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InteractiveComponentToolTest {

    private InteractiveComponentTool tool;
    private TutorContext context;

    @BeforeEach
    void setUp() {
        tool = new InteractiveComponentTool(
                new ContentNormalizer(Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC)));
        Lesson lesson = Lesson.builder().id("lesson_1").title("Lesson 1: Fractions").build();
        context = TutorContext.builder()
                .userId("user-1")
                .subject(Subject.builder().id("subject_1").name("Math").build())
                .lessonPlan(LessonPlan.builder().lessons(new ArrayList<>(List.of(lesson))).build())
                .build();
    }

    @Test
    void execute_normalizesContentAndRecordsType() {
        ToolResult result = tool.execute(context, Map.of(
                "type", "multiple-choice",
                "content", Map.of("question", "What is 1/2 + 1/4?"),
                "learning_objective", "Adding fractions",
                "difficulty", "intermediate"));

        assertTrue(result.isSuccess());
        InteractiveContent content = result.getContents().get(0);
        assertEquals(ContentType.MULTIPLE_CHOICE, content.type());
        assertEquals("What is 1/2 + 1/4?", content.data().get("question"));
        assertTrue(content.data().containsKey("choices"));
        assertEquals(LearnerLevel.INTERMEDIATE, content.difficulty());
        assertEquals("subject_1", content.subjectId());
        assertEquals("multiple-choice", result.getPayload().get("componentType"));
        assertEquals(List.of(ContentType.MULTIPLE_CHOICE), context.getCurrentLesson().getRecentContentTypes());
    }

    @Test
    void execute_rendersUnknownTypeAsPlaceholder() {
        ToolResult result = tool.execute(context, Map.of("type", "hologram", "learning_objective", "Fractions"));

        assertTrue(result.isSuccess());
        assertEquals(ContentType.PLACEHOLDER, result.getContents().get(0).type());
    }

    @Test
    void execute_acceptsUnderscoreTypeNames() {
        ToolResult result = tool.execute(context, Map.of("type", "fill_blank", "content", Map.of()));

        assertEquals(ContentType.FILL_BLANK, result.getContents().get(0).type());
        assertEquals(LearnerLevel.BEGINNER, result.getContents().get(0).difficulty());
    }
}
