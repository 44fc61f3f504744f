package me.golemcore.tutor.tools;

import me.golemcore.tutor.domain.model.LearningProgress;
import me.golemcore.tutor.domain.model.Subject;
import me.golemcore.tutor.domain.model.ToolFailureKind;
import me.golemcore.tutor.domain.model.ToolResult;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.domain.service.SummaryComposer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SummaryRequestToolTest {

    private SummaryRequestTool tool;
    private TutorContext context;

    @BeforeEach
    void setUp() {
        tool = new SummaryRequestTool(new SummaryComposer());
        LearningProgress progress = new LearningProgress();
        progress.recordScore(3, 4);
        context = TutorContext.builder()
                .subject(Subject.builder().id("subject_1").name("History").build())
                .learningProgress(progress)
                .build();
    }

    @Test
    void execute_summarizesProgress() {
        ToolResult result = tool.execute(context, Map.of("content_type", "progress"));

        assertTrue(result.isSuccess());
        String content = (String) result.getPayload().get("content");
        assertTrue(content.contains("Accuracy: 75.0%"));
        assertTrue(content.contains("Lessons completed: 0 of 0"));
        assertTrue(content.contains("Current subject: History"));
    }

    @Test
    void execute_reportsMissingLesson() {
        ToolResult result = tool.execute(context, Map.of("content_type", "LESSON"));

        assertEquals("No active lesson", result.getPayload().get("content"));
    }

    @Test
    void execute_usesScopeForConcepts() {
        ToolResult result = tool.execute(context, Map.of("content_type", "concept", "scope", "World War I"));

        assertEquals("Concept Summary: World War I", result.getPayload().get("content"));
    }

    @Test
    void execute_rejectsUnknownContentType() {
        ToolResult result = tool.execute(context, Map.of("content_type", "gossip"));

        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, result.getFailureKind());
    }
}
