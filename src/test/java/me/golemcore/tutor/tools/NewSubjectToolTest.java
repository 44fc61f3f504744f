package me.golemcore.tutor.tools;

import me.golemcore.tutor.domain.model.LearnerLevel;
import me.golemcore.tutor.domain.model.Subject;
import me.golemcore.tutor.domain.model.ToolFailureKind;
import me.golemcore.tutor.domain.model.ToolResult;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.domain.service.SubjectService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NewSubjectToolTest {

    private SubjectService subjectService;
    private NewSubjectTool tool;
    private TutorContext context;

    @BeforeEach
    void setUp() {
        subjectService = mock(SubjectService.class);
        tool = new NewSubjectTool(subjectService);
        context = TutorContext.builder().userId("user-1").build();
    }

    @Test
    void getDefinition_requiresName() {
        Map<String, Object> schema = tool.getDefinition().getInputSchema();

        assertEquals("new_subject", tool.getDefinition().getName());
        assertEquals(List.of("name"), schema.get("required"));
    }

    @Test
    void execute_startsSubjectAndSeedsGoalsPrompt() {
        Subject subject = Subject.builder().id("subject_1").name("Biology").build();
        when(subjectService.startSubject(context, "Biology", "cells", LearnerLevel.ADVANCED)).thenReturn(subject);

        ToolResult result = tool.execute(context, Map.of(
                "name", "Biology", "description", "cells", "difficulty_level", "advanced"));

        assertTrue(result.isSuccess());
        assertSame(subject, result.getPayload().get("subject"));
        verify(subjectService).seedGoalsPrompt(context, "Biology");
    }

    @Test
    void execute_failsWithoutName() {
        ToolResult result = tool.execute(context, Map.of("name", "  "));

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, result.getFailureKind());
        verify(subjectService, never()).startSubject(any(), anyString(), any(), any());
    }
}
