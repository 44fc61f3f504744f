package me.golemcore.tutor.domain.loop;

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

import me.golemcore.tutor.domain.model.ConceptInfo;
import me.golemcore.tutor.domain.model.LearnerPreferences;
import me.golemcore.tutor.domain.model.LearningProgress;
import me.golemcore.tutor.domain.model.LessonPlan;
import me.golemcore.tutor.domain.model.LessonPlanState;
import me.golemcore.tutor.domain.model.Subject;
import me.golemcore.tutor.domain.model.TutorContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Per-run additional instructions describing where the learner currently
 * stands.
 */
@Component
public class ContextualInstructionsBuilder {

    static final String HEADER = "Additional context for this conversation:\n";

    private static final List<String> INTERACTIVE_CONTENT_RULES = List.of(
            "IMPORTANT - ALWAYS use the interactive_component tool call for ANY educational topic:",
            "1. MUST use tool calls when explaining concepts, NOT just text responses",
            "2. Create interactive components for ALL educational topics using the interactive_component tool",
            "3. Every educational response REQUIRES an interactive component",
            "4. Keep chat responses BRIEF and focus on creating rich interactive components",
            "5. For ANY topic, create an appropriate interactive component type (explainer, interactive-example, etc.)");

    /**
     * @return the instructions, or an empty string when nothing is known yet
     */
    public String build(TutorContext context) {
        List<String> lines = new ArrayList<>();

        Subject subject = context.getSubject();
        if (subject != null) {
            lines.add("Current subject: " + subject.getName());
            lines.add("Subject progress: " + formatPercent(subject.getProgress()) + "%");
        }

        LessonPlan plan = context.getLessonPlan();
        if (plan != null && plan.getLessons() != null && !plan.getLessons().isEmpty()) {
            int total = plan.getLessons().size();
            if (plan.getState() == LessonPlanState.COMPLETE) {
                lines.add("All " + total + " lessons completed");
            } else {
                lines.add("Current lesson: " + (plan.getCurrentLessonIndex() + 1) + " of " + total
                        + " (" + plan.getCurrentLesson().getTitle() + ", id " + plan.getCurrentLesson().getId()
                        + ")");
                ConceptInfo concept = plan.getCurrentLesson().getCurrentConcept();
                if (concept != null) {
                    lines.add("Current concept: " + concept.getName() + (concept.isMastered() ? " (mastered)" : ""));
                }
            }
        }

        LearningProgress progress = context.getLearningProgress();
        if (progress != null) {
            lines.add("Current accuracy: " + formatPercent(progress.getAccuracy() * 100) + "%");
        }

        LearnerPreferences preferences = context.getPreferences();
        if (preferences != null) {
            if (preferences.getLearningStyle() != null) {
                lines.add("Preferred learning style: " + preferences.getLearningStyle());
            }
            if (preferences.getPace() != null) {
                lines.add("Preferred pace: " + preferences.getPace());
            }
        }
        if (preferences == null || preferences.isPreferInteractiveContent()) {
            lines.addAll(INTERACTIVE_CONTENT_RULES);
        }
        if (context.getInstructionOverrides() != null && !context.getInstructionOverrides().isBlank()) {
            lines.add(context.getInstructionOverrides().trim());
        }

        if (context.getUserGoals() != null && !context.getUserGoals().isEmpty()) {
            lines.add("Learning goals: " + String.join(", ", context.getUserGoals()));
        }
        if (context.getUserLevel() != null) {
            lines.add("Self-assessed level: " + context.getUserLevel().getValue());
        }

        return lines.isEmpty() ? "" : HEADER + String.join("\n", lines);
    }

    private static String formatPercent(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
