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

import me.golemcore.tutor.domain.model.LearningProgress;
import me.golemcore.tutor.domain.model.Lesson;
import me.golemcore.tutor.domain.model.LessonPlan;
import me.golemcore.tutor.domain.model.TutorContext;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Plain-text summaries of lesson, concept and overall progress.
 */
@Component
public class SummaryComposer {

    static final String NO_ACTIVE_LESSON = "No active lesson";
    static final String GENERAL_CONCEPTS = "General overview of key concepts covered";

    public String progressSummary(TutorContext context) {
        LearningProgress progress = context.getLearningProgress() != null
                ? context.getLearningProgress()
                : new LearningProgress();
        LessonPlan plan = context.getLessonPlan();
        long completed = plan != null ? plan.getCompletedCount() : 0;
        int total = plan != null && plan.getLessons() != null ? plan.getLessons().size() : 0;
        String subjectName = context.getSubject() != null ? context.getSubject().getName() : "None";

        return "Learning Progress Summary:\n"
                + "- Accuracy: " + String.format(Locale.ROOT, "%.1f", progress.getAccuracy() * 100) + "%\n"
                + "- Lessons completed: " + completed + " of " + total + "\n"
                + "- Current subject: " + subjectName;
    }

    public String lessonSummary(Lesson lesson) {
        if (lesson == null) {
            return NO_ACTIVE_LESSON;
        }
        return "Current Lesson Summary:\n"
                + "Title: " + lesson.getTitle() + "\n"
                + "Description: " + lesson.getDescription();
    }

    public String conceptSummary(String scope) {
        return "Concept Summary: " + (scope != null && !scope.isBlank() ? scope : GENERAL_CONCEPTS);
    }

    /**
     * Summary shown once every lesson of a subject is completed.
     */
    public String subjectSummary(TutorContext context) {
        String subjectName = context.getSubject() != null ? context.getSubject().getName() : "this subject";
        return "Subject complete: " + subjectName + "\n" + progressSummary(context);
    }
}
