package me.golemcore.tutor.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Graded-interaction counters for the current subject. Derived flags are
 * recomputed after each graded interaction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LearningProgress {

    private int correctAnswers;
    private int totalAttempts;
    private boolean needsReview;
    private boolean readyForNext;
    private Integer currentLessonIndex;
    private Integer totalLessons;
    private int streakCount;

    public void recordAttempt(boolean correct) {
        totalAttempts++;
        if (correct) {
            correctAnswers++;
            streakCount++;
        } else {
            streakCount = 0;
        }
    }

    public void recordScore(int correct, int total) {
        if (total <= 0) {
            return;
        }
        int bounded = Math.max(0, Math.min(correct, total));
        correctAnswers += bounded;
        totalAttempts += total;
        streakCount = bounded == total ? streakCount + 1 : 0;
    }

    /**
     * Correct-answer ratio in {@code [0, 1]}; zero before any attempt.
     */
    @JsonIgnore
    public double getAccuracy() {
        return totalAttempts > 0 ? (double) correctAnswers / totalAttempts : 0.0;
    }

    public void syncWith(LessonPlan plan, boolean lastDecisionPassed) {
        this.needsReview = !lastDecisionPassed;
        if (plan == null) {
            this.readyForNext = false;
            this.currentLessonIndex = null;
            this.totalLessons = null;
            return;
        }
        Lesson current = plan.getCurrentLesson();
        this.readyForNext = current != null && current.isCompleted();
        this.currentLessonIndex = plan.getCurrentLessonIndex();
        this.totalLessons = plan.getLessons() != null ? plan.getLessons().size() : 0;
    }
}
