package me.golemcore.tutor.domain.content;

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

import me.golemcore.tutor.domain.model.LearnerLevel;
import me.golemcore.tutor.domain.model.LearningProgress;
import me.golemcore.tutor.domain.model.MasteryDecision;
import org.springframework.stereotype.Component;

/**
 * Decides whether a score demonstrates mastery of a lesson.
 *
 * <p>
 * The threshold adapts to the harder of learner level and lesson difficulty:
 * 0.7 for beginners, 0.8 when either is intermediate, 0.9 when either is
 * advanced.
 */
@Component
public class MasteryEvaluator {

    static final double BEGINNER_THRESHOLD = 0.7;
    static final double INTERMEDIATE_THRESHOLD = 0.8;
    static final double ADVANCED_THRESHOLD = 0.9;

    public double threshold(LearnerLevel learnerLevel, LearnerLevel difficulty) {
        if (learnerLevel == LearnerLevel.ADVANCED || difficulty == LearnerLevel.ADVANCED) {
            return ADVANCED_THRESHOLD;
        }
        if (learnerLevel == LearnerLevel.INTERMEDIATE || difficulty == LearnerLevel.INTERMEDIATE) {
            return INTERMEDIATE_THRESHOLD;
        }
        return BEGINNER_THRESHOLD;
    }

    /**
     * Evaluate a single assessment. A non-positive total yields a ratio of 0.
     */
    public MasteryDecision evaluate(int score, int total, LearnerLevel learnerLevel, LearnerLevel difficulty) {
        double ratio = total > 0 ? (double) score / total : 0.0;
        double threshold = threshold(learnerLevel, difficulty);
        return new MasteryDecision(ratio, threshold, ratio >= threshold);
    }

    public MasteryDecision evaluate(LearningProgress progress, LearnerLevel learnerLevel, LearnerLevel difficulty) {
        if (progress == null) {
            return evaluate(0, 0, learnerLevel, difficulty);
        }
        return evaluate(progress.getCorrectAnswers(), progress.getTotalAttempts(), learnerLevel, difficulty);
    }
}
