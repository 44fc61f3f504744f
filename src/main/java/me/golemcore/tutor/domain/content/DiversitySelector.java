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

import lombok.RequiredArgsConstructor;
import me.golemcore.tutor.domain.model.ContentCategory;
import me.golemcore.tutor.domain.model.ContentType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Picks a concrete content type for a requested category while avoiding the
 * types produced most recently.
 *
 * <p>
 * Exclusion relaxes in two steps: first every recent type is excluded; if
 * that leaves nothing, only the most recent one; if that still leaves
 * nothing, any candidate is allowed.
 */
@Component
@RequiredArgsConstructor
public class DiversitySelector {

    static final int WINDOW = 3;

    private static final Map<ContentCategory, Map<ContentType, Integer>> WEIGHTS = new EnumMap<>(
            ContentCategory.class);

    static {
        WEIGHTS.put(ContentCategory.NEXT_QUESTION, weights(
                ContentType.MULTIPLE_CHOICE, 3,
                ContentType.PROGRESS_QUIZ, 2,
                ContentType.FILL_BLANK, 2,
                ContentType.CONCEPT_CARD, 1,
                ContentType.EXPLAINER, 1));
        WEIGHTS.put(ContentCategory.NEXT_EXERCISE, weights(
                ContentType.STEP_SOLVER, 3,
                ContentType.DRAG_DROP, 3,
                ContentType.TEXT_HIGHLIGHTER, 2,
                ContentType.PROGRESS_QUIZ, 1,
                ContentType.MULTIPLE_CHOICE, 1,
                ContentType.CONCEPT_CARD, 1,
                ContentType.FILL_BLANK, 1));
        WEIGHTS.put(ContentCategory.NEXT_PROBLEM, weights(
                ContentType.STEP_SOLVER, 3,
                ContentType.PROGRESS_QUIZ, 2,
                ContentType.MULTIPLE_CHOICE, 2,
                ContentType.FILL_BLANK, 1,
                ContentType.CONCEPT_CARD, 1,
                ContentType.EXPLAINER, 1));
        WEIGHTS.put(ContentCategory.PRACTICE, weights(
                ContentType.MULTIPLE_CHOICE, 2,
                ContentType.FILL_BLANK, 2,
                ContentType.DRAG_DROP, 2,
                ContentType.STEP_SOLVER, 2,
                ContentType.CONCEPT_CARD, 1,
                ContentType.INTERACTIVE_EXAMPLE, 1,
                ContentType.FORMULA_EXPLORER, 1,
                ContentType.GRAPH_VISUALIZER, 1,
                ContentType.TEXT_HIGHLIGHTER, 1));
        WEIGHTS.put(ContentCategory.ASSESSMENT, weights(
                ContentType.PROGRESS_QUIZ, 3,
                ContentType.STEP_SOLVER, 2,
                ContentType.FORMULA_EXPLORER, 1,
                ContentType.GRAPH_VISUALIZER, 1,
                ContentType.TEXT_HIGHLIGHTER, 1));
        WEIGHTS.put(ContentCategory.DEFAULT, weights(
                ContentType.PROGRESS_QUIZ, 1,
                ContentType.MULTIPLE_CHOICE, 1,
                ContentType.STEP_SOLVER, 1,
                ContentType.CONCEPT_CARD, 1,
                ContentType.EXPLAINER, 1,
                ContentType.FILL_BLANK, 1));
    }

    private final Random random;

    /**
     * @param category
     *            requested category, {@code null} means {@link ContentCategory#DEFAULT}
     * @param recentTypes
     *            recently produced types, most recent first; only the first
     *            {@value #WINDOW} entries are considered
     */
    public ContentType selectType(ContentCategory category, List<ContentType> recentTypes) {
        Map<ContentType, Integer> candidates = candidates(category);
        List<ContentType> recent = recentTypes == null
                ? List.of()
                : recentTypes.subList(0, Math.min(WINDOW, recentTypes.size()));

        Map<ContentType, Integer> pool = without(candidates, recent);
        if (pool.isEmpty() && !recent.isEmpty()) {
            pool = without(candidates, List.of(recent.get(0)));
        }
        if (pool.isEmpty()) {
            pool = candidates;
        }
        return pickWeighted(pool);
    }

    public List<ContentType> candidateTypes(ContentCategory category) {
        return new ArrayList<>(candidates(category).keySet());
    }

    private Map<ContentType, Integer> candidates(ContentCategory category) {
        return WEIGHTS.get(category != null ? category : ContentCategory.DEFAULT);
    }

    private ContentType pickWeighted(Map<ContentType, Integer> pool) {
        int total = pool.values().stream().mapToInt(Integer::intValue).sum();
        int roll = random.nextInt(total);
        for (Map.Entry<ContentType, Integer> entry : pool.entrySet()) {
            roll -= entry.getValue();
            if (roll < 0) {
                return entry.getKey();
            }
        }
        throw new IllegalStateException("Weighted selection fell through");
    }

    private static Map<ContentType, Integer> without(Map<ContentType, Integer> candidates,
            List<ContentType> excluded) {
        Map<ContentType, Integer> pool = new LinkedHashMap<>(candidates);
        excluded.forEach(pool::remove);
        return pool;
    }

    private static Map<ContentType, Integer> weights(Object... pairs) {
        Map<ContentType, Integer> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((ContentType) pairs[i], (Integer) pairs[i + 1]);
        }
        return map;
    }
}
