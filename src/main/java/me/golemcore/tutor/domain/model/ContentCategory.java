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

import java.util.Locale;

/**
 * Requested kind of follow-up content. Each category maps to a weighted list
 * of concrete {@link ContentType}s.
 */
public enum ContentCategory {

    NEXT_QUESTION, NEXT_EXERCISE, NEXT_PROBLEM, PRACTICE, ASSESSMENT, DEFAULT;

    public static ContentCategory fromAction(String action) {
        if (action == null || action.isBlank()) {
            return DEFAULT;
        }
        try {
            return valueOf(action.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            return DEFAULT;
        }
    }
}
