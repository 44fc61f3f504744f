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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.tutor.infrastructure.config.TutorProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Detects messages too short or too vague to act on. Patterns must match the
 * whole message, so a real question that merely contains "what" or "how" is
 * not flagged.
 */
@Component
@Slf4j
public class AmbiguityGuard {

    public static final String CLARIFYING_QUESTION = "Can you clarify what you want to learn or practice?";
    public static final String CLARIFYING_CONTEXT = "The request was too short or ambiguous.";

    private final TutorProperties.GuardProperties guard;
    private final List<Pattern> vaguePatterns;

    public AmbiguityGuard(TutorProperties properties) {
        this.guard = properties.getGuard();
        this.vaguePatterns = guard.getVaguePatterns().stream()
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    public boolean isAmbiguous(String message) {
        if (!guard.isEnabled()) {
            return false;
        }
        String trimmed = message != null ? message.trim() : "";
        if (trimmed.length() < guard.getMinMessageLength()) {
            return true;
        }
        String normalized = trimmed.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        for (Pattern pattern : vaguePatterns) {
            if (pattern.matcher(normalized).matches()) {
                log.debug("[Orchestrator] Message matched vague pattern {}", pattern.pattern());
                return true;
            }
        }
        return false;
    }
}
