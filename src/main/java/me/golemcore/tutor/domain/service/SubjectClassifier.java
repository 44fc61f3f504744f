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

import me.golemcore.tutor.domain.model.SubjectDetection;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline detection of "I want to learn X" requests, used when the assistant
 * service cannot be reached.
 *
 * <p>
 * A learning phrase ("learn", "study", "teach me", ...) followed by a topic
 * names the subject after the topic, with confidence
 * {@value #PHRASE_CONFIDENCE} or {@value #CURATED_CONFIDENCE} when the topic
 * also hits the curated keyword table. Without a learning phrase only a
 * curated keyword match counts, and the curated subject name is used.
 */
@Component
public class SubjectClassifier {

    static final double CURATED_CONFIDENCE = 0.8;
    static final double PHRASE_CONFIDENCE = 0.5;

    private static final int MAX_TOPIC_LENGTH = 60;

    private static final Pattern LEARN_PHRASE = Pattern.compile(
            "(?:i want to learn|i'm interested in|help me with|let's learn|teach me|learn|study|teach)"
                    + "\\s+(?:about\\s+)?([a-z0-9][a-z0-9\\s\\-]*)$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.!?,;:]+$");

    private static final Map<Pattern, String> CURATED = new LinkedHashMap<>();

    static {
        curated("social media", "Social Media Management");
        curated("advertising", "Digital Advertising");
        curated("math|mathematics|algebra|calculus|geometry|statistics", "Mathematics");
        curated("science|physics|chemistry|biology", "Science");
        curated("history", "History");
        curated("english|literature|writing|grammar", "English");
        curated("programming|coding|javascript|python|web development", "Programming");
        curated("business|entrepreneurship|management|leadership", "Business");
        curated("spanish|french|german|language", "Language Learning");
        curated("art|design|drawing|painting", "Art & Design");
        curated("music|piano|guitar|singing", "Music");
        curated("cooking|recipe|culinary", "Cooking");
        curated("fitness|exercise|workout|health", "Health & Fitness");
    }

    public SubjectDetection classify(String message) {
        if (message == null || message.isBlank()) {
            return SubjectDetection.noMatch();
        }
        String cleaned = TRAILING_PUNCTUATION.matcher(message.trim()).replaceAll("").trim();

        Matcher phrase = LEARN_PHRASE.matcher(cleaned);
        if (phrase.find()) {
            String topic = phrase.group(1).trim().replaceAll("\\s+", " ");
            if (!topic.isEmpty() && topic.length() <= MAX_TOPIC_LENGTH) {
                double confidence = curatedSubject(topic) != null ? CURATED_CONFIDENCE : PHRASE_CONFIDENCE;
                return SubjectDetection.detected(capitalize(topic), confidence);
            }
        }

        String curated = curatedSubject(cleaned);
        return curated != null
                ? SubjectDetection.detected(curated, CURATED_CONFIDENCE)
                : SubjectDetection.noMatch();
    }

    private static String curatedSubject(String text) {
        for (Map.Entry<Pattern, String> entry : CURATED.entrySet()) {
            if (entry.getKey().matcher(text).find()) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static String capitalize(String topic) {
        return topic.substring(0, 1).toUpperCase(Locale.ROOT) + topic.substring(1);
    }

    private static void curated(String keywords, String subject) {
        CURATED.put(Pattern.compile("\\b(?:" + keywords + ")\\b", Pattern.CASE_INSENSITIVE), subject);
    }
}
