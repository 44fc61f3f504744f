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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tutor.domain.model.ContentFeedItem;
import me.golemcore.tutor.domain.model.ConversationTurn;
import me.golemcore.tutor.domain.model.InteractiveContent;
import me.golemcore.tutor.domain.model.LearnerLevel;
import me.golemcore.tutor.domain.model.LearningProgress;
import me.golemcore.tutor.domain.model.PersistedMessage;
import me.golemcore.tutor.domain.model.Subject;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.port.outbound.TutorPersistencePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Subject lifecycle and the per-subject message and content logs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubjectService {

    private static final String SUBJECT_ID_PREFIX = "subject_";

    private final TutorPersistencePort persistencePort;
    private final PersistenceRetrySupport retrySupport;
    private final TutorContextService contextService;
    private final AssistantSessionManager sessionManager;
    private final Clock clock;

    /**
     * Start a new subject in the given context. A previous subject's lesson
     * plan and progress stay with that subject; the context starts clean.
     */
    public Subject startSubject(TutorContext context, String name, String description, LearnerLevel level) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Subject name is required");
        }
        if (context.hasSubject()) {
            contextService.saveAsync(context);
        }

        Instant now = Instant.now(clock);
        String trimmed = name.trim();
        Subject subject = Subject.builder()
                .id(SUBJECT_ID_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 12))
                .name(trimmed)
                .description(description)
                .progress(0.0)
                .active(true)
                .createdAt(now)
                .lastActiveAt(now)
                .topicKeywords(new ArrayList<>(List.of(trimmed.toLowerCase(Locale.ROOT))))
                .build();

        context.setSubject(subject);
        context.setLessonPlan(null);
        context.setLearningProgress(new LearningProgress());
        if (level != null) {
            context.setUserLevel(level);
        }
        if (context.getUserId() != null) {
            String userId = context.getUserId();
            retrySupport.runAsync("save subject " + subject.getId(),
                    () -> persistencePort.saveSubject(userId, subject));
        }
        log.info("[Subject] Started '{}' ({})", trimmed, subject.getId());
        return subject;
    }

    /**
     * Ask for goals and self-assessed level right after a subject starts.
     */
    public void seedGoalsPrompt(TutorContext context, String subjectName) {
        context.appendTurn(ConversationTurn.assistant(
                "To personalize your learning, what are your main goals for " + subjectName
                        + "? How would you rate your current level (beginner, intermediate, advanced)?",
                List.of(), Instant.now(clock)));
    }

    public List<Subject> listSubjects(String userId) {
        return retrySupport.call("list subjects " + userId, () -> persistencePort.loadSubjectsByUser(userId));
    }

    /**
     * Delete a subject with everything stored for it and release its
     * assistant session.
     */
    public void deleteSubject(String userId, String subjectId) {
        retrySupport.run("delete subject " + subjectId, () -> persistencePort.deleteSubject(userId, subjectId));
        sessionManager.teardown(subjectId);
        contextService.evict(userId, subjectId);
        log.info("[Subject] Deleted {} for user {}", subjectId, userId);
    }

    public List<PersistedMessage> loadMessages(String userId, String subjectId) {
        return retrySupport.call("load messages " + subjectId,
                () -> persistencePort.loadMessagesBySubject(userId, subjectId));
    }

    public List<ContentFeedItem> loadContentFeed(String userId, String subjectId) {
        return retrySupport.call("load content " + subjectId,
                () -> persistencePort.loadContentFeedBySubject(userId, subjectId));
    }

    /**
     * Append the turn's user and assistant messages and generated content to
     * the subject logs in the background.
     */
    public void recordTurn(String userId, String subjectId, String userMessage, String assistantMessage,
            List<InteractiveContent> contents) {
        if (userId == null || subjectId == null) {
            return;
        }
        Instant now = Instant.now(clock);
        List<InteractiveContent> generated = contents != null ? List.copyOf(contents) : List.of();
        retrySupport.runAsync("record turn " + subjectId, () -> {
            if (userMessage != null) {
                retrySupport.run("save user message", () -> persistencePort.saveMessage(
                        message(userId, subjectId, ConversationTurn.ROLE_USER, userMessage, now, false)));
            }
            if (assistantMessage != null) {
                retrySupport.run("save assistant message", () -> persistencePort.saveMessage(
                        message(userId, subjectId, ConversationTurn.ROLE_ASSISTANT, assistantMessage,
                                now.plusMillis(1), !generated.isEmpty())));
            }
            int offset = generated.isEmpty() ? 0
                    : retrySupport.call("count content " + subjectId,
                            () -> persistencePort.loadContentFeedBySubject(userId, subjectId).size());
            for (int i = 0; i < generated.size(); i++) {
                ContentFeedItem item = ContentFeedItem.from(userId, generated.get(i), offset + i);
                retrySupport.run("save content " + item.getId(), () -> persistencePort.saveContentItem(item));
            }
        });
    }

    private static PersistedMessage message(String userId, String subjectId, String role, String content,
            Instant timestamp, boolean hasGeneratedContent) {
        return PersistedMessage.builder()
                .id("msg_" + UUID.randomUUID())
                .userId(userId)
                .subjectId(subjectId)
                .role(role)
                .content(content)
                .timestamp(timestamp)
                .hasGeneratedContent(hasGeneratedContent)
                .build();
    }
}
