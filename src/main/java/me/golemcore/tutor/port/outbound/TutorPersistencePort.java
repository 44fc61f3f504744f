package me.golemcore.tutor.port.outbound;

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

import me.golemcore.tutor.domain.model.ContentFeedItem;
import me.golemcore.tutor.domain.model.PersistedMessage;
import me.golemcore.tutor.domain.model.SessionHandle;
import me.golemcore.tutor.domain.model.Subject;
import me.golemcore.tutor.domain.model.TutorContext;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage of tutoring state.
 *
 * <p>
 * Every operation may be retried by the caller. Saving a message or content
 * item whose id already exists raises {@link DuplicateRecordException}, which
 * callers treat as already saved. Other storage failures surface as
 * {@link PersistenceException}.
 */
public interface TutorPersistencePort {

    Optional<TutorContext> loadContext(String userId, String subjectId);

    void saveContext(String userId, String subjectId, TutorContext context);

    void saveSubject(String userId, Subject subject);

    List<Subject> loadSubjectsByUser(String userId);

    /**
     * Delete a subject together with its context, messages, content feed and
     * session handle.
     */
    void deleteSubject(String userId, String subjectId);

    void saveMessage(PersistedMessage message);

    List<PersistedMessage> loadMessagesBySubject(String userId, String subjectId);

    void saveContentItem(ContentFeedItem item);

    List<ContentFeedItem> loadContentFeedBySubject(String userId, String subjectId);

    Optional<SessionHandle> loadSessionHandle(String subjectId);

    void saveSessionHandle(SessionHandle handle);

    void deleteSessionHandle(String subjectId);
}
