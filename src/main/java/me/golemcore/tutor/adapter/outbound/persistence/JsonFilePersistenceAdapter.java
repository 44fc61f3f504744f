package me.golemcore.tutor.adapter.outbound.persistence;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tutor.domain.model.ContentFeedItem;
import me.golemcore.tutor.domain.model.PersistedMessage;
import me.golemcore.tutor.domain.model.SessionHandle;
import me.golemcore.tutor.domain.model.Subject;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.port.outbound.DuplicateRecordException;
import me.golemcore.tutor.port.outbound.PersistenceException;
import me.golemcore.tutor.port.outbound.StoragePort;
import me.golemcore.tutor.port.outbound.TutorPersistencePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * {@link TutorPersistencePort} backed by JSON and JSONL files in the local
 * workspace.
 *
 * <p>
 * Contexts, subject indexes and session handles are whole-file JSON documents
 * written atomically. Messages and content feed items are append-only JSONL
 * logs; appending an id that is already present raises
 * {@link DuplicateRecordException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonFilePersistenceAdapter implements TutorPersistencePort {

    static final String CONTEXTS_DIR = "contexts";
    static final String SUBJECTS_DIR = "subjects";
    static final String MESSAGES_DIR = "messages";
    static final String CONTENT_DIR = "content";
    static final String SESSIONS_DIR = "sessions";

    private static final TypeReference<List<Subject>> SUBJECT_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private final Map<String, Object> fileLocks = new ConcurrentHashMap<>();

    // ==================== Context ====================

    @Override
    public Optional<TutorContext> loadContext(String userId, String subjectId) {
        String json = await(storagePort.getText(CONTEXTS_DIR, contextPath(userId, subjectId)));
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(read(json, TutorContext.class));
    }

    @Override
    public void saveContext(String userId, String subjectId, TutorContext context) {
        String path = contextPath(userId, subjectId);
        synchronized (lockFor(CONTEXTS_DIR, path)) {
            await(storagePort.putTextAtomic(CONTEXTS_DIR, path, write(context), true));
        }
        log.debug("[Persistence] Saved context {}/{}", userId, subjectId);
    }

    // ==================== Subjects ====================

    @Override
    public void saveSubject(String userId, Subject subject) {
        String path = subjectsPath(userId);
        synchronized (lockFor(SUBJECTS_DIR, path)) {
            List<Subject> subjects = new ArrayList<>(loadSubjectsByUser(userId));
            subjects.removeIf(existing -> existing.getId().equals(subject.getId()));
            subjects.add(subject);
            await(storagePort.putTextAtomic(SUBJECTS_DIR, path, write(subjects), false));
        }
    }

    @Override
    public List<Subject> loadSubjectsByUser(String userId) {
        String json = await(storagePort.getText(SUBJECTS_DIR, subjectsPath(userId)));
        if (json == null || json.isBlank()) {
            return List.of();
        }
        List<Subject> subjects = new ArrayList<>(read(json, SUBJECT_LIST_TYPE_REF));
        subjects.sort(Comparator.comparing(Subject::getLastActiveAt,
                Comparator.nullsLast(Comparator.reverseOrder())));
        return subjects;
    }

    @Override
    public void deleteSubject(String userId, String subjectId) {
        String path = subjectsPath(userId);
        synchronized (lockFor(SUBJECTS_DIR, path)) {
            List<Subject> subjects = new ArrayList<>(loadSubjectsByUser(userId));
            if (subjects.removeIf(existing -> existing.getId().equals(subjectId))) {
                await(storagePort.putTextAtomic(SUBJECTS_DIR, path, write(subjects), false));
            }
        }
        await(storagePort.deleteObject(CONTEXTS_DIR, contextPath(userId, subjectId)));
        await(storagePort.deleteObject(MESSAGES_DIR, logPath(userId, subjectId)));
        await(storagePort.deleteObject(CONTENT_DIR, logPath(userId, subjectId)));
        deleteSessionHandle(subjectId);
        log.info("[Persistence] Deleted subject {} for user {}", subjectId, userId);
    }

    // ==================== Messages & content ====================

    @Override
    public void saveMessage(PersistedMessage message) {
        appendUnique(MESSAGES_DIR, logPath(message.getUserId(), message.getSubjectId()), message.getId(),
                message, PersistedMessage.class, PersistedMessage::getId);
    }

    @Override
    public List<PersistedMessage> loadMessagesBySubject(String userId, String subjectId) {
        List<PersistedMessage> messages = readLog(MESSAGES_DIR, logPath(userId, subjectId), PersistedMessage.class);
        messages.sort(Comparator.comparing(PersistedMessage::getTimestamp,
                Comparator.nullsFirst(Comparator.naturalOrder())));
        return messages;
    }

    @Override
    public void saveContentItem(ContentFeedItem item) {
        appendUnique(CONTENT_DIR, logPath(item.getUserId(), item.getSubjectId()), item.getId(),
                item, ContentFeedItem.class, ContentFeedItem::getId);
    }

    @Override
    public List<ContentFeedItem> loadContentFeedBySubject(String userId, String subjectId) {
        List<ContentFeedItem> items = readLog(CONTENT_DIR, logPath(userId, subjectId), ContentFeedItem.class);
        items.sort(Comparator.comparingInt(ContentFeedItem::getOrderIndex));
        return items;
    }

    // ==================== Session handles ====================

    @Override
    public Optional<SessionHandle> loadSessionHandle(String subjectId) {
        String json = await(storagePort.getText(SESSIONS_DIR, sessionPath(subjectId)));
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(read(json, SessionHandle.class));
    }

    @Override
    public void saveSessionHandle(SessionHandle handle) {
        await(storagePort.putTextAtomic(SESSIONS_DIR, sessionPath(handle.getSubjectId()), write(handle), false));
    }

    @Override
    public void deleteSessionHandle(String subjectId) {
        await(storagePort.deleteObject(SESSIONS_DIR, sessionPath(subjectId)));
    }

    // ==================== Helpers ====================

    private <T> void appendUnique(String directory, String path, String id, T record, Class<T> type,
            Function<T, String> idOf) {
        if (id == null || id.isBlank()) {
            throw new PersistenceException("Record id is required for " + directory, null, false);
        }
        synchronized (lockFor(directory, path)) {
            boolean exists = readLog(directory, path, type).stream()
                    .anyMatch(existing -> id.equals(idOf.apply(existing)));
            if (exists) {
                throw new DuplicateRecordException("Record " + id + " already stored in " + directory);
            }
            await(storagePort.appendText(directory, path, write(record) + "\n"));
        }
    }

    private <T> List<T> readLog(String directory, String path, Class<T> type) {
        String content = await(storagePort.getText(directory, path));
        List<T> records = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return records;
        }
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(objectMapper.readValue(line, type));
            } catch (JsonProcessingException e) {
                log.warn("[Persistence] Skipping corrupt line in {}/{}: {}", directory, path, e.getMessage());
            }
        }
        return records;
    }

    private Object lockFor(String directory, String path) {
        return fileLocks.computeIfAbsent(directory + "/" + path, key -> new Object());
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize " + value.getClass().getSimpleName(), e, false);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to parse " + type.getSimpleName(), e, false);
        }
    }

    private <T> T read(String json, TypeReference<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to parse " + type.getType().getTypeName(), e, false);
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof PersistenceException persistenceException) {
                throw persistenceException;
            }
            throw new PersistenceException("Storage operation failed: " + cause.getMessage(), cause);
        }
    }

    private static String contextPath(String userId, String subjectId) {
        return segment(userId) + "/" + segment(subjectId) + ".json";
    }

    private static String subjectsPath(String userId) {
        return segment(userId) + ".json";
    }

    private static String logPath(String userId, String subjectId) {
        return segment(userId) + "/" + segment(subjectId) + ".jsonl";
    }

    private static String sessionPath(String subjectId) {
        return segment(subjectId) + ".json";
    }

    static String segment(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Identifier must not be blank");
        }
        return raw.replaceAll("[^A-Za-z0-9_.-]", "_").replace("..", "_");
    }
}
