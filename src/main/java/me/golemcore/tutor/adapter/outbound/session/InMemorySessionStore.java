package me.golemcore.tutor.adapter.outbound.session;

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

import me.golemcore.tutor.domain.model.SessionHandle;
import me.golemcore.tutor.port.outbound.SessionStore;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local session handles. Lost on restart; durable handles are kept by
 * the persistence port.
 */
@Component
public class InMemorySessionStore implements SessionStore {

    private final Map<String, SessionHandle> handles = new ConcurrentHashMap<>();

    @Override
    public Optional<SessionHandle> get(String subjectId) {
        return Optional.ofNullable(handles.get(subjectId));
    }

    @Override
    public SessionHandle putIfAbsent(SessionHandle handle) {
        SessionHandle existing = handles.putIfAbsent(handle.getSubjectId(), handle);
        return existing != null ? existing : handle;
    }

    @Override
    public Optional<SessionHandle> delete(String subjectId) {
        return Optional.ofNullable(handles.remove(subjectId));
    }
}
