package me.golemcore.tutor.adapter.inbound.web.controller;

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
import me.golemcore.tutor.domain.model.ContentFeedItem;
import me.golemcore.tutor.domain.model.PersistedMessage;
import me.golemcore.tutor.domain.model.Subject;
import me.golemcore.tutor.domain.service.SubjectService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * REST endpoints for a learner's subjects and their message and content logs.
 */
@RestController
@RequestMapping("/api/subjects")
@RequiredArgsConstructor
public class SubjectsController {

    private final SubjectService subjectService;

    @GetMapping
    public Mono<ResponseEntity<List<Subject>>> listSubjects(@RequestParam String userId) {
        requireUser(userId);
        return Mono.fromCallable(() -> ResponseEntity.ok(subjectService.listSubjects(userId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/{subjectId}")
    public Mono<ResponseEntity<Void>> deleteSubject(@PathVariable String subjectId, @RequestParam String userId) {
        requireUser(userId);
        return Mono.fromCallable(() -> {
            subjectService.deleteSubject(userId, subjectId);
            return ResponseEntity.noContent().<Void>build();
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{subjectId}/messages")
    public Mono<ResponseEntity<List<PersistedMessage>>> getMessages(@PathVariable String subjectId,
            @RequestParam String userId) {
        requireUser(userId);
        return Mono.fromCallable(() -> ResponseEntity.ok(subjectService.loadMessages(userId, subjectId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{subjectId}/content")
    public Mono<ResponseEntity<List<ContentFeedItem>>> getContent(@PathVariable String subjectId,
            @RequestParam String userId) {
        requireUser(userId);
        return Mono.fromCallable(() -> ResponseEntity.ok(subjectService.loadContentFeed(userId, subjectId)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "userId is required");
        }
    }
}
