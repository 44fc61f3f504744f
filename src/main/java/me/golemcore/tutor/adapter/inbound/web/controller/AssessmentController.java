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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.tutor.adapter.inbound.web.dto.AssessmentSubmission;
import me.golemcore.tutor.domain.model.AssessmentRequest;
import me.golemcore.tutor.domain.model.AssessmentResult;
import me.golemcore.tutor.domain.service.AssessmentService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Graded assessment submissions for a lesson.
 */
@RestController
@RequestMapping("/api/assessment")
@RequiredArgsConstructor
@Slf4j
public class AssessmentController {

    static final String INVALID_PARAMETERS = "Missing or invalid parameters";

    private final AssessmentService assessmentService;

    @PostMapping
    public Mono<ResponseEntity<AssessmentResult>> submit(@RequestBody(required = false) AssessmentSubmission request) {
        if (request == null || request.getUserId() == null || request.getUserId().isBlank()
                || request.getLessonId() == null || request.getLessonId().isBlank()
                || request.getScore() == null || request.getTotal() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, INVALID_PARAMETERS);
        }

        AssessmentRequest assessment = new AssessmentRequest(request.getLessonId(), request.getScore(),
                request.getTotal(), request.getDifficulty());
        log.debug("[API] Assessment for lesson {}: {}/{}", request.getLessonId(), request.getScore(),
                request.getTotal());
        return Mono.fromCallable(() -> {
            AssessmentResult result = assessmentService.processAssessment(request.getUserId(),
                    request.getSubjectId(), assessment);
            if (result.getError() != null) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND).body(result);
            }
            return ResponseEntity.ok(result);
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
