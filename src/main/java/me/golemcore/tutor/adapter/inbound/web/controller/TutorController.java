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
import me.golemcore.tutor.adapter.inbound.web.dto.InteractionRequest;
import me.golemcore.tutor.adapter.inbound.web.dto.SendMessageRequest;
import me.golemcore.tutor.domain.loop.TutorOrchestrator;
import me.golemcore.tutor.domain.model.TutorContext;
import me.golemcore.tutor.domain.model.TutorResponse;
import me.golemcore.tutor.domain.model.TutorTurnRequest;
import me.golemcore.tutor.domain.service.TutorContextService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;

/**
 * Conversation endpoints: learner messages, component interactions and the
 * current context.
 *
 * <p>
 * A turn blocks while the assistant run is polled, so turns run on the
 * bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/tutor")
@RequiredArgsConstructor
public class TutorController {

    private final TutorOrchestrator orchestrator;
    private final TutorContextService contextService;

    @PostMapping("/messages")
    public Mono<ResponseEntity<TutorResponse>> sendMessage(@RequestBody(required = false) SendMessageRequest request) {
        if (request == null || isBlank(request.getUserId())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "userId is required");
        }
        if (isBlank(request.getMessage())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "message is required");
        }

        if (request.getTimeoutMs() != null && request.getTimeoutMs() <= 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "timeoutMs must be positive");
        }

        TutorTurnRequest turn = TutorTurnRequest.builder()
                .userId(request.getUserId())
                .subjectId(blankToNull(request.getSubjectId()))
                .message(request.getMessage())
                .overrides(request.getContext())
                .timeout(request.getTimeoutMs() != null ? Duration.ofMillis(request.getTimeoutMs()) : null)
                .build();
        return Mono.fromCallable(() -> ResponseEntity.ok(orchestrator.respond(turn)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/interactions")
    public Mono<ResponseEntity<TutorResponse>> interact(@RequestBody(required = false) InteractionRequest request) {
        if (request == null || isBlank(request.getUserId())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "userId is required");
        }
        if (isBlank(request.getAction())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "action is required");
        }

        return Mono.fromCallable(() -> ResponseEntity.ok(orchestrator.handleInteraction(request.getUserId(),
                blankToNull(request.getSubjectId()), request.getAction(), request.getData())))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/context")
    public Mono<ResponseEntity<TutorContext>> getContext(@RequestParam String userId,
            @RequestParam(required = false) String subjectId) {
        if (isBlank(userId)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "userId is required");
        }
        return Mono.fromCallable(() -> ResponseEntity.ok(
                contextService.withContext(userId, blankToNull(subjectId), contextService::snapshot)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value;
    }
}
