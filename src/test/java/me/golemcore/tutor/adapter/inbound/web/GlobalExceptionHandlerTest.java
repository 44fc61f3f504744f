package me.golemcore.tutor.adapter.inbound.web;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void shouldKeepStatusOfResponseStatusException() {
        StepVerifier.create(handler.handleResponseStatus(
                new ResponseStatusException(HttpStatus.BAD_REQUEST, "userId is required")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("userId is required", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapDomainExceptions() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("Subject name is required")))
                .assertNext(response -> assertEquals(400, response.getBody().getStatus()))
                .verifyComplete();
        StepVerifier.create(handler.handleIllegalState(new IllegalStateException("No lesson plan")))
                .assertNext(response -> assertEquals(HttpStatus.CONFLICT, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldHideDetailsOfUnexpectedErrors() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("secret path /etc")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
