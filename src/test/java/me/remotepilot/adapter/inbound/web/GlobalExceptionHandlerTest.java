package me.remotepilot.adapter.inbound.web;

import me.remotepilot.domain.model.RateLimitResult;
import me.remotepilot.ratelimit.RateLimitExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldMapRateLimitTo429WithRetryHeaders() {
        RateLimitResult denied = RateLimitResult.builder()
                .allowed(false)
                .resetIn(Duration.ofMillis(41_200))
                .build();

        StepVerifier.create(handler.handleRateLimit(new RateLimitExceededException(denied)))
                .assertNext(response -> {
                    assertEquals(HttpStatus.TOO_MANY_REQUESTS, response.getStatusCode());
                    assertEquals("42", response.getHeaders().getFirst("X-RateLimit-Reset"));
                    assertEquals("42", response.getHeaders().getFirst(HttpHeaders.RETRY_AFTER));
                    assertEquals("Rate limit exceeded", response.getBody().getError());
                    assertEquals(42, response.getBody().getRetryAfterSeconds());
                })
                .verifyComplete();
    }

    @Test
    void shouldKeepResponseStatus() {
        StepVerifier.create(handler.handleResponseStatus(
                new ResponseStatusException(HttpStatus.BAD_REQUEST, "message is required")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("message is required", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalArgumentTo400() {
        StepVerifier.create(handler.handleIllegalArgument(new IllegalArgumentException("bad session id")))
                .assertNext(response -> assertEquals(400, response.getBody().getStatus()))
                .verifyComplete();
    }

    @Test
    void shouldMapIllegalStateTo409() {
        StepVerifier.create(handler.handleIllegalState(new IllegalStateException("Duplicate schedule id")))
                .assertNext(response -> assertEquals(HttpStatus.CONFLICT, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldHideInternalErrorDetails() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("NPE in orchestrator")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }
}
