package com.bulwark.controller;

import com.bulwark.exception.CircuitOpenException;
import com.bulwark.exception.ClientErrorException;
import com.bulwark.exception.DeadlineExceededException;
import com.bulwark.exception.FailureStage;
import com.bulwark.exception.PoolExhaustedException;
import com.bulwark.exception.RateLimitedException;
import com.bulwark.exception.UnknownProviderException;
import com.bulwark.exception.UpstreamException;
import com.bulwark.model.ProviderKey;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

class ApiExceptionHandlerTest {

    private static final ProviderKey KEY = ProviderKey.of("openai");

    private final ApiExceptionHandler handler = new ApiExceptionHandler();

    @Test
    void mapsEachFailureToItsStatus() {
        assertEquals(HttpStatus.TOO_MANY_REQUESTS, ApiExceptionHandler.statusFor(new RateLimitedException(KEY, "slow down")));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, ApiExceptionHandler.statusFor(new CircuitOpenException(KEY, "open")));
        assertEquals(HttpStatus.SERVICE_UNAVAILABLE, ApiExceptionHandler.statusFor(new PoolExhaustedException(KEY, "full")));
        assertEquals(HttpStatus.BAD_GATEWAY, ApiExceptionHandler.statusFor(new UpstreamException(KEY, 500, "boom", null)));
        assertEquals(HttpStatus.BAD_REQUEST, ApiExceptionHandler.statusFor(
                new ClientErrorException(KEY, FailureStage.UPSTREAM_CALL, 422, "bad", null)));
        assertEquals(HttpStatus.GATEWAY_TIMEOUT, ApiExceptionHandler.statusFor(
                new DeadlineExceededException(KEY, FailureStage.UPSTREAM_CALL, "late", null)));
        assertEquals(HttpStatus.NOT_FOUND, ApiExceptionHandler.statusFor(new UnknownProviderException(KEY)));
    }

    @Test
    void problemCarriesProviderStageAndDisposition() {
        ResponseEntity<ProblemDetail> response = handler.handleResilience(
                new DeadlineExceededException(KEY, FailureStage.RATE_LIMIT, "late", null));

        assertEquals(504, response.getStatusCode().value());
        ProblemDetail problem = response.getBody();
        assertNotNull(problem);
        assertEquals("Deadline exceeded", problem.getTitle());
        assertEquals("openai", problem.getProperties().get("provider"));
        assertEquals("RATE_LIMIT", problem.getProperties().get("stage"));
        assertEquals("RETRY_LATER", problem.getProperties().get("disposition"));
    }

    @Test
    void illegalArgumentsAreBadRequests() {
        ResponseEntity<ProblemDetail> response = handler.handleBadRequest(new IllegalArgumentException("no model"));

        assertEquals(400, response.getStatusCode().value());
        assertEquals("no model", response.getBody().getDetail());
    }
}
