package com.bulwark.controller;

import com.bulwark.exception.CircuitOpenException;
import com.bulwark.exception.ClientErrorException;
import com.bulwark.exception.DeadlineExceededException;
import com.bulwark.exception.PoolExhaustedException;
import com.bulwark.exception.RateLimitedException;
import com.bulwark.exception.ResilienceException;
import com.bulwark.exception.UnknownProviderException;
import com.bulwark.exception.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures to RFC 7807 problem responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ResilienceException.class)
    public ResponseEntity<ProblemDetail> handleResilience(ResilienceException e) {
        HttpStatus status = statusFor(e);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, e.getMessage());
        problem.setTitle(titleFor(e));
        if (e.getProviderKey() != null) {
            problem.setProperty("provider", e.getProviderKey().getName());
        }
        problem.setProperty("stage", e.getStage().name());
        problem.setProperty("disposition", e.getDisposition().name());

        if (status.is5xxServerError() && !(e instanceof CircuitOpenException)) {
            log.warn("Request failed at {} for {}: {}", e.getStage(), e.getProviderKey(), e.getMessage());
        }
        return ResponseEntity.status(status).body(problem);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleBadRequest(IllegalArgumentException e) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, e.getMessage());
        problem.setTitle("Invalid request");
        return ResponseEntity.badRequest().body(problem);
    }

    static HttpStatus statusFor(ResilienceException e) {
        if (e instanceof RateLimitedException) {
            return HttpStatus.TOO_MANY_REQUESTS;
        }
        if (e instanceof CircuitOpenException || e instanceof PoolExhaustedException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (e instanceof UpstreamException) {
            return HttpStatus.BAD_GATEWAY;
        }
        if (e instanceof ClientErrorException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (e instanceof DeadlineExceededException) {
            return HttpStatus.GATEWAY_TIMEOUT;
        }
        if (e instanceof UnknownProviderException) {
            return HttpStatus.NOT_FOUND;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static String titleFor(ResilienceException e) {
        if (e instanceof RateLimitedException) {
            return "Rate limited";
        }
        if (e instanceof CircuitOpenException) {
            return "Circuit open";
        }
        if (e instanceof PoolExhaustedException) {
            return "Connection pool exhausted";
        }
        if (e instanceof DeadlineExceededException) {
            return "Deadline exceeded";
        }
        if (e instanceof ClientErrorException) {
            return "Invalid request";
        }
        if (e instanceof UnknownProviderException) {
            return "Unknown provider";
        }
        return "Provider call failed";
    }
}
