package com.bulwark.service;

import com.bulwark.exception.ClientErrorException;
import com.bulwark.exception.DeadlineExceededException;
import com.bulwark.exception.FailureStage;
import com.bulwark.exception.ResilienceException;
import com.bulwark.exception.UpstreamException;
import com.bulwark.model.ProviderKey;
import com.bulwark.provider.ProviderProtocolException;
import lombok.Value;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.util.concurrent.TimeoutException;

/**
 * Maps errors raised during a provider call to typed failures and decides
 * whether they count against the circuit breaker and whether the connection may be reused.
 *
 * <p>Timeouts, transport errors, 5xx, 408 and 429 count as provider failures.
 * Other 4xx answers and request conversion errors are the caller's fault and do not.
 */
public class FailureClassifier {

    public Classification classify(ProviderKey key, Throwable error) {
        Throwable cause = Exceptions.unwrap(error);

        if (cause instanceof ResilienceException) {
            ResilienceException resilience = (ResilienceException) cause;
            return new Classification(resilience, resilience instanceof UpstreamException, false);
        }

        if (cause instanceof TimeoutException) {
            return new Classification(
                    new DeadlineExceededException(key, FailureStage.UPSTREAM_CALL,
                            "Provider " + key + " did not answer before the deadline", cause),
                    true, true);
        }

        if (cause instanceof WebClientResponseException) {
            int status = ((WebClientResponseException) cause).getStatusCode().value();
            String message = "Provider " + key + " answered HTTP " + status;
            if (isClientError(status)) {
                return new Classification(
                        new ClientErrorException(key, FailureStage.UPSTREAM_CALL, status, message, cause),
                        false, false);
            }
            return new Classification(new UpstreamException(key, status, message, cause), true, false);
        }

        if (cause instanceof WebClientRequestException) {
            return new Classification(
                    new UpstreamException(key, null, "Request to provider " + key + " failed: " + cause.getMessage(), cause),
                    true, true);
        }

        if (cause instanceof ProviderProtocolException) {
            return new Classification(
                    new UpstreamException(key, null, cause.getMessage(), cause),
                    true, false);
        }

        if (cause instanceof IllegalArgumentException) {
            return new Classification(
                    new ClientErrorException(key, FailureStage.UPSTREAM_CALL, null, cause.getMessage(), cause),
                    false, false);
        }

        return new Classification(
                new UpstreamException(key, null, "Call to provider " + key + " failed: " + cause, cause),
                true, true);
    }

    static boolean isClientError(int status) {
        return status >= 400 && status < 500 && status != 408 && status != 429;
    }

    @Value
    public static class Classification {

        ResilienceException exception;

        /**
         * The failure says something about the provider's health.
         */
        boolean breakerFailure;

        /**
         * The connection's state is unknown and it must be discarded.
         */
        boolean discardConnection;
    }
}
