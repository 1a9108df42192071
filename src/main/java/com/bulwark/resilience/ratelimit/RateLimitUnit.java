package com.bulwark.resilience.ratelimit;

/**
 * What one bucket token stands for.
 */
public enum RateLimitUnit {

    /**
     * One token per outbound call.
     */
    REQUESTS,

    /**
     * One token per estimated LLM token of the request.
     */
    TOKENS
}
