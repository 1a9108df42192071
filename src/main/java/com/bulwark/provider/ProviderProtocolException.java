package com.bulwark.provider;

/**
 * A provider answered successfully but its body could not be understood.
 */
public class ProviderProtocolException extends RuntimeException {

    public ProviderProtocolException(String message) {
        super(message);
    }

    public ProviderProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
