package com.scanreward.api.token.exceptions;

/**
 * Thrown by {@link com.scanreward.api.token.TokenIdGenerator} if the secure random source can't be
 * used.
 */
public class EntropySourceUnavailableException extends RuntimeException {

    public EntropySourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
