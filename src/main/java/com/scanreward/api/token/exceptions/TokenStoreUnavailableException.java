package com.scanreward.api.token.exceptions;

/**
 * Thrown by TokenStore operations if the database is unreachable or doesn't respond in time. The
 * failed operation is safe to retry.
 */
public class TokenStoreUnavailableException extends Exception {

    public TokenStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
