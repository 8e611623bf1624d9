package com.scanreward.api.token.exceptions;

/**
 * Thrown by operations in the token package if no token exists with the requested id.
 */
public class TokenNotFoundException extends Exception {
}
