package com.scanreward.api.token.exceptions;

/**
 * Thrown by redeem operation in RedemptionService if the requested token has expired.
 */
public class TokenExpiredException extends Exception {
}
