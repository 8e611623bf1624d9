package com.scanreward.api.token.exceptions;

/**
 * Thrown by redeem operation in RedemptionService if the requested token has already been
 * redeemed, including when a concurrent request redeemed it first.
 */
public class TokenAlreadyUsedException extends Exception {
}
