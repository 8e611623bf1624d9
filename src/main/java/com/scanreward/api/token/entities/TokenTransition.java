package com.scanreward.api.token.entities;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * New field values that a conditional state transition applies to a {@link RewardToken}.
 */
@Value
@Builder
public class TokenTransition {

    @NonNull
    TokenState state;

    long amount;

    @NonNull
    OffsetDateTime redeemedAt;

    /**
     * @return a transition to {@link TokenState#REDEEMED} that assigns the given reward {@code
     * amount} at {@code redeemedAt}.
     */
    @NonNull
    public static TokenTransition redeem(long amount, @NonNull OffsetDateTime redeemedAt) {
        return new TokenTransition(TokenState.REDEEMED, amount, redeemedAt);
    }
}
