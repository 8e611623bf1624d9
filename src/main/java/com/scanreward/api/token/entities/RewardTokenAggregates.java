package com.scanreward.api.token.entities;

import lombok.NonNull;

/**
 * Aggregate queries over {@link RewardToken} rows whose criteria are only known at runtime.
 */
public interface RewardTokenAggregates {

    /**
     * Sums the amounts of all tokens that match the given {@code filter}.
     *
     * @param filter must not be {@literal null}.
     * @return the sum of matching amounts; {@literal 0} if no token matches.
     */
    long sumAmountMatching(@NonNull TokenFilter filter);
}
