package com.scanreward.api.token.entities;

import lombok.Builder;
import lombok.Value;

/**
 * A predicate over {@link RewardToken} rows for aggregate queries. A {@literal null} field doesn't
 * restrict the result.
 */
@Value
@Builder
public class TokenFilter {

    TokenState state;

    String productName;

    String batchId;

    public static TokenFilter byState(TokenState state) {
        return TokenFilter.builder().state(state).build();
    }
}
