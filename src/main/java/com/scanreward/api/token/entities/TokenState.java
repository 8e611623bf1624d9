package com.scanreward.api.token.entities;

import lombok.NonNull;

/**
 * Redemption state of a {@link RewardToken}. {@link #UNREDEEMED} to {@link #REDEEMED} is the only
 * allowed transition; {@link #REDEEMED} is terminal.
 */
public enum TokenState {
    UNREDEEMED,
    REDEEMED;

    /**
     * @param next the proposed state.
     * @return whether a token in this state may move to {@code next}.
     */
    public boolean canTransitionTo(@NonNull TokenState next) {
        return this == UNREDEEMED && next == REDEEMED;
    }
}
