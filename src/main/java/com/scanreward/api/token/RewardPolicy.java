package com.scanreward.api.token;

import com.scanreward.api.token.entities.RewardToken;
import lombok.NonNull;

import java.security.SecureRandom;
import java.util.Map;

/**
 * {@link RewardPolicy} decides the reward amount that a token yields on redemption. There are three
 * implementations available for {@link RewardPolicy}: {@link Constant Constant}, {@link
 * TieredByBatch TieredByBatch} and {@link Randomized Randomized}.
 */
interface RewardPolicy {

    /**
     * @param token the token being redeemed.
     * @return the reward amount to assign to the {@code token}.
     */
    long amountFor(@NonNull RewardToken token);


    /**
     * {@link Constant} assigns the same amount to every token.
     */
    class Constant implements RewardPolicy {

        private final long amount;

        Constant(long amount) {
            this.amount = amount;
        }

        @Override
        public long amountFor(@NonNull RewardToken token) {
            return amount;
        }
    }

    /**
     * {@link TieredByBatch} looks up the amount by the token's batch id and falls back to a default
     * amount for batches without a tier.
     */
    class TieredByBatch implements RewardPolicy {

        private final Map<String, Long> amounts;
        private final long defaultAmount;

        TieredByBatch(@NonNull Map<String, Long> amounts, long defaultAmount) {
            this.amounts = Map.copyOf(amounts);
            this.defaultAmount = defaultAmount;
        }

        @Override
        public long amountFor(@NonNull RewardToken token) {
            return amounts.getOrDefault(token.getBatchId(), defaultAmount);
        }
    }

    /**
     * {@link Randomized} draws a uniformly distributed amount from {@code [min, max]}. Amounts are
     * drawn from a {@link SecureRandom} so that they can't be predicted from earlier redemptions.
     * The range must hold at most {@link Long#MAX_VALUE} values.
     */
    class Randomized implements RewardPolicy {

        private final SecureRandom random;
        private final long min;
        private final long max;

        Randomized(@NonNull SecureRandom random, long min, long max) {
            // min >= 0 keeps max - min from overflowing, but the bound max - min + 1 still can.
            if (min < 0 || max < min || max - min == Long.MAX_VALUE) {
                throw new IllegalArgumentException(String.format("invalid reward range: [%d, %d]", min, max));
            }

            this.random = random;
            this.min = min;
            this.max = max;
        }

        @Override
        public long amountFor(@NonNull RewardToken token) {
            return min + random.nextLong(max - min + 1);
        }
    }
}
