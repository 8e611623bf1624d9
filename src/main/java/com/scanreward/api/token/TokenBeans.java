package com.scanreward.api.token;

import lombok.NonNull;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

import static java.util.Objects.requireNonNullElse;

/**
 * Spring Beans used by the token package.
 */
@Configuration
class TokenBeans {

    @NonNull
    @Bean
    RewardPolicy rewardPolicy(@NonNull TokenConfiguration config) {
        switch (config.getRewardPolicy()) {
            case CONSTANT:
                return new RewardPolicy.Constant(config.getConstantRewardAmount());
            case TIERED_BY_BATCH:
                return new RewardPolicy.TieredByBatch(
                    requireNonNullElse(config.getBatchRewardAmounts(), Map.of()),
                    config.getConstantRewardAmount());
            case RANDOMIZED:
                return new RewardPolicy.Randomized(
                    TokenIdGenerator.createSecureRandom(config.getSecureRandomAlgorithm()),
                    config.getRandomRewardMin(),
                    config.getRandomRewardMax());
            default:
                throw new IllegalArgumentException("unsupported reward policy: " + config.getRewardPolicy());
        }
    }
}
