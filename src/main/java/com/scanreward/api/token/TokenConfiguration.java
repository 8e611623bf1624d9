package com.scanreward.api.token;

import com.scanreward.api.platform.validation.annotations.HttpUrl;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.Map;

/**
 * Configuration properties used by various components in the token package.
 */
@Validated
@ConfigurationProperties("app.tokens")
@Data
class TokenConfiguration {

    /**
     * {@link RewardPolicy} to use for assigning reward amounts on redemption.
     */
    @NotNull
    private final RewardPolicyType rewardPolicy;

    /**
     * Reward amount used by {@link RewardPolicy.Constant}, and the fallback for batches without a
     * tier in {@link #batchRewardAmounts}.
     */
    @PositiveOrZero
    private final long constantRewardAmount;

    /**
     * Reward amounts keyed by batch id, used by {@link RewardPolicy.TieredByBatch}.
     */
    private final Map<String, @NotNull @PositiveOrZero Long> batchRewardAmounts;

    /**
     * Inclusive lower bound of the amounts drawn by {@link RewardPolicy.Randomized}.
     */
    @PositiveOrZero
    private final long randomRewardMin;

    /**
     * Inclusive upper bound of the amounts drawn by {@link RewardPolicy.Randomized}.
     */
    @PositiveOrZero
    private final long randomRewardMax;

    /**
     * Base of the URLs encoded in printed QR codes. Issued token ids are appended to it as the last
     * path segment.
     */
    @NotBlank
    @HttpUrl
    private final String redemptionBaseUrl;

    /**
     * Optional {@link java.security.SecureRandom} algorithm name, e.g. {@code NativePRNGNonBlocking}.
     * The platform default is used when it is blank.
     */
    private final String secureRandomAlgorithm;

    public enum RewardPolicyType {
        CONSTANT,
        TIERED_BY_BATCH,
        RANDOMIZED
    }
}
