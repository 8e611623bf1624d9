package com.scanreward.api.token;

import com.scanreward.api.token.entities.TokenState;
import com.scanreward.api.token.entities.TokenTransition;
import com.scanreward.api.token.exceptions.TokenAlreadyUsedException;
import com.scanreward.api.token.exceptions.TokenExpiredException;
import com.scanreward.api.token.exceptions.TokenNotFoundException;
import com.scanreward.api.token.exceptions.TokenStoreUnavailableException;
import com.scanreward.api.token.payload.RedemptionResponse;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Redeems issued tokens. A token moves from {@link TokenState#UNREDEEMED UNREDEEMED} to {@link
 * TokenState#REDEEMED REDEEMED} at most once, and never after its expiry deadline.
 */
@Service
@Slf4j
public class RedemptionService {

    private final TokenStore tokenStore;
    private final RewardPolicy rewardPolicy;

    @Autowired
    RedemptionService(@NonNull TokenStore tokenStore, @NonNull RewardPolicy rewardPolicy) {
        this.tokenStore = tokenStore;
        this.rewardPolicy = rewardPolicy;
    }

    /**
     * <p>
     * Redeems the token with the given {@code tokenId} and assigns it the reward amount decided by
     * the configured {@link RewardPolicy}.</p>
     * <p>
     * The expiry check precedes the used check, so a redeemed token past its deadline reports
     * {@link TokenExpiredException}. When several requests race to redeem the same token, exactly
     * one of them succeeds and the rest fail with {@link TokenAlreadyUsedException}.</p>
     * <p>
     * The redemption timestamp is never earlier than the token's creation timestamp, even if the
     * issuing instance's clock ran ahead of this one.</p>
     *
     * @param tokenId must not be {@literal null}.
     * @return the assigned reward amount and the redemption timestamp.
     * @throws TokenNotFoundException         if no token exists with the given id.
     * @throws TokenExpiredException          if the token's expiry deadline has passed.
     * @throws TokenAlreadyUsedException      if the token has already been redeemed.
     * @throws TokenStoreUnavailableException if the token store can't be reached. Retrying is safe.
     */
    @NonNull
    public RedemptionResponse redeem(@NonNull String tokenId) throws
        TokenNotFoundException,
        TokenExpiredException,
        TokenAlreadyUsedException,
        TokenStoreUnavailableException {
        val token = tokenStore.findById(tokenId).orElseThrow(TokenNotFoundException::new);
        // timestamps are stored with microsecond precision.
        val now = OffsetDateTime.now().truncatedTo(ChronoUnit.MICROS);
        if (token.isExpiredAt(now)) {
            log.debug("refused to redeem expired token from batch '{}'", token.getBatchId());
            throw new TokenExpiredException();
        }

        if (token.getState() == TokenState.REDEEMED) {
            throw new TokenAlreadyUsedException();
        }

        val redeemedAt = now.isBefore(token.getCreatedAt()) ? token.getCreatedAt() : now;
        val amount = rewardPolicy.amountFor(token);
        if (!tokenStore.compareAndTransition(tokenId, TokenState.UNREDEEMED, TokenTransition.redeem(amount, redeemedAt))) {
            log.debug("lost a concurrent redemption race for a token from batch '{}'", token.getBatchId());
            throw new TokenAlreadyUsedException();
        }

        log.debug("redeemed token from batch '{}' for amount {}", token.getBatchId(), amount);
        return RedemptionResponse.builder()
            .amount(amount)
            .redeemedAt(redeemedAt)
            .build();
    }
}
