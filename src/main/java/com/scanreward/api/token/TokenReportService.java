package com.scanreward.api.token;

import com.scanreward.api.platform.transaction.annotations.SnapshotReadTransactional;
import com.scanreward.api.token.entities.RewardToken;
import com.scanreward.api.token.entities.TokenFilter;
import com.scanreward.api.token.entities.TokenState;
import com.scanreward.api.token.exceptions.TokenNotFoundException;
import com.scanreward.api.token.exceptions.TokenStoreUnavailableException;
import com.scanreward.api.token.payload.DashboardStatsResponse;
import com.scanreward.api.token.payload.ProductStatsResponse;
import com.scanreward.api.token.payload.TokenResponse;
import lombok.NonNull;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read-only projections over the token store for administrators.
 */
@Service
public class TokenReportService {

    private final TokenStore tokenStore;

    @Autowired
    TokenReportService(@NonNull TokenStore tokenStore) {
        this.tokenStore = tokenStore;
    }

    /**
     * Counts issued, redeemed and remaining tokens, and sums the rewards paid for redeemed tokens.
     * All numbers are read from the same snapshot of the store, but redemptions that commit while
     * the snapshot is taken may not be reflected.
     *
     * @throws TokenStoreUnavailableException if the token store can't be reached.
     */
    @NonNull
    @SnapshotReadTransactional
    public DashboardStatsResponse getDashboardStats() throws TokenStoreUnavailableException {
        return DashboardStatsResponse.builder()
            .totalIssued(tokenStore.count())
            .redeemedCount(tokenStore.countByState(TokenState.REDEEMED))
            .remainingCount(tokenStore.countByState(TokenState.UNREDEEMED))
            .totalRewardPaid(tokenStore.sumAmountWhere(TokenFilter.byState(TokenState.REDEEMED)))
            .build();
    }

    /**
     * @return number of issued and redeemed tokens per product, ordered by product name.
     * @throws TokenStoreUnavailableException if the token store can't be reached.
     */
    @NonNull
    public List<ProductStatsResponse> getProductStats() throws TokenStoreUnavailableException {
        return tokenStore.groupCountByProduct()
            .stream()
            .map(c -> ProductStatsResponse.builder()
                .productName(c.getProductName())
                .total(c.getTotal())
                .redeemed(c.getRedeemed())
                .build())
            .toList();
    }

    /**
     * @param tokenId must not be {@literal null}.
     * @return the current state of the token with the given id.
     * @throws TokenNotFoundException         if no token exists with the given id.
     * @throws TokenStoreUnavailableException if the token store can't be reached.
     */
    @NonNull
    public TokenResponse getToken(@NonNull String tokenId) throws TokenNotFoundException, TokenStoreUnavailableException {
        return tokenStore.findById(tokenId)
            .map(TokenReportService::buildTokenResponse)
            .orElseThrow(TokenNotFoundException::new);
    }

    @NonNull
    private static TokenResponse buildTokenResponse(@NonNull RewardToken token) {
        return TokenResponse.builder()
            .id(token.getId())
            .productName(token.getProductName())
            .batchId(token.getBatchId())
            .state(token.getState())
            .amount(token.getAmount())
            .createdAt(token.getCreatedAt())
            .redeemedAt(token.getRedeemedAt())
            .expiresAt(token.getExpiresAt())
            .build();
    }
}
