package com.scanreward.api.token;

import com.scanreward.api.token.entities.RewardToken;
import com.scanreward.api.token.exceptions.DuplicateTokenIdException;
import com.scanreward.api.token.exceptions.TokenStoreUnavailableException;
import com.scanreward.api.token.payload.IssueBatchParams;
import com.scanreward.api.token.payload.IssuedBatchResponse;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.stream.IntStream;

import static org.apache.commons.lang3.StringUtils.removeEnd;

/**
 * Issues batches of new, unredeemed tokens.
 */
@Service
@Slf4j
public class TokenIssuanceService {

    private final TokenConfiguration config;
    private final TokenIdGenerator idGenerator;
    private final TokenStore tokenStore;

    @Autowired
    TokenIssuanceService(
        @NonNull TokenConfiguration config,
        @NonNull TokenIdGenerator idGenerator,
        @NonNull TokenStore tokenStore
    ) {
        this.config = config;
        this.idGenerator = idGenerator;
        this.tokenStore = tokenStore;
    }

    /**
     * Generates {@code params.count} new token ids and persists them as a single batch. Either all
     * tokens in the batch are issued, or none of them.
     *
     * @param params must not be {@literal null}.
     * @return the issued tokens with the urls to encode in their QR codes.
     * @throws DuplicateTokenIdException      if a generated id collides with another id. It points
     *                                        to a broken entropy source or a corrupt store, so it
     *                                        is logged as an integrity anomaly.
     * @throws TokenStoreUnavailableException if the token store can't be reached.
     * @throws com.scanreward.api.token.exceptions.EntropySourceUnavailableException if the secure
     *                                        random source fails.
     */
    @NonNull
    public IssuedBatchResponse issueBatch(@NonNull IssueBatchParams params) throws DuplicateTokenIdException, TokenStoreUnavailableException {
        val tokens = IntStream.range(0, params.getCount())
            .mapToObj(i -> RewardToken.builder()
                .id(idGenerator.generate())
                .productName(params.getProductName())
                .batchId(params.getBatchId())
                .expiresAt(params.getExpiresAt())
                .build())
            .toList();

        try {
            tokenStore.insertBatch(tokens);
        } catch (DuplicateTokenIdException e) {
            log.error("integrity anomaly: {} token id collision(s) while issuing batch '{}'",
                e.getIds().size(), params.getBatchId(), e);
            throw e;
        }

        log.info("issued {} tokens for product '{}' in batch '{}'", tokens.size(), params.getProductName(), params.getBatchId());
        val baseUrl = removeEnd(config.getRedemptionBaseUrl(), "/");
        return IssuedBatchResponse.builder()
            .productName(params.getProductName())
            .batchId(params.getBatchId())
            .expiresAt(params.getExpiresAt())
            .tokens(
                tokens.stream()
                    .map(t -> IssuedBatchResponse.IssuedToken.builder()
                        .id(t.getId())
                        .redemptionUrl(baseUrl + "/" + t.getId())
                        .build())
                    .toList())
            .build();
    }
}
