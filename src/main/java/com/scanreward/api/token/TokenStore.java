package com.scanreward.api.token;

import com.scanreward.api.token.entities.ProductTokenCount;
import com.scanreward.api.token.entities.RewardToken;
import com.scanreward.api.token.entities.TokenFilter;
import com.scanreward.api.token.entities.TokenState;
import com.scanreward.api.token.entities.TokenTransition;
import com.scanreward.api.token.exceptions.DuplicateTokenIdException;
import com.scanreward.api.token.exceptions.TokenStoreUnavailableException;
import lombok.NonNull;

import java.util.List;
import java.util.Optional;

/**
 * Durable record of every issued {@link RewardToken} and its redemption state.
 * <p>
 * All reads are evaluated by a single query, so each token's fields are always observed together.
 * {@link #compareAndTransition} is the only way to mutate a stored token.</p>
 */
public interface TokenStore {

    /**
     * Persists all given tokens, or none of them.
     *
     * @param tokens new tokens; must not be {@literal null} or empty.
     * @throws DuplicateTokenIdException      if any token id repeats within the batch or already
     *                                        exists in the store.
     * @throws TokenStoreUnavailableException if the store can't be reached.
     * @throws org.springframework.dao.DataIntegrityViolationException if a token violates any
     *                                        other constraint of the store.
     */
    void insertBatch(@NonNull List<RewardToken> tokens) throws DuplicateTokenIdException, TokenStoreUnavailableException;

    /**
     * @param id must not be {@literal null}.
     * @return the token with the given id, or {@link Optional#empty()} if none exists.
     * @throws TokenStoreUnavailableException if the store can't be reached.
     */
    @NonNull
    Optional<RewardToken> findById(@NonNull String id) throws TokenStoreUnavailableException;

    /**
     * Atomically applies the {@code transition} to the token with the given {@code id} if its
     * stored state still equals {@code expectedState} at the time of the write.
     *
     * @return {@literal true} if the transition was applied, {@literal false} on conflict, i.e. the
     * stored state differed or the token doesn't exist. A conflict has no side effects.
     * @throws IllegalArgumentException       if {@code expectedState} can't transition to the
     *                                        {@code transition}'s state.
     * @throws TokenStoreUnavailableException if the store can't be reached. The outcome of the
     *                                        write is then unknown, but retrying is safe.
     */
    boolean compareAndTransition(
        @NonNull String id,
        @NonNull TokenState expectedState,
        @NonNull TokenTransition transition
    ) throws TokenStoreUnavailableException;

    /**
     * @return the total number of issued tokens.
     * @throws TokenStoreUnavailableException if the store can't be reached.
     */
    long count() throws TokenStoreUnavailableException;

    /**
     * @return the number of tokens in the given {@code state}.
     * @throws TokenStoreUnavailableException if the store can't be reached.
     */
    long countByState(@NonNull TokenState state) throws TokenStoreUnavailableException;

    /**
     * @return the sum of amounts of all tokens matching the {@code filter}.
     * @throws TokenStoreUnavailableException if the store can't be reached.
     */
    long sumAmountWhere(@NonNull TokenFilter filter) throws TokenStoreUnavailableException;

    /**
     * @return the number of issued and redeemed tokens for each product, ordered by product name.
     * @throws TokenStoreUnavailableException if the store can't be reached.
     */
    @NonNull
    List<ProductTokenCount> groupCountByProduct() throws TokenStoreUnavailableException;
}
