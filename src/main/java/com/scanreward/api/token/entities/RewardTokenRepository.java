package com.scanreward.api.token.entities;

import lombok.NonNull;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

/**
 * A JPA {@link Repository} declaration for database interactions of {@link RewardToken} entity.
 * <p>
 * Tokens are never deleted, and the only update path is {@link #updateStateIfCurrent}.</p>
 */
@Repository
public interface RewardTokenRepository extends CrudRepository<RewardToken, String>, RewardTokenAggregates {

    /**
     * Returns the ids among the given {@code ids} that already exist in the database.
     *
     * @param ids must not be {@literal null} or empty.
     * @return a guaranteed to be not {@literal null} list of existing ids.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e.id from RewardToken e where e.id in ?1")
    List<String> findExistingIds(@NonNull Collection<String> ids);

    /**
     * Atomically applies the new state, amount and redemption timestamp to the token with the
     * given {@code id}, but only if its state still equals {@code expectedState} when the update
     * executes. The database evaluates the condition and the write as one statement, so at most one
     * of several concurrent callers can match the row.
     *
     * @param id            must not be {@literal null}.
     * @param expectedState must not be {@literal null}.
     * @param newState      must not be {@literal null}.
     * @param amount        reward amount to assign.
     * @param redeemedAt    must not be {@literal null}.
     * @return the number of updated rows; {@literal 1} on success, {@literal 0} if the token
     * doesn't exist or its state has changed.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("update RewardToken e set e.state = ?3, e.amount = ?4, e.redeemedAt = ?5, e.version = e.version + 1 " +
        "where e.id = ?1 and e.state = ?2")
    int updateStateIfCurrent(
        @NonNull String id,
        @NonNull TokenState expectedState,
        @NonNull TokenState newState,
        long amount,
        @NonNull OffsetDateTime redeemedAt);

    /**
     * @param state must not be {@literal null}.
     * @return the number of tokens in the given {@code state}.
     */
    @Transactional(readOnly = true)
    @Query("select count(e) from RewardToken e where e.state = ?1")
    long countByState(@NonNull TokenState state);

    /**
     * @return the number of issued and redeemed tokens for each product, ordered by the product
     * name.
     */
    @NonNull
    @Transactional(readOnly = true)
    @Query("select e.productName as productName, count(e) as total, " +
        "sum(case when e.state = com.scanreward.api.token.entities.TokenState.REDEEMED then 1 else 0 end) as redeemed " +
        "from RewardToken e group by e.productName order by e.productName")
    List<ProductTokenCount> countGroupByProductName();

    @Override
    default void deleteById(@NonNull String id) {
        throw new UnsupportedOperationException("deleting reward tokens is not supported");
    }

    @Override
    default void delete(@NonNull RewardToken entity) {
        throw new UnsupportedOperationException("deleting reward tokens is not supported");
    }

    @Override
    default void deleteAllById(@NonNull Iterable<? extends String> ids) {
        throw new UnsupportedOperationException("deleting reward tokens is not supported");
    }

    @Override
    default void deleteAll(@NonNull Iterable<? extends RewardToken> entities) {
        throw new UnsupportedOperationException("deleting reward tokens is not supported");
    }

    @Override
    default void deleteAll() {
        throw new UnsupportedOperationException("deleting reward tokens is not supported");
    }
}
