package com.scanreward.api.token;

import com.scanreward.api.token.entities.ProductTokenCount;
import com.scanreward.api.token.entities.RewardToken;
import com.scanreward.api.token.entities.RewardTokenRepository;
import com.scanreward.api.token.entities.TokenFilter;
import com.scanreward.api.token.entities.TokenState;
import com.scanreward.api.token.entities.TokenTransition;
import com.scanreward.api.token.exceptions.DuplicateTokenIdException;
import com.scanreward.api.token.exceptions.TokenStoreUnavailableException;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import lombok.val;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.sql.SQLException;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link TokenStore} backed by a relational database through {@link RewardTokenRepository}.
 * <p>
 * Conditional transitions execute as a single {@code UPDATE ... WHERE state = ?} statement, which
 * keeps them atomic across threads and across application instances that share the database.</p>
 */
@Component
@Slf4j
class JpaTokenStore implements TokenStore {

    // SQLSTATE class 23 "integrity constraint violation", unique_violation.
    private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    private final RewardTokenRepository repository;

    @Autowired
    JpaTokenStore(@NonNull RewardTokenRepository repository) {
        this.repository = repository;
    }

    @Override
    public void insertBatch(@NonNull List<RewardToken> tokens) throws DuplicateTokenIdException, TokenStoreUnavailableException {
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("token batch must not be empty");
        }

        val ids = new HashSet<String>();
        val repeated = tokens.stream()
            .map(RewardToken::getId)
            .filter(id -> !ids.add(id))
            .collect(Collectors.toSet());

        if (!repeated.isEmpty()) {
            throw new DuplicateTokenIdException(repeated);
        }

        try {
            val existing = repository.findExistingIds(ids);
            if (!existing.isEmpty()) {
                throw new DuplicateTokenIdException(existing);
            }

            // saveAll runs in a single transaction, so the batch is inserted all-or-nothing.
            repository.saveAll(tokens);
        } catch (DataIntegrityViolationException e) {
            if (!isUniqueKeyViolation(e)) {
                // e.g. a not-null or length violation; nothing a retry or a new id would fix.
                throw e;
            }

            // a concurrent insert won the race between the existence check and the insert.
            throw new DuplicateTokenIdException("token id uniqueness constraint violated", e);
        } catch (DataAccessException e) {
            throw new TokenStoreUnavailableException("failed to insert token batch", e);
        }
    }

    private static boolean isUniqueKeyViolation(@NonNull DataIntegrityViolationException e) {
        if (e instanceof DuplicateKeyException) {
            return true;
        }

        val sqlException = ExceptionUtils.throwableOfType(e, SQLException.class);
        return sqlException != null && UNIQUE_VIOLATION_SQL_STATE.equals(sqlException.getSQLState());
    }

    @NonNull
    @Override
    public Optional<RewardToken> findById(@NonNull String id) throws TokenStoreUnavailableException {
        try {
            return repository.findById(id);
        } catch (DataAccessException e) {
            throw new TokenStoreUnavailableException("failed to find token", e);
        }
    }

    @Override
    public boolean compareAndTransition(
        @NonNull String id,
        @NonNull TokenState expectedState,
        @NonNull TokenTransition transition
    ) throws TokenStoreUnavailableException {
        if (!expectedState.canTransitionTo(transition.getState())) {
            throw new IllegalArgumentException(
                String.format("illegal token state transition: %s -> %s", expectedState, transition.getState()));
        }

        final int updated;
        try {
            updated = repository.updateStateIfCurrent(
                id, expectedState, transition.getState(), transition.getAmount(), transition.getRedeemedAt());
        } catch (DataAccessException e) {
            throw new TokenStoreUnavailableException("failed to transition token state", e);
        }

        if (updated > 1) {
            // the primary key makes this impossible unless the schema is broken.
            log.error("conditional transition updated {} rows for a single token id", updated);
        }

        return updated > 0;
    }

    @Override
    public long count() throws TokenStoreUnavailableException {
        try {
            return repository.count();
        } catch (DataAccessException e) {
            throw new TokenStoreUnavailableException("failed to count tokens", e);
        }
    }

    @Override
    public long countByState(@NonNull TokenState state) throws TokenStoreUnavailableException {
        try {
            return repository.countByState(state);
        } catch (DataAccessException e) {
            throw new TokenStoreUnavailableException("failed to count tokens by state", e);
        }
    }

    @Override
    public long sumAmountWhere(@NonNull TokenFilter filter) throws TokenStoreUnavailableException {
        try {
            return repository.sumAmountMatching(filter);
        } catch (DataAccessException e) {
            throw new TokenStoreUnavailableException("failed to sum token amounts", e);
        }
    }

    @NonNull
    @Override
    public List<ProductTokenCount> groupCountByProduct() throws TokenStoreUnavailableException {
        try {
            return repository.countGroupByProductName();
        } catch (DataAccessException e) {
            throw new TokenStoreUnavailableException("failed to count tokens by product", e);
        }
    }
}
