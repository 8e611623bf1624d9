package com.scanreward.api.token;

import com.scanreward.api.token.entities.RewardToken;
import com.scanreward.api.token.entities.RewardTokenRepository;
import com.scanreward.api.token.entities.TokenState;
import com.scanreward.api.token.entities.TokenTransition;
import com.scanreward.api.token.exceptions.DuplicateTokenIdException;
import com.scanreward.api.token.exceptions.TokenStoreUnavailableException;
import lombok.NonNull;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;

import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JpaTokenStoreTest {

    @Mock
    private RewardTokenRepository repository;

    private JpaTokenStore store;

    @BeforeEach
    void setUp() {
        store = new JpaTokenStore(repository);
    }

    @Test
    void insertBatch_withEmptyBatch() {
        assertThrows(IllegalArgumentException.class, () -> store.insertBatch(List.of()));
    }

    @Test
    void insertBatch_withRepeatedIds() {
        val batch = List.of(buildToken("a"), buildToken("b"), buildToken("a"));
        val e = assertThrows(DuplicateTokenIdException.class, () -> store.insertBatch(batch));
        assertEquals(Set.of("a"), e.getIds());
        verify(repository, never()).saveAll(any());
    }

    @Test
    void insertBatch_withExistingIds() {
        when(repository.findExistingIds(anyCollection())).thenReturn(List.of("b"));
        val batch = List.of(buildToken("a"), buildToken("b"));
        val e = assertThrows(DuplicateTokenIdException.class, () -> store.insertBatch(batch));
        assertEquals(Set.of("b"), e.getIds());
        verify(repository, never()).saveAll(any());
    }

    @Test
    void insertBatch_withUniqueKeyViolation() {
        when(repository.findExistingIds(anyCollection())).thenReturn(List.of());
        when(repository.saveAll(any())).thenThrow(new DataIntegrityViolationException(
            "could not execute statement", new SQLException("duplicate key value", "23505")));

        val batch = List.of(buildToken("a"), buildToken("b"));
        assertThrows(DuplicateTokenIdException.class, () -> store.insertBatch(batch));
    }

    @Test
    void insertBatch_withDuplicateKeyException() {
        when(repository.findExistingIds(anyCollection())).thenReturn(List.of());
        when(repository.saveAll(any())).thenThrow(new DuplicateKeyException("duplicate key"));
        val batch = List.of(buildToken("a"));
        assertThrows(DuplicateTokenIdException.class, () -> store.insertBatch(batch));
    }

    @Test
    void insertBatch_withOtherConstraintViolation() {
        when(repository.findExistingIds(anyCollection())).thenReturn(List.of());
        when(repository.saveAll(any())).thenThrow(new DataIntegrityViolationException(
            "could not execute statement", new SQLException("value too long", "22001")));

        val batch = List.of(buildToken("a"));
        assertThrows(DataIntegrityViolationException.class, () -> store.insertBatch(batch));

        doThrow(new DataIntegrityViolationException(
            "could not execute statement", new SQLException("null value in column", "23502")))
            .when(repository).saveAll(any());

        assertThrows(DataIntegrityViolationException.class, () -> store.insertBatch(batch));
    }

    @Test
    void insertBatch_withUnavailableStore() {
        when(repository.findExistingIds(anyCollection())).thenThrow(new QueryTimeoutException("timeout"));
        val batch = List.of(buildToken("a"));
        assertThrows(TokenStoreUnavailableException.class, () -> store.insertBatch(batch));
    }

    @Test
    void insertBatch() throws DuplicateTokenIdException, TokenStoreUnavailableException {
        when(repository.findExistingIds(anyCollection())).thenReturn(List.of());
        val batch = List.of(buildToken("a"), buildToken("b"));
        store.insertBatch(batch);
        verify(repository).saveAll(batch);
    }

    @Test
    void compareAndTransition() throws TokenStoreUnavailableException {
        val now = OffsetDateTime.now();
        when(repository.updateStateIfCurrent("a", TokenState.UNREDEEMED, TokenState.REDEEMED, 100L, now))
            .thenReturn(1);

        assertTrue(store.compareAndTransition("a", TokenState.UNREDEEMED, TokenTransition.redeem(100, now)));
    }

    @Test
    void compareAndTransition_withStateMismatch() throws TokenStoreUnavailableException {
        when(repository.updateStateIfCurrent(eq("a"), eq(TokenState.UNREDEEMED), eq(TokenState.REDEEMED), anyLong(), any()))
            .thenReturn(0);

        assertFalse(store.compareAndTransition("a", TokenState.UNREDEEMED, TokenTransition.redeem(100, OffsetDateTime.now())));
    }

    @Test
    void compareAndTransition_withIllegalTransition() {
        val transition = TokenTransition.redeem(100, OffsetDateTime.now());
        assertThrows(
            IllegalArgumentException.class,
            () -> store.compareAndTransition("a", TokenState.REDEEMED, transition));

        verify(repository, never()).updateStateIfCurrent(any(), any(), any(), anyLong(), any());
    }

    @Test
    void compareAndTransition_withUnavailableStore() {
        when(repository.updateStateIfCurrent(eq("a"), eq(TokenState.UNREDEEMED), eq(TokenState.REDEEMED), anyLong(), any()))
            .thenThrow(new QueryTimeoutException("timeout"));

        val transition = TokenTransition.redeem(100, OffsetDateTime.now());
        assertThrows(
            TokenStoreUnavailableException.class,
            () -> store.compareAndTransition("a", TokenState.UNREDEEMED, transition));
    }

    @NonNull
    private static RewardToken buildToken(@NonNull String id) {
        return RewardToken.builder()
            .id(id)
            .productName("P")
            .batchId("B")
            .build();
    }
}
