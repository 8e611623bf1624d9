package com.scanreward.api.token;

import com.scanreward.api.token.entities.RewardToken;
import com.scanreward.api.token.entities.TokenState;
import com.scanreward.api.token.entities.TokenTransition;
import com.scanreward.api.token.exceptions.TokenAlreadyUsedException;
import com.scanreward.api.token.exceptions.TokenExpiredException;
import com.scanreward.api.token.exceptions.TokenNotFoundException;
import com.scanreward.api.token.exceptions.TokenStoreUnavailableException;
import lombok.NonNull;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedemptionServiceTest {

    private static final String TOKEN_ID = "0123456789abcdef0123456789abcdef";

    @Mock
    private TokenStore tokenStore;

    @Mock
    private RewardPolicy rewardPolicy;

    private RedemptionService service;

    @BeforeEach
    void setUp() {
        service = new RedemptionService(tokenStore, rewardPolicy);
        lenient().when(rewardPolicy.amountFor(any())).thenReturn(100L);
    }

    @Test
    void redeem_withUnknownToken() throws TokenStoreUnavailableException {
        when(tokenStore.findById(anyString())).thenReturn(Optional.empty());
        assertThrows(TokenNotFoundException.class, () -> service.redeem(TOKEN_ID));
    }

    @Test
    void redeem_withExpiredToken() throws TokenStoreUnavailableException {
        val token = buildToken(TokenState.UNREDEEMED, OffsetDateTime.now().minusMinutes(1));
        when(tokenStore.findById(TOKEN_ID)).thenReturn(Optional.of(token));
        assertThrows(TokenExpiredException.class, () -> service.redeem(TOKEN_ID));
        verify(tokenStore, never()).compareAndTransition(any(), any(), any());
    }

    @Test
    void redeem_withExpiredAndRedeemedToken() throws TokenStoreUnavailableException {
        val token = buildToken(TokenState.REDEEMED, OffsetDateTime.now().minusMinutes(1));
        when(tokenStore.findById(TOKEN_ID)).thenReturn(Optional.of(token));
        assertThrows(TokenExpiredException.class, () -> service.redeem(TOKEN_ID));
    }

    @Test
    void redeem_withRedeemedToken() throws TokenStoreUnavailableException {
        val token = buildToken(TokenState.REDEEMED, null);
        when(tokenStore.findById(TOKEN_ID)).thenReturn(Optional.of(token));
        assertThrows(TokenAlreadyUsedException.class, () -> service.redeem(TOKEN_ID));
        verify(tokenStore, never()).compareAndTransition(any(), any(), any());
    }

    @Test
    void redeem_withLostRace() throws TokenStoreUnavailableException {
        val token = buildToken(TokenState.UNREDEEMED, null);
        when(tokenStore.findById(TOKEN_ID)).thenReturn(Optional.of(token));
        when(tokenStore.compareAndTransition(eq(TOKEN_ID), eq(TokenState.UNREDEEMED), any())).thenReturn(false);
        assertThrows(TokenAlreadyUsedException.class, () -> service.redeem(TOKEN_ID));
    }

    @Test
    void redeem_withUnavailableStore() throws TokenStoreUnavailableException {
        when(tokenStore.findById(TOKEN_ID))
            .thenThrow(new TokenStoreUnavailableException("connection refused", new RuntimeException()));

        assertThrows(TokenStoreUnavailableException.class, () -> service.redeem(TOKEN_ID));
    }

    @Test
    void redeem_withValidToken() throws TokenStoreUnavailableException {
        val token = buildToken(TokenState.UNREDEEMED, OffsetDateTime.now().plusDays(1));
        when(tokenStore.findById(TOKEN_ID)).thenReturn(Optional.of(token));
        when(tokenStore.compareAndTransition(eq(TOKEN_ID), eq(TokenState.UNREDEEMED), any())).thenReturn(true);

        val response = assertDoesNotThrow(() -> service.redeem(TOKEN_ID));
        assertEquals(100L, response.getAmount());

        val transitionCaptor = ArgumentCaptor.forClass(TokenTransition.class);
        verify(tokenStore).compareAndTransition(eq(TOKEN_ID), eq(TokenState.UNREDEEMED), transitionCaptor.capture());
        val transition = transitionCaptor.getValue();
        assertEquals(TokenState.REDEEMED, transition.getState());
        assertEquals(100L, transition.getAmount());
        assertEquals(response.getRedeemedAt(), transition.getRedeemedAt());
        assertFalse(transition.getRedeemedAt().isAfter(OffsetDateTime.now()));
        assertFalse(transition.getRedeemedAt().isBefore(token.getCreatedAt()));
    }

    @Test
    void redeem_withCreationTimestampAheadOfLocalClock() throws TokenStoreUnavailableException {
        // e.g. the token was issued by an instance whose clock runs ahead.
        val token = buildToken(TokenState.UNREDEEMED, null);
        token.setCreatedAt(OffsetDateTime.now().plusSeconds(5));
        when(tokenStore.findById(TOKEN_ID)).thenReturn(Optional.of(token));
        when(tokenStore.compareAndTransition(eq(TOKEN_ID), eq(TokenState.UNREDEEMED), any())).thenReturn(true);

        val response = assertDoesNotThrow(() -> service.redeem(TOKEN_ID));
        assertEquals(token.getCreatedAt(), response.getRedeemedAt());

        val transitionCaptor = ArgumentCaptor.forClass(TokenTransition.class);
        verify(tokenStore).compareAndTransition(eq(TOKEN_ID), eq(TokenState.UNREDEEMED), transitionCaptor.capture());
        assertEquals(token.getCreatedAt(), transitionCaptor.getValue().getRedeemedAt());
    }

    @NonNull
    private static RewardToken buildToken(@NonNull TokenState state, OffsetDateTime expiresAt) {
        return RewardToken.builder()
            .id(TOKEN_ID)
            .productName("product")
            .batchId("batch")
            .state(state)
            .expiresAt(expiresAt)
            .build();
    }
}
