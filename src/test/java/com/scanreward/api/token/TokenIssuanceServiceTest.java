package com.scanreward.api.token;

import com.scanreward.api.token.entities.RewardToken;
import com.scanreward.api.token.entities.TokenState;
import com.scanreward.api.token.exceptions.DuplicateTokenIdException;
import com.scanreward.api.token.exceptions.EntropySourceUnavailableException;
import com.scanreward.api.token.exceptions.TokenStoreUnavailableException;
import com.scanreward.api.token.payload.IssueBatchParams;
import lombok.val;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TokenIssuanceServiceTest {

    @Mock
    private TokenConfiguration config;

    @Mock
    private TokenIdGenerator idGenerator;

    @Mock
    private TokenStore tokenStore;

    private TokenIssuanceService service;

    @BeforeEach
    void setUp() {
        service = new TokenIssuanceService(config, idGenerator, tokenStore);
        lenient().when(config.getRedemptionBaseUrl()).thenReturn("https://rewards.test/redeem/");

        val counter = new AtomicInteger();
        lenient().when(idGenerator.generate()).thenAnswer(i -> String.format("%032x", counter.incrementAndGet()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void issueBatch() throws DuplicateTokenIdException, TokenStoreUnavailableException {
        val expiresAt = OffsetDateTime.now().plusDays(30);
        val params = IssueBatchParams.builder()
            .productName("P")
            .batchId("B")
            .count(3)
            .expiresAt(expiresAt)
            .build();

        val response = assertDoesNotThrow(() -> service.issueBatch(params));
        assertEquals("P", response.getProductName());
        assertEquals("B", response.getBatchId());
        assertEquals(expiresAt, response.getExpiresAt());
        assertEquals(3, response.getTokens().size());

        val first = response.getTokens().get(0);
        assertEquals(String.format("%032x", 1), first.getId());
        assertEquals("https://rewards.test/redeem/" + first.getId(), first.getRedemptionUrl());

        val batchCaptor = ArgumentCaptor.forClass(List.class);
        verify(tokenStore).insertBatch(batchCaptor.capture());
        val batch = (List<RewardToken>) batchCaptor.getValue();
        assertEquals(3, batch.size());
        batch.forEach(t -> {
            assertEquals("P", t.getProductName());
            assertEquals("B", t.getBatchId());
            assertEquals(TokenState.UNREDEEMED, t.getState());
            assertEquals(0, t.getAmount());
            assertEquals(expiresAt, t.getExpiresAt());
        });
    }

    @Test
    void issueBatch_withIdCollision() throws DuplicateTokenIdException, TokenStoreUnavailableException {
        doThrow(new DuplicateTokenIdException(Set.of("collided"))).when(tokenStore).insertBatch(any());
        val params = IssueBatchParams.builder().productName("P").batchId("B").count(2).build();
        assertThrows(DuplicateTokenIdException.class, () -> service.issueBatch(params));
    }

    @Test
    void issueBatch_withUnavailableStore() throws DuplicateTokenIdException, TokenStoreUnavailableException {
        doThrow(new TokenStoreUnavailableException("connection refused", new RuntimeException()))
            .when(tokenStore).insertBatch(any());

        val params = IssueBatchParams.builder().productName("P").batchId("B").count(2).build();
        assertThrows(TokenStoreUnavailableException.class, () -> service.issueBatch(params));
    }

    @Test
    void issueBatch_withFailingEntropySource() throws DuplicateTokenIdException, TokenStoreUnavailableException {
        when(idGenerator.generate()).thenThrow(new EntropySourceUnavailableException("closed", new RuntimeException()));
        val params = IssueBatchParams.builder().productName("P").batchId("B").count(2).build();
        assertThrows(EntropySourceUnavailableException.class, () -> service.issueBatch(params));
        verify(tokenStore, never()).insertBatch(any());
    }
}
