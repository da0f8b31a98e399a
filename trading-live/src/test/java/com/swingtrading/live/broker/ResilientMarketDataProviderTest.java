package com.swingtrading.live.broker;

import com.swingtrading.error.BrokerAuthenticationException;
import com.swingtrading.error.ExternalServiceException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResilientMarketDataProviderTest {

    private static final Quote QUOTE = new Quote("TCS", 3_500.0, 3_520.0, 3_480.0, Instant.EPOCH);

    @Mock
    private MarketDataProvider delegate;

    private SimpleMeterRegistry registry;
    private ResilientMarketDataProvider provider;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        provider = new ResilientMarketDataProvider(delegate, registry, 3, Duration.ofMillis(1));
    }

    @Test
    @DisplayName("Transient failures are retried until a call succeeds")
    void retriesTransientFailures() {
        when(delegate.fetchQuote("TCS"))
            .thenThrow(new ExternalServiceException("nse", "timeout"))
            .thenThrow(new ExternalServiceException("nse", "timeout"))
            .thenReturn(QUOTE);

        assertEquals(QUOTE, provider.fetchQuote("TCS"));
        verify(delegate, times(3)).fetchQuote("TCS");
        assertEquals(1.0, registry.counter("market.data.success", "operation", "fetchQuote").count());
    }

    @Test
    @DisplayName("Gives up after the last attempt with the original failure")
    void givesUpAfterMaxAttempts() {
        when(delegate.fetchQuote("TCS")).thenThrow(new ExternalServiceException("nse", "down"));

        ExternalServiceException e = assertThrows(ExternalServiceException.class, () -> provider.fetchQuote("TCS"));

        assertEquals("nse", e.getService());
        verify(delegate, times(3)).fetchQuote("TCS");
        assertEquals(1.0, registry.counter("market.data.failure", "operation", "fetchQuote",
            "error", "ExternalServiceException").count());
    }

    @Test
    @DisplayName("Authentication failures are not retried")
    void authNotRetried() {
        when(delegate.fetchQuote("TCS")).thenThrow(new BrokerAuthenticationException("nse", "forbidden"));

        assertThrows(BrokerAuthenticationException.class, () -> provider.fetchQuote("TCS"));
        verify(delegate, times(1)).fetchQuote("TCS");
    }

    @Test
    @DisplayName("Open circuit rejects calls without reaching the delegate")
    void openCircuitRejects() {
        when(delegate.fetchQuote("TCS")).thenThrow(new ExternalServiceException("nse", "down"));
        // 4 calls x 3 attempts fill the 10-call window with failures
        for (int i = 0; i < 4; i++) {
            assertThrows(ExternalServiceException.class, () -> provider.fetchQuote("TCS"));
        }
        assertEquals("OPEN", provider.getCircuitBreakerState());
        clearInvocations(delegate);

        ExternalServiceException e = assertThrows(ExternalServiceException.class, () -> provider.fetchQuote("TCS"));

        assertTrue(e.getMessage().contains("circuit open"));
        verifyNoInteractions(delegate);

        provider.resetCircuitBreaker();
        assertEquals("CLOSED", provider.getCircuitBreakerState());
    }

    @Test
    @DisplayName("Calls are timed per operation")
    void timesCalls() {
        when(delegate.fetchQuote("TCS")).thenReturn(QUOTE);

        provider.fetchQuote("TCS");
        provider.fetchQuote("TCS");

        assertEquals(2, registry.timer("market.data.call", "operation", "fetchQuote").count());
    }
}
