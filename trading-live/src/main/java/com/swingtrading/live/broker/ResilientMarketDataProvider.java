package com.swingtrading.live.broker;

import com.swingtrading.error.BrokerAuthenticationException;
import com.swingtrading.error.ExternalServiceException;
import com.swingtrading.model.PriceSeries;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Decorates a {@link MarketDataProvider} with retry (exponential backoff),
 * a circuit breaker and call timing.
 * <p>
 * Chain: Retry -> CircuitBreaker -> delegate. Authentication failures are
 * never retried and pass through unchanged.
 */
public final class ResilientMarketDataProvider implements MarketDataProvider {
    private static final Logger logger = LoggerFactory.getLogger(ResilientMarketDataProvider.class);

    private final MarketDataProvider delegate;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;
    private final MeterRegistry meterRegistry;

    public ResilientMarketDataProvider(MarketDataProvider delegate, MeterRegistry meterRegistry) {
        this(delegate, meterRegistry, 4, Duration.ofSeconds(1));
    }

    /**
     * @param maxAttempts total attempts per call, first one included
     * @param initialWait wait before the first retry; doubles on each further retry
     */
    public ResilientMarketDataProvider(MarketDataProvider delegate, MeterRegistry meterRegistry,
                                       int maxAttempts, Duration initialWait) {
        this.delegate = delegate;
        this.meterRegistry = meterRegistry;

        // Open after 50% failures in 10 calls, probe again after 30 seconds
        var cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(10)
            .minimumNumberOfCalls(10)
            .permittedNumberOfCallsInHalfOpenState(3)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .ignoreExceptions(BrokerAuthenticationException.class)
            .build();
        this.circuitBreaker = CircuitBreaker.of("market-data", cbConfig);

        var retryConfig = RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .intervalFunction(IntervalFunction.ofExponentialBackoff(initialWait, 2.0))
            .retryExceptions(ExternalServiceException.class)
            .ignoreExceptions(BrokerAuthenticationException.class)
            .build();
        this.retry = Retry.of("market-data", retryConfig);

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                logger.warn("Market data circuit breaker state changed: {}", event.getStateTransition()));
        retry.getEventPublisher()
            .onRetry(event -> logger.debug("Retrying market data call (attempt {}): {}",
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));

        logger.info("ResilientMarketDataProvider wrapping {} with {} attempts, backoff from {}",
            delegate.getClass().getSimpleName(), maxAttempts, initialWait);
    }

    @Override
    public Quote fetchQuote(String symbol) {
        return executeResilient("fetchQuote", () -> delegate.fetchQuote(symbol));
    }

    @Override
    public PriceSeries fetchDailyHistory(String symbol, int days) {
        return executeResilient("fetchDailyHistory", () -> delegate.fetchDailyHistory(symbol, days));
    }

    public String getCircuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    public void resetCircuitBreaker() {
        logger.info("Manual circuit breaker reset requested");
        circuitBreaker.reset();
    }

    private <T> T executeResilient(String operation, Supplier<T> supplier) {
        var timer = Timer.builder("market.data.call")
            .tag("operation", operation)
            .register(meterRegistry);

        return timer.record(() -> {
            try {
                T result = Retry.decorateSupplier(retry,
                    CircuitBreaker.decorateSupplier(circuitBreaker, supplier)).get();
                meterRegistry.counter("market.data.success", "operation", operation).increment();
                return result;
            } catch (BrokerAuthenticationException e) {
                throw e;
            } catch (CallNotPermittedException e) {
                meterRegistry.counter("market.data.failure", "operation", operation,
                    "error", "CircuitOpen").increment();
                throw new ExternalServiceException("market-data", operation + " rejected: circuit open", e);
            } catch (ExternalServiceException e) {
                meterRegistry.counter("market.data.failure", "operation", operation,
                    "error", e.getClass().getSimpleName()).increment();
                logger.warn("Market data call failed after retries: {} - {}", operation, e.getMessage());
                throw e;
            }
        });
    }
}
