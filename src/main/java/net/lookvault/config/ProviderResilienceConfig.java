/**
 * Configuration for upstream provider resilience
 * - Configures a circuit breaker and a rate limiter per paid provider
 * - Keeps one failing provider from being hammered while the others keep serving
 */
package net.lookvault.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ProviderResilienceConfig {
    private static final Logger logger = LoggerFactory.getLogger(ProviderResilienceConfig.class);

    @Value("${shopping.search.requests-per-second:5}")
    private int shoppingSearchRequestsPerSecond;

    @Value("${marketplace.browse.requests-per-second:5}")
    private int marketplaceBrowseRequestsPerSecond;

    @Value("${lookvault.providers.circuit-breaker.failure-rate-threshold:50}")
    private float failureRateThreshold;

    @Value("${lookvault.providers.circuit-breaker.open-duration:PT60S}")
    private Duration openDuration;

    @Bean
    public CircuitBreaker shoppingSearchCircuitBreaker() {
        return circuitBreaker("shoppingSearchProvider");
    }

    @Bean
    public RateLimiter shoppingSearchRateLimiter() {
        return rateLimiter("shoppingSearchProviderRateLimiter", shoppingSearchRequestsPerSecond);
    }

    @Bean
    public CircuitBreaker marketplaceBrowseCircuitBreaker() {
        return circuitBreaker("marketplaceBrowseProvider");
    }

    @Bean
    public RateLimiter marketplaceBrowseRateLimiter() {
        return rateLimiter("marketplaceBrowseProviderRateLimiter", marketplaceBrowseRequestsPerSecond);
    }

    private CircuitBreaker circuitBreaker(String name) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .slidingWindowSize(20)
                .minimumNumberOfCalls(10)
                .waitDurationInOpenState(openDuration)
                .permittedNumberOfCallsInHalfOpenState(2)
                .build();
        CircuitBreaker circuitBreaker = CircuitBreaker.of(name, config);
        circuitBreaker.getEventPublisher().onStateTransition(event ->
                logger.warn("Circuit breaker '{}' transitioned: {}", name, event.getStateTransition()));
        logger.info("Circuit breaker '{}' initialized (failureRateThreshold={}%, openDuration={})",
                name, failureRateThreshold, openDuration);
        return circuitBreaker;
    }

    // Zero timeout: a throttled call fails fast and the aggregator treats it like any provider failure.
    private RateLimiter rateLimiter(String name, int requestsPerSecond) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(requestsPerSecond)
                .timeoutDuration(Duration.ZERO)
                .build();
        RateLimiter rateLimiter = RateLimiter.of(name, config);
        logger.info("Rate limiter '{}' initialized with limit of {} requests/second", name, requestsPerSecond);
        return rateLimiter;
    }
}
