package com.courtdata.scraper.config;

import com.courtdata.scraper.service.core.NavigationException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Exposes the Resilience4j registries and the named policies used while
 * driving the court site: a navigation retry, a result-polling retry, a
 * circuit breaker shared by all runs, and the backoff used between
 * challenge attempts. All timings come from {@link SearchProperties}.
 * </p>
 */
@Configuration
public class Resilience4jConfig {

    /** Name of the retry wrapping search-page navigation. */
    public static final String NAVIGATION = "courtNavigation";

    /** Name of the retry polling for a settled result page. */
    public static final String RESULT_POLL = "courtResultPoll";

    /** Name of the circuit breaker guarding the court site. */
    public static final String COURT_SITE = "courtSite";

    /**
     * Creates the global {@link RetryRegistry} which holds all configured
     * {@link Retry} instances.
     *
     * @return a registry with default retry configuration
     */
    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    /**
     * Creates the global {@link CircuitBreakerRegistry} which holds all
     * configured {@link CircuitBreaker} instances.
     *
     * @return a registry with default circuit-breaker configuration
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    /**
     * Exponential backoff derived from <code>court.search.backoff</code>.
     *
     * @param props search settings
     * @return interval function mapping attempt number to wait in millis
     */
    @Bean
    public IntervalFunction challengeBackoff(final SearchProperties props) {
        SearchProperties.Backoff b = props.getBackoff();
        return IntervalFunction.ofExponentialBackoff(
                b.getInitial().toMillis(), b.getMultiplier(), b.getMax().toMillis());
    }

    /**
     * Retry policy for loading the search page. Only {@link NavigationException}
     * is retried; everything else surfaces on the first failure.
     *
     * @param registry         the global {@link RetryRegistry}
     * @param props            search settings
     * @param challengeBackoff shared backoff function
     * @return a {@link Retry} registered under {@value #NAVIGATION}
     */
    @Bean
    public Retry navigationRetry(final RetryRegistry registry,
                                 final SearchProperties props,
                                 final IntervalFunction challengeBackoff) {
        RetryConfig cfg = RetryConfig.custom()
                .maxAttempts(Math.max(1, props.getNavigationAttempts()))
                .intervalFunction(challengeBackoff)
                .retryExceptions(NavigationException.class)
                .build();
        return registry.retry(NAVIGATION, cfg);
    }

    /**
     * Retry policy for result polling. A poll "fails" by returning
     * {@code true} (page still in progress); once attempts run out the last
     * result is handed back to the caller.
     *
     * @param registry         the global {@link RetryRegistry}
     * @param props            search settings
     * @param challengeBackoff shared backoff function
     * @return a {@link Retry} registered under {@value #RESULT_POLL}
     */
    @Bean
    public Retry resultPollRetry(final RetryRegistry registry,
                                 final SearchProperties props,
                                 final IntervalFunction challengeBackoff) {
        RetryConfig cfg = RetryConfig.<Boolean>custom()
                .maxAttempts(Math.max(1, props.getResultPollAttempts()))
                .intervalFunction(challengeBackoff)
                .retryOnResult(Boolean.TRUE::equals)
                .retryExceptions(NavigationException.class)
                .build();
        return registry.retry(RESULT_POLL, cfg);
    }

    /**
     * Circuit breaker opened when navigation to the court site keeps failing.
     *
     * @param registry the global {@link CircuitBreakerRegistry}
     * @param props    search settings
     * @return a {@link CircuitBreaker} registered under {@value #COURT_SITE}
     */
    @Bean
    public CircuitBreaker courtSiteCircuitBreaker(final CircuitBreakerRegistry registry,
                                                  final SearchProperties props) {
        SearchProperties.Breaker b = props.getBreaker();
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .failureRateThreshold(b.getFailureRateThreshold())
                .minimumNumberOfCalls(Math.max(1, b.getMinimumCalls()))
                .slidingWindowSize(Math.max(1, b.getMinimumCalls()))
                .waitDurationInOpenState(b.getOpenWait())
                .recordExceptions(NavigationException.class)
                .build();
        return registry.circuitBreaker(COURT_SITE, cfg);
    }

}
