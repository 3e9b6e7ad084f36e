package com.courtdata.scraper.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Binds the search orchestration settings under the <code>court.search</code> prefix.
 * <p>
 * Every retry count, backoff and timeout used while driving the court site
 * lives here so that operators can tune them without a rebuild.
 * </p>
 * <pre>{@code
 * court:
 *   search:
 *     challenge-retry-budget: 3
 *     challenge-wait: 5m
 *     attempt-budget: 10m
 *     backoff:
 *       initial: 1s
 *       multiplier: 2.0
 *       max: 15s
 * }</pre>
 */
@Component
@ConfigurationProperties(prefix = "court.search")
@Getter
@Setter
public class SearchProperties {

    /** Maximum number of challenge codes submitted in one run. */
    private int challengeRetryBudget = 3;

    /** How long a run waits for a human-supplied challenge code. */
    private Duration challengeWait = Duration.ofMinutes(5);

    /** Wall-clock budget of one whole run. */
    private Duration attemptBudget = Duration.ofMinutes(10);

    /** Exponential backoff shared by navigation retries, result polling and challenge retries. */
    private Backoff backoff = new Backoff();

    /** Attempts (first try included) to load the search page. */
    private int navigationAttempts = 3;

    /** Attempts (first try included) to see a settled result page. */
    private int resultPollAttempts = 5;

    /** Oldest year accepted for a case. */
    private int minYear = 1951;

    /** How long finished search jobs stay queryable. */
    private Duration jobRetention = Duration.ofMinutes(30);

    /** Circuit breaker guarding the court site across runs. */
    private Breaker breaker = new Breaker();

    /** Worker threads running searches; each holds its own browser. */
    private int workers = 4;

    /** Searches allowed to queue behind busy workers. */
    private int queueCapacity = 50;

    @Getter
    @Setter
    public static class Backoff {

        private Duration initial = Duration.ofSeconds(1);

        private double multiplier = 2.0;

        private Duration max = Duration.ofSeconds(15);
    }

    @Getter
    @Setter
    public static class Breaker {

        /** Failure percentage that opens the breaker. */
        private float failureRateThreshold = 50f;

        /** Calls recorded before the failure rate is evaluated. */
        private int minimumCalls = 10;

        /** How long the breaker stays open before letting a probe through. */
        private Duration openWait = Duration.ofSeconds(60);
    }
}
