package com.courtdata.scraper.service.challenge;

import java.time.Duration;

/**
 * Supplies a human-read code for a challenge, blocking until one is available.
 */
@FunctionalInterface
public interface ChallengeCodeSource {

    /**
     * @param artifact the challenge to answer
     * @param timeout  longest time to wait
     * @return the code
     * @throws com.courtdata.scraper.exception.ChallengeTimeoutException when nothing arrives in time
     * @throws com.courtdata.scraper.exception.SearchCancelledException  when the run is cancelled meanwhile
     */
    String nextCode(ChallengeArtifact artifact, Duration timeout);
}
