package com.courtdata.scraper.service.search;

import com.courtdata.scraper.service.challenge.ChallengeArtifact;

import java.util.UUID;

/**
 * Receives every state transition of a run.
 */
@FunctionalInterface
public interface SearchObserver {

    SearchObserver NONE = (attemptId, state, challenge) -> { };

    /**
     * @param attemptId run identifier
     * @param state     state just entered
     * @param challenge artifact being answered in {@link SearchState#CHALLENGE_PENDING}, otherwise {@code null}
     */
    void onTransition(UUID attemptId, SearchState state, ChallengeArtifact challenge);
}
