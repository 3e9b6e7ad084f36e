package com.courtdata.scraper.service.challenge;

import com.courtdata.scraper.service.core.BrowserSession;

import java.util.Optional;

/**
 * Reads, answers and refreshes the CAPTCHA on the active page. A rejected or
 * expired code is never resubmitted by the resolver itself.
 */
public interface ChallengeResolver {

    /**
     * @param session active session positioned on the search form
     * @return the challenge shown on the page, or empty when there is none
     */
    Optional<ChallengeArtifact> extractChallenge(BrowserSession session);

    /**
     * Enters {@code code}, submits the form and inspects the page that follows.
     *
     * @param session active session
     * @param code    code read by a human from the artifact
     * @return the site's verdict
     */
    ChallengeOutcome submitResponse(BrowserSession session, String code);

    /**
     * Asks the site for a new challenge. Any code for the previous artifact
     * becomes useless.
     *
     * @param session active session positioned on the search form
     * @return the fresh artifact
     */
    ChallengeArtifact refresh(BrowserSession session);
}
