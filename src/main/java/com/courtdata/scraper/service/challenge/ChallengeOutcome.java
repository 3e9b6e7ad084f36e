package com.courtdata.scraper.service.challenge;

/**
 * How the site reacted to a submitted challenge code.
 */
public enum ChallengeOutcome {
    ACCEPTED,
    REJECTED,
    EXPIRED
}
