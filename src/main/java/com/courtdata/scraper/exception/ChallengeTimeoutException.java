package com.courtdata.scraper.exception;

/**
 * No challenge code arrived within the allowed wait.
 */
public class ChallengeTimeoutException extends CaseSearchException {

    public ChallengeTimeoutException(final String message) {
        super(message);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.CHALLENGE_TIMEOUT;
    }
}
