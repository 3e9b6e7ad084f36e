package com.courtdata.scraper.exception;

/**
 * Every challenge code allowed for the run was rejected or expired.
 */
public class ChallengeExhaustedException extends CaseSearchException {

    private final int submissions;

    public ChallengeExhaustedException(final int submissions) {
        super("CAPTCHA not accepted after " + submissions + " submission(s)");
        this.submissions = submissions;
    }

    public int getSubmissions() {
        return submissions;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.CHALLENGE_EXHAUSTED;
    }
}
