package com.courtdata.scraper.exception;

import com.courtdata.scraper.domain.SearchOutcome;

/**
 * The wall-clock budget of a run ran out. Reported as site-unreachable but
 * recorded with outcome {@link SearchOutcome#TIMEOUT}.
 */
public class AttemptTimeoutException extends SiteUnreachableException {

    public AttemptTimeoutException(final String message) {
        super(message);
    }

    @Override
    public SearchOutcome outcome() {
        return SearchOutcome.TIMEOUT;
    }
}
