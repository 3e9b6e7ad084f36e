package com.courtdata.scraper.exception;

import com.courtdata.scraper.domain.SearchOutcome;

/**
 * Root of every failure a search run can end with. Each subclass carries a
 * stable {@link FailureKind}; the message is safe to show to API callers and
 * never contains raw page content.
 */
public abstract class CaseSearchException extends RuntimeException {

    protected CaseSearchException(final String message) {
        super(message);
    }

    protected CaseSearchException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the failure code of this exception
     */
    public abstract FailureKind kind();

    /**
     * @return the outcome written to the attempt row
     */
    public SearchOutcome outcome() {
        return kind().outcome();
    }
}
