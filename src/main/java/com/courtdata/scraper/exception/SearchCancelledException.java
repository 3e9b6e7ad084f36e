package com.courtdata.scraper.exception;

/**
 * The run was cancelled by its caller.
 */
public class SearchCancelledException extends CaseSearchException {

    public SearchCancelledException(final String message) {
        super(message);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.CANCELLED;
    }
}
