package com.courtdata.scraper.exception;

/**
 * The request was rejected before any remote interaction took place.
 */
public class SearchValidationException extends CaseSearchException {

    public SearchValidationException(final String message) {
        super(message);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.VALIDATION_ERROR;
    }
}
