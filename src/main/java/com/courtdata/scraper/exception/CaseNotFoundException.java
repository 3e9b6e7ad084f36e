package com.courtdata.scraper.exception;

/**
 * The site answered but holds no record for the requested case, or a stored
 * case or order does not exist.
 */
public class CaseNotFoundException extends CaseSearchException {

    public CaseNotFoundException(final String message) {
        super(message);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.CASE_NOT_FOUND;
    }
}
