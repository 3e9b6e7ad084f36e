package com.courtdata.scraper.exception;

/**
 * The page returned by the site was not a case result (error, maintenance or
 * unrecognised markup).
 */
public class ResultParseException extends CaseSearchException {

    public ResultParseException(final String message) {
        super(message);
    }

    public ResultParseException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.PARSE_ERROR;
    }
}
