package com.courtdata.scraper.exception;

/**
 * Failure body returned to API callers: <code>{kind, message}</code>.
 *
 * @param kind    stable failure code
 * @param message human-readable explanation
 */
public record SearchFailure(FailureKind kind, String message) {

    public static SearchFailure of(final CaseSearchException ex) {
        return new SearchFailure(ex.kind(), ex.getMessage());
    }
}
