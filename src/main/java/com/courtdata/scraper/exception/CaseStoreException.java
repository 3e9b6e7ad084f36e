package com.courtdata.scraper.exception;

/**
 * A write or read against the case store failed. {@link #isConflict()} is
 * set when the failure came from a concurrent write to the same row, in which
 * case retrying the whole operation is safe.
 */
public class CaseStoreException extends CaseSearchException {

    private final boolean conflict;

    public CaseStoreException(final String message, final Throwable cause, final boolean conflict) {
        super(message, cause);
        this.conflict = conflict;
    }

    public boolean isConflict() {
        return conflict;
    }

    @Override
    public FailureKind kind() {
        return FailureKind.STORAGE_ERROR;
    }
}
