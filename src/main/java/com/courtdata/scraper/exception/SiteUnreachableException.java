package com.courtdata.scraper.exception;

/**
 * The court site could not be loaded, kept failing after retries, or never
 * produced a settled page.
 */
public class SiteUnreachableException extends CaseSearchException {

    public SiteUnreachableException(final String message) {
        super(message);
    }

    public SiteUnreachableException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.SITE_UNREACHABLE;
    }
}
