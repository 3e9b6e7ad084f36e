package com.courtdata.scraper.service.core;

/**
 * A page load did not complete within the configured timeout, or the
 * transport failed underneath it. Retried by the navigation policy.
 */
public class NavigationException extends RuntimeException {

    public NavigationException(final String message) {
        super(message);
    }

    public NavigationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
