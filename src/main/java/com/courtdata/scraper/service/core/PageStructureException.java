package com.courtdata.scraper.service.core;

/**
 * An element the form or challenge layer relies on is missing from the page.
 */
public class PageStructureException extends RuntimeException {

    public PageStructureException(final String message) {
        super(message);
    }

    public PageStructureException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
