package com.courtdata.scraper.parser;

/**
 * What the page shown after a search submission turned out to be.
 */
public enum PageKind {
    RESULT,
    NO_RECORD,
    ERROR,
    IN_PROGRESS,
    UNRECOGNIZED
}
