package com.courtdata.scraper.service.search;

/**
 * States of one search run, in the order a successful run visits them.
 */
public enum SearchState {
    INIT,
    FORM_FILLED,
    SUBMITTED,
    CHALLENGE_PENDING,
    CHALLENGE_RESOLVED,
    RESULT_READY,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
