package com.courtdata.scraper.domain;

/**
 * Terminal result of one search attempt.
 */
public enum SearchOutcome {
    SUCCESS,
    FAILURE,
    CAPTCHA_REQUIRED,
    TIMEOUT
}
