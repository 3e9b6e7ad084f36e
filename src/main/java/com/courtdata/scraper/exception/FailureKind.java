package com.courtdata.scraper.exception;

import com.courtdata.scraper.domain.SearchOutcome;

/**
 * Stable failure codes reported to callers and stored with failed attempts.
 */
public enum FailureKind {

    VALIDATION_ERROR,
    SITE_UNREACHABLE,
    CHALLENGE_TIMEOUT,
    CHALLENGE_EXHAUSTED,
    PARSE_ERROR,
    CASE_NOT_FOUND,
    STORAGE_ERROR,
    CANCELLED;

    /**
     * @return the attempt outcome recorded for a run ending with this kind
     */
    public SearchOutcome outcome() {
        return switch (this) {
            case CHALLENGE_TIMEOUT -> SearchOutcome.TIMEOUT;
            case CHALLENGE_EXHAUSTED -> SearchOutcome.CAPTCHA_REQUIRED;
            default -> SearchOutcome.FAILURE;
        };
    }
}
