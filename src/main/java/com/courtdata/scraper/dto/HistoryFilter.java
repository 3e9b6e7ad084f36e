package com.courtdata.scraper.dto;

import com.courtdata.scraper.domain.SearchOutcome;

import java.time.Instant;

/**
 * Optional criteria for the search history. {@code null} means "any".
 *
 * @param caseType   exact case type
 * @param caseNumber exact case number
 * @param year       exact year
 * @param outcome    attempt outcome
 * @param from       submitted at or after (inclusive)
 * @param to         submitted before (exclusive)
 */
public record HistoryFilter(String caseType,
                            String caseNumber,
                            Integer year,
                            SearchOutcome outcome,
                            Instant from,
                            Instant to) {

    public static HistoryFilter none() {
        return new HistoryFilter(null, null, null, null, null, null);
    }
}
