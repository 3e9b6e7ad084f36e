package com.courtdata.scraper.domain;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Normalized view of a case: what the parser extracted from a result page, or
 * what the store holds for a case. Fields that could not be found are
 * {@code null} and listed in {@code unknownFields}.
 */
public record CaseRecord(
        CaseKey key,
        String caseTitle,
        String petitioner,
        String respondent,
        LocalDate filingDate,
        LocalDate nextHearingDate,
        String status,
        String bench,
        List<OrderEntry> orders,
        Set<CaseField> unknownFields) {

    public CaseRecord {
        orders = orders == null ? List.of() : List.copyOf(orders);
        unknownFields = unknownFields == null ? Set.of() : Set.copyOf(unknownFields);
    }

    /**
     * @param caseKey natural key of the searched case
     * @return a copy of this record attached to {@code caseKey}
     */
    public CaseRecord withKey(final CaseKey caseKey) {
        return new CaseRecord(caseKey, caseTitle, petitioner, respondent, filingDate,
                nextHearingDate, status, bench, orders, unknownFields);
    }
}
