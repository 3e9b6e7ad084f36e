package com.courtdata.scraper.dto;

import java.util.List;

/**
 * Aggregate view of the search history.
 *
 * @param total         attempts recorded
 * @param successful    attempts that ended in SUCCESS
 * @param successRate   percentage of successful attempts, one decimal
 * @param last24Hours   attempts submitted during the last 24 hours
 * @param topCaseTypes  most searched case types, busiest first (at most ten)
 */
public record SearchStatistics(long total,
                               long successful,
                               double successRate,
                               long last24Hours,
                               List<CaseTypeTotal> topCaseTypes) {

    public record CaseTypeTotal(String caseType, long searches) {
    }
}
