package com.courtdata.scraper.domain;

import java.util.Objects;

/**
 * Natural key of a court case: type, number and year. Rendered as
 * <code>TYPE/NUMBER/YEAR</code>, e.g. <code>W.P.(C)/1234/2023</code>.
 *
 * @param caseType   case type label as shown by the site
 * @param caseNumber case number, digits only
 * @param year       filing year
 */
public record CaseKey(String caseType, String caseNumber, int year) {

    public CaseKey {
        Objects.requireNonNull(caseType, "caseType");
        Objects.requireNonNull(caseNumber, "caseNumber");
    }

    /**
     * @return the identifier used as the primary key of the stored case
     */
    public String id() {
        return caseType + "/" + caseNumber + "/" + year;
    }

    @Override
    public String toString() {
        return id();
    }
}
