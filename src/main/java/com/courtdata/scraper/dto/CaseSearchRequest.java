package com.courtdata.scraper.dto;

/**
 * Request body for {@code POST /api/searches}.
 * <p>
 * Fields are validated by the search run itself (so that rejected requests
 * are still recorded in the history), not by bean validation.
 * </p>
 *
 * @param caseType    case type label, e.g. "W.P.(C)"
 * @param caseNumber  case number, digits only
 * @param year        filing year
 * @param captchaCode optional CAPTCHA code read in advance
 */
public record CaseSearchRequest(String caseType, String caseNumber, Integer year, String captchaCode) {

    public CaseSearchRequest(final String caseType, final String caseNumber, final Integer year) {
        this(caseType, caseNumber, year, null);
    }

    @Override
    public String toString() {
        return "CaseSearchRequest[" + caseType + "/" + caseNumber + "/" + year
                + (captchaCode == null ? "" : ", captcha=***") + "]";
    }
}
