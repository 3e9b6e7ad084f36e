package com.courtdata.scraper.domain;

import java.util.List;
import java.util.Locale;

/**
 * Case attributes extracted from a result page, with the label keywords the
 * site uses for each of them.
 */
public enum CaseField {

    CASE_TITLE(false, List.of("case title", "cause title", "title"), List.of()),
    PETITIONER(false, List.of("petitioner", "appellant", "applicant"), List.of("advocate", "counsel")),
    RESPONDENT(false, List.of("respondent"), List.of("advocate", "counsel")),
    FILING_DATE(true, List.of("filing", "registration", "filed on"), List.of()),
    NEXT_HEARING_DATE(true,
            List.of("next hearing", "next date", "next listing", "hearing date", "date of hearing", "listed on"),
            List.of("last", "previous")),
    STATUS(false, List.of("status", "stage", "current"), List.of()),
    BENCH(false, List.of("bench", "judge", "coram", "before"), List.of());

    private final boolean date;
    private final List<String> keywords;
    private final List<String> excludes;

    CaseField(final boolean date, final List<String> keywords, final List<String> excludes) {
        this.date = date;
        this.keywords = keywords;
        this.excludes = excludes;
    }

    /**
     * @return {@code true} when the value is a calendar date
     */
    public boolean isDate() {
        return date;
    }

    /**
     * Tells whether a label such as "Petitioner(s):" names this field.
     *
     * @param label label text as found on the page
     * @return {@code true} if a keyword occurs in the label and no exclusion does
     */
    public boolean matchesLabel(final String label) {
        if (label == null) {
            return false;
        }
        String l = label.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(l::contains)
                && excludes.stream().noneMatch(l::contains);
    }
}
