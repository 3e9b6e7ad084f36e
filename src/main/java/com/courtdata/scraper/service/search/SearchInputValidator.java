package com.courtdata.scraper.service.search;

import com.courtdata.scraper.config.CourtSiteCfg;
import com.courtdata.scraper.config.SearchProperties;
import com.courtdata.scraper.domain.CaseKey;
import com.courtdata.scraper.dto.CaseSearchRequest;
import com.courtdata.scraper.exception.SearchValidationException;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Year;
import java.util.regex.Pattern;

/**
 * Checks a search request before any remote interaction and turns it into
 * the case's natural key.
 * <ul>
 *   <li>case type: non-blank; one of <code>court.site.case-types</code> when that list is set</li>
 *   <li>case number: 1 to 10 digits, not zero; leading zeros are dropped</li>
 *   <li>year: between <code>court.search.min-year</code> and the current year</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class SearchInputValidator {

    private static final Pattern CASE_NUMBER = Pattern.compile("\\d{1,10}");

    private final CourtSiteCfg site;
    private final SearchProperties props;
    private final Clock clock;

    /**
     * @param request incoming request
     * @return normalized natural key
     * @throws SearchValidationException describing the first invalid field
     */
    public CaseKey validate(final CaseSearchRequest request) {
        String type = StringUtils.trimToEmpty(request.caseType());
        if (type.isEmpty()) {
            throw new SearchValidationException("Case type is required");
        }
        if (!site.getCaseTypes().isEmpty()) {
            type = site.getCaseTypes().stream()
                    .filter(type::equalsIgnoreCase)
                    .findFirst()
                    .orElseThrow(() -> new SearchValidationException(
                            "Unknown case type: " + StringUtils.abbreviate(request.caseType(), 64)));
        }

        String number = StringUtils.trimToEmpty(request.caseNumber());
        if (!CASE_NUMBER.matcher(number).matches()) {
            throw new SearchValidationException("Case number must be 1 to 10 digits");
        }
        number = StringUtils.stripStart(number, "0");
        if (number.isEmpty()) {
            throw new SearchValidationException("Case number must not be zero");
        }

        Integer year = request.year();
        int current = Year.now(clock).getValue();
        if (year == null) {
            throw new SearchValidationException("Year is required");
        }
        if (year < props.getMinYear() || year > current) {
            throw new SearchValidationException(
                    "Year must be between " + props.getMinYear() + " and " + current);
        }
        return new CaseKey(type, number, year);
    }
}
