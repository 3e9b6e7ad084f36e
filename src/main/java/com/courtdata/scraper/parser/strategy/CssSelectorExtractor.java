package com.courtdata.scraper.parser.strategy;

import com.courtdata.scraper.config.CourtSiteCfg;
import com.courtdata.scraper.domain.CaseField;
import com.courtdata.scraper.parser.FieldExtractor;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Reads a field from site-specific CSS selectors configured under
 * <code>court.site.field-selectors</code>, falling back to a few well-known
 * class names.
 */
@Component
@Order(10)
@RequiredArgsConstructor
public class CssSelectorExtractor implements FieldExtractor {

    private static final Map<CaseField, List<String>> DEFAULTS = Map.of(
            CaseField.CASE_TITLE, List.of(".case-title", "#case-title"),
            CaseField.STATUS, List.of(".case-status", "#case-status"),
            CaseField.NEXT_HEARING_DATE, List.of(".next-hearing", "#next-hearing-date")
    );

    private final CourtSiteCfg cfg;

    @Override
    public String name() {
        return "css";
    }

    @Override
    public List<String> extract(final Document doc, final CaseField field) {
        List<String> selectors = cfg.getFieldSelectors()
                .getOrDefault(field, DEFAULTS.getOrDefault(field, List.of()));
        return selectors.stream()
                .flatMap(sel -> doc.select(sel).stream())
                .map(Element::text)
                .toList();
    }
}
