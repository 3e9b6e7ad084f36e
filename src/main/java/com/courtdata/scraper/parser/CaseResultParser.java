package com.courtdata.scraper.parser;

import com.courtdata.scraper.config.CourtSiteCfg;
import com.courtdata.scraper.domain.CaseField;
import com.courtdata.scraper.domain.CaseRecord;
import com.courtdata.scraper.domain.OrderEntry;
import com.courtdata.scraper.exception.CaseNotFoundException;
import com.courtdata.scraper.exception.CaseSearchException;
import com.courtdata.scraper.exception.ResultParseException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <h2>Case Result Parser</h2>
 *
 * <p>Turns the HTML shown after a search submission into a {@link CaseRecord}.
 * The court site renders the same data in several layouts, so each field is
 * looked up through an ordered chain of {@link FieldExtractor} strategies and
 * the first usable candidate wins:</p>
 * <ol>
 *   <li>configured CSS selectors,</li>
 *   <li>labelled table rows,</li>
 *   <li>definition lists,</li>
 *   <li>inline <code>Label: value</code> text,</li>
 *   <li>the <code>X VS. Y</code> cause title (title and parties only).</li>
 * </ol>
 * <p>A field no strategy finds stays {@code null} and is listed in
 * {@link CaseRecord#unknownFields()}; missing fields are never an error.</p>
 *
 * <pre>{@code
 * PageKind kind = parser.classify(html);
 * CaseRecord record = parser.parse(html).withKey(key);
 * }</pre>
 */
@Component
@Slf4j
public class CaseResultParser {

    private static final int MAX_VALUE = 1000;

    private final List<FieldExtractor> extractors;
    private final OrderTableExtractor orderTables;
    private final CourtSiteCfg cfg;

    public CaseResultParser(final List<FieldExtractor> extractors,
                            final OrderTableExtractor orderTables,
                            final CourtSiteCfg cfg) {
        this.extractors = List.copyOf(extractors);
        this.orderTables = orderTables;
        this.cfg = cfg;
    }

    /**
     * Decides what kind of page the site returned. Checks run in this order:
     * no-record markers, error markers, result content, in-progress signs.
     *
     * @param rawPage page HTML
     * @return the page kind, never {@code null}
     */
    public PageKind classify(final String rawPage) {
        Document doc = parseDocument(rawPage);
        String text = doc.body().text().toLowerCase(Locale.ROOT);

        if (containsAny(text, cfg.getMarkers().getNoRecord())) {
            return PageKind.NO_RECORD;
        }
        if (containsAny(text, cfg.getMarkers().getError())) {
            return PageKind.ERROR;
        }
        if (hasResultContent(doc)) {
            return PageKind.RESULT;
        }
        if (StringUtils.isBlank(text)
                || containsAny(text, cfg.getMarkers().getLoading())
                || !doc.select(cfg.getForm().getCaseNumber()).isEmpty()) {
            return PageKind.IN_PROGRESS;
        }
        return PageKind.UNRECOGNIZED;
    }

    /**
     * Extracts the case record from a result page. The returned record has no
     * key; callers attach the searched key with {@link CaseRecord#withKey}.
     *
     * @param rawPage page HTML
     * @return extracted record
     * @throws CaseNotFoundException when the site reports no matching record
     * @throws ResultParseException  when the page is not a result page
     */
    public CaseRecord parse(final String rawPage) {
        PageKind kind = classify(rawPage);
        if (kind != PageKind.RESULT) {
            throw notAResult(kind);
        }

        Document doc = parseDocument(rawPage);
        Map<CaseField, Object> values = new EnumMap<>(CaseField.class);
        Set<CaseField> unknown = EnumSet.noneOf(CaseField.class);
        for (CaseField field : CaseField.values()) {
            Optional<Object> value = find(doc, field);
            value.ifPresentOrElse(v -> values.put(field, v), () -> unknown.add(field));
        }
        List<OrderEntry> orders = orderTables.extract(doc);
        if (!unknown.isEmpty()) {
            log.debug("Fields not found on result page: {}", unknown);
        }

        return new CaseRecord(
                null,
                (String) values.get(CaseField.CASE_TITLE),
                (String) values.get(CaseField.PETITIONER),
                (String) values.get(CaseField.RESPONDENT),
                (LocalDate) values.get(CaseField.FILING_DATE),
                (LocalDate) values.get(CaseField.NEXT_HEARING_DATE),
                (String) values.get(CaseField.STATUS),
                (String) values.get(CaseField.BENCH),
                orders,
                unknown);
    }

    private static CaseSearchException notAResult(final PageKind kind) {
        return switch (kind) {
            case NO_RECORD -> new CaseNotFoundException("No record found for the requested case");
            case ERROR -> new ResultParseException("Court site returned an error or maintenance page");
            case IN_PROGRESS -> new ResultParseException("Result page did not finish loading");
            default -> new ResultParseException("Unrecognised result page layout");
        };
    }

    private Optional<Object> find(final Document doc, final CaseField field) {
        for (FieldExtractor extractor : extractors) {
            for (String candidate : extractor.extract(doc, field)) {
                Optional<Object> value = normalize(field, candidate);
                if (value.isPresent()) {
                    log.trace("{} found by {} strategy", field, extractor.name());
                    return value;
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Object> normalize(final CaseField field, final String raw) {
        String text = StringUtils.normalizeSpace(StringUtils.strip(raw, " :- "));
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        if (field.isDate()) {
            return LenientDateParser.parse(text).map(Object.class::cast);
        }
        return Optional.of(StringUtils.abbreviate(text, MAX_VALUE));
    }

    private boolean hasResultContent(final Document doc) {
        if (!doc.select(cfg.getMarkers().getResultContainer()).isEmpty()) {
            return true;
        }
        for (CaseField field : CaseField.values()) {
            if (find(doc, field).isPresent()) {
                return true;
            }
        }
        return !orderTables.extract(doc).isEmpty();
    }

    private Document parseDocument(final String rawPage) {
        return Jsoup.parse(Objects.toString(rawPage, ""), cfg.getBaseUrl());
    }

    private static boolean containsAny(final String text, final List<String> markers) {
        return markers.stream()
                .map(m -> m.toLowerCase(Locale.ROOT))
                .anyMatch(text::contains);
    }
}
