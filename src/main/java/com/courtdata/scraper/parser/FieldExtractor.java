package com.courtdata.scraper.parser;

import com.courtdata.scraper.domain.CaseField;
import org.jsoup.nodes.Document;

import java.util.List;

/**
 * One way of locating a case field on a result page. The parser asks every
 * extractor in order and keeps the first candidate that survives
 * normalization.
 */
public interface FieldExtractor {

    /**
     * @return short name used in debug logs
     */
    String name();

    /**
     * @param doc   the parsed result page (never modified)
     * @param field the field being looked for
     * @return candidate raw values in document order; empty when nothing matches
     */
    List<String> extract(Document doc, CaseField field);

}
