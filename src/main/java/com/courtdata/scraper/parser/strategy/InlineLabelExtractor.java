package com.courtdata.scraper.parser.strategy;

import com.courtdata.scraper.domain.CaseField;
import com.courtdata.scraper.parser.FieldExtractor;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads free-text lines of the form <code>Label: value</code> from leaf
 * blocks (paragraphs, list items, divs and spans without nested blocks).
 */
@Component
@Order(40)
public class InlineLabelExtractor implements FieldExtractor {

    private static final String BLOCKS = "p, li, div, span, td";
    private static final String NESTED = "p, li, div, table";
    private static final int MAX_LABEL = 40;

    @Override
    public String name() {
        return "inline-label";
    }

    @Override
    public List<String> extract(final Document doc, final CaseField field) {
        List<String> found = new ArrayList<>();
        for (Element el : doc.select(BLOCKS)) {
            if (!el.children().select(NESTED).isEmpty()) {
                continue;
            }
            String text = el.text();
            int colon = text.indexOf(':');
            if (colon <= 0 || colon > MAX_LABEL) {
                continue;
            }
            String label = text.substring(0, colon);
            String value = text.substring(colon + 1);
            if (field.matchesLabel(label) && StringUtils.isNotBlank(value)) {
                found.add(value);
            }
        }
        return found;
    }
}
