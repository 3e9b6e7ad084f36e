package com.courtdata.scraper.parser.strategy;

import com.courtdata.scraper.domain.CaseField;
import com.courtdata.scraper.parser.FieldExtractor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads <code>&lt;dt&gt;label&lt;/dt&gt;&lt;dd&gt;value&lt;/dd&gt;</code> pairs.
 */
@Component
@Order(30)
public class DefinitionListExtractor implements FieldExtractor {

    @Override
    public String name() {
        return "definition-list";
    }

    @Override
    public List<String> extract(final Document doc, final CaseField field) {
        List<String> found = new ArrayList<>();
        for (Element dt : doc.select("dl > dt")) {
            Element dd = dt.nextElementSibling();
            if (dd != null && "dd".equals(dd.normalName()) && field.matchesLabel(dt.text())) {
                found.add(dd.text());
            }
        }
        return found;
    }
}
