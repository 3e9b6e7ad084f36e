package com.courtdata.scraper.parser.strategy;

import com.courtdata.scraper.domain.CaseField;
import com.courtdata.scraper.parser.FieldExtractor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads <code>label | value</code> table rows. Rows with four cells are read
 * as two label/value pairs side by side.
 * <pre>{@code
 * <tr><td>Petitioner</td><td>RAM KUMAR</td></tr>
 * <tr><th>Filing Date</th><td>12-01-2023</td><th>Status</th><td>PENDING</td></tr>
 * }</pre>
 */
@Component
@Order(20)
public class LabelledTableRowExtractor implements FieldExtractor {

    @Override
    public String name() {
        return "table-row";
    }

    @Override
    public List<String> extract(final Document doc, final CaseField field) {
        List<String> found = new ArrayList<>();
        for (Element row : doc.select("tr")) {
            Elements cells = row.select("> td, > th");
            int pairs = cells.size() % 2 == 0 ? cells.size() : Math.min(cells.size(), 2);
            for (int i = 0; i + 1 < pairs; i += 2) {
                if (field.matchesLabel(cells.get(i).text())) {
                    found.add(cells.get(i + 1).text());
                }
            }
        }
        return found;
    }
}
