package com.courtdata.scraper.parser;

import com.courtdata.scraper.domain.OrderEntry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * <h2>Order Table Extractor</h2>
 * <p>Collects orders and judgments from the tables of a result page.</p>
 * <ol>
 *   <li><strong>Table selection:</strong> a table qualifies when its header row
 *       (all cells {@code th}) mentions "order" or "judgment", or mentions
 *       "date" together with "link", "pdf" or "download".</li>
 *   <li><strong>Date:</strong> the cell under a "date" header, otherwise the
 *       first cell holding a parseable date.</li>
 *   <li><strong>PDF:</strong> the first anchor whose href contains ".pdf" or
 *       "download", made absolute against the document base URI.</li>
 *   <li><strong>Description:</strong> the cell under a description-like header,
 *       otherwise the remaining cell text; "Order" when nothing is left.</li>
 *   <li><strong>Filtering:</strong> rows with neither date nor PDF are skipped;
 *       repeated (date, description) pairs collapse into one entry.</li>
 * </ol>
 */
@Component
@Slf4j
public class OrderTableExtractor {

    static final String DEFAULT_DESCRIPTION = "Order";

    private static final List<String> DESCRIPTION_HEADERS =
            List.of("description", "detail", "particular", "remark", "subject", "type");
    private static final List<String> LINK_WORDS = List.of("link", "pdf", "download");

    /**
     * @param doc result page parsed with the site base URL as base URI
     * @return orders in page order; never {@code null}
     */
    public List<OrderEntry> extract(final Document doc) {
        Map<String, OrderEntry> entries = new LinkedHashMap<>();
        for (Element table : doc.select("table")) {
            Element header = headerRow(table);
            if (header == null || !isOrderTable(header.text())) {
                continue;
            }
            Columns cols = Columns.of(header.select("> th"));
            for (Element row : table.select("tr")) {
                if (row == header || row.select("> td").isEmpty()) {
                    continue;
                }
                OrderEntry entry = readRow(row.select("> td"), cols);
                if (entry != null) {
                    entries.merge(entry.orderDate() + "|" + entry.description(),
                            entry, OrderTableExtractor::preferLinked);
                }
            }
        }
        log.debug("Extracted {} order row(s)", entries.size());
        return new ArrayList<>(entries.values());
    }

    private static Element headerRow(final Element table) {
        for (Element row : table.select("tr")) {
            Elements ths = row.select("> th");
            if (!ths.isEmpty() && row.select("> td").isEmpty()) {
                return row;
            }
        }
        return null;
    }

    private static boolean isOrderTable(final String headerText) {
        String h = headerText.toLowerCase(Locale.ROOT);
        if (h.contains("order") || h.contains("judgment") || h.contains("judgement")) {
            return true;
        }
        return h.contains("date") && LINK_WORDS.stream().anyMatch(h::contains);
    }

    private static OrderEntry readRow(final Elements cells, final Columns cols) {
        LocalDate date = null;
        int dateIdx = -1;
        if (cols.date >= 0 && cols.date < cells.size()) {
            date = LenientDateParser.parse(cells.get(cols.date).text()).orElse(null);
            dateIdx = date != null ? cols.date : -1;
        }
        for (int i = 0; date == null && i < cells.size(); i++) {
            date = LenientDateParser.parse(cells.get(i).text()).orElse(null);
            dateIdx = date != null ? i : -1;
        }

        Element link = cells.select("a[href]").stream()
                .filter(a -> {
                    String href = a.attr("href").toLowerCase(Locale.ROOT);
                    return href.contains(".pdf") || href.contains("download");
                })
                .findFirst()
                .orElse(null);
        String pdf = link == null ? null : StringUtils.defaultIfBlank(link.absUrl("href"), link.attr("href"));

        if (date == null && pdf == null) {
            return null;
        }
        return new OrderEntry(date, describe(cells, cols, dateIdx, link), pdf);
    }

    private static String describe(final Elements cells, final Columns cols,
                                   final int dateIdx, final Element link) {
        if (cols.description >= 0 && cols.description < cells.size()
                && StringUtils.isNotBlank(cells.get(cols.description).text())) {
            return cells.get(cols.description).text();
        }
        List<String> parts = new ArrayList<>();
        for (int i = 0; i < cells.size(); i++) {
            String text = cells.get(i).text();
            boolean serial = StringUtils.isNumeric(StringUtils.removeEnd(text, "."));
            boolean linkOnly = link != null && text.equals(link.text());
            if (i != dateIdx && !serial && !linkOnly && StringUtils.isNotBlank(text)) {
                parts.add(text);
            }
        }
        return parts.isEmpty() ? DEFAULT_DESCRIPTION : String.join(" ", parts);
    }

    private static OrderEntry preferLinked(final OrderEntry first, final OrderEntry again) {
        return first.pdfLocation() == null && again.pdfLocation() != null ? again : first;
    }

    /** Column positions picked from the header, -1 when absent. */
    private record Columns(int date, int description) {

        static Columns of(final Elements headers) {
            int date = -1;
            int description = -1;
            for (int i = 0; i < headers.size(); i++) {
                String h = headers.get(i).text().toLowerCase(Locale.ROOT);
                if (date < 0 && h.contains("date")) {
                    date = i;
                } else if (description < 0 && DESCRIPTION_HEADERS.stream().anyMatch(h::contains)) {
                    description = i;
                }
            }
            return new Columns(date, description);
        }
    }
}
