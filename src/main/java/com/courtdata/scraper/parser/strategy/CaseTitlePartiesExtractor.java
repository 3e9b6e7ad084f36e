package com.courtdata.scraper.parser.strategy;

import com.courtdata.scraper.domain.CaseField;
import com.courtdata.scraper.parser.FieldExtractor;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the title and the parties from a cause title such as
 * <code>RAM KUMAR VS. UNION OF INDIA &amp; ORS.</code>.
 */
@Component
@Order(50)
public class CaseTitlePartiesExtractor implements FieldExtractor {

    private static final Pattern VERSUS = Pattern.compile(
            "^(.+?)\\s+(?:vs?\\.?|versus)\\s+(.+)$", Pattern.CASE_INSENSITIVE);

    private static final String CANDIDATES = ".case-title, #case-title, h1, h2, h3, h4, td, p, span";
    private static final int MAX_TITLE = 500;

    @Override
    public String name() {
        return "cause-title";
    }

    @Override
    public List<String> extract(final Document doc, final CaseField field) {
        if (field != CaseField.CASE_TITLE && field != CaseField.PETITIONER
                && field != CaseField.RESPONDENT) {
            return List.of();
        }
        List<String> found = new ArrayList<>();
        for (Element el : doc.select(CANDIDATES)) {
            String text = el.text();
            if (text.length() > MAX_TITLE) {
                continue;
            }
            Matcher m = VERSUS.matcher(text);
            if (m.matches()) {
                found.add(switch (field) {
                    case PETITIONER -> m.group(1);
                    case RESPONDENT -> m.group(2);
                    default -> text;
                });
            }
        }
        return found;
    }
}
