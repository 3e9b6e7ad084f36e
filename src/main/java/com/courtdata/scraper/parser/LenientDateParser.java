package com.courtdata.scraper.parser;

import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the first calendar date inside a piece of page text.
 * <p>Accepted shapes, tried in this order:</p>
 * <ol>
 *   <li>ISO {@code 2023-05-01}</li>
 *   <li>day-month-year with {@code -}, {@code /} or {@code .} separators,
 *       two- or four-digit year ({@code 01-05-2023}, {@code 1/5/23})</li>
 *   <li>day, month name, year ({@code 01 May 2023}, {@code 1st May, 2023})</li>
 *   <li>month name, day, year ({@code May 1, 2023})</li>
 * </ol>
 * A two-digit year up to 69 is read as 20xx, anything above as 19xx.
 */
public final class LenientDateParser {

    private static final int PIVOT = 69;

    private static final Pattern ISO =
            Pattern.compile("\\b(\\d{4})-(\\d{1,2})-(\\d{1,2})\\b");
    private static final Pattern DAY_MONTH_YEAR =
            Pattern.compile("\\b(\\d{1,2})[-/.](\\d{1,2})[-/.](\\d{4}|\\d{2})\\b");
    private static final Pattern DAY_NAME_YEAR =
            Pattern.compile("\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+([A-Za-z]{3,9})\\.?,?\\s+(\\d{4})\\b");
    private static final Pattern NAME_DAY_YEAR =
            Pattern.compile("\\b([A-Za-z]{3,9})\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4})\\b");

    private static final List<Function<String, Optional<LocalDate>>> SHAPES = List.of(
            s -> scan(ISO, s, m -> date(num(m, 1), num(m, 2), num(m, 3))),
            s -> scan(DAY_MONTH_YEAR, s, m -> date(year(m.group(3)), num(m, 2), num(m, 1))),
            s -> scan(DAY_NAME_YEAR, s, m -> date(num(m, 3), month(m.group(2)), num(m, 1))),
            s -> scan(NAME_DAY_YEAR, s, m -> date(num(m, 3), month(m.group(1)), num(m, 2)))
    );

    private LenientDateParser() {
    }

    /**
     * @param text free text that may contain a date
     * @return the first date found, or empty when none parses
     */
    public static Optional<LocalDate> parse(final String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        for (Function<String, Optional<LocalDate>> shape : SHAPES) {
            Optional<LocalDate> date = shape.apply(text);
            if (date.isPresent()) {
                return date;
            }
        }
        return Optional.empty();
    }

    /** Tries every match of {@code p} until one converts to a valid date. */
    private static Optional<LocalDate> scan(final Pattern p, final String text,
                                            final Function<Matcher, Optional<LocalDate>> convert) {
        Matcher m = p.matcher(text);
        while (m.find()) {
            Optional<LocalDate> date = convert.apply(m);
            if (date.isPresent()) {
                return date;
            }
        }
        return Optional.empty();
    }

    /** Rejects impossible dates such as 31-02-2023 instead of letting java.time throw. */
    private static Optional<LocalDate> date(final int year, final int month, final int day) {
        if (month < 1 || month > 12 || day < 1 || year < 1) {
            return Optional.empty();
        }
        if (day > YearMonth.of(year, month).lengthOfMonth()) {
            return Optional.empty();
        }
        return Optional.of(LocalDate.of(year, month, day));
    }

    private static int num(final Matcher m, final int group) {
        return Integer.parseInt(m.group(group));
    }

    private static int year(final String digits) {
        int y = Integer.parseInt(digits);
        if (digits.length() == 2) {
            return y <= PIVOT ? 2000 + y : 1900 + y;
        }
        return y;
    }

    /** @return month number for "May", "Sept", "december"..., or 0 when unknown */
    private static int month(final String token) {
        String t = token.toLowerCase(Locale.ROOT);
        for (Month month : Month.values()) {
            if (month.name().toLowerCase(Locale.ROOT).startsWith(t)) {
                return month.getValue();
            }
        }
        return 0;
    }
}
