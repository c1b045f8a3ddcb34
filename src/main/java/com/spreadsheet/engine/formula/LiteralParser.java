package com.spreadsheet.engine.formula;

import com.spreadsheet.engine.models.CellValue;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers the typed value of raw text that is not a formula:
 * blank -> Empty, decimal -> Number, true/false -> Boolean,
 * a real calendar date written with '-' or '/' -> Date, otherwise Text.
 */
public final class LiteralParser {

    private static final Pattern NUMBER_PATTERN =
            Pattern.compile("^[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?$");

    // yyyy-MM-dd and yyyy/M/d
    private static final Pattern YEAR_FIRST = Pattern.compile("^(\\d{4})(?:-(\\d{2})-(\\d{2})|/(\\d{1,2})/(\\d{1,2}))$");
    // M/d/yyyy
    private static final Pattern YEAR_LAST = Pattern.compile("^(\\d{1,2})/(\\d{1,2})/(\\d{4})$");

    private LiteralParser() {
    }

    public static CellValue parse(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return CellValue.empty();
        }
        String trimmed = rawValue.trim();
        Double number = parseNumber(trimmed);
        if (number != null) {
            return CellValue.number(number);
        }
        if ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed)) {
            return CellValue.bool(Boolean.parseBoolean(trimmed.toLowerCase()));
        }
        if (trimmed.indexOf('-') >= 0 || trimmed.indexOf('/') >= 0) {
            LocalDate date = parseDate(trimmed);
            if (date != null) {
                return CellValue.date(date);
            }
        }
        return CellValue.text(rawValue);
    }

    /**
     * Returns the number denoted by unambiguously numeric text, or null.
     */
    public static Double parseNumber(String text) {
        String trimmed = text.trim();
        if (!NUMBER_PATTERN.matcher(trimmed).matches()) {
            return null;
        }
        double value = Double.parseDouble(trimmed);
        return Double.isFinite(value) ? value : null;
    }

    private static LocalDate parseDate(String text) {
        Matcher matcher = YEAR_FIRST.matcher(text);
        if (matcher.matches()) {
            boolean dashed = matcher.group(2) != null;
            return toDate(matcher.group(1),
                    dashed ? matcher.group(2) : matcher.group(4),
                    dashed ? matcher.group(3) : matcher.group(5));
        }
        matcher = YEAR_LAST.matcher(text);
        if (matcher.matches()) {
            return toDate(matcher.group(3), matcher.group(1), matcher.group(2));
        }
        return null;
    }

    private static LocalDate toDate(String year, String month, String day) {
        int y = Integer.parseInt(year);
        int m = Integer.parseInt(month);
        int d = Integer.parseInt(day);
        if (m < 1 || m > 12 || d < 1 || !YearMonth.of(y, m).isValidDay(d)) {
            return null;
        }
        return LocalDate.of(y, m, d);
    }
}
