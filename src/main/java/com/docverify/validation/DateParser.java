package com.docverify.validation;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the date notations found on identity and education documents.
 *
 * Formats are tried in order: ISO (yyyy-M-d, optionally followed by a time), d/M/yyyy with
 * '/', '-' or '.' separators, "d Mon yyyy", "Month d, yyyy", a bare year, then a handful of
 * generic ISO/RFC notations. Values that match a pattern but name an impossible calendar day
 * (31/02/2020) are treated as unparseable.
 */
public final class DateParser {

    private static final Pattern ISO = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})");
    private static final Pattern DAY_MONTH_YEAR = Pattern.compile("^(\\d{1,2})[/\\-.](\\d{1,2})[/\\-.](\\d{4})$");
    private static final Pattern DAY_NAMED_MONTH_YEAR = Pattern.compile("^(\\d{1,2})[\\s\\-.]?([a-zA-Z]+)[\\s\\-.,]?\\s*(\\d{4})$");
    private static final Pattern NAMED_MONTH_DAY_YEAR = Pattern.compile("^([a-zA-Z]+)\\s+(\\d{1,2}),?\\s*(\\d{4})$");
    private static final Pattern BARE_YEAR = Pattern.compile("^\\d{4}$");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("january", 1),
            Map.entry("feb", 2), Map.entry("february", 2),
            Map.entry("mar", 3), Map.entry("march", 3),
            Map.entry("apr", 4), Map.entry("april", 4),
            Map.entry("may", 5),
            Map.entry("jun", 6), Map.entry("june", 6),
            Map.entry("jul", 7), Map.entry("july", 7),
            Map.entry("aug", 8), Map.entry("august", 8),
            Map.entry("sep", 9), Map.entry("sept", 9), Map.entry("september", 9),
            Map.entry("oct", 10), Map.entry("october", 10),
            Map.entry("nov", 11), Map.entry("november", 11),
            Map.entry("dec", 12), Map.entry("december", 12));

    private static final List<DateTimeFormatter> FALLBACK_FORMATS = List.of(
            DateTimeFormatter.ofPattern("yyyy/M/d", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("yyyy.M.d", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("yyyyMMdd", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("MMM d yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("EEE MMM d yyyy", Locale.ENGLISH));

    private DateParser() {}

    public static Optional<LocalDate> parse(String value) {
        if (value == null) return Optional.empty();
        String str = value.trim();
        if (str.isEmpty()) return Optional.empty();

        try {
            Matcher iso = ISO.matcher(str);
            if (iso.find()) {
                return Optional.of(LocalDate.of(
                        Integer.parseInt(iso.group(1)), Integer.parseInt(iso.group(2)), Integer.parseInt(iso.group(3))));
            }

            Matcher dmy = DAY_MONTH_YEAR.matcher(str);
            if (dmy.matches()) {
                int day = Integer.parseInt(dmy.group(1));
                int month = Integer.parseInt(dmy.group(2));
                int year = Integer.parseInt(dmy.group(3));
                if (month >= 1 && month <= 12 && day >= 1 && day <= 31) {
                    return Optional.of(LocalDate.of(year, month, day));
                }
            }

            Matcher named = DAY_NAMED_MONTH_YEAR.matcher(str);
            if (named.matches()) {
                Integer month = MONTHS.get(named.group(2).toLowerCase(Locale.ROOT));
                if (month != null) {
                    return Optional.of(LocalDate.of(
                            Integer.parseInt(named.group(3)), month, Integer.parseInt(named.group(1))));
                }
            }

            Matcher mdy = NAMED_MONTH_DAY_YEAR.matcher(str);
            if (mdy.matches()) {
                Integer month = MONTHS.get(mdy.group(1).toLowerCase(Locale.ROOT));
                if (month != null) {
                    return Optional.of(LocalDate.of(
                            Integer.parseInt(mdy.group(3)), month, Integer.parseInt(mdy.group(2))));
                }
            }

            if (BARE_YEAR.matcher(str).matches()) {
                int year = Integer.parseInt(str);
                if (year >= 1900 && year <= 2100) {
                    return Optional.of(LocalDate.of(year, 1, 1));
                }
            }
        } catch (DateTimeException e) {
            // Matched a known layout but not a real calendar day
            return Optional.empty();
        }

        return parseGeneric(str);
    }

    private static Optional<LocalDate> parseGeneric(String str) {
        List<Function<String, LocalDate>> parsers = new ArrayList<>();
        parsers.add(s -> OffsetDateTime.parse(s).toLocalDate());
        parsers.add(s -> LocalDateTime.parse(s).toLocalDate());
        parsers.add(s -> ZonedDateTime.parse(s, DateTimeFormatter.RFC_1123_DATE_TIME).toLocalDate());
        for (DateTimeFormatter formatter : FALLBACK_FORMATS) {
            parsers.add(s -> LocalDate.parse(s, formatter));
        }

        for (Function<String, LocalDate> parser : parsers) {
            Optional<LocalDate> parsed = tryParse(parser, str);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> tryParse(Function<String, LocalDate> parser, String str) {
        try {
            return Optional.of(parser.apply(str));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
