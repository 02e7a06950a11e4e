package com.docverify.validation;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks every date-like field of the extracted data: parseability, plausible range for the
 * kind of date, and the ordering between birth, issue, expiry and exam dates.
 */
@Component
public class DateValidator {

    static final List<String> DATE_FIELDS = List.of(
            "date_of_birth", "dob", "birth_date",
            "issue_date", "date_of_issue", "issued_on",
            "expiry_date", "date_of_expiry", "valid_until", "valid_till", "expiry",
            "exam_date", "date_of_exam", "examination_date",
            "date_of_passing", "passing_date", "year_of_passing",
            "registration_date", "date_of_registration",
            "statement_date", "bill_date");

    private static final Pattern LEADING_YEAR = Pattern.compile("^(\\d{4})");
    private static final double DAYS_PER_YEAR = 365.25;

    private final Clock clock;

    public DateValidator(Clock clock) {
        this.clock = clock;
    }

    public CheckResult validate(Map<String, String> extractedData, String documentType) {
        LocalDate today = LocalDate.now(clock);
        List<String> issues = new ArrayList<>();
        Map<String, String> checkedFields = new LinkedHashMap<>();
        Map<String, LocalDate> parsedDates = new LinkedHashMap<>();

        for (Map.Entry<String, String> entry : extractedData.entrySet()) {
            String key = entry.getKey();
            String value = entry.getValue();
            if (value == null || value.isEmpty() || !isDateField(key)) continue;

            Optional<LocalDate> parsed = DateParser.parse(value);
            if (parsed.isEmpty()) {
                Optional<LocalDate> year = parseYearOnly(key, value, today);
                if (year.isPresent()) {
                    checkedFields.put(key, "valid year");
                    parsedDates.put(key, year.get());
                    continue;
                }
                issues.add(String.format("Invalid date format for '%s': \"%s\" is not a recognizable date", key, value));
                checkedFields.put(key, "unrecognizable date format");
                continue;
            }

            LocalDate date = parsed.get();
            if (date.getYear() < 1900 || date.getYear() > 2100) {
                issues.add(String.format("Invalid date for '%s': \"%s\" is not a real calendar date", key, value));
                checkedFields.put(key, "not a real calendar date");
                continue;
            }

            String rangeIssue = checkRange(key, date, today);
            if (rangeIssue != null) {
                issues.add(rangeIssue);
                checkedFields.put(key, rangeIssue);
                continue;
            }

            checkedFields.put(key, "valid");
            parsedDates.put(key, date);
        }

        issues.addAll(crossValidate(parsedDates, documentType));
        return CheckResult.of(issues, checkedFields);
    }

    static boolean isDateField(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        if (DATE_FIELDS.contains(lower)) return true;
        for (String known : DATE_FIELDS) {
            if (lower.contains(known.replace("_", ""))) return true;
        }
        return lower.contains("date") || lower.contains("dob")
                || lower.endsWith("_on") || lower.endsWith("_at");
    }

    // Year-named fields may carry things like "2015-16" that no date layout accepts.
    private Optional<LocalDate> parseYearOnly(String key, String value, LocalDate today) {
        if (!key.toLowerCase(Locale.ROOT).contains("year")) return Optional.empty();
        Matcher matcher = LEADING_YEAR.matcher(value.trim());
        if (!matcher.find()) return Optional.empty();
        int year = Integer.parseInt(matcher.group(1));
        if (year >= 1900 && year <= today.getYear() + 5) {
            return Optional.of(LocalDate.of(year, 1, 1));
        }
        return Optional.empty();
    }

    private String checkRange(String fieldName, LocalDate date, LocalDate today) {
        String field = fieldName.toLowerCase(Locale.ROOT);

        if (field.contains("birth") || field.contains("dob")) {
            if (date.isAfter(today)) {
                return String.format("Date of birth '%s' is in the future", fieldName);
            }
            if (yearsBetween(date, today) > 150) {
                return String.format("Date of birth '%s' implies age over 150 years", fieldName);
            }
        }

        if ((field.contains("issue") || field.contains("registration") || field.contains("passing"))
                && date.isAfter(today.plusDays(30))) {
            return String.format("Issue/registration date '%s' is in the future", fieldName);
        }

        if ((field.contains("expir") || field.contains("valid")) && yearsBetween(today, date) > 50) {
            return String.format("Expiry date '%s' is more than 50 years in the future", fieldName);
        }

        if (field.contains("exam") && date.isAfter(today.plusDays(365))) {
            return String.format("Exam date '%s' is unreasonably far in the future", fieldName);
        }

        return null;
    }

    private List<String> crossValidate(Map<String, LocalDate> dates, String documentType) {
        List<String> issues = new ArrayList<>();

        String dobKey = findKey(dates, k -> k.contains("birth") || k.contains("dob"));
        String issueKey = findKey(dates, k -> k.contains("issue") && !k.contains("expir"));
        String expiryKey = findKey(dates, k -> k.contains("expir") || k.contains("valid"));
        String passingKey = findKey(dates, k -> k.contains("passing"));
        String examKey = findKey(dates, k -> k.contains("exam") && k.contains("date"));

        LocalDate dob = dobKey != null ? dates.get(dobKey) : null;
        LocalDate issued = issueKey != null ? dates.get(issueKey) : null;
        LocalDate expiry = expiryKey != null ? dates.get(expiryKey) : null;
        LocalDate passing = passingKey != null ? dates.get(passingKey) : null;
        LocalDate exam = examKey != null ? dates.get(examKey) : null;

        if (issued != null && expiry != null && !issued.isBefore(expiry)) {
            issues.add(String.format("Issue date (%s) must be before expiry date (%s)", issueKey, expiryKey));
        }
        if (dob != null && issued != null && !dob.isBefore(issued)) {
            issues.add(String.format("Date of birth (%s) must be before issue date (%s)", dobKey, issueKey));
        }
        if (dob != null && passing != null && !dob.isBefore(passing)) {
            issues.add("Date of birth must be before date of passing");
        }
        if (dob != null && exam != null && !dob.isBefore(exam)) {
            issues.add("Date of birth must be before exam date");
        }

        if (dob != null && (passing != null || exam != null)) {
            LocalDate examDate = passing != null ? passing : exam;
            if (yearsBetween(dob, examDate) < 5) {
                issues.add("Person appears to be under 5 years old at the time of examination - suspicious");
            }
        }

        if (dob != null && issued != null) {
            double ageAtIssue = yearsBetween(dob, issued);
            if ("driving_license".equals(documentType) && ageAtIssue < 16) {
                issues.add("Person appears to be under 16 at driving license issue date");
            }
            if ("voter_id".equals(documentType) && ageAtIssue < 18) {
                issues.add("Person appears to be under 18 at voter ID issue date");
            }
            if ("pan".equals(documentType) && ageAtIssue < 0) {
                issues.add("PAN card issue date is before date of birth");
            }
        }

        return issues;
    }

    private static String findKey(Map<String, LocalDate> dates, Predicate<String> matcher) {
        for (String key : dates.keySet()) {
            if (matcher.test(key.toLowerCase(Locale.ROOT))) return key;
        }
        return null;
    }

    private static double yearsBetween(LocalDate from, LocalDate to) {
        return ChronoUnit.DAYS.between(from, to) / DAYS_PER_YEAR;
    }
}
