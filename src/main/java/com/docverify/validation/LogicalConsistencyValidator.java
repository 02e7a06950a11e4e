package com.docverify.validation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cross-field plausibility: name parts, client metadata, per-type rules and numeric ranges.
 */
@Component
public class LogicalConsistencyValidator {

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*([+-]?(\\d+\\.?\\d*|\\.\\d+))");
    private static final Pattern PIN_CODE = Pattern.compile("^\\d{6}$");
    private static final Set<String> GENDERS = Set.of("male", "female", "transgender", "m", "f", "t");
    private static final Set<String> PASSPORT_TYPES = Set.of("P", "D", "S", "O");
    private static final List<String> NON_PERSON_NAME_MARKERS = List.of("exam", "board", "school", "institution", "university");

    public CheckResult validate(String documentType, Map<String, String> extractedData, Map<String, String> metadata) {
        List<String> issues = new ArrayList<>();
        Map<String, String> checks = new LinkedHashMap<>();

        record("name_consistency", checkNameConsistency(extractedData), issues, checks);
        record("metadata_match", checkMetadataMatch(extractedData, metadata), issues, checks);
        record("type_specific", checkDocumentTypeRules(documentType, extractedData), issues, checks);
        record("numeric_fields", checkNumericFields(extractedData), issues, checks);

        return CheckResult.of(issues, checks);
    }

    private static void record(String check, List<String> found, List<String> issues, Map<String, String> checks) {
        checks.put(check, found.isEmpty() ? "passed" : "failed");
        issues.addAll(found);
    }

    List<String> checkNameConsistency(Map<String, String> data) {
        Map<String, String> nameFields = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : data.entrySet()) {
            if (entry.getValue() == null) continue;
            String key = entry.getKey().toLowerCase(Locale.ROOT);
            if (key.contains("name") && NON_PERSON_NAME_MARKERS.stream().noneMatch(key::contains)) {
                nameFields.put(entry.getKey(), entry.getValue().trim());
            }
        }

        String fullName = firstPresent(nameFields, "full_name", "name", "holder_name", "student_name");
        String firstName = firstPresent(nameFields, "first_name");
        String lastName = firstPresent(nameFields, "last_name", "surname");

        List<String> issues = new ArrayList<>();
        if (fullName != null && firstName != null
                && !fullName.toLowerCase(Locale.ROOT).contains(firstName.toLowerCase(Locale.ROOT))) {
            issues.add(String.format("Name inconsistency: first_name \"%s\" not found within full name \"%s\"", firstName, fullName));
        }
        if (fullName != null && lastName != null
                && !fullName.toLowerCase(Locale.ROOT).contains(lastName.toLowerCase(Locale.ROOT))) {
            issues.add(String.format("Name inconsistency: last_name \"%s\" not found within full name \"%s\"", lastName, fullName));
        }
        return issues;
    }

    List<String> checkMetadataMatch(Map<String, String> data, Map<String, String> metadata) {
        List<String> issues = new ArrayList<>();
        if (metadata == null || metadata.isEmpty()) return issues;

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            String metaKey = entry.getKey();
            String metaValue = entry.getValue();
            if (metaValue == null || metaValue.isEmpty()) continue;
            String extractedValue = data.get(metaKey);
            if (extractedValue == null) continue;

            String expected = metaValue.trim().toLowerCase(Locale.ROOT);
            String actual = extractedValue.trim().toLowerCase(Locale.ROOT);

            boolean matches;
            if (metaKey.toLowerCase(Locale.ROOT).contains("name")) {
                List<String> actualWords = Arrays.asList(actual.split("\\s+"));
                matches = Arrays.stream(expected.split("\\s+")).anyMatch(actualWords::contains);
            } else {
                matches = stripSeparators(expected).equals(stripSeparators(actual));
            }

            if (!matches) {
                issues.add(String.format("Metadata mismatch: '%s' - expected \"%s\", extracted \"%s\"",
                        metaKey, metaValue, extractedValue));
            }
        }
        return issues;
    }

    List<String> checkDocumentTypeRules(String documentType, Map<String, String> data) {
        List<String> issues = new ArrayList<>();
        if (documentType == null) return issues;

        switch (documentType) {
            case "aadhaar": {
                String gender = firstPresent(data, "gender", "sex");
                if (gender != null && !GENDERS.contains(gender.toLowerCase(Locale.ROOT))) {
                    issues.add(String.format("Invalid gender value on Aadhaar: \"%s\"", gender));
                }
                break;
            }
            case "passport": {
                String nationality = firstPresent(data, "nationality", "country");
                if (nationality != null && nationality.trim().length() < 2) {
                    issues.add("Passport nationality field is too short");
                }
                String passportType = firstPresent(data, "passport_type", "type");
                if (passportType != null && !PASSPORT_TYPES.contains(passportType.toUpperCase(Locale.ROOT))) {
                    issues.add(String.format("Invalid passport type: \"%s\". Expected P (ordinary), D (diplomatic), "
                            + "S (service), or O (official)", passportType));
                }
                break;
            }
            case "marksheet_10":
            case "marksheet_12": {
                OptionalDouble total = parseNumber(firstPresent(data, "total_marks", "total", "aggregate"));
                OptionalDouble percentage = parseNumber(data.get("percentage"));
                if (total.isPresent() && percentage.isPresent()) {
                    double pct = percentage.getAsDouble();
                    if (pct < 0 || pct > 100) {
                        issues.add(String.format("Percentage %s%% is outside valid range (0-100)", formatNumber(pct)));
                    }
                }
                String rollNo = firstNonNull(data, "roll_number", "roll_no", "registration_number");
                if (rollNo != null && rollNo.trim().isEmpty()) {
                    issues.add("Roll/registration number is empty on marksheet");
                }
                break;
            }
            case "bank_statement": {
                OptionalDouble opening = parseNumber(data.get("opening_balance"));
                OptionalDouble closing = parseNumber(data.get("closing_balance"));
                OptionalDouble credits = parseNumber(firstPresent(data, "total_credit", "total_credits"));
                OptionalDouble debits = parseNumber(firstPresent(data, "total_debit", "total_debits"));
                if (opening.isPresent() && closing.isPresent() && credits.isPresent() && debits.isPresent()) {
                    double expectedClosing = opening.getAsDouble() + credits.getAsDouble() - debits.getAsDouble();
                    if (Math.abs(closing.getAsDouble() - expectedClosing) > 1) {
                        issues.add(String.format(Locale.ROOT,
                                "Bank statement balance mismatch: opening(%s) + credits(%s) - debits(%s) = %.2f, but closing balance is %s",
                                formatNumber(opening.getAsDouble()), formatNumber(credits.getAsDouble()),
                                formatNumber(debits.getAsDouble()), expectedClosing, formatNumber(closing.getAsDouble())));
                    }
                }
                break;
            }
            default:
                break;
        }
        return issues;
    }

    List<String> checkNumericFields(Map<String, String> data) {
        List<String> issues = new ArrayList<>();
        for (Map.Entry<String, String> entry : data.entrySet()) {
            String key = entry.getKey();
            String value = entry.getValue();
            if (value == null) continue;
            String lower = key.toLowerCase(Locale.ROOT);

            if (lower.contains("percent")) {
                OptionalDouble num = parseNumber(value);
                if (num.isPresent() && (num.getAsDouble() < 0 || num.getAsDouble() > 100)) {
                    issues.add(String.format("Invalid percentage in '%s': %s (must be 0-100)", key, value));
                }
            }

            if (lower.contains("gpa")) {
                OptionalDouble num = parseNumber(value);
                if (num.isPresent() && (num.getAsDouble() < 0 || num.getAsDouble() > 10)) {
                    issues.add(String.format("Suspicious GPA/CGPA in '%s': %s (expected 0-10)", key, value));
                }
            }

            if (lower.equals("age")) {
                OptionalDouble num = parseNumber(value);
                if (num.isPresent() && (num.getAsDouble() < 0 || num.getAsDouble() > 150)) {
                    issues.add("Invalid age: " + value);
                }
            }

            if (lower.contains("pincode") || lower.contains("pin_code") || lower.contains("zip")) {
                String cleaned = value.replaceAll("\\s", "");
                if (!cleaned.isEmpty() && !PIN_CODE.matcher(cleaned).matches()) {
                    issues.add(String.format("Invalid PIN code format in '%s': \"%s\" (expected 6-digit number)", key, value));
                }
            }
        }
        return issues;
    }

    /**
     * Parses the numeric prefix of a value, so "85.5%" reads as 85.5.
     */
    static OptionalDouble parseNumber(String value) {
        if (value == null) return OptionalDouble.empty();
        Matcher matcher = LEADING_NUMBER.matcher(value);
        if (!matcher.find()) return OptionalDouble.empty();
        return OptionalDouble.of(Double.parseDouble(matcher.group(1)));
    }

    private static String firstPresent(Map<String, String> data, String... keys) {
        for (String key : keys) {
            String value = data.get(key);
            if (value != null && !value.isEmpty()) return value;
        }
        return null;
    }

    private static String firstNonNull(Map<String, String> data, String... keys) {
        for (String key : keys) {
            String value = data.get(key);
            if (value != null && !value.trim().isEmpty()) return value;
        }
        // an explicitly empty roll number is itself worth reporting
        for (String key : keys) {
            if (data.get(key) != null) return data.get(key);
        }
        return null;
    }

    private static String stripSeparators(String value) {
        return value.replaceAll("[\\s\\-/.]", "");
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
