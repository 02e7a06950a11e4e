package com.docverify.validation;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Validates the identifier printed on identity documents against its canonical layout.
 * Types without a known layout pass; an identity type whose identifier cannot be found fails.
 */
@Component
public class IdFormatValidator {

    enum IdFormat {
        AADHAAR("aadhaar", List.of("aadhaar_number", "aadhaar_no", "uid", "id_number"),
                "12-digit numeric (XXXX XXXX XXXX)",
                value -> {
                    String cleaned = value.replaceAll("\\s+", "");
                    return cleaned.matches("\\d{12}") && cleaned.charAt(0) != '0' && cleaned.charAt(0) != '1';
                }),
        PAN("pan", List.of("pan_number", "pan_no", "pan", "id_number"),
                "10-char alphanumeric (ABCDE1234F)",
                matchesCleaned(Pattern.compile("^[A-Z]{3}[ABCDEFGHJLPT][A-Z]\\d{4}[A-Z]$"), "\\s+")),
        PASSPORT("passport", List.of("passport_number", "passport_no", "id_number"),
                "Letter followed by 7 digits (A1234567)",
                matchesCleaned(Pattern.compile("^[A-Z]\\d{7}$"), "\\s+")),
        DRIVING_LICENSE("driving_license", List.of("license_number", "dl_number", "dl_no", "id_number"),
                "State code + RTO code + year + serial",
                value -> {
                    String cleaned = value.replaceAll("[\\s-]+", "").toUpperCase(Locale.ROOT);
                    return cleaned.matches("[A-Z]{2}\\d{2}\\d{4,13}") && cleaned.length() >= 8 && cleaned.length() <= 17;
                }),
        VOTER_ID("voter_id", List.of("voter_id", "epic_number", "epic_no", "id_number"),
                "3 letters followed by 7 digits (ABC1234567)",
                matchesCleaned(Pattern.compile("^[A-Z]{3}\\d{7}$"), "\\s+"));

        private final String documentType;
        private final List<String> fields;
        private final String description;
        private final Predicate<String> rule;

        IdFormat(String documentType, List<String> fields, String description, Predicate<String> rule) {
            this.documentType = documentType;
            this.fields = fields;
            this.description = description;
            this.rule = rule;
        }

        static IdFormat forDocumentType(String documentType) {
            for (IdFormat format : values()) {
                if (format.documentType.equals(documentType)) return format;
            }
            return null;
        }

        private static Predicate<String> matchesCleaned(Pattern pattern, String strip) {
            return value -> pattern.matcher(value.replaceAll(strip, "").toUpperCase(Locale.ROOT)).matches();
        }
    }

    public CheckResult validate(String documentType, Map<String, String> extractedData) {
        IdFormat format = IdFormat.forDocumentType(documentType);
        if (format == null) {
            return CheckResult.passed();
        }

        Map.Entry<String, String> idField = findIdField(format, extractedData);
        if (idField == null) {
            return CheckResult.of(List.of("No ID number found in extracted data for " + documentType));
        }

        String key = idField.getKey();
        String value = idField.getValue();
        if (format.rule.test(value)) {
            return CheckResult.of(List.of(), Map.of(key, "valid"));
        }
        String issue = String.format("ID number '%s' in field '%s' does not match expected %s format (%s)",
                value, key, documentType, format.description);
        return CheckResult.of(List.of(issue), Map.of(key, "expected " + format.description));
    }

    // Exact name first, then any key whose normalized form contains the normalized field name.
    private Map.Entry<String, String> findIdField(IdFormat format, Map<String, String> extractedData) {
        for (String fieldName : format.fields) {
            String exact = extractedData.get(fieldName);
            if (isPresent(exact)) {
                return Map.entry(fieldName, exact.trim());
            }
            String normalizedField = normalize(fieldName);
            for (Map.Entry<String, String> entry : extractedData.entrySet()) {
                if (isPresent(entry.getValue()) && normalize(entry.getKey()).contains(normalizedField)) {
                    return Map.entry(entry.getKey(), entry.getValue().trim());
                }
            }
        }
        return null;
    }

    private static boolean isPresent(String value) {
        return value != null && !value.trim().isEmpty();
    }

    private static String normalize(String key) {
        return key.toLowerCase(Locale.ROOT).replaceAll("[_\\s-]", "");
    }
}
