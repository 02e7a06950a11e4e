package com.docverify.validation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Flags values that look fabricated: placeholders, runs of one character, and one identifier
 * copied into two unrelated identifier fields.
 */
@Component
public class DataConsistencyValidator {

    private static final Set<String> PLACEHOLDERS = Set.of(
            "test", "sample", "dummy", "xxx", "n/a", "na", "null", "undefined", "todo", "tbd");
    private static final Set<String> FREE_TEXT_FIELDS = Set.of("remarks", "notes");

    public CheckResult validate(Map<String, String> extractedData) {
        List<String> issues = new ArrayList<>();

        for (Map.Entry<String, String> entry : extractedData.entrySet()) {
            String key = entry.getKey();
            if (entry.getValue() == null) continue;
            String trimmed = entry.getValue().trim();
            if (trimmed.isEmpty()) continue;

            if (PLACEHOLDERS.contains(trimmed.toLowerCase(Locale.ROOT))
                    && !FREE_TEXT_FIELDS.contains(key.toLowerCase(Locale.ROOT))) {
                issues.add(String.format("Suspicious placeholder value in '%s': \"%s\"", key, trimmed));
            }

            if (trimmed.length() > 4 && isSingleRepeatedCharacter(trimmed.replaceAll("\\s", ""))) {
                issues.add(String.format("Suspicious repeated character value in '%s': \"%s\"", key, trimmed));
            }
        }

        issues.addAll(findDuplicatedIdentifiers(extractedData));
        return CheckResult.of(issues);
    }

    private List<String> findDuplicatedIdentifiers(Map<String, String> extractedData) {
        List<String> issues = new ArrayList<>();
        Map<String, String> ownerByValue = new HashMap<>();

        for (Map.Entry<String, String> entry : extractedData.entrySet()) {
            String key = entry.getKey();
            String value = entry.getValue();
            if (value == null || value.trim().isEmpty()) continue;
            String lowerKey = key.toLowerCase(Locale.ROOT);
            if (!(lowerKey.contains("number") || lowerKey.contains("id") || lowerKey.contains("no"))) continue;

            String trimmed = value.trim();
            String previousKey = ownerByValue.get(trimmed);
            if (previousKey != null && !previousKey.equals(key)) {
                String otherKey = previousKey.toLowerCase(Locale.ROOT);
                // aadhaar_no vs aadhaar_no_masked style pairs are expected to agree
                if (!lowerKey.contains(otherKey) && !otherKey.contains(lowerKey)) {
                    issues.add(String.format("Same value \"%s\" found in both '%s' and '%s' - possible data inconsistency",
                            trimmed, previousKey, key));
                }
            }
            ownerByValue.put(trimmed, key);
        }
        return issues;
    }

    private static boolean isSingleRepeatedCharacter(String value) {
        if (value.length() < 2) return false;
        char first = value.charAt(0);
        for (int i = 1; i < value.length(); i++) {
            if (value.charAt(i) != first) return false;
        }
        return true;
    }
}
