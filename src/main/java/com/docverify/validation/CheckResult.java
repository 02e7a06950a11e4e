package com.docverify.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one validation check. checkedFields maps a field name to a short verdict for that field.
 */
public record CheckResult(boolean valid, List<String> issues, Map<String, String> checkedFields) {

    public CheckResult {
        issues = Collections.unmodifiableList(new ArrayList<>(issues));
        checkedFields = Collections.unmodifiableMap(new LinkedHashMap<>(checkedFields));
    }

    public static CheckResult of(List<String> issues, Map<String, String> checkedFields) {
        return new CheckResult(issues.isEmpty(), issues, checkedFields);
    }

    public static CheckResult of(List<String> issues) {
        return of(issues, Map.of());
    }

    public static CheckResult passed() {
        return new CheckResult(true, List.of(), Map.of());
    }
}
