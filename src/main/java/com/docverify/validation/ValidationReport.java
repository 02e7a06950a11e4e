package com.docverify.validation;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Aggregated result of the four deterministic checks. passed is true only when every check passed.
 * Issues are advisory: the rule engine decides what they cost.
 */
@Value
@Builder
public class ValidationReport {

    public static final String CHECK_NO_DATA = "no_data";
    public static final String CHECK_DATES = "dates_invalid";
    public static final String CHECK_ID_FORMAT = "id_format_invalid";
    public static final String CHECK_LOGICAL = "logical_check_failed";
    public static final String CHECK_DATA_CONSISTENCY = "data_inconsistent";

    boolean passed;
    List<String> issues;
    List<String> failedChecks;
    CheckResult dates;
    CheckResult idFormat;
    CheckResult logical;
    CheckResult dataConsistency;

    public boolean isDatesValid() {
        return dates != null && dates.valid();
    }

    public boolean isIdFormatValid() {
        return idFormat != null && idFormat.valid();
    }

    public boolean isLogicalChecksPassed() {
        return logical != null && logical.valid();
    }

    public boolean isDataConsistent() {
        return dataConsistency != null && dataConsistency.valid();
    }

    public int getChecksPassed() {
        int passedCount = 0;
        if (isDatesValid()) passedCount++;
        if (isIdFormatValid()) passedCount++;
        if (isLogicalChecksPassed()) passedCount++;
        if (isDataConsistent()) passedCount++;
        return passedCount;
    }

    public String getDetails() {
        return issues.isEmpty() ? "All validation checks passed" : String.join("; ", issues);
    }
}
