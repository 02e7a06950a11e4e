package com.docverify.validation;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class LogicalConsistencyValidatorTest {

    private final LogicalConsistencyValidator validator = new LogicalConsistencyValidator();

    @Test
    void validate_firstNameMissingFromFullName_flagged() {
        CheckResult result = validator.validate("pan",
                Map.of("full_name", "Ravi Kumar", "first_name", "Suresh"), Map.of());

        assertThat(result.issues()).containsExactly(
                "Name inconsistency: first_name \"Suresh\" not found within full name \"Ravi Kumar\"");
        assertThat(result.checkedFields()).containsEntry("name_consistency", "failed");
    }

    @Test
    void validate_metadataNameSharingAWord_matches() {
        CheckResult result = validator.validate("pan",
                Map.of("name", "RAVI KUMAR SHARMA"), Map.of("name", "Ravi Sharma"));

        assertThat(result.valid()).isTrue();
    }

    @Test
    void validate_metadataIdIgnoresSeparators() {
        CheckResult result = validator.validate("aadhaar",
                Map.of("aadhaar_number", "2345 6789 0123"), Map.of("aadhaar_number", "2345-6789-0123"));

        assertThat(result.valid()).isTrue();
    }

    @Test
    void validate_bankStatementBalanceMismatch_flagged() {
        CheckResult result = validator.validate("bank_statement", Map.of(
                "opening_balance", "1000",
                "total_credits", "500",
                "total_debits", "200",
                "closing_balance", "2000"), Map.of());

        assertThat(result.issues()).containsExactly(
                "Bank statement balance mismatch: opening(1000) + credits(500) - debits(200) = 1300.00, but closing balance is 2000");
    }

    @Test
    void validate_percentageOutOfRange_flagged() {
        CheckResult result = validator.validate("marksheet_12",
                Map.of("percentage", "105%", "total_marks", "525"), Map.of());

        assertThat(result.issues()).contains(
                "Percentage 105% is outside valid range (0-100)",
                "Invalid percentage in 'percentage': 105% (must be 0-100)");
    }

    @Test
    void parseNumber_readsNumericPrefix() {
        assertThat(LogicalConsistencyValidator.parseNumber("85.5%")).hasValue(85.5);
        assertThat(LogicalConsistencyValidator.parseNumber("abc")).isEmpty();
    }
}
