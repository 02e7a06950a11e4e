package com.docverify.validation;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IdFormatValidatorTest {

    private final IdFormatValidator validator = new IdFormatValidator();

    @Test
    void validate_wellFormedPan_passes() {
        CheckResult result = validator.validate("pan", Map.of("pan_number", "ABCDE1234F"));

        assertThat(result.valid()).isTrue();
        assertThat(result.checkedFields()).containsEntry("pan_number", "valid");
    }

    @Test
    void validate_malformedPan_reportsExpectedFormat() {
        CheckResult result = validator.validate("pan", Map.of("pan_number", "1234ABCDEF"));

        assertThat(result.valid()).isFalse();
        assertThat(result.issues()).containsExactly(
                "ID number '1234ABCDEF' in field 'pan_number' does not match expected pan format "
                        + "(10-char alphanumeric (ABCDE1234F))");
    }

    @Test
    void validate_aadhaarWithSpaces_passesButLeadingOneFails() {
        assertThat(validator.validate("aadhaar", Map.of("aadhaar_number", "2345 6789 0123")).valid()).isTrue();
        assertThat(validator.validate("aadhaar", Map.of("aadhaar_number", "1234 5678 9012")).valid()).isFalse();
    }

    @Test
    void validate_idFieldFoundByNormalizedName() {
        CheckResult result = validator.validate("passport", Map.of("Passport No", "K1234567"));

        assertThat(result.valid()).isTrue();
    }

    @Test
    void validate_identityTypeWithoutIdField_fails() {
        CheckResult result = validator.validate("voter_id", Map.of("name", "Asha"));

        assertThat(result.issues()).containsExactly("No ID number found in extracted data for voter_id");
    }

    @Test
    void validate_typeWithoutKnownLayout_passes() {
        assertThat(validator.validate("bank_statement", Map.of("account_number", "12")).valid()).isTrue();
    }
}
