package com.docverify.validation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Deterministic, server-side checks on the data returned by the extraction collaborator.
 * Runs the four checks in a fixed order and never throws on odd input; the result is advisory
 * and is priced by the rule engine.
 */
@Component
public class DocumentDataValidator {

    private final DateValidator dateValidator;
    private final IdFormatValidator idFormatValidator;
    private final LogicalConsistencyValidator logicalValidator;
    private final DataConsistencyValidator dataConsistencyValidator;

    public DocumentDataValidator(DateValidator dateValidator,
                                 IdFormatValidator idFormatValidator,
                                 LogicalConsistencyValidator logicalValidator,
                                 DataConsistencyValidator dataConsistencyValidator) {
        this.dateValidator = dateValidator;
        this.idFormatValidator = idFormatValidator;
        this.logicalValidator = logicalValidator;
        this.dataConsistencyValidator = dataConsistencyValidator;
    }

    public ValidationReport validate(String documentType, Map<String, String> extractedData, Map<String, String> metadata) {
        if (extractedData == null || extractedData.isEmpty()) {
            return ValidationReport.builder()
                    .passed(false)
                    .issues(List.of("No extracted data to validate"))
                    .failedChecks(List.of(ValidationReport.CHECK_NO_DATA))
                    .build();
        }

        Map<String, String> safeMetadata = metadata != null ? metadata : Map.of();
        List<String> issues = new ArrayList<>();
        List<String> failedChecks = new ArrayList<>();

        CheckResult dates = collect(dateValidator.validate(extractedData, documentType),
                ValidationReport.CHECK_DATES, issues, failedChecks);
        CheckResult idFormat = collect(idFormatValidator.validate(documentType, extractedData),
                ValidationReport.CHECK_ID_FORMAT, issues, failedChecks);
        CheckResult logical = collect(logicalValidator.validate(documentType, extractedData, safeMetadata),
                ValidationReport.CHECK_LOGICAL, issues, failedChecks);
        CheckResult consistency = collect(dataConsistencyValidator.validate(extractedData),
                ValidationReport.CHECK_DATA_CONSISTENCY, issues, failedChecks);

        return ValidationReport.builder()
                .passed(failedChecks.isEmpty())
                .issues(issues)
                .failedChecks(failedChecks)
                .dates(dates)
                .idFormat(idFormat)
                .logical(logical)
                .dataConsistency(consistency)
                .build();
    }

    private static CheckResult collect(CheckResult result, String checkName,
                                       List<String> issues, List<String> failedChecks) {
        if (!result.valid()) {
            issues.addAll(result.issues());
            failedChecks.add(checkName);
        }
        return result;
    }
}
