package com.docverify.client;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Body posted to the extraction service.
 */
@Data
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExtractionRequest {
    private String documentType;
    private String mediaType;
    private String documentBase64;
    private List<String> requiredFields;
    // field name -> regex the value must match
    private Map<String, String> validationRules;
    // client-supplied values to cross-check against the document
    private Map<String, String> metadata;
}
