package com.docverify.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-document-type configuration. ownerId == null marks a global definition.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentTypeConfig {
    private String code;
    private String name;
    private String ownerId;

    @Builder.Default
    private List<String> requiredFields = new ArrayList<>();

    // field name -> regex
    @Builder.Default
    private Map<String, String> validationRules = new LinkedHashMap<>();

    @Builder.Default
    private List<String> allowedFormats = List.of("jpg", "png", "pdf");

    @Builder.Default
    private int maxSizeMb = 5;

    @Builder.Default
    private boolean active = true;

    public boolean isGlobal() {
        return ownerId == null;
    }
}
