package com.docverify.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ImageQuality {
    GOOD,
    ACCEPTABLE,
    POOR,
    SUSPICIOUS,
    UNKNOWN;

    @JsonValue
    public String value() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ImageQuality fromValue(String value) {
        if (value == null) return UNKNOWN;
        for (ImageQuality quality : values()) {
            if (quality.name().equalsIgnoreCase(value.trim())) {
                return quality;
            }
        }
        return UNKNOWN;
    }
}
