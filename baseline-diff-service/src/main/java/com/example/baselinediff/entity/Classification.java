package com.example.baselinediff.entity;

import com.example.baselinediff.exception.BadRequestException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Provenance label assigned to a commit by the diff classifier.
 */
public enum Classification {
    SHARED("shared"),
    UPSTREAM_ONLY("upstream_only"),
    VENDOR_ONLY("vendor_only");

    private final String value;

    Classification(String value) {
        this.value = value;
    }

    /**
     * Value stored in the {@code commits.classification} column and used on the wire.
     */
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Classification fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (Classification classification : values()) {
            if (classification.value.equalsIgnoreCase(value) || classification.name().equalsIgnoreCase(value)) {
                return classification;
            }
        }
        throw BadRequestException.unknownClassification(value);
    }
}
