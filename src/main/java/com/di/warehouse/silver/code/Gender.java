package com.di.warehouse.silver.code;

import java.util.Set;

/**
 * Standardized gender shared by the CRM and ERP customer tables.
 */
public enum Gender {

    FEMALE("Female"),
    MALE("Male"),
    NOT_AVAILABLE("N/A");

    private static final Set<String> ERP_FEMALE = Set.of("F", "FEMALE");
    private static final Set<String> ERP_MALE = Set.of("M", "MALE");

    private final String label;

    Gender(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * CRM single-letter code: F or M, trimmed and case-insensitive; anything else is N/A.
     */
    public static Gender fromCrmCode(String code) {
        String normalized = CodeText.normalize(code);
        if ("F".equals(normalized)) {
            return FEMALE;
        }
        if ("M".equals(normalized)) {
            return MALE;
        }
        return NOT_AVAILABLE;
    }

    /**
     * ERP value: F/FEMALE or M/MALE, trimmed and case-insensitive; anything else is N/A.
     */
    public static Gender fromErpValue(String value) {
        String normalized = CodeText.normalize(value);
        if (normalized == null) {
            return NOT_AVAILABLE;
        }
        if (ERP_FEMALE.contains(normalized)) {
            return FEMALE;
        }
        if (ERP_MALE.contains(normalized)) {
            return MALE;
        }
        return NOT_AVAILABLE;
    }
}
