package com.di.warehouse.silver.code;

/**
 * Standardized marital status. Any code other than S or M maps to {@link #NOT_AVAILABLE}.
 */
public enum MaritalStatus {

    SINGLE("Single"),
    MARRIED("Married"),
    NOT_AVAILABLE("N/A");

    private final String label;

    MaritalStatus(String label) {
        this.label = label;
    }

    /** Value stored in Silver. */
    public String getLabel() {
        return label;
    }

    /**
     * Maps a CRM code, trimmed and case-insensitive.
     */
    public static MaritalStatus fromCode(String code) {
        String normalized = CodeText.normalize(code);
        if ("S".equals(normalized)) {
            return SINGLE;
        }
        if ("M".equals(normalized)) {
            return MARRIED;
        }
        return NOT_AVAILABLE;
    }
}
