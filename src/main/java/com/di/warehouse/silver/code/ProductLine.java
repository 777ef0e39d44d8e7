package com.di.warehouse.silver.code;

/**
 * Product line decoded from the CRM single-letter code.
 */
public enum ProductLine {

    MOUNTAIN("M", "Mountain"),
    ROAD("R", "Road"),
    OTHER_SALES("S", "Other Sales"),
    TOURING("T", "Touring"),
    NOT_AVAILABLE(null, "N/A");

    private final String code;
    private final String label;

    ProductLine(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static ProductLine fromCode(String raw) {
        String normalized = CodeText.normalize(raw);
        if (normalized == null) {
            return NOT_AVAILABLE;
        }
        for (ProductLine line : values()) {
            if (normalized.equals(line.code)) {
                return line;
            }
        }
        return NOT_AVAILABLE;
    }
}
