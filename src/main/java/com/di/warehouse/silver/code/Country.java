package com.di.warehouse.silver.code;

import java.util.Set;

/**
 * Country standardization for ERP locations.
 * <p>Known codes map to a full name; blank maps to N/A; any other value is kept as {@link #OTHER}
 * and passes through trimmed.
 */
public enum Country {

    GERMANY("Germany"),
    UNITED_STATES("United States"),
    NOT_AVAILABLE("N/A"),
    OTHER(null);

    private static final Set<String> US_CODES = Set.of("US", "USA");

    private final String label;

    Country(String label) {
        this.label = label;
    }

    /** Fixed label, or null for {@link #OTHER}. */
    public String getLabel() {
        return label;
    }

    /**
     * Classifies a raw value. {@code DE} matches case-sensitively, {@code US}/{@code USA} case-insensitively.
     */
    public static Country classify(String raw) {
        if (raw == null) {
            return NOT_AVAILABLE;
        }
        String trimmed = raw.trim();
        if (trimmed.equals("DE")) {
            return GERMANY;
        }
        if (US_CODES.contains(CodeText.normalize(trimmed))) {
            return UNITED_STATES;
        }
        if (trimmed.isEmpty()) {
            return NOT_AVAILABLE;
        }
        return OTHER;
    }

    /**
     * Value stored in Silver: the standard label, or the trimmed original for {@link #OTHER}.
     */
    public static String standardize(String raw) {
        Country country = classify(raw);
        return country == OTHER ? raw.trim() : country.getLabel();
    }
}
