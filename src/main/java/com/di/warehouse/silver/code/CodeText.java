package com.di.warehouse.silver.code;

import java.util.Locale;

/**
 * Normalization shared by the code enums: trimmed, upper-cased, null stays null.
 */
final class CodeText {

    private CodeText() {}

    static String normalize(String raw) {
        return raw == null ? null : raw.trim().toUpperCase(Locale.ROOT);
    }
}
