package com.di.warehouse.silver.code;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Silver code standardization Tests")
class CodeEnumsTest {

    // ============================================================================
    // Marital status
    // ============================================================================

    @ParameterizedTest
    @CsvSource({"S, SINGLE", "s, SINGLE", "' s ', SINGLE", "M, MARRIED", "m, MARRIED", "D, NOT_AVAILABLE", "'', NOT_AVAILABLE"})
    @DisplayName("Should map marital status codes")
    void testMaritalStatus(String code, MaritalStatus expected) {
        assertEquals(expected, MaritalStatus.fromCode(code));
    }

    @Test
    @DisplayName("Should map a null marital status to N/A")
    void testMaritalStatus_Null() {
        assertEquals(MaritalStatus.NOT_AVAILABLE, MaritalStatus.fromCode(null));
        assertEquals("N/A", MaritalStatus.NOT_AVAILABLE.getLabel());
    }

    // ============================================================================
    // Gender
    // ============================================================================

    @ParameterizedTest
    @CsvSource({"F, FEMALE", "f, FEMALE", "' M', MALE", "Male, NOT_AVAILABLE", "X, NOT_AVAILABLE"})
    @DisplayName("Should map CRM single-letter gender codes")
    void testGender_Crm(String code, Gender expected) {
        assertEquals(expected, Gender.fromCrmCode(code));
    }

    @ParameterizedTest
    @CsvSource({"F, FEMALE", "Female, FEMALE", "' female ', FEMALE", "M, MALE", "MALE, MALE", "unknown, NOT_AVAILABLE"})
    @DisplayName("Should map ERP gender values")
    void testGender_Erp(String value, Gender expected) {
        assertEquals(expected, Gender.fromErpValue(value));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    @DisplayName("Should map missing gender to N/A")
    void testGender_Missing(String value) {
        assertEquals(Gender.NOT_AVAILABLE, Gender.fromCrmCode(value));
        assertEquals(Gender.NOT_AVAILABLE, Gender.fromErpValue(value));
    }

    // ============================================================================
    // Product line
    // ============================================================================

    @ParameterizedTest
    @CsvSource({"M, Mountain", "r, Road", "' S ', Other Sales", "T, Touring", "Z, N/A", "'', N/A"})
    @DisplayName("Should decode product line codes")
    void testProductLine(String code, String label) {
        assertEquals(label, ProductLine.fromCode(code).getLabel());
    }

    @Test
    @DisplayName("Should decode a null product line to N/A")
    void testProductLine_Null() {
        assertEquals(ProductLine.NOT_AVAILABLE, ProductLine.fromCode(null));
    }

    // ============================================================================
    // Country
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
            "DE, Germany",
            "' DE ', Germany",
            "US, United States",
            "usa, United States",
            "' Usa', United States",
            "' Australia ', Australia",
            "France, France"
    })
    @DisplayName("Should standardize country codes and trim other names")
    void testCountry_Standardize(String raw, String expected) {
        assertEquals(expected, Country.standardize(raw));
    }

    @Test
    @DisplayName("Should match DE case-sensitively")
    void testCountry_GermanyIsCaseSensitive() {
        assertEquals(Country.OTHER, Country.classify("de"));
        assertEquals("de", Country.standardize("de"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"  "})
    @DisplayName("Should map a missing country to N/A")
    void testCountry_Missing(String raw) {
        assertEquals("N/A", Country.standardize(raw));
    }

    @Test
    @DisplayName("Should keep every standardized label within its closed set")
    void testClosedSets() {
        Set<String> marital = Stream.of("S", "M", "x", null, " m ")
                .map(c -> MaritalStatus.fromCode(c).getLabel()).collect(Collectors.toSet());
        assertTrue(Set.of("Single", "Married", "N/A").containsAll(marital));
        Set<Gender> genders = Stream.of("F", "female", "M", "?", null)
                .map(Gender::fromErpValue).collect(Collectors.toSet());
        assertTrue(EnumSet.allOf(Gender.class).containsAll(genders));
        assertEquals(Set.of("Female", "Male", "N/A"),
                EnumSet.allOf(Gender.class).stream().map(Gender::getLabel).collect(Collectors.toSet()));
    }
}
