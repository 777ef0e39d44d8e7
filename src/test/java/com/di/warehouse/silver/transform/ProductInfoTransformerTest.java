package com.di.warehouse.silver.transform;

import com.di.warehouse.model.bronze.BronzeProductInfo;
import com.di.warehouse.model.silver.SilverProductInfo;
import com.di.warehouse.silver.batch.BatchContext;
import com.di.warehouse.silver.code.ProductLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProductInfoTransformer Tests")
class ProductInfoTransformerTest {

    private final ProductInfoTransformer transformer = new ProductInfoTransformer();
    private final BatchContext context = new BatchContext("test-run", LocalDateTime.of(2026, 1, 1, 0, 0));

    private static BronzeProductInfo version(int id, String key, LocalDateTime start) {
        return BronzeProductInfo.builder()
                .productId(id)
                .productKey(key)
                .productName("Sport-100 Helmet- Red")
                .cost(new BigDecimal("12"))
                .productLine("S")
                .startDate(start)
                .endDate(LocalDateTime.of(2000, 1, 1, 0, 0))
                .build();
    }

    // ============================================================================
    // Key split
    // ============================================================================

    @ParameterizedTest
    @CsvSource({
            "CO-RF-FR-R92B-58, CO_RF, FR-R92B-58",
            "AC-HE-HL-U509-R,  AC_HE, HL-U509-R",
            "AB-CDEF,          AB_CD, F",
            "AB-CD-,           AB_CD, ''",
            "AB-CD,            AB_CD, ''",
            "XY,               XY,    ''"
    })
    @DisplayName("Should split the raw key into category id and product key")
    void testKeySplit(String raw, String categoryId, String productKey) {
        assertEquals(categoryId, ProductInfoTransformer.categoryId(raw));
        assertEquals(productKey, ProductInfoTransformer.productKey(raw));
    }

    @Test
    @DisplayName("Should keep a null raw key null")
    void testKeySplit_Null() {
        assertNull(ProductInfoTransformer.categoryId(null));
        assertNull(ProductInfoTransformer.productKey(null));
    }

    // ============================================================================
    // Cost, line and dates
    // ============================================================================

    @Test
    @DisplayName("Should default a missing cost to 0 and keep the rest")
    void testCostAndLine() {
        BronzeProductInfo raw = BronzeProductInfo.builder()
                .productId(210)
                .productKey("CO-RF-FR-R92B-58")
                .productName("HL Road Frame - Black- 58")
                .productLine("r ")
                .startDate(LocalDateTime.of(2003, 7, 1, 13, 45))
                .build();

        SilverProductInfo out = transformer.transform(List.of(raw), context).get(0);

        assertEquals(0, BigDecimal.ZERO.compareTo(out.getCost()));
        assertEquals(ProductLine.ROAD, out.getProductLine());
        assertEquals(LocalDate.of(2003, 7, 1), out.getStartDate());
        assertNull(out.getEndDate());
        assertEquals("CO_RF", out.getCategoryId());
        assertEquals("FR-R92B-58", out.getProductKey());
    }

    @Test
    @DisplayName("Should derive each end date from the next version's start date")
    void testEndDateChain() {
        List<SilverProductInfo> out = transformer.transform(List.of(
                version(212, "AC-HE-HL-U509-R", LocalDateTime.of(2011, 7, 1, 0, 0)),
                version(213, "AC-HE-HL-U509-R", LocalDateTime.of(2012, 7, 1, 0, 0)),
                version(214, "AC-HE-HL-U509-R", LocalDateTime.of(2013, 7, 1, 0, 0))), context);

        assertEquals(LocalDate.of(2012, 6, 30), out.get(0).getEndDate());
        assertEquals(LocalDate.of(2013, 6, 30), out.get(1).getEndDate());
        assertNull(out.get(2).getEndDate());
    }

    @Test
    @DisplayName("Should order versions by start date regardless of read order and keep output in read order")
    void testEndDateChain_Unordered() {
        List<SilverProductInfo> out = transformer.transform(List.of(
                version(3, "AC-HE-HL-U509-R", LocalDateTime.of(2013, 7, 1, 0, 0)),
                version(1, "AC-HE-HL-U509-R", LocalDateTime.of(2011, 7, 1, 0, 0)),
                version(9, "CO-RF-FR-R92B-58", LocalDateTime.of(2003, 7, 1, 0, 0)),
                version(2, "AC-HE-HL-U509-R", LocalDateTime.of(2012, 7, 1, 0, 0))), context);

        assertEquals(List.of(3, 1, 9, 2), out.stream().map(SilverProductInfo::getProductId).toList());
        assertNull(out.get(0).getEndDate());
        assertEquals(LocalDate.of(2012, 6, 30), out.get(1).getEndDate());
        assertNull(out.get(2).getEndDate());
        assertEquals(LocalDate.of(2013, 6, 30), out.get(3).getEndDate());
    }

    @Test
    @DisplayName("Should sort versions without a start date first")
    void testEndDateChain_NullStart() {
        List<SilverProductInfo> out = transformer.transform(List.of(
                version(2, "AC-HE-HL-U509-R", LocalDateTime.of(2012, 7, 1, 0, 0)),
                version(1, "AC-HE-HL-U509-R", null)), context);

        assertNull(out.get(0).getEndDate());
        assertEquals(LocalDate.of(2012, 6, 30), out.get(1).getEndDate());
    }

    @Test
    @DisplayName("Should give the earlier of two same-day versions an end date before its own start")
    void testEndDateChain_SameStart() {
        List<SilverProductInfo> out = transformer.transform(List.of(
                version(1, "AC-HE-HL-U509-R", LocalDateTime.of(2012, 7, 1, 0, 0)),
                version(2, "AC-HE-HL-U509-R", LocalDateTime.of(2012, 7, 1, 8, 0))), context);

        assertEquals(LocalDate.of(2012, 6, 30), out.get(0).getEndDate());
        assertNull(out.get(1).getEndDate());
    }

    @Test
    @DisplayName("Should chain same-day versions by product id whatever the read order")
    void testEndDateChain_SameStart_ShuffledInput() {
        List<BronzeProductInfo> rows = new ArrayList<>(List.of(
                version(7, "AC-HE-HL-U509-R", LocalDateTime.of(2012, 7, 1, 0, 0)),
                version(5, "AC-HE-HL-U509-R", LocalDateTime.of(2012, 7, 1, 0, 0)),
                version(6, "AC-HE-HL-U509-R", LocalDateTime.of(2012, 7, 1, 0, 0)),
                version(4, "AC-HE-HL-U509-R", LocalDateTime.of(2011, 7, 1, 0, 0)),
                version(8, "CO-RF-FR-R92B-58", null)));
        Set<SilverProductInfo> expected = new HashSet<>(transformer.transform(rows, context));

        Random random = new Random(7);
        for (int i = 0; i < 20; i++) {
            Collections.shuffle(rows, random);
            assertEquals(expected, new HashSet<>(transformer.transform(rows, context)));
        }
        SilverProductInfo current = expected.stream().filter(p -> p.getEndDate() == null
                && p.getProductKey().equals("HL-U509-R")).findFirst().orElseThrow();
        assertEquals(7, current.getProductId());
    }

    @Test
    @DisplayName("Should leave exactly one current version per product key")
    void testOneCurrentVersionPerKey() {
        List<BronzeProductInfo> rows = new ArrayList<>();
        for (int year = 2005; year < 2015; year++) {
            rows.add(version(year, "AC-HE-HL-U509-R", LocalDateTime.of(year, 1, 1, 0, 0)));
            rows.add(version(year + 100, "CO-RF-FR-R92B-58", LocalDateTime.of(year, 6, 1, 0, 0)));
        }
        List<SilverProductInfo> out = transformer.transform(rows, context);

        assertEquals(1, out.stream().filter(p -> p.getProductKey().equals("HL-U509-R") && p.getEndDate() == null).count());
        assertEquals(1, out.stream().filter(p -> p.getProductKey().equals("FR-R92B-58") && p.getEndDate() == null).count());
        out.stream().filter(p -> p.getEndDate() != null)
                .forEach(p -> assertTrue(p.getEndDate().isBefore(p.getStartDate().plusYears(1))));
    }

    @Test
    @DisplayName("Should be idempotent over the same input")
    void testIdempotent() {
        List<BronzeProductInfo> rows = List.of(
                version(1, "AC-HE-HL-U509-R", LocalDateTime.of(2011, 7, 1, 0, 0)),
                version(2, "AC-HE-HL-U509-R", LocalDateTime.of(2012, 7, 1, 0, 0)));
        assertEquals(transformer.transform(rows, context), transformer.transform(rows, context));
    }
}
