package com.di.warehouse.silver.transform;

import com.di.warehouse.model.bronze.BronzeProductInfo;
import com.di.warehouse.model.silver.SilverProductInfo;
import com.di.warehouse.silver.batch.BatchContext;
import com.di.warehouse.silver.code.ProductLine;
import com.di.warehouse.util.DateFormatUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Splits the raw product key into category id and product key, decodes the product line and
 * derives each version's end date from the next version's start date.
 */
public class ProductInfoTransformer implements SilverTransformer<BronzeProductInfo, SilverProductInfo> {

    static final int CATEGORY_PREFIX_LENGTH = 5;
    static final int PRODUCT_KEY_OFFSET = 6;

    // null start dates first; same-day versions by product id, then by content, so read order never matters
    private static final Comparator<SilverProductInfo> BY_START_DATE =
            Comparator.comparing(SilverProductInfo::getStartDate, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparing(SilverProductInfo::getProductId, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(SilverProductInfo::getProductName, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparing(SilverProductInfo::getCost, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparing(SilverProductInfo::getProductLine, Comparator.nullsFirst(Comparator.naturalOrder()))
                    .thenComparing(SilverProductInfo::getCategoryId, Comparator.nullsFirst(Comparator.naturalOrder()));

    @Override
    public List<SilverProductInfo> transform(List<BronzeProductInfo> rows, BatchContext context) {
        List<SilverProductInfo> versions = new ArrayList<>(rows.size());
        for (BronzeProductInfo row : rows) {
            versions.add(SilverProductInfo.builder()
                    .productId(row.getProductId())
                    .categoryId(categoryId(row.getProductKey()))
                    .productKey(productKey(row.getProductKey()))
                    .productName(row.getProductName())
                    .cost(row.getCost() == null ? BigDecimal.ZERO : row.getCost())
                    .productLine(ProductLine.fromCode(row.getProductLine()))
                    .startDate(DateFormatUtils.truncateToDay(row.getStartDate()))
                    .build());
        }
        return withEndDates(versions);
    }

    /** First five characters of the raw key with '-' replaced by '_'. */
    static String categoryId(String rawKey) {
        if (rawKey == null) {
            return null;
        }
        String prefix = rawKey.length() > CATEGORY_PREFIX_LENGTH ? rawKey.substring(0, CATEGORY_PREFIX_LENGTH) : rawKey;
        return prefix.replace('-', '_');
    }

    /** Raw key from the seventh character on; empty when the key is shorter. */
    static String productKey(String rawKey) {
        if (rawKey == null) {
            return null;
        }
        return rawKey.length() > PRODUCT_KEY_OFFSET ? rawKey.substring(PRODUCT_KEY_OFFSET) : "";
    }

    private List<SilverProductInfo> withEndDates(List<SilverProductInfo> versions) {
        Map<String, List<Integer>> positionsByKey = new HashMap<>();
        for (int i = 0; i < versions.size(); i++) {
            positionsByKey.computeIfAbsent(versions.get(i).getProductKey(), k -> new ArrayList<>()).add(i);
        }
        List<SilverProductInfo> out = new ArrayList<>(versions);
        for (List<Integer> positions : positionsByKey.values()) {
            positions.sort(Comparator.comparing(versions::get, BY_START_DATE));
            for (int p = 0; p < positions.size(); p++) {
                int index = positions.get(p);
                LocalDate nextStart = p + 1 < positions.size() ? versions.get(positions.get(p + 1)).getStartDate() : null;
                out.set(index, withEndDate(versions.get(index), nextStart == null ? null : nextStart.minusDays(1)));
            }
        }
        return out;
    }

    private static SilverProductInfo withEndDate(SilverProductInfo v, LocalDate endDate) {
        return Objects.equals(v.getEndDate(), endDate) ? v : v.toBuilder().endDate(endDate).build();
    }
}
