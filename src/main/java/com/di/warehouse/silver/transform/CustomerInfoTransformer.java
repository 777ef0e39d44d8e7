package com.di.warehouse.silver.transform;

import com.di.warehouse.model.bronze.BronzeCustomerInfo;
import com.di.warehouse.model.silver.SilverCustomerInfo;
import com.di.warehouse.silver.batch.BatchContext;
import com.di.warehouse.silver.code.Gender;
import com.di.warehouse.silver.code.MaritalStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps the most recent record per customer id and standardizes names and codes.
 * <p>Most recent means the greatest create date; a null date loses to any date. Among equal dates the
 * row with the lowest customer key, then first name, last name, marital and gender codes wins, so the
 * result does not depend on the order Bronze returns rows in. Rows without a customer id are dropped.
 */
public class CustomerInfoTransformer implements SilverTransformer<BronzeCustomerInfo, SilverCustomerInfo> {

    private static final Comparator<BronzeCustomerInfo> BY_CREATE_DATE =
            Comparator.comparing(BronzeCustomerInfo::getCreateDate, Comparator.nullsFirst(Comparator.naturalOrder()));

    private static final Comparator<BronzeCustomerInfo> BY_CONTENT =
            Comparator.comparing(BronzeCustomerInfo::getCustomerKey, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(BronzeCustomerInfo::getFirstName, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(BronzeCustomerInfo::getLastName, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(BronzeCustomerInfo::getMaritalStatus, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(BronzeCustomerInfo::getGender, Comparator.nullsLast(Comparator.naturalOrder()));

    @Override
    public List<SilverCustomerInfo> transform(List<BronzeCustomerInfo> rows, BatchContext context) {
        Map<Integer, BronzeCustomerInfo> latest = new LinkedHashMap<>();
        for (BronzeCustomerInfo row : rows) {
            if (row.getCustomerId() == null) {
                continue;
            }
            latest.merge(row.getCustomerId(), row, CustomerInfoTransformer::preferred);
        }
        List<SilverCustomerInfo> out = new ArrayList<>(latest.size());
        for (BronzeCustomerInfo row : latest.values()) {
            out.add(SilverCustomerInfo.builder()
                    .customerId(row.getCustomerId())
                    .customerKey(row.getCustomerKey())
                    .firstName(trim(row.getFirstName()))
                    .lastName(trim(row.getLastName()))
                    .maritalStatus(MaritalStatus.fromCode(row.getMaritalStatus()))
                    .gender(Gender.fromCrmCode(row.getGender()))
                    .createDate(row.getCreateDate())
                    .build());
        }
        return out;
    }

    static BronzeCustomerInfo preferred(BronzeCustomerInfo kept, BronzeCustomerInfo candidate) {
        int byDate = BY_CREATE_DATE.compare(candidate, kept);
        if (byDate != 0) {
            return byDate > 0 ? candidate : kept;
        }
        return BY_CONTENT.compare(candidate, kept) < 0 ? candidate : kept;
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
