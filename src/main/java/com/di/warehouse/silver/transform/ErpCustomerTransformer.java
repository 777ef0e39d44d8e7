package com.di.warehouse.silver.transform;

import com.di.warehouse.model.bronze.BronzeErpCustomer;
import com.di.warehouse.model.silver.SilverErpCustomer;
import com.di.warehouse.silver.batch.BatchContext;
import com.di.warehouse.silver.code.Gender;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

public class ErpCustomerTransformer implements SilverTransformer<BronzeErpCustomer, SilverErpCustomer> {

    static final String LEGACY_ID_PREFIX = "NAS";

    @Override
    public List<SilverErpCustomer> transform(List<BronzeErpCustomer> rows, BatchContext context) {
        LocalDateTime now = context.getProcessingTime();
        List<SilverErpCustomer> out = new ArrayList<>(rows.size());
        for (BronzeErpCustomer row : rows) {
            out.add(SilverErpCustomer.builder()
                    .customerId(stripLegacyPrefix(row.getCustomerId()))
                    .birthDate(pastOrNull(row.getBirthDate(), now))
                    .gender(Gender.fromErpValue(row.getGender()))
                    .build());
        }
        return out;
    }

    static String stripLegacyPrefix(String customerId) {
        if (customerId != null && customerId.startsWith(LEGACY_ID_PREFIX)) {
            return customerId.substring(LEGACY_ID_PREFIX.length());
        }
        return customerId;
    }

    // birth dates after the processing time are invalid
    static LocalDate pastOrNull(LocalDate birthDate, LocalDateTime now) {
        if (birthDate == null || birthDate.atStartOfDay().isAfter(now)) {
            return null;
        }
        return birthDate;
    }
}
