package com.di.warehouse.silver.transform;

import com.di.warehouse.model.bronze.BronzeErpLocation;
import com.di.warehouse.model.silver.SilverErpLocation;
import com.di.warehouse.silver.batch.BatchContext;
import com.di.warehouse.silver.code.Country;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes hyphens from the customer id so it joins with the CRM customer key, and spells out country codes.
 */
public class ErpLocationTransformer implements SilverTransformer<BronzeErpLocation, SilverErpLocation> {

    @Override
    public List<SilverErpLocation> transform(List<BronzeErpLocation> rows, BatchContext context) {
        List<SilverErpLocation> out = new ArrayList<>(rows.size());
        for (BronzeErpLocation row : rows) {
            out.add(SilverErpLocation.builder()
                    .customerId(row.getCustomerId() == null ? null : row.getCustomerId().replace("-", ""))
                    .country(Country.standardize(row.getCountry()))
                    .build());
        }
        return out;
    }
}
