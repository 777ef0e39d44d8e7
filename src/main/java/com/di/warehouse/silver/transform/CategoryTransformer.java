package com.di.warehouse.silver.transform;

import com.di.warehouse.model.bronze.BronzeCategory;
import com.di.warehouse.model.silver.SilverCategory;
import com.di.warehouse.silver.batch.BatchContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Copies category reference rows unchanged.
 */
public class CategoryTransformer implements SilverTransformer<BronzeCategory, SilverCategory> {

    @Override
    public List<SilverCategory> transform(List<BronzeCategory> rows, BatchContext context) {
        List<SilverCategory> out = new ArrayList<>(rows.size());
        for (BronzeCategory row : rows) {
            out.add(SilverCategory.builder()
                    .id(row.getId())
                    .category(row.getCategory())
                    .subcategory(row.getSubcategory())
                    .maintenance(row.getMaintenance())
                    .build());
        }
        return out;
    }
}
