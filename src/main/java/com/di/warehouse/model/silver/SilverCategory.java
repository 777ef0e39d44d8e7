package com.di.warehouse.model.silver;

import lombok.Builder;
import lombok.Value;

/**
 * Row of {@code silver.erp_px_cat_g1v2}; identical to the Bronze row.
 */
@Value
@Builder
public class SilverCategory {
    String id;
    String category;
    String subcategory;
    String maintenance;
}
