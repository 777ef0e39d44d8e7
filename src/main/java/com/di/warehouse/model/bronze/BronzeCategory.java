package com.di.warehouse.model.bronze;

import lombok.Builder;
import lombok.Value;

/**
 * Raw row of {@code bronze.erp_px_cat_g1v2}.
 */
@Value
@Builder
public class BronzeCategory {
    String id;
    String category;
    String subcategory;
    String maintenance;
}
