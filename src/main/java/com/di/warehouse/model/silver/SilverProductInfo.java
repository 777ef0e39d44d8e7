package com.di.warehouse.model.silver;

import com.di.warehouse.silver.code.ProductLine;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Row of {@code silver.crm_prd_info}: one product version. {@code endDate} is null for the current version.
 */
@Value
@Builder(toBuilder = true)
public class SilverProductInfo {
    Integer productId;
    String categoryId;
    String productKey;
    String productName;
    BigDecimal cost;
    ProductLine productLine;
    LocalDate startDate;
    LocalDate endDate;
}
