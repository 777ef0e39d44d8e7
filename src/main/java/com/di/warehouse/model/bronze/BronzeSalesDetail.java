package com.di.warehouse.model.bronze;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Raw row of {@code bronze.crm_sales_details}. Dates are integers in {@code yyyyMMdd} form and may be 0 or malformed.
 */
@Value
@Builder
public class BronzeSalesDetail {
    String orderNumber;
    String productKey;
    Integer customerId;
    Integer orderDate;
    Integer shipDate;
    Integer dueDate;
    BigDecimal salesAmount;
    Integer quantity;
    BigDecimal price;
}
