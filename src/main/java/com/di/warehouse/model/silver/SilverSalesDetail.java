package com.di.warehouse.model.silver;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Row of {@code silver.crm_sales_details}: one order line item with validated dates and repaired amounts.
 */
@Value
@Builder
public class SilverSalesDetail {
    String orderNumber;
    String productKey;
    Integer customerId;
    LocalDate orderDate;
    LocalDate shipDate;
    LocalDate dueDate;
    BigDecimal salesAmount;
    Integer quantity;
    BigDecimal price;
}
