package com.di.warehouse.model.bronze;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Raw row of {@code bronze.crm_prd_info}. {@code productKey} still carries the category prefix
 * (e.g. {@code CO-RF-FR-R92B-58}).
 */
@Value
@Builder
public class BronzeProductInfo {
    Integer productId;
    String productKey;
    String productName;
    BigDecimal cost;
    String productLine;
    LocalDateTime startDate;
    LocalDateTime endDate;
}
