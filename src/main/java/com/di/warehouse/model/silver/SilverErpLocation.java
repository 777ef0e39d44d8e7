package com.di.warehouse.model.silver;

import lombok.Builder;
import lombok.Value;

/**
 * Row of {@code silver.erp_loc_a101}. {@code country} is a full country name or {@code N/A}.
 */
@Value
@Builder
public class SilverErpLocation {
    String customerId;
    String country;
}
