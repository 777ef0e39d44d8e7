package com.di.warehouse.model.bronze;

import lombok.Builder;
import lombok.Value;

/**
 * Raw row of {@code bronze.erp_loc_a101}.
 */
@Value
@Builder
public class BronzeErpLocation {
    String customerId;
    String country;
}
