package com.di.warehouse.model.bronze;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Raw row of {@code bronze.erp_cust_az12}.
 */
@Value
@Builder
public class BronzeErpCustomer {
    String customerId;
    LocalDate birthDate;
    String gender;
}
