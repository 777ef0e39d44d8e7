package com.di.warehouse.model.silver;

import com.di.warehouse.silver.code.Gender;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Row of {@code silver.erp_cust_az12}.
 */
@Value
@Builder
public class SilverErpCustomer {
    String customerId;
    LocalDate birthDate;
    Gender gender;
}
