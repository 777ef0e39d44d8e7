package com.di.warehouse.model.silver;

import com.di.warehouse.silver.code.Gender;
import com.di.warehouse.silver.code.MaritalStatus;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Row of {@code silver.crm_cust_info}: exactly one per customer id.
 */
@Value
@Builder
public class SilverCustomerInfo {
    int customerId;
    String customerKey;
    String firstName;
    String lastName;
    MaritalStatus maritalStatus;
    Gender gender;
    LocalDate createDate;
}
