package com.di.warehouse.model.bronze;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Raw row of {@code bronze.crm_cust_info}. A customer id may appear many times (stale or duplicate records).
 */
@Value
@Builder
public class BronzeCustomerInfo {
    Integer customerId;
    String customerKey;
    String firstName;
    String lastName;
    String maritalStatus;
    String gender;
    LocalDate createDate;
}
