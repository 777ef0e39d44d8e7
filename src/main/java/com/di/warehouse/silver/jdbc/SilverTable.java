package com.di.warehouse.silver.jdbc;

import java.util.Collections;
import java.util.List;

/**
 * The six Silver tables, in batch order, with the columns the batch writes.
 * The audit column {@code dwh_create_date} is left to its database default.
 */
public enum SilverTable {

    CRM_CUST_INFO("crm_cust_info",
            "cst_id", "cst_key", "cst_firstname", "cst_lastname", "cst_marital_status", "cst_gndr", "cst_create_date"),
    CRM_PRD_INFO("crm_prd_info",
            "prd_id", "cat_id", "prd_key", "prd_nm", "prd_cost", "prd_line", "prd_start_dt", "prd_end_dt"),
    CRM_SALES_DETAILS("crm_sales_details",
            "sls_ord_num", "sls_prd_key", "sls_cust_id", "sls_order_dt", "sls_ship_dt", "sls_due_dt",
            "sls_sales", "sls_quantity", "sls_price"),
    ERP_PX_CAT_G1V2("erp_px_cat_g1v2", "id", "cat", "subcat", "maintenance"),
    ERP_CUST_AZ12("erp_cust_az12", "cid", "bdate", "gen"),
    ERP_LOC_A101("erp_loc_a101", "cid", "cntry");

    public static final String SILVER_SCHEMA = "silver";
    public static final String STAGING_SCHEMA = "silver_staging";

    private final String tableName;
    private final List<String> columns;

    SilverTable(String tableName, String... columns) {
        this.tableName = tableName;
        this.columns = List.of(columns);
    }

    public String getTableName() {
        return tableName;
    }

    public List<String> getColumns() {
        return columns;
    }

    public String qualifiedName(String schema) {
        return schema + "." + tableName;
    }

    String columnList() {
        return String.join(", ", columns);
    }

    String insertSql(String schema) {
        String placeholders = String.join(", ", Collections.nCopies(columns.size(), "?"));
        return "INSERT INTO " + qualifiedName(schema) + " (" + columnList() + ") VALUES (" + placeholders + ")";
    }

    String publishSql() {
        return "INSERT INTO " + qualifiedName(SILVER_SCHEMA) + " (" + columnList() + ") SELECT " + columnList()
                + " FROM " + qualifiedName(STAGING_SCHEMA);
    }
}
