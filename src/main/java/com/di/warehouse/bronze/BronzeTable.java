package com.di.warehouse.bronze;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The six Bronze tables in load order. Columns are listed in CSV field order.
 */
public enum BronzeTable {

    CRM_CUST_INFO("crm_cust_info", List.of(
            col("cst_id", ColumnType.INT),
            col("cst_key", ColumnType.TEXT),
            col("cst_firstname", ColumnType.TEXT),
            col("cst_lastname", ColumnType.TEXT),
            col("cst_marital_status", ColumnType.TEXT),
            col("cst_gndr", ColumnType.TEXT),
            col("cst_create_date", ColumnType.DATE))),
    CRM_PRD_INFO("crm_prd_info", List.of(
            col("prd_id", ColumnType.INT),
            col("prd_key", ColumnType.TEXT),
            col("prd_nm", ColumnType.TEXT),
            col("prd_cost", ColumnType.DECIMAL),
            col("prd_line", ColumnType.TEXT),
            col("prd_start_dt", ColumnType.TIMESTAMP),
            col("prd_end_dt", ColumnType.TIMESTAMP))),
    CRM_SALES_DETAILS("crm_sales_details", List.of(
            col("sls_ord_num", ColumnType.TEXT),
            col("sls_prd_key", ColumnType.TEXT),
            col("sls_cust_id", ColumnType.INT),
            col("sls_order_dt", ColumnType.INT),
            col("sls_ship_dt", ColumnType.INT),
            col("sls_due_dt", ColumnType.INT),
            col("sls_sales", ColumnType.DECIMAL),
            col("sls_quantity", ColumnType.INT),
            col("sls_price", ColumnType.DECIMAL))),
    ERP_LOC_A101("erp_loc_a101", List.of(
            col("cid", ColumnType.TEXT),
            col("cntry", ColumnType.TEXT))),
    ERP_CUST_AZ12("erp_cust_az12", List.of(
            col("cid", ColumnType.TEXT),
            col("bdate", ColumnType.DATE),
            col("gen", ColumnType.TEXT))),
    ERP_PX_CAT_G1V2("erp_px_cat_g1v2", List.of(
            col("id", ColumnType.TEXT),
            col("cat", ColumnType.TEXT),
            col("subcat", ColumnType.TEXT),
            col("maintenance", ColumnType.TEXT)));

    public static final String SCHEMA = "bronze";

    private final String tableName;
    private final List<Column> columns;

    BronzeTable(String tableName, List<Column> columns) {
        this.tableName = tableName;
        this.columns = columns;
    }

    public String getTableName() {
        return tableName;
    }

    public List<Column> getColumns() {
        return columns;
    }

    public String qualifiedName() {
        return SCHEMA + "." + tableName;
    }

    String insertSql() {
        String names = columns.stream().map(Column::name).collect(Collectors.joining(", "));
        String placeholders = String.join(", ", Collections.nCopies(columns.size(), "?"));
        return "INSERT INTO " + qualifiedName() + " (" + names + ") VALUES (" + placeholders + ")";
    }

    private static Column col(String name, ColumnType type) {
        return new Column(name, type);
    }

    public record Column(String name, ColumnType type) {
    }
}
