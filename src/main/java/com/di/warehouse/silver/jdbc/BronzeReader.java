package com.di.warehouse.silver.jdbc;

import com.di.warehouse.model.bronze.BronzeCategory;
import com.di.warehouse.model.bronze.BronzeCustomerInfo;
import com.di.warehouse.model.bronze.BronzeErpCustomer;
import com.di.warehouse.model.bronze.BronzeErpLocation;
import com.di.warehouse.model.bronze.BronzeProductInfo;
import com.di.warehouse.model.bronze.BronzeSalesDetail;
import com.di.warehouse.sql.SqlQueriesProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Reads the six Bronze tables with the named queries from sql-queries.yml.
 * Rows come back in the order the database returns them; the transformers use that order for tie-breaks.
 */
@Repository
@Slf4j
public class BronzeReader {

    private final JdbcTemplate jdbc;
    private final SqlQueriesProperties.Bronze queries;

    public BronzeReader(JdbcTemplate jdbc, SqlQueriesProperties sqlQueries) {
        this.jdbc = jdbc;
        this.queries = sqlQueries.getBronze();
    }

    // ------------------------------------------------------------------

    private static final RowMapper<BronzeCustomerInfo> CUSTOMER_INFO = (rs, n) -> BronzeCustomerInfo.builder()
            .customerId(getInteger(rs, "cst_id"))
            .customerKey(rs.getString("cst_key"))
            .firstName(rs.getString("cst_firstname"))
            .lastName(rs.getString("cst_lastname"))
            .maritalStatus(rs.getString("cst_marital_status"))
            .gender(rs.getString("cst_gndr"))
            .createDate(rs.getObject("cst_create_date", LocalDate.class))
            .build();

    private static final RowMapper<BronzeProductInfo> PRODUCT_INFO = (rs, n) -> BronzeProductInfo.builder()
            .productId(getInteger(rs, "prd_id"))
            .productKey(rs.getString("prd_key"))
            .productName(rs.getString("prd_nm"))
            .cost(rs.getBigDecimal("prd_cost"))
            .productLine(rs.getString("prd_line"))
            .startDate(rs.getObject("prd_start_dt", LocalDateTime.class))
            .endDate(rs.getObject("prd_end_dt", LocalDateTime.class))
            .build();

    private static final RowMapper<BronzeSalesDetail> SALES_DETAIL = (rs, n) -> BronzeSalesDetail.builder()
            .orderNumber(rs.getString("sls_ord_num"))
            .productKey(rs.getString("sls_prd_key"))
            .customerId(getInteger(rs, "sls_cust_id"))
            .orderDate(getInteger(rs, "sls_order_dt"))
            .shipDate(getInteger(rs, "sls_ship_dt"))
            .dueDate(getInteger(rs, "sls_due_dt"))
            .salesAmount(rs.getBigDecimal("sls_sales"))
            .quantity(getInteger(rs, "sls_quantity"))
            .price(rs.getBigDecimal("sls_price"))
            .build();

    private static final RowMapper<BronzeCategory> CATEGORY = (rs, n) -> BronzeCategory.builder()
            .id(rs.getString("id"))
            .category(rs.getString("cat"))
            .subcategory(rs.getString("subcat"))
            .maintenance(rs.getString("maintenance"))
            .build();

    private static final RowMapper<BronzeErpCustomer> ERP_CUSTOMER = (rs, n) -> BronzeErpCustomer.builder()
            .customerId(rs.getString("cid"))
            .birthDate(rs.getObject("bdate", LocalDate.class))
            .gender(rs.getString("gen"))
            .build();

    private static final RowMapper<BronzeErpLocation> ERP_LOCATION = (rs, n) -> BronzeErpLocation.builder()
            .customerId(rs.getString("cid"))
            .country(rs.getString("cntry"))
            .build();

    // ------------------------------------------------------------------

    public List<BronzeCustomerInfo> readCustomerInfo() {
        return query(queries.getSelectCustomerInfo(), CUSTOMER_INFO);
    }

    public List<BronzeProductInfo> readProductInfo() {
        return query(queries.getSelectProductInfo(), PRODUCT_INFO);
    }

    public List<BronzeSalesDetail> readSalesDetails() {
        return query(queries.getSelectSalesDetails(), SALES_DETAIL);
    }

    public List<BronzeCategory> readCategories() {
        return query(queries.getSelectCategories(), CATEGORY);
    }

    public List<BronzeErpCustomer> readErpCustomers() {
        return query(queries.getSelectErpCustomers(), ERP_CUSTOMER);
    }

    public List<BronzeErpLocation> readErpLocations() {
        return query(queries.getSelectErpLocations(), ERP_LOCATION);
    }

    private <T> List<T> query(String sql, RowMapper<T> mapper) {
        if (sql == null || sql.isBlank()) {
            throw new IllegalStateException("Bronze query not configured (warehouse.sql.bronze.*)");
        }
        List<T> rows = jdbc.query(sql, mapper);
        log.debug("[SILVER] Read {} Bronze rows", rows.size());
        return rows;
    }

    private static Integer getInteger(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }
}
