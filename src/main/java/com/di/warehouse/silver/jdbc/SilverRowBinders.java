package com.di.warehouse.silver.jdbc;

import com.di.warehouse.model.silver.SilverCategory;
import com.di.warehouse.model.silver.SilverCustomerInfo;
import com.di.warehouse.model.silver.SilverErpCustomer;
import com.di.warehouse.model.silver.SilverErpLocation;
import com.di.warehouse.model.silver.SilverProductInfo;
import com.di.warehouse.model.silver.SilverSalesDetail;
import org.springframework.jdbc.core.ParameterizedPreparedStatementSetter;

import java.math.BigDecimal;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;

/**
 * Statement setters for the Silver inserts; parameter order follows {@link SilverTable#getColumns()}.
 */
public final class SilverRowBinders {

    private SilverRowBinders() {
    }

    public static final ParameterizedPreparedStatementSetter<SilverCustomerInfo> CUSTOMER_INFO = (ps, r) -> {
        ps.setInt(1, r.getCustomerId());
        ps.setString(2, r.getCustomerKey());
        ps.setString(3, r.getFirstName());
        ps.setString(4, r.getLastName());
        ps.setString(5, r.getMaritalStatus().getLabel());
        ps.setString(6, r.getGender().getLabel());
        setDate(ps, 7, r.getCreateDate());
    };

    public static final ParameterizedPreparedStatementSetter<SilverProductInfo> PRODUCT_INFO = (ps, r) -> {
        setInteger(ps, 1, r.getProductId());
        ps.setString(2, r.getCategoryId());
        ps.setString(3, r.getProductKey());
        ps.setString(4, r.getProductName());
        setDecimal(ps, 5, r.getCost());
        ps.setString(6, r.getProductLine().getLabel());
        setDate(ps, 7, r.getStartDate());
        setDate(ps, 8, r.getEndDate());
    };

    public static final ParameterizedPreparedStatementSetter<SilverSalesDetail> SALES_DETAIL = (ps, r) -> {
        ps.setString(1, r.getOrderNumber());
        ps.setString(2, r.getProductKey());
        setInteger(ps, 3, r.getCustomerId());
        setDate(ps, 4, r.getOrderDate());
        setDate(ps, 5, r.getShipDate());
        setDate(ps, 6, r.getDueDate());
        setDecimal(ps, 7, r.getSalesAmount());
        setInteger(ps, 8, r.getQuantity());
        setDecimal(ps, 9, r.getPrice());
    };

    public static final ParameterizedPreparedStatementSetter<SilverErpCustomer> ERP_CUSTOMER = (ps, r) -> {
        ps.setString(1, r.getCustomerId());
        setDate(ps, 2, r.getBirthDate());
        ps.setString(3, r.getGender().getLabel());
    };

    public static final ParameterizedPreparedStatementSetter<SilverErpLocation> ERP_LOCATION = (ps, r) -> {
        ps.setString(1, r.getCustomerId());
        ps.setString(2, r.getCountry());
    };

    public static final ParameterizedPreparedStatementSetter<SilverCategory> CATEGORY = (ps, r) -> {
        ps.setString(1, r.getId());
        ps.setString(2, r.getCategory());
        ps.setString(3, r.getSubcategory());
        ps.setString(4, r.getMaintenance());
    };

    private static void setInteger(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value != null) ps.setInt(index, value); else ps.setNull(index, Types.INTEGER);
    }

    private static void setDecimal(PreparedStatement ps, int index, BigDecimal value) throws SQLException {
        if (value != null) ps.setBigDecimal(index, value); else ps.setNull(index, Types.DECIMAL);
    }

    private static void setDate(PreparedStatement ps, int index, LocalDate value) throws SQLException {
        if (value != null) ps.setDate(index, Date.valueOf(value)); else ps.setNull(index, Types.DATE);
    }
}
