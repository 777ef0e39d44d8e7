package com.di.warehouse.sql;

import com.di.warehouse.support.SqlQueries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SqlQueriesProperties Tests")
class SqlQueriesPropertiesTest {

    @Test
    @DisplayName("Should bind every Bronze query from sql-queries.yml")
    void testBind_AllBronzeQueries() {
        SqlQueriesProperties.Bronze bronze = SqlQueries.load().getBronze();

        Map<String, String> byTable = Map.of(
                "bronze.crm_cust_info", bronze.getSelectCustomerInfo(),
                "bronze.crm_prd_info", bronze.getSelectProductInfo(),
                "bronze.crm_sales_details", bronze.getSelectSalesDetails(),
                "bronze.erp_px_cat_g1v2", bronze.getSelectCategories(),
                "bronze.erp_cust_az12", bronze.getSelectErpCustomers(),
                "bronze.erp_loc_a101", bronze.getSelectErpLocations());

        byTable.forEach((table, sql) -> {
            assertNotNull(sql, table);
            assertTrue(sql.startsWith("SELECT "), sql);
            assertTrue(sql.endsWith("FROM " + table), sql);
        });
    }

    @Test
    @DisplayName("Should start with no queries when nothing is bound")
    void testUnbound() {
        SqlQueriesProperties props = new SqlQueriesProperties();
        assertNotNull(props.getBronze());
        assertNull(props.getBronze().getSelectCustomerInfo());
    }
}
