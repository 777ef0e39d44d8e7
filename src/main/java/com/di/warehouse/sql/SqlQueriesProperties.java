package com.di.warehouse.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bronze extraction queries loaded from sql-queries.yml (warehouse.sql.*).
 * The Silver reader runs these named queries; none are hard coded in repository classes.
 */
@ConfigurationProperties(prefix = "warehouse.sql")
public class SqlQueriesProperties {

    private Bronze bronze = new Bronze();

    public Bronze getBronze() { return bronze; }
    public void setBronze(Bronze bronze) { this.bronze = bronze; }

    public static class Bronze {
        private String selectCustomerInfo;
        private String selectProductInfo;
        private String selectSalesDetails;
        private String selectCategories;
        private String selectErpCustomers;
        private String selectErpLocations;

        public String getSelectCustomerInfo() { return selectCustomerInfo; }
        public void setSelectCustomerInfo(String selectCustomerInfo) { this.selectCustomerInfo = selectCustomerInfo; }
        public String getSelectProductInfo() { return selectProductInfo; }
        public void setSelectProductInfo(String selectProductInfo) { this.selectProductInfo = selectProductInfo; }
        public String getSelectSalesDetails() { return selectSalesDetails; }
        public void setSelectSalesDetails(String selectSalesDetails) { this.selectSalesDetails = selectSalesDetails; }
        public String getSelectCategories() { return selectCategories; }
        public void setSelectCategories(String selectCategories) { this.selectCategories = selectCategories; }
        public String getSelectErpCustomers() { return selectErpCustomers; }
        public void setSelectErpCustomers(String selectErpCustomers) { this.selectErpCustomers = selectErpCustomers; }
        public String getSelectErpLocations() { return selectErpLocations; }
        public void setSelectErpLocations(String selectErpLocations) { this.selectErpLocations = selectErpLocations; }
    }
}
