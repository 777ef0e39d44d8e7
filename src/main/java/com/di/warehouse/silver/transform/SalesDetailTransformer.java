package com.di.warehouse.silver.transform;

import com.di.warehouse.model.bronze.BronzeSalesDetail;
import com.di.warehouse.model.silver.SilverSalesDetail;
import com.di.warehouse.silver.batch.BatchContext;
import com.di.warehouse.util.DateFormatUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates the three compact dates and repairs sales amount and unit price.
 * <p>Price repair divides the original sales amount, never the repaired one.
 */
public class SalesDetailTransformer implements SilverTransformer<BronzeSalesDetail, SilverSalesDetail> {

    static final BigDecimal SALES_TOLERANCE = new BigDecimal("0.01");
    static final int PRICE_SCALE = 2;

    @Override
    public List<SilverSalesDetail> transform(List<BronzeSalesDetail> rows, BatchContext context) {
        List<SilverSalesDetail> out = new ArrayList<>(rows.size());
        for (BronzeSalesDetail row : rows) {
            out.add(SilverSalesDetail.builder()
                    .orderNumber(row.getOrderNumber())
                    .productKey(row.getProductKey())
                    .customerId(row.getCustomerId())
                    .orderDate(DateFormatUtils.parseCompactDate(row.getOrderDate()))
                    .shipDate(DateFormatUtils.parseCompactDate(row.getShipDate()))
                    .dueDate(DateFormatUtils.parseCompactDate(row.getDueDate()))
                    .salesAmount(repairSales(row.getSalesAmount(), row.getQuantity(), row.getPrice()))
                    .quantity(row.getQuantity())
                    .price(repairPrice(row.getPrice(), row.getSalesAmount(), row.getQuantity()))
                    .build());
        }
        return out;
    }

    /**
     * Recomputes quantity x |price| when the amount is missing, not positive, or off by more than 0.01.
     * When quantity or price is missing the consistency check cannot fail, so a positive amount is kept.
     */
    static BigDecimal repairSales(BigDecimal sales, Integer quantity, BigDecimal price) {
        BigDecimal expected = (quantity == null || price == null)
                ? null
                : BigDecimal.valueOf(quantity).multiply(price.abs());
        boolean invalid = sales == null
                || sales.signum() <= 0
                || (expected != null && sales.subtract(expected).abs().compareTo(SALES_TOLERANCE) > 0);
        return invalid ? expected : sales;
    }

    /**
     * Derives original sales / quantity when the price is missing or not positive; null when that
     * division is undefined.
     */
    static BigDecimal repairPrice(BigDecimal price, BigDecimal originalSales, Integer quantity) {
        if (price != null && price.signum() > 0) {
            return price;
        }
        if (originalSales == null || quantity == null || quantity == 0) {
            return null;
        }
        return originalSales.divide(BigDecimal.valueOf(quantity), PRICE_SCALE, RoundingMode.HALF_UP);
    }
}
