package io.insights.retail;

/**
 * Limits and thresholds for {@link AggregationEngine}.
 *
 * @param topProductsLimit      how many products to rank by revenue
 * @param lowStockLimit         how many low-stock items a summary reports (the demo view)
 * @param uploadLowStockLimit   how many low-stock items an analysis of uploaded files reports
 * @param defaultMinAlert       alert threshold for inventory rows that carry no Min_Alert
 */
public record SummaryOptions(int topProductsLimit, int lowStockLimit, int uploadLowStockLimit, int defaultMinAlert) {
    public static final int DEFAULT_TOP_PRODUCTS = 5;
    public static final int DEFAULT_LOW_STOCK_LIMIT = 5;
    public static final int UPLOAD_LOW_STOCK_LIMIT = 10;
    public static final int DEFAULT_MIN_ALERT = 5;

    public SummaryOptions {
        if (topProductsLimit < 0) throw new IllegalArgumentException("topProductsLimit must be >= 0");
        checkLowStockLimit(lowStockLimit);
        checkLowStockLimit(uploadLowStockLimit);
    }

    public static SummaryOptions defaults() {
        return new SummaryOptions(DEFAULT_TOP_PRODUCTS, DEFAULT_LOW_STOCK_LIMIT, UPLOAD_LOW_STOCK_LIMIT, DEFAULT_MIN_ALERT);
    }

    /** An explicit limit replaces both the summary and the upload default. */
    public SummaryOptions withLowStockLimit(int limit) {
        return new SummaryOptions(topProductsLimit, limit, limit, defaultMinAlert);
    }

    static int checkLowStockLimit(int limit) {
        if (limit < 0) throw new IllegalArgumentException("lowStockLimit must be >= 0");
        return limit;
    }
}
