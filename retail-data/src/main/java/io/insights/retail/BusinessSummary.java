package io.insights.retail;

import java.util.List;

/**
 * Headline figures derived from the three datasets. Recomputed from scratch on every aggregation.
 */
public record BusinessSummary(
        double totalRevenue,
        int totalOrders,
        double averageOrderValue,
        List<ProductRevenue> topProducts,
        List<StockLevel> lowStockItems,
        double averageRating,
        double sentimentScore
) {
    public BusinessSummary {
        topProducts = List.copyOf(topProducts);
        lowStockItems = List.copyOf(lowStockItems);
    }
}
