package io.insights.retail;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Plain-text rendering of summaries and validation failures for the console.
 */
public final class SummaryFormatter {
    private SummaryFormatter() {}

    public static String format(InsightsBundle bundle) {
        BusinessSummary s = bundle.summary();
        DataStats stats = bundle.dataStats();
        StringBuilder sb = new StringBuilder();
        sb.append("Records: sales=").append(stats.salesRecords())
          .append(" inventory=").append(stats.inventoryItems())
          .append(" reviews=").append(stats.reviewCount()).append('\n');
        sb.append("Total revenue:       ").append(money(s.totalRevenue())).append('\n');
        sb.append("Total orders:        ").append(s.totalOrders()).append('\n');
        sb.append("Average order value: ").append(money(s.averageOrderValue())).append('\n');
        sb.append("Average rating:      ").append(String.format(Locale.ROOT, "%.2f", s.averageRating())).append('\n');
        sb.append("Sentiment score:     ").append(String.format(Locale.ROOT, "%+.2f", s.sentimentScore())).append('\n');
        sb.append("Top products:").append('\n');
        if (s.topProducts().isEmpty()) sb.append("  (none)\n");
        int rank = 1;
        for (ProductRevenue p : s.topProducts()) {
            sb.append("  ").append(rank++).append(". ").append(p.product()).append("  ").append(money(p.revenue())).append('\n');
        }
        sb.append("Low stock:").append('\n');
        if (s.lowStockItems().isEmpty()) sb.append("  (none)\n");
        for (StockLevel l : s.lowStockItems()) {
            sb.append("  ").append(l.product()).append("  stock=").append(l.stock()).append('\n');
        }
        return sb.toString();
    }

    public static String formatRejections(Map<DatasetKind, ValidationResult> validations) {
        StringBuilder sb = new StringBuilder();
        validations.forEach((kind, v) -> {
            if (v.valid()) return;
            sb.append(kind.title()).append(" validation failed:").append('\n');
            List<String> errors = v.errors();
            for (String e : errors) sb.append("  - ").append(e).append('\n');
        });
        return sb.toString();
    }

    static String money(double v) {
        return String.format(Locale.ROOT, "%,.2f", v);
    }
}
