package io.insights.retail;

import java.time.Instant;
import java.util.List;

/**
 * Everything handed to the presentation layer once all three datasets have passed validation.
 */
public record InsightsBundle(
        Instant createdAt,
        BusinessSummary summary,
        DataStats dataStats,
        List<SalesRecord> sales,
        List<InventoryRecord> inventory,
        List<ReviewRecord> reviews
) {
    public static final int DEFAULT_SAMPLE_SIZE = 10;

    public InsightsBundle {
        sales = List.copyOf(sales);
        inventory = List.copyOf(inventory);
        reviews = List.copyOf(reviews);
    }

    public static InsightsBundle of(BusinessSummary summary, List<SalesRecord> sales, List<InventoryRecord> inventory,
                                    List<ReviewRecord> reviews) {
        return new InsightsBundle(Instant.now(), summary,
                new DataStats(sales.size(), inventory.size(), reviews.size()), sales, inventory, reviews);
    }

    public ContextSnapshot contextSnapshot() { return contextSnapshot(DEFAULT_SAMPLE_SIZE); }

    public ContextSnapshot contextSnapshot(int sampleSize) {
        int n = Math.max(0, sampleSize);
        return new ContextSnapshot(summary, head(sales, n), head(inventory, n), head(reviews, n));
    }

    private static <T> List<T> head(List<T> list, int n) {
        return List.copyOf(list.subList(0, Math.min(n, list.size())));
    }
}
