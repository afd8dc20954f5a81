package io.insights.retail;

import java.util.List;

/**
 * The summary plus the leading records of each dataset, sized for handing to a downstream consumer
 * that cannot take whole datasets.
 */
public record ContextSnapshot(
        BusinessSummary businessSummary,
        List<SalesRecord> sampleSalesData,
        List<InventoryRecord> sampleInventoryData,
        List<ReviewRecord> sampleReviews
) {}
