package io.insights.retail;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SummaryFormatterTest {

    @Test
    void formatsHeadlineFigures() {
        BusinessSummary summary = new BusinessSummary(12345.5, 3, 4115.1666, List.of(new ProductRevenue("Blue Kurta", 12000)),
                List.of(), 4.25, -0.5);
        String text = SummaryFormatter.format(new InsightsBundle(Instant.EPOCH, summary, new DataStats(3, 0, 4),
                List.of(), List.of(), List.of()));

        assertTrue(text.contains("Total revenue:       12,345.50"));
        assertTrue(text.contains("Average order value: 4,115.17"));
        assertTrue(text.contains("Sentiment score:     -0.50"));
        assertTrue(text.contains("  1. Blue Kurta  12,000.00"));
        assertTrue(text.contains("Low stock:\n  (none)\n"));
        assertTrue(text.startsWith("Records: sales=3 inventory=0 reviews=4\n"));
    }

    @Test
    void listsOnlyFailedValidations() {
        Map<DatasetKind, ValidationResult> validations = new EnumMap<>(DatasetKind.class);
        validations.put(DatasetKind.SALES, ValidationResult.of(List.of("Missing required field: Date")));
        validations.put(DatasetKind.INVENTORY, ValidationResult.ok());
        validations.put(DatasetKind.REVIEWS, ValidationResult.of(List.of(SchemaValidator.NO_DATA)));

        assertEquals("Sales Data validation failed:\n  - Missing required field: Date\n"
                        + "Customer Reviews validation failed:\n  - No data found in the file\n",
                SummaryFormatter.formatRejections(validations));
    }
}
