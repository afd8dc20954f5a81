package io.insights.retail;

import java.time.LocalDate;

/**
 * One order. {@code date} is null when the source cell was not an ISO date; {@code customerAge} and
 * {@code location} are null when absent.
 */
public record SalesRecord(
        LocalDate date,
        String product,
        String category,
        int quantity,
        double amount,
        Integer customerAge,
        String location
) implements RetailRecord {
}
