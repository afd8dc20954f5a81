package io.insights.retail;

import java.time.LocalDate;

public record ReviewRecord(
        LocalDate date,
        double rating,
        String reviewText,
        String product,
        String platform
) implements RetailRecord {
}
