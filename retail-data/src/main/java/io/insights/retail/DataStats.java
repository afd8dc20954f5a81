package io.insights.retail;

public record DataStats(int salesRecords, int inventoryItems, int reviewCount) {}
