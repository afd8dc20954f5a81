package io.insights.retail;

/**
 * A typed row of one of the three datasets. Datasets relate to each other only through {@link #product()}.
 */
public sealed interface RetailRecord permits SalesRecord, InventoryRecord, ReviewRecord {
    String product();
}
