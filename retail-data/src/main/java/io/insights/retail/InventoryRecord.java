package io.insights.retail;

/**
 * Stock position of one product. {@code stock} is null when the source cell was not numeric, which keeps the
 * item out of low-stock alerts. {@code minAlert} is null when the source did not supply one.
 */
public record InventoryRecord(
        String product,
        String category,
        Integer stock,
        double price,
        String supplier,
        Integer minAlert
) implements RetailRecord {

    public int effectiveMinAlert(int defaultThreshold) {
        return minAlert == null ? defaultThreshold : minAlert;
    }

    public boolean isBelowAlert(int defaultThreshold) {
        return stock != null && stock < effectiveMinAlert(defaultThreshold);
    }
}
