package io.insights.retail;

import java.util.List;
import java.util.Locale;

/**
 * The three datasets the engine ingests, each with its required-field contract.
 */
public enum DatasetKind {
    SALES("Sales Data", List.of("Date", "Product", "Quantity", "Amount"), List.of("Quantity", "Amount")),
    INVENTORY("Inventory Data", List.of("Product", "Stock", "Price"), List.of()),
    REVIEWS("Customer Reviews", List.of("Date", "Rating", "Review", "Product"), List.of());

    private final String title;
    private final List<String> requiredFields;
    private final List<String> numericChecks; // checked on the leading rows only

    DatasetKind(String title, List<String> requiredFields, List<String> numericChecks) {
        this.title = title;
        this.requiredFields = requiredFields;
        this.numericChecks = numericChecks;
    }

    public String title() { return title; }
    public List<String> requiredFields() { return requiredFields; }
    public List<String> numericChecks() { return numericChecks; }

    /** Conventional file name inside a data directory, e.g. {@code sales.csv}. */
    public String fileName() { return id() + ".csv"; }

    public String id() { return name().toLowerCase(Locale.ROOT); }
}
