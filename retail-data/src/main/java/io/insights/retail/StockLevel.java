package io.insights.retail;

public record StockLevel(String product, int stock) {}
