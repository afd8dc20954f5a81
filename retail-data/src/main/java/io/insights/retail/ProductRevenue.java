package io.insights.retail;

public record ProductRevenue(String product, double revenue) {}
