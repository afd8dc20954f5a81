package io.insights.retail;

import io.insights.config.Settings;

/**
 * Engine settings, read from {@code -Dinsights.*} system properties or {@code INSIGHTS_*} environment variables.
 * An explicit {@code insights.lowStockLimit} applies to both the summary and the upload limit; otherwise they
 * default to 5 and 10.
 */
public record RetailConfig(
        int topProductsLimit,
        int lowStockLimit,
        int uploadLowStockLimit,
        int defaultMinAlert,
        boolean wholeWordSentiment,
        int sampleSize
) {
    public static RetailConfig fromEnv() { return from(new Settings()); }

    public static RetailConfig from(Settings s) {
        return new RetailConfig(
                s.intValue("insights.topProductsLimit", SummaryOptions.DEFAULT_TOP_PRODUCTS),
                s.intValue("insights.lowStockLimit", SummaryOptions.DEFAULT_LOW_STOCK_LIMIT),
                s.intValue("insights.lowStockLimit", SummaryOptions.UPLOAD_LOW_STOCK_LIMIT),
                s.intValue("insights.defaultMinAlert", SummaryOptions.DEFAULT_MIN_ALERT),
                s.flag("insights.sentiment.wholeWords", false),
                s.intValue("insights.sampleSize", InsightsBundle.DEFAULT_SAMPLE_SIZE));
    }

    public SummaryOptions summaryOptions() {
        return new SummaryOptions(topProductsLimit, lowStockLimit, uploadLowStockLimit, defaultMinAlert);
    }

    public Lexicon lexicon() {
        return Lexicon.defaults().withWholeWords(wholeWordSentiment);
    }

    public RetailConfig withLowStockLimit(int limit) {
        return new RetailConfig(topProductsLimit, limit, limit, defaultMinAlert, wholeWordSentiment, sampleSize);
    }

    public RetailConfig withWholeWordSentiment(boolean enabled) {
        return new RetailConfig(topProductsLimit, lowStockLimit, uploadLowStockLimit, defaultMinAlert, enabled, sampleSize);
    }

    public RetailConfig withSampleSize(int size) {
        return new RetailConfig(topProductsLimit, lowStockLimit, uploadLowStockLimit, defaultMinAlert, wholeWordSentiment, size);
    }
}
