package io.insights.retail;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.insights.config.Settings;
import io.insights.metrics.Metrics;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RetailConfigTest {

    @Test
    void defaultsWhenNothingIsSet() {
        RetailConfig cfg = RetailConfig.from(new Settings(Map.of()));
        assertEquals(SummaryOptions.defaults(), cfg.summaryOptions());
        assertEquals(5, cfg.lowStockLimit());
        assertEquals(10, cfg.uploadLowStockLimit());
        assertFalse(cfg.wholeWordSentiment());
        assertEquals(InsightsBundle.DEFAULT_SAMPLE_SIZE, cfg.sampleSize());
    }

    @Test
    void readsEnvironmentVariables() {
        RetailConfig cfg = RetailConfig.from(new Settings(Map.of(
                "INSIGHTS_LOW_STOCK_LIMIT", "10",
                "INSIGHTS_TOP_PRODUCTS_LIMIT", "3",
                "INSIGHTS_SENTIMENT_WHOLE_WORDS", "true")));
        assertEquals(10, cfg.lowStockLimit());
        assertEquals(10, cfg.uploadLowStockLimit());
        assertEquals(3, cfg.topProductsLimit());
        assertTrue(cfg.lexicon().wholeWords());
    }

    @Test
    void malformedNumberFails() {
        Settings settings = new Settings(Map.of("INSIGHTS_SAMPLE_SIZE", "ten"));
        assertThrows(IllegalArgumentException.class, () -> RetailConfig.from(settings));
    }

    @Test
    void moduleWiresConfiguredSingletons() throws Exception {
        RetailConfig cfg = RetailConfig.from(new Settings(Map.of())).withLowStockLimit(1).withWholeWordSentiment(true);
        Injector injector = Guice.createInjector(new RetailInsightsModule(cfg));

        BusinessInsightsService service = injector.getInstance(BusinessInsightsService.class);
        assertSame(service, injector.getInstance(BusinessInsightsService.class));
        assertSame(injector.getInstance(MetricRegistry.class), injector.getInstance(Metrics.class).registry());
        assertTrue(injector.getInstance(SentimentScorer.class).lexicon().wholeWords());
        assertEquals(1, injector.getInstance(AggregationEngine.class).options().lowStockLimit());
        assertEquals(1, injector.getInstance(AggregationEngine.class).options().uploadLowStockLimit());

        AnalysisOutcome outcome = service.analyze(Fixtures.all());
        assertEquals(List.of(new StockLevel("Blue Kurta", 2)), outcome.bundle().summary().lowStockItems());
        assertEquals(3, injector.getInstance(Metrics.class).counts().get("ingest.sales.rows"));
    }
}
