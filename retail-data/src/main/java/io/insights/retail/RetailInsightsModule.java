package io.insights.retail;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.insights.metrics.Metrics;

public class RetailInsightsModule extends AbstractModule {
    private final RetailConfig config;

    public RetailInsightsModule(RetailConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(RetailConfig.class).toInstance(config);
        bind(BusinessInsightsService.class).in(Singleton.class);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton SentimentScorer sentimentScorer() { return new SentimentScorer(config.lexicon()); }

    @Provides @Singleton AggregationEngine aggregationEngine(SentimentScorer scorer, Metrics metrics) {
        return new AggregationEngine(scorer, config.summaryOptions(), metrics);
    }

    @Provides @Singleton DatasetIngestor datasetIngestor(Metrics metrics) {
        return new DatasetIngestor(new CsvRecordDecoder(), metrics);
    }

    @Provides @Singleton SummaryJsonWriter summaryJsonWriter() { return new SummaryJsonWriter(config.sampleSize()); }
}
