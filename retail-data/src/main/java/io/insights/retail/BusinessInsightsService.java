package io.insights.retail;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Inject;
import io.insights.core.Source;
import io.insights.runtime.Pipeline;
import io.insights.runtime.PipelineBuilder;
import io.insights.runtime.StageException;
import io.insights.sink.CollectingSink;
import io.insights.source.ListSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the raw datasets through the ingest pipeline and, when sales, inventory and reviews are all present
 * and valid, aggregates them into an {@link InsightsBundle}.
 */
public class BusinessInsightsService {
    private static final Logger log = LoggerFactory.getLogger(BusinessInsightsService.class);

    private final DatasetIngestor ingestor;
    private final AggregationEngine engine;
    private final MetricRegistry registry;

    @Inject
    public BusinessInsightsService(DatasetIngestor ingestor, AggregationEngine engine, MetricRegistry registry) {
        this.ingestor = ingestor;
        this.engine = engine;
        this.registry = registry;
    }

    /** Analysis of uploaded files, reporting up to the configured upload low-stock limit. */
    public AnalysisOutcome analyze(List<RawDataset> datasets) throws DecodeException {
        return analyze(new ListSource<>(datasets, RawDataset::name), engine.options().uploadLowStockLimit());
    }

    /**
     * @param lowStockLimit cap on reported low-stock items for this call
     * @throws DecodeException when any dataset is not readable as CSV; nothing is aggregated then
     */
    public AnalysisOutcome analyze(Source<RawDataset> source, int lowStockLimit) throws DecodeException {
        CollectingSink<IngestedDataset> sink = new CollectingSink<>();
        Pipeline<RawDataset, IngestedDataset> pipeline = new PipelineBuilder<RawDataset, IngestedDataset>()
                .name("ingest")
                .source(source)
                .transform(ingestor)
                .sink(sink)
                .metrics(registry)
                .build();
        try {
            pipeline.run();
        } catch (StageException e) {
            if (e.getCause() instanceof DecodeException de) throw de;
            throw e;
        }

        Map<DatasetKind, IngestedDataset> byKind = new EnumMap<>(DatasetKind.class);
        for (IngestedDataset d : sink.payloads()) {
            IngestedDataset prev = byKind.put(d.kind(), d);
            if (prev != null) {
                throw new IllegalArgumentException("More than one " + d.kind().id() + " dataset: " + prev.name() + ", " + d.name());
            }
        }

        Map<DatasetKind, ValidationResult> validations = new EnumMap<>(DatasetKind.class);
        boolean complete = true;
        for (DatasetKind kind : DatasetKind.values()) {
            IngestedDataset d = byKind.get(kind);
            ValidationResult v = d == null ? ValidationResult.of(List.of(SchemaValidator.NO_DATA)) : d.validation();
            validations.put(kind, v);
            complete &= v.valid();
        }
        if (!complete) {
            log.info("analysis incomplete, {} dataset(s) rejected",
                    validations.values().stream().filter(v -> !v.valid()).count());
            return new AnalysisOutcome(validations, null);
        }

        List<SalesRecord> sales = byKind.get(DatasetKind.SALES).recordsOf(SalesRecord.class);
        List<InventoryRecord> inventory = byKind.get(DatasetKind.INVENTORY).recordsOf(InventoryRecord.class);
        List<ReviewRecord> reviews = byKind.get(DatasetKind.REVIEWS).recordsOf(ReviewRecord.class);
        BusinessSummary summary = engine.summarize(sales, inventory, reviews, lowStockLimit);
        return new AnalysisOutcome(validations, InsightsBundle.of(summary, sales, inventory, reviews));
    }

    /** Bundle over generated demo data; the demo view caps low-stock items at the summary limit. */
    public InsightsBundle demo(DemoDataGenerator generator) {
        List<SalesRecord> sales = generator.sales();
        List<InventoryRecord> inventory = generator.inventory();
        List<ReviewRecord> reviews = generator.reviews();
        BusinessSummary summary = engine.summarize(sales, inventory, reviews);
        return InsightsBundle.of(summary, sales, inventory, reviews);
    }
}
