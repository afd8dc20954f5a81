package io.insights.retail;

import com.codahale.metrics.MetricRegistry;
import io.insights.core.Record;
import io.insights.metrics.Metrics;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatasetIngestorTest {
    private final MetricRegistry registry = new MetricRegistry();
    private final DatasetIngestor ingestor = new DatasetIngestor(new CsvRecordDecoder(), new Metrics(registry));

    @Test
    void ingestsValidDataset() throws Exception {
        IngestedDataset d = ingestor.ingest(RawDataset.of(DatasetKind.INVENTORY,
                "Product,Category,Stock,Price,Supplier,Min_Alert\nA,Ethnic,3,10,S,5\nB,Western,30,20,S,5\n"));

        assertTrue(d.isValid());
        assertEquals(DatasetKind.INVENTORY, d.kind());
        assertEquals("inventory.csv", d.name());
        assertEquals(2, d.size());
        assertEquals("B", d.recordsOf(InventoryRecord.class).get(1).product());
        assertEquals(2, registry.counter("ingest.inventory.rows").getCount());
        assertEquals(0, registry.counter("ingest.inventory.invalid").getCount());
    }

    @Test
    void invalidDatasetStillCarriesRecords() throws Exception {
        IngestedDataset d = ingestor.ingest(RawDataset.of(DatasetKind.SALES,
                "Date,Product,Quantity,Amount\n2024-08-01,A,two,10\n"));

        assertFalse(d.isValid());
        assertEquals(List.of("Row 1: Quantity must be a number"), d.validation().errors());
        assertEquals(1, d.size());
        assertEquals(1, registry.counter("ingest.sales.invalid").getCount());
    }

    @Test
    void countsDecoderWarnings() throws Exception {
        IngestedDataset d = ingestor.ingest(RawDataset.of(DatasetKind.REVIEWS,
                "Date,Rating,Review,Product\n2024-08-01,5,Good,A,extra\n"));
        assertEquals(1, d.warnings().size());
        assertEquals(1, registry.counter("ingest.reviews.warnings").getCount());
    }

    @Test
    void decodeFailurePropagates() {
        DecodeException e = assertThrows(DecodeException.class,
                () -> ingestor.ingest(new RawDataset(DatasetKind.SALES, "bad.csv", new byte[]{(byte) 0xC3, (byte) 0x28})));
        assertEquals("bad.csv", e.source());
    }

    @Test
    void keepsRecordIdentityAsTransform() throws Exception {
        List<Record<IngestedDataset>> out = ingestor.apply(
                new Record<>(7, "reviews.csv", RawDataset.of(DatasetKind.REVIEWS, "Date,Rating,Review,Product\n")));
        assertEquals(1, out.size());
        assertEquals(7, out.get(0).seq());
        assertEquals("reviews.csv", out.get(0).origin());
        assertEquals(List.of(SchemaValidator.NO_DATA), out.get(0).payload().validation().errors());
    }

    @Test
    void fractionalRatingsReachTheAverage() throws Exception {
        IngestedDataset d = ingestor.ingest(RawDataset.of(DatasetKind.REVIEWS,
                "Date,Rating,Review,Product\n2024-09-01,4.5,Good,A\n2024-09-02,3.5,Fine,B\n"));
        BusinessSummary s = new AggregationEngine().summarize(List.of(), List.of(), d.recordsOf(ReviewRecord.class));
        assertEquals(4.0, s.averageRating(), 1e-9);
    }

    @Test
    void recordsOfRejectsWrongType() throws Exception {
        IngestedDataset d = ingestor.ingest(RawDataset.of(DatasetKind.INVENTORY, "Product,Stock,Price\nA,1,2\n"));
        assertThrows(IllegalStateException.class, () -> d.recordsOf(SalesRecord.class));
    }
}
