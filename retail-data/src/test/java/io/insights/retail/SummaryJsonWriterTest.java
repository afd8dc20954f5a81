package io.insights.retail;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SummaryJsonWriterTest {

    private static InsightsBundle bundle() {
        BusinessSummary summary = new BusinessSummary(450, 3, 150,
                List.of(new ProductRevenue("B", 300), new ProductRevenue("A", 150)),
                List.of(new StockLevel("X", 2)), 4.5, 0.25);
        List<SalesRecord> sales = List.of(
                new SalesRecord(LocalDate.of(2024, 8, 1), "A", "Ethnic", 1, 100, null, null),
                new SalesRecord(LocalDate.of(2024, 8, 2), "B", "Ethnic", 1, 300, 30, "Pune"),
                new SalesRecord(LocalDate.of(2024, 8, 3), "A", "Ethnic", 1, 50, null, null));
        return new InsightsBundle(Instant.parse("2024-10-01T10:15:30Z"), summary, new DataStats(3, 1, 0),
                sales, List.of(new InventoryRecord("X", "Ethnic", 2, 10, null, 5)), List.of());
    }

    @Test
    void writesSummaryStatsAndSample() throws Exception {
        SummaryJsonWriter writer = new SummaryJsonWriter(2);
        JsonNode root = writer.mapper().readTree(writer.toJson(bundle()));

        assertEquals("2024-10-01T10:15:30Z", root.get("createdAt").asText());
        assertEquals(450.0, root.at("/summary/totalRevenue").asDouble());
        assertEquals("B", root.at("/summary/topProducts/0/product").asText());
        assertEquals(2, root.at("/summary/lowStockItems/0/stock").asInt());
        assertEquals(3, root.at("/dataStats/salesRecords").asInt());
        assertEquals(2, root.at("/context/sampleSalesData").size());
        assertEquals("2024-08-01", root.at("/context/sampleSalesData/0/date").asText());
        assertFalse(root.at("/context/sampleSalesData/0").has("location"));
        assertEquals(0, root.at("/context/sampleReviews").size());
    }

    @Test
    void writesFileCreatingParents(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("reports/summary.json");
        new SummaryJsonWriter(10).write(bundle(), out);
        assertTrue(Files.exists(out));
        assertTrue(Files.readString(out).contains("\"totalOrders\" : 3"));
    }

    @Test
    void contextSnapshotTakesLeadingRecords() {
        ContextSnapshot snapshot = bundle().contextSnapshot(1);
        assertEquals(1, snapshot.sampleSalesData().size());
        assertEquals("A", snapshot.sampleSalesData().get(0).product());
        assertEquals(1, snapshot.sampleInventoryData().size());
        assertEquals(3, bundle().contextSnapshot().sampleSalesData().size());
        assertTrue(bundle().contextSnapshot(-1).sampleSalesData().isEmpty());
    }
}
