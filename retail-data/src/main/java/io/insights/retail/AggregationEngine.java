package io.insights.retail;

import io.insights.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Computes the {@link BusinessSummary}. Total over its inputs: empty datasets give zeros and empty lists.
 */
public class AggregationEngine {
    private static final Logger log = LoggerFactory.getLogger(AggregationEngine.class);

    private final SentimentScorer sentiment;
    private final SummaryOptions options;
    private final Metrics metrics; // optional

    public AggregationEngine() { this(new SentimentScorer(Lexicon.defaults()), SummaryOptions.defaults(), null); }
    public AggregationEngine(SentimentScorer sentiment, SummaryOptions options) { this(sentiment, options, null); }
    public AggregationEngine(SentimentScorer sentiment, SummaryOptions options, Metrics metrics) {
        this.sentiment = sentiment;
        this.options = options;
        this.metrics = metrics;
    }

    public SummaryOptions options() { return options; }

    public BusinessSummary summarize(List<SalesRecord> sales, List<InventoryRecord> inventory, List<ReviewRecord> reviews) {
        return summarize(sales, inventory, reviews, options.lowStockLimit());
    }

    public BusinessSummary summarize(List<SalesRecord> sales, List<InventoryRecord> inventory, List<ReviewRecord> reviews,
                                     int lowStockLimit) {
        SummaryOptions.checkLowStockLimit(lowStockLimit);
        long t0 = System.nanoTime();
        double totalRevenue = 0;
        for (SalesRecord s : sales) totalRevenue += s.amount();
        int totalOrders = sales.size();
        double averageOrderValue = totalOrders > 0 ? totalRevenue / totalOrders : 0;

        BusinessSummary summary = new BusinessSummary(
                totalRevenue,
                totalOrders,
                averageOrderValue,
                topProducts(sales, options.topProductsLimit()),
                lowStock(inventory, lowStockLimit, options.defaultMinAlert()),
                averageRating(reviews),
                sentiment.score(reviews));

        if (metrics != null) {
            metrics.timer("aggregate.time").update(System.nanoTime() - t0, TimeUnit.NANOSECONDS);
        }
        log.debug("summary: {}", summary);
        return summary;
    }

    static List<ProductRevenue> topProducts(List<SalesRecord> sales, int limit) {
        // insertion order keeps ties in first-seen order through the stable sort
        Map<String, Double> byProduct = new LinkedHashMap<>();
        for (SalesRecord s : sales) {
            byProduct.merge(s.product(), s.amount(), Double::sum);
        }
        List<ProductRevenue> ranked = new ArrayList<>(byProduct.size());
        byProduct.forEach((product, revenue) -> ranked.add(new ProductRevenue(product, revenue)));
        ranked.sort(Comparator.comparingDouble(ProductRevenue::revenue).reversed());
        return List.copyOf(ranked.subList(0, Math.min(limit, ranked.size())));
    }

    static List<StockLevel> lowStock(List<InventoryRecord> inventory, int limit, int defaultMinAlert) {
        List<InventoryRecord> low = new ArrayList<>();
        for (InventoryRecord item : inventory) {
            if (item.isBelowAlert(defaultMinAlert)) low.add(item);
        }
        low.sort(Comparator.comparingInt(InventoryRecord::stock));
        List<StockLevel> out = new ArrayList<>(Math.min(limit, low.size()));
        for (int i = 0; i < low.size() && i < limit; i++) {
            InventoryRecord item = low.get(i);
            out.add(new StockLevel(item.product(), item.stock()));
        }
        return out;
    }

    static double averageRating(List<ReviewRecord> reviews) {
        if (reviews.isEmpty()) return 0;
        double total = 0;
        for (ReviewRecord r : reviews) total += r.rating();
        return total / reviews.size();
    }
}
