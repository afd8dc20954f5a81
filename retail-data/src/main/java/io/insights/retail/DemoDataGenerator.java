package io.insights.retail;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Synthetic datasets for a small clothing retailer. The same seed always yields the same data.
 */
public class DemoDataGenerator {
    static final List<String> PRODUCTS =
            List.of("Blue Kurta", "Red Saree", "Cotton Shirt", "Denim Jeans", "Silk Dupatta", "Woolen Shawl");
    static final List<String> CATEGORIES = List.of("Ethnic", "Western", "Accessories");
    static final List<String> LOCATIONS = List.of("Mumbai", "Delhi", "Bangalore", "Chennai", "Kolkata", "Pune");
    static final List<String> SUPPLIERS = List.of("Fashion_Co", "Style_Hub", "Trend_Makers", "Elite_Fashion");
    static final List<String> PLATFORMS = List.of("Google", "Facebook", "Website", "Amazon");
    static final List<String> POSITIVE_REVIEWS = List.of(
            "Excellent quality and fast delivery!",
            "Great product, highly recommended",
            "Good value for money",
            "Beautiful design and comfortable fit",
            "Amazing customer service",
            "Perfect for festive occasions");
    static final List<String> NEGATIVE_REVIEWS = List.of(
            "Product quality could be better",
            "Delivery was delayed",
            "Not as shown in pictures",
            "Expensive for the quality",
            "Size was not accurate",
            "Customer support needs improvement");

    static final LocalDate START = LocalDate.of(2024, 8, 1);
    static final int SALES_ROWS = 100;
    static final int REVIEW_ROWS = 50;
    static final int DAY_SPAN = 90;

    private final long seed;

    public DemoDataGenerator(long seed) {
        this.seed = seed;
    }

    public long seed() { return seed; }

    public List<SalesRecord> sales() {
        Random rnd = new Random(seed);
        List<SalesRecord> out = new ArrayList<>(SALES_ROWS);
        for (int i = 0; i < SALES_ROWS; i++) {
            LocalDate date = START.plusDays(rnd.nextInt(DAY_SPAN));
            String product = pick(rnd, PRODUCTS);
            int quantity = rnd.nextInt(5) + 1;
            int basePrice = rnd.nextInt(2000) + 500;
            out.add(new SalesRecord(
                    date,
                    product,
                    pick(rnd, CATEGORIES),
                    quantity,
                    (double) basePrice * quantity,
                    rnd.nextInt(40) + 20,
                    pick(rnd, LOCATIONS)));
        }
        return out;
    }

    public List<InventoryRecord> inventory() {
        Random rnd = new Random(seed + 1);
        List<InventoryRecord> out = new ArrayList<>(PRODUCTS.size());
        for (String product : PRODUCTS) {
            out.add(new InventoryRecord(
                    product,
                    pick(rnd, CATEGORIES),
                    rnd.nextInt(50) + 5,
                    rnd.nextInt(2000) + 500,
                    pick(rnd, SUPPLIERS),
                    rnd.nextInt(10) + 5));
        }
        return out;
    }

    public List<ReviewRecord> reviews() {
        Random rnd = new Random(seed + 2);
        List<ReviewRecord> out = new ArrayList<>(REVIEW_ROWS);
        for (int i = 0; i < REVIEW_ROWS; i++) {
            LocalDate date = START.plusDays(rnd.nextInt(DAY_SPAN));
            int rating = rnd.nextInt(5) + 1;
            List<String> texts = rating >= 4 ? POSITIVE_REVIEWS : NEGATIVE_REVIEWS;
            out.add(new ReviewRecord(
                    date,
                    rating,
                    pick(rnd, texts),
                    pick(rnd, PRODUCTS),
                    pick(rnd, PLATFORMS)));
        }
        return out;
    }

    private static String pick(Random rnd, List<String> values) {
        return values.get(rnd.nextInt(values.size()));
    }
}
