package io.insights.retail;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns decoded rows into typed records of the dataset's kind. Mapping never fails: a non-numeric amount,
 * quantity or rating counts as 0, and unparseable dates and blank optional fields become null.
 * Amount, price and rating keep their decimal value. Whole-number columns (quantity, stock, min alert,
 * customer age) are floored.
 */
public final class RecordMapper {
    private RecordMapper() {}

    public static List<? extends RetailRecord> map(DatasetKind kind, List<DecodedRow> rows) {
        return switch (kind) {
            case SALES -> sales(rows);
            case INVENTORY -> inventory(rows);
            case REVIEWS -> reviews(rows);
        };
    }

    public static List<SalesRecord> sales(List<DecodedRow> rows) {
        List<SalesRecord> out = new ArrayList<>(rows.size());
        for (DecodedRow r : rows) {
            out.add(new SalesRecord(
                    date(r, "Date"),
                    r.text("Product"),
                    r.text("Category"),
                    (int) Math.floor(number(r, "Quantity", 0)),
                    number(r, "Amount", 0),
                    optionalInt(r, "Customer_Age"),
                    optionalText(r, "Location")));
        }
        return out;
    }

    public static List<InventoryRecord> inventory(List<DecodedRow> rows) {
        List<InventoryRecord> out = new ArrayList<>(rows.size());
        for (DecodedRow r : rows) {
            out.add(new InventoryRecord(
                    r.text("Product"),
                    r.text("Category"),
                    optionalInt(r, "Stock"),
                    number(r, "Price", 0),
                    optionalText(r, "Supplier"),
                    optionalInt(r, "Min_Alert")));
        }
        return out;
    }

    public static List<ReviewRecord> reviews(List<DecodedRow> rows) {
        List<ReviewRecord> out = new ArrayList<>(rows.size());
        for (DecodedRow r : rows) {
            out.add(new ReviewRecord(
                    date(r, "Date"),
                    number(r, "Rating", 0),
                    r.text("Review"),
                    r.text("Product"),
                    optionalText(r, "Platform")));
        }
        return out;
    }

    private static double number(DecodedRow r, String field, double fallback) {
        return r.get(field).map(v -> v.numberOr(fallback)).orElse(fallback);
    }

    private static Integer optionalInt(DecodedRow r, String field) {
        return r.get(field).filter(FieldValue::isNumber).map(v -> (int) Math.floor(v.number())).orElse(null);
    }

    private static String optionalText(DecodedRow r, String field) {
        String t = r.text(field).trim();
        return t.isEmpty() ? null : t;
    }

    private static LocalDate date(DecodedRow r, String field) {
        String t = r.text(field).trim();
        if (t.isEmpty()) return null;
        try {
            return LocalDate.parse(t);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
