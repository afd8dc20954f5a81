package io.insights.retail;

/**
 * One decoded cell. For numeric columns, {@code number} holds the parsed value, or null when the text did not parse.
 */
public record FieldValue(String text, boolean numericColumn, Double number) {

    public static FieldValue text(String text) {
        return new FieldValue(text, false, null);
    }

    public static FieldValue numeric(String text, Double number) {
        return new FieldValue(text, true, number);
    }

    public boolean isNumber() { return number != null; }

    /** True when the column expects a number and this cell's text is not one. */
    public boolean coercionFailed() { return numericColumn && number == null; }

    public boolean isBlank() { return text.isBlank(); }

    public double numberOr(double fallback) {
        return number == null ? fallback : number;
    }
}
