package io.insights.retail;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural checks for a decoded dataset. Only the first row is checked for required fields; sales also
 * get a numeric check on Quantity and Amount over the first {@value #NUMERIC_CHECK_ROWS} rows.
 * Every problem found is reported, nothing short-circuits except an empty dataset.
 */
public final class SchemaValidator {
    public static final String NO_DATA = "No data found in the file";
    static final int NUMERIC_CHECK_ROWS = 5;

    private SchemaValidator() {}

    public static ValidationResult validate(DecodedDataset dataset) {
        return validate(dataset.rows(), dataset.kind());
    }

    public static ValidationResult validate(List<DecodedRow> rows, DatasetKind kind) {
        if (rows.isEmpty()) {
            return ValidationResult.of(List.of(NO_DATA));
        }
        List<String> errors = new ArrayList<>();
        DecodedRow first = rows.get(0);
        for (String field : kind.requiredFields()) {
            if (!first.has(field)) {
                errors.add("Missing required field: " + field);
            }
        }

        int checked = Math.min(NUMERIC_CHECK_ROWS, rows.size());
        for (int i = 0; i < checked; i++) {
            DecodedRow row = rows.get(i);
            for (String field : kind.numericChecks()) {
                FieldValue v = row.fields().get(field);
                // blank cells pass
                if (v != null && !v.isBlank() && !v.isNumber()) {
                    errors.add("Row " + (i + 1) + ": " + field + " must be a number");
                }
            }
        }
        return ValidationResult.of(errors);
    }
}
