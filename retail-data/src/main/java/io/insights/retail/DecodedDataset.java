package io.insights.retail;

import java.util.List;

/**
 * Output of the decoder: header, data rows in source order, and non-fatal warnings.
 */
public record DecodedDataset(DatasetKind kind, String name, List<String> header, List<DecodedRow> rows, List<String> warnings) {

    public DecodedDataset {
        header = List.copyOf(header);
        rows = List.copyOf(rows);
        warnings = List.copyOf(warnings);
    }

    public boolean isEmpty() { return rows.isEmpty(); }
}
