package io.insights.retail;

import java.util.ArrayList;
import java.util.List;

/**
 * A decoded, validated and typed dataset. Records are present even when validation failed, so callers can
 * decide for themselves whether to proceed.
 */
public record IngestedDataset(
        DatasetKind kind,
        String name,
        ValidationResult validation,
        List<String> warnings,
        List<? extends RetailRecord> records
) {
    public IngestedDataset {
        warnings = List.copyOf(warnings);
        records = List.copyOf(records);
    }

    public boolean isValid() { return validation.valid(); }

    public int size() { return records.size(); }

    /** Records narrowed to {@code type}; the kind decides which type they are. */
    public <T extends RetailRecord> List<T> recordsOf(Class<T> type) {
        List<T> out = new ArrayList<>(records.size());
        for (RetailRecord r : records) {
            if (!type.isInstance(r)) {
                throw new IllegalStateException(kind + " dataset holds " + r.getClass().getSimpleName() + ", not " + type.getSimpleName());
            }
            out.add(type.cast(r));
        }
        return out;
    }
}
