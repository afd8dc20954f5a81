package io.insights.retail;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Field name to value mapping for one data row, in header order. Absent fields (short rows) have no entry.
 */
public record DecodedRow(int rowNumber, Map<String, FieldValue> fields) {

    public DecodedRow {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public boolean has(String field) { return fields.containsKey(field); }

    public Optional<FieldValue> get(String field) { return Optional.ofNullable(fields.get(field)); }

    public String text(String field) {
        FieldValue v = fields.get(field);
        return v == null ? "" : v.text();
    }
}
