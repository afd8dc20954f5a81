package io.insights.retail;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-dataset validation and, when every dataset passed, the bundle built from them.
 */
public record AnalysisOutcome(Map<DatasetKind, ValidationResult> validations, InsightsBundle bundle) {

    public AnalysisOutcome {
        Map<DatasetKind, ValidationResult> copy = new EnumMap<>(DatasetKind.class);
        copy.putAll(validations);
        validations = Collections.unmodifiableMap(copy);
    }

    public boolean isComplete() { return bundle != null; }

    public Optional<InsightsBundle> insights() { return Optional.ofNullable(bundle); }
}
