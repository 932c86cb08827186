package com.openbudget.aggregates.normalization;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Raised at startup when required normalization datasets cannot be found.
 */
public class NormalizationDatasetException extends RuntimeException {

    private final List<String> missingDatasets;

    public NormalizationDatasetException(List<String> missingDatasets, Map<String, String> errors) {
        super("Required normalization datasets are missing:\n" + missingDatasets.stream()
                .map(id -> "  - " + id + ": " + errors.getOrDefault(id, "Unknown error"))
                .collect(Collectors.joining("\n")));
        this.missingDatasets = List.copyOf(missingDatasets);
    }

    public List<String> missingDatasets() {
        return missingDatasets;
    }
}
