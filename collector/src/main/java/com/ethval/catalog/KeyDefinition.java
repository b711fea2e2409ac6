package com.ethval.catalog;

import java.util.List;

/**
 * Natural key of a series: the date alone, or the date plus a dimension field (e.g. {@code chain}) whose
 * values are resolved independently.
 */
public record KeyDefinition(String dimensionField, List<String> dimensions) {

    private static final KeyDefinition DATE_ONLY = new KeyDefinition(null, List.of());

    public KeyDefinition {
        dimensions = dimensions == null ? List.of() : List.copyOf(dimensions);
    }

    public static KeyDefinition dateOnly() {
        return DATE_ONLY;
    }

    public static KeyDefinition composite(String dimensionField, List<String> dimensions) {
        if (dimensionField == null || dimensions == null || dimensions.isEmpty()) {
            throw new IllegalArgumentException("Composite key needs a dimension field and at least one dimension");
        }
        return new KeyDefinition(dimensionField, dimensions);
    }

    public boolean isComposite() {
        return dimensionField != null;
    }

    /** Store conflict key: {@code date} or {@code date,<dimensionField>}. */
    public String conflictKey() {
        return isComposite() ? "date," + dimensionField : "date";
    }
}
