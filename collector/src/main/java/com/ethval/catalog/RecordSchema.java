package com.ethval.catalog;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Value fields of a metric, besides date, dimension and source which every record carries.
 *
 * @param storesTimestamp whether records keep the redundant Unix-seconds timestamp
 */
public record RecordSchema(List<FieldSpec> fields, boolean storesTimestamp) {

    public RecordSchema {
        fields = List.copyOf(fields);
    }

    public static RecordSchema of(FieldSpec... fields) {
        return new RecordSchema(List.of(fields), true);
    }

    public RecordSchema withoutTimestamp() {
        return new RecordSchema(fields, false);
    }

    public Optional<FieldSpec> field(String name) {
        return fields.stream().filter(f -> f.name().equals(name)).findFirst();
    }

    public Set<String> fieldNames() {
        return fields.stream().map(FieldSpec::name).collect(Collectors.toSet());
    }
}
