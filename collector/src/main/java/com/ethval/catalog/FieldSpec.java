package com.ethval.catalog;

import java.util.Objects;

/**
 * One typed value field of a metric record.
 *
 * @param scale decimal places kept after HALF_UP rounding (DECIMAL only)
 * @param required a row without a usable value for this field is dropped
 * @param validRange null when any value is accepted
 */
public record FieldSpec(String name, FieldType type, int scale, UnitHint unitHint, boolean required,
                        ValidRange validRange) {

    public FieldSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        unitHint = unitHint == null ? UnitHint.NONE : unitHint;
    }

    public static FieldSpec decimal(String name, int scale) {
        return new FieldSpec(name, FieldType.DECIMAL, scale, UnitHint.NONE, false, null);
    }

    public static FieldSpec integer(String name) {
        return new FieldSpec(name, FieldType.INTEGER, 0, UnitHint.NONE, false, null);
    }

    public static FieldSpec text(String name) {
        return new FieldSpec(name, FieldType.TEXT, 0, UnitHint.NONE, false, null);
    }

    public FieldSpec asRequired() {
        return new FieldSpec(name, type, scale, unitHint, true, validRange);
    }

    public FieldSpec unit(UnitHint hint) {
        return new FieldSpec(name, type, scale, hint, required, validRange);
    }

    public FieldSpec valid(ValidRange range) {
        return new FieldSpec(name, type, scale, unitHint, required, range);
    }
}
