package com.ethval.catalog;

public enum FieldType {
    DECIMAL,
    INTEGER,
    TEXT
}
