package com.ethval.ingestion.normalizer;

public class UnparseableNumberException extends NormalizationException {

    public UnparseableNumberException(String field, Object raw) {
        super("Unparseable number for " + field + ": '" + raw + "'");
    }
}
