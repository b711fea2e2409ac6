package com.ethval.ingestion.normalizer;

public class UnparseableDateException extends NormalizationException {

    public UnparseableDateException(String token) {
        super("Unparseable date: '" + token + "'");
    }

    public UnparseableDateException(String token, Throwable cause) {
        super("Unparseable date: '" + token + "'", cause);
    }
}
