package com.ethval.ingestion.adapter;

public class EmptyResultException extends SourceFetchException {

    public EmptyResultException(String message) {
        super(message);
    }
}
