package com.ethval.ingestion.job;

/**
 * @param candidates rows that had no gas price
 * @param updated    rows patched with an Etherscan value
 * @param notFound   rows Etherscan had no valid value for
 */
public record BackfillResult(int candidates, int updated, int notFound) {

    public static BackfillResult nothingToDo() {
        return new BackfillResult(0, 0, 0);
    }
}
