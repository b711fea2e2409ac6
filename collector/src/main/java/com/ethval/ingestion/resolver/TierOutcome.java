package com.ethval.ingestion.resolver;

/**
 * What one tier contributed for one dimension. {@code error} is null when the tier answered.
 *
 * @param fetched rows returned by the adapter
 * @param kept    normalized records inside the window
 * @param added   keys this tier claimed that no earlier tier had
 */
public record TierOutcome(String dimension, String source, int fetched, int kept, int dropped, int added,
                          String error) {

    public static TierOutcome failed(String dimension, String source, String error) {
        return new TierOutcome(dimension, source, 0, 0, 0, 0, error);
    }

    public boolean succeeded() {
        return error == null;
    }
}
