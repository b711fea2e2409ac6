package com.ethval.catalog;

/**
 * Overlay of today's record from a live snapshot endpoint, applied after merge.
 */
public record EnrichmentSpec(RestJsonTier tier, Mode mode) {

    public enum Mode {
        /** Today's record is replaced by the snapshot row (appended when absent). */
        REPLACE_RECORD,
        /** The snapshot's non-null fields patch today's record; nothing happens when it is absent. */
        OVERLAY_FIELDS
    }

    public static EnrichmentSpec replace(RestJsonTier tier) {
        return new EnrichmentSpec(tier, Mode.REPLACE_RECORD);
    }

    public static EnrichmentSpec overlay(RestJsonTier tier) {
        return new EnrichmentSpec(tier, Mode.OVERLAY_FIELDS);
    }
}
