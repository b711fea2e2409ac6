package com.ethval.domain;

/**
 * Source tags written to the {@code source} field of every record. Live API tags are declared per tier
 * in the metric catalog; the synthetic ones are fixed here.
 */
public final class SourceTag {

    public static final String INTERPOLATED = "interpolated";
    public static final String ESTIMATED = "estimated";
    public static final String DERIVED = "derived";

    private SourceTag() {
    }

    public static boolean isSynthetic(String source) {
        return INTERPOLATED.equals(source) || ESTIMATED.equals(source);
    }
}
