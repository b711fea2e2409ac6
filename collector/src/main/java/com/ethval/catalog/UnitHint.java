package com.ethval.catalog;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Magnitude-based unit correction applied before rounding. These are guesses from the size of the raw
 * value, not type-safe conversions: a source reporting in the display unit passes through unchanged.
 */
public enum UnitHint {

    NONE(null, null),

    /**
     * Gas price. Raw values above 1,000,000 are taken to be Wei and divided by 10^9 to get Gwei;
     * no real daily average has ever exceeded 1,000,000 Gwei.
     */
    WEI_TO_GWEI(new BigDecimal("1000000"), BigDecimal.TEN.pow(9)),

    /**
     * ETH amounts (supply, staking, burn). Raw values above 10^12 are taken to be Wei and divided by 10^18;
     * total supply is about 1.2 x 10^8 ETH.
     */
    WEI_TO_ETH(new BigDecimal("1000000000000"), BigDecimal.TEN.pow(18)),

    /**
     * Ratios stored as a fraction. Raw values above 1 are taken to be percent and divided by 100
     * (Etherscan's API reports network utilization as a fraction, its chart export as a percent).
     */
    PERCENT_TO_FRACTION(BigDecimal.ONE, BigDecimal.valueOf(100));

    private final BigDecimal threshold;
    private final BigDecimal divisor;

    UnitHint(BigDecimal threshold, BigDecimal divisor) {
        this.threshold = threshold;
        this.divisor = divisor;
    }

    public BigDecimal rescale(BigDecimal raw) {
        if (raw == null || threshold == null || raw.abs().compareTo(threshold) <= 0) {
            return raw;
        }
        return raw.divide(divisor, MathContext.DECIMAL128);
    }
}
