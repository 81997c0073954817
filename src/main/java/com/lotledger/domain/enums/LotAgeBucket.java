package com.lotledger.domain.enums;

import com.lotledger.exception.InvalidArgumentException;

/**
 * Age bands for open lots, in whole days between the acquisition date and the valuation date.
 * Bounds are inclusive and the bands cover every non-negative age without overlap.
 */
public enum LotAgeBucket {
    UNDER_6_MONTHS("0-6 months", 0, 182),
    SIX_TO_12_MONTHS("6-12 months", 183, 365),
    ONE_TO_2_YEARS("1-2 years", 366, 730),
    TWO_TO_5_YEARS("2-5 years", 731, 1825),
    OVER_5_YEARS("5+ years", 1826, Long.MAX_VALUE);

    private final String label;
    private final long minDays;
    private final long maxDays;

    LotAgeBucket(String label, long minDays, long maxDays) {
        this.label = label;
        this.minDays = minDays;
        this.maxDays = maxDays;
    }

    public String getLabel() {
        return label;
    }

    public long getMinDays() {
        return minDays;
    }

    public long getMaxDays() {
        return maxDays;
    }

    public boolean contains(long ageDays) {
        return ageDays >= minDays && ageDays <= maxDays;
    }

    /** Negative ages (acquired after the valuation date) fall in the youngest band. */
    public static LotAgeBucket of(long ageDays) {
        for (LotAgeBucket bucket : values()) {
            if (bucket.contains(Math.max(0, ageDays))) {
                return bucket;
            }
        }
        throw new IllegalStateException("No age bucket for " + ageDays + " days");
    }

    /** Accepts the enum name ({@code ONE_TO_2_YEARS}) or the display label ({@code 1-2 years}). */
    public static LotAgeBucket parse(String value) {
        if (value != null) {
            for (LotAgeBucket bucket : values()) {
                if (bucket.name().equalsIgnoreCase(value.trim()) || bucket.label.equalsIgnoreCase(value.trim())) {
                    return bucket;
                }
            }
        }
        throw new InvalidArgumentException("bucket", "Unknown lot age bucket: " + value);
    }
}
