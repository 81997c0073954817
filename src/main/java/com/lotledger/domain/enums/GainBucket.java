package com.lotledger.domain.enums;

/**
 * Holding-period classification of a realized gain.
 *
 * <p>A matched lot held for more than 365 calendar days is LONG (LTCG), otherwise SHORT (STCG).
 * The bucket determines which tax rate applies and whether the period exemption is available.
 */
public enum GainBucket {
    /** Short-term capital gain: held 365 days or less. */
    SHORT,

    /** Long-term capital gain: held more than 365 days. */
    LONG
}
