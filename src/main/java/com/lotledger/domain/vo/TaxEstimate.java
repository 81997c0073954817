package com.lotledger.domain.vo;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable bucketed tax liability for one aggregation period.
 *
 * <p>Short-term tax is charged on every positive short-term gain. Long-term gains are pooled
 * with the long-term gains already realized earlier in the period, and only the part of the
 * pool above the exemption threshold is taxed. Losses never produce negative tax.
 */
@Value
@Builder
public class TaxEstimate {

    /** Sum of positive SHORT gains. */
    BigDecimal shortTermGain;

    /** Sum of positive LONG gains passed in (excluding prior gains). */
    BigDecimal longTermGain;

    /** Prior long-term gains of the period plus longTermGain. */
    BigDecimal pooledLongTermGain;

    /** Part of the exemption threshold absorbed by the pool. */
    BigDecimal exemptionUsed;

    BigDecimal taxableLongTermGain;
    BigDecimal shortTax;
    BigDecimal longTax;

    public BigDecimal getTotalTax() {
        return shortTax.add(longTax);
    }

    public static TaxEstimate zero() {
        return TaxEstimate.builder()
                .shortTermGain(BigDecimal.ZERO)
                .longTermGain(BigDecimal.ZERO)
                .pooledLongTermGain(BigDecimal.ZERO)
                .exemptionUsed(BigDecimal.ZERO)
                .taxableLongTermGain(BigDecimal.ZERO)
                .shortTax(BigDecimal.ZERO)
                .longTax(BigDecimal.ZERO)
                .build();
    }
}
