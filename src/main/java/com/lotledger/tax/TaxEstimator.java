package com.lotledger.tax;

import com.lotledger.domain.enums.GainBucket;
import com.lotledger.domain.model.RealizedGain;
import com.lotledger.domain.vo.TaxEstimate;
import com.lotledger.exception.InvalidArgumentException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Computes the bucketed tax liability of a set of realized gains.
 *
 * <ul>
 *   <li><b>Short-term:</b> sum of positive SHORT gains x short-term rate.</li>
 *   <li><b>Long-term:</b> positive LONG gains are pooled with the long-term gains already
 *       realized earlier in the period; only the pool above the exemption is taxed.</li>
 * </ul>
 *
 * <p>A loss contributes zero to its bucket; losses are not offset against gains.
 */
@Service
public class TaxEstimator {

    private static final int MONEY_SCALE = 8;

    private final TaxRates taxRates;

    public TaxEstimator(TaxRates taxRates) {
        this.taxRates = taxRates;
    }

    /** Estimate using the configured rates and exemption. */
    public TaxEstimate estimateTax(List<RealizedGain> gains, BigDecimal priorLongTermGainsThisPeriod) {
        return estimateTax(
                gains,
                priorLongTermGainsThisPeriod,
                taxRates.getShortTermRate(),
                taxRates.getLongTermRate(),
                taxRates.getLongTermExemption());
    }

    public TaxEstimate estimateTax(
            List<RealizedGain> gains,
            BigDecimal priorLongTermGainsThisPeriod,
            BigDecimal shortRate,
            BigDecimal longRate,
            BigDecimal longExemptionThreshold) {
        requireNonNegative("shortRate", shortRate);
        requireNonNegative("longRate", longRate);
        requireNonNegative("longExemptionThreshold", longExemptionThreshold);
        BigDecimal prior = priorLongTermGainsThisPeriod != null ? priorLongTermGainsThisPeriod : BigDecimal.ZERO;
        requireNonNegative("priorLongTermGainsThisPeriod", prior);

        BigDecimal shortTermGain = sumPositive(gains, GainBucket.SHORT);
        BigDecimal longTermGain = sumPositive(gains, GainBucket.LONG);

        BigDecimal pooled = prior.add(longTermGain);
        BigDecimal exemptionUsed = pooled.min(longExemptionThreshold);
        BigDecimal taxableLong = pooled.subtract(longExemptionThreshold).max(BigDecimal.ZERO);

        return TaxEstimate.builder()
                .shortTermGain(shortTermGain)
                .longTermGain(longTermGain)
                .pooledLongTermGain(pooled)
                .exemptionUsed(exemptionUsed)
                .taxableLongTermGain(taxableLong)
                .shortTax(shortTermGain.multiply(shortRate).setScale(MONEY_SCALE, RoundingMode.HALF_UP))
                .longTax(taxableLong.multiply(longRate).setScale(MONEY_SCALE, RoundingMode.HALF_UP))
                .build();
    }

    private BigDecimal sumPositive(List<RealizedGain> gains, GainBucket bucket) {
        return gains.stream()
                .filter(g -> g.getBucket() == bucket)
                .map(RealizedGain::getGainAmount)
                .filter(amount -> amount.signum() > 0)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private void requireNonNegative(String field, BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new InvalidArgumentException(field, field + " must be zero or greater");
        }
    }
}
