package com.lotledger.unit.tax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lotledger.domain.enums.GainBucket;
import com.lotledger.domain.model.RealizedGain;
import com.lotledger.domain.vo.TaxEstimate;
import com.lotledger.exception.InvalidArgumentException;
import com.lotledger.tax.TaxEstimator;
import com.lotledger.tax.TaxRates;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link TaxEstimator}.
 * Verifies bucket rates, pooling of long-term gains against the exemption, and that losses
 * never reduce or invert the tax.
 */
class TaxEstimatorTest {

    private static final BigDecimal SHORT_RATE = new BigDecimal("0.20");
    private static final BigDecimal LONG_RATE = new BigDecimal("0.10");
    private static final BigDecimal EXEMPTION = new BigDecimal("100000");

    private TaxEstimator taxEstimator;

    @BeforeEach
    void setUp() {
        taxEstimator = new TaxEstimator(TaxRates.builder()
                .shortTermRate(SHORT_RATE)
                .longTermRate(LONG_RATE)
                .longTermExemption(EXEMPTION)
                .build());
    }

    @Nested
    @DisplayName("Long-term bucket")
    class LongTerm {

        @Test
        @DisplayName("150,000 long-term gain over a 100,000 exemption at 10% is 5,000")
        void longTermAboveExemption() {
            TaxEstimate estimate = taxEstimator.estimateTax(
                    List.of(gain(GainBucket.LONG, "150000")), BigDecimal.ZERO, SHORT_RATE, LONG_RATE, EXEMPTION);

            assertThat(estimate.getLongTax()).isEqualByComparingTo("5000");
            assertThat(estimate.getTaxableLongTermGain()).isEqualByComparingTo("50000");
            assertThat(estimate.getExemptionUsed()).isEqualByComparingTo("100000");
            assertThat(estimate.getShortTax()).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Long-term gain within the exemption is not taxed")
        void longTermWithinExemption() {
            TaxEstimate estimate = taxEstimator.estimateTax(List.of(gain(GainBucket.LONG, "80000")), BigDecimal.ZERO);

            assertThat(estimate.getLongTax()).isEqualByComparingTo("0");
            assertThat(estimate.getExemptionUsed()).isEqualByComparingTo("80000");
        }

        @Test
        @DisplayName("Prior long-term gains of the period use up the exemption first")
        void priorGainsArePooled() {
            TaxEstimate estimate =
                    taxEstimator.estimateTax(List.of(gain(GainBucket.LONG, "30000")), new BigDecimal("90000"));

            // pooled 120000, taxable 20000
            assertThat(estimate.getPooledLongTermGain()).isEqualByComparingTo("120000");
            assertThat(estimate.getLongTax()).isEqualByComparingTo("2000");
        }
    }

    @Nested
    @DisplayName("Short-term bucket")
    class ShortTerm {

        @Test
        @DisplayName("50,000 short-term gain at 20% is 10,000")
        void shortTermRate() {
            TaxEstimate estimate = taxEstimator.estimateTax(
                    List.of(gain(GainBucket.SHORT, "50000")), BigDecimal.ZERO, SHORT_RATE, LONG_RATE, EXEMPTION);

            assertThat(estimate.getShortTax()).isEqualByComparingTo("10000");
            assertThat(estimate.getTotalTax()).isEqualByComparingTo("10000");
        }

        @Test
        @DisplayName("Losses contribute zero and are not offset against gains")
        void lossesContributeZero() {
            TaxEstimate estimate = taxEstimator.estimateTax(
                    List.of(
                            gain(GainBucket.SHORT, "50000"),
                            gain(GainBucket.SHORT, "-20000"),
                            gain(GainBucket.LONG, "150000"),
                            gain(GainBucket.LONG, "-40000")),
                    BigDecimal.ZERO);

            assertThat(estimate.getShortTermGain()).isEqualByComparingTo("50000");
            assertThat(estimate.getShortTax()).isEqualByComparingTo("10000");
            assertThat(estimate.getLongTax()).isEqualByComparingTo("5000");
            assertThat(estimate.getTotalTax()).isEqualByComparingTo("15000");
        }

        @Test
        @DisplayName("Only losses yield zero tax, never negative")
        void onlyLosses() {
            TaxEstimate estimate = taxEstimator.estimateTax(
                    List.of(gain(GainBucket.SHORT, "-500"), gain(GainBucket.LONG, "-900")), BigDecimal.ZERO);

            assertThat(estimate.getTotalTax()).isEqualByComparingTo("0");
        }
    }

    @Test
    @DisplayName("No gains yields a zero estimate")
    void noGains() {
        TaxEstimate estimate = taxEstimator.estimateTax(List.of(), null);

        assertThat(estimate.getTotalTax()).isEqualByComparingTo(TaxEstimate.zero().getTotalTax());
    }

    @Test
    @DisplayName("Negative rates are rejected")
    void negativeRateRejected() {
        assertThatThrownBy(() -> taxEstimator.estimateTax(
                        List.of(), BigDecimal.ZERO, new BigDecimal("-0.1"), LONG_RATE, EXEMPTION))
                .isInstanceOf(InvalidArgumentException.class);
    }

    private static RealizedGain gain(GainBucket bucket, String amount) {
        return RealizedGain.builder().bucket(bucket).gainAmount(new BigDecimal(amount)).build();
    }
}
