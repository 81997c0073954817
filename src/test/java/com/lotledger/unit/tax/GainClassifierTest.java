package com.lotledger.unit.tax;

import static org.assertj.core.api.Assertions.assertThat;

import com.lotledger.domain.enums.GainBucket;
import com.lotledger.domain.model.MatchedLot;
import com.lotledger.domain.model.RealizedGain;
import com.lotledger.tax.GainClassifier;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GainClassifierTest {

    private GainClassifier gainClassifier;

    @BeforeEach
    void setUp() {
        gainClassifier = new GainClassifier();
    }

    @Test
    @DisplayName("Held exactly 365 days is short-term")
    void exactly365DaysIsShort() {
        assertThat(gainClassifier.classify(365)).isEqualTo(GainBucket.SHORT);
    }

    @Test
    @DisplayName("Held 366 days is long-term")
    void day366IsLong() {
        assertThat(gainClassifier.classify(366)).isEqualTo(GainBucket.LONG);
    }

    @Test
    @DisplayName("Same-day disposal is short-term")
    void zeroDaysIsShort() {
        assertThat(gainClassifier.classify(0)).isEqualTo(GainBucket.SHORT);
    }

    @Test
    @DisplayName("Realized gain carries the matched piece, its bucket and its financial year")
    void toRealizedGain() {
        MatchedLot matchedLot = MatchedLot.builder()
                .acquisitionId(7L)
                .acquisitionDate(LocalDate.of(2023, 2, 1))
                .disposalDate(LocalDate.of(2024, 3, 15))
                .quantity(new BigDecimal("4"))
                .unitCostBasis(new BigDecimal("100"))
                .unitProceeds(new BigDecimal("130"))
                .cost(new BigDecimal("400"))
                .proceeds(new BigDecimal("520"))
                .gain(new BigDecimal("120"))
                .holdingPeriodDays(408)
                .build();
        LocalDateTime createdAt = LocalDateTime.of(2024, 3, 15, 10, 0);

        RealizedGain gain = gainClassifier.toRealizedGain("TCS", 9L, matchedLot, createdAt);

        assertThat(gain.getAcquisitionId()).isEqualTo(7L);
        assertThat(gain.getDisposalId()).isEqualTo(9L);
        assertThat(gain.getInstrumentId()).isEqualTo("TCS");
        assertThat(gain.getBucket()).isEqualTo(GainBucket.LONG);
        assertThat(gain.getGainAmount()).isEqualByComparingTo("120");
        assertThat(gain.getCostBasis()).isEqualByComparingTo("400");
        assertThat(gain.getProceeds()).isEqualByComparingTo("520");
        // March 2024 belongs to FY 2023-24
        assertThat(gain.getFinancialYear()).isEqualTo("2023-24");
        assertThat(gain.getCreatedAt()).isEqualTo(createdAt);
    }
}
