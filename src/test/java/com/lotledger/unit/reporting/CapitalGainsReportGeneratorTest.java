package com.lotledger.unit.reporting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import com.lotledger.domain.enums.GainBucket;
import com.lotledger.entity.RealizedGainEntity;
import com.lotledger.exception.InvalidArgumentException;
import com.lotledger.mapper.RealizedGainMapper;
import com.lotledger.reporting.CapitalGainsReport;
import com.lotledger.reporting.CapitalGainsReportGenerator;
import com.lotledger.repository.jpa.RealizedGainJpaRepository;
import com.lotledger.tax.TaxEstimator;
import com.lotledger.tax.TaxRates;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

/**
 * Unit tests for CapitalGainsReportGenerator.
 *
 * <p>Verifies: financial year window, bucket totals (net of losses), counts and the tax estimate.
 */
class CapitalGainsReportGeneratorTest {

    @Mock
    private RealizedGainJpaRepository realizedGainJpaRepository;

    private CapitalGainsReportGenerator capitalGainsReportGenerator;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        TaxEstimator taxEstimator = new TaxEstimator(TaxRates.builder()
                .shortTermRate(new BigDecimal("0.20"))
                .longTermRate(new BigDecimal("0.10"))
                .longTermExemption(new BigDecimal("100000"))
                .build());
        capitalGainsReportGenerator = new CapitalGainsReportGenerator(
                realizedGainJpaRepository, Mappers.getMapper(RealizedGainMapper.class), taxEstimator);
    }

    @Test
    void report_aggregatesBucketsOfTheYear() {
        when(realizedGainJpaRepository.findByFinancialYearOrderByDisposalDateAscIdAsc("2024-25"))
                .thenReturn(List.of(
                        gain(GainBucket.SHORT, "50000"),
                        gain(GainBucket.SHORT, "-10000"),
                        gain(GainBucket.LONG, "150000")));

        CapitalGainsReport report = capitalGainsReportGenerator.generate("2024-25");

        assertThat(report.getFinancialYear()).isEqualTo("2024-25");
        assertThat(report.getFrom()).isEqualTo(LocalDate.of(2024, 4, 1));
        assertThat(report.getTo()).isEqualTo(LocalDate.of(2025, 3, 31));
        assertThat(report.getShortTermGain()).isEqualByComparingTo("40000");
        assertThat(report.getLongTermGain()).isEqualByComparingTo("150000");
        assertThat(report.getShortTermCount()).isEqualTo(2);
        assertThat(report.getLongTermCount()).isEqualTo(1);
        // short: 50000 x 20% (loss ignored), long: (150000 - 100000) x 10%
        assertThat(report.getTaxEstimate().getShortTax()).isEqualByComparingTo("10000");
        assertThat(report.getTaxEstimate().getLongTax()).isEqualByComparingTo("5000");
        assertThat(report.getGains()).hasSize(3);
    }

    @Test
    void report_emptyYear() {
        when(realizedGainJpaRepository.findByFinancialYearOrderByDisposalDateAscIdAsc("2023-24"))
                .thenReturn(List.of());

        CapitalGainsReport report = capitalGainsReportGenerator.generate("FY 2023-24");

        assertThat(report.getShortTermGain()).isEqualByComparingTo("0");
        assertThat(report.getTaxEstimate().getTotalTax()).isEqualByComparingTo("0");
    }

    @Test
    void report_invalidYear() {
        assertThatThrownBy(() -> capitalGainsReportGenerator.generate("24/25"))
                .isInstanceOf(InvalidArgumentException.class);
    }

    private static RealizedGainEntity gain(GainBucket bucket, String amount) {
        return RealizedGainEntity.builder()
                .bucket(bucket)
                .gainAmount(new BigDecimal(amount))
                .proceeds(BigDecimal.ZERO)
                .costBasis(BigDecimal.ZERO)
                .quantity(BigDecimal.ONE)
                .build();
    }
}
