package com.lotledger.reporting;

import com.lotledger.domain.enums.GainBucket;
import com.lotledger.domain.model.RealizedGain;
import com.lotledger.domain.vo.FinancialYear;
import com.lotledger.domain.vo.TaxEstimate;
import com.lotledger.mapper.RealizedGainMapper;
import com.lotledger.repository.jpa.RealizedGainJpaRepository;
import com.lotledger.tax.TaxEstimator;
import java.math.BigDecimal;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Aggregates the realized gains of a financial year into SHORT / LONG totals and the tax
 * estimate for the year.
 *
 * <p>The whole year is one aggregation period: the long-term exemption is applied once to
 * the year's pooled long-term gains, so no prior long-term gains are carried in.
 */
@Service
public class CapitalGainsReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(CapitalGainsReportGenerator.class);

    private final RealizedGainJpaRepository realizedGainJpaRepository;
    private final RealizedGainMapper realizedGainMapper;
    private final TaxEstimator taxEstimator;

    public CapitalGainsReportGenerator(
            RealizedGainJpaRepository realizedGainJpaRepository,
            RealizedGainMapper realizedGainMapper,
            TaxEstimator taxEstimator) {
        this.realizedGainJpaRepository = realizedGainJpaRepository;
        this.realizedGainMapper = realizedGainMapper;
        this.taxEstimator = taxEstimator;
    }

    /**
     * @param financialYear in format "2024-25" (April 2024 to March 2025)
     */
    public CapitalGainsReport generate(String financialYear) {
        return generate(FinancialYear.parse(financialYear));
    }

    public CapitalGainsReport generate(FinancialYear financialYear) {
        List<RealizedGain> gains = realizedGainMapper.toDomainList(
                realizedGainJpaRepository.findByFinancialYearOrderByDisposalDateAscIdAsc(financialYear.getLabel()));

        TaxEstimate taxEstimate = taxEstimator.estimateTax(gains, BigDecimal.ZERO);

        CapitalGainsReport report = CapitalGainsReport.builder()
                .financialYear(financialYear.getLabel())
                .from(financialYear.getStart())
                .to(financialYear.getEnd())
                .shortTermGain(sumGain(gains, GainBucket.SHORT))
                .longTermGain(sumGain(gains, GainBucket.LONG))
                .totalProceeds(gains.stream().map(RealizedGain::getProceeds).reduce(BigDecimal.ZERO, BigDecimal::add))
                .totalCostBasis(gains.stream().map(RealizedGain::getCostBasis).reduce(BigDecimal.ZERO, BigDecimal::add))
                .taxEstimate(taxEstimate)
                .shortTermCount(countBucket(gains, GainBucket.SHORT))
                .longTermCount(countBucket(gains, GainBucket.LONG))
                .gains(gains)
                .build();

        log.info(
                "Capital gains report generated: FY={}, short={}, long={}, tax={}",
                report.getFinancialYear(),
                report.getShortTermGain(),
                report.getLongTermGain(),
                taxEstimate.getTotalTax());
        return report;
    }

    private BigDecimal sumGain(List<RealizedGain> gains, GainBucket bucket) {
        return gains.stream()
                .filter(g -> g.getBucket() == bucket)
                .map(RealizedGain::getGainAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private int countBucket(List<RealizedGain> gains, GainBucket bucket) {
        return (int) gains.stream().filter(g -> g.getBucket() == bucket).count();
    }
}
