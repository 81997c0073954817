package com.lotledger.reporting;

import com.lotledger.domain.model.RealizedGain;
import com.lotledger.domain.vo.TaxEstimate;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Capital gains of an Indian financial year (April 1 to March 31), split by holding-period
 * bucket.
 *
 * <p>{@code shortTermGain} and {@code longTermGain} are net figures (losses included);
 * the tax estimate only counts the positive gains of each bucket.
 */
@Data
@Builder
public class CapitalGainsReport {

    private String financialYear;
    private LocalDate from;
    private LocalDate to;
    private BigDecimal shortTermGain;
    private BigDecimal longTermGain;
    private BigDecimal totalProceeds;
    private BigDecimal totalCostBasis;
    private TaxEstimate taxEstimate;
    private int shortTermCount;
    private int longTermCount;
    private List<RealizedGain> gains;
}
