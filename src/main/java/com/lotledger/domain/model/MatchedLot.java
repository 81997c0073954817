package com.lotledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Data;

/** One slice of a disposal satisfied from a single acquisition lot. */
@Data
@Builder
public class MatchedLot {

    private Long acquisitionId;
    private LocalDate acquisitionDate;
    private LocalDate disposalDate;
    private BigDecimal quantity;
    private BigDecimal unitCostBasis;
    private BigDecimal unitProceeds;
    private BigDecimal cost;
    private BigDecimal proceeds;
    private BigDecimal gain;
    private long holdingPeriodDays;
}
