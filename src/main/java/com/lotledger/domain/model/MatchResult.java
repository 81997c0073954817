package com.lotledger.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Outcome of matching one disposal against the available lots. */
@Data
@Builder
public class MatchResult {

    private List<MatchedLot> matchedLots;
    private BigDecimal totalQuantity;
    private BigDecimal totalCost;
    private BigDecimal totalProceeds;
    private BigDecimal totalGain;

    /** totalCost / totalQuantity. */
    private BigDecimal averageCost;
}
