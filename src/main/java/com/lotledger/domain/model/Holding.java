package com.lotledger.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Open position in one instrument, built from the lots that still have available quantity.
 * Market fields are only populated when the caller supplies a valuation price.
 */
@Data
@Builder
public class Holding {

    private String instrumentId;
    private BigDecimal quantity;
    private BigDecimal costBasis;
    private BigDecimal averageCost;
    private int openLots;

    private BigDecimal marketPrice;
    private BigDecimal marketValue;
    private BigDecimal unrealizedGain;

    /** unrealizedGain / costBasis * 100. Null without a market price or when cost basis is zero. */
    private BigDecimal unrealizedGainPercent;
}
