package com.lotledger.domain.model;

import com.lotledger.domain.enums.GainBucket;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Data;

/**
 * The persisted pairing of one acquisition with one disposal.
 *
 * <p>Immutable once written. An accepted edit upstream re-derives the gains of the affected
 * instrument, which replaces these rows rather than mutating them.
 */
@Data
@Builder
public class RealizedGain {

    private Long id;
    private Long acquisitionId;
    private Long disposalId;
    private String instrumentId;
    private BigDecimal quantity;
    private BigDecimal unitCostBasis;
    private BigDecimal unitProceeds;
    private LocalDate acquisitionDate;
    private LocalDate disposalDate;
    private long holdingPeriodDays;
    private GainBucket bucket;
    private BigDecimal costBasis;
    private BigDecimal proceeds;

    /** proceeds minus costBasis. Negative for a loss. */
    private BigDecimal gainAmount;

    /** Indian financial year of the disposal, e.g. "2024-25". */
    private String financialYear;

    private LocalDateTime createdAt;
}
