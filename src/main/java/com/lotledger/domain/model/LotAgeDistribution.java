package com.lotledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/**
 * Open quantity split by {@link com.lotledger.domain.enums.LotAgeBucket}, one entry per bucket
 * in age order (empty buckets included).
 */
@Data
@Builder
public class LotAgeDistribution {

    /** Null for the distribution across all instruments. */
    private String instrumentId;

    private LocalDate asOf;
    private BigDecimal totalQuantity;

    /** Instruments that still hold open quantity. */
    private int instrumentCount;

    private List<AgeBucketSummary> buckets;
}
