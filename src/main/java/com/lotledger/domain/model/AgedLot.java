package com.lotledger.domain.model;

import com.lotledger.domain.enums.LotAgeBucket;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Data;

/** An open lot with its age at the valuation date. */
@Data
@Builder
public class AgedLot {

    private Long acquisitionId;
    private String instrumentId;
    private LocalDate acquisitionDate;
    private BigDecimal unitPrice;
    private BigDecimal available;
    private BigDecimal costBasis;
    private long ageDays;
    private LotAgeBucket bucket;

    /** available x market price; null when no price was supplied. */
    private BigDecimal marketValue;
}
