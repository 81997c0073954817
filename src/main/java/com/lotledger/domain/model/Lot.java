package com.lotledger.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Data;

/**
 * The unconsumed part of one acquisition. {@code available} is derived on every read from the
 * realized gains drawn against the acquisition and is never stored.
 */
@Data
@Builder
public class Lot {

    private Long acquisitionId;
    private LocalDate date;
    private BigDecimal unitPrice;

    /** Originally acquired quantity. */
    private BigDecimal quantity;

    /** quantity minus everything already matched against this acquisition. */
    private BigDecimal available;
}
